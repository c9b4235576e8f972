/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class of a command-line tool made up of commands. The first
 * argument that is not an option names the command; a command named
 * `foo-bar` is implemented by a class `FooBarCommand` in the package of
 * the application class.
 */
public abstract class Application
{
    protected Command defaultCommand()
    {
        return new DefaultCommand(this);
    }

    protected abstract String version();

    protected abstract String description();

    /**
     * Reports a failed command and returns the process exit code.
     */
    protected abstract int error(Throwable ex, int verbosity);

    static String commandClassName(String name)
    {
        StringBuilder buf = new StringBuilder();
        boolean upper = true;
        for(int i=0; i<name.length(); i++)
        {
            char ch = name.charAt(i);
            if(ch == '-')
            {
                upper = true;
                continue;
            }
            buf.append(upper ? Character.toUpperCase(ch) : ch);
            upper = false;
        }
        return buf.append("Command").toString();
    }

    protected Command createCommand(String name)
    {
        Package p = getClass().getPackage();
        String commandClassName = p.getName() + '.' + commandClassName(name);
        try
        {
            Class<?> commandClass = Class.forName(commandClassName);
            return (Command)commandClass.getConstructor().newInstance();
        }
        catch (ClassNotFoundException | NoSuchMethodException ex)
        {
            throw new IllegalArgumentException("Unknown command: " + name);
        }
        catch (InvocationTargetException | InstantiationException | IllegalAccessException ex)
        {
            throw new RuntimeException(
                String.format("Unable to instantiate command class %s: %s",
                    commandClassName, ex.getMessage()), ex);
        }
    }

    public int run(Command cmd, String[] args)
    {
        CommandLineParser parser = new CommandLineParser();
        List<String> params = new ArrayList<>();
        parser.parse(args);

        try
        {
            CommandConfigurator configurator = null;
            while(parser.next())
            {
                if (configurator == null)
                {
                    if (cmd == null)
                    {
                        if (parser.key() == null)
                        {
                            cmd = createCommand(parser.value());
                            continue;
                        }
                        cmd = defaultCommand();
                    }
                    configurator = new CommandConfigurator(cmd);
                }

                String key = parser.key();
                String value = parser.value();
                if (key != null)
                {
                    configurator.setOption(key, value);
                }
                else
                {
                    params.add(value);
                }
            }
            if(cmd == null) cmd = defaultCommand();
            if(configurator == null) configurator = new CommandConfigurator(cmd);
            configurator.setParams(params);
            return cmd.perform();
        }
        catch(Throwable ex)
        {
            if(cmd == null) cmd = defaultCommand();
            return cmd.error(ex);
        }
    }
}

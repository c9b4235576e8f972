/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies options and positional parameters to a {@link Command}, based on
 * the {@link Option} and {@link Parameter} annotations of its fields and
 * methods (including those of its superclasses).
 */
public class CommandConfigurator
{
    private final Command command;
    private final List<Setter> params = new ArrayList<>();
    private final Map<String, Setter> options = new HashMap<>();

    public CommandConfigurator(Command command)
    {
        this.command = command;
        inspect(command.getClass());
    }

    static class Setter implements Comparable<Setter>
    {
        Field field;
        Method method;
        String paramName;
        String description;
        int position;
        boolean optional;

        Class<?> type()
        {
            if(field != null) return field.getType();
            Class<?>[] methodParams = method.getParameterTypes();
            return methodParams.length == 0 ? null : methodParams[0];
        }

        @Override public int compareTo(Setter other)
        {
            return Integer.compare(position, other.position);
        }
    }

    private static String processAnnotationDescription(Setter setter, String string)
    {
        int n = string.indexOf(':');
        if (n >= 0)
        {
            setter.description = string.substring(n + 1).trim();
            string = string.substring(0, n);
        }
        n = string.indexOf('=');
        if (n >= 0)
        {
            String paramName = string.substring(n + 1);
            if(paramName.startsWith("?"))
            {
                setter.optional = true;
                paramName = paramName.substring(1);
            }
            setter.paramName = paramName;
            string = string.substring(0, n);
        }
        return string;
    }

    private void processAnnotation(Annotation a, Field field, Method method)
    {
        if (a instanceof Option option)
        {
            Setter s = new Setter();
            s.field = field;
            s.method = method;
            String name = processAnnotationDescription(s, option.value());
            if (name.isEmpty())
            {
                name = field != null ? field.getName() : method.getName();
            }
            for(String alias: name.split(","))
            {
                options.put(alias.trim(), s);
            }
            return;
        }
        if (a instanceof Parameter parameter)
        {
            Setter s = new Setter();
            s.field = field;
            s.method = method;
            String name = processAnnotationDescription(s, parameter.value());
            if (!name.isEmpty())
            {
                s.position = Integer.parseInt(name.trim());
            }
            params.add(s);
        }
    }

    private void inspect(Class<?> clazz)
    {
        do
        {
            for (Field f : clazz.getDeclaredFields())
            {
                for (Annotation a : f.getAnnotations())
                {
                    processAnnotation(a, f, null);
                }
            }
            for (Method m : clazz.getDeclaredMethods())
            {
                for (Annotation a : m.getAnnotations())
                {
                    processAnnotation(a, null, m);
                }
            }
            clazz = clazz.getSuperclass();
        }
        while (clazz != null && clazz != Object.class);
        Collections.sort(params);
        boolean optionalSeen = false;
        for(Setter p: params)
        {
            if(optionalSeen && !p.optional)
            {
                throw new IllegalStateException(String.format(
                    "%s: required parameter <%s> follows an optional one",
                    command.getClass().getSimpleName(), p.paramName));
            }
            optionalSeen |= p.optional;
        }
    }

    protected Object convert(String s, Class<?> type)
    {
        return Converter.convert(s, type);
    }

    private void set(Setter setter, String value) throws IllegalAccessException, InvocationTargetException
    {
        Field f = setter.field;
        if (f != null)
        {
            Class<?> type = f.getType();
            Object v = (type == Boolean.TYPE) ? Converter.toBoolean(value) : convert(value, type);
            f.setAccessible(true);
            f.set(command, v);
            return;
        }
        Method m = setter.method;
        m.setAccessible(true);
        Class<?> type = setter.type();
        if (type == null)
        {
            if(value != null)
            {
                throw new IllegalArgumentException("Cannot have a value");
            }
            m.invoke(command);
            return;
        }
        m.invoke(command, convert(value, type));
    }

    public void setOption(String name, String value) throws Exception
    {
        Setter setter = options.get(name);
        if (setter == null)
        {
            command.setOption(name, value);
            return;
        }
        try
        {
            set(setter, value);
        }
        catch(InvocationTargetException ex)
        {
            Throwable cause = ex.getCause();
            throw new IllegalArgumentException(
                "Option " + name + ": " + cause.getMessage(), cause);
        }
        catch(IllegalArgumentException ex)
        {
            throw new IllegalArgumentException(
                "Option " + name + ": " + ex.getMessage(), ex);
        }
    }

    private Object toParamValue(Setter setter, Class<?> type, List<String> args, int pos)
    {
        if(type.isArray())
        {
            int len = args.size() - pos;
            Class<?> itemType = type.getComponentType();
            Object a = Array.newInstance(itemType, len);
            for(int i=0; i<len; i++)
            {
                Array.set(a,i,convert(args.get(pos+i), itemType));
            }
            return a;
        }
        return convert(args.get(pos), type);
    }

    protected String formatParamName(Setter setter)
    {
        return String.format("<%s>", setter.paramName);
    }

    public void setParams(List<String> args) throws Exception
    {
        int argPos = 0;
        final int argCount = args.size();

        for(Setter setter: params)
        {
            if(argPos >= argCount)
            {
                if(setter.optional) break;
                throw new IllegalArgumentException(formatParamName(setter) + ": Missing argument");
            }
            Class<?> type = setter.type();
            try
            {
                Object value = toParamValue(setter, type, args, argPos);
                if (setter.field != null)
                {
                    setter.field.setAccessible(true);
                    setter.field.set(command, value);
                }
                else
                {
                    setter.method.setAccessible(true);
                    setter.method.invoke(command, value);
                }
            }
            catch(InvocationTargetException ex)
            {
                Throwable cause = ex.getCause();
                throw new IllegalArgumentException(String.format("%s: %s",
                    formatParamName(setter), cause.getMessage()), cause);
            }
            catch(IllegalArgumentException ex)
            {
                throw new IllegalArgumentException(String.format("%s: %s",
                    formatParamName(setter), ex.getMessage()), ex);
            }
            argPos = type.isArray() ? argCount : argPos + 1;
        }

        if(argPos < argCount)
        {
            throw new IllegalArgumentException(
                "Extraneous argument(s): " + String.join(" ",
                    args.subList(argPos, argCount)));
        }
    }

    /**
     * Describes the command's options, one per line, for use in help text.
     */
    public String describeOptions()
    {
        Map<Setter,List<String>> names = new LinkedHashMap<>();
        List<String> keys = new ArrayList<>(options.keySet());
        Collections.sort(keys);
        for(String key: keys)
        {
            names.computeIfAbsent(options.get(key), k -> new ArrayList<>()).add(key);
        }
        StringBuilder buf = new StringBuilder();
        for(Map.Entry<Setter,List<String>> e: names.entrySet())
        {
            Setter s = e.getKey();
            StringBuilder line = new StringBuilder("  ");
            List<String> aliases = e.getValue();
            aliases.sort((a, b) -> Integer.compare(b.length(), a.length()));
            for(int i=0; i<aliases.size(); i++)
            {
                if(i > 0) line.append(", ");
                String alias = aliases.get(i);
                line.append(alias.length() == 1 ? "-" : "--").append(alias);
            }
            if(s.paramName != null) line.append('=').append(s.paramName);
            if(s.description != null)
            {
                while(line.length() < 32) line.append(' ');
                line.append(' ').append(s.description);
            }
            buf.append(line).append('\n');
        }
        return buf.toString();
    }
}

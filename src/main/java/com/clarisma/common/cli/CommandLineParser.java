/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

/**
 * Splits command-line arguments into options (`-k`, `--key`,
 * `--key=value`) and plain values. Everything after `--` is treated as a
 * plain value.
 */
public class CommandLineParser
{
    private int current;
    private String[] args;
    private String key;
    private String value;
    private boolean optionsEnded;

    public void parse(String[] args)
    {
        this.args = args;
        current = -1;
        optionsEnded = false;
    }

    public boolean next()
    {
        current++;
        if(current >= args.length) return false;
        String arg = args[current];
        if(!optionsEnded && arg.equals("--"))
        {
            optionsEnded = true;
            return next();
        }
        if (!optionsEnded && arg.length() > 1 && arg.charAt(0) == '-')
        {
            int keyStart = arg.charAt(1)=='-' ? 2 : 1;
            int n = arg.indexOf('=');
            if(n > 0)
            {
                key = arg.substring(keyStart,n);
                value = arg.substring(n+1);
            }
            else
            {
                key = arg.substring(keyStart);
                value = null;
            }
        }
        else
        {
            key = null;
            value = arg;
        }
        return true;
    }

    /**
     * The name of the current option, or `null` if the current argument
     * is a plain value.
     */
    public String key()
    {
        return key;
    }

    public String value()
    {
        return value;
    }
}

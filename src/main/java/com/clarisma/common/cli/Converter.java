/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

import java.nio.file.Path;

public class Converter
{
    public static Object convert(String s, Class<?> type)
    {
        if(type==String.class) return s;
        if(s == null)
        {
            throw new IllegalArgumentException("Value required");
        }
        try
        {
            if (type == Integer.class || type == Integer.TYPE)
            {
                return Integer.parseInt(s.replace("_", ""));
            }
            if (type == Long.class || type == Long.TYPE)
            {
                return Long.parseLong(s.replace("_", ""));
            }
            if (type == Double.class || type == Double.TYPE)
            {
                return Double.parseDouble(s);
            }
        }
        catch(NumberFormatException ex)
        {
            throw new IllegalArgumentException("Must be a number, not \"" + s + "\"");
        }
        if (type == Boolean.class || type == Boolean.TYPE)
        {
            return toBoolean(s);
        }
        if (type == Path.class)
        {
            return Path.of(s);
        }
        throw new IllegalArgumentException(String.format(
            "Unable to convert \"%s\" to %s", s, type.getSimpleName()));
    }

    public static boolean toBoolean(String s)
    {
        // An option without a value is a flag that is switched on
        if(s == null) return true;
        switch (s.toLowerCase())
        {
        case "yes", "true", "on": return true;
        case "no", "false", "off": return false;
        default:
            throw new IllegalArgumentException("Must be yes/no, not \"" + s + "\"");
        }
    }
}

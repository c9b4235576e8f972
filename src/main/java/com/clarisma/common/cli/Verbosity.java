/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

/**
 * Levels of console output. Commands print messages only if the current
 * level is at least the level of the message.
 */
public class Verbosity
{
    public static final int SILENT = -2;
    public static final int QUIET = -1;
    public static final int NORMAL = 0;
    public static final int VERBOSE = 1;
    public static final int DEBUG = 2;

    private static final String[] NAMES = { "silent", "quiet", "normal", "verbose", "debug" };

    public static int parse(String s)
    {
        for(int i=0; i<NAMES.length; i++)
        {
            if(NAMES[i].equalsIgnoreCase(s)) return i + SILENT;
        }
        throw new IllegalArgumentException("\"" + s + "\" is not a valid verbosity " +
            "(must be " + String.join("|", NAMES) + ")");
    }

    public static String name(int level)
    {
        if(level < SILENT) level = SILENT;
        if(level > DEBUG) level = DEBUG;
        return NAMES[level - SILENT];
    }
}

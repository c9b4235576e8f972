/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

public interface Command
{
    int perform() throws Throwable;

    /**
     * Reports an exception thrown while configuring or performing the
     * command.
     *
     * @return the process exit code
     */
    int error(Throwable ex);

    /**
     * Called for options that are not declared via {@link Option}.
     */
    default void setOption(String name, String value)
    {
        throw new IllegalArgumentException("Unknown option: " + name);
    }
}

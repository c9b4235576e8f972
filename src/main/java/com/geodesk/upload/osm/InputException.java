/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.osm;

/**
 * Indicates that the input cannot be uploaded as it is. Always reported
 * before anything is sent to the server.
 */
public class InputException extends Exception
{
    public InputException(String message)
    {
        super(message);
    }

    public InputException(String message, Throwable cause)
    {
        super(message, cause);
    }
}

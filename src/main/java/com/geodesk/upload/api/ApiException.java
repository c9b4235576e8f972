/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import java.io.IOException;

/**
 * Indicates that the API did not accept a request.
 */
public class ApiException extends IOException
{
    private final int status;
    private final String responseBody;

    public ApiException(String message, int status, String responseBody)
    {
        super(status > 0 ? message + " (HTTP " + status + ")" : message);
        this.status = status;
        this.responseBody = responseBody;
    }

    public ApiException(String message, Throwable cause)
    {
        super(message + ": " + cause.getMessage(), cause);
        status = 0;
        responseBody = null;
    }

    /**
     * The HTTP status code, or 0 if no response was received.
     */
    public int status()
    {
        return status;
    }

    /**
     * The body of the error response (often a plain-text explanation from
     * the server), or `null`.
     */
    public String responseBody()
    {
        return responseBody;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.idmap;

import java.io.IOException;

/**
 * Durable backing store of an {@link IdMap}. Implementations must replace
 * the stored mapping atomically: a failure while writing leaves the
 * previously written data intact.
 */
public interface IdMapStorage
{
    /**
     * Reads the stored mapping.
     *
     * @return the stored bytes, or `null` if nothing has been stored yet
     */
    byte[] read() throws IOException;

    void write(byte[] data) throws IOException;

    /**
     * Returns the marker describing an upload whose results may not have
     * been stored, or `null` if there is none.
     */
    String readPending() throws IOException;

    /**
     * Stores a marker for an upload that is about to be sent; `null` removes
     * the marker.
     */
    void writePending(String marker) throws IOException;
}

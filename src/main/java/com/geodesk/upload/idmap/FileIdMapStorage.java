/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.idmap;

import com.clarisma.common.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores an ID map in a file (by default, the input file's name with
 * `.db` appended). The pending-upload marker lives next to it, in a file
 * with the additional extension `.pending`.
 */
public class FileIdMapStorage implements IdMapStorage
{
    private final Path path;
    private final Path pendingPath;

    public FileIdMapStorage(Path path)
    {
        this.path = path;
        pendingPath = FileUtils.addExtension(path, ".pending");
    }

    public Path path()
    {
        return path;
    }

    @Override public byte[] read() throws IOException
    {
        return FileUtils.readIfExists(path);
    }

    @Override public void write(byte[] data) throws IOException
    {
        FileUtils.writeAtomic(path, data);
    }

    @Override public String readPending() throws IOException
    {
        byte[] marker = FileUtils.readIfExists(pendingPath);
        return marker == null ? null : new String(marker, StandardCharsets.UTF_8);
    }

    @Override public void writePending(String marker) throws IOException
    {
        if(marker == null)
        {
            Files.deleteIfExists(pendingPath);
            return;
        }
        FileUtils.writeAtomic(pendingPath, marker.getBytes(StandardCharsets.UTF_8));
    }

    @Override public String toString()
    {
        return path.toString();
    }
}

package com.geodesk.upload.idmap;

import java.io.IOException;

public class MemoryIdMapStorage implements IdMapStorage
{
    public byte[] data;
    public String pending;
    public int writes;
    public boolean failWrite;

    @Override public byte[] read()
    {
        return data;
    }

    @Override public void write(byte[] data) throws IOException
    {
        if(failWrite) throw new IOException("Disk full");
        this.data = data;
        writes++;
    }

    @Override public String readPending()
    {
        return pending;
    }

    @Override public void writePending(String marker)
    {
        pending = marker;
    }

    @Override public String toString()
    {
        return "memory";
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

public class UploadSummary
{
    private final int diffsetsUploaded;
    private final int changesetsUsed;
    private final long entitiesUploaded;
    private final long entitiesSkipped;

    public UploadSummary(int diffsetsUploaded, int changesetsUsed,
        long entitiesUploaded, long entitiesSkipped)
    {
        this.diffsetsUploaded = diffsetsUploaded;
        this.changesetsUsed = changesetsUsed;
        this.entitiesUploaded = entitiesUploaded;
        this.entitiesSkipped = entitiesSkipped;
    }

    public int diffsetsUploaded()
    {
        return diffsetsUploaded;
    }

    public int changesetsUsed()
    {
        return changesetsUsed;
    }

    public long entitiesUploaded()
    {
        return entitiesUploaded;
    }

    /**
     * Number of entities that were not uploaded because the ID map shows
     * them as already processed.
     */
    public long entitiesSkipped()
    {
        return entitiesSkipped;
    }

    @Override public String toString()
    {
        return String.format("Uploaded %,d entities in %,d diffset%s / %,d changeset%s " +
            "(skipped %,d already uploaded)",
            entitiesUploaded, diffsetsUploaded, diffsetsUploaded==1 ? "" : "s",
            changesetsUsed, changesetsUsed==1 ? "" : "s", entitiesSkipped);
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import com.geodesk.upload.model.EntityType;

/**
 * The server's answer for one entity of an uploaded diffset.
 */
public class DiffResult
{
    private final EntityType type;
    private final long oldId;
    private final long newId;
    private final int newVersion;
    private final boolean deleted;

    private DiffResult(EntityType type, long oldId, long newId, int newVersion, boolean deleted)
    {
        this.type = type;
        this.oldId = oldId;
        this.newId = newId;
        this.newVersion = newVersion;
        this.deleted = deleted;
    }

    public static DiffResult mapped(EntityType type, long oldId, long newId, int newVersion)
    {
        return new DiffResult(type, oldId, newId, newVersion, false);
    }

    public static DiffResult deleted(EntityType type, long oldId)
    {
        return new DiffResult(type, oldId, oldId, 0, true);
    }

    public EntityType type()
    {
        return type;
    }

    public long oldId()
    {
        return oldId;
    }

    /**
     * The permanent ID of a created or modified entity (for a deleted
     * entity, the same as its old ID).
     */
    public long newId()
    {
        return newId;
    }

    public int newVersion()
    {
        return newVersion;
    }

    public boolean isDeleted()
    {
        return deleted;
    }

    @Override public String toString()
    {
        return deleted ? String.format("%s/%d deleted", type, oldId) :
            String.format("%s/%d -> %d (v%d)", type, oldId, newId, newVersion);
    }
}

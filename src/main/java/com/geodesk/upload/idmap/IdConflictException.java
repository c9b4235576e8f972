/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.idmap;

import com.geodesk.upload.model.EntityType;

/**
 * Thrown if the server reports a permanent ID for an entity that has
 * already been mapped to a different ID. This never happens in normal
 * operation; the ID map cannot be trusted once it does.
 */
public class IdConflictException extends IllegalStateException
{
    private final EntityType type;
    private final long sourceId;

    public IdConflictException(EntityType type, long sourceId, long existingId, long newId)
    {
        super(String.format("%s/%d is already mapped to %d, cannot map it to %d",
            type, sourceId, existingId, newId));
        this.type = type;
        this.sourceId = sourceId;
    }

    public EntityType type()
    {
        return type;
    }

    public long sourceId()
    {
        return sourceId;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

public class UploadLimits
{
    /**
     * Maximum number of entities in a diffset.
     */
    public static final int DEFAULT_DIFFSET_SIZE = 1000;

    /**
     * Maximum number of entities in a changeset (imposed by the server).
     */
    public static final int DEFAULT_CHANGESET_SIZE = 50_000;

    public static final int DEFAULT_MAX_WAY_NODES = 2000;
    public static final int DEFAULT_MAX_RELATION_MEMBERS = 32_000;

    private final int diffsetSize;
    private final int changesetSize;
    private final int maxWayNodes;
    private final int maxRelationMembers;

    public UploadLimits(int diffsetSize, int changesetSize, int maxWayNodes, int maxRelationMembers)
    {
        if(diffsetSize < 1) throw new IllegalArgumentException("Diffset size must be at least 1");
        if(changesetSize < 1) throw new IllegalArgumentException("Changeset size must be at least 1");
        if(maxWayNodes < 2) throw new IllegalArgumentException("Way node limit must be at least 2");
        if(maxRelationMembers < 1) throw new IllegalArgumentException("Relation member limit must be at least 1");
        this.diffsetSize = diffsetSize;
        this.changesetSize = changesetSize;
        this.maxWayNodes = maxWayNodes;
        this.maxRelationMembers = maxRelationMembers;
    }

    public UploadLimits(int diffsetSize, int changesetSize)
    {
        this(diffsetSize, changesetSize, DEFAULT_MAX_WAY_NODES, DEFAULT_MAX_RELATION_MEMBERS);
    }

    public static UploadLimits defaults()
    {
        return new UploadLimits(DEFAULT_DIFFSET_SIZE, DEFAULT_CHANGESET_SIZE);
    }

    public int diffsetSize()
    {
        return diffsetSize;
    }

    public int changesetSize()
    {
        return changesetSize;
    }

    public int maxWayNodes()
    {
        return maxWayNodes;
    }

    public int maxRelationMembers()
    {
        return maxRelationMembers;
    }
}

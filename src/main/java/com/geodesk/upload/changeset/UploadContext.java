/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

import com.geodesk.upload.api.OsmApi;
import com.geodesk.upload.idmap.IdMap;

/**
 * State shared by the changesets and diffsets of one upload run.
 */
public class UploadContext
{
    private final OsmApi api;
    private final IdMap idMap;
    private final UploadLimits limits;
    private final ProgressReporter progress;
    private int diffsetsUploaded;
    private int changesetsOpened;
    private long entitiesUploaded;

    public UploadContext(OsmApi api, IdMap idMap, UploadLimits limits, ProgressReporter progress)
    {
        this.api = api;
        this.idMap = idMap;
        this.limits = limits;
        this.progress = progress;
    }

    public OsmApi api()
    {
        return api;
    }

    public IdMap idMap()
    {
        return idMap;
    }

    public UploadLimits limits()
    {
        return limits;
    }

    void changesetOpened()
    {
        changesetsOpened++;
    }

    void startProgress(long totalEntities)
    {
        if(progress != null) progress.start(totalEntities);
    }

    void finishProgress()
    {
        if(progress != null) progress.finished();
    }

    void diffsetUploaded(int entityCount)
    {
        diffsetsUploaded++;
        entitiesUploaded += entityCount;
        if(progress != null) progress.progress(entityCount);
    }

    public int diffsetsUploaded()
    {
        return diffsetsUploaded;
    }

    public int changesetsOpened()
    {
        return changesetsOpened;
    }

    public long entitiesUploaded()
    {
        return entitiesUploaded;
    }
}

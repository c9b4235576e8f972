/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

import com.geodesk.upload.api.ApiException;
import com.geodesk.upload.api.DiffResult;
import com.geodesk.upload.idmap.IdMap;
import com.geodesk.upload.model.Action;
import com.geodesk.upload.model.OsmEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A group of creations, modifications and deletions that is uploaded to
 * a changeset in a single request. Once it holds as many entities as
 * the diffset size limit allows, it uploads itself; an uploaded diffset is
 * closed and accepts no further entities.
 *
 * The results of an upload (the permanent IDs of created entities) are
 * recorded in the ID map, which is then persisted.
 */
public class DiffSet
{
    private static final Logger log = LogManager.getLogger();

    private final UploadContext context;
    private final Changeset changeset;
    private final List<OsmEntity> creates = new ArrayList<>();
    private final List<OsmEntity> modifies = new ArrayList<>();
    private final List<OsmEntity> deletes = new ArrayList<>();
    private int count;
    private boolean closed;

    DiffSet(UploadContext context, Changeset changeset)
    {
        this.context = context;
        this.changeset = changeset;
    }

    public int count()
    {
        return count;
    }

    public boolean isClosed()
    {
        return closed;
    }

    private List<OsmEntity> list(Action action)
    {
        switch(action)
        {
        case CREATE: return creates;
        case MODIFY: return modifies;
        default: return deletes;
        }
    }

    public AddResult add(Action action, OsmEntity entity) throws IOException
    {
        if(closed) return AddResult.CLOSED;
        list(action).add(entity);
        count++;
        if(count >= context.limits().diffsetSize()) upload();
        return AddResult.ADDED;
    }

    /**
     * Uploads the diffset, unless it is empty or has already been uploaded.
     * The ID map is marked as pending while the request is under way; the
     * marker stays behind only if the request failed without a response.
     *
     * @throws IOException if the server rejects the diffset, or the ID map
     *   cannot be written
     */
    public void upload() throws IOException
    {
        if(count == 0 || closed) return;
        IdMap idMap = context.idMap();
        long changesetId = changeset.id();
        log.info("Uploading {} entities to changeset {}", count, changesetId);
        idMap.markPending(String.format("diffset of %d entities in changeset %d",
            count, changesetId));
        List<DiffResult> results;
        try
        {
            results = context.api().uploadDiff(changesetId, creates, modifies, deletes);
        }
        catch(ApiException ex)
        {
            // A diffset the server responded to with an error has not been
            // applied at all; without a response, its fate is unknown
            if(ex.status() > 0) idMap.clearPending();
            throw ex;
        }
        processResults(idMap, results);
        idMap.persist();
        closed = true;
        context.diffsetUploaded(count);
    }

    private void processResults(IdMap idMap, List<DiffResult> results)
    {
        if(results.size() != count)
        {
            log.warn("Uploaded {} entities to changeset {}, but server reported {} results",
                count, changeset.id(), results.size());
        }
        for(DiffResult result: results)
        {
            if(result.isDeleted())
            {
                idMap.recordDeleted(result.type(), result.oldId());
            }
            else
            {
                idMap.record(result.type(), result.oldId(), result.newId());
            }
        }
    }
}

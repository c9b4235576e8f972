/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

import com.geodesk.upload.api.ApiException;
import com.geodesk.upload.model.Action;
import com.geodesk.upload.model.OsmEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A changeset on the server, filled one diffset at a time.
 *
 * The changeset is opened when the first entity is added, so a run that
 * has nothing to upload never creates an empty changeset. Once the number
 * of entities reaches the changeset size limit, the current diffset is
 * uploaded and the changeset is closed. A closed changeset cannot be
 * reopened.
 */
public class Changeset
{
    private static final Logger log = LogManager.getLogger();

    private final UploadContext context;
    private final Map<String,String> tags;
    private DiffSet currentDiffSet;
    private long id;
    private boolean opened;
    private boolean closed;
    private int count;

    public Changeset(UploadContext context, Map<String,String> tags)
    {
        this.context = context;
        this.tags = new LinkedHashMap<>(tags);
        currentDiffSet = new DiffSet(context, this);
    }

    /**
     * The server-assigned ID, or 0 if the changeset has not been opened.
     */
    public long id()
    {
        return id;
    }

    public int count()
    {
        return count;
    }

    public boolean isOpen()
    {
        return opened && !closed;
    }

    public boolean isClosed()
    {
        return closed;
    }

    private void open() throws ApiException
    {
        id = context.api().createChangeset(tags);
        opened = true;
        context.changesetOpened();
        log.info("Created changeset {}", id);
    }

    public AddResult add(Action action, OsmEntity entity) throws IOException
    {
        if(closed) return AddResult.CLOSED;
        if(!opened) open();
        entity.changeset(id);
        if(currentDiffSet.add(action, entity) == AddResult.CLOSED)
        {
            currentDiffSet = new DiffSet(context, this);
            if(currentDiffSet.add(action, entity) == AddResult.CLOSED)
            {
                throw new IllegalStateException("New diffset rejected " + entity);
            }
        }
        count++;
        if(count >= context.limits().changesetSize())
        {
            currentDiffSet.upload();
            close();
        }
        return AddResult.ADDED;
    }

    /**
     * Uploads any entities that are still waiting in the current diffset,
     * and closes the changeset. Has no effect if the changeset was never
     * opened, or has already been closed. If the server refuses to close
     * the changeset, the failure is logged; the changeset is considered
     * closed regardless (the server closes idle changesets on its own).
     *
     * @throws IOException if the final diffset cannot be uploaded
     */
    public void close() throws IOException
    {
        if(!opened || closed) return;
        currentDiffSet.upload();
        try
        {
            context.api().closeChangeset(id);
            log.info("Closed changeset {} ({} entities)", id, count);
        }
        catch(ApiException ex)
        {
            log.error("Failed to close changeset {}: {}", id, ex.getMessage());
        }
        closed = true;
    }
}

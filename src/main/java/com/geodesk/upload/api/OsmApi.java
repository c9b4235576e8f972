/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import com.geodesk.upload.model.OsmEntity;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The three changeset operations of the OSM editing API. Every call
 * blocks until the server has answered; any answer other than success
 * results in an {@link ApiException}.
 */
public interface OsmApi extends Closeable
{
    /**
     * Opens a changeset.
     *
     * @param tags the changeset's tags (e.g. `comment`, `created_by`)
     * @return the ID of the new changeset
     */
    long createChangeset(Map<String,String> tags) throws ApiException;

    /**
     * Uploads a diffset into an open changeset. The server applies it
     * atomically.
     *
     * @return the result for each entity in the diffset
     */
    List<DiffResult> uploadDiff(long changesetId, List<OsmEntity> creates,
        List<OsmEntity> modifies, List<OsmEntity> deletes) throws ApiException;

    void closeChangeset(long changesetId) throws ApiException;

    @Override default void close() throws IOException
    {
        // nothing to release by default
    }
}

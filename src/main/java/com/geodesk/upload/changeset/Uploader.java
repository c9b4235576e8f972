/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

import com.geodesk.upload.api.OsmApi;
import com.geodesk.upload.graph.RelationSorter;
import com.geodesk.upload.idmap.IdMap;
import com.geodesk.upload.model.EntityType;
import com.geodesk.upload.model.Member;
import com.geodesk.upload.model.OsmEntity;
import com.geodesk.upload.osm.InputException;
import com.geodesk.upload.osm.OsmDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Uploads the entities of an OSM document: first all nodes, then all ways,
 * then all relations, each in a sequence where every entity comes after the
 * entities it references (relations that have other relations as members
 * are sorted accordingly).
 *
 * Entities that are already in the ID map are skipped, which allows an
 * interrupted upload to be resumed. Before an entity is added to a
 * changeset, its references to entities that have already been uploaded
 * are replaced with their permanent IDs; references to entities that are
 * still waiting in the current diffset keep their source IDs, which the
 * server resolves within the diffset.
 *
 * The whole document is validated before anything is sent to the server.
 */
public class Uploader
{
    private static final Logger log = LogManager.getLogger();

    private final UploadContext context;
    private final IdMap idMap;
    private Map<String,String> tags;
    private Changeset changeset;
    private List<OsmEntity> nodes;
    private List<OsmEntity> ways;
    private List<OsmEntity> relations;
    private long skipped;

    public Uploader(OsmApi api, IdMap idMap, UploadLimits limits)
    {
        this(api, idMap, limits, null);
    }

    public Uploader(OsmApi api, IdMap idMap, UploadLimits limits, ProgressReporter progress)
    {
        context = new UploadContext(api, idMap, limits, progress);
        this.idMap = idMap;
    }

    private static String changeDocumentMessage(String marker)
    {
        return String.format(
            "This is an osmChange file, or an OSM file with <%s> elements.\n" +
            "Uploading it as an OSM file would create every entity anew and\n" +
            "corrupt the data on the server. Upload osmChange files directly\n" +
            "through the API instead.", marker);
    }

    /**
     * Checks that the document can be uploaded, and determines which of its
     * entities still need to be uploaded, and in which order. Entities that
     * are already in the ID map are skipped; if the document contains an
     * entity more than once, only the first occurrence is kept.
     *
     * @throws InputException if the document is an osmChange document,
     *   contains a way or relation that exceeds the server's limits, or
     *   contains relations that reference each other in a cycle
     */
    public void validate(OsmDocument doc) throws InputException
    {
        if(doc.isChangeDocument())
        {
            throw new InputException(changeDocumentMessage(doc.changeMarker()));
        }
        nodes = pending(doc.nodes());
        ways = pending(doc.ways());
        relations = pending(doc.relations());
        skipped = doc.entityCount() - nodes.size() - ways.size() - relations.size();

        UploadLimits limits = context.limits();
        for(OsmEntity way: ways)
        {
            if(way.memberCount() > limits.maxWayNodes())
            {
                throw new InputException(String.format(
                    "way/%d has %d nodes (at most %d allowed)",
                    way.id(), way.memberCount(), limits.maxWayNodes()));
            }
        }
        for(OsmEntity rel: relations)
        {
            if(rel.memberCount() > limits.maxRelationMembers())
            {
                throw new InputException(String.format(
                    "relation/%d has %d members (at most %d allowed)",
                    rel.id(), rel.memberCount(), limits.maxRelationMembers()));
            }
        }
        if(RelationSorter.needsSorting(relations))
        {
            relations = new RelationSorter(idMap).sort(relations);
        }
    }

    /**
     * Returns the entities that have not been uploaded yet, without
     * repeated IDs.
     */
    private List<OsmEntity> pending(List<OsmEntity> entities)
    {
        List<OsmEntity> pending = new ArrayList<>(entities.size());
        MutableLongSet seen = new LongHashSet();
        for(OsmEntity entity: entities)
        {
            if(idMap.contains(entity.type(), entity.id())) continue;
            if(!seen.add(entity.id()))
            {
                log.warn("Duplicate {}; only the first one will be uploaded", entity);
                continue;
            }
            pending.add(entity);
        }
        return pending;
    }

    /**
     * Uploads the document.
     *
     * @param doc   the entities to upload
     * @param tags  the tags of each changeset that is created
     * @return a summary of what has been uploaded
     * @throws InputException if the document cannot be uploaded (nothing
     *   has been sent in that case)
     * @throws IOException if the server rejected a request, or the ID map
     *   could not be written
     */
    public UploadSummary run(OsmDocument doc, Map<String,String> tags)
        throws InputException, IOException
    {
        validate(doc);
        this.tags = tags;
        changeset = new Changeset(context, tags);
        context.startProgress(nodes.size() + ways.size() + relations.size());

        uploadInOrder(nodes);
        uploadInOrder(ways);
        uploadInOrder(relations);

        changeset.close();
        context.finishProgress();
        UploadSummary summary = new UploadSummary(context.diffsetsUploaded(),
            context.changesetsOpened(), context.entitiesUploaded(), skipped);
        log.info("{}", summary);
        return summary;
    }

    private void uploadInOrder(List<OsmEntity> entities) throws IOException
    {
        for(OsmEntity entity: entities)
        {
            updateReferences(entity);
            submit(entity);
        }
    }

    /**
     * Replaces an entity's references to already-uploaded entities with
     * their permanent IDs.
     */
    void updateReferences(OsmEntity entity)
    {
        List<Member> members = entity.members();
        for(int i=0; i<members.size(); i++)
        {
            Member m = members.get(i);
            long newRef = idMap.resolve(m.type(), m.ref());
            if(newRef != m.ref()) entity.setMember(i, m.withRef(newRef));
        }
    }

    private void submit(OsmEntity entity) throws IOException
    {
        if(changeset.add(entity.action(), entity) == AddResult.CLOSED)
        {
            changeset = new Changeset(context, tags);
            if(changeset.add(entity.action(), entity) == AddResult.CLOSED)
            {
                throw new IllegalStateException("New changeset rejected " + entity);
            }
        }
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.idmap;

import com.geodesk.upload.model.EntityType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.map.primitive.MutableLongLongMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.OptionalLong;

/**
 * Maps the IDs that entities carry in the input file (source IDs) to the
 * permanent IDs assigned by the server, separately for each entity type.
 *
 * An entity whose source ID is present in the map has already been uploaded
 * (or its deletion has been confirmed), and will be skipped by later runs.
 * A mapping is recorded only once the server has accepted the diffset that
 * contains the entity, and is never changed afterward.
 *
 * The map is loaded once at startup and written back after every diffset
 * that has been uploaded successfully. Between sending a diffset and
 * persisting its results, a pending-upload marker is kept in storage, so
 * a crash inside this window can be detected on the next run.
 */
public class IdMap
{
    private static final Logger log = LogManager.getLogger();

    private static final String FORMAT_NAME = "osm-id-map";
    private static final int FORMAT_VERSION = 1;

    private final IdMapStorage storage;
    private final MutableLongLongMap[] maps;
    private String pendingUpload;

    public IdMap(IdMapStorage storage)
    {
        this.storage = storage;
        maps = new MutableLongLongMap[EntityType.values().length];
        clear();
    }

    private void clear()
    {
        for(int i=0; i<maps.length; i++) maps[i] = new LongLongHashMap();
    }

    private MutableLongLongMap map(EntityType type)
    {
        return maps[type.ordinal()];
    }

    public boolean contains(EntityType type, long sourceId)
    {
        return map(type).containsKey(sourceId);
    }

    public OptionalLong lookup(EntityType type, long sourceId)
    {
        MutableLongLongMap map = map(type);
        if(!map.containsKey(sourceId)) return OptionalLong.empty();
        return OptionalLong.of(map.get(sourceId));
    }

    /**
     * Returns the permanent ID of an entity, or its source ID if it has not
     * been mapped yet.
     */
    public long resolve(EntityType type, long sourceId)
    {
        return map(type).getIfAbsent(sourceId, sourceId);
    }

    /**
     * Records the permanent ID of an entity. Recording the same mapping
     * again has no effect.
     *
     * @throws IdConflictException if the entity is already mapped to a
     *   different ID
     */
    public void record(EntityType type, long sourceId, long permanentId)
    {
        MutableLongLongMap map = map(type);
        if(map.containsKey(sourceId))
        {
            long existingId = map.get(sourceId);
            if(existingId == permanentId) return;
            throw new IdConflictException(type, sourceId, existingId, permanentId);
        }
        map.put(sourceId, permanentId);
    }

    /**
     * Records that the server has confirmed the deletion of an entity.
     * The entity maps to itself, which marks it as processed.
     */
    public void recordDeleted(EntityType type, long sourceId)
    {
        record(type, sourceId, sourceId);
    }

    public int size(EntityType type)
    {
        return map(type).size();
    }

    public int size()
    {
        int size = 0;
        for(MutableLongLongMap map: maps) size += map.size();
        return size;
    }

    /**
     * Describes the upload that was in flight when a previous run ended
     * without storing its results, or `null` if the previous run ended
     * cleanly. If not `null`, the entities of that upload may exist on the
     * server even though they are not in this map.
     */
    public String pendingUpload()
    {
        return pendingUpload;
    }

    /**
     * Restores the map from storage. Missing or unreadable data results
     * in an empty map.
     */
    public void load()
    {
        clear();
        byte[] data;
        try
        {
            data = storage.read();
            pendingUpload = storage.readPending();
        }
        catch(IOException ex)
        {
            log.warn("Unable to read ID map from {}, starting with an empty map: {}",
                storage, ex.getMessage());
            return;
        }
        if(pendingUpload != null)
        {
            log.warn("The previous run did not store the results of {}; " +
                "its entities may already exist on the server", pendingUpload);
        }
        if(data == null)
        {
            log.debug("No ID map at {}, starting with an empty map", storage);
            return;
        }
        try
        {
            decode(data);
            log.info("Loaded {} ID mappings from {}", size(), storage);
        }
        catch(IOException | ClassNotFoundException | ClassCastException ex)
        {
            log.warn("ID map in {} is corrupt, starting with an empty map: {}",
                storage, ex.getMessage());
            clear();
        }
    }

    /**
     * Writes the complete map to storage, and clears the pending-upload
     * marker.
     */
    public void persist() throws IOException
    {
        storage.write(encode());
        clearPending();
    }

    /**
     * Removes the pending-upload marker, if there is one.
     */
    public void clearPending() throws IOException
    {
        if(pendingUpload != null)
        {
            storage.writePending(null);
            pendingUpload = null;
        }
    }

    /**
     * Stores a marker describing an upload that is about to be sent. The
     * marker is removed by the next call to {@link #persist()}.
     */
    public void markPending(String description) throws IOException
    {
        storage.writePending(description);
        pendingUpload = description;
    }

    private byte[] encode() throws IOException
    {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try(ObjectOutputStream out = new ObjectOutputStream(buf))
        {
            out.writeUTF(FORMAT_NAME);
            out.writeInt(FORMAT_VERSION);
            out.writeInt(maps.length);
            for(MutableLongLongMap map: maps) out.writeObject(map);
        }
        return buf.toByteArray();
    }

    private void decode(byte[] data) throws IOException, ClassNotFoundException
    {
        try(ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data)))
        {
            if(!FORMAT_NAME.equals(in.readUTF()))
            {
                throw new IOException("Not an ID map");
            }
            int version = in.readInt();
            if(version != FORMAT_VERSION)
            {
                throw new IOException("Unsupported ID map version " + version);
            }
            int count = in.readInt();
            if(count != maps.length)
            {
                throw new IOException("Expected " + maps.length + " entity types, found " + count);
            }
            for(int i=0; i<count; i++) maps[i] = (LongLongHashMap)in.readObject();
        }
    }
}

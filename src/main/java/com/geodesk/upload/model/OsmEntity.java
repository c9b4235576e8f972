/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node, way or relation as read from an OSM file, ready to be placed
 * into a diffset.
 *
 * The `id` is the source ID, i.e. the ID the entity carries in the input
 * file. New entities have negative IDs; the server assigns their permanent
 * IDs once the diffset that contains them has been accepted.
 *
 * Attributes other than `id`, `action` and `changeset` are passed through
 * to the server unchanged, in the order in which they were read.
 */
public class OsmEntity
{
    private final EntityType type;
    private final long id;
    private final Action action;
    private final Map<String,String> attributes;
    private final List<String> tags;
    private final List<Member> members;
    private long changeset;

    public OsmEntity(EntityType type, long id, Action action)
    {
        this.type = type;
        this.id = id;
        this.action = action;
        attributes = new LinkedHashMap<>();
        tags = new ArrayList<>();
        members = new ArrayList<>();
    }

    public EntityType type()
    {
        return type;
    }

    public long id()
    {
        return id;
    }

    public Action action()
    {
        return action;
    }

    public Map<String,String> attributes()
    {
        return Collections.unmodifiableMap(attributes);
    }

    public void attribute(String key, String value)
    {
        attributes.put(key, value);
    }

    /**
     * Returns the tags as a flat list of alternating keys and values.
     */
    public List<String> tags()
    {
        return Collections.unmodifiableList(tags);
    }

    public void tag(String key, String value)
    {
        tags.add(key);
        tags.add(value);
    }

    public List<Member> members()
    {
        return Collections.unmodifiableList(members);
    }

    public void addMember(Member member)
    {
        members.add(member);
    }

    public int memberCount()
    {
        return members.size();
    }

    public void setMember(int n, Member member)
    {
        members.set(n, member);
    }

    /**
     * The ID of the changeset this entity has been assigned to, or 0 if
     * it has not been added to a changeset yet.
     */
    public long changeset()
    {
        return changeset;
    }

    public void changeset(long changeset)
    {
        this.changeset = changeset;
    }

    @Override public String toString()
    {
        return type.xmlName() + "/" + id;
    }
}

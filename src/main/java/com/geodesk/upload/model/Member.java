/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.model;

/**
 * A reference from a way or relation to another entity. For ways, members
 * are the node references (`nd` elements) and have no role.
 */
public class Member
{
    private final EntityType type;
    private final long ref;
    private final String role;

    public Member(EntityType type, long ref, String role)
    {
        this.type = type;
        this.ref = ref;
        this.role = role;
    }

    public static Member node(long ref)
    {
        return new Member(EntityType.NODE, ref, null);
    }

    public EntityType type()
    {
        return type;
    }

    public long ref()
    {
        return ref;
    }

    public String role()
    {
        return role;
    }

    public Member withRef(long newRef)
    {
        return newRef == ref ? this : new Member(type, newRef, role);
    }

    @Override public boolean equals(Object other)
    {
        if(!(other instanceof Member m)) return false;
        return type == m.type && ref == m.ref &&
            (role == null ? m.role == null : role.equals(m.role));
    }

    @Override public int hashCode()
    {
        return Long.hashCode(ref) * 31 + type.ordinal();
    }

    @Override public String toString()
    {
        return type.xmlName() + "/" + ref + (role == null ? "" : " (" + role + ")");
    }
}

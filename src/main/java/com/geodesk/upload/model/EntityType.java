/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.model;

public enum EntityType
{
    NODE("node"),
    WAY("way"),
    RELATION("relation");

    private final String xmlName;

    EntityType(String xmlName)
    {
        this.xmlName = xmlName;
    }

    /**
     * The name of the XML element that represents an entity of this type
     * (also used as the `type` attribute of relation members).
     */
    public String xmlName()
    {
        return xmlName;
    }

    public static EntityType from(String s)
    {
        switch(s)
        {
        case "node":
        case "n":
            return NODE;
        case "way":
        case "w":
            return WAY;
        case "relation":
        case "r":
            return RELATION;
        default:
            throw new IllegalArgumentException("Unknown entity type: " + s);
        }
    }

    @Override public String toString()
    {
        return xmlName;
    }
}

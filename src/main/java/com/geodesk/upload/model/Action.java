/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.model;

/**
 * What the server should do with an entity. JOSM marks edited entities
 * with an `action` attribute; entities without one are created.
 */
public enum Action
{
    CREATE("create"),
    MODIFY("modify"),
    DELETE("delete");

    private final String xmlName;

    Action(String xmlName)
    {
        this.xmlName = xmlName;
    }

    public String xmlName()
    {
        return xmlName;
    }

    public static Action from(String s)
    {
        if(s == null) return CREATE;
        switch(s)
        {
        case "create": return CREATE;
        case "modify": return MODIFY;
        case "delete": return DELETE;
        default:
            throw new IllegalArgumentException("Unknown action: " + s);
        }
    }
}

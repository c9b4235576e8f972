/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.osm;

import com.geodesk.upload.model.OsmEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * The entities of an OSM file, grouped by type, each group in the order
 * in which the entities appear in the file.
 */
public class OsmDocument
{
    private final List<OsmEntity> nodes = new ArrayList<>();
    private final List<OsmEntity> ways = new ArrayList<>();
    private final List<OsmEntity> relations = new ArrayList<>();
    private String changeMarker;

    public List<OsmEntity> nodes()
    {
        return nodes;
    }

    public List<OsmEntity> ways()
    {
        return ways;
    }

    public List<OsmEntity> relations()
    {
        return relations;
    }

    public void add(OsmEntity entity)
    {
        switch(entity.type())
        {
        case NODE:
            nodes.add(entity);
            break;
        case WAY:
            ways.add(entity);
            break;
        case RELATION:
            relations.add(entity);
            break;
        }
    }

    public long entityCount()
    {
        return (long)nodes.size() + ways.size() + relations.size();
    }

    /**
     * Returns `true` if this is an osmChange document (or an OSM file that
     * contains osmChange elements), which must not be uploaded as if it
     * were a plain OSM file.
     */
    public boolean isChangeDocument()
    {
        return changeMarker != null;
    }

    /**
     * The name of the element that marks this document as a change
     * document, or `null`.
     */
    public String changeMarker()
    {
        return changeMarker;
    }

    public void markAsChangeDocument(String element)
    {
        if(changeMarker == null) changeMarker = element;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.graph;

import com.geodesk.upload.osm.InputException;
import org.eclipse.collections.api.list.primitive.LongList;

/**
 * Thrown if relations that have not been uploaded yet refer to each other
 * in a cycle. Such relations cannot be placed in an order where every
 * relation is uploaded after the relations it references.
 */
public class CyclicRelationException extends InputException
{
    private final LongList cycle;

    public CyclicRelationException(LongList cycle)
    {
        super("Relations form a reference cycle: " + describe(cycle));
        this.cycle = cycle;
    }

    private static String describe(LongList cycle)
    {
        StringBuilder buf = new StringBuilder();
        for(int i=0; i<cycle.size(); i++)
        {
            buf.append("relation/").append(cycle.get(i)).append(" -> ");
        }
        buf.append("relation/").append(cycle.get(0));
        return buf.toString();
    }

    /**
     * The IDs of the relations in the cycle, in reference order (each
     * relation references the next; the last references the first).
     */
    public LongList cycle()
    {
        return cycle;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.graph;

import com.geodesk.upload.idmap.IdMap;
import com.geodesk.upload.model.EntityType;
import com.geodesk.upload.model.Member;
import com.geodesk.upload.model.OsmEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.api.map.primitive.MutableLongIntMap;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.LongIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Places relations into an order in which every relation comes after the
 * relations it has as members, so that a parent relation's member
 * references can be rewritten to the permanent IDs of its child relations.
 *
 * The relations form a directed graph (edge = "is a member of"). Every
 * relation that is not a member of another relation becomes a child of a
 * virtual root. A depth-first traversal from the root, emitting relations
 * in post-order, yields members before their parents. Relations that have
 * already been uploaded (i.e. that are in the ID map) are not part of the
 * graph; references to them, and to relations that are not in the input,
 * impose no ordering.
 *
 * The traversal uses an explicit stack, so chains of nested relations can
 * be arbitrarily deep.
 */
public class RelationSorter
{
    private static final Logger log = LogManager.getLogger();

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private final IdMap idMap;
    private final List<OsmEntity> relations = new ArrayList<>();
    private final MutableLongIntMap indexOfId = new LongIntHashMap();
    private final List<MutableIntList> children = new ArrayList<>();
    private boolean[] hasParent;
    private byte[] state;
    private List<OsmEntity> sorted;

    public RelationSorter(IdMap idMap)
    {
        this.idMap = idMap;
    }

    /**
     * Checks whether any relation has another relation as a member. If not,
     * the relations can be uploaded in the order in which they appear.
     */
    public static boolean needsSorting(List<OsmEntity> relations)
    {
        for(OsmEntity rel: relations)
        {
            for(Member m: rel.members())
            {
                if(m.type() == EntityType.RELATION) return true;
            }
        }
        return false;
    }

    /**
     * Returns the relations that have not been uploaded yet, ordered so that
     * each relation comes after all of its not-yet-uploaded child relations.
     * Relations that are not related to each other keep their original order.
     *
     * @param input the relations, in document order
     * @return a new list with the sorted relations
     * @throws CyclicRelationException if relations reference each other
     *   in a cycle
     */
    public List<OsmEntity> sort(List<OsmEntity> input) throws CyclicRelationException
    {
        buildGraph(input);
        int count = relations.size();
        sorted = new ArrayList<>(count);
        state = new byte[count];

        // Children of the virtual root
        for(int i=0; i<count; i++)
        {
            if(!hasParent[i]) traverse(i);
        }

        // Relations that cannot be reached from the root are part of a
        // cycle, or are members of a relation in a cycle; traversing them
        // is bound to find the cycle
        for(int i=0; i<count; i++)
        {
            if(state[i] == UNVISITED) traverse(i);
        }

        log.debug("Sorted {} relations", sorted.size());
        List<OsmEntity> result = sorted;
        reset();
        return result;
    }

    private void reset()
    {
        relations.clear();
        indexOfId.clear();
        children.clear();
        hasParent = null;
        state = null;
        sorted = null;
    }

    private void buildGraph(List<OsmEntity> input)
    {
        reset();
        for(OsmEntity rel: input)
        {
            if(idMap.contains(EntityType.RELATION, rel.id())) continue;
            if(indexOfId.containsKey(rel.id()))
            {
                log.warn("Duplicate relation/{}; only the first one will be uploaded", rel.id());
                continue;
            }
            indexOfId.put(rel.id(), relations.size());
            relations.add(rel);
            children.add(new IntArrayList());
        }
        hasParent = new boolean[relations.size()];
        for(int i=0; i<relations.size(); i++)
        {
            MutableIntList childList = children.get(i);
            for(Member m: relations.get(i).members())
            {
                if(m.type() != EntityType.RELATION) continue;
                int child = indexOfId.getIfAbsent(m.ref(), -1);
                if(child < 0) continue;
                childList.add(child);
                hasParent[child] = true;
            }
        }
    }

    private void traverse(int start) throws CyclicRelationException
    {
        MutableIntList stack = new IntArrayList();
        MutableIntList nextChild = new IntArrayList();
        stack.add(start);
        nextChild.add(0);
        state[start] = IN_PROGRESS;

        while(!stack.isEmpty())
        {
            int top = stack.size() - 1;
            int current = stack.get(top);
            MutableIntList childList = children.get(current);
            int pos = nextChild.get(top);
            if(pos < childList.size())
            {
                nextChild.set(top, pos + 1);
                int child = childList.get(pos);
                if(state[child] == UNVISITED)
                {
                    state[child] = IN_PROGRESS;
                    stack.add(child);
                    nextChild.add(0);
                }
                else if(state[child] == IN_PROGRESS)
                {
                    throw new CyclicRelationException(cycle(stack, child));
                }
                continue;
            }
            stack.removeAtIndex(top);
            nextChild.removeAtIndex(top);
            state[current] = DONE;
            sorted.add(relations.get(current));
        }
    }

    private MutableLongList cycle(MutableIntList stack, int first)
    {
        MutableLongList ids = new LongArrayList();
        int start = stack.lastIndexOf(first);
        for(int i=start; i<stack.size(); i++)
        {
            ids.add(relations.get(stack.get(i)).id());
        }
        return ids;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import com.geodesk.upload.model.EntityType;
import com.geodesk.upload.model.Member;
import com.geodesk.upload.model.OsmEntity;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * Produces the XML request bodies of the changeset API: the changeset
 * document used to open a changeset, and the osmChange document that
 * carries a diffset.
 */
public class ChangeWriter
{
    private final String generator;

    public ChangeWriter(String generator)
    {
        this.generator = generator;
    }

    public String changesetXml(Map<String,String> tags)
    {
        StringWriter buf = new StringWriter();
        XmlWriter out = new XmlWriter(buf);
        out.begin("osm");
        out.attr("version", "0.6");
        out.attr("generator", generator);
        out.begin("changeset");
        for(Map.Entry<String,String> tag: tags.entrySet())
        {
            out.begin("tag");
            out.attr("k", tag.getKey());
            out.attr("v", tag.getValue());
            out.end();
        }
        out.end();
        out.end();
        out.flush();
        return buf.toString();
    }

    public String diffXml(List<OsmEntity> creates, List<OsmEntity> modifies,
        List<OsmEntity> deletes)
    {
        StringWriter buf = new StringWriter();
        XmlWriter out = new XmlWriter(buf);
        out.begin("osmChange");
        out.attr("version", "0.6");
        out.attr("generator", generator);
        writeSection(out, "create", creates);
        writeSection(out, "modify", modifies);
        writeSection(out, "delete", deletes);
        out.end();
        out.flush();
        return buf.toString();
    }

    private void writeSection(XmlWriter out, String action, List<OsmEntity> entities)
    {
        out.begin(action);
        for(OsmEntity entity: entities) writeEntity(out, entity);
        out.end();
    }

    private void writeEntity(XmlWriter out, OsmEntity entity)
    {
        out.begin(entity.type().xmlName());
        out.attr("id", entity.id());
        if(entity.changeset() != 0) out.attr("changeset", entity.changeset());
        for(Map.Entry<String,String> attr: entity.attributes().entrySet())
        {
            out.attr(attr.getKey(), attr.getValue());
        }

        List<String> tags = entity.tags();
        for(int i=0; i<tags.size(); i+=2)
        {
            out.begin("tag");
            out.attr("k", tags.get(i));
            out.attr("v", tags.get(i+1));
            out.end();
        }

        if(entity.type() == EntityType.WAY)
        {
            for(Member m: entity.members())
            {
                out.begin("nd");
                out.attr("ref", m.ref());
                out.end();
            }
        }
        else if(entity.type() == EntityType.RELATION)
        {
            for(Member m: entity.members())
            {
                out.begin("member");
                out.attr("type", m.type().xmlName());
                out.attr("ref", m.ref());
                out.attr("role", m.role() == null ? "" : m.role());
                out.end();
            }
        }
        out.end();
    }
}

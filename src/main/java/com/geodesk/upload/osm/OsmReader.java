/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.osm;

import com.clarisma.common.io.FileUtils;
import com.geodesk.upload.model.Action;
import com.geodesk.upload.model.EntityType;
import com.geodesk.upload.model.Member;
import com.geodesk.upload.model.OsmEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Reads an OSM XML file (as written by JOSM) into an {@link OsmDocument}.
 *
 * The reader also accepts osmChange documents, and OSM files that contain
 * `create`, `modify`, `delete` or `add` elements, but marks such documents
 * as change documents so they can be rejected before upload.
 */
public class OsmReader extends DefaultHandler
{
    private static final Logger log = LogManager.getLogger();

    private OsmDocument document;
    private OsmEntity current;
    private boolean rootSeen;

    public OsmDocument read(Path path) throws IOException, InputException
    {
        boolean zipped = FileUtils.getExtension(path.toString()).equals("gz");
        try (InputStream fin = Files.newInputStream(path);
            InputStream in = zipped ? new GZIPInputStream(fin) : fin)
        {
            return read(in, path.toString());
        }
    }

    public OsmDocument read(InputStream in, String name) throws IOException, InputException
    {
        document = new OsmDocument();
        current = null;
        rootSeen = false;
        try
        {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            SAXParser parser = factory.newSAXParser();
            parser.parse(in, this);
        }
        catch(SAXException | ParserConfigurationException ex)
        {
            throw new InputException("%s: Invalid file (%s)".formatted(name, ex.getMessage()), ex);
        }
        log.debug("Read {} nodes, {} ways, {} relations from {}", document.nodes().size(),
            document.ways().size(), document.relations().size(), name);
        OsmDocument result = document;
        document = null;
        return result;
    }

    private void startRoot(String qName) throws SAXException
    {
        rootSeen = true;
        switch(qName)
        {
        case "osm":
            break;
        case "osmChange":
            document.markAsChangeDocument(qName);
            break;
        default:
            throw new SAXException("Not an OSM file (root element is <" + qName + ">)");
        }
    }

    private static long parseLong(Attributes attr, String name, String element) throws SAXException
    {
        String value = attr.getValue(name);
        if(value == null) throw new SAXException("<" + element + "> lacks attribute " + name);
        try
        {
            return Long.parseLong(value);
        }
        catch(NumberFormatException ex)
        {
            throw new SAXException("<" + element + ">: Invalid " + name + " \"" + value + "\"");
        }
    }

    private void startEntity(EntityType type, String qName, Attributes attr) throws SAXException
    {
        long id = parseLong(attr, "id", qName);
        Action action;
        try
        {
            action = Action.from(attr.getValue("action"));
        }
        catch(IllegalArgumentException ex)
        {
            throw new SAXException(type + "/" + id + ": " + ex.getMessage());
        }
        current = new OsmEntity(type, id, action);
        for(int i=0; i<attr.getLength(); i++)
        {
            String key = attr.getQName(i);
            switch(key)
            {
            case "id":
            case "action":
            case "changeset":
                break;
            default:
                current.attribute(key, attr.getValue(i));
            }
        }
    }

    @Override public void startElement (String uri, String localName,
        String qName, Attributes attr) throws SAXException
    {
        if(!rootSeen)
        {
            startRoot(qName);
            return;
        }
        switch(qName)
        {
        case "node":
            startEntity(EntityType.NODE, qName, attr);
            break;
        case "way":
            startEntity(EntityType.WAY, qName, attr);
            break;
        case "relation":
            startEntity(EntityType.RELATION, qName, attr);
            break;
        case "nd":
            if(current != null) current.addMember(Member.node(parseLong(attr, "ref", qName)));
            break;
        case "member":
            if(current != null)
            {
                String typeName = attr.getValue("type");
                EntityType type;
                try
                {
                    type = EntityType.from(typeName == null ? "" : typeName);
                }
                catch(IllegalArgumentException ex)
                {
                    throw new SAXException(current + ": Invalid member type \"" +
                        typeName + "\"");
                }
                current.addMember(new Member(type, parseLong(attr, "ref", qName),
                    attr.getValue("role")));
            }
            break;
        case "tag":
            if(current != null)
            {
                String key = attr.getValue("k");
                String value = attr.getValue("v");
                if(key == null || value == null)
                {
                    throw new SAXException(current + ": <tag> lacks attribute " +
                        (key == null ? "k" : "v"));
                }
                current.tag(key, value);
            }
            break;
        case "add":
        case "create":
        case "modify":
        case "delete":
            document.markAsChangeDocument(qName);
            break;
        }
    }

    @Override public void endElement (String uri, String localName, String qName)
    {
        switch(qName)
        {
        case "node":
        case "way":
        case "relation":
            if(current != null)
            {
                document.add(current);
                current = null;
            }
            break;
        }
    }
}

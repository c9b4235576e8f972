/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import com.geodesk.upload.model.EntityType;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the `diffResult` document returned by a diffset upload. For each
 * uploaded entity, the server reports its `old_id` and, unless the entity
 * was deleted, its `new_id` and `new_version`.
 */
public class DiffResultReader extends DefaultHandler
{
    private final List<DiffResult> results = new ArrayList<>();
    private boolean inDiffResult;

    public List<DiffResult> read(String xml) throws IOException
    {
        results.clear();
        inDiffResult = false;
        try
        {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            SAXParser parser = factory.newSAXParser();
            parser.parse(new InputSource(new StringReader(xml)), this);
        }
        catch(SAXException | ParserConfigurationException ex)
        {
            throw new IOException("Invalid diff result (%s)".formatted(ex.getMessage()), ex);
        }
        return new ArrayList<>(results);
    }

    @Override public void startElement(String uri, String localName,
        String qName, Attributes attr) throws SAXException
    {
        if(!inDiffResult)
        {
            if(!qName.equals("diffResult"))
            {
                throw new SAXException("Expected <diffResult>, not <" + qName + ">");
            }
            inDiffResult = true;
            return;
        }
        EntityType type;
        try
        {
            type = EntityType.from(qName);
        }
        catch(IllegalArgumentException ex)
        {
            throw new SAXException("Unexpected element <" + qName + ">");
        }
        long oldId = parseId(attr, "old_id", qName);
        String newId = attr.getValue("new_id");
        if(newId == null)
        {
            results.add(DiffResult.deleted(type, oldId));
            return;
        }
        String newVersion = attr.getValue("new_version");
        try
        {
            results.add(DiffResult.mapped(type, oldId, Long.parseLong(newId),
                newVersion == null ? 0 : Integer.parseInt(newVersion)));
        }
        catch(NumberFormatException ex)
        {
            throw new SAXException("Invalid new_id/new_version in <" + qName + ">");
        }
    }

    private static long parseId(Attributes attr, String name, String element) throws SAXException
    {
        String value = attr.getValue(name);
        if(value == null) throw new SAXException("<" + element + "> lacks " + name);
        try
        {
            return Long.parseLong(value);
        }
        catch(NumberFormatException ex)
        {
            throw new SAXException("Invalid " + name + " in <" + element + ">: " + value);
        }
    }
}

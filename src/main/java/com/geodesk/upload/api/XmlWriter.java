/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A minimal streaming XML writer that produces indented output. Elements
 * without children are written as empty-element tags.
 */
public class XmlWriter extends PrintWriter
{
    private final String indentString = "  ";
    private final Deque<String> elements = new ArrayDeque<>();
    private boolean childElements = true;

    public XmlWriter(Writer out)
    {
        super(out);
        println("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
    }

    protected void indent()
    {
        for(int i=0; i<elements.size(); i++) print(indentString);
    }

    public void begin(String tag)
    {
        if(!childElements)
        {
            println(">");
        }
        indent();
        print("<");
        print(tag);
        elements.push(tag);
        childElements = false;
    }

    public void attr(String a, Object v)
    {
        print(' ');
        print(a);
        print("=\"");
        print(escape(v.toString()));
        print('\"');
    }

    public void attr(String a, long v)
    {
        print(' ');
        print(a);
        print("=\"");
        print(v);
        print('\"');
    }

    public void end()
    {
        String tag = elements.pop();
        if(childElements)
        {
            indent();
            print("</");
            print(tag);
            println(">");
        }
        else
        {
            println("/>");
        }
        childElements = true;
    }

    private static boolean needsEscape(String s)
    {
        for(int i=0; i<s.length(); i++)
        {
            char ch = s.charAt(i);
            if(ch == '&' || ch == '<' || ch == '>' || ch == '\"' || ch == '\'' ||
                ch == '\n' || ch == '\r' || ch == '\t')
            {
                return true;
            }
        }
        return false;
    }

    /**
     * Escapes a string for use as an attribute value. Line breaks and tabs
     * are written as character references, since an XML parser would
     * otherwise normalize them to spaces.
     */
    public static String escape(String s)
    {
        if(!needsEscape(s)) return s;
        StringBuilder buf = new StringBuilder(s.length() + 16);
        for(int i=0; i<s.length(); i++)
        {
            char ch = s.charAt(i);
            switch(ch)
            {
            case '&':
                buf.append("&amp;");
                break;
            case '>':
                buf.append("&gt;");
                break;
            case '<':
                buf.append("&lt;");
                break;
            case '\"':
                buf.append("&quot;");
                break;
            case '\'':
                buf.append("&apos;");
                break;
            case '\n':
                buf.append("&#10;");
                break;
            case '\r':
                buf.append("&#13;");
                break;
            case '\t':
                buf.append("&#9;");
                break;
            default:
                buf.append(ch);
                break;
            }
        }
        return buf.toString();
    }
}

/*
 * DavMail POP/IMAP/SMTP/CalDav/LDAP Exchange Gateway
 * Copyright (C) 2009  Mickael Guessant
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License
 * as published by the Free Software Foundation; either version 2
 * of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 51 Franklin Street, Fifth Floor, Boston, MA  02110-1301, USA.
 */
package davcal.util;

import davcal.exception.DavCalException;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;
import org.jdom.output.Format;
import org.jdom.output.XMLOutputter;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * JDOM helpers: parse request bodies, find children by local name, serialize responses.
 * Child lookup ignores namespace and case, clients are not consistent on prefixes.
 */
public final class XmlUtil {

    private XmlUtil() {
    }

    /**
     * Build a SAX builder with DTD processing disabled.
     *
     * @return builder
     */
    private static SAXBuilder createBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
        builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        builder.setExpandEntities(false);
        return builder;
    }

    /**
     * Parse XML content.
     *
     * @param content xml content
     * @return document
     * @throws DavCalException on malformed content
     */
    public static Document parse(String content) throws DavCalException {
        try {
            return createBuilder().build(new StringReader(content));
        } catch (JDOMException e) {
            throw new DavCalException("EXCEPTION_INVALID_XML", e.getMessage());
        } catch (IOException e) {
            throw new DavCalException("EXCEPTION_INVALID_XML", e.getMessage());
        }
    }

    /**
     * Child elements with local name, ignore namespace.
     *
     * @param parent    parent element
     * @param localName local name
     * @return matching children in document order
     */
    public static List<Element> getChildren(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent != null) {
            for (Object child : parent.getChildren()) {
                Element element = (Element) child;
                if (element.getName().equalsIgnoreCase(localName)) {
                    result.add(element);
                }
            }
        }
        return result;
    }

    /**
     * First child element with local name, ignore namespace.
     *
     * @param parent    parent element
     * @param localName local name
     * @return child or null
     */
    public static Element getChild(Element parent, String localName) {
        List<Element> children = getChildren(parent, localName);
        if (children.isEmpty()) {
            return null;
        }
        return children.get(0);
    }

    /**
     * All child elements.
     *
     * @param parent parent element
     * @return children
     */
    public static List<Element> getChildren(Element parent) {
        List<Element> result = new ArrayList<>();
        if (parent != null) {
            for (Object child : parent.getChildren()) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * Serialize document, raw UTF-8 output, text content kept as is.
     *
     * @param document document
     * @return xml content
     */
    public static String toString(Document document) {
        XMLOutputter outputter = new XMLOutputter(Format.getRawFormat().setEncoding("UTF-8"));
        return outputter.outputString(document);
    }

    /**
     * Serialize element, pretty printed for debug logs.
     *
     * @param element element
     * @return xml content
     */
    public static String toPrettyString(Element element) {
        XMLOutputter outputter = new XMLOutputter(Format.getPrettyFormat());
        return outputter.outputString(element);
    }
}

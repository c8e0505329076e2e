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
package davcal.multistatus;

import davcal.property.PropertyCatalog;
import davcal.property.PropertyResult;
import org.apache.commons.httpclient.HttpStatus;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.Namespace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Render one resource's resolved properties as a multistatus document.
 */
public final class MultistatusBuilder {
    /**
     * Propstat group order.
     */
    static final int[] STATUS_ORDER = {
            HttpStatus.SC_OK, HttpStatus.SC_NOT_FOUND, HttpStatus.SC_FORBIDDEN,
            HttpStatus.SC_INTERNAL_SERVER_ERROR, HttpStatus.SC_BAD_REQUEST
    };

    private MultistatusBuilder() {
    }

    /**
     * Status line as sent in d:status, e.g. HTTP/1.1 200 OK.
     *
     * @param status HTTP status code
     * @return status line
     */
    public static String getStatusLine(int status) {
        return "HTTP/1.1 " + status + ' ' + HttpStatus.getStatusText(status);
    }

    /**
     * Create an empty d:multistatus root with every known namespace declared.
     *
     * @return root element
     */
    public static Element createRoot() {
        Element root = new Element("multistatus", PropertyCatalog.DAV);
        for (Namespace namespace : PropertyCatalog.getNamespaces()) {
            if (!namespace.getPrefix().equals(root.getNamespacePrefix())) {
                root.addNamespaceDeclaration(namespace);
            }
        }
        return root;
    }

    /**
     * Build a document for one resource, properties grouped by status.
     *
     * @param href    resource href
     * @param results property outcomes by name
     * @return multistatus document
     */
    public static Document build(String href, Map<String, PropertyResult> results) {
        Map<Integer, List<Element>> groups = new LinkedHashMap<>();
        for (int status : STATUS_ORDER) {
            groups.put(status, new ArrayList<Element>());
        }
        for (Map.Entry<String, PropertyResult> entry : results.entrySet()) {
            PropertyResult result = entry.getValue();
            Element element;
            if (result.isOk()) {
                element = result.getValue().toElement();
            } else {
                element = PropertyCatalog.createElement(entry.getKey());
            }
            List<Element> group = groups.get(result.getStatus());
            if (group == null) {
                group = new ArrayList<>();
                groups.put(result.getStatus(), group);
            }
            group.add(element);
        }
        return buildDocument(href, groups);
    }

    /**
     * Build a propname answer: empty property elements under 200.
     *
     * @param href  resource href
     * @param names property names
     * @return multistatus document
     */
    public static Document buildPropNames(String href, List<String> names) {
        Map<Integer, List<Element>> groups = new LinkedHashMap<>();
        List<Element> elements = new ArrayList<>();
        for (String name : names) {
            elements.add(PropertyCatalog.createElement(name));
        }
        groups.put(HttpStatus.SC_OK, elements);
        return buildDocument(href, groups);
    }

    private static Document buildDocument(String href, Map<Integer, List<Element>> groups) {
        Element response = new Element("response", PropertyCatalog.DAV);
        response.addContent(PropertyCatalog.createElement("href", href));
        for (Map.Entry<Integer, List<Element>> group : groups.entrySet()) {
            if (group.getValue().isEmpty()) {
                continue;
            }
            Element prop = new Element("prop", PropertyCatalog.DAV);
            for (Element element : group.getValue()) {
                prop.addContent(element);
            }
            Element propstat = new Element("propstat", PropertyCatalog.DAV);
            propstat.addContent(prop);
            propstat.addContent(PropertyCatalog.createElement("status", getStatusLine(group.getKey())));
            response.addContent(propstat);
        }
        Element root = createRoot();
        root.addContent(response);
        return new Document(root);
    }

    /**
     * Build a document with a single status for a resource, used for missing multiget hrefs.
     *
     * @param href   resource href
     * @param status HTTP status
     * @return multistatus document
     */
    public static Document buildStatus(String href, int status) {
        Element response = new Element("response", PropertyCatalog.DAV);
        response.addContent(PropertyCatalog.createElement("href", href));
        response.addContent(PropertyCatalog.createElement("status", getStatusLine(status)));
        Element root = createRoot();
        root.addContent(response);
        return new Document(root);
    }
}

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
package davcal.property;

import org.jdom.Element;
import org.jdom.Namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Known WebDAV, CalDAV and vendor extension properties with their fixed namespace prefix.
 */
public final class PropertyCatalog {
    public static final Namespace DAV = Namespace.getNamespace("d", "DAV:");
    public static final Namespace CALDAV = Namespace.getNamespace("cal", "urn:ietf:params:xml:ns:caldav");
    public static final Namespace CALENDARSERVER = Namespace.getNamespace("cs", "http://calendarserver.org/ns/");
    public static final Namespace GOOGLE = Namespace.getNamespace("g", "http://schemas.google.com/gCal/2005");
    public static final Namespace ICAL = Namespace.getNamespace("ical", "http://apple.com/ns/ical/");

    private static final List<Namespace> NAMESPACES;
    private static final List<String> PROPERTY_NAMES = new ArrayList<>();
    private static final Map<String, Namespace> NAMESPACE_BY_NAME = new HashMap<>();

    static {
        List<Namespace> namespaces = new ArrayList<>();
        namespaces.add(DAV);
        namespaces.add(CALDAV);
        namespaces.add(CALENDARSERVER);
        namespaces.add(GOOGLE);
        namespaces.add(ICAL);
        NAMESPACES = Collections.unmodifiableList(namespaces);

        addProperties(DAV, "displayname", "resourcetype", "getetag", "getlastmodified", "getcontenttype",
                "owner", "current-user-principal", "principal-url", "supported-report-set", "acl",
                "current-user-privilege-set", "quota-available-bytes", "quota-used-bytes");
        addProperties(CALDAV, "calendar-description", "calendar-timezone", "calendar-data",
                "supported-calendar-component-set", "supported-calendar-data", "max-resource-size",
                "min-date-time", "max-date-time", "max-instances", "max-attendees-per-instance",
                "calendar-home-set", "schedule-inbox-url", "schedule-outbox-url", "schedule-default-calendar-url",
                "calendar-user-address-set", "calendar-user-type");
        addProperties(CALENDARSERVER, "getctag", "calendar-changes", "shared-url", "invite", "notification-url",
                "auto-schedule", "calendar-proxy-read-for", "calendar-proxy-write-for");
        addProperties(ICAL, "calendar-color");
        addProperties(GOOGLE, "color", "timezone", "hidden", "selected");

        // child elements
        addElements(DAV, "collection", "principal", "href", "grant", "deny", "privilege", "supported-report",
                "report", "ace", "search", "propfind");
        addElements(CALDAV, "calendar", "comp", "calendar-query", "calendar-multiget", "free-busy-query",
                "schedule-query", "schedule-multiget");
    }

    private PropertyCatalog() {
    }

    private static void addProperties(Namespace namespace, String... names) {
        for (String name : names) {
            PROPERTY_NAMES.add(name);
            NAMESPACE_BY_NAME.put(name, namespace);
        }
    }

    private static void addElements(Namespace namespace, String... names) {
        for (String name : names) {
            NAMESPACE_BY_NAME.put(name, namespace);
        }
    }

    /**
     * Namespaces declared on multistatus documents, in declaration order.
     *
     * @return namespaces
     */
    public static List<Namespace> getNamespaces() {
        return NAMESPACES;
    }

    /**
     * Cataloged property names, in catalog order.
     *
     * @return property names
     */
    public static List<String> getPropertyNames() {
        return Collections.unmodifiableList(PROPERTY_NAMES);
    }

    public static boolean isProperty(String name) {
        return PROPERTY_NAMES.contains(name);
    }

    /**
     * Namespace of a property or child element, DAV: when unknown.
     *
     * @param name local name
     * @return namespace
     */
    public static Namespace getNamespace(String name) {
        Namespace namespace = NAMESPACE_BY_NAME.get(name);
        if (namespace == null) {
            return DAV;
        }
        return namespace;
    }

    /**
     * Create an element in its cataloged namespace.
     *
     * @param name local name
     * @return new element
     */
    public static Element createElement(String name) {
        return new Element(name, getNamespace(name));
    }

    /**
     * Create an element with text content.
     *
     * @param name local name
     * @param text text content
     * @return new element
     */
    public static Element createElement(String name, String text) {
        Element element = createElement(name);
        element.setText(text);
        return element;
    }

    /**
     * Create an element holding a single d:href child.
     *
     * @param name local name
     * @param href href value
     * @return new element
     */
    public static Element createHrefElement(String name, String href) {
        Element element = createElement(name);
        element.addContent(createElement("href", href));
        return element;
    }
}

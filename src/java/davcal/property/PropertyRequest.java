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

import davcal.util.XmlUtil;
import org.jdom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Requested properties of a PROPFIND or REPORT body.
 */
public class PropertyRequest {
    /**
     * Request kind.
     */
    public enum Mode {
        PROP, ALLPROP, PROPNAME
    }

    static final List<String> ALLPROP_NAMES = Arrays.asList("resourcetype", "getcontenttype", "displayname");

    private final Mode mode;
    private final List<String> names;

    protected PropertyRequest(Mode mode, List<String> names) {
        this.mode = mode;
        this.names = names;
    }

    /**
     * allprop request, empty body.
     *
     * @return request
     */
    public static PropertyRequest allProp() {
        return new PropertyRequest(Mode.ALLPROP, new ArrayList<>(ALLPROP_NAMES));
    }

    public static PropertyRequest props(List<String> names) {
        return new PropertyRequest(Mode.PROP, new ArrayList<>(names));
    }

    /**
     * Build request from a propfind, calendar-query or calendar-multiget root element.
     *
     * @param root request root element, null for an empty body
     * @return request
     */
    public static PropertyRequest fromElement(Element root) {
        if (root == null) {
            return allProp();
        }
        Element prop = XmlUtil.getChild(root, "prop");
        if (prop != null) {
            return new PropertyRequest(Mode.PROP, getLocalNames(prop));
        }
        if (XmlUtil.getChild(root, "propname") != null) {
            return new PropertyRequest(Mode.PROPNAME, new ArrayList<String>());
        }
        PropertyRequest request = allProp();
        Element include = XmlUtil.getChild(root, "include");
        if (include != null) {
            for (String name : getLocalNames(include)) {
                if (!request.names.contains(name)) {
                    request.names.add(name);
                }
            }
        }
        return request;
    }

    private static List<String> getLocalNames(Element parent) {
        List<String> result = new ArrayList<>();
        for (Element child : XmlUtil.getChildren(parent)) {
            result.add(child.getName().toLowerCase(Locale.ROOT));
        }
        return result;
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * @return lower-cased property names, empty for propname
     */
    public List<String> getNames() {
        return names;
    }

    public boolean isPropName() {
        return mode == Mode.PROPNAME;
    }

    @Override
    public String toString() {
        return mode + " " + names;
    }
}

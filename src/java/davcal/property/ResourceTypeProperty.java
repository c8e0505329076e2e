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

import davcal.resource.ResourceType;
import org.jdom.Element;

import java.util.Locale;

/**
 * resourcetype property, children depend on the resource kind.
 */
public class ResourceTypeProperty implements PropertyValue {
    private final ResourceType type;
    private final String objectType;

    public ResourceTypeProperty(ResourceType type) {
        this(type, null);
    }

    /**
     * @param type       resource kind
     * @param objectType component kind of an object resource, e.g. VEVENT
     */
    public ResourceTypeProperty(ResourceType type, String objectType) {
        this.type = type;
        this.objectType = objectType;
    }

    public String getName() {
        return "resourcetype";
    }

    public ResourceType getType() {
        return type;
    }

    public String getObjectType() {
        return objectType;
    }

    public Element toElement() {
        Element element = PropertyCatalog.createElement(getName());
        switch (type) {
            case PRINCIPAL:
                element.addContent(PropertyCatalog.createElement("principal"));
                break;
            case HOME_SET:
                element.addContent(PropertyCatalog.createElement("collection"));
                element.addContent(new Element("calendar-home-set", PropertyCatalog.CALDAV));
                break;
            case COLLECTION:
                element.addContent(PropertyCatalog.createElement("collection"));
                element.addContent(PropertyCatalog.createElement("calendar"));
                break;
            case OBJECT:
                if (objectType != null && !objectType.isEmpty()) {
                    element.addContent(PropertyCatalog.createElement(objectType.toLowerCase(Locale.ROOT)));
                }
                break;
            default:
                break;
        }
        return element;
    }
}

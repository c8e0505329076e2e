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

import java.util.ArrayList;
import java.util.List;

/**
 * Property holding a list of hrefs: calendar-user-address-set, calendar-proxy-read-for...
 */
public class HrefSetProperty implements PropertyValue {
    private final String name;
    private final List<String> hrefs;

    public HrefSetProperty(String name, List<String> hrefs) {
        this.name = name;
        this.hrefs = new ArrayList<>(hrefs);
    }

    public String getName() {
        return name;
    }

    public List<String> getHrefs() {
        return hrefs;
    }

    public Element toElement() {
        Element element = PropertyCatalog.createElement(name);
        for (String href : hrefs) {
            element.addContent(PropertyCatalog.createElement("href", href));
        }
        return element;
    }
}

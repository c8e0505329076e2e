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
 * current-user-privilege-set property.
 */
public class PrivilegeSetProperty implements PropertyValue {
    private final List<String> privileges;

    public PrivilegeSetProperty(List<String> privileges) {
        this.privileges = new ArrayList<>(privileges);
    }

    public String getName() {
        return "current-user-privilege-set";
    }

    public List<String> getPrivileges() {
        return privileges;
    }

    public Element toElement() {
        Element element = PropertyCatalog.createElement(getName());
        for (String privilege : privileges) {
            element.addContent(createPrivilege(privilege));
        }
        return element;
    }

    static Element createPrivilege(String privilege) {
        Element privilegeElement = PropertyCatalog.createElement("privilege");
        privilegeElement.addContent(PropertyCatalog.createElement(privilege));
        return privilegeElement;
    }
}

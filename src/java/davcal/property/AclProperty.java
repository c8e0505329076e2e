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
import java.util.Collections;
import java.util.List;

/**
 * acl property: list of access control entries.
 */
public class AclProperty implements PropertyValue {
    private final List<Ace> aces;

    /**
     * Access control entry: principal href with granted and denied privileges.
     */
    public static class Ace {
        private final String principal;
        private final List<String> grant;
        private final List<String> deny;

        public Ace(String principal, List<String> grant, List<String> deny) {
            this.principal = principal;
            this.grant = new ArrayList<>(grant);
            this.deny = new ArrayList<>(deny);
        }

        public Ace(String principal, List<String> grant) {
            this(principal, grant, Collections.<String>emptyList());
        }

        public String getPrincipal() {
            return principal;
        }

        public List<String> getGrant() {
            return grant;
        }

        public List<String> getDeny() {
            return deny;
        }

        protected Element toElement() {
            Element aceElement = PropertyCatalog.createElement("ace");
            aceElement.addContent(PropertyCatalog.createHrefElement("principal", principal));
            if (!grant.isEmpty()) {
                aceElement.addContent(createPrivileges("grant", grant));
            }
            if (!deny.isEmpty()) {
                aceElement.addContent(createPrivileges("deny", deny));
            }
            return aceElement;
        }

        private static Element createPrivileges(String name, List<String> privileges) {
            Element element = PropertyCatalog.createElement(name);
            for (String privilege : privileges) {
                element.addContent(PrivilegeSetProperty.createPrivilege(privilege));
            }
            return element;
        }
    }

    public AclProperty(List<Ace> aces) {
        this.aces = new ArrayList<>(aces);
    }

    public String getName() {
        return "acl";
    }

    public List<Ace> getAces() {
        return aces;
    }

    public Element toElement() {
        Element element = PropertyCatalog.createElement(getName());
        for (Ace ace : aces) {
            element.addContent(ace.toElement());
        }
        return element;
    }
}

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

import davcal.util.DateUtil;
import org.jdom.Element;

import java.time.Instant;

/**
 * Date property, getlastmodified uses the HTTP date format, CalDAV limits use RFC 3339.
 */
public class DateProperty implements PropertyValue {
    private final String name;
    private final Instant value;
    private final boolean httpDate;

    protected DateProperty(String name, Instant value, boolean httpDate) {
        this.name = name;
        this.value = value;
        this.httpDate = httpDate;
    }

    public static DateProperty lastModified(Instant value) {
        return new DateProperty("getlastmodified", value, true);
    }

    public static DateProperty rfc3339(String name, Instant value) {
        return new DateProperty(name, value, false);
    }

    public String getName() {
        return name;
    }

    public Instant getValue() {
        return value;
    }

    public Element toElement() {
        return PropertyCatalog.createElement(name, httpDate ? DateUtil.formatHttpDate(value) : DateUtil.formatRfc3339(value));
    }
}

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
package davcal.storage;

import davcal.ical.VObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar object resource: one or more components sharing a UID, without the VCALENDAR wrapper.
 */
public class CalendarObject {
    private String path;
    private String etag;
    private Instant lastModified;
    private final List<VObject> components = new ArrayList<>();

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getEtag() {
        return etag;
    }

    public void setEtag(String etag) {
        this.etag = etag;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }

    /**
     * Components (VEVENT, VTODO...), live list.
     *
     * @return components
     */
    public List<VObject> getComponents() {
        return components;
    }

    /**
     * First component, null for an empty object.
     *
     * @return component
     */
    public VObject getFirstComponent() {
        if (components.isEmpty()) {
            return null;
        }
        return components.get(0);
    }
}

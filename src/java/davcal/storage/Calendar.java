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

import java.util.ArrayList;
import java.util.List;

/**
 * Calendar collection.
 * Display properties live in the VCALENDAR calendar data (NAME, DESCRIPTION, COLOR, VTIMEZONE...).
 */
public class Calendar {
    private String path;
    private String ctag;
    private String etag;
    private VObject calendarData;
    private final List<String> supportedComponents = new ArrayList<>();
    private boolean readOnly;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getCtag() {
        return ctag;
    }

    public void setCtag(String ctag) {
        this.ctag = ctag;
    }

    public String getEtag() {
        return etag;
    }

    public void setEtag(String etag) {
        this.etag = etag;
    }

    public VObject getCalendarData() {
        return calendarData;
    }

    public void setCalendarData(VObject calendarData) {
        this.calendarData = calendarData;
    }

    /**
     * Supported component names (VEVENT, VTODO...), live list.
     *
     * @return component names
     */
    public List<String> getSupportedComponents() {
        return supportedComponents;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /**
     * Copy with an independent component list, calendar data is shared.
     *
     * @return calendar copy
     */
    public Calendar copy() {
        Calendar copy = new Calendar();
        copy.path = path;
        copy.ctag = ctag;
        copy.etag = etag;
        copy.calendarData = calendarData;
        copy.supportedComponents.addAll(supportedComponents);
        copy.readOnly = readOnly;
        return copy;
    }
}

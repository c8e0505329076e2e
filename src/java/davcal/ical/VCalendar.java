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
package davcal.ical;

import davcal.exception.DavCalException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * VCALENDAR wrapper around stored components.
 */
public class VCalendar extends VObject {
    protected VObject firstComponent;

    /**
     * Parse an iCalendar body, bare components get a VCALENDAR wrapper.
     *
     * @param body iCalendar text
     * @throws IOException on invalid content
     */
    public VCalendar(String body) throws IOException {
        super();
        type = "VCALENDAR";
        VObject parsed = new VObject(new ICSBufferedReader(new StringReader(body)));
        if ("VCALENDAR".equals(parsed.getType())) {
            properties.addAll(parsed.getProperties());
            for (VObject vObject : parsed.getVObjects()) {
                addVObject(vObject);
            }
        } else {
            addVObject(parsed);
        }
    }

    /**
     * Empty calendar, optionally with VERSION and PRODID.
     *
     * @param productId  product id
     * @param withHeader add VERSION and PRODID
     */
    public VCalendar(String productId, boolean withHeader) {
        super();
        type = "VCALENDAR";
        if (withHeader) {
            setPropertyValue("VERSION", "2.0");
            setPropertyValue("PRODID", productId);
        }
    }

    /**
     * Wrap stored components, timezones of the calendar data come first.
     *
     * @param productId    product id
     * @param components   object components
     * @param calendarData calendar data holding VTIMEZONE definitions, may be null
     * @return calendar
     */
    public static VCalendar wrap(String productId, List<VObject> components, VObject calendarData) {
        VCalendar vCalendar = new VCalendar(productId, true);
        if (calendarData != null) {
            for (VObject vTimezone : calendarData.getVObjects("VTIMEZONE")) {
                vCalendar.addVObject(vTimezone);
            }
        }
        for (VObject component : components) {
            if ("VCALENDAR".equals(component.getType())) {
                for (VObject vObject : component.getVObjects()) {
                    vCalendar.addVObject(vObject);
                }
            } else {
                vCalendar.addVObject(component);
            }
        }
        return vCalendar;
    }

    @Override
    public void addVObject(VObject vObject) {
        if ("VTIMEZONE".equals(vObject.getType())) {
            // skip duplicate timezone definitions
            String tzid = vObject.getPropertyValue("TZID");
            for (VObject existing : getVObjects("VTIMEZONE")) {
                if (tzid != null && tzid.equals(existing.getPropertyValue("TZID"))) {
                    return;
                }
            }
        } else if (firstComponent == null) {
            firstComponent = vObject;
        }
        super.addVObject(vObject);
    }

    /**
     * Components other than VTIMEZONE.
     *
     * @return components
     */
    public List<VObject> getComponents() {
        List<VObject> result = new ArrayList<>();
        for (VObject vObject : getVObjects()) {
            if (!"VTIMEZONE".equals(vObject.getType())) {
                result.add(vObject);
            }
        }
        return result;
    }

    /**
     * Single component of a calendar object resource.
     *
     * @return component
     * @throws DavCalException when the calendar holds zero or several components
     */
    public VObject getSingleComponent() throws DavCalException {
        List<VObject> components = getComponents();
        if (components.size() != 1) {
            throw new DavCalException("EXCEPTION_INVALID_COMPONENT_COUNT", components.size());
        }
        return components.get(0);
    }

    public VObject getFirstComponent() {
        return firstComponent;
    }
}

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
package davcal;

import davcal.ical.VCalendar;
import davcal.ical.VObject;
import davcal.resource.DefaultPathCodec;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.memory.MemoryStorage;
import junit.framework.TestCase;

import java.io.IOException;

/**
 * DavCal generic test case.
 * Loads default settings and builds calendar fixtures.
 */
public abstract class AbstractDavCalTestCase extends TestCase {
    protected static final String CRLF = "\r\n";

    protected DefaultPathCodec pathCodec;

    @Override
    public void setUp() throws IOException {
        Settings.setDefaultSettings();
        pathCodec = new DefaultPathCodec();
    }

    /**
     * Build a VCALENDAR text around a single component.
     *
     * @param componentType component type, e.g. VEVENT
     * @param lines         component content lines
     * @return ics text
     */
    protected static String calendarText(String componentType, String... lines) {
        StringBuilder buffer = new StringBuilder();
        buffer.append("BEGIN:VCALENDAR").append(CRLF);
        buffer.append("VERSION:2.0").append(CRLF);
        buffer.append("PRODID:-//DavCal//Test//EN").append(CRLF);
        buffer.append("BEGIN:").append(componentType).append(CRLF);
        for (String line : lines) {
            buffer.append(line).append(CRLF);
        }
        buffer.append("END:").append(componentType).append(CRLF);
        buffer.append("END:VCALENDAR").append(CRLF);
        return buffer.toString();
    }

    protected static VObject component(String componentType, String... lines) throws IOException {
        return new VCalendar(calendarText(componentType, lines)).getSingleComponent();
    }

    /**
     * Calendar object holding a single component.
     */
    protected static CalendarObject calendarObject(String path, VObject component) {
        CalendarObject object = new CalendarObject();
        object.setPath(path);
        object.getComponents().add(component);
        return object;
    }

    /**
     * Calendar with a display name, stored under path.
     */
    protected static Calendar calendar(String path, String displayName) {
        Calendar calendar = new Calendar();
        calendar.setPath(path);
        VCalendar calendarData = new VCalendar(Settings.DEFAULT_PRODUCT_ID, true);
        calendarData.setPropertyValue("NAME", displayName);
        calendar.setCalendarData(calendarData);
        return calendar;
    }

    /**
     * In memory storage with user alice (password secret), calendar work and two January 2024 events.
     *
     * @return storage
     * @throws IOException on error
     */
    protected MemoryStorage createStorage() throws IOException {
        MemoryStorage storage = new MemoryStorage(pathCodec);
        storage.registerUser("alice", "Alice Doe", "secret");
        storage.createCalendar("alice", calendar("/alice/cal/work", "Work"));
        storage.updateObject("alice", "work", calendarObject("/alice/cal/work/meeting.ics",
                component("VEVENT", "UID:meeting", "SUMMARY:Team Meeting",
                        "DTSTART:20240115T100000Z", "DTEND:20240115T110000Z")));
        storage.updateObject("alice", "work", calendarObject("/alice/cal/work/review.ics",
                component("VEVENT", "UID:review", "SUMMARY:Code Review",
                        "DTSTART:20240122T140000Z", "DTEND:20240122T150000Z")));
        return storage;
    }

    /**
     * Add user bob (password hunter2) with his own work calendar and one event.
     */
    protected static void addSecondUser(MemoryStorage storage) throws IOException {
        storage.registerUser("bob", "Bob", "hunter2");
        storage.createCalendar("bob", calendar("/bob/cal/work", "Bob Work"));
        storage.updateObject("bob", "work", calendarObject("/bob/cal/work/secret.ics",
                component("VEVENT", "UID:secret", "SUMMARY:Bob Secret",
                        "DTSTART:20240116T100000Z", "DTEND:20240116T110000Z")));
    }
}

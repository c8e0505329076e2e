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

import davcal.AbstractDavCalTestCase;
import davcal.exception.DavCalException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Test calendar parsing, wrapping and folding.
 */
public class VCalendarTest extends AbstractDavCalTestCase {

    public void testParseCalendar() throws IOException {
        VCalendar vCalendar = new VCalendar(calendarText("VEVENT", "UID:1", "SUMMARY:Team Meeting"));
        assertEquals("VCALENDAR", vCalendar.getType());
        assertEquals("2.0", vCalendar.getPropertyValue("VERSION"));
        VObject event = vCalendar.getSingleComponent();
        assertEquals("VEVENT", event.getType());
        assertEquals("Team Meeting", event.getPropertyText("SUMMARY"));
        assertSame(event, vCalendar.getFirstComponent());
    }

    public void testBareComponentIsWrapped() throws IOException {
        VCalendar vCalendar = new VCalendar("BEGIN:VTODO" + CRLF + "UID:todo" + CRLF + "END:VTODO" + CRLF);
        assertEquals("VCALENDAR", vCalendar.getType());
        assertEquals("VTODO", vCalendar.getSingleComponent().getType());
    }

    public void testFoldedLines() throws IOException {
        VCalendar vCalendar = new VCalendar("BEGIN:VCALENDAR" + CRLF + "BEGIN:VEVENT" + CRLF
                + "DESCRIPTION:a long" + CRLF + "  description" + CRLF + "END:VEVENT" + CRLF + "END:VCALENDAR" + CRLF);
        assertEquals("a long description", vCalendar.getSingleComponent().getPropertyValue("DESCRIPTION"));
    }

    public void testLongLinesAreFolded() {
        VObject event = VObject.create("VEVENT");
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            summary.append('x');
        }
        event.setPropertyValue("SUMMARY", summary.toString());
        String ics = event.toString();
        for (String line : ics.split(CRLF)) {
            assertTrue(line.length() <= 75);
        }
        assertTrue(ics.contains(CRLF + " x"));
    }

    public void testTimezonesAreSkipped() throws IOException {
        String body = "BEGIN:VCALENDAR" + CRLF
                + "BEGIN:VTIMEZONE" + CRLF + "TZID:Europe/Paris" + CRLF + "END:VTIMEZONE" + CRLF
                + "BEGIN:VEVENT" + CRLF + "UID:1" + CRLF + "DTSTART;TZID=Europe/Paris:20240115T100000" + CRLF + "END:VEVENT" + CRLF
                + "END:VCALENDAR" + CRLF;
        VCalendar vCalendar = new VCalendar(body);
        assertEquals(1, vCalendar.getComponents().size());
        assertEquals(1, vCalendar.getVObjects("VTIMEZONE").size());
        assertEquals("VEVENT", vCalendar.getFirstComponent().getType());
    }

    public void testSeveralComponents() throws IOException {
        String body = "BEGIN:VCALENDAR" + CRLF
                + "BEGIN:VEVENT" + CRLF + "UID:1" + CRLF + "END:VEVENT" + CRLF
                + "BEGIN:VEVENT" + CRLF + "UID:2" + CRLF + "END:VEVENT" + CRLF
                + "END:VCALENDAR" + CRLF;
        try {
            new VCalendar(body).getSingleComponent();
            fail("Expected DavCalException");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testWrap() throws IOException {
        VObject calendarData = VObject.create("VCALENDAR");
        VObject vTimezone = VObject.create("VTIMEZONE");
        vTimezone.setPropertyValue("TZID", "Europe/Paris");
        calendarData.addVObject(vTimezone);

        List<VObject> components = new ArrayList<>();
        components.add(component("VEVENT", "UID:1"));
        components.add(new VCalendar(calendarText("VTODO", "UID:2")));

        VCalendar vCalendar = VCalendar.wrap("-//Test//EN", components, calendarData);
        assertEquals("-//Test//EN", vCalendar.getPropertyValue("PRODID"));
        assertEquals("2.0", vCalendar.getPropertyValue("VERSION"));
        List<VObject> children = vCalendar.getVObjects();
        assertEquals(3, children.size());
        assertEquals("VTIMEZONE", children.get(0).getType());
        assertEquals("VEVENT", children.get(1).getType());
        assertEquals("VTODO", children.get(2).getType());
    }

    public void testUnterminatedComponent() {
        try {
            new VCalendar("BEGIN:VCALENDAR" + CRLF + "BEGIN:VEVENT" + CRLF + "UID:1" + CRLF);
            fail("Expected DavCalException");
        } catch (IOException e) {
            assertTrue(e instanceof DavCalException);
        }
    }
}

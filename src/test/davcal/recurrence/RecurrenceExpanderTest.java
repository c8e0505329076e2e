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
package davcal.recurrence;

import davcal.AbstractDavCalTestCase;
import davcal.filter.TimeRange;
import davcal.ical.VObject;
import davcal.util.DateUtil;

import java.io.IOException;
import java.time.Instant;

/**
 * Test recurrence instance lookup.
 */
public class RecurrenceExpanderTest extends AbstractDavCalTestCase {

    protected static TimeRange range(String start, String end) {
        return new TimeRange(start == null ? null : DateUtil.parseUtc(start), end == null ? null : DateUtil.parseUtc(end));
    }

    protected static boolean hasInstance(RecurrenceExpander expander, VObject component, String start, String end, TimeRange range)
            throws IOException {
        Instant masterStart = DateUtil.parseUtc(start);
        Instant masterEnd = DateUtil.parseUtc(end);
        return expander.hasInstanceInRange(component, masterStart, masterEnd, range);
    }

    public void testIsRecurring() throws IOException {
        assertTrue(RecurrenceExpander.isRecurring(component("VEVENT", "UID:1", "RRULE:FREQ=DAILY")));
        assertTrue(RecurrenceExpander.isRecurring(component("VEVENT", "UID:1", "RDATE:20240101T100000Z")));
        assertFalse(RecurrenceExpander.isRecurring(component("VEVENT", "UID:1", "EXDATE:20240101T100000Z")));
    }

    public void testDefaultLimitsFromSettings() {
        RecurrenceExpander expander = new RecurrenceExpander();
        assertEquals(RecurrenceExpander.DEFAULT_MAX_OCCURRENCES, expander.getMaxOccurrences());
        assertEquals(RecurrenceExpander.DEFAULT_WINDOW_DAYS, expander.getWindowDays());
    }

    public void testOccurrenceAfterWindow() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 3);
        VObject weekly = component("VEVENT", "UID:1", "DTSTART:20240101T100000Z", "DTEND:20240101T110000Z",
                "RRULE:FREQ=WEEKLY;COUNT=2");
        assertTrue(hasInstance(expander, weekly, "20240101T100000Z", "20240101T110000Z",
                range("20240102T000000Z", "20240301T000000Z")));
        assertFalse(hasInstance(expander, weekly, "20240101T100000Z", "20240101T110000Z",
                range("20240109T000000Z", "20240301T000000Z")));
    }

    public void testExcludedMasterInstance() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 90);
        VObject daily = component("VEVENT", "UID:1", "DTSTART:20240110T100000Z", "DTEND:20240110T110000Z",
                "RRULE:FREQ=DAILY;COUNT=2", "EXDATE:20240110T100000Z");
        assertFalse(hasInstance(expander, daily, "20240110T100000Z", "20240110T110000Z",
                range("20240110T000000Z", "20240111T000000Z")));
    }

    public void testDateOnlyExclusion() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 90);
        VObject daily = component("VEVENT", "UID:1", "DTSTART:20240110T100000Z", "DTEND:20240110T110000Z",
                "RRULE:FREQ=DAILY;COUNT=3", "EXDATE;VALUE=DATE:20240111");
        assertFalse(hasInstance(expander, daily, "20240110T100000Z", "20240110T110000Z",
                range("20240111T000000Z", "20240112T000000Z")));
        assertTrue(hasInstance(expander, daily, "20240110T100000Z", "20240110T110000Z",
                range("20240112T000000Z", "20240113T000000Z")));
    }

    public void testPeriodRecurrenceDate() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 90);
        VObject event = component("VEVENT", "UID:1", "DTSTART:20240101T100000Z", "DTEND:20240101T110000Z",
                "RDATE;VALUE=PERIOD:20240301T100000Z/PT2H");
        assertTrue(hasInstance(expander, event, "20240101T100000Z", "20240101T110000Z",
                range("20240301T113000Z", "20240301T120000Z")));
    }

    public void testOpenEndedRange() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 90);
        VObject yearly = component("VEVENT", "UID:1", "DTSTART:20200101T100000Z", "DTEND:20200101T110000Z",
                "RRULE:FREQ=YEARLY");
        assertTrue(hasInstance(expander, yearly, "20200101T100000Z", "20200101T110000Z",
                range("20240601T000000Z", null)));
    }

    public void testInvalidRecurrenceDateIsIgnored() throws IOException {
        RecurrenceExpander expander = new RecurrenceExpander(100, 90);
        VObject event = component("VEVENT", "UID:1", "DTSTART:20240101T100000Z", "DTEND:20240101T110000Z",
                "RDATE:notadate");
        assertFalse(hasInstance(expander, event, "20240101T100000Z", "20240101T110000Z",
                range("20240301T000000Z", "20240401T000000Z")));
    }
}

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
package davcal.util;

import davcal.exception.DavCalException;
import davcal.ical.VProperty;
import junit.framework.TestCase;

import java.time.Duration;
import java.time.Instant;

/**
 * Test iCalendar date and duration helpers.
 */
public class DateUtilTest extends TestCase {

    public void testParseUtc() {
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), DateUtil.parseUtc("20240115T100000Z"));
        assertEquals("20240115T100000Z", DateUtil.formatUtc(Instant.parse("2024-01-15T10:00:00Z")));
    }

    public void testParseDate() throws DavCalException {
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), DateUtil.parseDate("20240115", null));
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), DateUtil.parseDate("20240115T100000Z", null));
        // floating time is UTC
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), DateUtil.parseDate("20240115T100000", null));
        assertEquals(Instant.parse("2024-01-15T09:00:00Z"), DateUtil.parseDate("20240115T100000", "Europe/Paris"));
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), DateUtil.parseDate("20240115T100000", "Custom/Zone"));
    }

    public void testParseDateProperty() throws DavCalException {
        VProperty property = new VProperty("DTSTART;TZID=America/New_York:20240701T120000");
        assertEquals(Instant.parse("2024-07-01T16:00:00Z"), DateUtil.parseDate(property));
    }

    public void testInvalidDate() {
        try {
            DateUtil.parseDate("2024-01-15", null);
            fail("invalid date parsed");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testIsDateOnly() {
        assertTrue(DateUtil.isDateOnly(new VProperty("DTSTART;VALUE=DATE:20240115")));
        assertTrue(DateUtil.isDateOnly(new VProperty("DTSTART:20240115")));
        assertFalse(DateUtil.isDateOnly(new VProperty("DTSTART:20240115T100000Z")));
    }

    public void testParseDuration() throws DavCalException {
        assertEquals(Duration.ofHours(1), DateUtil.parseDuration("PT1H"));
        assertEquals(Duration.ofDays(14), DateUtil.parseDuration("P2W"));
        assertEquals(Duration.ofDays(1).plusHours(2), DateUtil.parseDuration("P1DT2H"));
        assertEquals(Duration.ofMinutes(-15), DateUtil.parseDuration("-PT15M"));
        try {
            DateUtil.parseDuration("one hour");
            fail("invalid duration parsed");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testFormatHttpDate() {
        assertEquals("Mon, 15 Jan 2024 10:00:00 GMT", DateUtil.formatHttpDate(Instant.parse("2024-01-15T10:00:00Z")));
        assertEquals("2024-01-15T10:00:00Z", DateUtil.formatRfc3339(Instant.parse("2024-01-15T10:00:00Z")));
    }
}

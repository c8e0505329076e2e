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
package davcal.storage.memory;

import davcal.AbstractDavCalTestCase;
import davcal.filter.Filter;
import davcal.filter.TimeRange;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.StorageException;
import davcal.util.DateUtil;

import java.io.IOException;
import java.util.List;

/**
 * Test in memory storage backend.
 */
public class MemoryStorageTest extends AbstractDavCalTestCase {
    protected MemoryStorage storage;

    @Override
    public void setUp() throws IOException {
        super.setUp();
        storage = createStorage();
    }

    public void testAuthUser() throws StorageException {
        assertEquals("alice", storage.authUser("alice", "secret"));
        try {
            storage.authUser("alice", "wrong");
            fail("wrong password accepted");
        } catch (StorageException e) {
            assertEquals(StorageException.Reason.PERMISSION_DENIED, e.getReason());
        }
        try {
            storage.authUser("bob", "secret");
            fail("unknown user accepted");
        } catch (StorageException e) {
            assertEquals(StorageException.Reason.PERMISSION_DENIED, e.getReason());
        }
    }

    public void testUserWithoutPassword() throws StorageException {
        storage.registerUser("guest", null, null);
        assertEquals("guest", storage.authUser("guest", "anything"));
        assertEquals("guest", storage.getUser("guest").getDisplayName());
        assertEquals("/guest", storage.getUser("guest").getPath());
    }

    public void testInvalidUserId() {
        try {
            storage.registerUser("", "Nobody", null);
            fail("empty user id accepted");
        } catch (StorageException e) {
            assertEquals(StorageException.Reason.INVALID_INPUT, e.getReason());
        }
    }

    public void testGetUser() throws StorageException {
        assertEquals("Alice Doe", storage.getUser("alice").getDisplayName());
        assertEquals("mailto:alice@example.com", storage.getUser("alice").getUserAddress());
        try {
            storage.getUser("bob");
            fail("unknown user found");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testGetCalendar() throws StorageException {
        Calendar calendar = storage.getCalendar("alice", "work");
        assertEquals("/alice/cal/work", calendar.getPath());
        assertEquals("Work", calendar.getCalendarData().getPropertyText("NAME"));
        assertNotNull(calendar.getEtag());
        assertEquals(1, calendar.getSupportedComponents().size());
        assertEquals("VEVENT", calendar.getSupportedComponents().get(0));
    }

    public void testCalendarCopyIsIndependent() throws StorageException {
        storage.getCalendar("alice", "work").getSupportedComponents().add("VTODO");
        assertEquals(1, storage.getCalendar("alice", "work").getSupportedComponents().size());
    }

    public void testCreateExistingCalendar() throws StorageException {
        try {
            storage.createCalendar("alice", calendar("/alice/cal/work", "Other"));
            fail("calendar replaced");
        } catch (StorageException e) {
            assertEquals(StorageException.Reason.CONFLICT, e.getReason());
        }
        assertEquals("Work", storage.getCalendar("alice", "work").getCalendarData().getPropertyText("NAME"));
    }

    public void testCreateCalendarForUnknownUser() {
        try {
            storage.createCalendar("bob", calendar("/bob/cal/home", "Home"));
            fail("calendar created for unknown user");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testUserCalendars() throws StorageException {
        storage.createCalendar("alice", calendar("/alice/cal/home", "Home"));
        List<Calendar> calendars = storage.getUserCalendars("alice");
        assertEquals(2, calendars.size());
        assertEquals("/alice/cal/home", calendars.get(0).getPath());
        assertEquals("/alice/cal/work", calendars.get(1).getPath());
    }

    public void testObjectPaths() throws StorageException {
        List<String> paths = storage.getObjectPathsInCollection("alice", "work");
        assertEquals(2, paths.size());
        assertEquals("/alice/cal/work/meeting.ics", paths.get(0));
        assertEquals("/alice/cal/work/review.ics", paths.get(1));
        try {
            storage.getObjectPathsInCollection("alice", "missing");
            fail("missing calendar listed");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testObjectPathsScopedToOwner() throws IOException {
        addSecondUser(storage);
        storage.createCalendar("bob", calendar("/bob/cal/private", "Private"));

        List<String> alicePaths = storage.getObjectPathsInCollection("alice", "work");
        assertEquals(2, alicePaths.size());
        assertFalse(alicePaths.contains("/bob/cal/work/secret.ics"));

        List<String> bobPaths = storage.getObjectPathsInCollection("bob", "work");
        assertEquals(1, bobPaths.size());
        assertEquals("/bob/cal/work/secret.ics", bobPaths.get(0));
        assertEquals(1, storage.getObjectsInCollection("bob", "work").size());

        try {
            storage.getObjectPathsInCollection("alice", "private");
            fail("calendar of another user listed");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testUpdateObjectChangesEtagAndCtag() throws IOException {
        CalendarObject meeting = storage.getObject("alice", "work", "meeting.ics");
        String etag = meeting.getEtag();
        String ctag = storage.getCalendar("alice", "work").getCtag();
        assertNotNull(meeting.getLastModified());

        String newEtag = storage.updateObject("alice", "work", calendarObject("meeting.ics",
                component("VEVENT", "UID:meeting", "SUMMARY:Moved Meeting",
                        "DTSTART:20240116T100000Z", "DTEND:20240116T110000Z")));
        assertFalse(etag.equals(newEtag));
        assertTrue(newEtag.startsWith("\"") && newEtag.endsWith("\""));
        assertFalse(ctag.equals(storage.getCalendar("alice", "work").getCtag()));

        CalendarObject updated = storage.getObject("alice", "work", "meeting.ics");
        assertEquals("/alice/cal/work/meeting.ics", updated.getPath());
        assertEquals(newEtag, updated.getEtag());
        assertEquals("Moved Meeting", updated.getFirstComponent().getPropertyText("SUMMARY"));
    }

    public void testSameContentSameEtag() throws IOException {
        String etag = storage.getObject("alice", "work", "review.ics").getEtag();
        String newEtag = storage.updateObject("alice", "work", calendarObject("/alice/cal/work/review.ics",
                component("VEVENT", "UID:review", "SUMMARY:Code Review",
                        "DTSTART:20240122T140000Z", "DTEND:20240122T150000Z")));
        assertEquals(etag, newEtag);
    }

    public void testDeleteObject() throws StorageException {
        String ctag = storage.getCalendar("alice", "work").getCtag();
        storage.deleteObject("alice", "work", "meeting.ics");
        assertFalse(ctag.equals(storage.getCalendar("alice", "work").getCtag()));
        try {
            storage.getObject("alice", "work", "meeting.ics");
            fail("deleted object found");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
        try {
            storage.deleteObject("alice", "work", "meeting.ics");
            fail("deleted twice");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testReadOnlyCalendar() throws IOException {
        Calendar holidays = calendar("/alice/cal/holidays", "Holidays");
        holidays.setReadOnly(true);
        storage.createCalendar("alice", holidays);
        try {
            storage.updateObject("alice", "holidays", calendarObject("new-year.ics",
                    component("VEVENT", "UID:new-year", "DTSTART;VALUE=DATE:20240101")));
            fail("read only calendar updated");
        } catch (StorageException e) {
            assertEquals(StorageException.Reason.PERMISSION_DENIED, e.getReason());
        }
    }

    public void testGetObjectByFilter() throws StorageException {
        Filter filter = new Filter("VCALENDAR");
        Filter eventFilter = new Filter("VEVENT");
        eventFilter.setTimeRange(new TimeRange(DateUtil.parseUtc("20240120T000000Z"), DateUtil.parseUtc("20240127T000000Z")));
        filter.getChildren().add(eventFilter);

        List<CalendarObject> objects = storage.getObjectByFilter("alice", "work", filter);
        assertEquals(1, objects.size());
        assertEquals("/alice/cal/work/review.ics", objects.get(0).getPath());

        assertEquals(2, storage.getObjectByFilter("alice", "work", null).size());
    }
}

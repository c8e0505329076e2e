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

import davcal.AbstractDavCalTestCase;
import davcal.resource.Resource;
import davcal.resource.ResourceType;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.StorageException;
import davcal.storage.memory.MemoryStorage;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Test per resource type property resolution.
 */
public class ResolverTablesTest extends AbstractDavCalTestCase {
    protected MemoryStorage storage;

    @Override
    public void setUp() throws IOException {
        super.setUp();
        storage = createStorage();
    }

    protected Map<String, PropertyResult> resolve(Resource resource, String... names) {
        PropertyEnvironment environment = new PropertyEnvironment(storage, pathCodec, resource, "alice", null);
        return ResolverTables.resolve(environment, Arrays.asList(names));
    }

    protected static String getText(PropertyResult result) {
        assertTrue(result.toString(), result.isOk());
        return ((TextProperty) result.getValue()).getValue();
    }

    protected static String getHref(PropertyResult result) {
        assertTrue(result.toString(), result.isOk());
        return ((HrefProperty) result.getValue()).getHref();
    }

    public void testServiceRoot() {
        Map<String, PropertyResult> results = resolve(Resource.serviceRoot(),
                "displayname", "current-user-principal", "calendar-home-set", "getetag");
        assertEquals("CalDAV Service Root", getText(results.get("displayname")));
        assertEquals("/alice", getHref(results.get("current-user-principal")));
        assertEquals("/alice/cal", getHref(results.get("calendar-home-set")));
        assertEquals(404, results.get("getetag").getStatus());
    }

    public void testPrincipal() {
        Map<String, PropertyResult> results = resolve(Resource.principal("alice"),
                "displayname", "principal-url", "calendar-user-address-set", "calendar-color", "schedule-inbox-url");
        assertEquals("Alice Doe", getText(results.get("displayname")));
        assertEquals("/alice", getHref(results.get("principal-url")));
        assertEquals(Collections.singletonList("mailto:alice@example.com"),
                ((HrefSetProperty) results.get("calendar-user-address-set").getValue()).getHrefs());
        assertEquals("#4285F4", getText(results.get("calendar-color")));
        assertEquals(404, results.get("schedule-inbox-url").getStatus());
    }

    public void testHomeSet() {
        Map<String, PropertyResult> results = resolve(Resource.homeSet("alice"), "displayname", "resourcetype");
        assertEquals("Calendar Home", getText(results.get("displayname")));
        assertEquals(ResourceType.HOME_SET, ((ResourceTypeProperty) results.get("resourcetype").getValue()).getType());
    }

    public void testCollection() throws StorageException {
        Calendar calendar = storage.getCalendar("alice", "work");
        Map<String, PropertyResult> results = resolve(Resource.collection("alice", "work"),
                "DisplayName", "getctag", "getetag", "calendar-description", "supported-calendar-component-set",
                "supported-report-set");
        assertEquals("Work", getText(results.get("displayname")));
        assertEquals(calendar.getCtag(), getText(results.get("getctag")));
        assertEquals(calendar.getEtag(), getText(results.get("getetag")));
        assertEquals(404, results.get("calendar-description").getStatus());
        assertEquals(Collections.singletonList("VEVENT"),
                ((SupportedComponentSetProperty) results.get("supported-calendar-component-set").getValue()).getComponents());
        assertEquals(Arrays.asList("calendar-query", "calendar-multiget"),
                ((SupportedReportSetProperty) results.get("supported-report-set").getValue()).getReports());
    }

    public void testObject() {
        Map<String, PropertyResult> results = resolve(Resource.object("alice", "work", "meeting.ics"),
                "resourcetype", "getcontenttype", "getlastmodified", "calendar-data", "getctag");
        ResourceTypeProperty resourceType = (ResourceTypeProperty) results.get("resourcetype").getValue();
        assertEquals("VEVENT", resourceType.getObjectType());
        assertEquals("vevent", resourceType.toElement().getChild("vevent", PropertyCatalog.DAV).getName());
        assertEquals("text/calendar", getText(results.get("getcontenttype")));
        assertTrue(results.get("getlastmodified").isOk());
        String ics = ((CalendarDataProperty) results.get("calendar-data").getValue()).getIcs();
        assertTrue(ics.startsWith("BEGIN:VCALENDAR"));
        assertTrue(ics.contains("SUMMARY:Team Meeting"));
        assertEquals(404, results.get("getctag").getStatus());
    }

    public void testMissingObject() {
        Map<String, PropertyResult> results = resolve(Resource.object("alice", "work", "missing.ics"),
                "getetag", "getcontenttype");
        assertEquals(500, results.get("getetag").getStatus());
        assertEquals(200, results.get("getcontenttype").getStatus());
    }

    public void testPreloadedObject() throws IOException {
        CalendarObject preload = calendarObject("/alice/cal/work/draft.ics", component("VTODO", "UID:draft", "SUMMARY:Draft"));
        preload.setEtag("\"draft\"");
        PropertyEnvironment environment = new PropertyEnvironment(storage, pathCodec,
                Resource.object("alice", "work", "draft.ics"), "alice", preload);
        Map<String, PropertyResult> results = ResolverTables.resolve(environment, Arrays.asList("getetag", "getlastmodified"));
        assertEquals("\"draft\"", getText(results.get("getetag")));
        assertEquals(404, results.get("getlastmodified").getStatus());
    }

    public void testFailureStaysLocal() {
        storage = new MemoryStorage(pathCodec) {
            @Override
            public Calendar getCalendar(String userId, String calendarId) throws StorageException {
                throw new StorageException(StorageException.Reason.STORAGE_UNAVAILABLE, "EXCEPTION_CALENDAR_NOT_FOUND", calendarId);
            }
        };
        Map<String, PropertyResult> results = resolve(Resource.collection("alice", "work"),
                "displayname", "resourcetype", "getctag", "unknown");
        assertEquals(PropertyError.INTERNAL, results.get("displayname").getError());
        assertEquals(PropertyError.INTERNAL, results.get("getctag").getError());
        assertEquals(200, results.get("resourcetype").getStatus());
        assertEquals(PropertyError.NOT_FOUND, results.get("unknown").getError());
    }

    public void testDuplicateNames() {
        Map<String, PropertyResult> results = resolve(Resource.homeSet("alice"), "displayname", "DISPLAYNAME");
        assertEquals(1, results.size());
    }

    public void testReadOnlyPrivileges() throws StorageException {
        Calendar holidays = calendar("/alice/cal/holidays", "Holidays");
        holidays.setReadOnly(true);
        storage.createCalendar("alice", holidays);
        Map<String, PropertyResult> results = resolve(Resource.collection("alice", "holidays"), "current-user-privilege-set");
        assertEquals(Collections.singletonList("read"),
                ((PrivilegeSetProperty) results.get("current-user-privilege-set").getValue()).getPrivileges());
        results = resolve(Resource.collection("alice", "work"), "current-user-privilege-set");
        assertEquals(Arrays.asList("read", "write"),
                ((PrivilegeSetProperty) results.get("current-user-privilege-set").getValue()).getPrivileges());
    }

    public void testPropertyNames() {
        List<String> names = ResolverTables.getPropertyNames(ResourceType.COLLECTION);
        assertTrue(names.contains("getctag"));
        assertTrue(names.contains("displayname"));
        assertFalse(names.contains("calendar-data"));
        assertTrue(ResolverTables.getPropertyNames(ResourceType.OBJECT).contains("calendar-data"));
        assertTrue(ResolverTables.getPropertyNames(ResourceType.UNKNOWN).isEmpty());
    }
}

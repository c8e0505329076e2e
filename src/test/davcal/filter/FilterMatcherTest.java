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
package davcal.filter;

import davcal.AbstractDavCalTestCase;
import davcal.recurrence.RecurrenceExpander;
import davcal.storage.CalendarObject;
import davcal.util.DateUtil;

import java.io.IOException;

/**
 * Test calendar-query filter evaluation.
 */
public class FilterMatcherTest extends AbstractDavCalTestCase {
    protected FilterMatcher filterMatcher;

    @Override
    public void setUp() throws IOException {
        super.setUp();
        filterMatcher = new FilterMatcher(new RecurrenceExpander(100, 90));
    }

    protected static Filter eventFilter(String start, String end) {
        Filter eventFilter = new Filter("VEVENT");
        eventFilter.setTimeRange(new TimeRange(start == null ? null : DateUtil.parseUtc(start),
                end == null ? null : DateUtil.parseUtc(end)));
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(eventFilter);
        return filter;
    }

    protected static Filter januaryFilter() {
        return eventFilter("20240101T000000Z", "20240201T000000Z");
    }

    protected CalendarObject event(String... lines) throws IOException {
        return calendarObject("/alice/cal/work/event.ics", component("VEVENT", lines));
    }

    public void testNullFilterMatchesEverything() throws IOException {
        assertTrue(filterMatcher.matches(null, event("UID:1", "DTSTART:20240115T100000Z")));
    }

    public void testTimeRange() throws IOException {
        CalendarObject meeting = event("UID:1", "DTSTART:20240115T100000Z", "DTEND:20240115T110000Z");
        assertTrue(filterMatcher.matches(januaryFilter(), meeting));
        assertFalse(filterMatcher.matches(eventFilter("20240201T000000Z", "20240301T000000Z"), meeting));
    }

    public void testTimeRangeBoundaries() throws IOException {
        CalendarObject meeting = event("UID:1", "DTSTART:20240115T100000Z", "DTEND:20240115T110000Z");
        // end is exclusive on both sides
        assertFalse(filterMatcher.matches(eventFilter("20240115T110000Z", "20240115T120000Z"), meeting));
        assertFalse(filterMatcher.matches(eventFilter("20240115T090000Z", "20240115T100000Z"), meeting));
        assertTrue(filterMatcher.matches(eventFilter("20240115T105959Z", null), meeting));
        assertTrue(filterMatcher.matches(eventFilter(null, "20240115T100001Z"), meeting));
    }

    public void testDuration() throws IOException {
        CalendarObject longMeeting = event("UID:1", "DTSTART:20240115T100000Z", "DURATION:P1DT2H");
        assertTrue(filterMatcher.matches(eventFilter("20240116T110000Z", "20240117T000000Z"), longMeeting));
        assertFalse(filterMatcher.matches(eventFilter("20240116T120000Z", "20240117T000000Z"), longMeeting));
    }

    public void testAllDayEvent() throws IOException {
        CalendarObject holiday = event("UID:1", "DTSTART;VALUE=DATE:20240131");
        assertTrue(filterMatcher.matches(eventFilter("20240131T120000Z", "20240201T120000Z"), holiday));
        assertFalse(filterMatcher.matches(eventFilter("20240201T000000Z", "20240202T000000Z"), holiday));
    }

    public void testComponentTypeMismatch() throws IOException {
        CalendarObject todo = calendarObject("/alice/cal/work/todo.ics",
                component("VTODO", "UID:1", "DTSTART:20240115T100000Z", "DUE:20240116T100000Z"));
        assertFalse(filterMatcher.matches(januaryFilter(), todo));

        Filter todoFilter = new Filter("VTODO");
        todoFilter.setTimeRange(new TimeRange(DateUtil.parseUtc("20240116T000000Z"), DateUtil.parseUtc("20240117T000000Z")));
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(todoFilter);
        assertTrue(filterMatcher.matches(filter, todo));
    }

    public void testWeeklyRecurrence() throws IOException {
        CalendarObject weekly = event("UID:1", "DTSTART:20231204T100000Z", "DTEND:20231204T110000Z",
                "RRULE:FREQ=WEEKLY;COUNT=10");
        assertTrue(filterMatcher.matches(januaryFilter(), weekly));
        assertFalse(filterMatcher.matches(eventFilter("20240301T000000Z", "20240401T000000Z"), weekly));
    }

    public void testUnboundedRecurrence() throws IOException {
        CalendarObject daily = event("UID:1", "DTSTART:20230101T080000Z", "DTEND:20230101T090000Z",
                "RRULE:FREQ=DAILY");
        assertTrue(filterMatcher.matches(eventFilter("20240610T000000Z", "20240611T000000Z"), daily));
    }

    public void testExcludedOccurrence() throws IOException {
        CalendarObject daily = event("UID:1", "DTSTART:20240110T100000Z", "DTEND:20240110T110000Z",
                "RRULE:FREQ=DAILY;COUNT=3", "EXDATE:20240111T100000Z");
        assertFalse(filterMatcher.matches(eventFilter("20240111T000000Z", "20240112T000000Z"), daily));
        assertTrue(filterMatcher.matches(eventFilter("20240112T000000Z", "20240113T000000Z"), daily));
    }

    public void testRecurrenceDate() throws IOException {
        CalendarObject event = event("UID:1", "DTSTART:20240101T100000Z", "DTEND:20240101T110000Z",
                "RDATE:20240301T100000Z");
        assertTrue(filterMatcher.matches(eventFilter("20240301T000000Z", "20240302T000000Z"), event));
        assertFalse(filterMatcher.matches(eventFilter("20240201T000000Z", "20240202T000000Z"), event));
    }

    public void testTextMatch() throws IOException {
        CalendarObject meeting = event("UID:1", "SUMMARY:Team Meeting", "DTSTART:20240115T100000Z");
        Filter eventFilter = new Filter("VEVENT");
        PropFilter summaryFilter = new PropFilter("SUMMARY");
        summaryFilter.setTextMatch(new TextMatch("meeting"));
        eventFilter.getPropFilters().add(summaryFilter);
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(eventFilter);
        assertTrue(filterMatcher.matches(filter, meeting));

        summaryFilter.getTextMatch().setNegate(true);
        assertFalse(filterMatcher.matches(filter, meeting));

        summaryFilter.getTextMatch().setNegate(false);
        summaryFilter.getTextMatch().setCollation("i;octet");
        assertFalse(filterMatcher.matches(filter, meeting));
    }

    public void testPropertyNotDefined() throws IOException {
        CalendarObject meeting = event("UID:1", "SUMMARY:Team Meeting", "DTSTART:20240115T100000Z");
        Filter eventFilter = new Filter("VEVENT");
        PropFilter locationFilter = new PropFilter("LOCATION");
        locationFilter.setNotDefined(true);
        eventFilter.getPropFilters().add(locationFilter);
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(eventFilter);
        assertTrue(filterMatcher.matches(filter, meeting));

        CalendarObject located = event("UID:2", "LOCATION:Room 1", "DTSTART:20240115T100000Z");
        assertFalse(filterMatcher.matches(filter, located));
    }

    public void testParamFilter() throws IOException {
        CalendarObject meeting = event("UID:1", "DTSTART:20240115T100000Z",
                "ATTENDEE;PARTSTAT=ACCEPTED;CN=Bob:mailto:bob@example.com");
        ParamFilter partstatFilter = new ParamFilter("PARTSTAT");
        partstatFilter.setTextMatch(new TextMatch("accepted"));
        PropFilter attendeeFilter = new PropFilter("ATTENDEE");
        attendeeFilter.getParamFilters().add(partstatFilter);
        Filter eventFilter = new Filter("VEVENT");
        eventFilter.getPropFilters().add(attendeeFilter);
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(eventFilter);
        assertTrue(filterMatcher.matches(filter, meeting));

        partstatFilter.getTextMatch().setValue("DECLINED");
        assertFalse(filterMatcher.matches(filter, meeting));
    }

    public void testAllOfAnyOf() throws IOException {
        CalendarObject meeting = event("UID:1", "SUMMARY:Team Meeting", "DTSTART:20240115T100000Z");
        PropFilter summaryFilter = new PropFilter("SUMMARY");
        summaryFilter.setTextMatch(new TextMatch("team"));
        PropFilter locationFilter = new PropFilter("LOCATION");
        Filter eventFilter = new Filter("VEVENT");
        eventFilter.getPropFilters().add(summaryFilter);
        eventFilter.getPropFilters().add(locationFilter);
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(eventFilter);

        assertTrue(filterMatcher.matches(filter, meeting));
        eventFilter.setTest(TestMode.ALLOF);
        assertFalse(filterMatcher.matches(filter, meeting));
    }

    public void testComponentNotDefined() throws IOException {
        Filter todoFilter = new Filter("VTODO");
        todoFilter.setNotDefined(true);
        Filter filter = new Filter("VCALENDAR");
        filter.getChildren().add(todoFilter);
        assertTrue(filterMatcher.matches(filter, event("UID:1", "DTSTART:20240115T100000Z")));
    }

    public void testEmptyObject() {
        CalendarObject empty = new CalendarObject();
        Filter filter = new Filter("VCALENDAR");
        assertFalse(filterMatcher.matches(filter, empty));
        filter.setNotDefined(true);
        assertTrue(filterMatcher.matches(filter, empty));
    }
}

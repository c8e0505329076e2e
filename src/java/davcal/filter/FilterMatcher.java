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

import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.exception.DavCalException;
import davcal.ical.VObject;
import davcal.ical.VProperty;
import davcal.recurrence.RecurrenceExpander;
import davcal.storage.CalendarObject;
import davcal.util.DateUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluate a calendar-query filter against stored calendar objects.
 */
public class FilterMatcher {
    private final RecurrenceExpander recurrenceExpander;

    public FilterMatcher() {
        this(new RecurrenceExpander());
    }

    public FilterMatcher(RecurrenceExpander recurrenceExpander) {
        this.recurrenceExpander = recurrenceExpander;
    }

    /**
     * Check a calendar object against a filter.
     *
     * @param filter filter, null matches everything
     * @param object calendar object
     * @return true on match
     */
    public boolean matches(Filter filter, CalendarObject object) {
        if (filter == null) {
            return true;
        }
        if (object == null || object.getComponents().isEmpty()) {
            return filter.isNotDefined();
        }
        VObject calendar = calendarOf(object);

        String component = filter.getComponent();
        if (component == null || component.isEmpty()) {
            List<VObject> components = calendar.getVObjects();
            if (components.isEmpty()) {
                return filter.isNotDefined();
            }
            return matchNode(filter, components.get(0));
        } else if ("VCALENDAR".equalsIgnoreCase(component)) {
            return matchComponentList(filter, Collections.singletonList(calendar));
        } else {
            return matchComponentList(filter, calendar.getVObjects());
        }
    }

    /**
     * Stored objects hold either a VCALENDAR or its inner components.
     */
    protected VObject calendarOf(CalendarObject object) {
        List<VObject> components = object.getComponents();
        if (components.size() == 1 && "VCALENDAR".equals(components.get(0).getType())) {
            return components.get(0);
        }
        VObject calendar = VObject.create("VCALENDAR");
        for (VObject component : components) {
            calendar.addVObject(component);
        }
        return calendar;
    }

    protected boolean matchComponentList(Filter filter, List<VObject> components) {
        List<VObject> candidates = new ArrayList<>();
        for (VObject component : components) {
            if (component.getType().equalsIgnoreCase(filter.getComponent())) {
                candidates.add(component);
            }
        }
        if (filter.isNotDefined()) {
            return candidates.isEmpty();
        }
        for (VObject candidate : candidates) {
            if (matchNode(filter, candidate)) {
                return true;
            }
        }
        return false;
    }

    protected boolean matchNode(Filter filter, VObject component) {
        if (filter.getTimeRange() != null && !matchTimeRange(filter.getTimeRange(), component)) {
            return false;
        }
        List<Boolean> results = new ArrayList<>();
        for (PropFilter propFilter : filter.getPropFilters()) {
            results.add(matchPropFilter(propFilter, component));
        }
        for (Filter child : filter.getChildren()) {
            results.add(matchComponentList(child, component.getVObjects()));
        }
        return filter.getTest().combine(results);
    }

    protected boolean matchPropFilter(PropFilter propFilter, VObject component) {
        List<VProperty> properties = component.getProperties(propFilter.getName());
        if (propFilter.isNotDefined()) {
            return properties.isEmpty();
        }
        for (VProperty property : properties) {
            boolean textMatches = propFilter.getTextMatch() == null
                    || propFilter.getTextMatch().matches(property.getTextValue());
            if (textMatches && matchParamFilters(propFilter, property)) {
                return true;
            }
        }
        return false;
    }

    protected boolean matchParamFilters(PropFilter propFilter, VProperty property) {
        List<Boolean> results = new ArrayList<>();
        for (ParamFilter paramFilter : propFilter.getParamFilters()) {
            results.add(matchParamFilter(paramFilter, property));
        }
        return propFilter.getTest().combine(results);
    }

    protected boolean matchParamFilter(ParamFilter paramFilter, VProperty property) {
        VProperty.Param param = property.getParam(paramFilter.getName());
        if (paramFilter.isNotDefined()) {
            return param == null;
        }
        if (param == null) {
            return false;
        }
        if (paramFilter.getTextMatch() == null) {
            return true;
        }
        for (String value : param.getValues()) {
            if (paramFilter.getTextMatch().matches(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if any instance of the component overlaps the time range.
     */
    protected boolean matchTimeRange(TimeRange timeRange, VObject component) {
        Instant[] span;
        try {
            span = getInstanceSpan(component);
        } catch (DavCalException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_INVALID_COMPONENT_DATES", component.getType()), e);
            return false;
        }
        if (span == null) {
            return false;
        }
        if (RecurrenceExpander.isRecurring(component)) {
            return recurrenceExpander.hasInstanceInRange(component, span[0], span[1], timeRange);
        }
        return timeRange.overlaps(span[0], span[1]);
    }

    /**
     * Master instance start and end.
     *
     * @param component calendar component
     * @return start and end, null when the component has no date
     * @throws DavCalException on invalid date values
     */
    protected Instant[] getInstanceSpan(VObject component) throws DavCalException {
        VProperty dtstart = component.getProperty("DTSTART");
        VProperty due = "VTODO".equals(component.getType()) ? component.getProperty("DUE") : null;
        if (dtstart == null) {
            if (due == null) {
                return null;
            }
            Instant dueDate = DateUtil.parseDate(due);
            return new Instant[]{dueDate, dueDate};
        }

        Instant start = DateUtil.parseDate(dtstart);
        Instant end;
        VProperty dtend = component.getProperty("DTEND");
        String duration = component.getPropertyValue("DURATION");
        if (dtend != null) {
            end = DateUtil.parseDate(dtend);
            if (DateUtil.isDateOnly(dtstart) && !end.isAfter(start)) {
                end = start.plus(Duration.ofDays(1));
            }
        } else if (duration != null) {
            end = start.plus(DateUtil.parseDuration(duration));
        } else if (DateUtil.isDateOnly(dtstart)) {
            end = start.plus(Duration.ofDays(1));
        } else {
            end = start;
        }

        if (due != null) {
            Instant dueDate = DateUtil.parseDate(due);
            if (dueDate.isAfter(end)) {
                end = dueDate;
            }
        }
        return new Instant[]{start, end};
    }
}

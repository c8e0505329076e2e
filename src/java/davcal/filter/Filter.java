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

import java.util.ArrayList;
import java.util.List;

/**
 * comp-filter element, root of the calendar-query predicate.
 * When notDefined is set every other constraint stays empty.
 */
public class Filter {
    private String component;
    private TestMode test = TestMode.ANYOF;
    private boolean notDefined;
    private TimeRange timeRange;
    private final List<PropFilter> propFilters = new ArrayList<>();
    private final List<Filter> children = new ArrayList<>();

    public Filter() {
    }

    public Filter(String component) {
        this.component = component;
    }

    /**
     * Component name (VCALENDAR, VEVENT...), may be null on a root filter.
     *
     * @return component name
     */
    public String getComponent() {
        return component;
    }

    public void setComponent(String component) {
        this.component = component;
    }

    public TestMode getTest() {
        return test;
    }

    public void setTest(TestMode test) {
        this.test = test;
    }

    public boolean isNotDefined() {
        return notDefined;
    }

    public void setNotDefined(boolean notDefined) {
        this.notDefined = notDefined;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public void setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public List<PropFilter> getPropFilters() {
        return propFilters;
    }

    /**
     * Nested comp-filter elements.
     *
     * @return child filters
     */
    public List<Filter> getChildren() {
        return children;
    }
}

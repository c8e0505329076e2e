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

import davcal.exception.DavCalException;
import davcal.exception.FilterParseException;
import davcal.util.DateUtil;
import davcal.util.XmlUtil;
import org.apache.log4j.Logger;
import org.jdom.Document;
import org.jdom.Element;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Build the filter tree from a calendar-query request.
 */
public final class FilterParser {
    private static final Logger LOGGER = Logger.getLogger(FilterParser.class);

    private FilterParser() {
    }

    /**
     * Parse the filter of a calendar-query body.
     *
     * @param body request body
     * @return filter or null when the query has no filter
     * @throws FilterParseException on malformed xml
     */
    public static Filter parse(String body) throws FilterParseException {
        Document document;
        try {
            document = XmlUtil.parse(body);
        } catch (DavCalException e) {
            throw new FilterParseException("EXCEPTION_INVALID_FILTER", e.getMessage());
        }
        return parseFilterElement(XmlUtil.getChild(document.getRootElement(), "filter"));
    }

    /**
     * Parse a filter element, first comp-filter is the root.
     *
     * @param filterElement filter element, may be null
     * @return filter or null when there is no comp-filter
     */
    public static Filter parseFilterElement(Element filterElement) {
        Element compFilterElement = XmlUtil.getChild(filterElement, "comp-filter");
        if (compFilterElement == null) {
            return null;
        }
        return parseCompFilter(compFilterElement);
    }

    static Filter parseCompFilter(Element element) {
        Filter filter = new Filter(element.getAttributeValue("name"));
        filter.setTest(TestMode.fromValue(element.getAttributeValue("test")));

        // is-not-defined excludes every other constraint
        if (XmlUtil.getChild(element, "is-not-defined") != null) {
            filter.setNotDefined(true);
            return filter;
        }

        Element timeRangeElement = XmlUtil.getChild(element, "time-range");
        if (timeRangeElement != null) {
            filter.setTimeRange(parseTimeRange(timeRangeElement));
        }
        for (Element propFilterElement : XmlUtil.getChildren(element, "prop-filter")) {
            filter.getPropFilters().add(parsePropFilter(propFilterElement));
        }
        for (Element childElement : XmlUtil.getChildren(element, "comp-filter")) {
            filter.getChildren().add(parseCompFilter(childElement));
        }
        return filter;
    }

    static PropFilter parsePropFilter(Element element) {
        PropFilter propFilter = new PropFilter(element.getAttributeValue("name"));
        propFilter.setTest(TestMode.fromValue(element.getAttributeValue("test")));

        if (XmlUtil.getChild(element, "is-not-defined") != null) {
            propFilter.setNotDefined(true);
            return propFilter;
        }

        Element textMatchElement = XmlUtil.getChild(element, "text-match");
        if (textMatchElement != null) {
            propFilter.setTextMatch(parseTextMatch(textMatchElement));
        }
        for (Element paramFilterElement : XmlUtil.getChildren(element, "param-filter")) {
            propFilter.getParamFilters().add(parseParamFilter(paramFilterElement));
        }
        return propFilter;
    }

    static ParamFilter parseParamFilter(Element element) {
        ParamFilter paramFilter = new ParamFilter(element.getAttributeValue("name"));

        if (XmlUtil.getChild(element, "is-not-defined") != null) {
            paramFilter.setNotDefined(true);
            return paramFilter;
        }

        Element textMatchElement = XmlUtil.getChild(element, "text-match");
        if (textMatchElement != null) {
            paramFilter.setTextMatch(parseTextMatch(textMatchElement));
        }
        return paramFilter;
    }

    static TextMatch parseTextMatch(Element element) {
        TextMatch textMatch = new TextMatch(element.getText());
        String collation = element.getAttributeValue("collation");
        if (collation != null) {
            textMatch.setCollation(collation);
        }
        String matchType = element.getAttributeValue("match-type");
        if (matchType != null) {
            textMatch.setMatchType(matchType);
        }
        textMatch.setNegate("yes".equals(element.getAttributeValue("negate-condition")));
        return textMatch;
    }

    static TimeRange parseTimeRange(Element element) {
        return new TimeRange(parseBound(element.getAttributeValue("start")), parseBound(element.getAttributeValue("end")));
    }

    /**
     * Parse a time-range bound, an invalid value leaves the range open on that side.
     */
    private static Instant parseBound(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return DateUtil.parseUtc(value);
        } catch (DateTimeParseException e) {
            LOGGER.debug("Ignoring invalid time-range bound " + value);
            return null;
        }
    }
}

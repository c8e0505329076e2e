/*
 * DavMail POP/IMAP/SMTP/CalDav/LDAP Exchange Gateway
 * Copyright (C) 2010  Mickael Guessant
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

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Date related conversion methods
 */
public final class DateUtil {
    public static final String CALDAV_DATE_TIME = "yyyyMMdd'T'HHmmss";
    public static final String CALDAV_DATE = "yyyyMMdd";

    private static final DateTimeFormatter CALDAV_DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern(CALDAV_DATE_TIME);
    private static final DateTimeFormatter CALDAV_DATE_FORMATTER = DateTimeFormatter.ofPattern(CALDAV_DATE);
    private static final DateTimeFormatter UTC_DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern(CALDAV_DATE_TIME + "'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);

    private DateUtil() {
    }

    /**
     * Parse a compact UTC timestamp, e.g. 20240101T000000Z.
     *
     * @param value timestamp
     * @return instant
     * @throws DateTimeParseException on invalid value
     */
    public static Instant parseUtc(String value) {
        return LocalDateTime.parse(value.trim(), DateTimeFormatter.ofPattern(CALDAV_DATE_TIME + "'Z'")).toInstant(ZoneOffset.UTC);
    }

    /**
     * Format instant as compact UTC timestamp.
     *
     * @param instant date
     * @return formatted value
     */
    public static String formatUtc(Instant instant) {
        return UTC_DATE_TIME_FORMATTER.format(instant);
    }

    /**
     * Format instant as HTTP date (RFC 1123, GMT).
     *
     * @param instant date
     * @return formatted value
     */
    public static String formatHttpDate(Instant instant) {
        return HTTP_DATE_FORMATTER.format(instant);
    }

    /**
     * Format instant as RFC 3339 UTC date.
     *
     * @param instant date
     * @return formatted value
     */
    public static String formatRfc3339(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    /**
     * Check if a DTSTART/DTEND like property holds a date without time.
     *
     * @param property date property
     * @return true for all-day dates
     */
    public static boolean isDateOnly(VProperty property) {
        return property.hasParam("VALUE", "DATE")
                || (property.getValue() != null && property.getValue().trim().length() == 8);
    }

    /**
     * Parse a date property value, honor the TZID parameter.
     *
     * @param property date property
     * @return instant
     * @throws DavCalException on invalid date
     */
    public static Instant parseDate(VProperty property) throws DavCalException {
        return parseDate(property.getValue(), property.getParamValue("TZID"));
    }

    /**
     * Parse an iCalendar date or date-time value.
     * Date only values are midnight UTC, floating and unknown zones are UTC.
     *
     * @param value date value
     * @param tzid  optional timezone id
     * @return instant
     * @throws DavCalException on invalid date
     */
    public static Instant parseDate(String value, String tzid) throws DavCalException {
        if (value == null) {
            throw new DavCalException("EXCEPTION_INVALID_DATE", "null");
        }
        String trimmedValue = value.trim();
        try {
            if (trimmedValue.length() == 8) {
                return LocalDate.parse(trimmedValue, CALDAV_DATE_FORMATTER).atStartOfDay(ZoneOffset.UTC).toInstant();
            } else if (trimmedValue.endsWith("Z")) {
                return LocalDateTime.parse(trimmedValue.substring(0, trimmedValue.length() - 1), CALDAV_DATE_TIME_FORMATTER)
                        .toInstant(ZoneOffset.UTC);
            } else {
                LocalDateTime localDateTime = LocalDateTime.parse(trimmedValue, CALDAV_DATE_TIME_FORMATTER);
                return localDateTime.atZone(getZone(tzid)).toInstant();
            }
        } catch (DateTimeParseException e) {
            throw new DavCalException("EXCEPTION_INVALID_DATE", value);
        }
    }

    private static ZoneId getZone(String tzid) {
        if (tzid != null) {
            try {
                return ZoneId.of(tzid);
            } catch (DateTimeException e) {
                // custom VTIMEZONE ids are not resolved
                return ZoneOffset.UTC;
            }
        }
        return ZoneOffset.UTC;
    }

    /**
     * Parse an RFC 5545 duration, e.g. P1W, P1DT2H, -PT15M.
     *
     * @param value duration value
     * @return duration
     * @throws DavCalException on invalid duration
     */
    public static Duration parseDuration(String value) throws DavCalException {
        if (value == null) {
            throw new DavCalException("EXCEPTION_INVALID_DURATION", "null");
        }
        String trimmedValue = value.trim().toUpperCase(Locale.ROOT);
        try {
            if (trimmedValue.indexOf('W') >= 0) {
                Period period = Period.parse(trimmedValue);
                return Duration.ofDays(period.getDays());
            } else {
                return Duration.parse(trimmedValue);
            }
        } catch (DateTimeParseException e) {
            throw new DavCalException("EXCEPTION_INVALID_DURATION", value);
        }
    }
}

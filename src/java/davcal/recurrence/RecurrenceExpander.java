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

import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.Settings;
import davcal.exception.DavCalException;
import davcal.filter.TimeRange;
import davcal.ical.VObject;
import davcal.ical.VProperty;
import davcal.util.DateUtil;
import net.fortuna.ical4j.model.DateList;
import net.fortuna.ical4j.model.DateTime;
import net.fortuna.ical4j.model.Recur;
import net.fortuna.ical4j.model.parameter.Value;
import org.apache.log4j.Logger;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

/**
 * Check recurring component instances (RRULE, RDATE, EXDATE) against a time range.
 * RRULE expansion relies on ical4j.
 */
public class RecurrenceExpander {
    private static final Logger LOGGER = Logger.getLogger(RecurrenceExpander.class);

    public static final int DEFAULT_MAX_OCCURRENCES = 100;
    public static final int DEFAULT_WINDOW_DAYS = 90;
    static final int UNBOUNDED_YEARS = 10;

    private final int maxOccurrences;
    private final int windowDays;

    /**
     * Create expander with limits from settings.
     */
    public RecurrenceExpander() {
        this(Settings.getIntProperty("davcal.recurrence.maxOccurrences", DEFAULT_MAX_OCCURRENCES),
                Settings.getIntProperty("davcal.recurrence.windowDays", DEFAULT_WINDOW_DAYS));
    }

    public RecurrenceExpander(int maxOccurrences, int windowDays) {
        this.maxOccurrences = maxOccurrences;
        this.windowDays = windowDays;
    }

    public int getMaxOccurrences() {
        return maxOccurrences;
    }

    public int getWindowDays() {
        return windowDays;
    }

    /**
     * Check if a component carries recurrence properties.
     *
     * @param component calendar component
     * @return true with RRULE or RDATE
     */
    public static boolean isRecurring(VObject component) {
        return component.getProperty("RRULE") != null || component.getProperty("RDATE") != null;
    }

    /**
     * Check if any instance of a component overlaps the time range.
     *
     * @param component   calendar component
     * @param masterStart master instance start
     * @param masterEnd   master instance end
     * @param timeRange   time range
     * @return true if at least one non excluded instance overlaps
     */
    public boolean hasInstanceInRange(VObject component, Instant masterStart, Instant masterEnd, TimeRange timeRange) {
        Exclusions exclusions = new Exclusions(component);
        if (timeRange.overlaps(masterStart, masterEnd) && !exclusions.contains(masterStart)) {
            return true;
        }
        Duration duration = Duration.between(masterStart, masterEnd);

        Instant rangeStart = timeRange.getStart() != null ? timeRange.getStart() : masterStart;
        Instant rangeEnd = timeRange.getEnd() != null ? timeRange.getEnd()
                : masterStart.atZone(ZoneOffset.UTC).plusYears(UNBOUNDED_YEARS).toInstant();
        TimeRange clampedRange = new TimeRange(rangeStart, rangeEnd);

        for (VProperty rrule : component.getProperties("RRULE")) {
            if (hasRuleInstanceInRange(rrule.getValue(), masterStart, duration, clampedRange, exclusions)) {
                return true;
            }
        }

        for (VProperty rdate : component.getProperties("RDATE")) {
            for (String value : rdate.getValues()) {
                if (isRDateInRange(value, rdate.getParamValue("TZID"), duration, clampedRange, exclusions)) {
                    return true;
                }
            }
        }
        return false;
    }

    protected boolean hasRuleInstanceInRange(String ruleValue, Instant masterStart, Duration duration,
                                             TimeRange range, Exclusions exclusions) {
        Recur recur;
        try {
            recur = new Recur(ruleValue);
        } catch (ParseException | IllegalArgumentException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_INVALID_RRULE", ruleValue, e.getMessage()));
            return false;
        }

        // an occurrence starting before the range may still end inside it
        Instant periodStart = range.getStart().minus(duration);
        Instant periodEnd = range.getEnd();

        if (windowDays > 0) {
            Instant windowEnd = periodStart.plus(Duration.ofDays(windowDays));
            if (windowEnd.isBefore(periodEnd)) {
                if (hasOccurrenceInPeriod(recur, masterStart, periodStart, windowEnd, duration, range, exclusions)) {
                    return true;
                }
            }
        }
        return hasOccurrenceInPeriod(recur, masterStart, periodStart, periodEnd, duration, range, exclusions);
    }

    protected boolean hasOccurrenceInPeriod(Recur recur, Instant masterStart, Instant periodStart, Instant periodEnd,
                                            Duration duration, TimeRange range, Exclusions exclusions) {
        DateList dates = recur.getDates(toDateTime(masterStart), toDateTime(periodStart), toDateTime(periodEnd),
                Value.DATE_TIME, maxOccurrences);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Expanded " + recur + " between " + periodStart + " and " + periodEnd + ": " + dates.size() + " occurrences");
        }
        for (Object date : dates) {
            Instant occurrenceStart = ((java.util.Date) date).toInstant();
            if (range.overlaps(occurrenceStart, occurrenceStart.plus(duration)) && !exclusions.contains(occurrenceStart)) {
                return true;
            }
        }
        return false;
    }

    protected boolean isRDateInRange(String value, String tzid, Duration duration, TimeRange range, Exclusions exclusions) {
        try {
            Instant start;
            Instant end;
            int slashIndex = value.indexOf('/');
            if (slashIndex > 0) {
                // PERIOD value: start/end or start/duration
                start = DateUtil.parseDate(value.substring(0, slashIndex), tzid);
                String periodEnd = value.substring(slashIndex + 1);
                if (periodEnd.startsWith("P") || periodEnd.startsWith("-") || periodEnd.startsWith("+")) {
                    end = start.plus(DateUtil.parseDuration(periodEnd));
                } else {
                    end = DateUtil.parseDate(periodEnd, tzid);
                }
            } else {
                start = DateUtil.parseDate(value, tzid);
                end = start.plus(duration);
            }
            return range.overlaps(start, end) && !exclusions.contains(start);
        } catch (DavCalException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_INVALID_RDATE", value), e);
            return false;
        }
    }

    private static DateTime toDateTime(Instant instant) {
        DateTime dateTime = new DateTime(instant.toEpochMilli());
        dateTime.setUtc(true);
        return dateTime;
    }

    /**
     * EXDATE values of a component: exact instants and whole days.
     */
    protected static class Exclusions {
        private final Set<Instant> instants = new HashSet<>();
        private final Set<LocalDate> days = new HashSet<>();

        protected Exclusions(VObject component) {
            for (VProperty exdate : component.getProperties("EXDATE")) {
                boolean dateOnly = exdate.hasParam("VALUE", "DATE");
                for (String value : exdate.getValues()) {
                    try {
                        Instant instant = DateUtil.parseDate(value, exdate.getParamValue("TZID"));
                        if (dateOnly || value.trim().length() == 8) {
                            days.add(instant.atZone(ZoneOffset.UTC).toLocalDate());
                        } else {
                            instants.add(instant);
                        }
                    } catch (DavCalException e) {
                        DavGatewayLog.warn(new BundleMessage("LOG_INVALID_EXDATE", value), e);
                    }
                }
            }
        }

        protected boolean contains(Instant instant) {
            return instants.contains(instant) || days.contains(instant.atZone(ZoneOffset.UTC).toLocalDate());
        }
    }
}

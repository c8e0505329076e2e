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

import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.Settings;
import davcal.exception.DavCalException;
import davcal.exception.PathException;
import davcal.ical.VCalendar;
import davcal.ical.VObject;
import davcal.resource.ResourceType;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.StorageException;
import davcal.storage.User;
import davcal.util.DateUtil;
import org.apache.log4j.Logger;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per resource type property resolvers.
 * Each table starts from a copy of the common table and overrides resource specific entries.
 */
public final class ResolverTables {
    private static final Logger LOGGER = Logger.getLogger(ResolverTables.class);

    static final long MAX_RESOURCE_SIZE = 10485760L;
    static final Instant MIN_DATE_TIME = Instant.EPOCH;
    static final Instant MAX_DATE_TIME = ZonedDateTime.of(9999, 12, 31, 23, 59, 59, 0, ZoneOffset.UTC).toInstant();
    static final long MAX_INSTANCES = 100000L;
    static final long MAX_ATTENDEES_PER_INSTANCE = 100L;

    /**
     * Resolver body allowed to fail on storage or path errors.
     */
    private interface StorageResolver {
        PropertyResult resolve(PropertyEnvironment environment) throws DavCalException;
    }

    private static final Map<String, PropertyResolver> COMMON;
    private static final Map<String, PropertyResolver> SERVICE_ROOT;
    private static final Map<String, PropertyResolver> PRINCIPAL;
    private static final Map<String, PropertyResolver> HOME_SET;
    private static final Map<String, PropertyResolver> COLLECTION;
    private static final Map<String, PropertyResolver> OBJECT;

    static {
        COMMON = Collections.unmodifiableMap(buildCommonTable());
        SERVICE_ROOT = Collections.unmodifiableMap(buildServiceRootTable());
        PRINCIPAL = Collections.unmodifiableMap(buildPrincipalTable());
        HOME_SET = Collections.unmodifiableMap(buildHomeSetTable());
        COLLECTION = Collections.unmodifiableMap(buildCollectionTable());
        OBJECT = Collections.unmodifiableMap(buildObjectTable());
    }

    private ResolverTables() {
    }

    /**
     * Resolver table of a resource type, empty for unknown types.
     *
     * @param type resource type
     * @return resolvers by property name
     */
    public static Map<String, PropertyResolver> getTable(ResourceType type) {
        switch (type) {
            case SERVICE_ROOT:
                return SERVICE_ROOT;
            case PRINCIPAL:
                return PRINCIPAL;
            case HOME_SET:
                return HOME_SET;
            case COLLECTION:
                return COLLECTION;
            case OBJECT:
                return OBJECT;
            default:
                return Collections.emptyMap();
        }
    }

    /**
     * Resolve requested properties of the environment resource.
     * Names without resolver are not found, failures stay local to their property.
     *
     * @param environment resolution environment
     * @param names       requested property names
     * @return outcome by lower-cased property name, request order
     */
    public static Map<String, PropertyResult> resolve(PropertyEnvironment environment, Collection<String> names) {
        Map<String, PropertyResolver> table = getTable(environment.getResource().getType());
        Map<String, PropertyResult> results = new LinkedHashMap<>();
        for (String name : names) {
            String key = name.toLowerCase(Locale.ROOT);
            if (results.containsKey(key)) {
                continue;
            }
            PropertyResolver resolver = table.get(key);
            if (resolver == null) {
                results.put(key, PropertyResult.notFound());
            } else {
                results.put(key, resolver.resolve(environment));
            }
        }
        return results;
    }

    /**
     * Cataloged property names with a resolver for this resource type.
     *
     * @param type resource type
     * @return property names, catalog order
     */
    public static List<String> getPropertyNames(ResourceType type) {
        Map<String, PropertyResolver> table = getTable(type);
        List<String> names = new ArrayList<>();
        for (String name : PropertyCatalog.getPropertyNames()) {
            if (table.containsKey(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private static PropertyResolver guarded(final String name, final StorageResolver resolver) {
        return environment -> {
            try {
                return resolver.resolve(environment);
            } catch (PathException e) {
                DavGatewayLog.debug(new BundleMessage("LOG_PROPERTY_HREF_FAILED", name, environment.getResource()), e);
                return PropertyResult.notFound();
            } catch (DavCalException e) {
                DavGatewayLog.warn(new BundleMessage("LOG_PROPERTY_RESOLUTION_FAILED", name, environment.getResource()), e);
                return PropertyResult.error(PropertyError.INTERNAL);
            }
        };
    }

    private static PropertyResolver constant(final PropertyValue value) {
        return environment -> PropertyResult.ok(value);
    }

    private static PropertyResolver notFound() {
        return environment -> PropertyResult.notFound();
    }

    private static PropertyResult textOrNotFound(String name, String value) {
        if (value == null || value.isEmpty()) {
            return PropertyResult.notFound();
        }
        return PropertyResult.ok(new TextProperty(name, value));
    }

    private static PropertyResolver acl(final boolean principalHref) {
        return guarded("acl", environment -> {
            String principal = principalHref ? environment.getPrincipalHref() : environment.getResourceHref();
            List<AclProperty.Ace> aces = new ArrayList<>();
            aces.add(new AclProperty.Ace(principal, environment.getPrivileges()));
            return PropertyResult.ok(new AclProperty(aces));
        });
    }

    private static void putLimits(Map<String, PropertyResolver> table) {
        table.put("max-resource-size", constant(new NumberProperty("max-resource-size", MAX_RESOURCE_SIZE)));
        table.put("min-date-time", constant(DateProperty.rfc3339("min-date-time", MIN_DATE_TIME)));
        table.put("max-date-time", constant(DateProperty.rfc3339("max-date-time", MAX_DATE_TIME)));
        table.put("max-instances", constant(new NumberProperty("max-instances", MAX_INSTANCES)));
        table.put("max-attendees-per-instance", constant(new NumberProperty("max-attendees-per-instance", MAX_ATTENDEES_PER_INSTANCE)));
    }

    private static void putScheduling(Map<String, PropertyResolver> table) {
        // scheduling is not supported
        table.put("schedule-inbox-url", notFound());
        table.put("schedule-outbox-url", notFound());
        table.put("schedule-default-calendar-url", notFound());
    }

    private static Map<String, PropertyResolver> buildCommonTable() {
        Map<String, PropertyResolver> table = new HashMap<>();
        table.put("owner", guarded("owner", environment ->
                PropertyResult.ok(new HrefProperty("owner", environment.getPrincipalHref()))));
        table.put("current-user-principal", guarded("current-user-principal", environment ->
                PropertyResult.ok(new HrefProperty("current-user-principal", environment.getPrincipalHref()))));
        table.put("principal-url", guarded("principal-url", environment ->
                PropertyResult.ok(new HrefProperty("principal-url", environment.getPrincipalHref()))));
        table.put("supported-report-set", constant(new SupportedReportSetProperty(Collections.<String>emptyList())));
        table.put("current-user-privilege-set", guarded("current-user-privilege-set", environment ->
                PropertyResult.ok(new PrivilegeSetProperty(environment.getPrivileges()))));
        table.put("calendar-home-set", guarded("calendar-home-set", environment ->
                PropertyResult.ok(new HrefProperty("calendar-home-set", environment.getHomeSetHref()))));
        table.put("calendar-user-address-set", guarded("calendar-user-address-set", environment -> {
            User user = environment.getUser();
            if (user == null || user.getUserAddress() == null || user.getUserAddress().isEmpty()) {
                return PropertyResult.notFound();
            }
            return PropertyResult.ok(new HrefSetProperty("calendar-user-address-set",
                    Collections.singletonList(user.getUserAddress())));
        }));
        table.put("calendar-user-type", constant(new TextProperty("calendar-user-type", "individual")));
        table.put("hidden", constant(new BooleanProperty("hidden", false)));
        table.put("selected", constant(new BooleanProperty("selected", true)));
        return table;
    }

    private static Map<String, PropertyResolver> buildServiceRootTable() {
        Map<String, PropertyResolver> table = new HashMap<>();
        table.put("displayname", constant(new TextProperty("displayname", "CalDAV Service Root")));
        table.put("current-user-principal", COMMON.get("current-user-principal"));
        table.put("principal-url", COMMON.get("principal-url"));
        table.put("calendar-home-set", COMMON.get("calendar-home-set"));
        table.put("current-user-privilege-set", constant(new PrivilegeSetProperty(
                Arrays.asList("read", "read-acl", "read-current-user-privilege-set"))));
        return table;
    }

    private static PropertyResolver userColor(final String name) {
        return guarded(name, environment -> {
            User user = environment.getUser();
            return textOrNotFound(name, user == null ? null : user.getPreferredColor());
        });
    }

    private static Map<String, PropertyResolver> buildPrincipalTable() {
        Map<String, PropertyResolver> table = new HashMap<>(COMMON);
        table.put("displayname", guarded("displayname", environment -> {
            User user = environment.getUser();
            String name = environment.getUserId();
            if (user != null && user.getDisplayName() != null && !user.getDisplayName().isEmpty()) {
                name = user.getDisplayName();
            }
            return PropertyResult.ok(new TextProperty("displayname", name));
        }));
        table.put("resourcetype", constant(new ResourceTypeProperty(ResourceType.PRINCIPAL)));
        table.put("getcontenttype", notFound());
        table.put("calendar-color", userColor("calendar-color"));
        table.put("color", userColor("color"));
        table.put("timezone", guarded("timezone", environment -> {
            User user = environment.getUser();
            return textOrNotFound("timezone", user == null ? null : user.getPreferredTimezone());
        }));
        table.put("acl", acl(false));
        return table;
    }

    private static Map<String, PropertyResolver> buildHomeSetTable() {
        Map<String, PropertyResolver> table = new HashMap<>(COMMON);
        table.put("displayname", constant(new TextProperty("displayname", "Calendar Home")));
        table.put("resourcetype", constant(new ResourceTypeProperty(ResourceType.HOME_SET)));
        table.put("acl", acl(true));
        table.put("supported-calendar-data", constant(new SupportedCalendarDataProperty("icalendar", "2.0")));
        putLimits(table);
        putScheduling(table);
        return table;
    }

    private static String getCalendarText(Calendar calendar, String propertyName) {
        if (calendar == null || calendar.getCalendarData() == null) {
            return null;
        }
        return calendar.getCalendarData().getPropertyText(propertyName);
    }

    /**
     * TZID of the first VTIMEZONE in calendar data.
     */
    private static String getCalendarTimezoneId(Calendar calendar) {
        if (calendar == null || calendar.getCalendarData() == null) {
            return null;
        }
        List<VObject> vTimezones = calendar.getCalendarData().getVObjects("VTIMEZONE");
        if (vTimezones.isEmpty()) {
            return null;
        }
        return vTimezones.get(0).getPropertyValue("TZID");
    }

    private static PropertyResolver calendarText(final String name, final String propertyName) {
        return guarded(name, environment -> textOrNotFound(name, getCalendarText(environment.getCalendar(), propertyName)));
    }

    private static PropertyResolver calendarTimezone(final String name) {
        return guarded(name, environment -> textOrNotFound(name, getCalendarTimezoneId(environment.getCalendar())));
    }

    private static Map<String, PropertyResolver> buildCollectionTable() {
        Map<String, PropertyResolver> table = new HashMap<>(COMMON);
        table.put("displayname", calendarText("displayname", "NAME"));
        table.put("resourcetype", constant(new ResourceTypeProperty(ResourceType.COLLECTION)));
        table.put("getetag", guarded("getetag", environment ->
                textOrNotFound("getetag", environment.getCalendar().getEtag())));
        table.put("getctag", guarded("getctag", environment ->
                textOrNotFound("getctag", environment.getCalendar().getCtag())));
        table.put("getlastmodified", guarded("getlastmodified", environment -> {
            Calendar calendar = environment.getCalendar();
            if (calendar.getCalendarData() == null || calendar.getCalendarData().getProperty("LAST-MODIFIED") == null) {
                return PropertyResult.notFound();
            }
            return PropertyResult.ok(DateProperty.lastModified(
                    DateUtil.parseDate(calendar.getCalendarData().getProperty("LAST-MODIFIED"))));
        }));
        table.put("getcontenttype", notFound());
        table.put("calendar-description", calendarText("calendar-description", "DESCRIPTION"));
        table.put("calendar-timezone", calendarTimezone("calendar-timezone"));
        table.put("timezone", guarded("timezone", environment -> {
            Calendar calendar = environment.getCalendar();
            String timezone = getCalendarText(calendar, "X-TIMEZONE");
            if (timezone == null || timezone.isEmpty()) {
                timezone = getCalendarTimezoneId(calendar);
            }
            return textOrNotFound("timezone", timezone);
        }));
        table.put("supported-calendar-component-set", guarded("supported-calendar-component-set", environment -> {
            List<String> components = environment.getCalendar().getSupportedComponents();
            if (components.isEmpty()) {
                return PropertyResult.notFound();
            }
            return PropertyResult.ok(new SupportedComponentSetProperty(components));
        }));
        table.put("supported-calendar-data", constant(new SupportedCalendarDataProperty("icalendar", "2.0")));
        table.put("supported-report-set", constant(new SupportedReportSetProperty(
                Arrays.asList("calendar-query", "calendar-multiget"))));
        putLimits(table);
        table.put("calendar-color", calendarText("calendar-color", "COLOR"));
        table.put("color", calendarText("color", "COLOR"));
        table.put("acl", acl(false));
        putScheduling(table);
        return table;
    }

    /**
     * First component of an object, VCALENDAR wrappers are looked through.
     */
    private static VObject getFirstComponent(CalendarObject object) {
        VObject component = object.getFirstComponent();
        if (component != null && "VCALENDAR".equals(component.getType())) {
            for (VObject vObject : component.getVObjects()) {
                if (!"VTIMEZONE".equals(vObject.getType())) {
                    return vObject;
                }
            }
            return null;
        }
        return component;
    }

    private static Map<String, PropertyResolver> buildObjectTable() {
        Map<String, PropertyResolver> table = new HashMap<>(COMMON);
        table.put("displayname", guarded("displayname", environment -> {
            VObject component = getFirstComponent(environment.getObject());
            return textOrNotFound("displayname", component == null ? null : component.getPropertyText("NAME"));
        }));
        table.put("resourcetype", guarded("resourcetype", environment -> {
            VObject component = getFirstComponent(environment.getObject());
            if (component == null) {
                return PropertyResult.notFound();
            }
            return PropertyResult.ok(new ResourceTypeProperty(ResourceType.OBJECT, component.getType()));
        }));
        table.put("getetag", guarded("getetag", environment ->
                textOrNotFound("getetag", environment.getObject().getEtag())));
        table.put("getlastmodified", guarded("getlastmodified", environment -> {
            CalendarObject object = environment.getObject();
            VObject component = getFirstComponent(object);
            if (component != null && component.getProperty("LAST-MODIFIED") != null) {
                return PropertyResult.ok(DateProperty.lastModified(DateUtil.parseDate(component.getProperty("LAST-MODIFIED"))));
            }
            if (object.getLastModified() != null) {
                return PropertyResult.ok(DateProperty.lastModified(object.getLastModified()));
            }
            return PropertyResult.notFound();
        }));
        table.put("getcontenttype", constant(new TextProperty("getcontenttype", "text/calendar")));
        table.put("calendar-description", calendarText("calendar-description", "DESCRIPTION"));
        table.put("calendar-timezone", calendarTimezone("calendar-timezone"));
        table.put("timezone", calendarTimezone("timezone"));
        table.put("calendar-data", guarded("calendar-data", environment -> {
            CalendarObject object = environment.getObject();
            String productId = Settings.getProperty("davcal.productId", Settings.DEFAULT_PRODUCT_ID);
            String ics = VCalendar.wrap(productId, object.getComponents(), null).toString();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("calendar-data of " + environment.getResource() + ": " + ics.length() + " chars");
            }
            return PropertyResult.ok(new CalendarDataProperty(ics));
        }));
        table.put("supported-calendar-data", constant(new SupportedCalendarDataProperty("text/calendar", "2.0")));
        putLimits(table);
        table.put("acl", acl(false));
        table.put("calendar-color", userColor("calendar-color"));
        table.put("color", userColor("color"));
        putScheduling(table);
        return table;
    }
}

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

import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.exception.PathException;
import davcal.filter.Filter;
import davcal.filter.FilterMatcher;
import davcal.ical.VObject;
import davcal.resource.PathCodec;
import davcal.resource.Resource;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.Storage;
import davcal.storage.StorageException;
import davcal.storage.User;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Storage backend keeping users, calendars and objects in memory.
 */
public class MemoryStorage implements Storage {
    private static final Logger LOGGER = Logger.getLogger(MemoryStorage.class);

    static final String DEFAULT_COLOR = "#4285F4";
    static final String DEFAULT_TIMEZONE = "UTC";
    static final String DEFAULT_MAIL_DOMAIN = "example.com";

    private final PathCodec pathCodec;
    private final FilterMatcher filterMatcher;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, UserEntry> users = new TreeMap<>();
    private final AtomicLong ctagSequence = new AtomicLong();

    protected static class UserEntry {
        protected final User user;
        protected final String password;
        protected final Map<String, CalendarEntry> calendars = new TreeMap<>();

        protected UserEntry(User user, String password) {
            this.user = user;
            this.password = password;
        }
    }

    protected static class CalendarEntry {
        protected final Calendar calendar;
        protected final Map<String, CalendarObject> objects = new TreeMap<>();

        protected CalendarEntry(Calendar calendar) {
            this.calendar = calendar;
        }
    }

    public MemoryStorage(PathCodec pathCodec) {
        this(pathCodec, new FilterMatcher());
    }

    public MemoryStorage(PathCodec pathCodec, FilterMatcher filterMatcher) {
        this.pathCodec = pathCodec;
        this.filterMatcher = filterMatcher;
    }

    /**
     * Register a user.
     *
     * @param userId      user id
     * @param displayName display name, user id if null
     * @param password    password, null accepts any password
     * @return registered user
     * @throws StorageException on invalid user id
     */
    public User registerUser(String userId, String displayName, String password) throws StorageException {
        if (userId == null || userId.isEmpty()) {
            throw new StorageException(StorageException.Reason.INVALID_INPUT, "EXCEPTION_INVALID_USER_ID", userId);
        }
        User user = new User();
        user.setDisplayName(displayName != null ? displayName : userId);
        user.setUserAddress("mailto:" + userId + '@' + DEFAULT_MAIL_DOMAIN);
        user.setPreferredColor(DEFAULT_COLOR);
        user.setPreferredTimezone(DEFAULT_TIMEZONE);
        user.setPath(encode(Resource.principal(userId)));

        lock.writeLock().lock();
        try {
            users.put(userId, new UserEntry(user, password));
        } finally {
            lock.writeLock().unlock();
        }
        DavGatewayLog.debug(new BundleMessage("LOG_USER_REGISTERED", userId));
        return user;
    }

    public List<CalendarObject> getObjectsInCollection(String userId, String calendarId) throws StorageException {
        lock.readLock().lock();
        try {
            return new ArrayList<>(getCalendarEntry(userId, calendarId).objects.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getObjectPathsInCollection(String userId, String calendarId) throws StorageException {
        List<String> result = new ArrayList<>();
        for (CalendarObject object : getObjectsInCollection(userId, calendarId)) {
            result.add(object.getPath());
        }
        return result;
    }

    public List<Calendar> getUserCalendars(String userId) throws StorageException {
        lock.readLock().lock();
        try {
            List<Calendar> result = new ArrayList<>();
            for (CalendarEntry calendarEntry : getUserEntry(userId).calendars.values()) {
                result.add(calendarEntry.calendar.copy());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public User getUser(String userId) throws StorageException {
        lock.readLock().lock();
        try {
            return getUserEntry(userId).user;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String authUser(String username, String password) throws StorageException {
        lock.readLock().lock();
        try {
            UserEntry userEntry = users.get(username);
            if (userEntry == null || (userEntry.password != null && !userEntry.password.equals(password))) {
                throw new StorageException(StorageException.Reason.PERMISSION_DENIED, "EXCEPTION_AUTHENTICATION_FAILED", username);
            }
            return username;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Calendar getCalendar(String userId, String calendarId) throws StorageException {
        lock.readLock().lock();
        try {
            return getCalendarEntry(userId, calendarId).calendar.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CalendarObject getObject(String userId, String calendarId, String objectId) throws StorageException {
        lock.readLock().lock();
        try {
            CalendarObject object = getCalendarEntry(userId, calendarId).objects.get(objectId);
            if (object == null) {
                throw new StorageException(StorageException.Reason.NOT_FOUND, "EXCEPTION_OBJECT_NOT_FOUND", objectId);
            }
            return object;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CalendarObject> getObjectByFilter(String userId, String calendarId, Filter filter) throws StorageException {
        lock.readLock().lock();
        try {
            List<CalendarObject> result = new ArrayList<>();
            for (CalendarObject object : getCalendarEntry(userId, calendarId).objects.values()) {
                if (filterMatcher.matches(filter, object)) {
                    result.add(object);
                }
            }
            LOGGER.debug("Filter matched " + result.size() + " objects in " + userId + '/' + calendarId);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String updateObject(String userId, String calendarId, CalendarObject object) throws StorageException {
        String objectId = getLastSegment(object.getPath());
        if (objectId == null) {
            throw new StorageException(StorageException.Reason.INVALID_INPUT, "EXCEPTION_INVALID_OBJECT_PATH", object.getPath());
        }
        lock.writeLock().lock();
        try {
            CalendarEntry calendarEntry = getCalendarEntry(userId, calendarId);
            if (calendarEntry.calendar.isReadOnly()) {
                throw new StorageException(StorageException.Reason.PERMISSION_DENIED, "EXCEPTION_CALENDAR_READ_ONLY", calendarId);
            }
            object.setPath(encode(Resource.object(userId, calendarId, objectId)));
            object.setEtag(generateEtag(object));
            object.setLastModified(Instant.now());
            calendarEntry.objects.put(objectId, object);
            calendarEntry.calendar.setCtag(nextCtag());
            return object.getEtag();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void deleteObject(String userId, String calendarId, String objectId) throws StorageException {
        lock.writeLock().lock();
        try {
            CalendarEntry calendarEntry = getCalendarEntry(userId, calendarId);
            if (calendarEntry.calendar.isReadOnly()) {
                throw new StorageException(StorageException.Reason.PERMISSION_DENIED, "EXCEPTION_CALENDAR_READ_ONLY", calendarId);
            }
            if (calendarEntry.objects.remove(objectId) == null) {
                throw new StorageException(StorageException.Reason.NOT_FOUND, "EXCEPTION_OBJECT_NOT_FOUND", objectId);
            }
            calendarEntry.calendar.setCtag(nextCtag());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void createCalendar(String userId, Calendar calendar) throws StorageException {
        String calendarId = getLastSegment(calendar.getPath());
        if (calendarId == null) {
            throw new StorageException(StorageException.Reason.INVALID_INPUT, "EXCEPTION_INVALID_CALENDAR_PATH", calendar.getPath());
        }
        lock.writeLock().lock();
        try {
            UserEntry userEntry = getUserEntry(userId);
            if (userEntry.calendars.containsKey(calendarId)) {
                throw new StorageException(StorageException.Reason.CONFLICT, "EXCEPTION_CALENDAR_EXISTS", calendarId);
            }
            if (calendar.getCalendarData() == null) {
                calendar.setCalendarData(VObject.create("VCALENDAR"));
            }
            if (calendar.getSupportedComponents().isEmpty()) {
                calendar.getSupportedComponents().add("VEVENT");
            }
            calendar.setPath(encode(Resource.collection(userId, calendarId)));
            String ctag = nextCtag();
            calendar.setCtag(ctag);
            calendar.setEtag('"' + DigestUtils.sha1Hex(calendar.getPath() + ctag) + '"');
            userEntry.calendars.put(calendarId, new CalendarEntry(calendar));
        } finally {
            lock.writeLock().unlock();
        }
        DavGatewayLog.debug(new BundleMessage("LOG_CALENDAR_CREATED", userId, calendarId));
    }

    protected UserEntry getUserEntry(String userId) throws StorageException {
        UserEntry userEntry = users.get(userId);
        if (userEntry == null) {
            throw new StorageException(StorageException.Reason.NOT_FOUND, "EXCEPTION_USER_NOT_FOUND", userId);
        }
        return userEntry;
    }

    protected CalendarEntry getCalendarEntry(String userId, String calendarId) throws StorageException {
        CalendarEntry calendarEntry = getUserEntry(userId).calendars.get(calendarId);
        if (calendarEntry == null) {
            throw new StorageException(StorageException.Reason.NOT_FOUND, "EXCEPTION_CALENDAR_NOT_FOUND", calendarId);
        }
        return calendarEntry;
    }

    protected String nextCtag() {
        return String.valueOf(ctagSequence.incrementAndGet());
    }

    /**
     * Quoted SHA-1 of the object text.
     */
    protected static String generateEtag(CalendarObject object) {
        StringBuilder buffer = new StringBuilder();
        for (VObject component : object.getComponents()) {
            buffer.append(component.toString());
        }
        return '"' + DigestUtils.sha1Hex(buffer.toString().getBytes(StandardCharsets.UTF_8)) + '"';
    }

    protected static String getLastSegment(String path) {
        if (path == null) {
            return null;
        }
        String value = path;
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        int slashIndex = value.lastIndexOf('/');
        String segment = value.substring(slashIndex + 1);
        return segment.isEmpty() ? null : segment;
    }

    protected String encode(Resource resource) throws StorageException {
        try {
            return pathCodec.encodePath(resource);
        } catch (PathException e) {
            throw new StorageException(StorageException.Reason.INVALID_INPUT, "EXCEPTION_INVALID_PATH", e.getMessage());
        }
    }
}

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
package davcal.storage;

import davcal.filter.Filter;

import java.util.List;

/**
 * Calendar storage backend.
 * Every call may fail with a StorageException, NOT_FOUND tells a missing record.
 */
public interface Storage {

    /**
     * Objects of a calendar collection.
     *
     * @param userId     calendar owner
     * @param calendarId calendar id
     * @return calendar objects
     * @throws StorageException on error
     */
    List<CalendarObject> getObjectsInCollection(String userId, String calendarId) throws StorageException;

    /**
     * Object paths of a calendar collection.
     *
     * @param userId     calendar owner
     * @param calendarId calendar id
     * @return object paths, as accepted by the path codec
     * @throws StorageException on error
     */
    List<String> getObjectPathsInCollection(String userId, String calendarId) throws StorageException;

    /**
     * Calendars of a user.
     *
     * @param userId user id
     * @return calendars
     * @throws StorageException on error
     */
    List<Calendar> getUserCalendars(String userId) throws StorageException;

    /**
     * @param userId user id
     * @return user
     * @throws StorageException on error
     */
    User getUser(String userId) throws StorageException;

    /**
     * Check credentials.
     *
     * @param username login
     * @param password password
     * @return authenticated user id
     * @throws StorageException on invalid credentials or error
     */
    String authUser(String username, String password) throws StorageException;

    /**
     * @param userId     user id
     * @param calendarId calendar id
     * @return calendar
     * @throws StorageException on error
     */
    Calendar getCalendar(String userId, String calendarId) throws StorageException;

    /**
     * @param userId     user id
     * @param calendarId calendar id
     * @param objectId   object id
     * @return calendar object
     * @throws StorageException on error
     */
    CalendarObject getObject(String userId, String calendarId, String objectId) throws StorageException;

    /**
     * Objects of a calendar matching a calendar-query filter.
     *
     * @param userId     user id
     * @param calendarId calendar id
     * @param filter     filter, null matches every object
     * @return matching objects
     * @throws StorageException on error
     */
    List<CalendarObject> getObjectByFilter(String userId, String calendarId, Filter filter) throws StorageException;

    /**
     * Create or replace an object, the object path names the target.
     *
     * @param userId     user id
     * @param calendarId calendar id
     * @param object     calendar object
     * @return new etag
     * @throws StorageException on error
     */
    String updateObject(String userId, String calendarId, CalendarObject object) throws StorageException;

    /**
     * @param userId     user id
     * @param calendarId calendar id
     * @param objectId   object id
     * @throws StorageException on error
     */
    void deleteObject(String userId, String calendarId, String objectId) throws StorageException;

    /**
     * Create a calendar, the calendar path names the target.
     * Implementations set etag and path on the calendar.
     *
     * @param userId   user id
     * @param calendar calendar
     * @throws StorageException on error
     */
    void createCalendar(String userId, Calendar calendar) throws StorageException;
}

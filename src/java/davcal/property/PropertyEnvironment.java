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

import davcal.exception.PathException;
import davcal.resource.PathCodec;
import davcal.resource.Resource;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.Storage;
import davcal.storage.StorageException;
import davcal.storage.User;
import org.apache.commons.httpclient.URIException;
import org.apache.commons.httpclient.util.URIUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolution environment bound to one resource.
 * Backing records are loaded on first access and kept for the rest of the resolution.
 */
public class PropertyEnvironment {
    private final Storage storage;
    private final PathCodec pathCodec;
    private final Resource resource;
    private final String principalId;
    private final CalendarObject preload;

    private User user;
    private Calendar calendar;
    private CalendarObject object;

    /**
     * Create environment.
     *
     * @param storage     storage backend
     * @param pathCodec   path codec
     * @param resource    resolved resource
     * @param principalId authenticated user, used when the resource has no user (service root)
     * @param preload     object already fetched for this resource, may be null
     */
    public PropertyEnvironment(Storage storage, PathCodec pathCodec, Resource resource, String principalId, CalendarObject preload) {
        this.storage = storage;
        this.pathCodec = pathCodec;
        this.resource = resource;
        this.principalId = principalId;
        this.preload = preload;
    }

    public PropertyEnvironment(Storage storage, PathCodec pathCodec, Resource resource) {
        this(storage, pathCodec, resource, null, null);
    }

    public Resource getResource() {
        return resource;
    }

    /**
     * Resource user, authenticated user when the resource has none.
     *
     * @return user id
     */
    public String getUserId() {
        if (resource.getUserId() != null) {
            return resource.getUserId();
        }
        return principalId;
    }

    public String getResourceHref() throws PathException {
        if (resource.getUri() != null) {
            return encodeHref(resource.getUri());
        }
        return encodeHref(pathCodec.encodePath(resource));
    }

    public String getPrincipalHref() throws PathException {
        return encodeHref(pathCodec.encodePath(Resource.principal(getUserId())));
    }

    public String getHomeSetHref() throws PathException {
        return encodeHref(pathCodec.encodePath(Resource.homeSet(getUserId())));
    }

    /**
     * Escape a decoded path for use in an href element.
     *
     * @param path decoded path
     * @return URL encoded path
     * @throws PathException on encoding failure
     */
    public static String encodeHref(String path) throws PathException {
        try {
            return URIUtil.encodePath(path, "UTF-8");
        } catch (URIException e) {
            throw new PathException("EXCEPTION_INVALID_PATH", path);
        }
    }

    public User getUser() throws StorageException {
        if (user == null) {
            user = storage.getUser(getUserId());
        }
        return user;
    }

    public Calendar getCalendar() throws StorageException {
        if (calendar == null) {
            calendar = storage.getCalendar(resource.getUserId(), resource.getCalendarId());
        }
        return calendar;
    }

    public CalendarObject getObject() throws StorageException {
        if (object == null) {
            if (preload != null) {
                object = preload;
            } else {
                object = storage.getObject(resource.getUserId(), resource.getCalendarId(), resource.getObjectId());
            }
        }
        return object;
    }

    /**
     * Privileges of the current user, calendar content is read only when the calendar is.
     *
     * @return privilege names
     * @throws StorageException on error
     */
    public List<String> getPrivileges() throws StorageException {
        List<String> privileges = new ArrayList<>();
        privileges.add("read");
        switch (resource.getType()) {
            case COLLECTION:
            case OBJECT:
                Calendar currentCalendar = getCalendar();
                if (currentCalendar != null && !currentCalendar.isReadOnly()) {
                    privileges.add("write");
                }
                break;
            default:
                privileges.add("write");
        }
        return privileges;
    }
}

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
package davcal.resource;

/**
 * Typed resource identity, immutable.
 * The cached uri is not part of the identity.
 */
public final class Resource {
    private final String userId;
    private final String calendarId;
    private final String objectId;
    private final ResourceType type;
    private final String uri;

    private Resource(ResourceType type, String userId, String calendarId, String objectId, String uri) {
        this.type = type;
        this.userId = userId;
        this.calendarId = calendarId;
        this.objectId = objectId;
        this.uri = uri;
    }

    public static Resource serviceRoot() {
        return new Resource(ResourceType.SERVICE_ROOT, null, null, null, null);
    }

    public static Resource principal(String userId) {
        return new Resource(ResourceType.PRINCIPAL, userId, null, null, null);
    }

    public static Resource homeSet(String userId) {
        return new Resource(ResourceType.HOME_SET, userId, null, null, null);
    }

    public static Resource collection(String userId, String calendarId) {
        return new Resource(ResourceType.COLLECTION, userId, calendarId, null, null);
    }

    public static Resource object(String userId, String calendarId, String objectId) {
        return new Resource(ResourceType.OBJECT, userId, calendarId, objectId, null);
    }

    /**
     * Copy with the encoded uri cached.
     *
     * @param uri encoded path
     * @return new resource
     */
    public Resource withUri(String uri) {
        return new Resource(type, userId, calendarId, objectId, uri);
    }

    public String getUserId() {
        return userId;
    }

    public String getCalendarId() {
        return calendarId;
    }

    public String getObjectId() {
        return objectId;
    }

    public ResourceType getType() {
        return type;
    }

    /**
     * Cached uri, null when the resource was not built from a path.
     *
     * @return uri
     */
    public String getUri() {
        return uri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Resource)) {
            return false;
        }
        Resource other = (Resource) o;
        return type == other.type && equalsOrNull(userId, other.userId)
                && equalsOrNull(calendarId, other.calendarId) && equalsOrNull(objectId, other.objectId);
    }

    private static boolean equalsOrNull(String first, String second) {
        return first == null ? second == null : first.equals(second);
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + (userId != null ? userId.hashCode() : 0);
        result = 31 * result + (calendarId != null ? calendarId.hashCode() : 0);
        result = 31 * result + (objectId != null ? objectId.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return type + "{user=" + userId + ", calendar=" + calendarId + ", object=" + objectId + '}';
    }
}

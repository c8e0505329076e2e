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

import davcal.exception.PathException;

import java.util.ArrayList;
import java.util.List;

/**
 * Path layout: /&lt;user&gt;/cal/&lt;calendar&gt;/&lt;object&gt; under an optional prefix.
 */
public class DefaultPathCodec implements PathCodec {
    static final String CALENDAR_SEGMENT = "cal";

    private final String prefix;

    /**
     * Create codec with a path prefix, e.g. /caldav.
     *
     * @param prefix path prefix, null or empty for none
     */
    public DefaultPathCodec(String prefix) {
        this.prefix = normalizePrefix(prefix);
    }

    public DefaultPathCodec() {
        this(null);
    }

    private static String normalizePrefix(String value) {
        if (value == null) {
            return "";
        }
        String result = value.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        if (!result.isEmpty() && !result.startsWith("/")) {
            result = '/' + result;
        }
        return result;
    }

    public String getPrefix() {
        return prefix;
    }

    public Resource parsePath(String path) throws PathException {
        String relativePath = path == null ? "" : path;
        if (!prefix.isEmpty() && (relativePath.equals(prefix) || relativePath.startsWith(prefix + '/'))) {
            relativePath = relativePath.substring(prefix.length());
        }
        List<String> segments = new ArrayList<>();
        for (String segment : relativePath.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }

        Resource resource;
        switch (segments.size()) {
            case 0:
                resource = Resource.serviceRoot();
                break;
            case 1:
                resource = Resource.principal(segments.get(0));
                break;
            case 2:
                checkCalendarSegment(segments);
                resource = Resource.homeSet(segments.get(0));
                break;
            case 3:
                checkCalendarSegment(segments);
                resource = Resource.collection(segments.get(0), segments.get(2));
                break;
            case 4:
                checkCalendarSegment(segments);
                resource = Resource.object(segments.get(0), segments.get(2), segments.get(3));
                break;
            default:
                throw new PathException("EXCEPTION_PATH_TOO_MANY_SEGMENTS", segments.size());
        }
        return resource;
    }

    private void checkCalendarSegment(List<String> segments) throws PathException {
        if (!CALENDAR_SEGMENT.equals(segments.get(1))) {
            throw new PathException("EXCEPTION_PATH_INVALID_LAYOUT", '/' + String.join("/", segments));
        }
    }

    public String encodePath(Resource resource) throws PathException {
        StringBuilder buffer = new StringBuilder(prefix);
        switch (resource.getType()) {
            case SERVICE_ROOT:
                buffer.append('/');
                break;
            case PRINCIPAL:
                requireField(resource, resource.getUserId());
                buffer.append('/').append(resource.getUserId());
                break;
            case HOME_SET:
                requireField(resource, resource.getUserId());
                buffer.append('/').append(resource.getUserId()).append('/').append(CALENDAR_SEGMENT);
                break;
            case COLLECTION:
                requireField(resource, resource.getUserId());
                requireField(resource, resource.getCalendarId());
                buffer.append('/').append(resource.getUserId()).append('/').append(CALENDAR_SEGMENT)
                        .append('/').append(resource.getCalendarId());
                break;
            case OBJECT:
                requireField(resource, resource.getUserId());
                requireField(resource, resource.getCalendarId());
                requireField(resource, resource.getObjectId());
                buffer.append('/').append(resource.getUserId()).append('/').append(CALENDAR_SEGMENT)
                        .append('/').append(resource.getCalendarId()).append('/').append(resource.getObjectId());
                break;
            default:
                throw new PathException("EXCEPTION_PATH_INVALID_RESOURCE_TYPE", resource.getType());
        }
        return buffer.toString();
    }

    private static void requireField(Resource resource, String value) throws PathException {
        if (value == null || value.isEmpty()) {
            throw new PathException("EXCEPTION_PATH_MISSING_FIELD", resource);
        }
    }
}

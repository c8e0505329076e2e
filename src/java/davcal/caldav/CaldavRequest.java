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
package davcal.caldav;

import davcal.BundleMessage;
import davcal.DavGatewayLog;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Decoded HTTP request: method, path, lower-cased headers and body.
 */
public class CaldavRequest {
    /**
     * Depth value of Depth: infinity and of a missing Depth header.
     */
    public static final int DEPTH_INFINITY = Integer.MAX_VALUE;

    protected final String command;
    protected final String path;
    protected final Map<String, String> headers;
    protected final String body;
    protected String userId;

    /**
     * Build a request.
     *
     * @param command HTTP method
     * @param path    decoded request path
     * @param headers request headers, names are lower-cased
     * @param body    request body, may be null
     */
    public CaldavRequest(String command, String path, Map<String, String> headers, String body) {
        this.command = command;
        this.path = path;
        this.headers = new HashMap<>();
        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                this.headers.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
            }
        }
        this.body = body;
    }

    public String getCommand() {
        return command;
    }

    public String getPath() {
        return path;
    }

    public String getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null && body.trim().length() > 0;
    }

    /**
     * Get request header value.
     *
     * @param headerName header name, case insensitive
     * @return header value or null
     */
    public String getHeader(String headerName) {
        return headers.get(headerName.toLowerCase(Locale.ROOT));
    }

    /**
     * Authenticated user id, set once Basic authentication succeeded.
     *
     * @return user id
     */
    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    /**
     * Decode the Depth header: 0, 1 or infinity.
     * A missing header means infinity, an invalid one 0.
     *
     * @return depth
     */
    public int getDepth() {
        String depthValue = getHeader("depth");
        if (depthValue == null) {
            return DEPTH_INFINITY;
        }
        depthValue = depthValue.trim();
        if ("infinity".equalsIgnoreCase(depthValue)) {
            return DEPTH_INFINITY;
        }
        if ("0".equals(depthValue)) {
            return 0;
        }
        if ("1".equals(depthValue)) {
            return 1;
        }
        DavGatewayLog.warn(new BundleMessage("LOG_INVALID_DEPTH", depthValue));
        return 0;
    }

    @Override
    public String toString() {
        return command + ' ' + path + " Depth: " + getHeader("depth");
    }
}

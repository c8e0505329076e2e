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
package davcal.exception;

/**
 * Request level failure carrying the HTTP status sent back to the client.
 */
public class HttpStatusException extends DavCalException {
    private final int statusCode;

    /**
     * Create exception with HTTP status, BundleMessage key and arguments.
     *
     * @param statusCode HTTP status code
     * @param key        message key
     * @param arguments  message values
     */
    public HttpStatusException(int statusCode, String key, Object... arguments) {
        super(key, arguments);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status code for this failure.
     *
     * @return status code
     */
    public int getStatusCode() {
        return statusCode;
    }
}

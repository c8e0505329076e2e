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

/**
 * Outcome of a property resolution: a value or a typed error, never both.
 */
public final class PropertyResult {
    private final PropertyValue value;
    private final PropertyError error;

    private PropertyResult(PropertyValue value, PropertyError error) {
        this.value = value;
        this.error = error;
    }

    public static PropertyResult ok(PropertyValue value) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return new PropertyResult(value, null);
    }

    public static PropertyResult error(PropertyError error) {
        if (error == null) {
            throw new IllegalArgumentException("error is required");
        }
        return new PropertyResult(null, error);
    }

    public static PropertyResult notFound() {
        return error(PropertyError.NOT_FOUND);
    }

    public boolean isOk() {
        return value != null;
    }

    /**
     * @return value, null on error
     */
    public PropertyValue getValue() {
        return value;
    }

    /**
     * @return error, null on success
     */
    public PropertyError getError() {
        return error;
    }

    /**
     * HTTP status of the propstat group holding this result.
     *
     * @return status code
     */
    public int getStatus() {
        return isOk() ? 200 : error.getStatus();
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value.getName() + ')' : "error(" + error + ')';
    }
}

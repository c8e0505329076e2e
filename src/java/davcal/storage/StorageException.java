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

import davcal.exception.DavCalException;

/**
 * Storage backend failure, the reason tells a missing record from other failures.
 */
public class StorageException extends DavCalException {
    /**
     * Failure kinds reported by storage backends.
     */
    public enum Reason {
        NOT_FOUND, INVALID_INPUT, PERMISSION_DENIED, CONFLICT, STORAGE_UNAVAILABLE
    }

    private final Reason reason;

    /**
     * Create storage exception with reason, BundleMessage key and arguments.
     *
     * @param reason    failure kind
     * @param key       message key
     * @param arguments message values
     */
    public StorageException(Reason reason, String key, Object... arguments) {
        super(key, arguments);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isNotFound() {
        return reason == Reason.NOT_FOUND;
    }
}

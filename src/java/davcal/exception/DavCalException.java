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

import davcal.BundleMessage;

import java.io.IOException;

/**
 * Base DavCal failure, message text comes from the davcalmessages bundle.
 * Subclasses tell the HTTP status the handler answers with.
 */
public class DavCalException extends IOException {
    private final BundleMessage message;

    public DavCalException(String key, Object... arguments) {
        this.message = new BundleMessage(key, arguments);
    }

    @Override
    public String getMessage() {
        return message.formatLog();
    }

    /**
     * Unformatted message, for grouping in a BundleMessageList.
     *
     * @return bundle message
     */
    public BundleMessage getBundleMessage() {
        return message;
    }
}

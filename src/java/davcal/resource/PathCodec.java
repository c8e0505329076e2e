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

/**
 * Maps request paths to typed resources and back.
 * Implementations must keep parsePath(encodePath(r)) equal to r.
 */
public interface PathCodec {
    /**
     * Parse a request path.
     *
     * @param path request path, with or without prefix
     * @return resource
     * @throws PathException on path not matching the layout
     */
    Resource parsePath(String path) throws PathException;

    /**
     * Build the path of a resource, prefix included.
     *
     * @param resource resource
     * @return path
     * @throws PathException on missing identity fields
     */
    String encodePath(Resource resource) throws PathException;
}

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

import davcal.exception.DavCalException;
import davcal.storage.Calendar;
import davcal.storage.Storage;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Depth limited expansion of a resource into its descendants, depth first.
 */
public class ResourceWalker {
    private static final Logger LOGGER = Logger.getLogger(ResourceWalker.class);

    private final Storage storage;
    private final PathCodec pathCodec;

    public ResourceWalker(Storage storage, PathCodec pathCodec) {
        this.storage = storage;
        this.pathCodec = pathCodec;
    }

    /**
     * Fail when the current request thread was interrupted.
     *
     * @throws DavCalException on cancelled request
     */
    public static void checkCancelled() throws DavCalException {
        if (Thread.currentThread().isInterrupted()) {
            throw new DavCalException("EXCEPTION_REQUEST_CANCELLED");
        }
    }

    /**
     * Descendants of parent up to depth levels, parent excluded.
     *
     * @param depth  remaining depth, 0 or less returns nothing
     * @param parent parent resource
     * @return descendants in depth first order
     * @throws DavCalException on storage, path or cancellation error
     */
    public List<Resource> fetchChildren(int depth, Resource parent) throws DavCalException {
        if (depth <= 0) {
            return Collections.emptyList();
        }
        checkCancelled();

        List<Resource> resources = new ArrayList<>();
        switch (parent.getType()) {
            case COLLECTION:
                for (String path : storage.getObjectPathsInCollection(parent.getUserId(), parent.getCalendarId())) {
                    addWithChildren(resources, depth, path);
                }
                break;
            case HOME_SET:
                for (Calendar calendar : storage.getUserCalendars(parent.getUserId())) {
                    addWithChildren(resources, depth, calendar.getPath());
                }
                break;
            default:
                // objects and principals are leaves
                break;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Expanded " + parent + " to " + resources.size() + " resources");
        }
        return resources;
    }

    private void addWithChildren(List<Resource> resources, int depth, String path) throws DavCalException {
        Resource child = pathCodec.parsePath(path).withUri(path);
        resources.add(child);
        resources.addAll(fetchChildren(depth - 1, child));
    }
}

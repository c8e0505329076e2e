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

import davcal.AbstractDavCalTestCase;
import davcal.exception.DavCalException;
import davcal.storage.memory.MemoryStorage;

import java.io.IOException;
import java.util.List;

/**
 * Test depth based resource expansion.
 */
public class ResourceWalkerTest extends AbstractDavCalTestCase {
    protected MemoryStorage storage;
    protected ResourceWalker walker;

    @Override
    public void setUp() throws IOException {
        super.setUp();
        storage = createStorage();
        walker = new ResourceWalker(storage, pathCodec);
    }

    public void testDepthZero() throws DavCalException {
        assertTrue(walker.fetchChildren(0, Resource.homeSet("alice")).isEmpty());
    }

    public void testHomeSetDepthOne() throws DavCalException {
        List<Resource> resources = walker.fetchChildren(1, Resource.homeSet("alice"));
        assertEquals(1, resources.size());
        assertEquals(Resource.collection("alice", "work"), resources.get(0));
        assertEquals("/alice/cal/work", resources.get(0).getUri());
    }

    public void testHomeSetDepthInfinity() throws DavCalException {
        List<Resource> resources = walker.fetchChildren(Integer.MAX_VALUE, Resource.homeSet("alice"));
        assertEquals(3, resources.size());
        assertEquals(Resource.collection("alice", "work"), resources.get(0));
        assertEquals(Resource.object("alice", "work", "meeting.ics"), resources.get(1));
        assertEquals(Resource.object("alice", "work", "review.ics"), resources.get(2));
    }

    public void testCollectionChildren() throws DavCalException {
        List<Resource> resources = walker.fetchChildren(1, Resource.collection("alice", "work"));
        assertEquals(2, resources.size());
        assertEquals(ResourceType.OBJECT, resources.get(0).getType());
        assertEquals("/alice/cal/work/meeting.ics", resources.get(0).getUri());
    }

    public void testCollectionChildrenOfOwnerOnly() throws IOException {
        addSecondUser(storage);
        List<Resource> resources = walker.fetchChildren(1, Resource.collection("alice", "work"));
        assertEquals(2, resources.size());
        for (Resource resource : resources) {
            assertEquals("alice", resource.getUserId());
        }

        resources = walker.fetchChildren(Integer.MAX_VALUE, Resource.homeSet("bob"));
        assertEquals(2, resources.size());
        assertEquals(Resource.collection("bob", "work"), resources.get(0));
        assertEquals(Resource.object("bob", "work", "secret.ics"), resources.get(1));
    }

    public void testCollectionOfOtherUserNotExpanded() throws IOException {
        addSecondUser(storage);
        storage.createCalendar("bob", calendar("/bob/cal/private", "Private"));
        try {
            walker.fetchChildren(1, Resource.collection("alice", "private"));
            fail("collection of another user expanded");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testLeaves() throws DavCalException {
        assertTrue(walker.fetchChildren(1, Resource.principal("alice")).isEmpty());
        assertTrue(walker.fetchChildren(1, Resource.object("alice", "work", "meeting.ics")).isEmpty());
        assertTrue(walker.fetchChildren(1, Resource.serviceRoot()).isEmpty());
    }

    public void testMissingCollection() {
        try {
            walker.fetchChildren(1, Resource.collection("alice", "missing"));
            fail("missing collection expanded");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testCancelledRequest() {
        Thread.currentThread().interrupt();
        try {
            walker.fetchChildren(1, Resource.homeSet("alice"));
            fail("cancelled request expanded");
        } catch (DavCalException e) {
            assertNotNull(e.getMessage());
        } finally {
            // clear interrupted flag
            Thread.interrupted();
        }
    }
}

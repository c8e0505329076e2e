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
package davcal;

import davcal.storage.StorageException;
import davcal.storage.memory.MemoryStorage;

import java.io.IOException;

/**
 * Test gateway startup.
 */
public class TestDavGateway extends AbstractDavCalTestCase {

    public void testRegisterUsers() throws StorageException {
        MemoryStorage storage = new MemoryStorage(pathCodec);
        DavGateway.registerUsers(storage, "alice:secret:Alice Doe, bob::Bob,carol, :ignored");
        assertEquals("Alice Doe", storage.getUser("alice").getDisplayName());
        assertEquals("alice", storage.authUser("alice", "secret"));
        assertEquals("Bob", storage.getUser("bob").getDisplayName());
        assertEquals("bob", storage.authUser("bob", "anything"));
        assertEquals("carol", storage.getUser("carol").getDisplayName());
    }

    public void testRegisterNoUsers() throws StorageException {
        MemoryStorage storage = new MemoryStorage(pathCodec);
        DavGateway.registerUsers(storage, null);
        DavGateway.registerUsers(storage, " ");
        try {
            storage.getUser("alice");
            fail("unexpected user");
        } catch (StorageException e) {
            assertTrue(e.isNotFound());
        }
    }

    public void testStartWithoutListener() throws IOException {
        Settings.setProperty("davcal.caldavPort", "0");
        Settings.setProperty("davcal.users", "alice:secret");
        DavGateway.start();
        try {
            assertEquals("alice", DavGateway.getStorage().authUser("alice", "secret"));
        } finally {
            DavGateway.stop();
        }
    }
}

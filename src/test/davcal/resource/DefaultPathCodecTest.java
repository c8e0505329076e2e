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
import junit.framework.TestCase;

/**
 * Test path layout /user/cal/calendar/object.
 */
public class DefaultPathCodecTest extends TestCase {

    public void testParseResourceTypes() throws PathException {
        DefaultPathCodec pathCodec = new DefaultPathCodec();
        assertEquals(Resource.serviceRoot(), pathCodec.parsePath("/"));
        assertEquals(Resource.serviceRoot(), pathCodec.parsePath(""));
        assertEquals(Resource.principal("alice"), pathCodec.parsePath("/alice"));
        assertEquals(Resource.homeSet("alice"), pathCodec.parsePath("/alice/cal/"));
        assertEquals(Resource.collection("alice", "work"), pathCodec.parsePath("/alice/cal/work/"));
        assertEquals(Resource.object("alice", "work", "meeting.ics"), pathCodec.parsePath("/alice/cal/work/meeting.ics"));
    }

    public void testEmptySegmentsAreIgnored() throws PathException {
        DefaultPathCodec pathCodec = new DefaultPathCodec();
        assertEquals(Resource.collection("alice", "work"), pathCodec.parsePath("//alice//cal/work"));
    }

    public void testInvalidLayout() {
        DefaultPathCodec pathCodec = new DefaultPathCodec();
        try {
            pathCodec.parsePath("/alice/calendars/work");
            fail("Expected PathException");
        } catch (PathException e) {
            assertNotNull(e.getMessage());
        }
        try {
            pathCodec.parsePath("/alice/cal/work/meeting.ics/extra");
            fail("Expected PathException");
        } catch (PathException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testEncode() throws PathException {
        DefaultPathCodec pathCodec = new DefaultPathCodec();
        assertEquals("/", pathCodec.encodePath(Resource.serviceRoot()));
        assertEquals("/alice", pathCodec.encodePath(Resource.principal("alice")));
        assertEquals("/alice/cal", pathCodec.encodePath(Resource.homeSet("alice")));
        assertEquals("/alice/cal/work", pathCodec.encodePath(Resource.collection("alice", "work")));
        assertEquals("/alice/cal/work/meeting.ics", pathCodec.encodePath(Resource.object("alice", "work", "meeting.ics")));
    }

    public void testEncodeMissingField() {
        DefaultPathCodec pathCodec = new DefaultPathCodec();
        try {
            pathCodec.encodePath(Resource.collection("alice", null));
            fail("Expected PathException");
        } catch (PathException e) {
            assertNotNull(e.getMessage());
        }
    }

    public void testPrefix() throws PathException {
        DefaultPathCodec pathCodec = new DefaultPathCodec("caldav/");
        assertEquals("/caldav", pathCodec.getPrefix());
        assertEquals("/caldav/", pathCodec.encodePath(Resource.serviceRoot()));
        assertEquals("/caldav/alice/cal/work", pathCodec.encodePath(Resource.collection("alice", "work")));
        assertEquals(Resource.serviceRoot(), pathCodec.parsePath("/caldav"));
        assertEquals(Resource.object("alice", "work", "a.ics"), pathCodec.parsePath("/caldav/alice/cal/work/a.ics"));
    }

    public void testRoundTripThroughPrefix() throws PathException {
        DefaultPathCodec pathCodec = new DefaultPathCodec("/dav");
        Resource resource = Resource.object("bob", "home", "party.ics");
        assertEquals(resource, pathCodec.parsePath(pathCodec.encodePath(resource)));
    }
}

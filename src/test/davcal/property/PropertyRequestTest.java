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

import davcal.util.XmlUtil;
import junit.framework.TestCase;
import org.jdom.Element;

import java.util.Arrays;
import java.util.Locale;

/**
 * Test property request decoding.
 */
public class PropertyRequestTest extends TestCase {

    protected static Element root(String xml) throws Exception {
        return XmlUtil.parse(xml).getRootElement();
    }

    public void testNullRootIsAllProp() {
        PropertyRequest request = PropertyRequest.fromElement(null);
        assertEquals(PropertyRequest.Mode.ALLPROP, request.getMode());
        assertEquals(PropertyRequest.ALLPROP_NAMES, request.getNames());
    }

    public void testProp() throws Exception {
        PropertyRequest request = PropertyRequest.fromElement(root("<d:propfind xmlns:d=\"DAV:\" xmlns:cs=\"http://calendarserver.org/ns/\">"
                + "<d:prop><d:DisplayName/><cs:getctag/></d:prop></d:propfind>"));
        assertEquals(PropertyRequest.Mode.PROP, request.getMode());
        assertEquals(Arrays.asList("displayname", "getctag"), request.getNames());
    }

    public void testPropNamesIndependentOfDefaultLocale() throws Exception {
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            PropertyRequest request = PropertyRequest.fromElement(root("<d:propfind xmlns:d=\"DAV:\">"
                    + "<d:prop><d:DISPLAYNAME/><d:RESOURCETYPE/></d:prop></d:propfind>"));
            assertEquals(Arrays.asList("displayname", "resourcetype"), request.getNames());
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    public void testPropName() throws Exception {
        PropertyRequest request = PropertyRequest.fromElement(root("<propfind xmlns=\"DAV:\"><propname/></propfind>"));
        assertTrue(request.isPropName());
        assertTrue(request.getNames().isEmpty());
    }

    public void testAllPropWithInclude() throws Exception {
        PropertyRequest request = PropertyRequest.fromElement(root("<propfind xmlns=\"DAV:\" xmlns:C=\"urn:ietf:params:xml:ns:caldav\">"
                + "<allprop/><include><C:calendar-description/><displayname/></include></propfind>"));
        assertEquals(PropertyRequest.Mode.ALLPROP, request.getMode());
        assertEquals(Arrays.asList("resourcetype", "getcontenttype", "displayname", "calendar-description"), request.getNames());
    }

    public void testReportProp() throws Exception {
        PropertyRequest request = PropertyRequest.fromElement(root("<C:calendar-query xmlns:D=\"DAV:\" xmlns:C=\"urn:ietf:params:xml:ns:caldav\">"
                + "<D:prop><D:getetag/><C:calendar-data/></D:prop><C:filter/></C:calendar-query>"));
        assertEquals(Arrays.asList("getetag", "calendar-data"), request.getNames());
    }

    public void testAllPropNamesNotShared() {
        PropertyRequest.allProp().getNames().add("getetag");
        assertEquals(3, PropertyRequest.allProp().getNames().size());
    }
}

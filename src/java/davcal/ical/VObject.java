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
package davcal.ical;

import davcal.exception.DavCalException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * iCalendar component: VCALENDAR, VTIMEZONE, VEVENT, VTODO, VALARM...
 */
public class VObject {
    /**
     * VObject properties
     */
    final ArrayList<VProperty> properties = new ArrayList<>();
    /**
     * Inner VObjects (e.g. VEVENT, VALARM, ...)
     */
    final ArrayList<VObject> vObjects = new ArrayList<>();
    /**
     * Object base name (VCALENDAR, VEVENT...).
     */
    protected String type;

    /**
     * Create VObject with given type
     *
     * @param beginProperty first line property
     * @param reader        stream reader just after the BEGIN:TYPE line
     * @throws IOException on error
     */
    public VObject(VProperty beginProperty, BufferedReader reader) throws IOException {
        if (!"BEGIN".equals(beginProperty.getKey()) || beginProperty.getValue() == null) {
            throw new DavCalException("EXCEPTION_INVALID_ICS_LINE", beginProperty);
        }
        type = beginProperty.getValue().trim().toUpperCase(Locale.ROOT);
        String endLine = "END:" + type;
        String line = reader.readLine();
        while (line != null && !endLine.equalsIgnoreCase(line.trim())) {
            handleLine(line, reader);
            line = reader.readLine();
        }
        if (line == null) {
            throw new DavCalException("EXCEPTION_END_OF_STREAM");
        }
    }

    /**
     * Create VObject from reader.
     *
     * @param reader stream reader just before the BEGIN:TYPE line
     * @throws IOException on error
     */
    public VObject(BufferedReader reader) throws IOException {
        this(new VProperty(readFirstLine(reader)), reader);
    }

    /**
     * Create VObject from string.
     *
     * @param itemBody item body
     * @throws IOException on error
     */
    public VObject(String itemBody) throws IOException {
        this(new ICSBufferedReader(new StringReader(itemBody)));
    }

    /**
     * Create empty VObject of type.
     *
     * @param type object type
     */
    public static VObject create(String type) {
        VObject vObject = new VObject();
        vObject.type = type.toUpperCase(Locale.ROOT);
        return vObject;
    }

    protected VObject() {
    }

    private static String readFirstLine(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        // skip leading blank lines
        while (line != null && line.trim().isEmpty()) {
            line = reader.readLine();
        }
        if (line == null) {
            throw new DavCalException("EXCEPTION_END_OF_STREAM");
        }
        return line.trim();
    }

    protected void handleLine(String line, BufferedReader reader) throws IOException {
        // skip empty lines
        if (!line.trim().isEmpty()) {
            VProperty property = new VProperty(line);
            // inner object
            if ("BEGIN".equals(property.getKey())) {
                addVObject(new VObject(property, reader));
            } else if (property.getKey() != null) {
                addProperty(property);
            }
        }
    }

    public String getType() {
        return type;
    }

    /**
     * Add vObject.
     *
     * @param vObject inner object
     */
    public void addVObject(VObject vObject) {
        vObjects.add(vObject);
    }

    /**
     * Inner objects.
     *
     * @return inner objects, live list
     */
    public List<VObject> getVObjects() {
        return vObjects;
    }

    /**
     * Inner objects of the given type.
     *
     * @param objectType object type, case insensitive
     * @return matching objects
     */
    public List<VObject> getVObjects(String objectType) {
        List<VObject> result = new ArrayList<>();
        for (VObject vObject : vObjects) {
            if (vObject.type.equalsIgnoreCase(objectType)) {
                result.add(vObject);
            }
        }
        return result;
    }

    /**
     * Add vProperty.
     *
     * @param property vProperty
     */
    public void addProperty(VProperty property) {
        if (property.getValue() != null) {
            properties.add(property);
        }
    }

    /**
     * Write VObject to writer.
     *
     * @param writer buffered writer
     */
    public void writeTo(ICSBufferedWriter writer) {
        writer.writeLine("BEGIN:" + type);
        for (VProperty property : properties) {
            writer.writeLine(property.toString());
        }
        for (VObject object : vObjects) {
            object.writeTo(writer);
        }
        writer.writeLine("END:" + type);
    }

    public String toString() {
        ICSBufferedWriter writer = new ICSBufferedWriter();
        writeTo(writer);
        return writer.toString();
    }

    /**
     * Get VObject properties
     *
     * @return properties
     */
    public List<VProperty> getProperties() {
        return properties;
    }

    /**
     * Get vProperty by name.
     *
     * @param name property name
     * @return property object
     */
    public VProperty getProperty(String name) {
        for (VProperty property : properties) {
            if (property.getKey() != null && property.getKey().equalsIgnoreCase(name)) {
                return property;
            }
        }
        return null;
    }

    /**
     * Get multivalued vProperty by name.
     *
     * @param name property name
     * @return property list, empty if none
     */
    public List<VProperty> getProperties(String name) {
        List<VProperty> result = new ArrayList<>();
        for (VProperty property : properties) {
            if (property.getKey() != null && property.getKey().equalsIgnoreCase(name)) {
                result.add(property);
            }
        }
        return result;
    }

    /**
     * Get vProperty raw value by name.
     *
     * @param name property name
     * @return property value
     */
    public String getPropertyValue(String name) {
        VProperty property = getProperty(name);
        if (property != null) {
            return property.getValue();
        } else {
            return null;
        }
    }

    /**
     * Get vProperty text value by name.
     *
     * @param name property name
     * @return unescaped property value
     */
    public String getPropertyText(String name) {
        VProperty property = getProperty(name);
        if (property != null) {
            return property.getTextValue();
        } else {
            return null;
        }
    }

    /**
     * Set vProperty raw value on vObject, remove property if value is null.
     *
     * @param name  property name
     * @param value property value
     */
    public void setPropertyValue(String name, String value) {
        if (value == null) {
            removeProperty(name);
        } else {
            VProperty property = getProperty(name);
            if (property == null) {
                property = new VProperty(name, value);
                addProperty(property);
            } else {
                property.setValue(value);
            }
        }
    }

    /**
     * Set vProperty text value, escape special characters.
     *
     * @param name  property name
     * @param text  plain text
     */
    public void setPropertyText(String name, String text) {
        setPropertyValue(name, VProperty.escapeText(text));
    }

    /**
     * Remove vProperty from vObject.
     *
     * @param name property name
     */
    public void removeProperty(String name) {
        VProperty property = getProperty(name);
        if (property != null) {
            properties.remove(property);
        }
    }
}

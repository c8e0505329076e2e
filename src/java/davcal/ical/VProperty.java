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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * iCalendar content line: NAME;PARAM=v1,v2;PARAM2="quoted":value.
 * The value is kept raw (as on the wire), text accessors handle escaping.
 */
public class VProperty {
    protected enum State {
        KEY, PARAM_NAME, PARAM_VALUE, QUOTED_PARAM_VALUE
    }

    /**
     * Property parameter, name is upper case.
     */
    public static class Param {
        final String name;
        final List<String> values = new ArrayList<>();

        Param(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public List<String> getValues() {
            return values;
        }

        public String getValue() {
            if (!values.isEmpty()) {
                return values.get(0);
            } else {
                return null;
            }
        }
    }

    protected String key;
    protected List<Param> params;
    protected String value;

    /**
     * Create VProperty for key and raw value.
     *
     * @param name  property name
     * @param value property value
     */
    public VProperty(String name, String value) {
        setKey(name);
        this.value = value;
    }

    /**
     * Create VProperty from an unfolded content line.
     *
     * @param line content line
     */
    public VProperty(String line) {
        if (line != null) {
            State state = State.KEY;
            String paramName = null;
            List<String> paramValues = null;
            int startIndex = 0;
            for (int i = 0; i < line.length() && value == null; i++) {
                char currentChar = line.charAt(i);
                if (state == State.KEY) {
                    if (currentChar == ':') {
                        setKey(line.substring(startIndex, i));
                        value = line.substring(i + 1);
                    } else if (currentChar == ';') {
                        setKey(line.substring(startIndex, i));
                        state = State.PARAM_NAME;
                        startIndex = i + 1;
                    }
                } else if (state == State.PARAM_NAME) {
                    if (currentChar == '=') {
                        paramName = line.substring(startIndex, i).toUpperCase(Locale.ROOT);
                        state = State.PARAM_VALUE;
                        paramValues = new ArrayList<>();
                        startIndex = i + 1;
                    } else if (currentChar == ';') {
                        // param with no value
                        addParam(line.substring(startIndex, i).toUpperCase(Locale.ROOT), Collections.<String>emptyList());
                        startIndex = i + 1;
                    } else if (currentChar == ':') {
                        addParam(line.substring(startIndex, i).toUpperCase(Locale.ROOT), Collections.<String>emptyList());
                        value = line.substring(i + 1);
                    }
                } else if (state == State.PARAM_VALUE) {
                    if (currentChar == '"') {
                        state = State.QUOTED_PARAM_VALUE;
                        startIndex = i + 1;
                    } else if (currentChar == ':' || currentChar == ';' || currentChar == ',') {
                        if (startIndex < i) {
                            paramValues.add(line.substring(startIndex, i));
                        }
                        startIndex = i + 1;
                        if (currentChar == ':') {
                            addParam(paramName, paramValues);
                            value = line.substring(i + 1);
                        } else if (currentChar == ';') {
                            addParam(paramName, paramValues);
                            state = State.PARAM_NAME;
                        }
                    }
                } else if (state == State.QUOTED_PARAM_VALUE) {
                    if (currentChar == '"') {
                        state = State.PARAM_VALUE;
                        paramValues.add(line.substring(startIndex, i));
                        startIndex = i + 1;
                    }
                }
            }
        }
    }

    /**
     * Property key, without optional parameters (e.g. DTSTART).
     *
     * @return key
     */
    public String getKey() {
        return key;
    }

    /**
     * Raw property value.
     *
     * @return value
     */
    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /**
     * Comma separated values (EXDATE, RDATE, CATEGORIES...).
     *
     * @return values, empty list if no value
     */
    public List<String> getValues() {
        List<String> result = new ArrayList<>();
        if (value != null) {
            for (String item : value.split(",")) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }

    /**
     * Value decoded as iCalendar TEXT.
     *
     * @return unescaped value
     */
    public String getTextValue() {
        return unescapeText(value);
    }

    /**
     * Set value from plain text, escape special characters.
     *
     * @param text plain text
     */
    public void setTextValue(String text) {
        this.value = escapeText(text);
    }

    /**
     * Test if the property has a param named paramName with given value.
     *
     * @param paramName  param name
     * @param paramValue param value
     * @return true if property has param name and value
     */
    public boolean hasParam(String paramName, String paramValue) {
        Param param = getParam(paramName);
        if (param != null) {
            for (String currentValue : param.values) {
                if (paramValue.equalsIgnoreCase(currentValue)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Test if the property has a param named paramName.
     *
     * @param paramName param name
     * @return true if property has param name
     */
    public boolean hasParam(String paramName) {
        return getParam(paramName) != null;
    }

    /**
     * First value of param paramName.
     *
     * @param paramName param name
     * @return param value or null
     */
    public String getParamValue(String paramName) {
        Param param = getParam(paramName);
        if (param != null) {
            return param.getValue();
        }
        return null;
    }

    public void addParam(String paramName, String paramValue) {
        addParam(paramName, Collections.singletonList(paramValue));
    }

    protected void addParam(String paramName, List<String> paramValues) {
        if (params == null) {
            params = new ArrayList<>();
        }
        Param currentParam = getParam(paramName);
        if (currentParam == null) {
            currentParam = new Param(paramName.toUpperCase(Locale.ROOT));
            params.add(currentParam);
        }
        currentParam.values.addAll(paramValues);
    }

    public Param getParam(String paramName) {
        if (params != null) {
            for (Param param : params) {
                if (param.name.equalsIgnoreCase(paramName)) {
                    return param;
                }
            }
        }
        return null;
    }

    public List<Param> getParams() {
        if (params == null) {
            return Collections.emptyList();
        }
        return params;
    }

    /**
     * Set property key, drop vCard style group prefix.
     *
     * @param key property key
     */
    public void setKey(String key) {
        int dotIndex = key.indexOf('.');
        if (dotIndex < 0) {
            this.key = key.toUpperCase(Locale.ROOT);
        } else {
            this.key = key.substring(dotIndex + 1).toUpperCase(Locale.ROOT);
        }
    }

    public String toString() {
        StringBuilder buffer = new StringBuilder();
        buffer.append(key);
        if (params != null) {
            for (Param param : params) {
                buffer.append(';').append(param.name);
                if (!param.values.isEmpty()) {
                    buffer.append('=');
                    boolean firstValue = true;
                    for (String paramValue : param.values) {
                        if (firstValue) {
                            firstValue = false;
                        } else {
                            buffer.append(',');
                        }
                        appendParamValue(buffer, paramValue);
                    }
                }
            }
        }
        buffer.append(':');
        if (value != null) {
            buffer.append(value);
        }
        return buffer.toString();
    }

    protected void appendParamValue(StringBuilder buffer, String paramValue) {
        if (paramValue.indexOf(';') >= 0 || paramValue.indexOf(',') >= 0
                || paramValue.indexOf(':') >= 0) {
            buffer.append('"').append(paramValue).append('"');
        } else {
            buffer.append(paramValue);
        }
    }

    /**
     * Decode iCalendar TEXT escapes.
     *
     * @param value raw value
     * @return decoded text
     */
    public static String unescapeText(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder decodedValue = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                //noinspection AssignmentToForLoopParameter
                i++;
                c = value.charAt(i);
                if (c == 'n' || c == 'N') {
                    c = '\n';
                }
            }
            decodedValue.append(c);
        }
        return decodedValue.toString();
    }

    /**
     * Encode text as iCalendar TEXT.
     *
     * @param text plain text
     * @return escaped value
     */
    public static String escapeText(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder buffer = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                buffer.append("\\n");
            } else if (c == '\r') {
                continue;
            } else {
                if (c == '\\' || c == ';' || c == ',') {
                    buffer.append('\\');
                }
                buffer.append(c);
            }
        }
        return buffer.toString();
    }
}

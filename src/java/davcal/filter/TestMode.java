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
package davcal.filter;

import java.util.List;

/**
 * Combination of the conditions of a filter node.
 */
public enum TestMode {
    ANYOF("anyof"), ALLOF("allof");

    private final String value;

    TestMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Decode test attribute, anyof when missing or unknown.
     *
     * @param value attribute value
     * @return test mode
     */
    public static TestMode fromValue(String value) {
        if (value != null && ALLOF.value.equalsIgnoreCase(value.trim())) {
            return ALLOF;
        }
        return ANYOF;
    }

    /**
     * Combine condition results.
     *
     * @param results condition results
     * @return combined result, true when there is no condition
     */
    public boolean combine(List<Boolean> results) {
        if (results.isEmpty()) {
            return true;
        }
        if (this == ALLOF) {
            return !results.contains(Boolean.FALSE);
        } else {
            return results.contains(Boolean.TRUE);
        }
    }
}

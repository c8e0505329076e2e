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

import java.util.Locale;

/**
 * text-match element.
 */
public class TextMatch {
    public static final String DEFAULT_COLLATION = "i;unicode-casemap";
    public static final String DEFAULT_MATCH_TYPE = "contains";

    private String collation = DEFAULT_COLLATION;
    private String matchType = DEFAULT_MATCH_TYPE;
    private boolean negate;
    private String value = "";

    public TextMatch() {
    }

    public TextMatch(String value) {
        setValue(value);
    }

    public String getCollation() {
        return collation;
    }

    public void setCollation(String collation) {
        this.collation = collation;
    }

    public String getMatchType() {
        return matchType;
    }

    public void setMatchType(String matchType) {
        this.matchType = matchType;
    }

    public boolean isNegate() {
        return negate;
    }

    public void setNegate(boolean negate) {
        this.negate = negate;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value == null ? "" : value;
    }

    boolean isCaseInsensitive() {
        return "i;unicode-casemap".equalsIgnoreCase(collation) || "i;ascii-casemap".equalsIgnoreCase(collation);
    }

    /**
     * Compare text against this match, negate applied.
     *
     * @param text property or parameter text
     * @return match result
     */
    public boolean matches(String text) {
        String candidate = text == null ? "" : text;
        String expected = value;
        if (isCaseInsensitive()) {
            candidate = candidate.toLowerCase(Locale.ROOT);
            expected = expected.toLowerCase(Locale.ROOT);
        }
        boolean result;
        if ("equals".equalsIgnoreCase(matchType)) {
            result = candidate.equals(expected);
        } else if ("starts-with".equalsIgnoreCase(matchType)) {
            result = candidate.startsWith(expected);
        } else if ("ends-with".equalsIgnoreCase(matchType)) {
            result = candidate.endsWith(expected);
        } else {
            result = candidate.contains(expected);
        }
        return result != negate;
    }
}

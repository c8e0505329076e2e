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

import java.util.ArrayList;
import java.util.List;

/**
 * prop-filter element.
 */
public class PropFilter {
    private String name;
    private TestMode test = TestMode.ANYOF;
    private boolean notDefined;
    private TextMatch textMatch;
    private final List<ParamFilter> paramFilters = new ArrayList<>();

    public PropFilter() {
    }

    public PropFilter(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TestMode getTest() {
        return test;
    }

    public void setTest(TestMode test) {
        this.test = test;
    }

    public boolean isNotDefined() {
        return notDefined;
    }

    public void setNotDefined(boolean notDefined) {
        this.notDefined = notDefined;
    }

    public TextMatch getTextMatch() {
        return textMatch;
    }

    public void setTextMatch(TextMatch textMatch) {
        this.textMatch = textMatch;
    }

    public List<ParamFilter> getParamFilters() {
        return paramFilters;
    }
}

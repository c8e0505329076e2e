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

import org.jdom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * supported-report-set property, one supported-report per report name.
 */
public class SupportedReportSetProperty implements PropertyValue {
    private final List<String> reports;

    public SupportedReportSetProperty(List<String> reports) {
        this.reports = new ArrayList<>(reports);
    }

    public String getName() {
        return "supported-report-set";
    }

    public List<String> getReports() {
        return reports;
    }

    public Element toElement() {
        Element element = PropertyCatalog.createElement(getName());
        for (String report : reports) {
            Element reportElement = PropertyCatalog.createElement("report");
            reportElement.addContent(PropertyCatalog.createElement(report));
            Element supportedReport = PropertyCatalog.createElement("supported-report");
            supportedReport.addContent(reportElement);
            element.addContent(supportedReport);
        }
        return element;
    }
}

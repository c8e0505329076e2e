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

import java.time.Instant;

/**
 * time-range element, a null bound is unbounded.
 */
public class TimeRange {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    /**
     * Check overlap with an instance: instance start before range end and instance end after range start.
     * A zero length instance overlaps when it sits inside [start, end).
     *
     * @param instanceStart instance start
     * @param instanceEnd   instance end
     * @return true on overlap
     */
    public boolean overlaps(Instant instanceStart, Instant instanceEnd) {
        boolean beforeEnd = end == null || instanceStart.isBefore(end);
        boolean afterStart;
        if (start == null) {
            afterStart = true;
        } else if (instanceEnd.equals(instanceStart)) {
            afterStart = !instanceStart.isBefore(start);
        } else {
            afterStart = instanceEnd.isAfter(start);
        }
        return beforeEnd && afterStart;
    }

    @Override
    public String toString() {
        return "TimeRange{start=" + start + ", end=" + end + '}';
    }
}

/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Strata.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.strata.geometry;

/**
 * A time range over {@code long} instants. The start is always inclusive; the end is either inclusive (a closed
 * interval) or exclusive (a half-open interval).
 *
 * @param start        first instant of the interval
 * @param end          last instant, or the first instant after the interval when {@code endInclusive} is false
 * @param endInclusive whether {@code end} itself belongs to the interval
 * @author hal.hildebrand
 */
public record Interval(long start, long end, boolean endInclusive) {

    public Interval {
        if (end < start) {
            throw new IllegalArgumentException("Interval end " + end + " precedes start " + start);
        }
        if (end == start && !endInclusive) {
            throw new IllegalArgumentException("Half-open interval [" + start + ", " + end + ") is empty");
        }
    }

    /**
     * Closed interval {@code [start, end]}
     */
    public static Interval closed(long start, long end) {
        return new Interval(start, end, true);
    }

    /**
     * Half-open interval {@code [start, end)}
     */
    public static Interval halfOpen(long start, long end) {
        return new Interval(start, end, false);
    }

    /**
     * Single instant {@code [instant, instant]}
     */
    public static Interval instant(long instant) {
        return new Interval(instant, instant, true);
    }

    /**
     * @return true if the instant lies within this interval
     */
    public boolean contains(long instant) {
        return instant >= start && (endInclusive ? instant <= end : instant < end);
    }

    /**
     * @return true if every instant of {@code other} lies within this interval
     */
    public boolean contains(Interval other) {
        if (other.start < start) {
            return false;
        }
        if (other.end < end) {
            return true;
        }
        return other.end == end && (endInclusive || !other.endInclusive);
    }

    /**
     * @return true if every instant of this interval lies within {@code other}
     */
    public boolean containedBy(Interval other) {
        return other.contains(this);
    }

    /**
     * @return true if the two intervals share at least one instant
     */
    public boolean intersects(Interval other) {
        var lo = Math.max(start, other.start);
        var hi = Math.min(end, other.end);
        if (lo < hi) {
            return true;
        }
        if (lo > hi) {
            return false;
        }
        // touching at a single instant: every interval ending there must include it
        return (end != hi || endInclusive) && (other.end != hi || other.endInclusive);
    }

    /**
     * Length of the gap separating the two intervals, 0 if they intersect
     *
     * @throws ArithmeticException if the gap does not fit in a {@code long}
     */
    public long gap(Interval other) {
        if (intersects(other)) {
            return 0;
        }
        return start > other.end ? Math.subtractExact(start, other.end) : Math.subtractExact(other.start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + (endInclusive ? "]" : ")");
    }
}

/*
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.strata.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for closed and half-open interval semantics
 */
public class IntervalTest {

    @Test
    void testInvalidIntervals() {
        assertThrows(IllegalArgumentException.class, () -> Interval.closed(10, 5));
        assertThrows(IllegalArgumentException.class, () -> Interval.halfOpen(3, 3));
        assertDoesNotThrow(() -> Interval.instant(3));
    }

    @Test
    void testIntersectsOverlapping() {
        assertTrue(Interval.closed(0, 10).intersects(Interval.closed(5, 25)));
        assertTrue(Interval.closed(5, 25).intersects(Interval.closed(0, 10)));
        assertFalse(Interval.closed(0, 4).intersects(Interval.closed(5, 25)));
    }

    @Test
    void testIntersectsTouchingEndpoints() {
        assertTrue(Interval.closed(0, 5).intersects(Interval.closed(5, 10)));
        assertFalse(Interval.halfOpen(0, 5).intersects(Interval.closed(5, 10)));
        assertFalse(Interval.closed(5, 10).intersects(Interval.halfOpen(0, 5)));
        assertTrue(Interval.instant(5).intersects(Interval.halfOpen(5, 10)));
        assertFalse(Interval.instant(10).intersects(Interval.halfOpen(5, 10)));
    }

    @Test
    void testContains() {
        var outer = Interval.closed(0, 30);
        assertTrue(outer.contains(Interval.closed(5, 25)));
        assertTrue(outer.contains(Interval.closed(0, 30)));
        assertFalse(outer.contains(Interval.closed(5, 31)));
        assertFalse(Interval.halfOpen(0, 30).contains(Interval.closed(5, 30)));
        assertTrue(Interval.halfOpen(0, 30).contains(Interval.halfOpen(5, 30)));
        assertTrue(Interval.closed(5, 25).containedBy(outer));
    }

    @Test
    void testContainsInstant() {
        assertTrue(Interval.halfOpen(0, 10).contains(0));
        assertFalse(Interval.halfOpen(0, 10).contains(10));
        assertTrue(Interval.closed(0, 10).contains(10));
    }

    @Test
    void testGap() {
        assertEquals(0, Interval.closed(0, 10).gap(Interval.closed(5, 15)));
        assertEquals(5, Interval.closed(0, 10).gap(Interval.closed(15, 20)));
        assertEquals(5, Interval.closed(15, 20).gap(Interval.closed(0, 10)));
    }

    @Test
    void testGapBetweenExtremeInstants() {
        assertEquals(Long.MAX_VALUE, Interval.instant(0).gap(Interval.instant(Long.MAX_VALUE)));
        assertThrows(ArithmeticException.class,
                     () -> Interval.instant(Long.MIN_VALUE).gap(Interval.instant(Long.MAX_VALUE)));
        assertThrows(ArithmeticException.class,
                     () -> Interval.instant(Long.MAX_VALUE).gap(Interval.instant(Long.MIN_VALUE)));
    }
}

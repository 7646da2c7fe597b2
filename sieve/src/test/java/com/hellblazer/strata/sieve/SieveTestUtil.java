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
package com.hellblazer.strata.sieve;

import com.hellblazer.strata.geometry.Interval;
import com.hellblazer.strata.geometry.STObject;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared fixtures for the sieve tests
 */
public final class SieveTestUtil {

    private static final GeometryFactory FACTORY = new GeometryFactory();

    private SieveTestUtil() {
    }

    public static STObject box(double minX, double minY, double maxX, double maxY) {
        return STObject.of(FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY)));
    }

    public static STObject box(double minX, double minY, double maxX, double maxY, Interval interval) {
        return STObject.of(FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY)), interval);
    }

    /**
     * Points with integer payloads 0..n-1, uniformly placed in [0, extent) x [0, extent)
     */
    public static List<STRecord<Integer>> randomPoints(Random random, int n, double extent) {
        var records = new ArrayList<STRecord<Integer>>(n);
        for (int i = 0; i < n; i++) {
            records.add(STRecord.of(STObject.point(random.nextDouble() * extent, random.nextDouble() * extent), i));
        }
        return records;
    }

    /**
     * Axis aligned boxes with sides up to {@code maxSize}, inside [0, extent + maxSize)
     */
    public static List<STRecord<Integer>> randomBoxes(Random random, int n, double extent, double maxSize) {
        var records = new ArrayList<STRecord<Integer>>(n);
        for (int i = 0; i < n; i++) {
            var x = random.nextDouble() * extent;
            var y = random.nextDouble() * extent;
            var w = 0.1 + random.nextDouble() * maxSize;
            var h = 0.1 + random.nextDouble() * maxSize;
            records.add(STRecord.of(box(x, y, x + w, y + h), i));
        }
        return records;
    }

    /**
     * Points carrying closed intervals starting in [0, maxStart) and lasting up to {@code maxLength}
     */
    public static List<STRecord<Integer>> randomTimedPoints(Random random, int n, double extent, long maxStart,
                                                            long maxLength) {
        var records = new ArrayList<STRecord<Integer>>(n);
        for (int i = 0; i < n; i++) {
            var start = (long) random.nextInt((int) maxStart);
            var end = start + random.nextInt((int) maxLength + 1);
            records.add(STRecord.of(STObject.point(random.nextDouble() * extent, random.nextDouble() * extent,
                                                   Interval.closed(start, end)), i));
        }
        return records;
    }
}

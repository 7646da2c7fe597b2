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

import java.util.function.ToDoubleBiFunction;

/**
 * Stock distance functions over {@link STObject}s. Query operators treat every distance function as opaque and make
 * no assumption that it is monotonic with respect to bounding boxes.
 *
 * @author hal.hildebrand
 */
public final class Distances {

    private Distances() {
    }

    /**
     * A distance that is never smaller than the distance between the envelopes of its arguments. Spatial indexes may
     * skip whole subtrees during nearest neighbor search for such distances; any other distance forces a full scan.
     */
    @FunctionalInterface
    public interface EnvelopeBounded extends ToDoubleBiFunction<STObject, STObject> {
    }

    /**
     * @return true if {@code distance} is known to be bounded below by envelope distance
     */
    public static boolean isEnvelopeBounded(ToDoubleBiFunction<STObject, STObject> distance) {
        return distance instanceof EnvelopeBounded;
    }

    /**
     * Minimum Euclidean distance between the two geometries, 0 if they intersect
     */
    public static EnvelopeBounded euclidean() {
        return (a, b) -> a.geometry().distance(b.geometry());
    }

    /**
     * Euclidean distance between the centroids of the two geometries
     */
    public static EnvelopeBounded centroid() {
        return (a, b) -> a.geometry().getCentroid().distance(b.geometry().getCentroid());
    }

    /**
     * Gap between the two intervals, 0 if they overlap. Objects without an interval are infinitely far apart.
     */
    public static ToDoubleBiFunction<STObject, STObject> temporal() {
        return (a, b) -> {
            if (a.interval().isEmpty() || b.interval().isEmpty()) {
                return Double.POSITIVE_INFINITY;
            }
            var x = a.interval().get();
            var y = b.interval().get();
            if (x.intersects(y)) {
                return 0;
            }
            // measured in double so instants at opposite ends of the timeline stay comparable
            return x.start() > y.end() ? (double) x.start() - (double) y.end() : (double) y.start() - (double) x.end();
        };
    }
}

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
package com.hellblazer.strata.sieve.index;

/**
 * Index policy for a partition task. The policy only changes how candidates are found, never which records are
 * returned.
 *
 * @author hal.hildebrand
 */
public enum IndexType {
    /**
     * Stream the partition and test every record
     */
    NONE,

    /**
     * Build an R-tree over record envelopes. Requires a positive tree order.
     */
    SPATIAL,

    /**
     * Build an interval tree over record time intervals
     */
    TEMPORAL;

    /**
     * Create a fresh ephemeral index of this type.
     *
     * @param treeOrder node capacity for {@link #SPATIAL}, ignored otherwise
     * @throws IllegalArgumentException if this is {@link #SPATIAL} and {@code treeOrder <= 0}
     * @throws IllegalStateException    if this is {@link #NONE}
     */
    public <P> EphemeralIndex<P> newIndex(int treeOrder) {
        return switch (this) {
            case SPATIAL -> new SpatialTreeIndex<>(treeOrder);
            case TEMPORAL -> new IntervalTreeIndex<>();
            case NONE -> throw new IllegalStateException("Index type NONE has no index");
        };
    }
}

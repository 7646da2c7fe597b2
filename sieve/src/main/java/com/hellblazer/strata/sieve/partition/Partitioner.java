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
package com.hellblazer.strata.sieve.partition;

import com.hellblazer.strata.geometry.STObject;

/**
 * Assigns records to numbered partitions. Implementations must be deterministic and safe for concurrent use.
 *
 * @author hal.hildebrand
 */
public interface Partitioner {

    /**
     * @return the number of partitions, ids ranging over {@code [0, numPartitions())}
     */
    int numPartitions();

    /**
     * @return the partition the key belongs to
     * @throws IllegalArgumentException if the key cannot be placed without violating the declared bounds
     */
    int partitionFor(STObject key);
}

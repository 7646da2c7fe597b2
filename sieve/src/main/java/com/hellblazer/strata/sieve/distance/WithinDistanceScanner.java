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
package com.hellblazer.strata.sieve.distance;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.index.SpatialTreeIndex;
import com.hellblazer.strata.sieve.partition.PartitionPruner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;

/**
 * Finds every record within a maximum distance of a query object under an arbitrary distance function.
 *
 * <p>The distance function is opaque and need not grow with envelope separation, so no partition can be ruled out:
 * every partition is scanned. Each partition task builds a fresh R-tree and relies on its exact
 * {@code withinDistance} operation.
 *
 * @author hal.hildebrand
 */
public class WithinDistanceScanner {

    private static final Logger log = LoggerFactory.getLogger(WithinDistanceScanner.class);

    private final PartitionTaskExecutor taskExecutor;
    private final int                   treeOrder;

    /**
     * @throws IllegalArgumentException if {@code treeOrder <= 0}
     */
    public WithinDistanceScanner(PartitionTaskExecutor taskExecutor, int treeOrder) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        if (treeOrder <= 0) {
            throw new IllegalArgumentException("Tree order must be positive: " + treeOrder);
        }
        this.treeOrder = treeOrder;
    }

    /**
     * @return exactly the records with {@code distance(key, query) <= maxDistance}, partition by partition in
     * arrival order
     * @throws IllegalArgumentException if {@code maxDistance} is negative or not a number
     */
    public <V> List<STRecord<V>> withinDistance(PartitionedDataset<V> dataset, STObject query, double maxDistance,
                                                ToDoubleBiFunction<STObject, STObject> distance) {
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
        Objects.requireNonNull(distance, "Distance function cannot be null");
        if (Double.isNaN(maxDistance) || maxDistance < 0) {
            throw new IllegalArgumentException("Max distance must be non-negative: " + maxDistance);
        }

        var perPartition = taskExecutor.execute(PartitionPruner.all(dataset.numPartitions()), partition -> {
            var index = new SpatialTreeIndex<STRecord<V>>(treeOrder);
            for (var record : dataset.partition(partition.parentIndex())) {
                index.insert(record.key(), record);
            }
            index.build();
            return index.withinDistance(query, distance, maxDistance);
        });

        var result = new ArrayList<STRecord<V>>();
        perPartition.forEach(result::addAll);
        log.debug("Within distance {} of {}: {} records from {} partitions", maxDistance, query, result.size(),
                  dataset.numPartitions());
        return result;
    }
}

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
package com.hellblazer.strata.sieve.filter;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.JoinPredicate;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.index.IndexType;
import com.hellblazer.strata.sieve.partition.PartitionPruner;
import com.hellblazer.strata.sieve.partition.PrunedPartition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * A spatio-temporal filter over a partitioned dataset: partition pruning followed by an exact, optionally
 * index-accelerated, filter inside every surviving partition.
 *
 * <p>Filters built from a {@link JoinPredicate} prune partitions using the dataset's partitioner. Filters built from
 * an arbitrary predicate function cannot be pruned and visit every partition.
 *
 * @param <V> the payload type
 * @author hal.hildebrand
 */
public class SpatialFilter<V> {

    private final PartitionedDataset<V>           parent;
    private final STObject                        query;
    private final JoinPredicate                   predicate;
    private final BiPredicate<STObject, STObject> predicateFunction;
    private final FilterExecutor<V>               executor;
    private final boolean                         checkPartitions;

    private SpatialFilter(PartitionedDataset<V> parent, STObject query, JoinPredicate predicate,
                          BiPredicate<STObject, STObject> predicateFunction, IndexType indexType, int treeOrder,
                          boolean checkPartitions) {
        this.parent = Objects.requireNonNull(parent, "Dataset cannot be null");
        this.query = Objects.requireNonNull(query, "Query cannot be null");
        this.predicate = predicate;
        this.predicateFunction = Objects.requireNonNull(predicateFunction, "Predicate cannot be null");
        this.executor = new FilterExecutor<>(indexType, treeOrder);
        this.checkPartitions = checkPartitions;
    }

    /**
     * Filter with one of the fixed predicates, pruning partitions.
     *
     * @throws IllegalArgumentException if {@code indexType} is SPATIAL and {@code treeOrder <= 0}
     */
    public static <V> SpatialFilter<V> of(PartitionedDataset<V> parent, STObject query, JoinPredicate predicate,
                                          IndexType indexType, int treeOrder) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return new SpatialFilter<>(parent, query, predicate, predicate.function(), indexType, treeOrder, true);
    }

    /**
     * Filter with an arbitrary predicate function, visiting every partition. An index may only be used if the
     * function implies envelope (or interval) intersection with the query.
     *
     * @throws IllegalArgumentException if {@code indexType} is SPATIAL and {@code treeOrder <= 0}
     */
    public static <V> SpatialFilter<V> of(PartitionedDataset<V> parent, STObject query,
                                          BiPredicate<STObject, STObject> predicateFunction, IndexType indexType,
                                          int treeOrder) {
        return new SpatialFilter<>(parent, query, null, predicateFunction, indexType, treeOrder, false);
    }

    /**
     * The partitions that have to be processed, after pruning
     */
    public List<PrunedPartition> partitions() {
        if (!checkPartitions) {
            return PartitionPruner.all(parent.numPartitions());
        }
        return PartitionPruner.prune(parent.numPartitions(), parent.partitioner(), query, predicate);
    }

    /**
     * The matching records of one surviving partition, read from its original partition
     */
    public Iterable<STRecord<V>> compute(PrunedPartition partition) {
        return executor.filter(parent.partition(partition.parentIndex()), query, predicateFunction);
    }

    /**
     * Run the filter with one task per surviving partition and gather the matches in partition order.
     */
    public List<STRecord<V>> collect(PartitionTaskExecutor taskExecutor) {
        Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        var perPartition = taskExecutor.execute(partitions(), partition -> {
            var matches = new ArrayList<STRecord<V>>();
            compute(partition).forEach(matches::add);
            return matches;
        });
        var result = new ArrayList<STRecord<V>>();
        perPartition.forEach(result::addAll);
        return result;
    }
}

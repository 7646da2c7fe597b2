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
package com.hellblazer.strata.sieve.join;

import com.hellblazer.strata.sieve.JoinPredicate;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.filter.FilterExecutor;
import com.hellblazer.strata.sieve.index.IndexType;
import com.hellblazer.strata.sieve.partition.Partitioner;
import com.hellblazer.strata.sieve.partition.SpatialPartitioner;
import com.hellblazer.strata.sieve.partition.TemporalPartitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Join by one of the fixed predicates over co-partitioned inputs.
 *
 * <p>Both inputs are repartitioned by the same partitioner (a no-op for an input already partitioned by it). A
 * partitioner places each record in exactly one partition whose bounds cover it, so a matching pair always lives in
 * two partitions whose bounds intersect; for point data that is the same partition id. One task runs per such
 * partition pair. Inside a task the right partition is prepared once with the {@link FilterExecutor}, optionally
 * indexed, and queried with each left record before the exact predicate check.
 *
 * <p>Without a shared partitioner the join falls back to the {@link CartesianJoin}.
 *
 * @author hal.hildebrand
 */
public class PartitionedJoin {

    private static final Logger log = LoggerFactory.getLogger(PartitionedJoin.class);

    private final PartitionTaskExecutor taskExecutor;
    private final IndexType             indexType;
    private final int                   treeOrder;

    /**
     * @throws IllegalArgumentException if {@code indexType} is SPATIAL and {@code treeOrder <= 0}
     */
    public PartitionedJoin(PartitionTaskExecutor taskExecutor, IndexType indexType, int treeOrder) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        this.indexType = Objects.requireNonNull(indexType, "Index type cannot be null");
        if (indexType == IndexType.SPATIAL && treeOrder <= 0) {
            throw new IllegalArgumentException("Spatial index requires a positive tree order: " + treeOrder);
        }
        this.treeOrder = treeOrder;
    }

    /**
     * @param predicate   applied as {@code predicate.test(leftKey, rightKey)}
     * @param partitioner the partitioner to co-partition both inputs with; when empty, both inputs must already
     *                    share a partitioner
     * @return every pair satisfying the predicate
     */
    public <V, W> List<JoinPair<V, W>> join(PartitionedDataset<V> left, PartitionedDataset<W> right,
                                            JoinPredicate predicate, Optional<? extends Partitioner> partitioner) {
        Objects.requireNonNull(left, "Left input cannot be null");
        Objects.requireNonNull(right, "Right input cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        Objects.requireNonNull(partitioner, "Partitioner option cannot be null");

        PartitionedDataset<V> l = left;
        PartitionedDataset<W> r = right;
        if (partitioner.isPresent()) {
            l = left.partitionBy(partitioner.get());
            r = right.partitionBy(partitioner.get());
        } else if (left.partitioner().isEmpty() || !left.partitioner().equals(right.partitioner())) {
            log.debug("No shared partitioner for {} join, falling back to the cartesian product", predicate);
            return new CartesianJoin(taskExecutor).join(left, right, predicate.function());
        }

        var shared = l.partitioner().orElseThrow();
        var pairs = partitionPairs(shared);
        log.debug("{} join over {} partition pairs of {} partitions", predicate, pairs.size(),
                  shared.numPartitions());

        var leftInput = l;
        var rightInput = r;
        var perPair = taskExecutor.execute(pairs, pair -> joinPartitions(leftInput.partition(pair.left()),
                                                                         rightInput.partition(pair.right()),
                                                                         predicate));
        var result = new ArrayList<JoinPair<V, W>>();
        perPair.forEach(result::addAll);
        return result;
    }

    private List<PartitionPair> partitionPairs(Partitioner partitioner) {
        var n = partitioner.numPartitions();
        var pairs = new ArrayList<PartitionPair>();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (mayJoin(partitioner, i, j)) {
                    pairs.add(new PartitionPair(i, j));
                }
            }
        }
        return pairs;
    }

    private static boolean mayJoin(Partitioner partitioner, int i, int j) {
        if (i == j) {
            return true;
        }
        if (partitioner instanceof SpatialPartitioner spatial) {
            return spatial.partitionBounds(i).intersects(spatial.partitionBounds(j));
        }
        if (partitioner instanceof TemporalPartitioner temporal) {
            return temporal.partitionBounds(i).intersects(temporal.partitionBounds(j));
        }
        return true;
    }

    private <V, W> List<JoinPair<V, W>> joinPartitions(List<STRecord<V>> leftPartition,
                                                       List<STRecord<W>> rightPartition, JoinPredicate predicate) {
        var pairs = new ArrayList<JoinPair<V, W>>();
        if (leftPartition.isEmpty() || rightPartition.isEmpty()) {
            return pairs;
        }
        var lookup = new FilterExecutor<W>(indexType, treeOrder).prepare(rightPartition);
        for (var l : leftPartition) {
            // the lookup tests (rightKey, query), so the predicate is applied with its arguments swapped back
            for (var r : lookup.lookup(l.key(), (rightKey, leftKey) -> predicate.test(leftKey, rightKey))) {
                pairs.add(new JoinPair<>(l, r));
            }
        }
        return pairs;
    }

    private record PartitionPair(int left, int right) {
    }
}

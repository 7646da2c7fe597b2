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

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.partition.PartitionPruner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Join by an arbitrary predicate function: the full cross product of both inputs, filtered.
 *
 * <p>This is the expensive fallback. Nothing is known about the predicate, so no partition pair can be skipped and
 * no index can be used (an index query may miss pairs the function accepts). The cost is quadratic in the input
 * sizes. One task runs per left partition, each scanning every right record.
 *
 * @author hal.hildebrand
 */
public class CartesianJoin {

    private static final Logger log = LoggerFactory.getLogger(CartesianJoin.class);

    private final PartitionTaskExecutor taskExecutor;

    public CartesianJoin(PartitionTaskExecutor taskExecutor) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
    }

    /**
     * @param predicate applied as {@code predicate.test(leftKey, rightKey)}
     * @return every pair satisfying the predicate
     */
    public <V, W> List<JoinPair<V, W>> join(PartitionedDataset<V> left, PartitionedDataset<W> right,
                                            BiPredicate<STObject, STObject> predicate) {
        Objects.requireNonNull(left, "Left input cannot be null");
        Objects.requireNonNull(right, "Right input cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null");

        var rightRecords = right.collect();
        log.debug("Cartesian join of {} x {} records", left.count(), rightRecords.size());

        var perPartition = taskExecutor.execute(PartitionPruner.all(left.numPartitions()), partition -> {
            var pairs = new ArrayList<JoinPair<V, W>>();
            for (var l : left.partition(partition.parentIndex())) {
                for (STRecord<W> r : rightRecords) {
                    if (predicate.test(l.key(), r.key())) {
                        pairs.add(new JoinPair<>(l, r));
                    }
                }
            }
            return pairs;
        });

        var result = new ArrayList<JoinPair<V, W>>();
        perPartition.forEach(result::addAll);
        return result;
    }
}

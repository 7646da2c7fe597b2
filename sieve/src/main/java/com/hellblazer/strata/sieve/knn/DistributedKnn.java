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
package com.hellblazer.strata.sieve.knn;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.SieveConfig;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.index.SpatialTreeIndex;
import com.hellblazer.strata.sieve.partition.PartitionPruner;
import com.hellblazer.strata.sieve.partition.PrunedPartition;
import com.hellblazer.strata.sieve.partition.SpatialPartitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.ToDoubleBiFunction;
import java.util.stream.Collectors;

/**
 * Two-phase k-nearest-neighbor search over a partitioned dataset.
 *
 * <p>The map phase runs one task per participating partition: it builds a fresh R-tree over the partition and emits
 * that partition's local k nearest records. The reduce phase starts only once every map task has finished; it ranks
 * all candidates by their true distance to the query, breaking ties by partition and then by local rank, and keeps
 * the first k.
 *
 * <p>A partition participates when the dataset has no spatial partitioner, or when its bounds intersect the query
 * envelope. That test is a heuristic: a true neighbor in a partition whose bounds miss the query envelope is lost
 * even when it is closer than the k-th candidate found. Results are only exact when pruning is disabled, or when the
 * configured safety margin is at least the k-th neighbor distance. A warning is logged the first time a query is
 * pruned without a margin.
 *
 * @author hal.hildebrand
 */
public class DistributedKnn {

    private static final Logger log = LoggerFactory.getLogger(DistributedKnn.class);

    private final PartitionTaskExecutor taskExecutor;
    private final int                   treeOrder;
    private final boolean               pruning;
    private final double                safetyMargin;
    private final AtomicBoolean         heuristicWarned = new AtomicBoolean();

    public DistributedKnn(PartitionTaskExecutor taskExecutor) {
        this(taskExecutor, taskExecutor.getConfig());
    }

    /**
     * @throws IllegalArgumentException if the configured tree order is not positive
     */
    public DistributedKnn(PartitionTaskExecutor taskExecutor, SieveConfig config) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        if (config.getTreeOrder() <= 0) {
            throw new IllegalArgumentException("kNN requires a positive tree order: " + config.getTreeOrder());
        }
        this.treeOrder = config.getTreeOrder();
        this.pruning = config.isKnnPruning();
        this.safetyMargin = config.getKnnSafetyMargin();
    }

    /**
     * @return up to {@code k} records nearest to the query under {@code distance}, ascending by distance
     * @throws IllegalArgumentException if {@code k <= 0}
     */
    public <V> List<Neighbor<V>> kNN(PartitionedDataset<V> dataset, STObject query, int k,
                                     ToDoubleBiFunction<STObject, STObject> distance) {
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
        Objects.requireNonNull(distance, "Distance function cannot be null");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }

        var participants = participants(dataset, query);

        // map: local top-k per partition; execute() returns only after every task has finished
        List<List<STRecord<V>>> local = taskExecutor.execute(participants, partition -> localNearest(
        dataset.partition(partition.parentIndex()), query, k, distance));

        // reduce: global top-k over at most k * participants candidates
        var result = merge(local, query, k, distance);
        log.debug("kNN k={} over {} of {} partitions: {} candidates, {} results", k, participants.size(),
                  dataset.numPartitions(), local.stream().mapToInt(List::size).sum(), result.size());
        return result;
    }

    private <V> List<PrunedPartition> participants(PartitionedDataset<V> dataset, STObject query) {
        var partitioner = dataset.partitioner();
        if (!pruning || partitioner.isEmpty() || !(partitioner.get() instanceof SpatialPartitioner spatial)) {
            return PartitionPruner.all(dataset.numPartitions());
        }
        if (safetyMargin == 0.0 && heuristicWarned.compareAndSet(false, true)) {
            log.warn("kNN partition pruning without a safety margin is approximate; neighbors just outside the "
                     + "bounds of a skipped partition can be missed");
        }
        return PartitionPruner.pruneByEnvelope(dataset.numPartitions(), spatial, query.envelope(), safetyMargin);
    }

    private <V> List<STRecord<V>> localNearest(List<STRecord<V>> partition, STObject query, int k,
                                               ToDoubleBiFunction<STObject, STObject> distance) {
        var index = new SpatialTreeIndex<STRecord<V>>(treeOrder);
        for (var record : partition) {
            index.insert(record.key(), record);
        }
        index.build();
        return index.kNN(query, k, distance);
    }

    private <V> List<Neighbor<V>> merge(List<List<STRecord<V>>> local, STObject query, int k,
                                        ToDoubleBiFunction<STObject, STObject> distance) {
        var candidates = new ArrayList<Candidate<V>>();
        for (int p = 0; p < local.size(); p++) {
            var partitionCandidates = local.get(p);
            for (int rank = 0; rank < partitionCandidates.size(); rank++) {
                var record = partitionCandidates.get(rank);
                candidates.add(new Candidate<>(record, distance.applyAsDouble(record.key(), query), p, rank));
            }
        }
        return candidates.stream()
                         .sorted(Comparator.<Candidate<V>>comparingDouble(Candidate::distance)
                                           .thenComparingInt(Candidate::partition)
                                           .thenComparingInt(Candidate::rank))
                         .limit(k)
                         .map(c -> new Neighbor<>(c.record().key(), c.distance(), c.record().value()))
                         .collect(Collectors.toList());
    }

    private record Candidate<V>(STRecord<V> record, double distance, int partition, int rank) {
    }
}

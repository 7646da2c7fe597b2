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
package com.hellblazer.strata.sieve;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.distance.WithinDistanceScanner;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.filter.SpatialFilter;
import com.hellblazer.strata.sieve.index.IndexType;
import com.hellblazer.strata.sieve.join.CartesianJoin;
import com.hellblazer.strata.sieve.join.JoinPair;
import com.hellblazer.strata.sieve.join.PartitionedJoin;
import com.hellblazer.strata.sieve.knn.DistributedKnn;
import com.hellblazer.strata.sieve.knn.Neighbor;
import com.hellblazer.strata.sieve.partition.Partitioner;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToDoubleBiFunction;

/**
 * Spatio-temporal query operators over one partitioned dataset.
 *
 * <p>Filters by a fixed predicate prune partitions with the dataset's partitioner and then filter each surviving
 * partition with the configured index type. Every operator runs one task per partition on the shared
 * {@link PartitionTaskExecutor}; indexes are built inside the tasks and dropped with them.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (var executor = new PartitionTaskExecutor(config)) {
 *     var queries = new SpatialQueries<>(dataset, executor);
 *     var hits = queries.intersects(STObject.of("POLYGON((0 0, 10 0, 10 10, 0 10, 0 0))"));
 *     var nearest = queries.kNN(STObject.point(5, 5), 3, Distances.euclidean());
 * }
 * }</pre>
 *
 * @param <V> the payload type
 * @author hal.hildebrand
 */
public class SpatialQueries<V> {

    private final PartitionedDataset<V> dataset;
    private final PartitionTaskExecutor taskExecutor;
    private final SieveConfig           config;

    public SpatialQueries(PartitionedDataset<V> dataset, PartitionTaskExecutor taskExecutor) {
        this(dataset, taskExecutor, taskExecutor.getConfig());
    }

    public SpatialQueries(PartitionedDataset<V> dataset, PartitionTaskExecutor taskExecutor, SieveConfig config) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset cannot be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * Records whose key intersects the query
     */
    public List<STRecord<V>> intersects(STObject query) {
        return filter(query, JoinPredicate.INTERSECTS);
    }

    /**
     * Records whose key contains the query
     */
    public List<STRecord<V>> contains(STObject query) {
        return filter(query, JoinPredicate.CONTAINS);
    }

    /**
     * Records whose key is contained by the query
     */
    public List<STRecord<V>> containedBy(STObject query) {
        return filter(query, JoinPredicate.CONTAINEDBY);
    }

    public List<STRecord<V>> filter(STObject query, JoinPredicate predicate) {
        return SpatialFilter.of(dataset, query, predicate, config.getIndexType(), config.getTreeOrder())
                            .collect(taskExecutor);
    }

    /**
     * Records satisfying {@code predicate.test(key, query)}. Every partition is scanned, without an index.
     */
    public List<STRecord<V>> filter(STObject query, BiPredicate<STObject, STObject> predicate) {
        return SpatialFilter.of(dataset, query, predicate, IndexType.NONE,
                                config.getTreeOrder()).collect(taskExecutor);
    }

    /**
     * Records with {@code distance(key, query) <= maxDistance}. Every partition is scanned.
     */
    public List<STRecord<V>> withinDistance(STObject query, double maxDistance,
                                            ToDoubleBiFunction<STObject, STObject> distance) {
        return new WithinDistanceScanner(taskExecutor, config.getTreeOrder()).withinDistance(dataset, query,
                                                                                             maxDistance, distance);
    }

    /**
     * The {@code k} records nearest to the query. See {@link DistributedKnn} for the accuracy of partition pruning.
     */
    public List<Neighbor<V>> kNN(STObject query, int k, ToDoubleBiFunction<STObject, STObject> distance) {
        return new DistributedKnn(taskExecutor, config).kNN(dataset, query, k, distance);
    }

    /**
     * Join by an arbitrary predicate, applied as {@code predicate.test(thisKey, otherKey)}. Computes and filters the
     * full cross product; neither partitions nor indexes can be used.
     */
    public <W> List<JoinPair<V, W>> join(PartitionedDataset<W> other, BiPredicate<STObject, STObject> predicate) {
        return new CartesianJoin(taskExecutor).join(dataset, other, predicate);
    }

    /**
     * Join by a fixed predicate, co-partitioning both inputs with the partitioner.
     *
     * @param partitioner when empty, both datasets must already share a partitioner, otherwise the cross product is
     *                    computed
     */
    public <W> List<JoinPair<V, W>> join(PartitionedDataset<W> other, JoinPredicate predicate,
                                         Optional<? extends Partitioner> partitioner) {
        return new PartitionedJoin(taskExecutor, config.getIndexType(), config.getTreeOrder()).join(dataset, other,
                                                                                                    predicate,
                                                                                                    partitioner);
    }

    /**
     * Density based clustering. Not implemented.
     *
     * @throws UnsupportedOperationException always
     */
    public <K> List<STRecord<ClusterAssignment<V>>> cluster(int minPts, double epsilon,
                                                            Function<STRecord<V>, K> keyExtractor,
                                                            boolean includeNoise, int maxPartitionCost) {
        throw new UnsupportedOperationException("Clustering is not implemented");
    }

    /**
     * Skyline of the records relative to a reference object. Not implemented.
     *
     * @throws UnsupportedOperationException always
     */
    public List<STRecord<V>> skyline(STObject reference, BiFunction<STObject, STObject, double[]> distance,
                                     BiPredicate<STObject, STObject> dominates, int partitionsPerDimension,
                                     boolean allowCache) {
        throw new UnsupportedOperationException("Skyline queries are not implemented");
    }

    /**
     * Skyline computed by aggregation. Not implemented.
     *
     * @throws UnsupportedOperationException always
     */
    public List<STRecord<V>> skylineAgg(STObject reference, BiFunction<STObject, STObject, double[]> distance,
                                        BiPredicate<STObject, STObject> dominates) {
        throw new UnsupportedOperationException("Skyline queries are not implemented");
    }

    /**
     * A record's cluster id paired with its payload
     */
    public record ClusterAssignment<V>(int clusterId, V value) {
    }
}

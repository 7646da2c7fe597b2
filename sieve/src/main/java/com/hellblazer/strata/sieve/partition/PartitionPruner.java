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

import com.hellblazer.strata.geometry.Interval;
import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.JoinPredicate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides which partitions of a dataset can hold a match for a query, without reading their records.
 *
 * <p>Pruning is sound but not complete: a partition is only dropped when its bounds prove that none of its records
 * can satisfy the predicate. Surviving partitions still need the exact predicate check. The survivors are renumbered
 * densely from 0 in their original order, each remembering the partition it came from.
 *
 * <p>Rules by partitioner:
 * <ul>
 *   <li>none, or an unknown kind: every partition survives</li>
 *   <li>{@link SpatialPartitioner}: the partition bounds must intersect the query envelope</li>
 *   <li>{@link TemporalPartitioner}: {@code INTERSECTS} needs intersecting bounds, {@code CONTAINS} needs bounds
 *   containing the query interval, {@code CONTAINEDBY} needs the range from this partition's start to the next
 *   partition's start to intersect the query interval</li>
 *   <li>no predicate (a caller supplied function): every partition survives</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public final class PartitionPruner {

    private static final Logger log = LoggerFactory.getLogger(PartitionPruner.class);

    private PartitionPruner() {
    }

    /**
     * @param numPartitions number of partitions in the dataset
     * @param partitioner   the partitioner that produced the dataset, if any
     * @param query         the query object
     * @param predicate     the predicate, or null for a caller supplied predicate function
     * @return the surviving partitions, renumbered
     * @throws IllegalArgumentException if a temporal partitioner is pruned with a query lacking an interval
     */
    public static List<PrunedPartition> prune(int numPartitions, Optional<? extends Partitioner> partitioner,
                                              STObject query, JoinPredicate predicate) {
        Objects.requireNonNull(partitioner, "Partitioner option cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
        if (partitioner.isEmpty() || predicate == null) {
            return all(numPartitions);
        }

        var p = partitioner.get();
        List<PrunedPartition> survivors;
        if (p instanceof SpatialPartitioner spatial) {
            survivors = pruneSpatial(numPartitions, spatial, query);
        } else if (p instanceof TemporalPartitioner temporal) {
            survivors = pruneTemporal(numPartitions, temporal, query, predicate);
        } else {
            survivors = all(numPartitions);
        }
        log.debug("{} query pruned {} of {} partitions", predicate, numPartitions - survivors.size(),
                  numPartitions);
        return survivors;
    }

    /**
     * Every partition, unchanged
     */
    public static List<PrunedPartition> all(int numPartitions) {
        var result = new ArrayList<PrunedPartition>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            result.add(new PrunedPartition(i, i));
        }
        return result;
    }

    private static List<PrunedPartition> pruneSpatial(int numPartitions, SpatialPartitioner partitioner,
                                                      STObject query) {
        return pruneByEnvelope(numPartitions, partitioner, query.envelope(), 0.0);
    }

    /**
     * Keep the partitions whose bounds, widened by {@code margin}, intersect the envelope. A null envelope (a
     * spatially unbounded query) keeps every partition.
     */
    public static List<PrunedPartition> pruneByEnvelope(int numPartitions, SpatialPartitioner partitioner,
                                                        Envelope queryEnvelope, double margin) {
        if (queryEnvelope.isNull()) {
            return all(numPartitions);
        }
        var survivors = new ArrayList<PrunedPartition>();
        for (int i = 0; i < numPartitions; i++) {
            var bounds = new Envelope(partitioner.partitionBounds(i));
            if (margin > 0) {
                bounds.expandBy(margin);
            }
            if (bounds.intersects(queryEnvelope)) {
                survivors.add(new PrunedPartition(survivors.size(), i));
            }
        }
        return survivors;
    }

    private static List<PrunedPartition> pruneTemporal(int numPartitions, TemporalPartitioner partitioner,
                                                       STObject query, JoinPredicate predicate) {
        var queryInterval = query.interval()
                                 .orElseThrow(() -> new IllegalArgumentException(
                                 "Temporal partition pruning requires a query interval: " + query));
        var survivors = new ArrayList<PrunedPartition>();
        for (int i = 0; i < numPartitions; i++) {
            if (mayMatch(partitioner, i, numPartitions, queryInterval, predicate)) {
                survivors.add(new PrunedPartition(survivors.size(), i));
            }
        }
        return survivors;
    }

    private static boolean mayMatch(TemporalPartitioner partitioner, int i, int numPartitions, Interval query,
                                    JoinPredicate predicate) {
        var bounds = partitioner.partitionBounds(i);
        return switch (predicate) {
            case INTERSECTS -> bounds.intersects(query);
            case CONTAINS -> bounds.contains(query);
            case CONTAINEDBY -> {
                // a record contained by the query starts inside it, and records are bucketed by start
                var startRange = i == numPartitions - 1 ? bounds : Interval.halfOpen(bounds.start(),
                                                                                     partitioner.partitionBounds(
                                                                                     i + 1).start());
                yield startRange.intersects(query);
            }
        };
    }
}

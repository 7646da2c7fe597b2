/*
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.strata.sieve.partition;

import com.hellblazer.strata.geometry.Interval;
import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.JoinPredicate;
import com.hellblazer.strata.sieve.SieveTestUtil;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static com.hellblazer.strata.sieve.SieveTestUtil.box;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class PartitionPrunerTest {

    private static Set<Integer> parents(List<PrunedPartition> pruned) {
        return pruned.stream().map(PrunedPartition::parentIndex).collect(Collectors.toSet());
    }

    @Test
    void testNoPartitionerKeepsEverything() {
        var pruned = PartitionPruner.prune(4, Optional.empty(), STObject.point(0, 0), JoinPredicate.INTERSECTS);
        assertEquals(List.of(new PrunedPartition(0, 0), new PrunedPartition(1, 1), new PrunedPartition(2, 2),
                             new PrunedPartition(3, 3)), pruned);
    }

    @Test
    void testNoPredicateKeepsEverything() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10, 20 }, 30);
        var pruned = PartitionPruner.prune(3, Optional.of(partitioner), STObject.temporal(Interval.instant(5)),
                                           null);
        assertEquals(3, pruned.size());
    }

    @Test
    void testContainedByKeepsEveryBucketWhoseStartsOverlapTheQuery() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10, 20 }, 30);
        var pruned = PartitionPruner.prune(3, Optional.of(partitioner), STObject.temporal(Interval.closed(5, 25)),
                                           JoinPredicate.CONTAINEDBY);
        assertEquals(Set.of(0, 1, 2), parents(pruned));
    }

    @Test
    void testTemporalPruningRenumbersDensely() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10, 20 }, 30);
        var query = STObject.temporal(Interval.closed(12, 15));

        assertEquals(List.of(new PrunedPartition(0, 1)),
                     PartitionPruner.prune(3, Optional.of(partitioner), query, JoinPredicate.INTERSECTS));
        assertEquals(List.of(new PrunedPartition(0, 1)),
                     PartitionPruner.prune(3, Optional.of(partitioner), query, JoinPredicate.CONTAINS));
        assertTrue(PartitionPruner.prune(3, Optional.of(partitioner), STObject.temporal(Interval.closed(5, 15)),
                                         JoinPredicate.CONTAINS).isEmpty());
    }

    @Test
    void testTemporalPruningNeedsAQueryInterval() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10 }, 20);
        assertThrows(IllegalArgumentException.class,
                     () -> PartitionPruner.prune(2, Optional.of(partitioner), STObject.point(1, 1),
                                                 JoinPredicate.INTERSECTS));
    }

    @Test
    void testSpatialPruningAgainstMockedBounds() {
        var partitioner = mock(SpatialPartitioner.class);
        when(partitioner.numPartitions()).thenReturn(3);
        when(partitioner.partitionBounds(0)).thenReturn(new Envelope(0, 10, 0, 10));
        when(partitioner.partitionBounds(1)).thenReturn(new Envelope(10, 20, 0, 10));
        when(partitioner.partitionBounds(2)).thenReturn(new Envelope(20, 30, 0, 10));

        var pruned = PartitionPruner.prune(3, Optional.of(partitioner), box(12, 2, 14, 4), JoinPredicate.INTERSECTS);
        assertEquals(List.of(new PrunedPartition(0, 1)), pruned);

        // boundary contact counts as intersection
        pruned = PartitionPruner.prune(3, Optional.of(partitioner), box(18, 2, 20, 4), JoinPredicate.CONTAINEDBY);
        assertEquals(List.of(new PrunedPartition(0, 1), new PrunedPartition(1, 2)), pruned);
        verify(partitioner, never()).partitionFor(any());
    }

    @Test
    void testMarginWidensBoundsWithoutMutatingThem() {
        var first = new Envelope(0, 10, 0, 10);
        var partitioner = mock(SpatialPartitioner.class);
        when(partitioner.partitionBounds(anyInt())).thenReturn(first);

        var far = new Envelope(13, 14, 13, 14);
        assertTrue(PartitionPruner.pruneByEnvelope(1, partitioner, far, 0.0).isEmpty());
        assertEquals(1, PartitionPruner.pruneByEnvelope(1, partitioner, far, 5.0).size());
        assertEquals(new Envelope(0, 10, 0, 10), first);
    }

    @Test
    void testSpatiallyUnboundedQueryKeepsEveryCell() {
        var keys = SieveTestUtil.randomPoints(new Random(3), 50, 100)
                                .stream()
                                .map(r -> r.key())
                                .collect(Collectors.toList());
        var grid = GridPartitioner.build(3, keys);
        var pruned = PartitionPruner.prune(9, Optional.of(grid), STObject.temporal(Interval.closed(0, 1)),
                                           JoinPredicate.INTERSECTS);
        assertEquals(9, pruned.size());
    }

    @ParameterizedTest
    @EnumSource(JoinPredicate.class)
    void testSpatialPruningNeverDropsAMatch(JoinPredicate predicate) {
        var random = new Random(7);
        var records = SieveTestUtil.randomBoxes(random, 400, 100, 8);
        var grid = GridPartitioner.build(4, records.stream().map(r -> r.key()).collect(Collectors.toList()));
        var dataset = PartitionedDataset.parallelize(records, 3).partitionBy(grid);

        for (int q = 0; q < 25; q++) {
            var x = random.nextDouble() * 100;
            var y = random.nextDouble() * 100;
            var query = box(x, y, x + random.nextDouble() * 30, y + random.nextDouble() * 30);
            var kept = parents(PartitionPruner.prune(dataset.numPartitions(), dataset.partitioner(), query,
                                                     predicate));
            for (int i = 0; i < dataset.numPartitions(); i++) {
                for (var record : dataset.partition(i)) {
                    if (predicate.test(record.key(), query)) {
                        assertTrue(kept.contains(i), "partition " + i + " holds a match for " + query);
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @EnumSource(JoinPredicate.class)
    void testTemporalPruningNeverDropsAMatch(JoinPredicate predicate) {
        var random = new Random(11);
        var records = SieveTestUtil.randomTimedPoints(random, 400, 100, 1000, 60);
        var buckets = StartTimePartitioner.build(6, records.stream().map(r -> r.key()).collect(Collectors.toList()));
        var dataset = PartitionedDataset.parallelize(records, 2).partitionBy(buckets);

        for (int q = 0; q < 40; q++) {
            var start = random.nextInt(1000);
            var query = STObject.temporal(Interval.closed(start, start + random.nextInt(200)));
            var kept = parents(PartitionPruner.prune(dataset.numPartitions(), dataset.partitioner(), query,
                                                     predicate));
            for (int i = 0; i < dataset.numPartitions(); i++) {
                for (var record : dataset.partition(i)) {
                    if (predicate.test(record.key(), query)) {
                        assertTrue(kept.contains(i), "partition " + i + " holds a match for " + query);
                    }
                }
            }
        }
    }
}

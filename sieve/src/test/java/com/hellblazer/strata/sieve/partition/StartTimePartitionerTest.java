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
import com.hellblazer.strata.sieve.SieveTestUtil;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class StartTimePartitionerTest {

    private static STObject timed(long start, long end) {
        return STObject.temporal(Interval.closed(start, end));
    }

    @Test
    void testExplicitBuckets() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10, 20 }, 30);

        assertEquals(3, partitioner.numPartitions());
        assertEquals(Interval.halfOpen(0, 10), partitioner.partitionBounds(0));
        assertEquals(Interval.halfOpen(10, 20), partitioner.partitionBounds(1));
        assertEquals(Interval.closed(20, 30), partitioner.partitionBounds(2));

        assertEquals(0, partitioner.partitionFor(timed(0, 9)));
        assertEquals(1, partitioner.partitionFor(timed(10, 19)));
        assertEquals(2, partitioner.partitionFor(timed(25, 30)));
    }

    @Test
    void testExplicitBucketsRejectStragglers() {
        var partitioner = StartTimePartitioner.ofBuckets(new long[] { 0, 10, 20 }, 30);
        assertThrows(IllegalArgumentException.class, () -> partitioner.partitionFor(timed(5, 12)));
        assertThrows(IllegalArgumentException.class, () -> partitioner.partitionFor(timed(-1, 2)));
        assertThrows(IllegalArgumentException.class, () -> partitioner.partitionFor(STObject.point(0, 0)));
    }

    @Test
    void testInvalidBuckets() {
        assertThrows(IllegalArgumentException.class, () -> StartTimePartitioner.ofBuckets(new long[0], 10));
        assertThrows(IllegalArgumentException.class, () -> StartTimePartitioner.ofBuckets(new long[] { 0, 0 }, 10));
        assertThrows(IllegalArgumentException.class, () -> StartTimePartitioner.ofBuckets(new long[] { 0, 20 }, 10));
        assertThrows(IllegalArgumentException.class, () -> StartTimePartitioner.build(0, List.of(timed(0, 1))));
        assertThrows(IllegalArgumentException.class, () -> StartTimePartitioner.build(2, List.of()));
    }

    @Test
    void testBuiltBucketsStretchToTheLongestInterval() {
        var partitioner = StartTimePartitioner.build(2, List.of(timed(0, 50), timed(3, 4), timed(10, 12)));

        assertEquals(2, partitioner.numPartitions());
        assertEquals(Interval.closed(0, 50), partitioner.partitionBounds(0));
        assertEquals(Interval.closed(6, 12), partitioner.partitionBounds(1));
        assertEquals(0, partitioner.partitionFor(timed(0, 50)));
        assertEquals(1, partitioner.partitionFor(timed(10, 12)));
    }

    @Test
    void testEveryBuiltKeyHasABucket() {
        var keys = SieveTestUtil.randomTimedPoints(new Random(17), 500, 10, 10_000, 500)
                                .stream()
                                .map(r -> r.key())
                                .collect(Collectors.toList());
        var partitioner = StartTimePartitioner.build(8, keys);
        for (var key : keys) {
            var bucket = partitioner.partitionFor(key);
            assertTrue(partitioner.partitionBounds(bucket).contains(key.interval().get()));
        }
    }

    @Test
    void testFewerDistinctStartsThanBuckets() {
        var partitioner = StartTimePartitioner.build(5, List.of(timed(7, 9), timed(7, 8)));
        assertEquals(1, partitioner.numPartitions());
        assertEquals(Interval.closed(7, 9), partitioner.partitionBounds(0));
    }

    @Test
    void testBuiltBucketsSpanTheWholeTimeline() {
        var earliest = timed(Long.MIN_VALUE, Long.MIN_VALUE + 1);
        var latest = timed(Long.MAX_VALUE - 1, Long.MAX_VALUE);
        var partitioner = StartTimePartitioner.build(4, List.of(earliest, latest));

        assertEquals(4, partitioner.numPartitions());
        assertEquals(Interval.halfOpen(Long.MIN_VALUE, Long.MIN_VALUE + (1L << 62)), partitioner.partitionBounds(0));
        assertEquals(Interval.halfOpen(0, 1L << 62), partitioner.partitionBounds(2));
        assertEquals(Interval.closed(1L << 62, Long.MAX_VALUE), partitioner.partitionBounds(3));
        assertEquals(0, partitioner.partitionFor(earliest));
        assertEquals(3, partitioner.partitionFor(latest));
    }
}

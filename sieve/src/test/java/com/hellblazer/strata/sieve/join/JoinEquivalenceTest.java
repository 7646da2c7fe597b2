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
package com.hellblazer.strata.sieve.join;

import com.hellblazer.strata.geometry.Interval;
import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.JoinPredicate;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.SieveConfig;
import com.hellblazer.strata.sieve.SieveTestUtil;
import com.hellblazer.strata.sieve.exec.PartitionTaskExecutor;
import com.hellblazer.strata.sieve.exec.PartitionedDataset;
import com.hellblazer.strata.sieve.index.IndexType;
import com.hellblazer.strata.sieve.partition.GridPartitioner;
import com.hellblazer.strata.sieve.partition.StartTimePartitioner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Partitioned joins must find exactly the pairs the cross product finds, whatever the partitioning
 */
public class JoinEquivalenceTest {

    private PartitionTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new PartitionTaskExecutor(SieveConfig.builder().withParallelism(4).build());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    static Stream<Arguments> predicateAndIndex() {
        var arguments = new ArrayList<Arguments>();
        for (var predicate : JoinPredicate.values()) {
            for (var index : IndexType.values()) {
                arguments.add(Arguments.of(predicate, index));
            }
        }
        return arguments.stream();
    }

    private static List<STObject> keys(List<STRecord<Integer>> left, List<STRecord<Integer>> right) {
        return Stream.concat(left.stream(), right.stream()).map(STRecord::key).collect(Collectors.toList());
    }

    private static List<STRecord<Integer>> temporalRecords(Random random, int n, int maxLength) {
        var records = new ArrayList<STRecord<Integer>>();
        for (int i = 0; i < n; i++) {
            var start = random.nextInt(1000);
            records.add(STRecord.of(STObject.temporal(Interval.closed(start, start + random.nextInt(maxLength))), i));
        }
        return records;
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("predicateAndIndex")
    void testGridPartitionedJoinMatchesCrossProduct(JoinPredicate predicate, IndexType indexType) {
        var random = new Random(predicate.ordinal() * 7 + indexType.ordinal());
        // the containing side gets the larger boxes
        var containedBy = predicate == JoinPredicate.CONTAINEDBY;
        var left = SieveTestUtil.randomBoxes(random, 150, 100, containedBy ? 3 : 20);
        var right = SieveTestUtil.randomBoxes(random, 150, 100, containedBy ? 20 : 3);
        var grid = GridPartitioner.build(4, keys(left, right));

        var leftData = PartitionedDataset.parallelize(left, 3);
        var rightData = PartitionedDataset.parallelize(right, 2);

        var expected = new CartesianJoin(executor).join(leftData, rightData, predicate.function());
        var actual = new PartitionedJoin(executor, indexType, 3).join(leftData, rightData, predicate,
                                                                      Optional.of(grid));
        assertFalse(expected.isEmpty(), "fixture should produce matches");
        assertEquals(expected.size(), actual.size());
        assertEquals(new HashSet<>(expected), new HashSet<>(actual));
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("predicateAndIndex")
    void testTemporallyPartitionedJoinMatchesCrossProduct(JoinPredicate predicate, IndexType indexType) {
        var random = new Random(100 + predicate.ordinal() * 7 + indexType.ordinal());
        var containedBy = predicate == JoinPredicate.CONTAINEDBY;
        var left = temporalRecords(random, 200, containedBy ? 15 : 120);
        var right = temporalRecords(random, 200, containedBy ? 120 : 15);
        var buckets = StartTimePartitioner.build(5, keys(left, right));

        var leftData = PartitionedDataset.parallelize(left, 2);
        var rightData = PartitionedDataset.parallelize(right, 2);

        var expected = new CartesianJoin(executor).join(leftData, rightData, predicate.function());
        var actual = new PartitionedJoin(executor, indexType, 3).join(leftData, rightData, predicate,
                                                                      Optional.of(buckets));
        assertFalse(expected.isEmpty(), "fixture should produce matches");
        assertEquals(expected.size(), actual.size());
        assertEquals(new HashSet<>(expected), new HashSet<>(actual));
    }

    @Test
    void testAlreadyCoPartitionedInputs() {
        var random = new Random(8);
        var left = SieveTestUtil.randomBoxes(random, 100, 50, 6);
        var right = SieveTestUtil.randomBoxes(random, 100, 50, 6);
        var grid = GridPartitioner.build(3, keys(left, right));
        var leftData = PartitionedDataset.parallelize(left, 2).partitionBy(grid);
        var rightData = PartitionedDataset.parallelize(right, 2).partitionBy(grid);

        var expected = new CartesianJoin(executor).join(leftData, rightData, JoinPredicate.INTERSECTS.function());
        var actual = new PartitionedJoin(executor, IndexType.SPATIAL, 4).join(leftData, rightData,
                                                                              JoinPredicate.INTERSECTS,
                                                                              Optional.empty());
        assertEquals(new HashSet<>(expected), new HashSet<>(actual));
    }

    @Test
    void testWithoutSharedPartitionerFallsBackToCrossProduct() {
        var random = new Random(9);
        var left = SieveTestUtil.randomBoxes(random, 60, 30, 6);
        var right = SieveTestUtil.randomBoxes(random, 60, 30, 6);
        var leftData = PartitionedDataset.parallelize(left, 2);
        var rightData = PartitionedDataset.parallelize(right, 3);

        var expected = new CartesianJoin(executor).join(leftData, rightData, JoinPredicate.CONTAINEDBY.function());
        var actual = new PartitionedJoin(executor, IndexType.NONE, 0).join(leftData, rightData,
                                                                           JoinPredicate.CONTAINEDBY,
                                                                           Optional.empty());
        assertEquals(expected, actual);
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionedJoin(executor, IndexType.SPATIAL, 0));
    }
}

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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;

/**
 * Buckets records by the start of their time interval. Bucket {@code i} receives the keys starting in
 * {@code [start(i), start(i + 1))}; the last bucket receives every key starting at or after its start.
 *
 * <p>A bucket's bounds cover the full intervals of the keys it holds, which may reach past the next bucket's start.
 *
 * @author hal.hildebrand
 */
public class StartTimePartitioner implements TemporalPartitioner {

    private final long[]     starts;
    private final Interval[] bounds;

    private StartTimePartitioner(long[] starts, Interval[] bounds) {
        this.starts = starts;
        this.bounds = bounds;
    }

    /**
     * Declare buckets directly: bucket {@code i} is {@code [starts[i], starts[i + 1])} and the last bucket is
     * {@code [starts[last], end]}. Keys must fit entirely inside their bucket.
     *
     * @throws IllegalArgumentException if the starts are empty or not strictly increasing, or {@code end} precedes
     *                                  the last start
     */
    public static StartTimePartitioner ofBuckets(long[] starts, long end) {
        Objects.requireNonNull(starts, "Starts cannot be null");
        checkStarts(starts);
        var last = starts.length - 1;
        if (end < starts[last]) {
            throw new IllegalArgumentException("End " + end + " precedes the last bucket start " + starts[last]);
        }
        var bounds = new Interval[starts.length];
        for (int i = 0; i < last; i++) {
            bounds[i] = Interval.halfOpen(starts[i], starts[i + 1]);
        }
        bounds[last] = Interval.closed(starts[last], end);
        return new StartTimePartitioner(starts.clone(), bounds);
    }

    /**
     * Build up to {@code numBuckets} equal-width buckets over the start times of the given keys, with bounds widened
     * to the intervals of the keys in each bucket.
     *
     * @throws IllegalArgumentException if there are no keys, a key has no interval, or {@code numBuckets <= 0}
     */
    public static StartTimePartitioner build(int numBuckets, Iterable<STObject> keys) {
        if (numBuckets <= 0) {
            throw new IllegalArgumentException("Number of buckets must be positive: " + numBuckets);
        }
        Objects.requireNonNull(keys, "Keys cannot be null");
        var minStart = Long.MAX_VALUE;
        var maxStart = Long.MIN_VALUE;
        var count = 0;
        for (var key : keys) {
            var interval = intervalOf(key);
            minStart = Math.min(minStart, interval.start());
            maxStart = Math.max(maxStart, interval.start());
            count++;
        }
        if (count == 0) {
            throw new IllegalArgumentException("Cannot build buckets over no keys");
        }

        // the span of two extreme instants does not fit in a long
        var low = BigInteger.valueOf(minStart);
        var high = BigInteger.valueOf(maxStart);
        var buckets = BigInteger.valueOf(numBuckets);
        var width = high.subtract(low).add(BigInteger.ONE).add(buckets).subtract(BigInteger.ONE).divide(buckets);
        var startList = new ArrayList<Long>();
        for (int i = 0; i < numBuckets; i++) {
            var s = low.add(width.multiply(BigInteger.valueOf(i)));
            if (s.compareTo(high) > 0) {
                break;
            }
            startList.add(s.longValueExact());
        }
        var starts = startList.stream().mapToLong(Long::longValue).toArray();

        var maxEnds = new long[starts.length];
        Arrays.fill(maxEnds, Long.MIN_VALUE);
        for (var key : keys) {
            var interval = intervalOf(key);
            var bucket = bucketOf(starts, interval.start());
            maxEnds[bucket] = Math.max(maxEnds[bucket], interval.end());
        }

        var last = starts.length - 1;
        var bounds = new Interval[starts.length];
        for (int i = 0; i < last; i++) {
            bounds[i] = maxEnds[i] >= starts[i + 1] ? Interval.closed(starts[i], maxEnds[i])
                                                    : Interval.halfOpen(starts[i], starts[i + 1]);
        }
        bounds[last] = Interval.closed(starts[last], Math.max(starts[last], maxEnds[last]));
        return new StartTimePartitioner(starts, bounds);
    }

    private static void checkStarts(long[] starts) {
        if (starts.length == 0) {
            throw new IllegalArgumentException("At least one bucket start is required");
        }
        for (int i = 1; i < starts.length; i++) {
            if (starts[i] <= starts[i - 1]) {
                throw new IllegalArgumentException("Bucket starts must increase strictly: " + Arrays.toString(starts));
            }
        }
    }

    private static Interval intervalOf(STObject key) {
        return key.interval()
                  .orElseThrow(() -> new IllegalArgumentException("Cannot bucket a key without an interval: " + key));
    }

    private static int bucketOf(long[] starts, long start) {
        var i = Arrays.binarySearch(starts, start);
        return i >= 0 ? i : -i - 2;
    }

    @Override
    public int numPartitions() {
        return starts.length;
    }

    @Override
    public int partitionFor(STObject key) {
        var interval = intervalOf(key);
        var bucket = bucketOf(starts, interval.start());
        if (bucket < 0) {
            throw new IllegalArgumentException("Key " + key + " starts before the first bucket " + starts[0]);
        }
        if (!bounds[bucket].contains(interval)) {
            throw new IllegalArgumentException("Key " + key + " extends beyond bucket bounds " + bounds[bucket]);
        }
        return bucket;
    }

    @Override
    public Interval partitionBounds(int partitionId) {
        return bounds[partitionId];
    }

    @Override
    public String toString() {
        return "StartTimePartitioner" + Arrays.toString(bounds);
    }
}

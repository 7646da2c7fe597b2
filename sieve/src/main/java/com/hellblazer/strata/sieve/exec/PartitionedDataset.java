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
package com.hellblazer.strata.sieve.exec;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.partition.Partitioner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An immutable collection of records split into numbered partitions, optionally remembering the partitioner that
 * produced the split. Partition tasks read partitions concurrently; nothing here is ever mutated after construction.
 *
 * @param <V> the payload type
 * @author hal.hildebrand
 */
public final class PartitionedDataset<V> {

    private final List<List<STRecord<V>>>  partitions;
    private final Optional<Partitioner> partitioner;

    private PartitionedDataset(List<List<STRecord<V>>> partitions, Partitioner partitioner) {
        var copy = new ArrayList<List<STRecord<V>>>(partitions.size());
        for (var partition : partitions) {
            copy.add(List.copyOf(partition));
        }
        this.partitions = Collections.unmodifiableList(copy);
        this.partitioner = Optional.ofNullable(partitioner);
    }

    /**
     * Split records into {@code numSlices} contiguous partitions of near equal size, without a partitioner.
     *
     * @throws IllegalArgumentException if {@code numSlices <= 0}
     */
    public static <V> PartitionedDataset<V> parallelize(List<STRecord<V>> records, int numSlices) {
        Objects.requireNonNull(records, "Records cannot be null");
        if (numSlices <= 0) {
            throw new IllegalArgumentException("Number of slices must be positive: " + numSlices);
        }
        var slices = new ArrayList<List<STRecord<V>>>(numSlices);
        var size = records.size();
        for (int i = 0; i < numSlices; i++) {
            var from = (int) ((long) i * size / numSlices);
            var to = (int) ((long) (i + 1) * size / numSlices);
            slices.add(records.subList(from, to));
        }
        return new PartitionedDataset<>(slices, null);
    }

    /**
     * Wrap partitions that were produced by the given partitioner.
     *
     * @throws IllegalArgumentException if the partition count does not match the partitioner
     */
    public static <V> PartitionedDataset<V> of(List<List<STRecord<V>>> partitions, Partitioner partitioner) {
        Objects.requireNonNull(partitions, "Partitions cannot be null");
        if (partitioner != null && partitioner.numPartitions() != partitions.size()) {
            throw new IllegalArgumentException(
            "Partitioner declares " + partitioner.numPartitions() + " partitions but " + partitions.size()
            + " were supplied");
        }
        return new PartitionedDataset<>(partitions, partitioner);
    }

    /**
     * Redistribute the records with the given partitioner. Returns this dataset when it is already partitioned by an
     * equal partitioner.
     *
     * @throws IllegalArgumentException if the partitioner rejects a record
     */
    public PartitionedDataset<V> partitionBy(Partitioner target) {
        Objects.requireNonNull(target, "Partitioner cannot be null");
        if (partitioner.isPresent() && partitioner.get().equals(target)) {
            return this;
        }
        var buckets = new ArrayList<List<STRecord<V>>>(target.numPartitions());
        for (int i = 0; i < target.numPartitions(); i++) {
            buckets.add(new ArrayList<>());
        }
        for (var partition : partitions) {
            for (var record : partition) {
                buckets.get(target.partitionFor(record.key())).add(record);
            }
        }
        return new PartitionedDataset<>(buckets, target);
    }

    public int numPartitions() {
        return partitions.size();
    }

    /**
     * @return the records of one partition, in arrival order
     */
    public List<STRecord<V>> partition(int index) {
        return partitions.get(index);
    }

    public Optional<Partitioner> partitioner() {
        return partitioner;
    }

    /**
     * @return every record, partition by partition
     */
    public List<STRecord<V>> collect() {
        return partitions.stream().flatMap(List::stream).collect(Collectors.toList());
    }

    /**
     * @return every key, partition by partition
     */
    public List<STObject> keys() {
        return partitions.stream().flatMap(List::stream).map(STRecord::key).collect(Collectors.toList());
    }

    public long count() {
        return partitions.stream().mapToLong(List::size).sum();
    }

    @Override
    public String toString() {
        return "PartitionedDataset[partitions=" + partitions.size() + ", records=" + count() + ", partitioner="
        + partitioner.map(Object::toString).orElse("none") + "]";
    }
}

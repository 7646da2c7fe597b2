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
package com.hellblazer.strata.sieve.filter;

import com.hellblazer.strata.geometry.STObject;
import com.hellblazer.strata.sieve.STRecord;
import com.hellblazer.strata.sieve.index.EphemeralIndex;
import com.hellblazer.strata.sieve.index.IndexType;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Applies an exact predicate to the records of one partition, optionally narrowing the candidates with an ephemeral
 * index first.
 *
 * <p>With {@link IndexType#NONE} the result is a lazy view: every call to {@code iterator()} starts a fresh pass over
 * the partition. With an index, the partition is loaded into a fresh index, queried with the query's envelope or
 * interval, and the candidates are checked with the exact predicate. The index is never kept beyond the lookup that
 * built it.
 *
 * <p>The index only narrows on envelope or interval intersection, so the answer is the same under every index type
 * as long as the predicate implies that intersection, which holds for all {@link com.hellblazer.strata.sieve.JoinPredicate}s.
 * Results are always in arrival order.
 *
 * @param <V> the payload type
 * @author hal.hildebrand
 */
public class FilterExecutor<V> {

    private final IndexType indexType;
    private final int       treeOrder;

    /**
     * @throws IllegalArgumentException if {@code indexType} is SPATIAL and {@code treeOrder <= 0}
     */
    public FilterExecutor(IndexType indexType, int treeOrder) {
        this.indexType = Objects.requireNonNull(indexType, "Index type cannot be null");
        if (indexType == IndexType.SPATIAL && treeOrder <= 0) {
            throw new IllegalArgumentException("Spatial index requires a positive tree order: " + treeOrder);
        }
        this.treeOrder = treeOrder;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    /**
     * The records of {@code partition} whose keys satisfy {@code predicate.test(key, query)}
     */
    public Iterable<STRecord<V>> filter(Iterable<STRecord<V>> partition, STObject query,
                                      BiPredicate<STObject, STObject> predicate) {
        return prepare(partition).lookup(query, predicate);
    }

    /**
     * Prepare a partition for repeated probing, building its index once when one is configured.
     */
    public Lookup<V> prepare(Iterable<STRecord<V>> partition) {
        Objects.requireNonNull(partition, "Partition cannot be null");
        if (indexType == IndexType.NONE) {
            return new ScanLookup<>(partition);
        }
        EphemeralIndex<STRecord<V>> index = indexType.newIndex(treeOrder);
        for (var record : partition) {
            index.insert(record.key(), record);
        }
        index.build();
        return new IndexLookup<>(index);
    }

    /**
     * Exact filtering against one prepared partition
     */
    public interface Lookup<V> {
        Iterable<STRecord<V>> lookup(STObject query, BiPredicate<STObject, STObject> predicate);
    }

    private record ScanLookup<V>(Iterable<STRecord<V>> partition) implements Lookup<V> {
        @Override
        public Iterable<STRecord<V>> lookup(STObject query, BiPredicate<STObject, STObject> predicate) {
            Objects.requireNonNull(query, "Query cannot be null");
            Objects.requireNonNull(predicate, "Predicate cannot be null");
            return () -> StreamSupport.stream(partition.spliterator(), false)
                                      .filter(r -> predicate.test(r.key(), query))
                                      .iterator();
        }
    }

    private record IndexLookup<V>(EphemeralIndex<STRecord<V>> index) implements Lookup<V> {
        @Override
        public Iterable<STRecord<V>> lookup(STObject query, BiPredicate<STObject, STObject> predicate) {
            Objects.requireNonNull(predicate, "Predicate cannot be null");
            List<STRecord<V>> matches = index.query(query)
                                           .stream()
                                           .filter(r -> predicate.test(r.key(), query))
                                           .collect(Collectors.toList());
            return matches;
        }
    }
}

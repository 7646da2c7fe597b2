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
package com.hellblazer.strata.sieve.index;

import com.hellblazer.strata.geometry.STObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;
import java.util.stream.Collectors;

/**
 * Shared bookkeeping for the ephemeral indexes: entry sequencing, the insert/build lifecycle and the exhaustive
 * distance operations. Subclasses supply the tree that narrows range queries.
 *
 * @param <P> the payload type
 * @author hal.hildebrand
 */
public abstract class AbstractEphemeralIndex<P> implements EphemeralIndex<P> {

    /**
     * An inserted key and payload. {@code seq} is the insertion position and orders every result.
     */
    protected record Entry<P>(STObject key, P payload, int seq) {
    }

    protected final List<Entry<P>> entries = new ArrayList<>();
    private boolean built;

    @Override
    public final void insert(STObject key, P payload) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (built) {
            throw new IllegalStateException("Cannot insert into a built index");
        }
        var entry = new Entry<>(key, payload, entries.size());
        entries.add(entry);
        index(entry);
    }

    @Override
    public final void build() {
        if (built) {
            return;
        }
        built = true;
        finish();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public final List<P> query(STObject query) {
        Objects.requireNonNull(query, "Query cannot be null");
        build();
        return payloads(candidates(query));
    }

    @Override
    public List<P> kNN(STObject query, int k, ToDoubleBiFunction<STObject, STObject> distance) {
        Objects.requireNonNull(query, "Query cannot be null");
        Objects.requireNonNull(distance, "Distance function cannot be null");
        build();
        return nearest(entries, query, k, distance);
    }

    @Override
    public List<P> withinDistance(STObject query, ToDoubleBiFunction<STObject, STObject> distance,
                                  double maxDistance) {
        Objects.requireNonNull(query, "Query cannot be null");
        Objects.requireNonNull(distance, "Distance function cannot be null");
        build();
        // the distance function is opaque, so no tree node can be skipped
        return entries.stream()
                      .filter(e -> distance.applyAsDouble(e.key(), query) <= maxDistance)
                      .map(Entry::payload)
                      .collect(Collectors.toList());
    }

    /**
     * Add an entry to the underlying tree
     */
    protected abstract void index(Entry<P> entry);

    /**
     * Finalize the underlying tree
     */
    protected abstract void finish();

    /**
     * Superset of the entries that may satisfy a predicate against the query, in any order
     */
    protected abstract Collection<Entry<P>> candidates(STObject query);

    /**
     * The {@code k} entries nearest to the query among {@code candidates}, ties broken by insertion order
     */
    protected List<P> nearest(Collection<Entry<P>> candidates, STObject query, int k,
                              ToDoubleBiFunction<STObject, STObject> distance) {
        if (k <= 0) {
            return List.of();
        }
        return candidates.stream()
                         .map(e -> new Scored<>(e, distance.applyAsDouble(e.key(), query)))
                         .sorted(Comparator.<Scored<P>>comparingDouble(Scored::distance)
                                           .thenComparingInt(s -> s.entry().seq()))
                         .limit(k)
                         .map(s -> s.entry().payload())
                         .collect(Collectors.toList());
    }

    private List<P> payloads(Collection<Entry<P>> candidates) {
        return candidates.stream()
                         .sorted(Comparator.comparingInt(Entry::seq))
                         .map(Entry::payload)
                         .collect(Collectors.toList());
    }

    private record Scored<P>(Entry<P> entry, double distance) {
    }
}

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

import com.hellblazer.strata.geometry.Distances;
import com.hellblazer.strata.geometry.STObject;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.ItemBoundable;
import org.locationtech.jts.index.strtree.ItemDistance;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.ToDoubleBiFunction;

/**
 * Ephemeral R-tree over record envelopes, backed by a Sort-Tile-Recursive packed JTS {@link STRtree}.
 *
 * <p>Keys with an empty geometry have no envelope and cannot live in the tree. They are kept aside and offered as
 * candidates to every query.
 *
 * <p>Nearest neighbor search walks the tree only for {@link Distances.EnvelopeBounded} distances, whose value can be
 * bounded by envelope separation. Other distances are evaluated against every entry. Entries tied at the k-th
 * distance are all gathered before selection, so ties fall to insertion order whatever the tree order.
 *
 * @param <P> the payload type
 * @author hal.hildebrand
 */
public class SpatialTreeIndex<P> extends AbstractEphemeralIndex<P> {

    /** STRtree rejects node capacities below 2 */
    private static final int MIN_NODE_CAPACITY = 2;

    private final STRtree        tree;
    private final List<Entry<P>> unbounded = new ArrayList<>();

    /**
     * @param order the node capacity (fan-out) of the tree
     * @throws IllegalArgumentException if {@code order <= 0}
     */
    public SpatialTreeIndex(int order) {
        if (order <= 0) {
            throw new IllegalArgumentException("Tree order must be positive: " + order);
        }
        this.tree = new STRtree(Math.max(MIN_NODE_CAPACITY, order));
    }

    @Override
    protected void index(Entry<P> entry) {
        var envelope = entry.key().envelope();
        if (envelope.isNull()) {
            unbounded.add(entry);
        } else {
            tree.insert(envelope, entry);
        }
    }

    @Override
    protected void finish() {
        tree.build();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Collection<Entry<P>> candidates(STObject query) {
        var envelope = query.envelope();
        if (envelope.isNull()) {
            return entries;
        }
        var result = new ArrayList<Entry<P>>((List<Entry<P>>) tree.query(envelope));
        result.addAll(unbounded);
        return result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<P> kNN(STObject query, int k, ToDoubleBiFunction<STObject, STObject> distance) {
        var envelope = query.envelope();
        if (k <= 0 || envelope.isNull() || tree.size() == 0 || !Distances.isEnvelopeBounded(distance)) {
            return super.kNN(query, k, distance);
        }
        build();
        var target = new Entry<P>(query, null, -1);
        ItemDistance itemDistance = (a, b) -> distance.applyAsDouble(keyOf(a, b, target), query);
        var hits = tree.nearestNeighbour(envelope, target, itemDistance, k);

        var candidates = new ArrayList<Entry<P>>(hits.length + unbounded.size());
        if (hits.length < k) {
            for (var hit : hits) {
                candidates.add((Entry<P>) hit);
            }
        } else {
            // the tree picks arbitrarily among entries tied at the k-th distance; gather all of them
            var kth = 0.0;
            for (var hit : hits) {
                kth = Math.max(kth, distance.applyAsDouble(((Entry<P>) hit).key(), query));
            }
            candidates.addAll(withinEnvelopeDistance(envelope, query, kth, distance));
        }
        candidates.addAll(unbounded);
        return nearest(candidates, query, k, distance);
    }

    @SuppressWarnings("unchecked")
    private List<Entry<P>> withinEnvelopeDistance(Envelope envelope, STObject query, double maxDistance,
                                                  ToDoubleBiFunction<STObject, STObject> distance) {
        if (Double.isInfinite(maxDistance) || Double.isNaN(maxDistance)) {
            return new ArrayList<>(treeEntries());
        }
        var widened = new Envelope(envelope);
        widened.expandBy(maxDistance);
        var result = new ArrayList<Entry<P>>();
        for (var entry : (List<Entry<P>>) tree.query(widened)) {
            if (distance.applyAsDouble(entry.key(), query) <= maxDistance) {
                result.add(entry);
            }
        }
        return result;
    }

    private List<Entry<P>> treeEntries() {
        var result = new ArrayList<Entry<P>>(entries);
        result.removeAll(unbounded);
        return result;
    }

    // the tree pairs the query entry with stored entries in either position
    @SuppressWarnings("unchecked")
    private STObject keyOf(ItemBoundable a, ItemBoundable b, Entry<P> target) {
        var first = (Entry<P>) a.getItem();
        return first == target ? ((Entry<P>) b.getItem()).key() : first.key();
    }
}

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
import org.locationtech.jts.index.intervalrtree.SortedPackedIntervalRTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ephemeral interval tree over record time intervals, backed by a JTS {@link SortedPackedIntervalRTree}.
 *
 * <p>The JTS tree stores closed intervals, so half-open ends are widened to closed ones; the result is still a
 * superset of the true matches. Keys without an interval are kept aside and offered as candidates to every query,
 * and a query without an interval returns every entry.
 *
 * @param <P> the payload type
 * @author hal.hildebrand
 */
public class IntervalTreeIndex<P> extends AbstractEphemeralIndex<P> {

    private final SortedPackedIntervalRTree tree      = new SortedPackedIntervalRTree();
    private final List<Entry<P>>            untimed   = new ArrayList<>();
    private int                             treeCount = 0;

    @Override
    protected void index(Entry<P> entry) {
        var interval = entry.key().interval();
        if (interval.isEmpty()) {
            untimed.add(entry);
            return;
        }
        tree.insert(interval.get().start(), interval.get().end(), entry);
        treeCount++;
    }

    @Override
    protected void finish() {
        // SortedPackedIntervalRTree packs itself on first query
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Collection<Entry<P>> candidates(STObject query) {
        var interval = query.interval();
        if (interval.isEmpty()) {
            return entries;
        }
        var result = new ArrayList<Entry<P>>(untimed);
        if (treeCount > 0) {
            tree.query(interval.get().start(), interval.get().end(), item -> result.add((Entry<P>) item));
        }
        return result;
    }
}

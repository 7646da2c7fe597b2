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

import java.util.List;
import java.util.function.ToDoubleBiFunction;

/**
 * An index built for one partition task and discarded when the task ends. Implementations are not thread safe and
 * are never shared between tasks.
 *
 * <p>Usage follows a fixed lifecycle: {@link #insert} every record, {@link #build()} once, then query. Inserting after
 * {@code build()} is an {@link IllegalStateException}.
 *
 * @param <P> the payload stored with each key
 * @author hal.hildebrand
 */
public interface EphemeralIndex<P> {

    /**
     * Add a key and its payload
     */
    void insert(STObject key, P payload);

    /**
     * Finalize the index. No further inserts are accepted.
     */
    void build();

    /**
     * @return the number of inserted entries
     */
    int size();

    /**
     * Coarse range query. The result is a superset of the payloads whose keys satisfy any of the join predicates
     * against {@code query}, in insertion order.
     */
    List<P> query(STObject query);

    /**
     * Up to {@code k} payloads nearest to {@code query} under {@code distance}, evaluated as
     * {@code distance(key, query)}
     */
    List<P> kNN(STObject query, int k, ToDoubleBiFunction<STObject, STObject> distance);

    /**
     * Exactly the payloads whose keys satisfy {@code distance(key, query) <= maxDistance}, in insertion order
     */
    List<P> withinDistance(STObject query, ToDoubleBiFunction<STObject, STObject> distance, double maxDistance);
}

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
package com.hellblazer.strata.sieve;

import com.hellblazer.strata.geometry.STObject;

import java.util.function.BiPredicate;

/**
 * The fixed join and filter predicates. Each constant carries its test, applied as {@code test(a, b)} where
 * {@code a} is the record key and {@code b} is the query object (or the right-hand key of a join).
 *
 * <p>Predicates outside this set are passed to the query operators as a plain {@link BiPredicate}; such predicates
 * give up partition pruning.
 *
 * @author hal.hildebrand
 */
public enum JoinPredicate {
    /**
     * {@code a} and {@code b} share at least one point
     */
    INTERSECTS(STObject::intersects),

    /**
     * every point of {@code b} lies within {@code a}
     */
    CONTAINS(STObject::contains),

    /**
     * every point of {@code a} lies within {@code b}
     */
    CONTAINEDBY(STObject::containedBy);

    private final BiPredicate<STObject, STObject> function;

    JoinPredicate(BiPredicate<STObject, STObject> function) {
        this.function = function;
    }

    public BiPredicate<STObject, STObject> function() {
        return function;
    }

    public boolean test(STObject a, STObject b) {
        return function.test(a, b);
    }
}

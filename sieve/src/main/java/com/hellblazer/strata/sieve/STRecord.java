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

import java.util.Objects;

/**
 * A spatio-temporal key paired with an arbitrary payload. Keys need not be unique.
 *
 * @param key   the spatio-temporal object the queries test
 * @param value the payload carried through untouched
 * @param <V>   the payload type
 */
public record STRecord<V>(STObject key, V value) {

    public STRecord {
        Objects.requireNonNull(key, "Record key cannot be null");
    }

    public static <V> STRecord<V> of(STObject key, V value) {
        return new STRecord<>(key, value);
    }
}

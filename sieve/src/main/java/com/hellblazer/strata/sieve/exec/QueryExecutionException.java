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

/**
 * A partition task failed on every attempt, or the query was interrupted while waiting for its tasks.
 *
 * @author hal.hildebrand
 */
public class QueryExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int taskIndex;

    public QueryExecutionException(String message, int taskIndex, Throwable cause) {
        super(message, cause);
        this.taskIndex = taskIndex;
    }

    /**
     * @return the index of the failing task, or -1 if no single task is to blame
     */
    public int getTaskIndex() {
        return taskIndex;
    }
}

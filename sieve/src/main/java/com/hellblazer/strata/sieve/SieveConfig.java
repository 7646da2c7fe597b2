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

import com.hellblazer.strata.sieve.index.IndexType;

/**
 * Configuration for partition-pruned query execution. Instances are immutable and created through a
 * {@link Builder}, or from {@code strata.sieve.*} system properties.
 *
 * @author hal.hildebrand
 */
public class SieveConfig {

    public static final String PROPERTY_PREFIX = "strata.sieve.";

    private final int       parallelism;
    private final int       minPartitionsForParallel;
    private final IndexType indexType;
    private final int       treeOrder;
    private final boolean   knnPruning;
    private final double    knnSafetyMargin;
    private final int       maxTaskAttempts;

    private SieveConfig(Builder builder) {
        this.parallelism = builder.parallelism;
        this.minPartitionsForParallel = builder.minPartitionsForParallel;
        this.indexType = builder.indexType;
        this.treeOrder = builder.treeOrder;
        this.knnPruning = builder.knnPruning;
        this.knnSafetyMargin = builder.knnSafetyMargin;
        this.maxTaskAttempts = builder.maxTaskAttempts;
    }

    /**
     * Number of worker threads used for partition tasks
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * Below this many partition tasks, tasks run on the calling thread
     */
    public int getMinPartitionsForParallel() {
        return minPartitionsForParallel;
    }

    /**
     * Index policy used by filters and partitioned joins
     */
    public IndexType getIndexType() {
        return indexType;
    }

    /**
     * Node capacity of the ephemeral R-trees
     */
    public int getTreeOrder() {
        return treeOrder;
    }

    /**
     * Whether kNN skips partitions whose bounds miss the query envelope
     */
    public boolean isKnnPruning() {
        return knnPruning;
    }

    /**
     * Distance by which partition bounds are widened before the kNN pruning test
     */
    public double getKnnSafetyMargin() {
        return knnSafetyMargin;
    }

    /**
     * Number of times a failing partition task is attempted before the query fails
     */
    public int getMaxTaskAttempts() {
        return maxTaskAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SieveConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Build a configuration from {@code strata.sieve.*} system properties, falling back to the defaults for any
     * property that is not set.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static SieveConfig fromSystemProperties() {
        var builder = builder();
        var parallelism = Integer.getInteger(PROPERTY_PREFIX + "parallelism");
        if (parallelism != null) {
            builder.withParallelism(parallelism);
        }
        var minPartitions = Integer.getInteger(PROPERTY_PREFIX + "minPartitionsForParallel");
        if (minPartitions != null) {
            builder.withMinPartitionsForParallel(minPartitions);
        }
        var indexType = System.getProperty(PROPERTY_PREFIX + "indexType");
        if (indexType != null) {
            builder.withIndexType(IndexType.valueOf(indexType.trim().toUpperCase()));
        }
        var treeOrder = Integer.getInteger(PROPERTY_PREFIX + "treeOrder");
        if (treeOrder != null) {
            builder.withTreeOrder(treeOrder);
        }
        var knnPruning = System.getProperty(PROPERTY_PREFIX + "knnPruning");
        if (knnPruning != null) {
            builder.withKnnPruning(Boolean.parseBoolean(knnPruning.trim()));
        }
        var margin = System.getProperty(PROPERTY_PREFIX + "knnSafetyMargin");
        if (margin != null) {
            try {
                builder.withKnnSafetyMargin(Double.parseDouble(margin.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + PROPERTY_PREFIX + "knnSafetyMargin: " + margin, e);
            }
        }
        var attempts = Integer.getInteger(PROPERTY_PREFIX + "maxTaskAttempts");
        if (attempts != null) {
            builder.withMaxTaskAttempts(attempts);
        }
        return builder.build();
    }

    public static class Builder {
        private int       parallelism              = Runtime.getRuntime().availableProcessors();
        private int       minPartitionsForParallel = 2;
        private IndexType indexType                = IndexType.SPATIAL;
        private int       treeOrder                = 10;
        private boolean   knnPruning               = true;
        private double    knnSafetyMargin          = 0.0;
        private int       maxTaskAttempts          = 1;

        private Builder() {
        }

        public Builder withParallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder withMinPartitionsForParallel(int minPartitions) {
            this.minPartitionsForParallel = minPartitions;
            return this;
        }

        public Builder withIndexType(IndexType indexType) {
            if (indexType == null) {
                throw new IllegalArgumentException("Index type cannot be null");
            }
            this.indexType = indexType;
            return this;
        }

        /**
         * Sets the R-tree node capacity. Validated against the index type in {@link #build()}.
         */
        public Builder withTreeOrder(int treeOrder) {
            this.treeOrder = treeOrder;
            return this;
        }

        public Builder withKnnPruning(boolean pruning) {
            this.knnPruning = pruning;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the margin is negative or not a number
         */
        public Builder withKnnSafetyMargin(double margin) {
            if (Double.isNaN(margin) || margin < 0) {
                throw new IllegalArgumentException("kNN safety margin must be non-negative: " + margin);
            }
            this.knnSafetyMargin = margin;
            return this;
        }

        public Builder withMaxTaskAttempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Max task attempts must be at least 1: " + attempts);
            }
            this.maxTaskAttempts = attempts;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the index type is SPATIAL and the tree order is not positive
         */
        public SieveConfig build() {
            if (indexType == IndexType.SPATIAL && treeOrder <= 0) {
                throw new IllegalArgumentException("Spatial index requires a positive tree order: " + treeOrder);
            }
            return new SieveConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format(
        "SieveConfig[parallelism=%d, minPartitionsForParallel=%d, index=%s, treeOrder=%d, knnPruning=%s, knnMargin=%.3f, attempts=%d]",
        parallelism, minPartitionsForParallel, indexType, treeOrder, knnPruning, knnSafetyMargin, maxTaskAttempts);
    }
}

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
package com.hellblazer.strata.sieve.partition;

import com.hellblazer.strata.geometry.STObject;
import org.locationtech.jts.geom.Envelope;

import java.util.Arrays;
import java.util.Objects;

/**
 * A uniform grid over the extent of a sample of keys. A key is assigned to the cell holding the centre of its
 * envelope; each partition's bounds are that cell widened to the envelopes of the sample keys assigned to it.
 *
 * <p>Keys that would reach beyond their cell's bounds are rejected by {@link #partitionFor(STObject)}, so the grid
 * must be built over every key it will partition. To co-partition two datasets, build it over the keys of both.
 *
 * @author hal.hildebrand
 */
public class GridPartitioner implements SpatialPartitioner {

    private final int        cellsPerDimension;
    private final double     minX;
    private final double     minY;
    private final double     cellWidth;
    private final double     cellHeight;
    private final Envelope[] bounds;

    private GridPartitioner(int cellsPerDimension, Envelope extent) {
        this.cellsPerDimension = cellsPerDimension;
        this.minX = extent.getMinX();
        this.minY = extent.getMinY();
        this.cellWidth = extent.getWidth() / cellsPerDimension;
        this.cellHeight = extent.getHeight() / cellsPerDimension;
        this.bounds = new Envelope[cellsPerDimension * cellsPerDimension];
        for (int row = 0; row < cellsPerDimension; row++) {
            for (int col = 0; col < cellsPerDimension; col++) {
                bounds[row * cellsPerDimension + col] = new Envelope(minX + col * cellWidth,
                                                                     minX + (col + 1) * cellWidth,
                                                                     minY + row * cellHeight,
                                                                     minY + (row + 1) * cellHeight);
            }
        }
    }

    /**
     * Build a grid of {@code cellsPerDimension * cellsPerDimension} partitions over the given keys.
     *
     * @throws IllegalArgumentException if there are no keys, a key has an empty geometry, or the cell count is not
     *                                  positive
     */
    public static GridPartitioner build(int cellsPerDimension, Iterable<STObject> keys) {
        if (cellsPerDimension <= 0) {
            throw new IllegalArgumentException("Cells per dimension must be positive: " + cellsPerDimension);
        }
        Objects.requireNonNull(keys, "Keys cannot be null");
        var extent = new Envelope();
        for (var key : keys) {
            extent.expandToInclude(envelopeOf(key));
        }
        if (extent.isNull()) {
            throw new IllegalArgumentException("Cannot build a grid over no keys");
        }
        var grid = new GridPartitioner(cellsPerDimension, extent);
        for (var key : keys) {
            var envelope = envelopeOf(key);
            grid.bounds[grid.cellOf(envelope)].expandToInclude(envelope);
        }
        return grid;
    }

    private static Envelope envelopeOf(STObject key) {
        var envelope = key.envelope();
        if (envelope.isNull()) {
            throw new IllegalArgumentException("Cannot place a spatially unbounded key on a grid: " + key);
        }
        return envelope;
    }

    @Override
    public int numPartitions() {
        return bounds.length;
    }

    @Override
    public int partitionFor(STObject key) {
        var envelope = envelopeOf(key);
        var cell = cellOf(envelope);
        if (!bounds[cell].covers(envelope)) {
            throw new IllegalArgumentException("Key " + key + " extends beyond partition bounds " + bounds[cell]
                                               + "; build the grid over all keys it partitions");
        }
        return cell;
    }

    @Override
    public Envelope partitionBounds(int partitionId) {
        return new Envelope(bounds[partitionId]);
    }

    public int getCellsPerDimension() {
        return cellsPerDimension;
    }

    private int cellOf(Envelope envelope) {
        var centre = envelope.centre();
        var col = index(centre.x, minX, cellWidth);
        var row = index(centre.y, minY, cellHeight);
        return row * cellsPerDimension + col;
    }

    private int index(double value, double origin, double size) {
        if (size <= 0) {
            return 0;
        }
        var i = (int) Math.floor((value - origin) / size);
        return Math.max(0, Math.min(cellsPerDimension - 1, i));
    }

    @Override
    public String toString() {
        return "GridPartitioner[" + cellsPerDimension + "x" + cellsPerDimension + ", bounds="
        + Arrays.toString(bounds) + "]";
    }
}

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
package com.hellblazer.strata.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.Objects;
import java.util.Optional;

/**
 * A spatio-temporal object: a geometry paired with an optional time interval.
 *
 * <p>The predicates combine a spatial and a temporal test. The spatial part is evaluated by JTS, where
 * {@code contains} means "covers" (boundary points count); an empty geometry is spatially unbounded and passes every
 * spatial test, which is how purely temporal objects are expressed. The temporal part
 * applies the interval predicate when both objects carry an interval, succeeds when neither does, and fails when only
 * one of them does.
 *
 * <p>Instances are immutable. The wrapped geometry must not be mutated by callers.
 *
 * @author hal.hildebrand
 */
public final class STObject {

    private static final GeometryFactory FACTORY = new GeometryFactory();

    private final Geometry           geometry;
    private final Optional<Interval> interval;

    private STObject(Geometry geometry, Interval interval) {
        this.geometry = Objects.requireNonNull(geometry, "Geometry cannot be null");
        this.interval = Optional.ofNullable(interval);
    }

    public static STObject of(Geometry geometry) {
        return new STObject(geometry, null);
    }

    public static STObject of(Geometry geometry, Interval interval) {
        return new STObject(geometry, Objects.requireNonNull(interval, "Interval cannot be null"));
    }

    /**
     * Parse a WKT geometry.
     *
     * @throws IllegalArgumentException if the text is not valid WKT
     */
    public static STObject of(String wkt) {
        return new STObject(parse(wkt), null);
    }

    /**
     * Parse a WKT geometry valid over the closed interval {@code [start, end]}.
     *
     * @throws IllegalArgumentException if the text is not valid WKT or the interval is invalid
     */
    public static STObject of(String wkt, long start, long end) {
        return new STObject(parse(wkt), Interval.closed(start, end));
    }

    public static STObject point(double x, double y) {
        return new STObject(FACTORY.createPoint(new Coordinate(x, y)), null);
    }

    public static STObject point(double x, double y, Interval interval) {
        return of(FACTORY.createPoint(new Coordinate(x, y)), interval);
    }

    /**
     * A spatially unbounded object valid over an interval, for purely temporal queries. Its geometry is the empty
     * point, which has a null envelope.
     */
    public static STObject temporal(Interval interval) {
        return of(FACTORY.createPoint(), interval);
    }

    private static Geometry parse(String wkt) {
        Objects.requireNonNull(wkt, "WKT cannot be null");
        try {
            return new WKTReader(FACTORY).read(wkt);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid WKT: " + wkt, e);
        }
    }

    public Geometry geometry() {
        return geometry;
    }

    public Optional<Interval> interval() {
        return interval;
    }

    /**
     * Minimal bounding box of the geometry, as a fresh copy. A null envelope is returned for empty geometries.
     */
    public Envelope envelope() {
        return new Envelope(geometry.getEnvelopeInternal());
    }

    /**
     * @return true if this object has no spatial extent and so places no spatial constraint on predicates
     */
    public boolean isSpatiallyUnbounded() {
        return geometry.isEmpty();
    }

    public boolean intersects(STObject other) {
        return intersectsSpatial(other) && temporalMatch(other, Interval::intersects);
    }

    /**
     * @return true if every point of {@code other} lies within this object
     */
    public boolean contains(STObject other) {
        return containsSpatial(other) && temporalMatch(other, Interval::contains);
    }

    /**
     * @return true if every point of this object lies within {@code other}
     */
    public boolean containedBy(STObject other) {
        return other.contains(this);
    }

    // an empty geometry places no spatial constraint
    private boolean intersectsSpatial(STObject other) {
        if (geometry.isEmpty() || other.geometry.isEmpty()) {
            return true;
        }
        return geometry.intersects(other.geometry);
    }

    private boolean containsSpatial(STObject other) {
        if (geometry.isEmpty() || other.geometry.isEmpty()) {
            return true;
        }
        return geometry.covers(other.geometry);
    }

    private boolean temporalMatch(STObject other, IntervalTest test) {
        if (interval.isPresent() && other.interval.isPresent()) {
            return test.test(interval.get(), other.interval.get());
        }
        return interval.isEmpty() && other.interval.isEmpty();
    }

    @FunctionalInterface
    private interface IntervalTest {
        boolean test(Interval a, Interval b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof STObject other)) {
            return false;
        }
        return geometry.equalsExact(other.geometry) && interval.equals(other.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(geometry.getEnvelopeInternal(), interval);
    }

    @Override
    public String toString() {
        return interval.map(i -> "STObject[" + geometry + ", " + i + "]").orElse("STObject[" + geometry + "]");
    }
}

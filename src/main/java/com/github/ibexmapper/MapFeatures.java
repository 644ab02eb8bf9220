/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.ibexmapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Overlays drawn on top of the heatmap: named points, named circles and
 * the graticule.
 */
public final class MapFeatures {

    /** A marker at a position given in degrees. */
    public record Point(String name, GeoPoint position) {
        public Point {
            if (name == null || position == null) {
                throw new IllegalArgumentException("Point needs a name and a position");
            }
        }
    }

    /**
     * A circle of angular radius {@code alphaDeg} around {@code center};
     * 90 degrees draws a great circle.
     */
    public record Circle(String name, GeoPoint center, double alphaDeg) {
        public static final double GREAT_CIRCLE_DEG = 90.0;

        public Circle {
            if (name == null || center == null) {
                throw new IllegalArgumentException("Circle needs a name and a centre");
            }
            if (!Double.isFinite(alphaDeg) || alphaDeg < 0.0 || alphaDeg > 180.0) {
                throw new IllegalArgumentException("Circle radius must be within [0, 180] degrees, got " + alphaDeg);
            }
        }

        public Circle(String name, GeoPoint center) {
            this(name, center, GREAT_CIRCLE_DEG);
        }
    }

    /** Graticule only. */
    public static final MapFeatures DEFAULT = new MapFeatures(List.of(), List.of(), true);

    private final List<Point> points;
    private final List<Circle> circles;
    private final boolean graticule;

    public MapFeatures(List<Point> points, List<Circle> circles, boolean graticule) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.circles = Collections.unmodifiableList(new ArrayList<>(circles));
        this.graticule = graticule;
    }

    public List<Point> points() {
        return points;
    }

    public List<Circle> circles() {
        return circles;
    }

    public boolean graticule() {
        return graticule;
    }

    public MapFeatures withPoint(String name, GeoPoint position) {
        List<Point> next = new ArrayList<>(points);
        next.add(new Point(name, position));
        return new MapFeatures(next, circles, graticule);
    }

    public MapFeatures withCircle(String name, GeoPoint center, double alphaDeg) {
        List<Circle> next = new ArrayList<>(circles);
        next.add(new Circle(name, center, alphaDeg));
        return new MapFeatures(points, next, graticule);
    }

    public MapFeatures withoutGraticule() {
        return new MapFeatures(points, circles, false);
    }
}

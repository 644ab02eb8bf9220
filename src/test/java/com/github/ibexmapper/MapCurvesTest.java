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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MapCurvesTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    @DisplayName("Default graticule has 7 parallels and 13 meridians of 361 samples")
    void defaultGraticule() {
        List<Curve> lines = MapCurves.graticule();

        assertEquals(20, lines.size());
        for (Curve line : lines) assertEquals(MapCurves.DEFAULT_SEGMENTS, line.size());
        assertEquals(-Math.PI / 2, lines.get(0).lat()[100], TOLERANCE);
        assertEquals(-Math.PI, lines.get(7).lon()[0], TOLERANCE);
        assertEquals(Math.PI / 2, lines.get(7).lat()[360], TOLERANCE);
    }

    @Test
    @DisplayName("Invalid graticule steps are rejected")
    void invalidGraticule() {
        assertThrows(IllegalArgumentException.class, () -> MapCurves.graticule(0, 30, 10));
        assertThrows(IllegalArgumentException.class, () -> MapCurves.graticule(30, 30, 1));
    }

    @Test
    @DisplayName("Great circle points lie 90 degrees from the centre")
    void greatCircle() {
        GeoPoint center = new GeoPoint(40, 25);
        Curve circle = MapCurves.circle(center, 90.0);
        double[] c = SphereTransform.toCartesian(center.lonRad(), center.latRad());

        assertEquals(MapCurves.CIRCLE_SAMPLES, circle.size());
        for (int i = 0; i < circle.size(); i++) {
            double[] p = SphereTransform.toCartesian(circle.lon()[i], circle.lat()[i]);
            assertEquals(0.0, SphereTransform.dot(c, p), TOLERANCE);
            assertTrue(circle.lon()[i] >= -Math.PI && circle.lon()[i] < Math.PI);
        }
    }

    @Test
    @DisplayName("Small circles keep their angular radius")
    void smallCircle() {
        GeoPoint center = new GeoPoint(-120, -50);
        Curve circle = MapCurves.circle(center, 20.0);
        double[] c = SphereTransform.toCartesian(center.lonRad(), center.latRad());

        for (int i = 0; i < circle.size(); i++) {
            double[] p = SphereTransform.toCartesian(circle.lon()[i], circle.lat()[i]);
            assertEquals(Math.cos(Math.toRadians(20.0)), SphereTransform.dot(c, p), TOLERANCE);
        }
    }

    @Test
    @DisplayName("Circles around either pole are parallels")
    void polarCircles() {
        Curve north = MapCurves.circle(new GeoPoint(0, 90), 30.0);
        Curve south = MapCurves.circle(new GeoPoint(0, -90), 30.0);

        for (int i = 0; i < north.size(); i++) {
            assertEquals(Math.toRadians(60), north.lat()[i], TOLERANCE);
            assertEquals(Math.toRadians(-60), south.lat()[i], TOLERANCE);
            assertTrue(Double.isFinite(north.lon()[i]) && Double.isFinite(south.lon()[i]));
        }
    }

    @Test
    @DisplayName("Labels cover the equator and the prime meridian")
    void labels() {
        List<MapCurves.Label> labels = MapCurves.graticuleLabels();

        assertEquals(18, labels.size());
        assertEquals("-180°", labels.get(0).text());
        assertEquals(-Math.PI, labels.get(0).lon(), TOLERANCE);
        assertEquals("0", labels.get(6).text());
        assertEquals("-90°", labels.get(12).text());
        assertEquals(-Math.PI / 2, labels.get(12).lat(), TOLERANCE);
        assertTrue(labels.stream().noneMatch(l -> l.text().equals("0°")));
    }
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit-sphere geometry: coordinate conversions and the two rotations that
 * re-orient a map around user-chosen anchors.
 *
 * <p>Longitude and latitude are in radians here unless a {@link GeoPoint} is
 * involved. The Cartesian frame has x towards (0, 0), y towards (90E, 0) and
 * z towards the north pole.</p>
 */
public final class SphereTransform {
    private static final Logger log = LoggerFactory.getLogger(SphereTransform.class);
    private static final double[] REFERENCE_AXIS = {1.0, 0.0, 0.0};
    // Cross products shorter than this have no usable direction
    private static final double MIN_AXIS_NORM = 1e-15;
    // Rotated points this close to the x-z plane are put on longitude 0
    private static final double POINT_Y_EPSILON = 1e-10;
    private static final double ANCHOR_RTOL = 1e-5;
    private static final double ANCHOR_ATOL = 1e-8;

    private SphereTransform() {}

    /** Longitude/latitude (radians) to a unit vector. */
    public static double[] toCartesian(double lonRad, double latRad) {
        double cosLat = Math.cos(latRad);
        return new double[] {cosLat * Math.cos(lonRad), cosLat * Math.sin(lonRad), Math.sin(latRad)};
    }

    /** Unit vector to {@code {lon, lat}} in radians; longitude in (-pi, pi]. */
    public static double[] toSpherical(double x, double y, double z) {
        double lat = Math.asin(Math.max(-1.0, Math.min(1.0, z)));
        double lon = Math.atan2(y, x);
        return new double[] {lon, lat};
    }

    /**
     * Shortest-arc rotation that carries {@code anchor} onto the reference
     * axis {@code (1, 0, 0)}. The anchor is {@linkplain GeoPoint#nudged() nudged}
     * first; an anchor still parallel to the axis yields the identity, and
     * one opposite to it a half turn about z.
     */
    public static Rotation buildCenteringRotation(GeoPoint anchor) {
        GeoPoint p = anchor.nudged();
        double[] v = toCartesian(p.lonRad(), p.latRad());
        double[] axis = cross(v, REFERENCE_AXIS);
        double norm = Math.sqrt(dot(axis, axis));
        double cos = Math.max(-1.0, Math.min(1.0, dot(v, REFERENCE_AXIS)));
        if (norm < MIN_AXIS_NORM) {
            if (cos > 0) return Rotation.IDENTITY;
            log.debug("Centering anchor {} is antipodal to the reference axis", anchor);
            return Rotation.aboutAxis(new double[] {0.0, 0.0, 1.0}, Math.PI);
        }
        axis[0] /= norm;
        axis[1] /= norm;
        axis[2] /= norm;
        return Rotation.aboutAxis(axis, Math.acos(cos));
    }

    /**
     * Rotation about the reference axis that brings the already-centered
     * {@code anchor} into the x-z plane with a positive z component, so it
     * marks the new prime meridian above the new centre.
     */
    public static Rotation buildMeridianRotation(GeoPoint anchor, Rotation centering) {
        GeoPoint p = anchor.nudged();
        double[] v = centering.apply(toCartesian(p.lonRad(), p.latRad()));
        double beta = Math.atan2(v[1], v[2]);
        return Rotation.aboutX(beta);
    }

    /**
     * Final rotation for a pair of anchors. Coinciding anchors leave the
     * meridian free, so only {@code centering} is used; otherwise the
     * meridian rotation is applied after it.
     */
    public static Rotation composeRotation(GeoPoint central, GeoPoint meridian, Rotation centering) {
        if (anchorsCoincide(central, meridian)) {
            return centering;
        }
        return buildMeridianRotation(meridian, centering).compose(centering);
    }

    /** Both coordinates equal within {@code 1e-8 + 1e-5 * |b|} degrees. */
    public static boolean anchorsCoincide(GeoPoint a, GeoPoint b) {
        return Math.abs(a.lonDeg() - b.lonDeg()) <= ANCHOR_ATOL + ANCHOR_RTOL * Math.abs(b.lonDeg())
                && Math.abs(a.latDeg() - b.latDeg()) <= ANCHOR_ATOL + ANCHOR_RTOL * Math.abs(b.latDeg());
    }

    /**
     * Rotate a single point. A result lying on the x-z plane (|y| below
     * 1e-10) is snapped to longitude 0 when it faces the centre (x >= 0)
     * and to pi when it lies on the antimeridian, so rounding in y cannot
     * flip it between +pi and -pi.
     *
     * @return {@code {lon, lat}} in radians
     */
    public static double[] rotatePoint(double lonRad, double latRad, Rotation rotation) {
        double[] v = rotation.apply(toCartesian(lonRad, latRad));
        double[] ll = toSpherical(v[0], v[1], v[2]);
        if (Math.abs(v[1]) < POINT_Y_EPSILON) {
            ll[0] = v[0] >= 0.0 ? 0.0 : Math.PI;
        }
        return ll;
    }

    /** Wrap a longitude into (-pi, pi]. NaN stays NaN. */
    public static double wrapLongitude(double lonRad) {
        if (lonRad > -Math.PI && lonRad <= Math.PI) return lonRad;
        double w = lonRad - 2.0 * Math.PI * Math.floor((lonRad + Math.PI) / (2.0 * Math.PI));
        return w == -Math.PI ? Math.PI : w;
    }

    static double[] cross(double[] a, double[] b) {
        return new double[] {
            a[1] * b[2] - a[2] * b[1],
            a[2] * b[0] - a[0] * b[2],
            a[0] * b[1] - a[1] * b[0]
        };
    }

    static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }
}

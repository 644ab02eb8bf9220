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

import com.github.ibexmapper.ConfigurationException.Reason;

/**
 * A geographic anchor in degrees: longitude in [-180, 180], latitude in
 * [-90, 90].
 *
 * @param lonDeg longitude (degrees, east positive)
 * @param latDeg latitude (degrees, north positive)
 */
public record GeoPoint(double lonDeg, double latDeg) {

    /** Offset (degrees) applied to exact 0, +/-90 and +/-180 values before building rotations. */
    public static final double NUDGE_DEG = 1e-8;

    public static final GeoPoint ORIGIN = new GeoPoint(0.0, 0.0);

    public GeoPoint {
        if (!Double.isFinite(lonDeg) || lonDeg < -180.0 || lonDeg > 180.0) {
            throw new ConfigurationException(
                    Reason.MALFORMED_GEO_POINT, "Longitude must be within [-180, 180], got " + lonDeg);
        }
        if (!Double.isFinite(latDeg) || latDeg < -90.0 || latDeg > 90.0) {
            throw new ConfigurationException(
                    Reason.MALFORMED_GEO_POINT, "Latitude must be within [-90, 90], got " + latDeg);
        }
    }

    /**
     * Parse the {@code "(lon, lat)"} form used by configuration files. The
     * parentheses are optional.
     *
     * @throws ConfigurationException with {@link Reason#MALFORMED_GEO_POINT}
     */
    public static GeoPoint parse(String text) {
        if (text == null) {
            throw new ConfigurationException(Reason.MALFORMED_GEO_POINT, "Expected '(lon, lat)', got null");
        }
        String s = text.trim();
        if (s.startsWith("(") && s.endsWith(")")) {
            s = s.substring(1, s.length() - 1);
        }
        String[] toks = s.split(",");
        if (toks.length != 2) {
            throw new ConfigurationException(
                    Reason.MALFORMED_GEO_POINT, "Expected '(lon, lat)', got '" + text + "'");
        }
        try {
            return new GeoPoint(Double.parseDouble(toks[0].trim()), Double.parseDouble(toks[1].trim()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    Reason.MALFORMED_GEO_POINT, "Expected '(lon, lat)', got '" + text + "'", e);
        }
    }

    /**
     * Copy with degenerate coordinates moved inward by {@link #NUDGE_DEG}, so
     * that no rotation axis is built from a zero-length cross product.
     */
    public GeoPoint nudged() {
        return new GeoPoint(nudge(lonDeg, 180.0), nudge(latDeg, 90.0));
    }

    public double lonRad() {
        return Math.toRadians(lonDeg);
    }

    public double latRad() {
        return Math.toRadians(latDeg);
    }

    @Override
    public String toString() {
        return "(" + lonDeg + ", " + latDeg + ")";
    }

    private static double nudge(double value, double limit) {
        if (value == 0.0) return NUDGE_DEG;
        if (value == limit) return limit - NUDGE_DEG;
        if (value == -limit) return -limit + NUDGE_DEG;
        if (limit == 180.0 && Math.abs(value) == 90.0) return value - Math.signum(value) * NUDGE_DEG;
        return value;
    }
}

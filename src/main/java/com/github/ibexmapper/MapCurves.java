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
import java.util.Arrays;
import java.util.List;

/**
 * Auxiliary map geometry: graticule lines, small circles and graticule label
 * anchors, all in radians on the unrotated sphere.
 */
public final class MapCurves {
    public static final int DEFAULT_STEP_DEG = 30;
    public static final int DEFAULT_SEGMENTS = 361;
    public static final int CIRCLE_SAMPLES = 360;
    private static final double POLE_TOLERANCE = 1e-8;

    private MapCurves() {}

    /** Parallels and meridians every 30 degrees, 361 samples each. */
    public static List<Curve> graticule() {
        return graticule(DEFAULT_STEP_DEG, DEFAULT_STEP_DEG, DEFAULT_SEGMENTS);
    }

    /**
     * Parallels at every {@code latStepDeg} from -90 to 90 followed by
     * meridians at every {@code lonStepDeg} from -180 to 180.
     */
    public static List<Curve> graticule(int lonStepDeg, int latStepDeg, int segments) {
        if (lonStepDeg <= 0 || latStepDeg <= 0 || segments < 2) {
            throw new IllegalArgumentException("Graticule steps must be positive and segments at least 2");
        }
        List<Curve> lines = new ArrayList<>();
        for (int latDeg = -90; latDeg <= 90; latDeg += latStepDeg) {
            double[] lon = HarmonicsEvaluator.linspace(-Math.PI, Math.PI, segments);
            double[] lat = new double[segments];
            Arrays.fill(lat, Math.toRadians(latDeg));
            lines.add(new Curve(lon, lat));
        }
        for (int lonDeg = -180; lonDeg <= 180; lonDeg += lonStepDeg) {
            double[] lat = HarmonicsEvaluator.linspace(-Math.PI / 2.0, Math.PI / 2.0, segments);
            double[] lon = new double[segments];
            Arrays.fill(lon, Math.toRadians(lonDeg));
            lines.add(new Curve(lon, lat));
        }
        return lines;
    }

    /**
     * Circle of angular radius {@code alphaDeg} around {@code center},
     * sampled at 360 points; 90 degrees gives a great circle. Longitudes
     * are wrapped into [-pi, pi).
     */
    public static Curve circle(GeoPoint center, double alphaDeg) {
        double[] c = SphereTransform.toCartesian(center.lonRad(), center.latRad());
        double[] pole = {0.0, 0.0, 1.0};

        // Centres on either pole have no defined east direction
        double[] u = SphereTransform.cross(pole, c);
        double norm = Math.sqrt(SphereTransform.dot(u, u));
        if (norm < POLE_TOLERANCE) {
            u = new double[] {1.0, 0.0, 0.0};
        } else {
            u[0] /= norm;
            u[1] /= norm;
            u[2] /= norm;
        }
        double[] w = SphereTransform.cross(c, u);

        double alpha = Math.toRadians(alphaDeg);
        double ca = Math.cos(alpha);
        double sa = Math.sin(alpha);
        double[] t = HarmonicsEvaluator.linspace(0.0, 2.0 * Math.PI, CIRCLE_SAMPLES);
        double[] lon = new double[t.length];
        double[] lat = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            double ct = Math.cos(t[i]);
            double st = Math.sin(t[i]);
            double x = ca * c[0] + sa * (ct * u[0] + st * w[0]);
            double y = ca * c[1] + sa * (ct * u[1] + st * w[1]);
            double z = ca * c[2] + sa * (ct * u[2] + st * w[2]);
            double[] ll = SphereTransform.toSpherical(x, y, z);
            double shifted = ll[0] + Math.PI;
            lon[i] = shifted - 2.0 * Math.PI * Math.floor(shifted / (2.0 * Math.PI)) - Math.PI;
            lat[i] = ll[1];
        }
        return new Curve(lon, lat);
    }

    /** A label text anchored at a position in radians. */
    public record Label(String text, double lon, double lat) {}

    /**
     * Label anchors along the equator every 30 degrees (-180 to 150) and the
     * prime meridian every 30 degrees (-90 to 90, zero skipped since the
     * equator already labels it).
     */
    public static List<Label> graticuleLabels() {
        List<Label> labels = new ArrayList<>();
        for (int lonDeg = -180; lonDeg < 180; lonDeg += DEFAULT_STEP_DEG) {
            String text = lonDeg == 0 ? "0" : lonDeg + "°";
            labels.add(new Label(text, Math.toRadians(lonDeg), 0.0));
        }
        for (int latDeg = -90; latDeg <= 90; latDeg += DEFAULT_STEP_DEG) {
            if (latDeg == 0) continue;
            labels.add(new Label(latDeg + "°", 0.0, Math.toRadians(latDeg)));
        }
        return labels;
    }
}

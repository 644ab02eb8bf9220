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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a renderer needs to draw one map, in display coordinates
 * (radians, longitudes within [-pi, pi]).
 *
 * @param heatmap   values indexed {@code [row][column]} on {@code mesh}; NaN
 *                  cells have no data
 * @param mesh      the canonical display grid
 * @param rotation  rotations applied, or {@code null} for an unrotated map
 * @param graticule seam-split parallels followed by meridians; empty when disabled
 * @param circles   seam-split circles by name, in request order
 * @param points    projected markers, in request order
 * @param labels    graticule label anchors
 */
public record ProjectedMap(
        double[][] heatmap,
        LonLatMesh mesh,
        RotationPair rotation,
        List<Curve> graticule,
        Map<String, Curve> circles,
        List<ProjectedPoint> points,
        List<MapCurves.Label> labels) {

    /** A named marker at its display position. */
    public record ProjectedPoint(String name, double lon, double lat) {}

    public Optional<RotationPair> rotationPair() {
        return Optional.ofNullable(rotation);
    }

    public int dpi() {
        return heatmap.length;
    }

    /** Smallest and largest non-NaN value, or {@code {NaN, NaN}} when none. */
    public double[] valueRange() {
        double min = Double.NaN;
        double max = Double.NaN;
        for (double[] row : heatmap) {
            for (double v : row) {
                if (Double.isNaN(v)) continue;
                if (Double.isNaN(min) || v < min) min = v;
                if (Double.isNaN(max) || v > max) max = v;
            }
        }
        return new double[] {min, max};
    }
}

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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resampling of heatmaps and curves onto a rotated sphere.
 *
 * <p>A heatmap is rotated by moving the coordinate grid and sampling the
 * unrotated data at the moved positions; rotated samples do not land on a
 * regular grid, so values are never pushed forward. The canonical grid has
 * latitudes from pi/2 down to -pi/2 (rows) and longitudes from pi down to
 * -pi (columns), endpoints included.</p>
 */
public final class GridResampler {
    private static final Logger log = LoggerFactory.getLogger(GridResampler.class);

    private GridResampler() {}

    /** Row latitudes of the canonical grid: pi/2 down to -pi/2. */
    public static double[] canonicalLatitudes(int rows) {
        return HarmonicsEvaluator.linspace(Math.PI / 2.0, -Math.PI / 2.0, rows);
    }

    /** Column longitudes of the canonical grid: pi down to -pi. */
    public static double[] canonicalLongitudes(int columns) {
        return HarmonicsEvaluator.linspace(Math.PI, -Math.PI, columns);
    }

    /** Canonical {@code dpi x dpi} coordinate mesh. */
    public static LonLatMesh canonicalMesh(int dpi) {
        double[] lat = canonicalLatitudes(dpi);
        double[] lon = canonicalLongitudes(dpi);
        double[][] lonMesh = new double[dpi][];
        double[][] latMesh = new double[dpi][dpi];
        for (int r = 0; r < dpi; r++) {
            lonMesh[r] = lon.clone();
            Arrays.fill(latMesh[r], lat[r]);
        }
        return new LonLatMesh(lonMesh, latMesh);
    }

    /**
     * Rotate every mesh point by {@code rotation}; longitudes of the result
     * are wrapped into (-pi, pi].
     */
    public static LonLatMesh rotateGrid(double[][] lon, double[][] lat, Rotation rotation) {
        LonLatMesh in = new LonLatMesh(lon, lat);
        int rows = in.rows();
        int cols = in.columns();
        double[][] m = rotation.toArray();
        double[][] outLon = new double[rows][cols];
        double[][] outLat = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double cosLat = Math.cos(lat[r][c]);
                double x = cosLat * Math.cos(lon[r][c]);
                double y = cosLat * Math.sin(lon[r][c]);
                double z = Math.sin(lat[r][c]);
                double rx = m[0][0] * x + m[0][1] * y + m[0][2] * z;
                double ry = m[1][0] * x + m[1][1] * y + m[1][2] * z;
                double rz = m[2][0] * x + m[2][1] * y + m[2][2] * z;
                outLat[r][c] = Math.asin(Math.max(-1.0, Math.min(1.0, rz)));
                outLon[r][c] = SphereTransform.wrapLongitude(Math.atan2(ry, rx));
            }
        }
        return new LonLatMesh(outLon, outLat);
    }

    /** {@link #rotateGrid(double[][], double[][], Rotation)} on a mesh. */
    public static LonLatMesh rotateGrid(LonLatMesh mesh, Rotation rotation) {
        return rotateGrid(mesh.lon(), mesh.lat(), rotation);
    }

    /**
     * Bilinear interpolation of {@code data}, laid out on the canonical grid,
     * at the positions {@code (newLat, newLon)}. Positions outside the grid's
     * envelope, or NaN, yield NaN.
     *
     * @param data   values, {@code [latitude row][longitude column]}, at least 2x2
     * @param newLat query latitudes (radians)
     * @param newLon query longitudes (radians), same shape as {@code newLat}
     */
    public static double[][] interpolate(double[][] data, double[][] newLat, double[][] newLon) {
        int rows = data.length;
        int cols = rows == 0 ? 0 : data[0].length;
        if (rows < 2 || cols < 2) {
            throw new IllegalArgumentException("Interpolation needs at least a 2x2 grid, got " + rows + "x" + cols);
        }
        LonLatMesh query = new LonLatMesh(newLon, newLat);
        double[] latAxis = canonicalLatitudes(rows);
        double[] lonAxis = canonicalLongitudes(cols);

        int missing = 0;
        double[][] out = new double[query.rows()][query.columns()];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < out[r].length; c++) {
                double v = sample(data, latAxis, lonAxis, newLat[r][c], newLon[r][c]);
                if (Double.isNaN(v)) missing++;
                out[r][c] = v;
            }
        }
        if (missing > 0) {
            log.debug("{} interpolated cells fell outside the grid or on missing data", missing);
        }
        return out;
    }

    /**
     * Rotate every sample of a curve; breaks stay breaks. The result is not
     * seam-split, see {@link #splitAtSeam(Curve)}.
     */
    public static Curve rotateCurve(Curve curve, Rotation rotation) {
        int n = curve.size();
        double[] lon = new double[n];
        double[] lat = new double[n];
        for (int i = 0; i < n; i++) {
            double[] v = rotation.apply(SphereTransform.toCartesian(curve.lon()[i], curve.lat()[i]));
            double[] ll = SphereTransform.toSpherical(v[0], v[1], v[2]);
            lon[i] = SphereTransform.wrapLongitude(ll[0]);
            lat[i] = ll[1];
        }
        return new Curve(lon, lat);
    }

    /**
     * Insert a NaN break between consecutive samples whose longitudes differ
     * by more than pi, i.e. where the curve crosses the +/-pi seam. Returns
     * {@code curve} itself when nothing crosses.
     */
    public static Curve splitAtSeam(Curve curve) {
        double[] lon = curve.lon();
        double[] lat = curve.lat();
        int jumps = 0;
        for (int i = 1; i < lon.length; i++) {
            if (crossesSeam(lon[i - 1], lon[i])) jumps++;
        }
        if (jumps == 0) return curve;

        double[] outLon = new double[lon.length + jumps];
        double[] outLat = new double[lat.length + jumps];
        int o = 0;
        for (int i = 0; i < lon.length; i++) {
            if (i > 0 && crossesSeam(lon[i - 1], lon[i])) {
                outLon[o] = Double.NaN;
                outLat[o] = Double.NaN;
                o++;
            }
            outLon[o] = lon[i];
            outLat[o] = lat[i];
            o++;
        }
        return new Curve(outLon, outLat);
    }

    private static boolean crossesSeam(double lonA, double lonB) {
        // NaN compares false, so breaks never count as a crossing
        return Math.abs(lonB - lonA) > Math.PI;
    }

    private static double sample(double[][] data, double[] latAxis, double[] lonAxis, double lat, double lon) {
        double fr = fractionalIndex(latAxis, lat);
        double fc = fractionalIndex(lonAxis, lon);
        if (Double.isNaN(fr) || Double.isNaN(fc)) return Double.NaN;
        int r0 = Math.min((int) Math.floor(fr), latAxis.length - 2);
        int c0 = Math.min((int) Math.floor(fc), lonAxis.length - 2);
        double wr = fr - r0;
        double wc = fc - c0;
        double top = data[r0][c0] * (1.0 - wc) + data[r0][c0 + 1] * wc;
        double bottom = data[r0 + 1][c0] * (1.0 - wc) + data[r0 + 1][c0 + 1] * wc;
        return top * (1.0 - wr) + bottom * wr;
    }

    /**
     * Position of {@code q} along an evenly spaced descending axis, in index
     * units, or NaN when {@code q} lies outside it.
     */
    private static double fractionalIndex(double[] axis, double q) {
        double first = axis[0];
        double last = axis[axis.length - 1];
        if (!(q <= first && q >= last)) return Double.NaN;
        return (first - q) / (first - last) * (axis.length - 1);
    }
}

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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.ibexmapper.ConfigurationException.Reason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a table of spherical-harmonic coefficients into a {@link ProjectedMap}.
 *
 * <p>A render validates the request, fetches the basis from the
 * {@link BasisCache}, contracts it with the coefficients, optionally clamps
 * negative values, optionally re-orients the map around the configured
 * anchors and finally applies the display scale. Overlays are rotated with
 * the same rotation and split at the longitude seam.</p>
 *
 * <p>Instances are safe to share; the cache serializes basis evaluation.</p>
 */
public final class IbexMapper {
    private static final Logger log = LoggerFactory.getLogger(IbexMapper.class);

    private final BasisCache cache;

    public IbexMapper(BasisCache cache) {
        this.cache = cache;
    }

    /** Mapper whose basis cache lives in {@code directory}. */
    public static IbexMapper withCacheDirectory(Path directory) {
        return new IbexMapper(BasisCache.onDisk(directory));
    }

    public BasisCache cache() {
        return cache;
    }

    /** Render with the graticule and no other overlays. */
    public ProjectedMap render(CoefficientTable table, MapperConfig config) {
        return render(table, config, MapFeatures.DEFAULT);
    }

    /**
     * Render {@code table} under {@code config}.
     *
     * @throws ConfigurationException if the table needs a higher degree than
     *                                {@code max_l_to_cache}; nothing is evaluated in that case
     */
    public ProjectedMap render(CoefficientTable table, MapperConfig config, MapFeatures features) {
        if (table.maxL() > config.maxLToCache()) {
            throw new ConfigurationException(Reason.MAX_L_MISMATCH,
                    "Coefficient table reaches l = " + table.maxL()
                            + " but max_l_to_cache is " + config.maxLToCache());
        }
        int dpi = config.mapAccuracy();
        log.info("Rendering {} coefficients (l <= {}) at dpi {}", table.size(), table.maxL(), dpi);

        BasisSet basis = cache.get(dpi, config.maxLToCache(), table.size());
        double[][] heatmap = HarmonicsEvaluator.contract(table, basis);

        if (!config.allowNegativeValues()) {
            clampNegative(heatmap);
        }

        LonLatMesh mesh = GridResampler.canonicalMesh(dpi);
        RotationPair rotation = null;
        if (config.rotate()) {
            rotation = RotationPair.of(config.centralPoint(), config.meridianPoint());
            log.debug("Rotating map to centre {} with meridian through {}",
                    config.centralPoint(), config.meridianPoint());
            // Each display cell samples the source at the inverse-rotated position
            LonLatMesh source = GridResampler.rotateGrid(mesh, rotation.full().transpose());
            heatmap = GridResampler.interpolate(heatmap, source.lat(), source.lon());
        }

        MapperConfig.Scale scale = config.heatmapScale();
        if (!scale.isNone()) {
            for (double[] row : heatmap) {
                for (int i = 0; i < row.length; i++) row[i] = scale.clamp(row[i]);
            }
        }

        Rotation full = rotation == null ? Rotation.IDENTITY : rotation.full();
        List<Curve> graticule = features.graticule() ? projectAll(MapCurves.graticule(), full) : List.of();
        Map<String, Curve> circles = new LinkedHashMap<>();
        for (MapFeatures.Circle c : features.circles()) {
            circles.put(c.name(), project(MapCurves.circle(c.center(), c.alphaDeg()), full));
        }
        List<ProjectedMap.ProjectedPoint> points = new ArrayList<>();
        for (MapFeatures.Point p : features.points()) {
            double[] ll = projectPoint(p.position().lonRad(), p.position().latRad(), rotation);
            points.add(new ProjectedMap.ProjectedPoint(p.name(), ll[0], ll[1]));
        }
        List<MapCurves.Label> labels = new ArrayList<>();
        if (features.graticule()) {
            for (MapCurves.Label label : MapCurves.graticuleLabels()) {
                double[] ll = projectPoint(label.lon(), label.lat(), rotation);
                labels.add(new MapCurves.Label(label.text(), ll[0], ll[1]));
            }
        }

        log.info("Rendered map at dpi {}{}", dpi, rotation == null ? "" : " (rotated)");
        return new ProjectedMap(heatmap, mesh, rotation, graticule,
                Collections.unmodifiableMap(circles),
                Collections.unmodifiableList(points),
                Collections.unmodifiableList(labels));
    }

    // Unrotated maps keep the input position as given
    private static double[] projectPoint(double lonRad, double latRad, RotationPair rotation) {
        if (rotation == null) {
            return new double[] {lonRad, latRad};
        }
        return SphereTransform.rotatePoint(lonRad, latRad, rotation.full());
    }

    private static void clampNegative(double[][] heatmap) {
        for (double[] row : heatmap) {
            for (int i = 0; i < row.length; i++) {
                if (row[i] < 0.0) row[i] = 0.0;
            }
        }
    }

    private static List<Curve> projectAll(List<Curve> curves, Rotation rotation) {
        List<Curve> out = new ArrayList<>(curves.size());
        for (Curve c : curves) out.add(project(c, rotation));
        return Collections.unmodifiableList(out);
    }

    private static Curve project(Curve curve, Rotation rotation) {
        Curve moved = rotation == Rotation.IDENTITY ? curve : GridResampler.rotateCurve(curve, rotation);
        return GridResampler.splitAtSeam(moved);
    }
}

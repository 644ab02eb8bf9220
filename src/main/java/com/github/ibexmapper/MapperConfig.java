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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import com.github.ibexmapper.ConfigurationException.Reason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed, validated settings for one render request.
 *
 * <p>Build with {@link #builder()} or read from {@link Properties} using the
 * keys {@code map_accuracy}, {@code max_l_to_cache}, {@code rotate},
 * {@code central_point}, {@code meridian_point},
 * {@code allow_negative_values} (or {@code show_negative_values}) and
 * {@code heatmap_scale}. Points and the scale use the {@code "(a, b)"}
 * form. Defaults ship on the classpath as
 * {@code ibexmapper-defaults.properties}.</p>
 */
public final class MapperConfig {
    private static final Logger log = LoggerFactory.getLogger(MapperConfig.class);
    public static final String DEFAULTS_RESOURCE = "ibexmapper-defaults.properties";

    /**
     * Display range for the heatmap. {@link #NONE} leaves values untouched.
     */
    public record Scale(double min, double max) {
        public static final Scale NONE = new Scale(0.0, 0.0);

        public Scale {
            if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
                throw new IllegalArgumentException("Invalid heatmap scale (" + min + ", " + max + ")");
            }
        }

        public boolean isNone() {
            return min == 0.0 && max == 0.0;
        }

        /** Clip a value into the range; NaN stays NaN. */
        public double clamp(double v) {
            if (isNone() || Double.isNaN(v)) return v;
            return Math.max(min, Math.min(max, v));
        }

        static Scale parse(String text) {
            String s = text.trim();
            if (s.startsWith("(") && s.endsWith(")")) s = s.substring(1, s.length() - 1);
            String[] toks = s.split(",");
            if (toks.length != 2) {
                throw new IllegalArgumentException("Expected '(min, max)', got '" + text + "'");
            }
            return new Scale(Double.parseDouble(toks[0].trim()), Double.parseDouble(toks[1].trim()));
        }
    }

    private final int mapAccuracy;
    private final int maxLToCache;
    private final boolean rotate;
    private final GeoPoint centralPoint;
    private final GeoPoint meridianPoint;
    private final boolean allowNegativeValues;
    private final Scale heatmapScale;

    private MapperConfig(Builder b) {
        this.mapAccuracy = b.mapAccuracy;
        this.maxLToCache = b.maxLToCache;
        this.rotate = b.rotate;
        this.centralPoint = b.centralPoint;
        this.meridianPoint = b.meridianPoint;
        this.allowNegativeValues = b.allowNegativeValues;
        this.heatmapScale = b.heatmapScale;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .mapAccuracy(mapAccuracy)
                .maxLToCache(maxLToCache)
                .rotate(rotate)
                .centralPoint(centralPoint)
                .meridianPoint(meridianPoint)
                .allowNegativeValues(allowNegativeValues)
                .heatmapScale(heatmapScale);
    }

    /**
     * Configuration from the classpath defaults resource.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static MapperConfig loadDefaults() {
        InputStream in = MapperConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            log.error("Default configuration '{}' not found on classpath", DEFAULTS_RESOURCE);
            throw new IllegalStateException(
                    "Default configuration '" + DEFAULTS_RESOURCE + "' not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            return fromProperties(props, builder());
        } catch (IOException e) {
            log.error("Failed to read default configuration", e);
            throw new IllegalStateException("Failed to read default configuration", e);
        }
    }

    /**
     * Overlay {@code props} on {@code base}; keys that are absent keep the
     * builder's values.
     *
     * @throws ConfigurationException   if a value fails validation
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static MapperConfig fromProperties(Properties props, Builder base) {
        String v;
        if ((v = props.getProperty("map_accuracy")) != null) base.mapAccuracy(parseInt("map_accuracy", v));
        if ((v = props.getProperty("max_l_to_cache")) != null) base.maxLToCache(parseInt("max_l_to_cache", v));
        if ((v = props.getProperty("rotate")) != null) base.rotate(parseBoolean("rotate", v));
        if ((v = props.getProperty("central_point")) != null) base.centralPoint(GeoPoint.parse(v));
        if ((v = props.getProperty("meridian_point")) != null) base.meridianPoint(GeoPoint.parse(v));
        if ((v = props.getProperty("show_negative_values")) != null) {
            base.allowNegativeValues(parseBoolean("show_negative_values", v));
        }
        if ((v = props.getProperty("allow_negative_values")) != null) {
            base.allowNegativeValues(parseBoolean("allow_negative_values", v));
        }
        if ((v = props.getProperty("heatmap_scale")) != null) base.heatmapScale(Scale.parse(v));
        return base.build();
    }

    /** Grid resolution (the heatmap is {@code dpi x dpi}). */
    public int mapAccuracy() {
        return mapAccuracy;
    }

    /** Degree limit of the cached basis; coefficient tables may not exceed it. */
    public int maxLToCache() {
        return maxLToCache;
    }

    public boolean rotate() {
        return rotate;
    }

    public GeoPoint centralPoint() {
        return centralPoint;
    }

    public GeoPoint meridianPoint() {
        return meridianPoint;
    }

    public boolean allowNegativeValues() {
        return allowNegativeValues;
    }

    public Scale heatmapScale() {
        return heatmapScale;
    }

    @Override
    public String toString() {
        return "MapperConfig{map_accuracy=" + mapAccuracy
                + ", max_l_to_cache=" + maxLToCache
                + ", rotate=" + rotate
                + ", central_point=" + centralPoint
                + ", meridian_point=" + meridianPoint
                + ", allow_negative_values=" + allowNegativeValues
                + ", heatmap_scale=(" + heatmapScale.min() + ", " + heatmapScale.max() + ")}";
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String s = value.trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
    }

    /** Mutable builder; {@link #build()} validates. */
    public static final class Builder {
        private int mapAccuracy = 720;
        private int maxLToCache = 30;
        private boolean rotate = false;
        private GeoPoint centralPoint = GeoPoint.ORIGIN;
        private GeoPoint meridianPoint = GeoPoint.ORIGIN;
        private boolean allowNegativeValues = true;
        private Scale heatmapScale = Scale.NONE;

        private Builder() {}

        public Builder mapAccuracy(int dpi) {
            this.mapAccuracy = dpi;
            return this;
        }

        public Builder maxLToCache(int maxL) {
            this.maxLToCache = maxL;
            return this;
        }

        public Builder rotate(boolean rotate) {
            this.rotate = rotate;
            return this;
        }

        public Builder centralPoint(GeoPoint point) {
            this.centralPoint = point;
            return this;
        }

        public Builder meridianPoint(GeoPoint point) {
            this.meridianPoint = point;
            return this;
        }

        public Builder allowNegativeValues(boolean allow) {
            this.allowNegativeValues = allow;
            return this;
        }

        public Builder heatmapScale(Scale scale) {
            this.heatmapScale = scale;
            return this;
        }

        /**
         * @throws ConfigurationException if the resolution is not positive (or
         *                                below 2 for a rotated map), the degree limit is
         *                                negative or a point is missing
         */
        public MapperConfig build() {
            if (mapAccuracy < 1) {
                throw new ConfigurationException(
                        Reason.NON_POSITIVE_DIMENSION, "map_accuracy must be positive, got " + mapAccuracy);
            }
            // Interpolating a rotated map needs a 2x2 grid
            if (rotate && mapAccuracy < 2) {
                throw new ConfigurationException(
                        Reason.NON_POSITIVE_DIMENSION, "map_accuracy must be at least 2 to rotate, got " + mapAccuracy);
            }
            if (maxLToCache < 0) {
                throw new ConfigurationException(
                        Reason.NON_POSITIVE_DIMENSION, "max_l_to_cache must not be negative, got " + maxLToCache);
            }
            if (centralPoint == null || meridianPoint == null) {
                throw new ConfigurationException(
                        Reason.MALFORMED_GEO_POINT, "central_point and meridian_point are required");
            }
            if (heatmapScale == null) {
                heatmapScale = Scale.NONE;
            }
            return new MapperConfig(this);
        }
    }
}

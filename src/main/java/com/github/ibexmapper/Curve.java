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
 * A polyline on the sphere as parallel longitude/latitude arrays (radians).
 * A NaN sample is a break: the renderer starts a new segment after it.
 *
 * @param lon longitudes, same length as {@code lat}
 * @param lat latitudes
 */
public record Curve(double[] lon, double[] lat) {

    public Curve {
        if (lon.length != lat.length) {
            throw new IllegalArgumentException(
                    "Longitude and latitude arrays differ in length: " + lon.length + " vs " + lat.length);
        }
    }

    public int size() {
        return lon.length;
    }

    public static boolean isBreak(double lon, double lat) {
        return Double.isNaN(lon) || Double.isNaN(lat);
    }

    /** Number of break markers. */
    public int breakCount() {
        int n = 0;
        for (int i = 0; i < lon.length; i++) {
            if (isBreak(lon[i], lat[i])) n++;
        }
        return n;
    }

    /** The drawable pieces between breaks; empty pieces are dropped. */
    public List<Curve> segments() {
        List<Curve> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= lon.length; i++) {
            if (i == lon.length || isBreak(lon[i], lat[i])) {
                if (i > start) {
                    out.add(new Curve(Arrays.copyOfRange(lon, start, i), Arrays.copyOfRange(lat, start, i)));
                }
                start = i + 1;
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Curve)) return false;
        Curve other = (Curve) obj;
        return Arrays.equals(lon, other.lon) && Arrays.equals(lat, other.lat);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(lon) + Arrays.hashCode(lat);
    }

    @Override
    public String toString() {
        return "Curve[" + lon.length + " samples, " + breakCount() + " breaks]";
    }
}

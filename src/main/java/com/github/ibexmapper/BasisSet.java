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

/**
 * Real spherical-harmonics basis sampled on a {@code dpi x dpi} grid.
 *
 * <p>Elements are stored in the canonical order {@code (0,0), (1,-1), (1,0),
 * (1,1), (2,-2), ...}, so element {@code k} of degree {@code l} and order
 * {@code m} sits at {@code l*l + l + m}. Each element is indexed
 * {@code [longitudeIndex][colatitudeIndex]}, with colatitude sampled
 * uniformly over [0, pi] and longitude over [0, 2*pi], both endpoints
 * included.</p>
 *
 * <p>Instances are shared between requests and never change; the public
 * accessors hand out copies. {@link #truncate(int)} returns a view over the
 * same arrays.</p>
 */
public final class BasisSet {
    private final int dpi;
    private final int maxL;
    private final double[][][] elements;

    public BasisSet(int dpi, int maxL, double[][][] elements) {
        if (elements.length > countFor(maxL)) {
            throw new IllegalArgumentException(
                    "A basis for max l " + maxL + " holds at most " + countFor(maxL)
                            + " elements, got " + elements.length);
        }
        for (double[][] e : elements) {
            if (e.length != dpi || (dpi > 0 && e[0].length != dpi)) {
                throw new IllegalArgumentException("Basis element is not " + dpi + "x" + dpi);
            }
        }
        this.dpi = dpi;
        this.maxL = maxL;
        this.elements = elements;
    }

    /** Number of basis elements for all degrees 0..maxL. */
    public static int countFor(int maxL) {
        return (maxL + 1) * (maxL + 1);
    }

    /** Position of {@code (l, m)} in the canonical enumeration. */
    public static int indexOf(int l, int m) {
        if (l < 0 || Math.abs(m) > l) {
            throw new IllegalArgumentException("Invalid harmonic (l=" + l + ", m=" + m + ")");
        }
        return l * l + l + m;
    }

    public int dpi() {
        return dpi;
    }

    /** Degree limit the set was evaluated for. */
    public int maxL() {
        return maxL;
    }

    public int size() {
        return elements.length;
    }

    /** True when every degree 0..maxL is present. */
    public boolean isComplete() {
        return elements.length == countFor(maxL);
    }

    /**
     * Copy of element {@code index}, indexed {@code [longitudeIndex][colatitudeIndex]}.
     * Writing to the copy does not affect the set.
     */
    public double[][] element(int index) {
        double[][] src = elements[index];
        double[][] copy = new double[src.length][];
        for (int i = 0; i < src.length; i++) copy[i] = src[i].clone();
        return copy;
    }

    /** Copy of the element for {@code (l, m)}. */
    public double[][] element(int l, int m) {
        return element(indexOf(l, m));
    }

    /** One sample of element {@code index}, without copying. */
    public double value(int index, int lonIdx, int colatIdx) {
        return elements[index][lonIdx][colatIdx];
    }

    // Shared array; callers inside the package only read it
    double[][] elementArray(int index) {
        return elements[index];
    }

    /**
     * First {@code count} elements. Low degrees come first in the canonical
     * order, so this is the basis a table with {@code count} rows needs.
     */
    public BasisSet truncate(int count) {
        if (count < 0 || count > elements.length) {
            throw new IllegalArgumentException(
                    "Cannot take " + count + " elements from a basis of " + elements.length);
        }
        if (count == elements.length) return this;
        double[][][] head = new double[count][][];
        System.arraycopy(elements, 0, head, 0, count);
        return new BasisSet(dpi, maxL, head);
    }
}

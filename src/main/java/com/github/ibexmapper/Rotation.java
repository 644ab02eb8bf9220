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

/**
 * Immutable 3x3 rotation matrix acting on column vectors, {@code v' = R v}.
 */
public final class Rotation {

    public static final Rotation IDENTITY = new Rotation(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});

    private final double[][] m;

    private Rotation(double[][] m) {
        this.m = m;
    }

    /** Wrap a 3x3 matrix. The rows are copied. */
    public static Rotation of(double[][] matrix) {
        if (matrix.length != 3) throw new IllegalArgumentException("Rotation must be 3x3");
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) {
            if (matrix[r].length != 3) throw new IllegalArgumentException("Rotation must be 3x3");
            copy[r] = matrix[r].clone();
        }
        return new Rotation(copy);
    }

    /**
     * Rotation by {@code angle} radians about a unit {@code axis}
     * (Rodrigues' formula).
     */
    public static Rotation aboutAxis(double[] axis, double angle) {
        double x = axis[0];
        double y = axis[1];
        double z = axis[2];
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        double t = 1.0 - c;
        return new Rotation(new double[][] {
            {t * x * x + c, t * x * y - s * z, t * x * z + s * y},
            {t * x * y + s * z, t * y * y + c, t * y * z - s * x},
            {t * x * z - s * y, t * y * z + s * x, t * z * z + c}
        });
    }

    /** Rotation about the x-axis by {@code angle} radians. */
    public static Rotation aboutX(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return new Rotation(new double[][] {{1, 0, 0}, {0, c, -s}, {0, s, c}});
    }

    public double get(int row, int col) {
        return m[row][col];
    }

    public double[][] toArray() {
        return new double[][] {m[0].clone(), m[1].clone(), m[2].clone()};
    }

    /** {@code R v} */
    public double[] apply(double x, double y, double z) {
        return new double[] {
            m[0][0] * x + m[0][1] * y + m[0][2] * z,
            m[1][0] * x + m[1][1] * y + m[1][2] * z,
            m[2][0] * x + m[2][1] * y + m[2][2] * z
        };
    }

    public double[] apply(double[] v) {
        return apply(v[0], v[1], v[2]);
    }

    /** {@code this . other}: applies {@code other} first, then this rotation. */
    public Rotation compose(Rotation other) {
        double[][] r = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i][j] = m[i][0] * other.m[0][j] + m[i][1] * other.m[1][j] + m[i][2] * other.m[2][j];
            }
        }
        return new Rotation(r);
    }

    /** The inverse, which for a rotation is the transpose. */
    public Rotation transpose() {
        double[][] t = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) t[i][j] = m[j][i];
        }
        return new Rotation(t);
    }

    public double determinant() {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    /** Element-wise comparison within {@code tol}. */
    public boolean isCloseTo(Rotation other, double tol) {
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                if (Math.abs(m[i][j] - other.m[i][j]) > tol) return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rotation)) return false;
        return Arrays.deepEquals(m, ((Rotation) obj).m);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(m);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(m);
    }
}

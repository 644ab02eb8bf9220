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

import java.util.concurrent.CancellationException;

import com.github.ibexmapper.ConfigurationException.Reason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Real spherical-harmonics evaluator.
 *
 * <p>{@link #evaluateBasis} samples every real orthonormal harmonic up to a
 * degree limit on a regular colatitude/longitude grid; {@link #contract}
 * turns a coefficient vector into a heatmap aligned with the Mollweide
 * renderer's axes.</p>
 *
 * <p>The complex harmonics follow the physics convention with the
 * Condon-Shortley phase. The real basis is built from them with the usual
 * combination (see {@link #toRealForm}), which cancels the phase, so the
 * real elements are {@code sqrt(2) N P_l^|m| cos(m phi)} for {@code m > 0},
 * {@code sqrt(2) N P_l^|m| sin(|m| phi)} for {@code m < 0} and
 * {@code N P_l^0} for {@code m = 0}.</p>
 */
public final class HarmonicsEvaluator {
    private static final Logger log = LoggerFactory.getLogger(HarmonicsEvaluator.class);
    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);
    private static final double IMAGINARY_TOLERANCE = 1e-9;
    private static final int PROGRESS_STEP_PERCENT = 5;

    private HarmonicsEvaluator() {}

    /**
     * Evaluate the complete real basis for degrees {@code 0..maxL} on a
     * {@code dpi x dpi} grid. This is the expensive step of the pipeline,
     * O(maxL^2 * dpi^2).
     *
     * <p>The calling thread's interrupt flag is checked once per degree; an
     * interrupted evaluation stops with {@link CancellationException}.</p>
     *
     * @param dpi  grid resolution, at least 1
     * @param maxL highest degree, at least 0
     * @return basis with {@code (maxL + 1)^2} elements in canonical order
     * @throws ConfigurationException if {@code dpi} or {@code maxL} is out of range
     */
    public static BasisSet evaluateBasis(int dpi, int maxL) {
        if (dpi < 1) {
            throw new ConfigurationException(Reason.NON_POSITIVE_DIMENSION, "dpi must be positive, got " + dpi);
        }
        if (maxL < 0) {
            throw new ConfigurationException(
                    Reason.NON_POSITIVE_DIMENSION, "max l must not be negative, got " + maxL);
        }
        log.info("Calculating spherical harmonics for dpi {} up to l = {}", dpi, maxL);
        long started = System.nanoTime();

        double[] colatitude = linspace(0.0, Math.PI, dpi);
        double[] longitude = linspace(0.0, 2.0 * Math.PI, dpi);

        // Orthonormal P_l^m(cos(theta)) per colatitude, without Condon-Shortley phase
        double[][] schmidt = computeSchmidtQuasiNormFactors(maxL);
        double[][][] legendre = new double[dpi][][];
        for (int j = 0; j < dpi; j++) {
            legendre[j] = orthonormalLegendre(colatitude[j], maxL, schmidt);
        }

        // cos(m*phi) and sin(m*phi) per longitude, built by angle addition
        double[][] cosM = new double[dpi][maxL + 1];
        double[][] sinM = new double[dpi][maxL + 1];
        for (int i = 0; i < dpi; i++) {
            double c = Math.cos(longitude[i]);
            double s = Math.sin(longitude[i]);
            cosM[i][0] = 1.0;
            sinM[i][0] = 0.0;
            for (int m = 1; m <= maxL; m++) {
                cosM[i][m] = cosM[i][m - 1] * c - sinM[i][m - 1] * s;
                sinM[i][m] = sinM[i][m - 1] * c + cosM[i][m - 1] * s;
            }
        }

        int total = BasisSet.countFor(maxL);
        double[][][] elements = new double[total][][];
        double maxImaginary = 0.0;
        int done = 0;
        int checkpoint = 0;
        for (int l = 0; l <= maxL; l++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Spherical harmonics evaluation cancelled at l = {}", l);
                throw new CancellationException("Basis evaluation interrupted at l = " + l);
            }
            for (int m = -l; m <= l; m++) {
                int k = Math.abs(m);
                double phase = (k & 1) == 0 ? 1.0 : -1.0;
                double[][] element = new double[dpi][dpi];
                for (int i = 0; i < dpi; i++) {
                    for (int j = 0; j < dpi; j++) {
                        double q = legendre[j][l][k];
                        // Y_{l,k} = (-1)^k q e^{ik phi}, Y_{l,-k} = q e^{-ik phi}
                        double reK = phase * q * cosM[i][k];
                        double imK = phase * q * sinM[i][k];
                        double reNegK = q * cosM[i][k];
                        double imNegK = -q * sinM[i][k];
                        double rePos = m < 0 ? reNegK : reK;
                        double imPos = m < 0 ? imNegK : imK;
                        double reNeg = m < 0 ? reK : reNegK;
                        double imNeg = m < 0 ? imK : imNegK;
                        element[i][j] = realFormRe(m, rePos, imPos, reNeg, imNeg);
                        double im = Math.abs(realFormIm(m, rePos, imPos, reNeg, imNeg));
                        if (im > maxImaginary) maxImaginary = im;
                    }
                }
                elements[BasisSet.indexOf(l, m)] = element;

                done++;
                int progress = (int) (100L * done / total);
                if (progress >= checkpoint + PROGRESS_STEP_PERCENT) {
                    checkpoint = progress - (progress % PROGRESS_STEP_PERCENT);
                    log.debug("Filtering progress: {}%", checkpoint);
                }
            }
        }
        if (maxImaginary > IMAGINARY_TOLERANCE) {
            log.warn("Real basis conversion left an imaginary residue of {}", maxImaginary);
        }
        log.info(
                "Calculated {} spherical harmonics in {} ms",
                total,
                String.format("%.1f", (System.nanoTime() - started) / 1e6));
        return new BasisSet(dpi, maxL, elements);
    }

    /**
     * Coefficient-weighted sum of the first {@code table.size()} basis
     * elements, aligned for the renderer (see {@link #contract(double[], BasisSet)}).
     *
     * @throws IllegalArgumentException if the table needs a higher degree than the basis holds
     */
    public static double[][] contract(CoefficientTable table, BasisSet basis) {
        if (table.maxL() > basis.maxL()) {
            throw new IllegalArgumentException(
                    "Coefficient table needs l = " + table.maxL() + " but the basis stops at l = " + basis.maxL());
        }
        return contract(table.coefficients(), basis);
    }

    /**
     * Contract coefficients with the leading basis elements and realign the
     * result for the renderer.
     *
     * <p>The weighted sum is indexed {@code [longitude][colatitude]}; it is
     * transposed to {@code [latitude][longitude]} (row 0 is the north pole),
     * flipped left-right and rolled right by {@code dpi / 2} columns. Output
     * cell {@code [j][i]} therefore holds sum cell
     * {@code [dpi - 1 - ((i - dpi/2) mod dpi)][j]}.</p>
     *
     * @throws IllegalArgumentException if there are more coefficients than basis elements
     */
    public static double[][] contract(double[] coefficients, BasisSet basis) {
        if (coefficients.length > basis.size()) {
            throw new IllegalArgumentException(
                    coefficients.length + " coefficients but only " + basis.size() + " basis elements");
        }
        int dpi = basis.dpi();
        double[][] sum = new double[dpi][dpi];
        for (int k = 0; k < coefficients.length; k++) {
            double c = coefficients[k];
            if (c == 0.0) continue;
            double[][] e = basis.elementArray(k);
            for (int i = 0; i < dpi; i++) {
                double[] row = sum[i];
                double[] src = e[i];
                for (int j = 0; j < dpi; j++) row[j] += c * src[j];
            }
        }

        int shift = dpi / 2;
        double[][] aligned = new double[dpi][dpi];
        for (int j = 0; j < dpi; j++) {
            for (int i = 0; i < dpi; i++) {
                aligned[j][i] = sum[dpi - 1 - Math.floorMod(i - shift, dpi)][j];
            }
        }
        return aligned;
    }

    /**
     * Complex spherical harmonic {@code Y_l^m(colatitude, longitude)},
     * orthonormal, with the Condon-Shortley phase.
     */
    public static Complex complexHarmonic(int l, int m, double colatitude, double longitude) {
        if (l < 0 || Math.abs(m) > l) {
            throw new IllegalArgumentException("Invalid harmonic (l=" + l + ", m=" + m + ")");
        }
        int k = Math.abs(m);
        double q = orthonormalLegendre(colatitude, l, computeSchmidtQuasiNormFactors(l))[l][k];
        Complex yk = Complex.polar(q, k * longitude).scale((k & 1) == 0 ? 1.0 : -1.0);
        if (m >= 0) return yk;
        return yk.conjugate().scale((k & 1) == 0 ? 1.0 : -1.0);
    }

    /**
     * Real-form combination of {@code Y_{l,m}} and {@code Y_{l,-m}}.
     * For {@code m < 0}: {@code (i/sqrt2)(Y_{l,m} - (-1)^|m| Y_{l,-m})};
     * for {@code m = 0}: {@code Y_{l,0}};
     * for {@code m > 0}: {@code (1/sqrt2)(Y_{l,-m} + (-1)^|m| Y_{l,m})}.
     * The imaginary part of the result is a rounding artefact.
     */
    public static Complex toRealForm(int m, Complex yLm, Complex yLNegM) {
        return new Complex(
                realFormRe(m, yLm.real, yLm.imag, yLNegM.real, yLNegM.imag),
                realFormIm(m, yLm.real, yLm.imag, yLNegM.real, yLNegM.imag));
    }

    private static double realFormRe(int m, double rePos, double imPos, double reNeg, double imNeg) {
        double sign = (Math.abs(m) & 1) == 0 ? 1.0 : -1.0;
        if (m < 0) {
            // i * (a + ib) = -b + ia
            return -(imPos - sign * imNeg) * INV_SQRT2;
        } else if (m == 0) {
            return rePos;
        }
        return (reNeg + sign * rePos) * INV_SQRT2;
    }

    private static double realFormIm(int m, double rePos, double imPos, double reNeg, double imNeg) {
        double sign = (Math.abs(m) & 1) == 0 ? 1.0 : -1.0;
        if (m < 0) {
            return (rePos - sign * reNeg) * INV_SQRT2;
        } else if (m == 0) {
            return imPos;
        }
        return (imNeg + sign * imPos) * INV_SQRT2;
    }

    /** {@code n} evenly spaced values from {@code start} to {@code stop}, both included. */
    static double[] linspace(double start, double stop, int n) {
        double[] out = new double[n];
        if (n == 1) {
            out[0] = start;
            return out;
        }
        double step = (stop - start) / (n - 1);
        for (int i = 0; i < n; i++) out[i] = start + i * step;
        out[n - 1] = stop;
        return out;
    }

    /**
     * Orthonormal associated Legendre values {@code N_lm P_l^m(cos(theta))}
     * for {@code 0 <= m <= l <= maxL}, without the Condon-Shortley phase.
     * Gauss-normalized values come from the standard recursion and are
     * rescaled through the Schmidt quasi-normalization factors.
     */
    private static double[][] orthonormalLegendre(double thetaRad, int maxL, double[][] schmidt) {
        double cos = Math.cos(thetaRad);
        double sin = Math.sin(thetaRad);
        double[][] p = new double[maxL + 1][];
        p[0] = new double[] {1.0};
        for (int n = 1; n <= maxL; n++) {
            p[n] = new double[n + 1];
            for (int m = 0; m <= n; m++) {
                if (n == m) {
                    p[n][m] = sin * p[n - 1][m - 1];
                } else if (n == 1 || m == n - 1) {
                    p[n][m] = cos * p[n - 1][m];
                } else {
                    double k = ((n - 1.0) * (n - 1.0) - m * m) / ((2.0 * n - 1.0) * (2.0 * n - 3.0));
                    p[n][m] = cos * p[n - 1][m] - k * p[n - 2][m];
                }
            }
        }
        for (int n = 0; n <= maxL; n++) {
            double norm = Math.sqrt((2.0 * n + 1.0) / (4.0 * Math.PI));
            for (int m = 0; m <= n; m++) {
                // Schmidt carries sqrt(2) for m > 0; orthonormal does not
                p[n][m] *= schmidt[n][m] * norm * (m == 0 ? 1.0 : INV_SQRT2);
            }
        }
        return p;
    }

    /**
     * Factors that turn Gauss-normalized Legendre functions into Schmidt
     * quasi-normalized ones, for degrees {@code 0..maxL}.
     */
    private static double[][] computeSchmidtQuasiNormFactors(int maxL) {
        double[][] s = new double[maxL + 1][];
        s[0] = new double[] {1.0};
        for (int n = 1; n <= maxL; n++) {
            s[n] = new double[n + 1];
            s[n][0] = s[n - 1][0] * (2.0 * n - 1.0) / n;
            for (int m = 1; m <= n; m++) {
                s[n][m] = s[n][m - 1] * Math.sqrt((n - m + 1.0) * (m == 1 ? 2.0 : 1.0) / (n + m));
            }
        }
        return s;
    }
}

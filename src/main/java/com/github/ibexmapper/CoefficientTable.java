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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spherical-harmonics coefficients supplied by the user, one row per
 * {@code (l, m)} in the canonical order {@code (0,0), (1,-1), (1,0), (1,1), ...}.
 *
 * <p>Row {@code k} multiplies basis element {@code k}, so rows must follow the
 * canonical enumeration without gaps; the table is never re-sorted.</p>
 */
public final class CoefficientTable {
    private static final Logger log = LoggerFactory.getLogger(CoefficientTable.class);

    /** One table row. */
    public record Row(int l, int m, double coefficient, double uncertainty) {}

    private final List<Row> rows;

    private CoefficientTable(List<Row> rows) {
        this.rows = rows;
    }

    /**
     * Build a table from rows already in canonical order.
     *
     * @throws IllegalArgumentException if the table is empty or a row is out of sequence
     */
    public static CoefficientTable of(List<Row> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Coefficient table has no rows");
        }
        for (int k = 0; k < rows.size(); k++) {
            Row r = rows.get(k);
            if (r.l() < 0 || Math.abs(r.m()) > r.l()) {
                throw new IllegalArgumentException(
                        "Row " + k + " has invalid harmonic (l=" + r.l() + ", m=" + r.m() + ")");
            }
            if (BasisSet.indexOf(r.l(), r.m()) != k) {
                throw new IllegalArgumentException(
                        "Row " + k + " (l=" + r.l() + ", m=" + r.m()
                                + ") is out of canonical (l, m) order");
            }
        }
        return new CoefficientTable(Collections.unmodifiableList(new ArrayList<>(rows)));
    }

    /**
     * Table with the given coefficients in canonical order and zero
     * uncertainties.
     */
    public static CoefficientTable ofCoefficients(double... coefficients) {
        List<Row> rows = new ArrayList<>(coefficients.length);
        int l = 0;
        int m = 0;
        for (double c : coefficients) {
            rows.add(new Row(l, m, c, 0.0));
            if (++m > l) {
                l++;
                m = -l;
            }
        }
        return of(rows);
    }

    /**
     * Load a whitespace-delimited {@code l m coefficient uncertainty} table.
     *
     * @throws IllegalStateException if the file cannot be read or parsed
     */
    public static CoefficientTable load(Path path) {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            log.error("Failed to read coefficient table {}", path, e);
            throw new IllegalStateException("Failed to read coefficient table " + path, e);
        }
    }

    /**
     * Parse a coefficient table. Blank lines and lines starting with
     * {@code #} are skipped; a missing uncertainty column reads as zero.
     *
     * @param source name used in error messages
     * @throws IllegalStateException on read or format errors
     */
    public static CoefficientTable parse(Reader reader, String source) {
        List<Row> rows = new ArrayList<>();
        int lineNo = 0;
        try {
            BufferedReader br = reader instanceof BufferedReader
                    ? (BufferedReader) reader
                    : new BufferedReader(reader);
            String line;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length < 3) {
                    throw new IllegalArgumentException("expected at least 3 columns, got " + toks.length);
                }
                int l = parseIndex("l", toks[0]);
                int m = parseIndex("m", toks[1]);
                double coeff = Double.parseDouble(toks[2]);
                double sigma = toks.length > 3 ? Double.parseDouble(toks[3]) : 0.0;
                rows.add(new Row(l, m, coeff, sigma));
            }
        } catch (IOException e) {
            log.error("Failed to read coefficient table {}", source, e);
            throw new IllegalStateException("Failed to read coefficient table " + source, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse coefficient table {} at line {}", source, lineNo, e);
            throw new IllegalStateException(
                    "Failed to parse coefficient table " + source + " at line " + lineNo + ": "
                            + e.getMessage(), e);
        }
        try {
            return of(rows);
        } catch (IllegalArgumentException e) {
            log.error("Invalid coefficient table {}: {}", source, e.getMessage());
            throw new IllegalStateException("Invalid coefficient table " + source + ": " + e.getMessage(), e);
        }
    }

    // Degree and order may be written as decimals ("2.0") but must be integral
    private static int parseIndex(String name, String token) {
        double value = Double.parseDouble(token);
        if (!Double.isFinite(value) || value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + token + "'");
        }
        return (int) value;
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** Degree of the last row. */
    public int maxL() {
        return rows.get(rows.size() - 1).l();
    }

    /** The coefficient column as a fresh array. */
    public double[] coefficients() {
        double[] c = new double[rows.size()];
        for (int i = 0; i < c.length; i++) c[i] = rows.get(i).coefficient();
        return c;
    }
}

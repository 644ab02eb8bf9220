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

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CoefficientTableTest {

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Comments and blank lines are skipped, missing uncertainty reads as zero")
        void loadsFixture() throws URISyntaxException {
            CoefficientTable table = CoefficientTable.load(resource("/coefficients/dipole.txt"));

            assertEquals(4, table.size());
            assertEquals(1, table.maxL());
            assertArrayEquals(new double[] {2.5, 0.0, 0.75, -0.25}, table.coefficients());
            assertEquals(0.05, table.rows().get(2).uncertainty());
            assertEquals(0.0, table.rows().get(3).uncertainty());
        }

        @Test
        @DisplayName("Degree and order may be written as decimals")
        void decimalIndices() {
            CoefficientTable table = CoefficientTable.parse(new StringReader("0.0 0.0 1.5 0.0\n"), "inline");

            assertEquals(0, table.rows().get(0).l());
            assertEquals(1.5, table.rows().get(0).coefficient());
        }

        @Test
        @DisplayName("Rows out of canonical order are rejected")
        void unordered() {
            IllegalStateException e = assertThrows(
                    IllegalStateException.class,
                    () -> CoefficientTable.load(resource("/coefficients/unordered.txt")));
            assertTrue(e.getMessage().contains("canonical"), e.getMessage());
        }

        @Test
        @DisplayName("Short or non-numeric lines report the line number")
        void malformedLine() {
            IllegalStateException shortLine = assertThrows(
                    IllegalStateException.class,
                    () -> CoefficientTable.parse(new StringReader("# header\n0 0\n"), "inline"));
            assertTrue(shortLine.getMessage().contains("line 2"), shortLine.getMessage());

            assertThrows(IllegalStateException.class,
                    () -> CoefficientTable.parse(new StringReader("0 0 x 0\n"), "inline"));
        }

        @Test
        @DisplayName("Fractional degree or order is rejected with the line number")
        void fractionalIndex() {
            IllegalStateException e = assertThrows(
                    IllegalStateException.class,
                    () -> CoefficientTable.parse(new StringReader("0 0 1.0 0.0\n1.5 0 0.2 0.0\n"), "inline"));
            assertTrue(e.getMessage().contains("line 2"), e.getMessage());

            assertThrows(IllegalStateException.class,
                    () -> CoefficientTable.parse(new StringReader("0 0.25 1.0 0.0\n"), "inline"));
        }

        @Test
        @DisplayName("Empty tables are rejected")
        void empty() {
            assertThrows(IllegalStateException.class,
                    () -> CoefficientTable.parse(new StringReader("# nothing\n\n"), "inline"));
        }

        @Test
        @DisplayName("Missing files fail with IllegalStateException")
        void missingFile() {
            assertThrows(IllegalStateException.class,
                    () -> CoefficientTable.load(Path.of("does-not-exist", "coefficients.txt")));
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Coefficients are assigned in canonical (l, m) order")
        void ofCoefficients() {
            CoefficientTable table = CoefficientTable.ofCoefficients(1, 2, 3, 4, 5);
            List<CoefficientTable.Row> rows = table.rows();

            assertEquals(2, table.maxL());
            assertEquals(1, rows.get(1).l());
            assertEquals(-1, rows.get(1).m());
            assertEquals(1, rows.get(3).m());
            assertEquals(2, rows.get(4).l());
            assertEquals(-2, rows.get(4).m());
        }

        @Test
        @DisplayName("Invalid harmonics are rejected")
        void invalidHarmonic() {
            assertThrows(IllegalArgumentException.class,
                    () -> CoefficientTable.of(List.of(new CoefficientTable.Row(0, 1, 1.0, 0.0))));
            assertThrows(IllegalArgumentException.class, () -> CoefficientTable.of(List.of()));
        }

        @Test
        @DisplayName("Rows are immutable")
        void immutableRows() {
            CoefficientTable table = CoefficientTable.ofCoefficients(1.0);
            assertThrows(UnsupportedOperationException.class,
                    () -> table.rows().add(new CoefficientTable.Row(1, -1, 0.0, 0.0)));
        }
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(CoefficientTableTest.class.getResource(name).toURI());
    }
}

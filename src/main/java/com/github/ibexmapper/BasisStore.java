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
import java.util.Optional;

/**
 * Persistent backing for {@link BasisCache}: one blob per
 * {@code (dpi, maxL)} pair.
 */
public interface BasisStore {

    /**
     * Read the basis stored for {@code (dpi, maxL)}.
     *
     * @return the basis, or empty when nothing is stored for the key
     * @throws CorruptBasisException if a stored blob exists but cannot be decoded
     * @throws IOException           on other read failures
     */
    Optional<BasisSet> load(int dpi, int maxL) throws IOException;

    /** Store a complete basis under its own {@code (dpi, maxL)}, replacing any previous blob. */
    void save(BasisSet basis) throws IOException;
}

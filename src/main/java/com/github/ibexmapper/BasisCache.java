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
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.github.ibexmapper.ConfigurationException.Reason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizing source of {@link BasisSet}s keyed by {@code (dpi, maxL)}.
 *
 * <p>Lookups go to an in-process table first, then to the {@link BasisStore};
 * a miss in both evaluates the basis and writes it back. An unreadable blob
 * counts as a miss and is overwritten. Entries are never invalidated; a
 * change to the evaluation itself needs the store wiped by hand.</p>
 *
 * <p>{@link #get} holds the cache's monitor for the whole lookup, so two
 * concurrent misses for the same key evaluate and write once.</p>
 */
public final class BasisCache {
    private static final Logger log = LoggerFactory.getLogger(BasisCache.class);

    /** Computes a complete basis on a miss. */
    @FunctionalInterface
    public interface Evaluator {
        BasisSet evaluate(int dpi, int maxL);
    }

    private record Key(int dpi, int maxL) {}

    private final BasisStore store;
    private final Evaluator evaluator;
    private final Map<Key, BasisSet> loaded = new HashMap<>();

    public BasisCache(BasisStore store) {
        this(store, HarmonicsEvaluator::evaluateBasis);
    }

    public BasisCache(BasisStore store, Evaluator evaluator) {
        this.store = store;
        this.evaluator = evaluator;
    }

    /** Cache backed by blob files in {@code directory}. */
    public static BasisCache onDisk(Path directory) {
        return new BasisCache(new FileBasisStore(directory));
    }

    /**
     * The complete basis for {@code (dpi, maxL)}.
     *
     * @throws ConfigurationException if {@code dpi < 1} or {@code maxL < 0}
     */
    public synchronized BasisSet get(int dpi, int maxL) {
        if (dpi < 1 || maxL < 0) {
            throw new ConfigurationException(
                    Reason.NON_POSITIVE_DIMENSION, "Invalid basis key dpi=" + dpi + ", l=" + maxL);
        }
        Key key = new Key(dpi, maxL);
        BasisSet basis = loaded.get(key);
        if (basis != null) {
            return basis;
        }

        basis = loadStored(dpi, maxL).orElse(null);
        if (basis != null) {
            log.info("Using cached spherical harmonics for dpi {} and l {}", dpi, maxL);
        } else {
            basis = evaluator.evaluate(dpi, maxL);
            try {
                store.save(basis);
            } catch (IOException e) {
                log.warn("Could not persist spherical harmonics for dpi {} and l {}", dpi, maxL, e);
            }
        }
        loaded.put(key, basis);
        return basis;
    }

    /**
     * The first {@code count} elements of the basis for {@code (dpi, maxL)},
     * i.e. what a coefficient table with {@code count} rows needs.
     */
    public BasisSet get(int dpi, int maxL, int count) {
        return get(dpi, maxL).truncate(count);
    }

    /**
     * Fill the cache for {@code (dpi, maxL)} on {@code executor}. Cancelling
     * the returned future with interruption stops an evaluation at the next
     * degree boundary and leaves the cache unchanged.
     */
    public Future<BasisSet> prefetch(int dpi, int maxL, ExecutorService executor) {
        return executor.submit(() -> get(dpi, maxL));
    }

    /** Whether {@code (dpi, maxL)} is already held in memory. */
    public synchronized boolean isLoaded(int dpi, int maxL) {
        return loaded.containsKey(new Key(dpi, maxL));
    }

    private Optional<BasisSet> loadStored(int dpi, int maxL) {
        try {
            return store.load(dpi, maxL);
        } catch (CorruptBasisException e) {
            log.warn("Discarding corrupt spherical harmonics cache for dpi {} and l {}: {}",
                    dpi, maxL, e.getMessage());
        } catch (IOException e) {
            log.warn("Could not read spherical harmonics cache for dpi {} and l {}", dpi, maxL, e);
        }
        return Optional.empty();
    }
}

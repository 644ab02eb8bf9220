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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BasisCacheTest {

    /** Evaluator that counts how often it runs. */
    private static final class CountingEvaluator implements BasisCache.Evaluator {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public BasisSet evaluate(int dpi, int maxL) {
            calls.incrementAndGet();
            return HarmonicsEvaluator.evaluateBasis(dpi, maxL);
        }
    }

    @Nested
    @DisplayName("In-memory behaviour")
    class MemoryTests {

        @Test
        @DisplayName("Repeated lookups evaluate once and return the same set")
        void idempotent() {
            CountingEvaluator evaluator = new CountingEvaluator();
            BasisCache cache = new BasisCache(new InMemoryBasisStore(), evaluator);

            BasisSet first = cache.get(6, 2);
            BasisSet second = cache.get(6, 2);

            assertSame(first, second);
            assertEquals(1, evaluator.calls.get());
            assertTrue(cache.isLoaded(6, 2));
        }

        @Test
        @DisplayName("A different degree limit is a different entry")
        void differentMaxL() {
            CountingEvaluator evaluator = new CountingEvaluator();
            BasisCache cache = new BasisCache(new InMemoryBasisStore(), evaluator);

            cache.get(6, 2);
            BasisSet deeper = cache.get(6, 3);

            assertEquals(2, evaluator.calls.get());
            assertEquals(16, deeper.size());
            assertFalse(cache.isLoaded(8, 2));
        }

        @Test
        @DisplayName("Requesting a count truncates to the leading elements")
        void truncation() {
            BasisCache cache = new BasisCache(new InMemoryBasisStore());
            BasisSet full = cache.get(5, 3);
            BasisSet head = cache.get(5, 3, 4);

            assertEquals(4, head.size());
            assertEquals(3, head.maxL());
            for (int k = 0; k < 4; k++) assertSame(full.elementArray(k), head.elementArray(k));
        }

        @Test
        @DisplayName("Elements handed out are copies of the shared basis")
        void elementsAreCopies() {
            BasisCache cache = new BasisCache(new InMemoryBasisStore());
            double[][] y10 = cache.get(5, 1).element(1, 0);
            double before = cache.get(5, 1).value(2, 0, 0);

            y10[0][0] = 1e9;

            assertEquals(before, cache.get(5, 1).value(2, 0, 0));
            assertEquals(before, cache.get(5, 1).element(2)[0][0]);
        }

        @Test
        @DisplayName("Invalid keys are rejected before evaluation")
        void invalidKey() {
            CountingEvaluator evaluator = new CountingEvaluator();
            BasisCache cache = new BasisCache(new InMemoryBasisStore(), evaluator);

            assertThrows(ConfigurationException.class, () -> cache.get(0, 2));
            assertThrows(ConfigurationException.class, () -> cache.get(4, -1));
            assertEquals(0, evaluator.calls.get());
        }

        @Test
        @DisplayName("A failing store does not fail the lookup")
        void failingStore() {
            BasisStore broken = new BasisStore() {
                @Override
                public Optional<BasisSet> load(int dpi, int maxL) throws IOException {
                    throw new IOException("disk unavailable");
                }

                @Override
                public void save(BasisSet basis) throws IOException {
                    throw new IOException("disk unavailable");
                }
            };
            BasisCache cache = new BasisCache(broken);

            BasisSet basis = cache.get(4, 1);

            assertEquals(4, basis.size());
        }

        @Test
        @DisplayName("Prefetch fills the cache in the background")
        void prefetch() throws Exception {
            CountingEvaluator evaluator = new CountingEvaluator();
            BasisCache cache = new BasisCache(new InMemoryBasisStore(), evaluator);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<BasisSet> future = cache.prefetch(6, 2, executor);
                BasisSet fetched = future.get(30, TimeUnit.SECONDS);

                assertTrue(cache.isLoaded(6, 2));
                assertSame(fetched, cache.get(6, 2));
                assertEquals(1, evaluator.calls.get());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Evaluated sets are written to the store")
        void writesThrough() {
            InMemoryBasisStore store = new InMemoryBasisStore();
            new BasisCache(store).get(4, 2);

            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("A fresh cache reads the stored blob bit for bit")
        void reloadsFromDisk() {
            CountingEvaluator firstEvaluator = new CountingEvaluator();
            BasisSet first = new BasisCache(new FileBasisStore(dir), firstEvaluator).get(7, 3);

            CountingEvaluator secondEvaluator = new CountingEvaluator();
            BasisSet reloaded = new BasisCache(new FileBasisStore(dir), secondEvaluator).get(7, 3);

            assertEquals(1, firstEvaluator.calls.get());
            assertEquals(0, secondEvaluator.calls.get());
            assertNotSame(first, reloaded);
            for (int k = 0; k < first.size(); k++) {
                for (int i = 0; i < 7; i++) assertArrayEquals(first.element(k)[i], reloaded.element(k)[i]);
            }
        }

        @Test
        @DisplayName("A corrupt blob is recomputed and overwritten")
        void corruptBlob() throws IOException {
            FileBasisStore store = new FileBasisStore(dir);
            Files.write(store.pathFor(5, 2), new byte[] {1, 2, 3, 4, 5, 6, 7});

            CountingEvaluator evaluator = new CountingEvaluator();
            BasisSet basis = new BasisCache(store, evaluator).get(5, 2);

            assertEquals(1, evaluator.calls.get());
            assertEquals(9, basis.size());
            assertTrue(store.load(5, 2).isPresent(), "blob should have been rewritten");
        }

        @Test
        @DisplayName("Cache directory is created on demand")
        void createsDirectory() {
            Path nested = dir.resolve("a").resolve("b");
            BasisCache.onDisk(nested).get(3, 1);

            assertTrue(Files.exists(nested.resolve(FileBasisStore.blobName(3, 1))));
        }
    }
}

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
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileBasisStoreTest {

    @TempDir
    Path dir;

    private FileBasisStore store;

    @BeforeEach
    void setUp() {
        store = new FileBasisStore(dir);
    }

    @Test
    @DisplayName("Blob names follow DPI<dpi>L<maxL>.bin")
    void blobName() {
        assertEquals("DPI720L30.bin", FileBasisStore.blobName(720, 30));
        assertEquals(dir.resolve("DPI4L2.bin"), store.pathFor(4, 2));
        assertEquals(dir, store.directory());
    }

    @Test
    @DisplayName("Missing blob loads as empty")
    void missing() throws IOException {
        assertTrue(store.load(4, 2).isEmpty());
    }

    @Test
    @DisplayName("Saved blob loads with identical values and leaves no temporary files")
    void saveAndLoad() throws IOException {
        BasisSet basis = HarmonicsEvaluator.evaluateBasis(5, 2);
        store.save(basis);

        BasisSet loaded = store.load(5, 2).orElseThrow();
        assertEquals(basis.size(), loaded.size());
        assertArrayEquals(basis.element(2, 1)[3], loaded.element(2, 1)[3]);

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count(), "only the blob itself should remain");
        }
    }

    @Test
    @DisplayName("A flipped byte fails the checksum")
    void checksum() throws IOException {
        store.save(HarmonicsEvaluator.evaluateBasis(4, 1));
        Path file = store.pathFor(4, 1);
        byte[] bytes = Files.readAllBytes(file);
        bytes[40] ^= 0x10;
        Files.write(file, bytes);

        assertThrows(CorruptBasisException.class, () -> store.load(4, 1));
    }

    @Test
    @DisplayName("A truncated blob is corrupt")
    void truncated() throws IOException {
        store.save(HarmonicsEvaluator.evaluateBasis(4, 1));
        Path file = store.pathFor(4, 1);
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length / 2));

        assertThrows(CorruptBasisException.class, () -> store.load(4, 1));
    }

    @Test
    @DisplayName("A blob stored under the wrong key is corrupt")
    void wrongKey() throws IOException {
        store.save(HarmonicsEvaluator.evaluateBasis(4, 1));
        Files.copy(store.pathFor(4, 1), store.pathFor(4, 2));

        assertThrows(CorruptBasisException.class, () -> store.load(4, 2));
    }

    @Test
    @DisplayName("Saving replaces an existing blob")
    void replaces() throws IOException {
        Files.write(store.pathFor(3, 0), new byte[] {0});
        store.save(HarmonicsEvaluator.evaluateBasis(3, 0));

        assertTrue(store.load(3, 0).isPresent());
    }

    @Test
    @DisplayName("Truncated sets cannot be stored")
    void incompleteSet() {
        BasisSet head = HarmonicsEvaluator.evaluateBasis(4, 2).truncate(3);
        assertThrows(IllegalArgumentException.class, () -> store.save(head));
    }
}

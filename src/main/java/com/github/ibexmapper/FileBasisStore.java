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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.CheckedOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BasisStore} keeping one binary file per {@code (dpi, maxL)} in a
 * directory, named {@code DPI<dpi>L<maxL>.bin}.
 *
 * <p>Layout (big-endian): magic, format version, dpi, maxL, element count,
 * then every element row by row as doubles, then a CRC32 of everything
 * before it. Files are written to a temporary sibling and renamed into
 * place, so readers never observe a half-written blob.</p>
 */
public final class FileBasisStore implements BasisStore {
    private static final Logger log = LoggerFactory.getLogger(FileBasisStore.class);
    private static final int MAGIC = 0x49425842; // "IBXB"
    private static final int VERSION = 1;

    private final Path directory;

    public FileBasisStore(Path directory) {
        this.directory = directory;
    }

    /** Deterministic blob name for a cache key. */
    public static String blobName(int dpi, int maxL) {
        return "DPI" + dpi + "L" + maxL + ".bin";
    }

    public Path directory() {
        return directory;
    }

    public Path pathFor(int dpi, int maxL) {
        return directory.resolve(blobName(dpi, maxL));
    }

    @Override
    public Optional<BasisSet> load(int dpi, int maxL) throws IOException {
        Path file = pathFor(dpi, maxL);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CRC32 crc = new CRC32();
        try (DataInputStream in = new DataInputStream(
                new CheckedInputStream(new BufferedInputStream(Files.newInputStream(file)), crc))) {
            int magic = in.readInt();
            int version = in.readInt();
            if (magic != MAGIC || version != VERSION) {
                throw new CorruptBasisException(
                        "Unrecognised basis blob header in " + file + " (magic " + Integer.toHexString(magic)
                                + ", version " + version + ")");
            }
            int storedDpi = in.readInt();
            int storedMaxL = in.readInt();
            int count = in.readInt();
            if (storedDpi != dpi || storedMaxL != maxL || count != BasisSet.countFor(maxL)) {
                throw new CorruptBasisException(
                        "Basis blob " + file + " holds dpi " + storedDpi + ", l " + storedMaxL + ", "
                                + count + " elements");
            }
            double[][][] elements = new double[count][dpi][dpi];
            for (double[][] element : elements) {
                for (double[] row : element) {
                    for (int j = 0; j < dpi; j++) row[j] = in.readDouble();
                }
            }
            long expected = crc.getValue();
            long stored = in.readLong();
            if (stored != expected) {
                throw new CorruptBasisException("Checksum mismatch in basis blob " + file);
            }
            if (in.read() != -1) {
                throw new CorruptBasisException("Trailing bytes in basis blob " + file);
            }
            log.debug("Loaded basis blob {}", file);
            return Optional.of(new BasisSet(dpi, maxL, elements));
        } catch (EOFException e) {
            throw new CorruptBasisException("Truncated basis blob " + file, e);
        }
    }

    @Override
    public void save(BasisSet basis) throws IOException {
        if (!basis.isComplete()) {
            throw new IllegalArgumentException("Only complete basis sets can be stored");
        }
        Files.createDirectories(directory);
        Path target = pathFor(basis.dpi(), basis.maxL());
        Path tmp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            CRC32 crc = new CRC32();
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp)))) {
                DataOutputStream body = new DataOutputStream(new CheckedOutputStream(out, crc));
                body.writeInt(MAGIC);
                body.writeInt(VERSION);
                body.writeInt(basis.dpi());
                body.writeInt(basis.maxL());
                body.writeInt(basis.size());
                for (int k = 0; k < basis.size(); k++) {
                    for (double[] row : basis.elementArray(k)) {
                        for (double v : row) body.writeDouble(v);
                    }
                }
                body.flush();
                out.writeLong(crc.getValue());
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, replacing {} directly", directory, target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Cached spherical harmonics to {}", target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

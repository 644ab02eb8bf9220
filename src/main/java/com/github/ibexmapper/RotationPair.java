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
 * The two rotations derived from a render request's anchors.
 *
 * @param centering moves the central point onto {@code (1, 0, 0)}
 * @param full      final rotation: the meridian rotation applied after the
 *                  centering one, or the centering rotation alone when both
 *                  anchors coincide
 */
public record RotationPair(Rotation centering, Rotation full) {

    /** Build both rotations from the central and meridian anchors. */
    public static RotationPair of(GeoPoint central, GeoPoint meridian) {
        Rotation centering = SphereTransform.buildCenteringRotation(central);
        return new RotationPair(centering, SphereTransform.composeRotation(central, meridian, centering));
    }
}

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
package com.github.tinemuz.lumiaxis.signal;

/**
 * Concrete kind of a luminescence signal.
 *
 * <p>The set is closed. {@link #BASE} marks the untyped result of a generic
 * reduction before {@code DimensionalityCastResolver} has looked at it.</p>
 */
public enum SignalType {
    BASE("Base", 0),
    LUMINESCENCE("Luminescence", 1),
    CL("CL", 1),
    CL_SEM("CL_SEM", 1),
    CL_STEM("CL_STEM", 1),
    EL("EL", 1),
    PL("PL", 1),
    TRANSIENT("Transient", 1),
    TRANSIENT_SPECTRUM("TransientSpectrum", 2);

    private final String label;
    private final int signalDimension;

    SignalType(String label, int signalDimension) {
        this.label = label;
        this.signalDimension = signalDimension;
    }

    public String label() {
        return label;
    }

    /** Number of signal axes the type expects; 0 for {@link #BASE}. */
    public int signalDimension() {
        return signalDimension;
    }
}

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

import com.github.tinemuz.lumiaxis.exceptions.ShapeMismatchException;
import java.util.Arrays;

/**
 * Measurement variance attached to a signal: absent, one constant for every
 * sample, or one value per data sample.
 */
public final class VarianceModel {

    public enum Kind {
        NONE,
        CONSTANT,
        ARRAY
    }

    private static final VarianceModel NONE = new VarianceModel(Kind.NONE, Double.NaN, null);

    private final Kind kind;
    private final double constant;
    private final double[] values;

    private VarianceModel(Kind kind, double constant, double[] values) {
        this.kind = kind;
        this.constant = constant;
        this.values = values;
    }

    public static VarianceModel none() {
        return NONE;
    }

    public static VarianceModel constant(double variance) {
        if (!(variance >= 0.0)) {
            throw new IllegalArgumentException("Variance must be non-negative: " + variance);
        }
        return new VarianceModel(Kind.CONSTANT, variance, null);
    }

    /** Per-sample variance; the array is copied. */
    public static VarianceModel array(double[] variance) {
        if (variance == null) throw new IllegalArgumentException("variance must not be null");
        return new VarianceModel(Kind.ARRAY, Double.NaN, variance.clone());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    /** Constant value; NaN unless {@link Kind#CONSTANT}. */
    public double constant() {
        return constant;
    }

    /**
     * Variance of every sample as a fresh array of {@code length} entries.
     * A constant is broadcast.
     *
     * @throws IllegalStateException if no variance is present
     * @throws ShapeMismatchException if an array variance has a different length
     */
    public double[] toArray(int length) {
        switch (kind) {
            case CONSTANT: {
                double[] out = new double[length];
                Arrays.fill(out, constant);
                return out;
            }
            case ARRAY:
                checkLength(length);
                return values.clone();
            default:
                throw new IllegalStateException("No variance present");
        }
    }

    /**
     * @throws ShapeMismatchException if an array variance does not have {@code length} entries
     */
    public void checkLength(int length) {
        if (kind == Kind.ARRAY && values.length != length) {
            throw new ShapeMismatchException(
                    "variance has " + values.length + " values but data has " + length);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return "VarianceModel{constant=" + constant + "}";
            case ARRAY:
                return "VarianceModel{array, length=" + values.length + "}";
            default:
                return "VarianceModel{none}";
        }
    }
}

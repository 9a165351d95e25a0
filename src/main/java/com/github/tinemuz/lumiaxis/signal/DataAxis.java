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

import java.util.Arrays;
import java.util.Optional;

/**
 * One axis of a signal: a name, a unit symbol, a navigation flag and the
 * coordinate of every sample.
 *
 * <p>An axis is either <em>uniform</em> (coordinates derived from offset and
 * scale) or <em>non-uniform</em> (coordinates stored explicitly). Non-uniform
 * coordinates must be strictly monotonic. Instances are immutable; an axis is
 * replaced wholesale, never edited.</p>
 */
public final class DataAxis {
    private final String name;
    private final String units;
    private final boolean navigate;
    private final int size;
    private final double offset;
    private final double scale;
    private final double[] values; // null when uniform

    private DataAxis(
            String name,
            String units,
            boolean navigate,
            int size,
            double offset,
            double scale,
            double[] values) {
        this.name = name;
        this.units = units;
        this.navigate = navigate;
        this.size = size;
        this.offset = offset;
        this.scale = scale;
        this.values = values;
    }

    /**
     * Uniform signal axis.
     *
     * @throws IllegalArgumentException if size is not positive or scale is zero
     */
    public static DataAxis uniform(String name, String units, int size, double offset, double scale) {
        if (size <= 0) throw new IllegalArgumentException("Axis size must be positive: " + size);
        if (scale == 0.0 || !Double.isFinite(scale)) {
            throw new IllegalArgumentException("Axis scale must be finite and non-zero: " + scale);
        }
        return new DataAxis(name, units, false, size, offset, scale, null);
    }

    /**
     * Non-uniform signal axis holding a copy of {@code values}.
     *
     * @throws IllegalArgumentException if values are empty or not strictly monotonic
     */
    public static DataAxis nonUniform(String name, String units, double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Axis values must not be empty");
        }
        if (monotonicDirection(values) == 0) {
            throw new IllegalArgumentException("Axis '" + name + "' values must be strictly monotonic");
        }
        return new DataAxis(name, units, false, values.length, Double.NaN, Double.NaN, values.clone());
    }

    /** Uniform navigation axis with unit spacing starting at zero. */
    public static DataAxis navigation(String name, int size) {
        return uniform(name, null, size, 0.0, 1.0).asNavigation(true);
    }

    /**
     * Direction of a coordinate vector: 1 strictly increasing, -1 strictly
     * decreasing, 0 otherwise. Single-element vectors count as increasing.
     */
    public static int monotonicDirection(double[] v) {
        if (v.length < 2) return 1;
        boolean up = true;
        boolean down = true;
        for (int i = 1; i < v.length; i++) {
            if (!(v[i] > v[i - 1])) up = false;
            if (!(v[i] < v[i - 1])) down = false;
        }
        return up ? 1 : (down ? -1 : 0);
    }

    public String name() {
        return name;
    }

    public String units() {
        return units;
    }

    public Optional<AxisUnit> unit() {
        return AxisUnit.fromSymbol(units);
    }

    public boolean navigate() {
        return navigate;
    }

    public int size() {
        return size;
    }

    public boolean isUniform() {
        return values == null;
    }

    /** Offset of a uniform axis, NaN for non-uniform axes. */
    public double offset() {
        return offset;
    }

    /** Scale of a uniform axis, NaN for non-uniform axes. */
    public double scale() {
        return scale;
    }

    public double valueAt(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " outside axis of size " + size);
        }
        return values == null ? offset + index * scale : values[index];
    }

    /** Coordinates of every sample (a fresh array). */
    public double[] values() {
        if (values != null) return values.clone();
        double[] out = new double[size];
        for (int i = 0; i < size; i++) out[i] = offset + i * scale;
        return out;
    }

    public double min() {
        return Math.min(valueAt(0), valueAt(size - 1));
    }

    public double max() {
        return Math.max(valueAt(0), valueAt(size - 1));
    }

    /**
     * Index of the sample closest to {@code value}. Values outside the axis
     * map to the nearest end.
     */
    public int valueToIndex(double value) {
        if (values == null) {
            long idx = Math.round((value - offset) / scale);
            return (int) Math.max(0, Math.min(size - 1, idx));
        }
        int best = 0;
        double bestDist = Math.abs(values[0] - value);
        for (int i = 1; i < size; i++) {
            double d = Math.abs(values[i] - value);
            if (d < bestDist) {
                best = i;
                bestDist = d;
            }
        }
        return best;
    }

    public DataAxis asNavigation(boolean nav) {
        return new DataAxis(name, units, nav, size, offset, scale, values);
    }

    /** Sub-axis of samples {@code [from, to)}; uniform axes stay uniform. */
    public DataAxis slice(int from, int to) {
        if (from < 0 || to > size || from >= to) {
            throw new IndexOutOfBoundsException(
                    "Slice [" + from + ", " + to + ") outside axis of size " + size);
        }
        if (values == null) {
            return new DataAxis(name, units, navigate, to - from, offset + from * scale, scale, null);
        }
        return new DataAxis(
                name, units, navigate, to - from, Double.NaN, Double.NaN,
                Arrays.copyOfRange(values, from, to));
    }

    @Override
    public String toString() {
        return "DataAxis{" + name + " [" + (units == null ? "<undefined>" : units) + "], size="
                + size + (navigate ? ", navigation" : ", signal")
                + (isUniform() ? ", uniform" : ", non-uniform") + "}";
    }
}

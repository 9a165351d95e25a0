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
import com.github.tinemuz.lumiaxis.exceptions.UnsupportedAxisUnitException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Luminescence signal: axes, row-major intensity data, optional variance,
 * metadata and a {@link SignalType} tag.
 *
 * <p>The data shape is the list of axis sizes in axis order. Axes flagged
 * {@link DataAxis#navigate() navigate} are navigation axes; the others are
 * signal axes. Instances are mutable only through the explicit setters, which
 * the in-place conversions use; {@link #copy()} gives a fully independent
 * signal.</p>
 */
public final class LumiSignal implements Normalizable, HasTimeAxis {
    private SignalType type;
    private final List<DataAxis> axes;
    private double[] data;
    private VarianceModel variance;
    private final Metadata metadata;

    /**
     * @throws IllegalArgumentException if no axis is given or the type is null
     * @throws ShapeMismatchException if the data or variance length does not match the axes
     */
    public LumiSignal(SignalType type, List<DataAxis> axes, double[] data) {
        this(type, axes, data, VarianceModel.none(), new Metadata());
    }

    public LumiSignal(
            SignalType type,
            List<DataAxis> axes,
            double[] data,
            VarianceModel variance,
            Metadata metadata) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (axes == null || axes.isEmpty()) {
            throw new IllegalArgumentException("A signal needs at least one axis");
        }
        this.type = type;
        this.axes = new ArrayList<>(axes);
        this.metadata = metadata == null ? new Metadata() : metadata;
        setData(data);
        setVariance(variance == null ? VarianceModel.none() : variance);
    }

    /** One-dimensional spectrum of the given type on a uniform axis. */
    public static LumiSignal spectrum(SignalType type, DataAxis axis, double[] data) {
        return new LumiSignal(type, List.of(axis), data);
    }

    public SignalType type() {
        return type;
    }

    public void setType(SignalType type) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        this.type = type;
    }

    public List<DataAxis> axes() {
        return Collections.unmodifiableList(axes);
    }

    public DataAxis axis(int index) {
        return axes.get(index);
    }

    @Override
    public int[] shape() {
        int[] shape = new int[axes.size()];
        for (int i = 0; i < shape.length; i++) shape[i] = axes.get(i).size();
        return shape;
    }

    /**
     * Replace one axis. The replacement must keep the size so the data stay aligned.
     *
     * @throws ShapeMismatchException if the size differs
     */
    public void replaceAxis(int index, DataAxis axis) {
        if (axis.size() != axes.get(index).size()) {
            throw new ShapeMismatchException(
                    "axis '" + axis.name() + "' has " + axis.size() + " samples, expected "
                            + axes.get(index).size());
        }
        axes.set(index, axis);
    }

    /** The live data array; callers that want to keep a snapshot must copy it. */
    @Override
    public double[] data() {
        return data;
    }

    @Override
    public void setData(double[] data) {
        if (data == null) throw new IllegalArgumentException("data must not be null");
        int expected = expectedLength();
        if (data.length != expected) {
            throw new ShapeMismatchException(
                    "data has " + data.length + " values but axes describe " + expected);
        }
        this.data = data;
    }

    @Override
    public VarianceModel variance() {
        return variance;
    }

    @Override
    public void setVariance(VarianceModel variance) {
        variance.checkLength(data.length);
        this.variance = variance;
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }

    /** Positions of the signal (non-navigation) axes, in axis order. */
    public List<Integer> signalAxisIndices() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < axes.size(); i++) if (!axes.get(i).navigate()) out.add(i);
        return out;
    }

    /** Positions of the navigation axes, in axis order. */
    public List<Integer> navigationAxisIndices() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < axes.size(); i++) if (axes.get(i).navigate()) out.add(i);
        return out;
    }

    public int signalDimension() {
        return signalAxisIndices().size();
    }

    public Optional<Integer> indexOfAxis(String name) {
        for (int i = 0; i < axes.size(); i++) {
            if (axes.get(i).name() != null && axes.get(i).name().equals(name)) return Optional.of(i);
        }
        return Optional.empty();
    }

    /**
     * The spectral axis is the last signal axis whose unit is not a time unit.
     * Axes with an unknown unit still qualify, so conversions can report the
     * unit as unsupported instead of failing to find an axis.
     */
    @Override
    public int spectralAxisIndex() {
        List<Integer> signal = signalAxisIndices();
        for (int j = signal.size() - 1; j >= 0; j--) {
            int i = signal.get(j);
            Optional<AxisUnit> unit = axes.get(i).unit();
            if (unit.isEmpty() || unit.get().kind() != AxisUnit.Kind.TIME) return i;
        }
        throw new UnsupportedAxisUnitException("Signal has no spectral axis: " + axes);
    }

    @Override
    public DataAxis spectralAxis() {
        return axes.get(spectralAxisIndex());
    }

    @Override
    public int timeAxisIndex() {
        for (int i : signalAxisIndices()) {
            Optional<AxisUnit> unit = axes.get(i).unit();
            if (unit.isPresent() && unit.get().kind() == AxisUnit.Kind.TIME) return i;
        }
        throw new UnsupportedAxisUnitException("Signal has no time axis: " + axes);
    }

    @Override
    public DataAxis timeAxis() {
        return axes.get(timeAxisIndex());
    }

    /** Layout of the data viewed along axis {@code index}. */
    public AxisStrides strides(int index) {
        return AxisStrides.of(shape(), index);
    }

    @Override
    public LumiSignal copy() {
        return new LumiSignal(type, axes, data.clone(), variance, metadata.copy());
    }

    private int expectedLength() {
        int n = 1;
        for (DataAxis a : axes) n *= a.size();
        return n;
    }

    @Override
    public String toString() {
        return "LumiSignal{" + type.label() + ", axes=" + axes + ", variance=" + variance + "}";
    }
}

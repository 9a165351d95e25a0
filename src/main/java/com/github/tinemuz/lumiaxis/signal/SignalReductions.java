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

import com.github.tinemuz.lumiaxis.cast.DimensionalityCastResolver;
import java.util.ArrayList;
import java.util.List;

/**
 * Axis-dropping operations on a {@link LumiSignal}.
 *
 * <p>Every operation returns a new signal. When the number of signal axes
 * changes, the result is first tagged {@link SignalType#BASE} and then handed
 * to {@link DimensionalityCastResolver}, so a wavelength × time signal reduced
 * along one axis comes back as a spectrum or a transient.</p>
 */
public final class SignalReductions {

    private SignalReductions() {}

    /** Sum over one axis. Variances add up. */
    public static LumiSignal sum(LumiSignal signal, String axisName) {
        int axis = requireAxis(signal, axisName);
        AxisStrides layout = signal.strides(axis);
        double[] data = reduce(signal.data(), layout, false);
        VarianceModel variance;
        switch (signal.variance().kind()) {
            case CONSTANT:
                variance = VarianceModel.constant(signal.variance().constant() * layout.size());
                break;
            case ARRAY:
                variance = VarianceModel.array(reduce(signal.variance().toArray(layout.length()), layout, false));
                break;
            default:
                variance = VarianceModel.none();
        }
        return finish(signal, dropAxis(signal, axis), data, variance);
    }

    /** Maximum over one axis. The result carries no variance. */
    public static LumiSignal max(LumiSignal signal, String axisName) {
        int axis = requireAxis(signal, axisName);
        double[] data = reduce(signal.data(), signal.strides(axis), true);
        return finish(signal, dropAxis(signal, axis), data, VarianceModel.none());
    }

    /**
     * The sub-signal at one position of an axis, with that axis removed.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside the axis
     */
    public static LumiSignal slice(LumiSignal signal, String axisName, int index) {
        int axis = requireAxis(signal, axisName);
        AxisStrides layout = signal.strides(axis);
        if (index < 0 || index >= layout.size()) {
            throw new IndexOutOfBoundsException(
                    "Index " + index + " outside axis '" + axisName + "' of size " + layout.size());
        }
        double[] data = layout.slice(signal.data(), index, index + 1);
        VarianceModel variance = signal.variance();
        if (variance.kind() == VarianceModel.Kind.ARRAY) {
            variance = VarianceModel.array(layout.slice(variance.toArray(layout.length()), index, index + 1));
        }
        return finish(signal, dropAxis(signal, axis), data, variance);
    }

    /**
     * Turn a signal axis into a navigation axis, for example to step through
     * the spectra of a streak image along time.
     *
     * @throws IllegalArgumentException if the axis already navigates
     */
    public static LumiSignal toNavigation(LumiSignal signal, String axisName) {
        int axis = requireAxis(signal, axisName);
        if (signal.axis(axis).navigate()) {
            throw new IllegalArgumentException("Axis '" + axisName + "' is already a navigation axis");
        }
        List<DataAxis> axes = new ArrayList<>(signal.axes());
        axes.set(axis, axes.get(axis).asNavigation(true));
        return finish(signal, axes, signal.data().clone(), signal.variance());
    }

    private static LumiSignal finish(
            LumiSignal source, List<DataAxis> axes, double[] data, VarianceModel variance) {
        LumiSignal out = new LumiSignal(source.type(), axes, data, variance, source.metadata().copy());
        if (out.signalDimension() != source.signalDimension()) {
            out.setType(SignalType.BASE);
            DimensionalityCastResolver.resolve(source.type(), out);
        }
        return out;
    }

    private static int requireAxis(LumiSignal signal, String axisName) {
        return signal.indexOfAxis(axisName).orElseThrow(
                () -> new IllegalArgumentException("No axis named '" + axisName + "' in " + signal.axes()));
    }

    private static List<DataAxis> dropAxis(LumiSignal signal, int axis) {
        List<DataAxis> axes = new ArrayList<>(signal.axes());
        axes.remove(axis);
        // A full reduction of a 1-D signal leaves a single value
        if (axes.isEmpty()) axes.add(DataAxis.navigation("Scalar", 1));
        return axes;
    }

    private static double[] reduce(double[] data, AxisStrides layout, boolean max) {
        double[] out = new double[layout.outer() * layout.inner()];
        for (int o = 0; o < layout.outer(); o++) {
            for (int k = 0; k < layout.inner(); k++) {
                double acc = max ? Double.NEGATIVE_INFINITY : 0.0;
                for (int i = 0; i < layout.size(); i++) {
                    double v = data[layout.index(o, i, k)];
                    acc = max ? Math.max(acc, v) : acc + v;
                }
                out[o * layout.inner() + k] = acc;
            }
        }
        return out;
    }
}

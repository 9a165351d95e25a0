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
package com.github.tinemuz.lumiaxis.join;

import com.github.tinemuz.lumiaxis.exceptions.SpectrumJoinException;
import com.github.tinemuz.lumiaxis.signal.AxisStrides;
import com.github.tinemuz.lumiaxis.signal.DataAxis;
import com.github.tinemuz.lumiaxis.signal.LumiSignal;
import com.github.tinemuz.lumiaxis.signal.VarianceModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins overlapping spectra into a single spectrum.
 *
 * <p>Spectra are joined in list order. For each adjacent pair the seam sits at
 * the centre of the overlap, between the largest coordinate of the earlier
 * spectrum and the smallest coordinate of the later one. The later spectrum is
 * scaled by the ratio of the mean intensities of both spectra in a window
 * around the seam, then the earlier spectrum is kept up to and including its
 * sample closest to the seam and the later spectrum supplies every sample
 * beyond it. No value is interpolated or blended.</p>
 *
 * <p>Inputs may carry navigation axes; the factor is then estimated per
 * navigation position. Type, metadata and axis names come from the first
 * spectrum.</p>
 */
public final class SpectrumJoiner {
    private static final Logger log = LoggerFactory.getLogger(SpectrumJoiner.class);

    private SpectrumJoiner() {}

    public static LumiSignal join(List<LumiSignal> spectra) {
        return join(spectra, JoinOptions.defaults());
    }

    /**
     * Join {@code spectra} in order.
     *
     * @throws SpectrumJoinException if fewer than two spectra are given, their
     *         units or navigation shapes differ, an axis is not increasing, an
     *         adjacent pair does not overlap or does not extend the range on both
     *         ends, or an estimated factor is negative
     */
    public static LumiSignal join(List<LumiSignal> spectra, JoinOptions options) {
        validate(spectra);
        LumiSignal merged = spectra.get(0).copy();
        for (int i = 1; i < spectra.size(); i++) {
            merged = joinPair(merged, spectra.get(i), i, options);
        }
        log.debug("Joined {} spectra into {} samples", spectra.size(),
                merged.spectralAxis().size());
        return merged;
    }

    private static void validate(List<LumiSignal> spectra) {
        if (spectra == null || spectra.size() < 2) {
            throw new SpectrumJoinException("at least two spectra are required, got "
                    + (spectra == null ? 0 : spectra.size()));
        }
        LumiSignal first = spectra.get(0);
        int axis = first.spectralAxisIndex();
        int[] navShape = withoutAxis(first.shape(), axis);
        String units = first.axis(axis).units();
        for (int i = 0; i < spectra.size(); i++) {
            LumiSignal s = spectra.get(i);
            if (s.spectralAxisIndex() != axis || !Arrays.equals(withoutAxis(s.shape(), axis), navShape)) {
                throw new SpectrumJoinException("spectrum " + i + " has shape " + Arrays.toString(s.shape())
                        + ", incompatible with " + Arrays.toString(first.shape()));
            }
            DataAxis a = s.axis(axis);
            if (!Objects.equals(a.units(), units)) {
                throw new SpectrumJoinException("spectrum " + i + " is in '" + a.units()
                        + "' but spectrum 0 is in '" + units + "'");
            }
            if (a.size() < 2 || DataAxis.monotonicDirection(a.values()) != 1) {
                throw new SpectrumJoinException("the axis of spectrum " + i + " is not increasing");
            }
            if (i > 0) {
                DataAxis previous = spectra.get(i - 1).axis(axis);
                if (previous.max() < a.min()) {
                    throw new SpectrumJoinException("spectra " + (i - 1) + " and " + i + " do not overlap (["
                            + previous.min() + ", " + previous.max() + "] and ["
                            + a.min() + ", " + a.max() + "])");
                }
                // Each spectrum extends the joined range at both ends
                if (!(a.min() > previous.min()) || !(a.max() > previous.max())) {
                    throw new SpectrumJoinException("spectra must be ordered by increasing range, but spectrum "
                            + i + " [" + a.min() + ", " + a.max() + "] does not extend beyond spectrum "
                            + (i - 1) + " [" + previous.min() + ", " + previous.max() + "]");
                }
            }
        }
    }

    private static LumiSignal joinPair(LumiSignal previous, LumiSignal next, int index, JoinOptions options) {
        int axis = previous.spectralAxisIndex();
        DataAxis a1 = previous.axis(axis);
        DataAxis a2 = next.axis(axis);
        AxisStrides l1 = previous.strides(axis);
        AxisStrides l2 = next.strides(axis);

        double center = (a1.max() + a2.min()) / 2.0;
        int ind1 = a1.valueToIndex(center);
        int ind2 = a2.valueToIndex(center);

        double[] factors = new double[l1.outer() * l1.inner()];
        Arrays.fill(factors, 1.0);
        if (options.scaleFactor() != null) {
            Arrays.fill(factors, options.scaleFactor());
        } else if (options.scale()) {
            int half = fitWindow(options.window(), ind1, a1.size(), ind2, a2.size(), center);
            for (int o = 0; o < l1.outer(); o++) {
                for (int k = 0; k < l1.inner(); k++) {
                    double f = windowMean(previous.data(), l1, o, k, ind1, half)
                            / windowMean(next.data(), l2, o, k, ind2, half);
                    if (Double.isNaN(f) || Double.isInfinite(f)) {
                        throw new SpectrumJoinException("spectrum " + index
                                + " has zero mean intensity around the seam at " + center);
                    }
                    if (f < 0) {
                        throw new SpectrumJoinException("one of the signals has a negative mean value "
                                + "in the overlapping range; join without scaling instead");
                    }
                    factors[o * l1.inner() + k] = f;
                }
            }
        }

        // Later samples start strictly after the seam sample of the earlier spectrum
        double seam = a1.valueAt(ind1);
        int start2 = 0;
        while (start2 < a2.size() && a2.valueAt(start2) <= seam) start2++;
        int n1 = ind1 + 1;
        int n2 = a2.size() - start2;
        AxisStrides out = new AxisStrides(l1.outer(), n1 + n2, l1.inner());

        double[] data = splice(previous.data(), l1, next.data(), l2, out, n1, start2, factors, false);
        VarianceModel variance = VarianceModel.none();
        if (previous.variance().isPresent() && next.variance().isPresent()) {
            variance = VarianceModel.array(splice(
                    previous.variance().toArray(l1.length()), l1,
                    next.variance().toArray(l2.length()), l2,
                    out, n1, start2, factors, true));
        } else if (previous.variance().isPresent() || next.variance().isPresent()) {
            log.warn("Dropping variance: spectrum {} and the spectra before it do not all carry one", index);
        }

        List<DataAxis> axes = new ArrayList<>(previous.axes());
        axes.set(axis, mergedAxis(a1, n1, a2, start2));
        log.debug("Seam {} at {} (index {} / {}), window factor {}", index, center, ind1, ind2, factors[0]);
        return new LumiSignal(previous.type(), axes, data, variance, previous.metadata().copy());
    }

    private static int fitWindow(int window, int ind1, int size1, int ind2, int size2, double center) {
        int half = Math.min(window, Math.min(Math.min(ind1, size1 - ind1), Math.min(ind2, size2 - ind2)));
        if (half < window) {
            log.warn("Join window of {} samples does not fit around the seam at {}; using {}",
                    window, center, half);
        }
        return half;
    }

    /** Mean over samples {@code [ind - half, ind + half)}, or the single sample at {@code ind}. */
    private static double windowMean(double[] data, AxisStrides layout, int o, int k, int ind, int half) {
        int from = ind - half;
        int to = half == 0 ? ind + 1 : ind + half;
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += data[layout.index(o, i, k)];
        return sum / (to - from);
    }

    private static double[] splice(
            double[] first, AxisStrides l1, double[] second, AxisStrides l2, AxisStrides out,
            int n1, int start2, double[] factors, boolean squared) {
        double[] result = new double[out.length()];
        for (int o = 0; o < out.outer(); o++) {
            for (int k = 0; k < out.inner(); k++) {
                double f = factors[o * out.inner() + k];
                if (squared) f *= f;
                for (int i = 0; i < n1; i++) {
                    result[out.index(o, i, k)] = first[l1.index(o, i, k)];
                }
                for (int j = 0; n1 + j < out.size(); j++) {
                    result[out.index(o, n1 + j, k)] = second[l2.index(o, start2 + j, k)] * f;
                }
            }
        }
        return result;
    }

    private static DataAxis mergedAxis(DataAxis a1, int n1, DataAxis a2, int start2) {
        int total = n1 + a2.size() - start2;
        if (a1.isUniform() && a2.isUniform() && onSameGrid(a1, n1, a2, start2)) {
            return DataAxis.uniform(a1.name(), a1.units(), total, a1.offset(), a1.scale())
                    .asNavigation(a1.navigate());
        }
        double[] values = new double[total];
        double[] v1 = a1.values();
        double[] v2 = a2.values();
        System.arraycopy(v1, 0, values, 0, n1);
        System.arraycopy(v2, start2, values, n1, total - n1);
        return DataAxis.nonUniform(a1.name(), a1.units(), values).asNavigation(a1.navigate());
    }

    private static boolean onSameGrid(DataAxis a1, int n1, DataAxis a2, int start2) {
        double tolerance = 1e-9 * Math.abs(a1.scale());
        if (Math.abs(a1.scale() - a2.scale()) > tolerance) return false;
        if (start2 >= a2.size()) return true;
        double expected = a1.offset() + n1 * a1.scale();
        return Math.abs(a2.valueAt(start2) - expected) <= 1e-6 * Math.abs(a1.scale());
    }

    private static int[] withoutAxis(int[] shape, int axis) {
        int[] out = new int[shape.length - 1];
        for (int d = 0, j = 0; d < shape.length; d++) if (d != axis) out[j++] = shape[d];
        return out;
    }
}

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
package com.github.tinemuz.lumiaxis.ops;

import com.github.tinemuz.lumiaxis.LumiAxisDefaults;
import com.github.tinemuz.lumiaxis.exceptions.ShapeMismatchException;
import com.github.tinemuz.lumiaxis.signal.AxisStrides;
import com.github.tinemuz.lumiaxis.signal.DataAxis;
import com.github.tinemuz.lumiaxis.signal.HasSpectralAxis;
import com.github.tinemuz.lumiaxis.signal.LumiSignal;
import com.github.tinemuz.lumiaxis.signal.Metadata;
import com.github.tinemuz.lumiaxis.signal.Normalizable;
import com.github.tinemuz.lumiaxis.signal.Scalable;
import com.github.tinemuz.lumiaxis.signal.VarianceModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations shared by every luminescence signal: exposure scaling,
 * normalisation, removal of negative values or a background, cropping of
 * navigation edges and centroid estimation.
 *
 * <p>Operations taking an {@code inplace} flag modify and return the given
 * signal when it is set, and work on a copy otherwise. Each operation records
 * what it did under {@code Signal.*} in the metadata.</p>
 */
public final class LumiOperations {
    private static final Logger log = LoggerFactory.getLogger(LumiOperations.class);

    public static final String QUANTITY = "Signal.quantity";
    public static final String SCALED = "Signal.scaled";
    public static final String NORMALIZED = "Signal.normalized";
    public static final String NEGATIVE_REMOVED = "Signal.negative_removed";
    public static final String CROPPED_EDGES = "Signal.cropped_edges";
    public static final String BACKGROUND_SUBTRACTED = "Signal.background_subtracted";
    public static final String BACKGROUND = "Signal.background";

    private static final Pattern COUNTS = Pattern.compile("\\(([cC])ounts\\)");

    private LumiOperations() {}

    // -----------------------------------------------------------------------
    // Exposure scaling
    // -----------------------------------------------------------------------

    /**
     * Divide the intensity by the acquisition time, turning counts into a
     * count rate. The variance is divided by the square of the exposure.
     *
     * @param exposure exposure time; null to read it from the configured
     *                 metadata paths
     * @throws IllegalStateException    if the data were normalized or already scaled
     * @throws IllegalArgumentException if no exposure is given or found, or it is not positive
     */
    public static <T extends Scalable> T scaleByExposure(T signal, Double exposure, boolean inplace) {
        Metadata metadata = signal.metadata();
        if (metadata.isTrue(NORMALIZED)) {
            throw new IllegalStateException("Data was normalized and cannot be scaled.");
        }
        if (metadata.isTrue(SCALED)) {
            throw new IllegalStateException("Data was already scaled.");
        }
        double time = exposure != null ? exposure : exposureFromMetadata(metadata);
        if (!(time > 0.0) || Double.isInfinite(time)) {
            throw new IllegalArgumentException("Exposure must be positive and finite: " + time);
        }

        T target = target(signal, inplace);
        double[] data = target.data().clone();
        for (int i = 0; i < data.length; i++) data[i] /= time;
        target.setData(data);
        VarianceModel variance = target.variance();
        if (variance.kind() == VarianceModel.Kind.CONSTANT) {
            target.setVariance(VarianceModel.constant(variance.constant() / (time * time)));
        } else if (variance.kind() == VarianceModel.Kind.ARRAY) {
            double[] v = variance.toArray(data.length);
            for (int i = 0; i < v.length; i++) v[i] /= time * time;
            target.setVariance(VarianceModel.array(v));
        }

        Metadata out = target.metadata();
        out.getString(QUANTITY).ifPresent(q -> {
            Matcher m = COUNTS.matcher(q);
            if (m.find()) out.set(QUANTITY, m.replaceFirst("($1ounts/s)"));
        });
        out.set(SCALED, Boolean.TRUE);
        return target;
    }

    private static double exposureFromMetadata(Metadata metadata) {
        for (String path : LumiAxisDefaults.exposurePaths()) {
            OptionalDouble value = metadata.getDouble(path);
            if (value.isPresent()) return value.getAsDouble();
        }
        throw new IllegalArgumentException(
                "Exposure not given and can not be extracted automatically from metadata.");
    }

    // -----------------------------------------------------------------------
    // Normalization
    // -----------------------------------------------------------------------

    public static <T extends Normalizable> T normalize(T signal, boolean inplace) {
        return normalize(signal, null, false, inplace);
    }

    /**
     * Divide the intensity so that the reference value becomes 1.
     *
     * <p>The reference is the global maximum, or with {@code elementWise} the
     * maximum of each spectrum. With a {@code position} it is the value at that
     * index of the spectral axis: the largest such value over the whole signal,
     * or each spectrum's own value with {@code elementWise}.</p>
     *
     * @param position index along the spectral axis, or null to use the maximum
     * @throws IndexOutOfBoundsException if {@code position} is outside the spectral axis
     */
    public static <T extends Normalizable> T normalize(
            T signal, Integer position, boolean elementWise, boolean inplace) {
        if (signal.metadata().isTrue(NORMALIZED)) {
            log.warn("Data was already normalized previously. Depending on the previous parameters "
                    + "this function might not yield the expected result.");
        }
        AxisStrides layout = AxisStrides.of(signal.shape(), signal.spectralAxisIndex());
        if (position != null && (position < 0 || position >= layout.size())) {
            throw new IndexOutOfBoundsException(
                    "Position " + position + " outside spectral axis of size " + layout.size());
        }

        double[] source = signal.data();
        int lines = layout.outer() * layout.inner();
        double[] divisors = new double[lines];
        double global = Double.NEGATIVE_INFINITY;
        for (int o = 0; o < layout.outer(); o++) {
            for (int k = 0; k < layout.inner(); k++) {
                double ref;
                if (position != null) {
                    ref = source[layout.index(o, position, k)];
                } else {
                    ref = Double.NEGATIVE_INFINITY;
                    for (int i = 0; i < layout.size(); i++) ref = Math.max(ref, source[layout.index(o, i, k)]);
                }
                divisors[o * layout.inner() + k] = ref;
                global = Math.max(global, ref);
            }
        }
        if (!elementWise) Arrays.fill(divisors, global);

        T target = target(signal, inplace);
        double[] data = source.clone();
        VarianceModel variance = target.variance();
        double[] scaledVariance = variance.isPresent() ? variance.toArray(data.length) : null;
        for (int o = 0; o < layout.outer(); o++) {
            for (int k = 0; k < layout.inner(); k++) {
                double d = divisors[o * layout.inner() + k];
                for (int i = 0; i < layout.size(); i++) {
                    int idx = layout.index(o, i, k);
                    data[idx] /= d;
                    if (scaledVariance != null) scaledVariance[idx] /= d * d;
                }
            }
        }
        target.setData(data);
        if (scaledVariance != null) target.setVariance(VarianceModel.array(scaledVariance));
        target.metadata().set(QUANTITY, "Normalized intensity");
        target.metadata().set(NORMALIZED, Boolean.TRUE);
        return target;
    }

    // -----------------------------------------------------------------------
    // Negative values
    // -----------------------------------------------------------------------

    public static <T extends Scalable> T removeNegative(T signal, boolean inplace) {
        return removeNegative(signal, 1.0, inplace);
    }

    /** Replace every negative intensity with {@code baseValue}. */
    public static <T extends Scalable> T removeNegative(T signal, double baseValue, boolean inplace) {
        T target = target(signal, inplace);
        double[] data = target.data().clone();
        int replaced = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] < 0) {
                data[i] = baseValue;
                replaced++;
            }
        }
        target.setData(data);
        target.metadata().set(NEGATIVE_REMOVED, Boolean.TRUE);
        log.debug("Replaced {} negative values with {}", replaced, baseValue);
        return target;
    }

    // -----------------------------------------------------------------------
    // Background
    // -----------------------------------------------------------------------

    /**
     * Subtract a background spectrum from every spectrum of the signal. The
     * background holds one value per sample of the spectral axis and is kept
     * under {@code Signal.background}.
     *
     * @throws ShapeMismatchException if the background length differs from the spectral axis size
     */
    public static <T extends Normalizable> T subtractBackground(T signal, double[] background, boolean inplace) {
        AxisStrides layout = AxisStrides.of(signal.shape(), signal.spectralAxisIndex());
        if (background == null || background.length != layout.size()) {
            throw new ShapeMismatchException("background has "
                    + (background == null ? 0 : background.length)
                    + " values but the spectral axis has " + layout.size());
        }
        T target = target(signal, inplace);
        double[] data = target.data().clone();
        for (int o = 0; o < layout.outer(); o++) {
            for (int i = 0; i < layout.size(); i++) {
                int base = layout.index(o, i, 0);
                for (int k = 0; k < layout.inner(); k++) data[base + k] -= background[i];
            }
        }
        target.setData(data);
        target.metadata().set(BACKGROUND_SUBTRACTED, Boolean.TRUE);
        target.metadata().set(BACKGROUND, background.clone());
        return target;
    }

    // -----------------------------------------------------------------------
    // Edge cropping
    // -----------------------------------------------------------------------

    /**
     * Crop pixels from the edges of the scanned region and return the cropped
     * signal.
     *
     * <p>The x direction is the last navigation axis. For maps, one value crops
     * every side, two values crop {@code (x, y)} and four values crop
     * {@code (left, bottom, right, top)}. Line scans accept one value or
     * {@code (left, right)}.</p>
     *
     * @throws IllegalArgumentException  if the signal has no navigation axis or
     *         more than two, or the range has the wrong length or negative entries
     * @throws IndexOutOfBoundsException if nothing would be left after cropping
     */
    public static LumiSignal cropEdges(LumiSignal signal, int... range) {
        List<Integer> nav = signal.navigationAxisIndices();
        if (nav.isEmpty() || nav.size() > 2) {
            throw new IllegalArgumentException(
                    "Edge cropping needs one or two navigation axes, got " + nav.size());
        }
        boolean lineScan = nav.size() == 1;
        int[] crop = cropValues(range, lineScan);

        int[] shape = signal.shape();
        int[] from = new int[shape.length];
        int[] to = shape.clone();
        int x = nav.get(nav.size() - 1);
        from[x] = crop[0];
        to[x] = shape[x] - (lineScan ? crop[1] : crop[2]);
        if (!lineScan) {
            int y = nav.get(0);
            from[y] = crop[3];
            to[y] = shape[y] - crop[1];
        }
        for (int d : nav) {
            if (to[d] <= from[d]) {
                throw new IndexOutOfBoundsException(
                        "The pixels to be cropped surpassed the width/height of the signal navigation axes.");
            }
        }

        List<DataAxis> axes = new ArrayList<>();
        for (int d = 0; d < shape.length; d++) axes.add(signal.axis(d).slice(from[d], to[d]));
        double[] data = subBlock(signal.data(), shape, from, to);
        VarianceModel variance = signal.variance();
        if (variance.kind() == VarianceModel.Kind.ARRAY) {
            variance = VarianceModel.array(subBlock(variance.toArray(signal.data().length), shape, from, to));
        }
        Metadata metadata = signal.metadata().copy();
        recordCrop(metadata, crop);
        return new LumiSignal(signal.type(), axes, data, variance, metadata);
    }

    /** Expand the user range to {left, bottom, right, top}, or {left, right} for line scans. */
    private static int[] cropValues(int[] range, boolean lineScan) {
        if (range == null || range.length == 0) range = new int[] {0};
        for (int v : range) {
            if (v < 0) throw new IllegalArgumentException("Crop values must not be negative: " + Arrays.toString(range));
        }
        if (lineScan) {
            if (range.length == 1) return new int[] {range[0], range[0]};
            if (range.length == 2) return range.clone();
        } else {
            if (range.length == 1) return new int[] {range[0], range[0], range[0], range[0]};
            if (range.length == 2) return new int[] {range[0], range[1], range[0], range[1]};
            if (range.length == 4) return range.clone();
        }
        throw new IllegalArgumentException("The crop range must have 1, 2 (x, y) or 4 (left, bottom, right, top) "
                + "values; for line scans 1 or 2 (left, right). Got " + range.length);
    }

    private static void recordCrop(Metadata metadata, int[] crop) {
        Object previous = metadata.get(CROPPED_EDGES).orElse(null);
        if (previous instanceof int[]) {
            metadata.set(CROPPED_EDGES, new int[][] {(int[]) previous, crop});
        } else if (previous instanceof int[][]) {
            int[][] rows = (int[][]) previous;
            int[][] stacked = Arrays.copyOf(rows, rows.length + 1);
            stacked[rows.length] = crop;
            metadata.set(CROPPED_EDGES, stacked);
        } else {
            metadata.set(CROPPED_EDGES, crop);
        }
    }

    private static double[] subBlock(double[] data, int[] shape, int[] from, int[] to) {
        int rank = shape.length;
        int[] strides = new int[rank];
        int length = 1;
        for (int d = rank - 1, s = 1; d >= 0; d--) {
            strides[d] = s;
            s *= shape[d];
            length *= to[d] - from[d];
        }
        double[] out = new double[length];
        int[] pos = from.clone();
        for (int n = 0; n < length; n++) {
            int src = 0;
            for (int d = 0; d < rank; d++) src += pos[d] * strides[d];
            out[n] = data[src];
            for (int d = rank - 1; d >= 0; d--) {
                if (++pos[d] < to[d]) break;
                pos[d] = from[d];
            }
        }
        return out;
    }

    // -----------------------------------------------------------------------
    // Centroid
    // -----------------------------------------------------------------------

    public static double centroid(double[] intensities, DataAxis axis) {
        return centroid(intensities, axis.values());
    }

    /**
     * Intensity-weighted centre of mass of a spectrum. The centre is found in
     * index space and then linearly interpolated onto {@code axis}.
     *
     * @throws IllegalArgumentException if the lengths differ, the total intensity is zero or
     *         negative values move the centre of mass off the axis
     */
    public static double centroid(double[] intensities, double[] axis) {
        if (intensities.length != axis.length) {
            throw new IllegalArgumentException("The length of the spectrum array " + intensities.length
                    + " must match the length of the axis array " + axis.length + ".");
        }
        double total = 0.0;
        double moment = 0.0;
        for (int i = 0; i < intensities.length; i++) {
            total += intensities[i];
            moment += i * intensities[i];
        }
        if (total == 0.0) throw new IllegalArgumentException("Spectrum has zero total intensity");
        double index = moment / total;
        if (!(index >= 0.0 && index <= axis.length - 1)) {
            throw new IllegalArgumentException("Centre of mass at index " + index
                    + " falls outside the axis; the spectrum has too much negative intensity");
        }
        int lower = (int) Math.floor(index);
        double rem = index - lower;
        if (rem == 0.0 || lower >= axis.length - 1) return axis[Math.min(lower, axis.length - 1)];
        return axis[lower] + rem * (axis[lower + 1] - axis[lower]);
    }

    /**
     * Centroid of every spectrum of a signal, in the row-major order of the
     * remaining axes.
     */
    public static double[] centroid(HasSpectralAxis signal) {
        AxisStrides layout = AxisStrides.of(signal.shape(), signal.spectralAxisIndex());
        double[] axis = signal.spectralAxis().values();
        double[] data = signal.data();
        double[] out = new double[layout.outer() * layout.inner()];
        double[] line = new double[layout.size()];
        for (int o = 0; o < layout.outer(); o++) {
            for (int k = 0; k < layout.inner(); k++) {
                for (int i = 0; i < line.length; i++) line[i] = data[layout.index(o, i, k)];
                out[o * layout.inner() + k] = centroid(line, axis);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Scalable> T target(T signal, boolean inplace) {
        return inplace ? signal : (T) signal.copy();
    }
}

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
 * Row-major layout of a flat data array viewed along one axis.
 *
 * <p>The flat index of element {@code (o, i, k)} is
 * {@code (o * size + i) * inner + k}, where {@code o} runs over all axes
 * before the chosen one, {@code i} over the chosen axis and {@code k} over all
 * axes after it.</p>
 */
public record AxisStrides(int outer, int size, int inner) {

    public static AxisStrides of(int[] shape, int axis) {
        if (axis < 0 || axis >= shape.length) {
            throw new IndexOutOfBoundsException("Axis " + axis + " outside shape of rank " + shape.length);
        }
        int outer = 1;
        for (int d = 0; d < axis; d++) outer *= shape[d];
        int inner = 1;
        for (int d = axis + 1; d < shape.length; d++) inner *= shape[d];
        return new AxisStrides(outer, shape[axis], inner);
    }

    public int index(int o, int i, int k) {
        return (o * size + i) * inner + k;
    }

    public int length() {
        return outer * size * inner;
    }

    /** Reverse the order of samples along the axis, in place. */
    public void reverse(double[] data) {
        for (int o = 0; o < outer; o++) {
            for (int i = 0, j = size - 1; i < j; i++, j--) {
                for (int k = 0; k < inner; k++) {
                    int a = index(o, i, k);
                    int b = index(o, j, k);
                    double t = data[a];
                    data[a] = data[b];
                    data[b] = t;
                }
            }
        }
    }

    /** Multiply every sample at axis position {@code i} by {@code factors[i]}, in place. */
    public void multiplyAlong(double[] data, double[] factors) {
        for (int o = 0; o < outer; o++) {
            for (int i = 0; i < size; i++) {
                double f = factors[i];
                int base = index(o, i, 0);
                for (int k = 0; k < inner; k++) data[base + k] *= f;
            }
        }
    }

    /** Copy samples {@code [from, to)} along the axis into a new array. */
    public double[] slice(double[] data, int from, int to) {
        int n = to - from;
        double[] out = new double[outer * n * inner];
        for (int o = 0; o < outer; o++) {
            for (int i = from; i < to; i++) {
                System.arraycopy(data, index(o, i, 0), out, (o * n + (i - from)) * inner, inner);
            }
        }
        return out;
    }
}

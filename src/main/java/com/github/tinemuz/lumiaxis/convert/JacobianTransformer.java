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
package com.github.tinemuz.lumiaxis.convert;

import com.github.tinemuz.lumiaxis.exceptions.ShapeMismatchException;
import com.github.tinemuz.lumiaxis.signal.AxisStrides;
import com.github.tinemuz.lumiaxis.signal.VarianceModel;

/**
 * Rescales intensity, and variance, after a change of the spectral variable
 * so that the integral over the axis is unchanged.
 *
 * <p>For a conversion λ → x the intensity per unit x is the intensity per
 * unit λ times |dλ/dx| (see e.g. Mooney and Kambhampati, J. Phys. Chem. Lett.
 * 4, 3316 (2013)). The factor is taken from the analytic derivative supplied
 * by {@link AxisConverter}, not from finite differences of the sampled axis.
 * Variance scales with the square of the same factor; a constant variance is
 * first expanded to one value per sample since the factor varies along the
 * axis.</p>
 *
 * <p>Sample order is not touched here; reversing a descending axis is the
 * caller's job.</p>
 */
public final class JacobianTransformer {

    private JacobianTransformer() {}

    /**
     * Rescaled intensity and variance.
     *
     * @param data     new intensity array
     * @param variance new variance, {@link VarianceModel#none()} if there was none
     */
    public record Result(double[] data, VarianceModel variance) {}

    /**
     * Jacobian factors |dλ/dx| in units of the old length unit per new unit.
     *
     * @param dNewDnm     signed derivative dx/dλ per sample, λ in nanometres
     * @param nmPerOldUnit length of one unit of the old axis in nanometres (1 for nm, 1000 for µm)
     */
    public static double[] factors(double[] dNewDnm, double nmPerOldUnit) {
        double[] f = new double[dNewDnm.length];
        for (int i = 0; i < f.length; i++) {
            f[i] = 1.0 / (Math.abs(dNewDnm[i]) * nmPerOldUnit);
        }
        return f;
    }

    /**
     * Apply the Jacobian along one axis.
     *
     * @param dNewDnm      signed derivative dx/dλ per axis sample, in the stored sample order
     * @param nmPerOldUnit length of one unit of the old axis in nanometres
     * @param data         intensity array laid out as {@code layout}; not modified
     * @param layout       view of the data along the converted axis
     * @param variance     variance of the data, may be {@link VarianceModel#none()}
     * @return new intensity and variance arrays
     * @throws ShapeMismatchException if the derivative, data or variance do not match the layout
     */
    public static Result transform(
            double[] dNewDnm,
            double nmPerOldUnit,
            double[] data,
            AxisStrides layout,
            VarianceModel variance) {
        if (dNewDnm.length != layout.size()) {
            throw new ShapeMismatchException(
                    dNewDnm.length + " derivative values for an axis of " + layout.size());
        }
        if (data.length != layout.length()) {
            throw new ShapeMismatchException(
                    "data has " + data.length + " values, layout describes " + layout.length());
        }
        variance.checkLength(data.length);

        double[] factors = factors(dNewDnm, nmPerOldUnit);
        double[] out = data.clone();
        layout.multiplyAlong(out, factors);

        if (!variance.isPresent()) {
            return new Result(out, VarianceModel.none());
        }
        double[] squared = new double[factors.length];
        for (int i = 0; i < squared.length; i++) squared[i] = factors[i] * factors[i];
        double[] scaledVariance = variance.toArray(data.length);
        layout.multiplyAlong(scaledVariance, squared);
        return new Result(out, VarianceModel.array(scaledVariance));
    }
}

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

/**
 * Refractive index of standard air as a function of vacuum wavelength.
 *
 * <p>Uses the two-term dispersion formula of E.R. Peck and K. Reeder,
 * "Dispersion of air", J. Opt. Soc. Am. 62, 958-962 (1972), with the
 * published coefficients and σ = 1/λ in inverse micrometres:</p>
 *
 * <pre>
 * n - 1 = 806051e-10 + 2480990e-8 / (132274e-3 - σ²) + 174557e-9 / (3932957e-5 - σ²)
 * </pre>
 *
 * <p>The formula is used over 185-1700 nm. Inputs outside that range are not
 * extrapolated: the nearest boundary is evaluated instead and a single
 * {@link ClampWarning} per call is sent to the {@link WarningSink}.</p>
 */
public final class AirRefractiveIndex {
    public static final double MIN_WAVELENGTH_NM = 185.0;
    public static final double MAX_WAVELENGTH_NM = 1700.0;

    private static final double K0 = 806051e-10;
    private static final double K1 = 2480990e-8;
    private static final double K2 = 132274e-3;
    private static final double K3 = 174557e-9;
    private static final double K4 = 3932957e-5;

    private AirRefractiveIndex() {}

    /** Refractive index at one wavelength (nm); out-of-range warnings are logged. */
    public static double ofAir(double wavelengthNm) {
        return ofAir(new double[] {wavelengthNm}, WarningSink.LOG)[0];
    }

    /** Refractive index at every wavelength (nm); out-of-range warnings are logged. */
    public static double[] ofAir(double[] wavelengthNm) {
        return ofAir(wavelengthNm, WarningSink.LOG);
    }

    /**
     * Refractive index at every wavelength (nm).
     *
     * @param wavelengthNm vacuum wavelengths in nanometres
     * @param sink         receives one warning if any input had to be clamped
     * @return a new array of refractive indices, same length as the input
     */
    public static double[] ofAir(double[] wavelengthNm, WarningSink sink) {
        double[] n = new double[wavelengthNm.length];
        int clamped = 0;
        double lowest = Double.POSITIVE_INFINITY;
        double highest = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n.length; i++) {
            double wl = wavelengthNm[i];
            lowest = Math.min(lowest, wl);
            highest = Math.max(highest, wl);
            if (wl < MIN_WAVELENGTH_NM) {
                wl = MIN_WAVELENGTH_NM;
                clamped++;
            } else if (wl > MAX_WAVELENGTH_NM) {
                wl = MAX_WAVELENGTH_NM;
                clamped++;
            }
            n[i] = peckReeder(wl);
        }
        if (clamped > 0 && sink != null) {
            sink.warn(new ClampWarning(clamped, lowest, highest));
        }
        return n;
    }

    private static double peckReeder(double wavelengthNm) {
        double um = wavelengthNm / 1000.0;
        double sigma2 = 1.0 / (um * um);
        return 1.0 + K0 + K1 / (K2 - sigma2) + K3 / (K4 - sigma2);
    }
}

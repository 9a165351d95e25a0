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
 * Conversions of spectral coordinates between wavelength (nm), photon energy
 * (eV), absolute wavenumber (1/cm) and Raman shift (1/cm relative to a laser
 * line).
 *
 * <p>All functions are pure. Array overloads return a new array of the same
 * length and never reorder samples: a conversion that reverses the direction
 * of increase (nm to eV, nm to 1/cm) is reported through the sign of the
 * matching derivative ({@link #dEvDnm}, {@link #dInvcmDnm},
 * {@link #dRamanShiftDnm}), not by sorting.</p>
 *
 * <p>The energy conversion accounts for the refractive index of air. It is
 * evaluated once at the input wavelength and not refined at the output
 * energy; {@link #evToNm} evaluates it at the approximate wavelength
 * {@code 1239.5 / E}.</p>
 */
public final class AxisConverter {
    /** Planck constant (J s), exact SI value. */
    public static final double PLANCK = 6.62607015e-34;
    /** Speed of light in vacuum (m/s). */
    public static final double SPEED_OF_LIGHT = 299792458.0;
    /** Elementary charge (C). */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;
    /** h c / e expressed in nm eV (about 1239.84). */
    public static final double HC_OVER_E_NM_EV = 1e9 * PLANCK * SPEED_OF_LIGHT / ELEMENTARY_CHARGE;

    // Rounded h c / e used only to pick the wavelength for n(λ) in evToNm
    private static final double APPROX_HC_OVER_E = 1239.5;
    private static final double NM_PER_CM = 1e7;

    private AxisConverter() {}

    // Energy

    public static double nmToEv(double nm) {
        return nmToEv(new double[] {nm})[0];
    }

    public static double[] nmToEv(double[] nm) {
        return nmToEv(nm, WarningSink.LOG);
    }

    /** E = 1e9 h c / (e n(λ) λ). */
    public static double[] nmToEv(double[] nm, WarningSink sink) {
        double[] n = AirRefractiveIndex.ofAir(nm, sink);
        double[] ev = new double[nm.length];
        for (int i = 0; i < nm.length; i++) ev[i] = HC_OVER_E_NM_EV / (n[i] * nm[i]);
        return ev;
    }

    public static double evToNm(double ev) {
        return evToNm(new double[] {ev})[0];
    }

    public static double[] evToNm(double[] ev) {
        return evToNm(ev, WarningSink.LOG);
    }

    /** λ = 1e9 h c / (e n(1239.5 / E) E). */
    public static double[] evToNm(double[] ev, WarningSink sink) {
        double[] approx = new double[ev.length];
        for (int i = 0; i < ev.length; i++) approx[i] = APPROX_HC_OVER_E / ev[i];
        double[] n = AirRefractiveIndex.ofAir(approx, sink);
        double[] nm = new double[ev.length];
        for (int i = 0; i < ev.length; i++) nm[i] = HC_OVER_E_NM_EV / (n[i] * ev[i]);
        return nm;
    }

    /**
     * Signed derivative dE/dλ in eV per nm, with n held at the input
     * wavelength: dE/dλ = -E / λ. Always negative.
     */
    public static double[] dEvDnm(double[] nm, double[] ev) {
        checkSameLength(nm, ev);
        double[] d = new double[nm.length];
        for (int i = 0; i < nm.length; i++) d[i] = -ev[i] / nm[i];
        return d;
    }

    // Absolute wavenumber

    public static double nmToInvcm(double nm) {
        return NM_PER_CM / nm;
    }

    public static double[] nmToInvcm(double[] nm) {
        double[] out = new double[nm.length];
        for (int i = 0; i < nm.length; i++) out[i] = nmToInvcm(nm[i]);
        return out;
    }

    public static double invcmToNm(double invcm) {
        return NM_PER_CM / invcm;
    }

    public static double[] invcmToNm(double[] invcm) {
        double[] out = new double[invcm.length];
        for (int i = 0; i < invcm.length; i++) out[i] = invcmToNm(invcm[i]);
        return out;
    }

    /** Signed derivative dν/dλ = -1e7 / λ² in cm⁻¹ per nm. Always negative. */
    public static double[] dInvcmDnm(double[] nm) {
        double[] d = new double[nm.length];
        for (int i = 0; i < nm.length; i++) d[i] = -NM_PER_CM / (nm[i] * nm[i]);
        return d;
    }

    // Raman shift

    /**
     * Raman shift Δν = 1e7/λ_laser - 1e7/λ in cm⁻¹. Zero at the laser line,
     * positive for Stokes lines (λ above the laser), negative for anti-Stokes.
     */
    public static double nmToRamanShift(double nm, double laserNm) {
        checkLaser(laserNm);
        return nmToInvcm(laserNm) - nmToInvcm(nm);
    }

    public static double[] nmToRamanShift(double[] nm, double laserNm) {
        checkLaser(laserNm);
        double laserInvcm = nmToInvcm(laserNm);
        double[] out = new double[nm.length];
        for (int i = 0; i < nm.length; i++) out[i] = laserInvcm - nmToInvcm(nm[i]);
        return out;
    }

    /** Inverse of {@link #nmToRamanShift(double, double)}: λ = 1e7 / (1e7/λ_laser - Δν). */
    public static double ramanShiftToNm(double shift, double laserNm) {
        checkLaser(laserNm);
        return invcmToNm(nmToInvcm(laserNm) - shift);
    }

    public static double[] ramanShiftToNm(double[] shift, double laserNm) {
        checkLaser(laserNm);
        double laserInvcm = nmToInvcm(laserNm);
        double[] out = new double[shift.length];
        for (int i = 0; i < shift.length; i++) out[i] = invcmToNm(laserInvcm - shift[i]);
        return out;
    }

    /** Signed derivative dΔν/dλ = +1e7 / λ² in cm⁻¹ per nm. Always positive. */
    public static double[] dRamanShiftDnm(double[] nm) {
        double[] d = dInvcmDnm(nm);
        for (int i = 0; i < d.length; i++) d[i] = -d[i];
        return d;
    }

    private static void checkLaser(double laserNm) {
        if (!(laserNm > 0.0) || Double.isInfinite(laserNm)) {
            throw new IllegalArgumentException("Laser wavelength must be positive and finite: " + laserNm);
        }
    }

    private static void checkSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Coordinate vectors differ in length: " + a.length + " vs " + b.length);
        }
    }
}

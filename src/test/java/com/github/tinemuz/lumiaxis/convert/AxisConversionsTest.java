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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.lumiaxis.exceptions.MissingLaserWavelengthException;
import com.github.tinemuz.lumiaxis.exceptions.UnsupportedAxisUnitException;
import com.github.tinemuz.lumiaxis.signal.DataAxis;
import com.github.tinemuz.lumiaxis.signal.LumiSignal;
import com.github.tinemuz.lumiaxis.signal.SignalType;
import com.github.tinemuz.lumiaxis.signal.VarianceModel;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class AxisConversionsTest {

    private static final String LASER_PATH = "Acquisition_instrument.Laser.wavelength";
    private static final String NOISE = "Signal.Noise_properties.Variance_linear_model";

    /** 200-390 nm in 10 nm steps. */
    private static DataAxis nmAxis() {
        return DataAxis.uniform("Wavelength", "nm", 20, 200.0, 10.0);
    }

    /** The same wavelengths in micrometres. */
    private static DataAxis umAxis() {
        return DataAxis.uniform("Wavelength", "µm", 20, 0.2, 0.01);
    }

    private static LumiSignal spectrum(DataAxis axis, double value) {
        double[] data = new double[axis.size()];
        Arrays.fill(data, value);
        return LumiSignal.spectrum(SignalType.CL, axis, data);
    }

    private static double[] ramp(int n) {
        double[] d = new double[n];
        for (int i = 0; i < n; i++) d[i] = i;
        return d;
    }

    private static double trapezoid(double[] x, double[] y) {
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.0;
        return sum;
    }

    private static void assertIncreasing(double[] v) {
        for (int i = 1; i < v.length; i++) {
            assertTrue(v[i] > v[i - 1], "axis not increasing at " + i);
        }
    }

    private static void assertRelativeEquals(double[] expected, double[] actual, double rtol) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], actual[i], Math.abs(expected[i]) * rtol, "sample " + i);
        }
    }

    static Stream<Arguments> conversions() {
        ConversionOptions raman = ConversionOptions.defaults().withLaser(244.0);
        return Stream.of(
                Arguments.of("Energy", "eV",
                        (BiFunction<LumiSignal, Boolean, LumiSignal>) (s, j) ->
                                AxisConversions.toEv(s, ConversionOptions.defaults().withJacobian(j))),
                Arguments.of("Wavenumber", "1/cm",
                        (BiFunction<LumiSignal, Boolean, LumiSignal>) (s, j) ->
                                AxisConversions.toInvcm(s, ConversionOptions.defaults().withJacobian(j))),
                Arguments.of("Raman Shift", "1/cm",
                        (BiFunction<LumiSignal, Boolean, LumiSignal>) (s, j) ->
                                AxisConversions.toRamanShift(s, raman.withJacobian(j))));
    }

    @Nested
    @DisplayName("Axis generation")
    class AxisTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.github.tinemuz.lumiaxis.convert.AxisConversionsTest#conversions")
        @DisplayName("Converted axis is non-uniform, increasing, named and sized")
        void convertedAxis(String name, String units, BiFunction<LumiSignal, Boolean, LumiSignal> convert) {
            LumiSignal out = convert.apply(spectrum(nmAxis(), 1.0), true);
            DataAxis axis = out.spectralAxis();
            assertEquals(name, axis.name());
            assertEquals(units, axis.units());
            assertEquals(20, axis.size());
            assertFalse(axis.isUniform());
            assertFalse(axis.navigate());
            assertIncreasing(axis.values());
        }

        @Test
        @DisplayName("Lowest energy comes from the longest wavelength")
        void energyEndpoints() {
            LumiSignal out = AxisConversions.toEv(spectrum(nmAxis(), 1.0));
            assertEquals(3.1781816, out.spectralAxis().valueAt(0), 1e-7);
            assertEquals(AxisConverter.nmToEv(200.0), out.spectralAxis().valueAt(19), 1e-12);
        }

        @Test
        @DisplayName("Lowest wavenumber is 1e7 / 390")
        void wavenumberEndpoints() {
            LumiSignal out = AxisConversions.toInvcm(spectrum(nmAxis(), 1.0));
            assertEquals(1e7 / 390.0, out.spectralAxis().valueAt(0), 1e-6);
            assertEquals(50000.0, out.spectralAxis().valueAt(19), 1e-6);
        }

        @Test
        @DisplayName("Raman shift keeps the wavelength order")
        void ramanOrder() {
            LumiSignal out = AxisConversions.toRamanShift(spectrum(nmAxis(), 1.0),
                    ConversionOptions.defaults().withLaser(244.0));
            assertEquals(1e7 / 244.0 - 1e7 / 200.0, out.spectralAxis().valueAt(0), 1e-6);
            assertTrue(out.spectralAxis().valueAt(0) < 0, "anti-Stokes side is negative");
        }
    }

    @Nested
    @DisplayName("Intensity and variance")
    class IntensityTests {

        @Test
        @DisplayName("Counts per eV at 390 nm")
        void jacobianEnergy() {
            LumiSignal out = AxisConversions.toEv(spectrum(nmAxis(), 100.0));
            assertEquals(12271.168, out.data()[0], 1e-3);
        }

        @Test
        @DisplayName("Counts per eV at 390 nm from a µm axis")
        void jacobianEnergyMicrometre() {
            LumiSignal out = AxisConversions.toEv(spectrum(umAxis(), 100.0));
            assertEquals(12.271168, out.data()[0], 1e-6);
        }

        @Test
        @DisplayName("Counts per wavenumber at 390 nm")
        void jacobianWavenumber() {
            LumiSignal out = AxisConversions.toInvcm(spectrum(nmAxis(), 100.0));
            assertEquals(1.521, out.data()[0], 1e-9);
        }

        @Test
        @DisplayName("Integral of a Gaussian peak is preserved")
        void integralInvariance() {
            int n = 801;
            double[] data = new double[n];
            DataAxis axis = DataAxis.uniform("Wavelength", "nm", n, 300.0, 0.5);
            double[] nm = axis.values();
            for (int i = 0; i < n; i++) data[i] = 1000.0 * Math.exp(-Math.pow((nm[i] - 500.0) / 20.0, 2) / 2.0);
            LumiSignal source = LumiSignal.spectrum(SignalType.PL, axis, data);
            double expected = trapezoid(nm, data);

            LumiSignal ev = AxisConversions.toEv(source);
            LumiSignal invcm = AxisConversions.toInvcm(source);
            LumiSignal raman = AxisConversions.toRamanShift(source, ConversionOptions.defaults().withLaser(244.0));

            assertEquals(expected, trapezoid(ev.spectralAxis().values(), ev.data()), expected * 1e-3);
            assertEquals(expected, trapezoid(invcm.spectralAxis().values(), invcm.data()), expected * 1e-3);
            assertEquals(expected, trapezoid(raman.spectralAxis().values(), raman.data()), expected * 1e-3);
        }

        @Test
        @DisplayName("Reversal keeps every intensity with its coordinate")
        void pairingPreserved() {
            LumiSignal source = LumiSignal.spectrum(SignalType.CL, nmAxis(), ramp(20));
            LumiSignal out = AxisConversions.toEv(source, ConversionOptions.defaults().withJacobian(false));
            for (int j = 0; j < 20; j++) {
                assertEquals(19 - j, out.data()[j], 0.0);
                assertEquals(AxisConverter.nmToEv(200.0 + 10.0 * (19 - j)), out.spectralAxis().valueAt(j), 1e-12);
            }
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.github.tinemuz.lumiaxis.convert.AxisConversionsTest#conversions")
        @DisplayName("Without the Jacobian only the axis changes")
        void noJacobian(String name, String units, BiFunction<LumiSignal, Boolean, LumiSignal> convert) {
            LumiSignal out = convert.apply(spectrum(nmAxis(), 1.0), false);
            for (double v : out.data()) assertEquals(1.0, v, 0.0);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.github.tinemuz.lumiaxis.convert.AxisConversionsTest#conversions")
        @DisplayName("µm input gives the nm result")
        void micrometreEqualsNanometre(
                String name, String units, BiFunction<LumiSignal, Boolean, LumiSignal> convert) {
            LumiSignal fromNm = convert.apply(spectrum(nmAxis(), 1.0), true);
            LumiSignal fromUm = AxisConversions.convert(spectrum(umAxis(), 1000.0),
                    targetOf(name), ConversionOptions.defaults().withLaser(0.244));
            assertRelativeEquals(fromNm.spectralAxis().values(), fromUm.spectralAxis().values(), 1e-9);
            assertRelativeEquals(fromNm.data(), fromUm.data(), 5e-4);
        }

        @Test
        @DisplayName("Constant variance becomes an array scaled by the factor squared")
        void varianceScaled() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.setVariance(VarianceModel.constant(4.0));
            LumiSignal out = AxisConversions.toEv(source);
            assertEquals(VarianceModel.Kind.ARRAY, out.variance().kind());
            double[] var = out.variance().toArray(20);
            for (int i = 0; i < 20; i++) {
                double f = out.data()[i];
                assertEquals(4.0 * f * f, var[i], 4.0 * f * f * 1e-12, "sample " + i);
            }
        }

        @Test
        @DisplayName("Variance array follows the reversed intensity")
        void varianceReversedWithData() {
            LumiSignal source = LumiSignal.spectrum(SignalType.CL, nmAxis(), ramp(20));
            source.setVariance(VarianceModel.array(ramp(20)));
            LumiSignal out = AxisConversions.toInvcm(source, ConversionOptions.defaults().withJacobian(false));
            assertArrayEquals(out.data(), out.variance().toArray(20), 0.0);
        }
    }

    @Nested
    @DisplayName("Navigation dimensions")
    class NavigationTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.github.tinemuz.lumiaxis.convert.AxisConversionsTest#conversions")
        @DisplayName("Line scans and maps convert every spectrum like a single one")
        void navigationDimensions(String name, String units, BiFunction<LumiSignal, Boolean, LumiSignal> convert) {
            LumiSignal single = convert.apply(spectrum(nmAxis(), 1.0), true);

            LumiSignal line = new LumiSignal(SignalType.CL_SEM,
                    List.of(DataAxis.navigation("x", 4), nmAxis()), filled(4 * 20));
            LumiSignal map = new LumiSignal(SignalType.CL_SEM,
                    List.of(DataAxis.navigation("y", 4), DataAxis.navigation("x", 4), nmAxis()), filled(16 * 20));

            LumiSignal lineOut = convert.apply(line, true);
            LumiSignal mapOut = convert.apply(map, true);
            assertArrayEquals(single.spectralAxis().values(), lineOut.spectralAxis().values(), 0.0);
            assertArrayEquals(single.spectralAxis().values(), mapOut.spectralAxis().values(), 0.0);
            for (int p = 0; p < 4; p++) {
                assertArrayEquals(single.data(), Arrays.copyOfRange(lineOut.data(), p * 20, p * 20 + 20), 1e-12);
            }
            for (int p = 0; p < 16; p++) {
                assertArrayEquals(single.data(), Arrays.copyOfRange(mapOut.data(), p * 20, p * 20 + 20), 1e-12);
            }
            assertTrue(lineOut.axis(0).navigate());
            assertEquals(2, mapOut.navigationAxisIndices().size());
        }

        @Test
        @DisplayName("Spectral axis before a navigation axis is reversed along the right stride")
        void spectralAxisNotLast() {
            double[] data = new double[20 * 2];
            for (int i = 0; i < 20; i++) {
                data[i * 2] = i;
                data[i * 2 + 1] = 100 + i;
            }
            LumiSignal source = new LumiSignal(SignalType.CL,
                    List.of(nmAxis(), DataAxis.navigation("x", 2)), data);
            LumiSignal out = AxisConversions.toEv(source, ConversionOptions.defaults().withJacobian(false));
            for (int j = 0; j < 20; j++) {
                assertEquals(19 - j, out.data()[j * 2], 0.0);
                assertEquals(119 - j, out.data()[j * 2 + 1], 0.0);
            }
        }

        @Test
        @DisplayName("Wavelength axis of a streak image converts, time axis untouched")
        void transientSpectrum() {
            DataAxis time = DataAxis.uniform("Time", "ps", 5, 0.0, 2.0);
            LumiSignal streak = new LumiSignal(SignalType.TRANSIENT_SPECTRUM,
                    List.of(nmAxis(), time), filled(20 * 5));
            LumiSignal out = AxisConversions.toEv(streak);
            assertEquals("eV", out.axis(0).units());
            assertEquals("ps", out.axis(1).units());
            assertTrue(out.axis(1).isUniform());
            assertEquals(SignalType.TRANSIENT_SPECTRUM, out.type());
        }

        private double[] filled(int n) {
            double[] d = new double[n];
            Arrays.fill(d, 1.0);
            return d;
        }
    }

    @Nested
    @DisplayName("Copy and in-place semantics")
    class InplaceTests {

        @Test
        @DisplayName("By default the source is left untouched")
        void copyByDefault() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            LumiSignal out = AxisConversions.toEv(source);
            assertNotSame(source, out);
            assertEquals("nm", source.spectralAxis().units());
            assertTrue(source.spectralAxis().isUniform());
            for (double v : source.data()) assertEquals(1.0, v, 0.0);
        }

        @Test
        @DisplayName("In place rewrites and returns the same signal")
        void inplace() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            LumiSignal out = AxisConversions.toInvcm(source, ConversionOptions.defaults().withInplace(true));
            assertSame(source, out);
            assertEquals("Wavenumber", source.spectralAxis().name());
        }

        @Test
        @DisplayName("Metadata of the copy is independent")
        void metadataCopied() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set("General.title", "sample");
            LumiSignal out = AxisConversions.toEv(source);
            out.metadata().set("General.title", "converted");
            assertEquals("sample", source.metadata().getString("General.title").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Laser wavelength")
    class LaserTests {

        @Test
        @DisplayName("Read from metadata when not given")
        void fromMetadata() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set(LASER_PATH, 244.0);
            LumiSignal out = AxisConversions.toRamanShift(source);
            assertEquals(1e7 / 244.0 - 1e7 / 200.0, out.spectralAxis().valueAt(0), 1e-6);
        }

        @Test
        @DisplayName("Explicit value wins over metadata")
        void explicitWins() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set(LASER_PATH, 300.0);
            LumiSignal out = AxisConversions.toRamanShift(source, ConversionOptions.defaults().withLaser(244.0));
            assertEquals(1e7 / 244.0 - 1e7 / 200.0, out.spectralAxis().valueAt(0), 1e-6);
        }

        @Test
        @DisplayName("Custom metadata path")
        void customPath() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set("Acquisition_instrument.PL.laser", "244");
            LumiSignal out = AxisConversions.toRamanShift(source,
                    ConversionOptions.defaults().withLaserMetadataPath("Acquisition_instrument.PL.laser"));
            assertEquals(1e7 / 244.0 - 1e7 / 200.0, out.spectralAxis().valueAt(0), 1e-6);
        }

        @Test
        @DisplayName("Missing laser fails without touching the signal")
        void missingLaser() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            MissingLaserWavelengthException e = assertThrows(MissingLaserWavelengthException.class,
                    () -> AxisConversions.toRamanShift(source, ConversionOptions.defaults().withInplace(true)));
            assertTrue(e.getMessage().contains(LASER_PATH), e.getMessage());
            assertEquals("nm", source.spectralAxis().units());
        }

        @Test
        @DisplayName("Non-positive laser is rejected")
        void negativeLaser() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            assertThrows(IllegalArgumentException.class,
                    () -> AxisConversions.toRamanShift(source, ConversionOptions.defaults().withLaser(-1.0)));
        }
    }

    @Nested
    @DisplayName("Unit validation and noise model")
    class ValidationTests {

        @Test
        @DisplayName("Converting an energy axis again is refused")
        void alreadyEv() {
            LumiSignal ev = AxisConversions.toEv(spectrum(nmAxis(), 1.0));
            UnsupportedAxisUnitException e =
                    assertThrows(UnsupportedAxisUnitException.class, () -> AxisConversions.toEv(ev));
            assertTrue(e.getMessage().contains("already eV"), e.getMessage());
            assertThrows(UnsupportedAxisUnitException.class, () -> AxisConversions.toInvcm(ev));
        }

        @Test
        @DisplayName("Wavenumber axis written as cm$^{-1}$ is recognised and refused")
        void alreadyWavenumber() {
            LumiSignal s = spectrum(DataAxis.uniform("Wavenumber", "cm$^{-1}$", 10, 1000, 10), 1.0);
            assertThrows(UnsupportedAxisUnitException.class, () -> AxisConversions.toEv(s));
        }

        @Test
        @DisplayName("Unknown unit is refused")
        void unknownUnit() {
            LumiSignal s = spectrum(DataAxis.uniform("Channel", "furlong", 10, 0, 1), 1.0);
            assertThrows(UnsupportedAxisUnitException.class, () -> AxisConversions.toEv(s));
        }

        @Test
        @DisplayName("Linear noise model is reset after a Jacobian transformation")
        void noiseModelReset() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set(NOISE + ".gain_factor", 2.5);
            source.metadata().set(NOISE + ".gain_offset", 3.0);
            source.metadata().set(NOISE + ".correlation_factor", 0.5);
            LumiSignal out = AxisConversions.toEv(source);
            assertEquals(1.0, out.metadata().getDouble(NOISE + ".gain_factor").getAsDouble(), 0.0);
            assertEquals(0.0, out.metadata().getDouble(NOISE + ".gain_offset").getAsDouble(), 0.0);
            assertEquals(1.0, out.metadata().getDouble(NOISE + ".correlation_factor").getAsDouble(), 0.0);
            assertEquals(2.5, source.metadata().getDouble(NOISE + ".gain_factor").getAsDouble(), 0.0);
        }

        @Test
        @DisplayName("Noise model is kept without a Jacobian transformation")
        void noiseModelKept() {
            LumiSignal source = spectrum(nmAxis(), 1.0);
            source.metadata().set(NOISE + ".gain_factor", 2.5);
            LumiSignal out = AxisConversions.toEv(source, ConversionOptions.defaults().withJacobian(false));
            assertEquals(2.5, out.metadata().getDouble(NOISE + ".gain_factor").getAsDouble(), 0.0);
        }
    }

    private static ConversionTarget targetOf(String axisName) {
        for (ConversionTarget t : ConversionTarget.values()) {
            if (t.axisName().equals(axisName)) return t;
        }
        throw new IllegalArgumentException(axisName);
    }
}

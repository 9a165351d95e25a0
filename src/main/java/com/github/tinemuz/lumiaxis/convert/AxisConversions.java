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

import com.github.tinemuz.lumiaxis.LumiAxisDefaults;
import com.github.tinemuz.lumiaxis.exceptions.MissingLaserWavelengthException;
import com.github.tinemuz.lumiaxis.exceptions.UnsupportedAxisUnitException;
import com.github.tinemuz.lumiaxis.signal.AxisStrides;
import com.github.tinemuz.lumiaxis.signal.AxisUnit;
import com.github.tinemuz.lumiaxis.signal.DataAxis;
import com.github.tinemuz.lumiaxis.signal.LumiSignal;
import com.github.tinemuz.lumiaxis.signal.Metadata;
import com.github.tinemuz.lumiaxis.signal.VarianceModel;
import java.util.Optional;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the spectral axis of a signal from wavelength to energy,
 * wavenumber or Raman shift.
 *
 * <p>The spectral axis must be in nm or µm. The result always carries a
 * non-uniform, increasing axis; when the converted coordinates run the other
 * way, coordinates, intensity and variance are reversed together so every
 * sample keeps its value. Unless disabled, the intensity is rescaled by the
 * Jacobian of the conversion ({@link JacobianTransformer}) so integrals over
 * the axis are preserved, and any stored linear noise model is reset since
 * its parameters referred to the old unit.</p>
 *
 * <p>By default the source signal is left untouched and a converted copy is
 * returned. With {@link ConversionOptions#inplace()} the signal itself is
 * rewritten and returned; every check runs before anything is modified.</p>
 */
public final class AxisConversions {
    private static final Logger log = LoggerFactory.getLogger(AxisConversions.class);

    private AxisConversions() {}

    public static LumiSignal toEv(LumiSignal signal) {
        return convert(signal, ConversionTarget.ENERGY, ConversionOptions.defaults());
    }

    /**
     * Convert the spectral axis to photon energy (eV), accounting for the
     * refractive index of air.
     *
     * @throws UnsupportedAxisUnitException if the axis is not in nm or µm
     */
    public static LumiSignal toEv(LumiSignal signal, ConversionOptions options) {
        return convert(signal, ConversionTarget.ENERGY, options);
    }

    public static LumiSignal toInvcm(LumiSignal signal) {
        return convert(signal, ConversionTarget.WAVENUMBER, ConversionOptions.defaults());
    }

    /**
     * Convert the spectral axis to absolute wavenumber (1/cm).
     *
     * @throws UnsupportedAxisUnitException if the axis is not in nm or µm
     */
    public static LumiSignal toInvcm(LumiSignal signal, ConversionOptions options) {
        return convert(signal, ConversionTarget.WAVENUMBER, options);
    }

    public static LumiSignal toRamanShift(LumiSignal signal) {
        return convert(signal, ConversionTarget.RAMAN_SHIFT, ConversionOptions.defaults());
    }

    /**
     * Convert the spectral axis to Raman shift (1/cm) relative to the laser
     * line. The laser wavelength, in the unit of the axis, is taken from the
     * options, else from the metadata path named in the options.
     *
     * @throws UnsupportedAxisUnitException     if the axis is not in nm or µm
     * @throws MissingLaserWavelengthException  if no laser wavelength can be found
     * @throws IllegalArgumentException         if the laser wavelength is not positive
     */
    public static LumiSignal toRamanShift(LumiSignal signal, ConversionOptions options) {
        return convert(signal, ConversionTarget.RAMAN_SHIFT, options);
    }

    /** Shared implementation of the three conversions. */
    public static LumiSignal convert(
            LumiSignal signal, ConversionTarget target, ConversionOptions options) {
        // STEP 1: Validate the axis unit and resolve the laser before touching anything
        int axisIndex = signal.spectralAxisIndex();
        DataAxis axis = signal.axis(axisIndex);
        AxisUnit unit = requireLengthUnit(axis, target);
        double nmPerUnit = unit.nanometers();
        double laserNm = target == ConversionTarget.RAMAN_SHIFT
                ? resolveLaser(signal, options) * nmPerUnit
                : Double.NaN;

        // STEP 2: New coordinates and the signed derivative d(new)/dλ, in stored order
        double[] nm = axis.values();
        for (int i = 0; i < nm.length; i++) nm[i] *= nmPerUnit;
        double[] coords;
        double[] derivative;
        switch (target) {
            case ENERGY:
                coords = AxisConverter.nmToEv(nm);
                derivative = AxisConverter.dEvDnm(nm, coords);
                break;
            case WAVENUMBER:
                coords = AxisConverter.nmToInvcm(nm);
                derivative = AxisConverter.dInvcmDnm(nm);
                break;
            case RAMAN_SHIFT:
                coords = AxisConverter.nmToRamanShift(nm, laserNm);
                derivative = AxisConverter.dRamanShiftDnm(nm);
                break;
            default:
                throw new IllegalArgumentException("Unknown conversion target " + target);
        }

        // STEP 3: Store increasing coordinates; keep intensity and variance paired
        AxisStrides layout = signal.strides(axisIndex);
        double[] data = signal.data().clone();
        VarianceModel variance = signal.variance();
        if (DataAxis.monotonicDirection(coords) < 0) {
            reverse(coords);
            reverse(derivative);
            layout.reverse(data);
            if (variance.kind() == VarianceModel.Kind.ARRAY) {
                double[] reversed = variance.toArray(data.length);
                layout.reverse(reversed);
                variance = VarianceModel.array(reversed);
            }
        }

        // STEP 4: Jacobian rescaling
        if (options.jacobian()) {
            JacobianTransformer.Result r =
                    JacobianTransformer.transform(derivative, nmPerUnit, data, layout, variance);
            data = r.data();
            variance = r.variance();
        }

        // STEP 5: Install the new axis, data and variance on the target signal
        LumiSignal out = options.inplace() ? signal : signal.copy();
        out.replaceAxis(
                axisIndex,
                DataAxis.nonUniform(target.axisName(), target.unit().symbol(), coords)
                        .asNavigation(axis.navigate()));
        out.setData(data);
        out.setVariance(variance);

        // STEP 6: Noise model parameters referred to the old unit
        if (options.jacobian()) {
            resetNoiseModel(out.metadata());
        }

        log.debug("Converted axis '{}' [{}] of {} samples to {} (jacobian={}, inplace={})",
                axis.name(), axis.units(), axis.size(), target, options.jacobian(), options.inplace());
        return out;
    }

    private static AxisUnit requireLengthUnit(DataAxis axis, ConversionTarget target) {
        Optional<AxisUnit> unit = axis.unit();
        if (unit.isEmpty()) {
            // Unlabelled spectral axes are taken to be in nanometres
            if (axis.units() == null || axis.units().isBlank()) return AxisUnit.NANOMETER;
            throw new UnsupportedAxisUnitException(
                    "Cannot convert axis '" + axis.name() + "' from unknown unit '" + axis.units()
                            + "' to " + target.unit().symbol());
        }
        if (unit.get().kind() != AxisUnit.Kind.LENGTH) {
            throw new UnsupportedAxisUnitException(
                    "Signal unit is already " + unit.get().symbol() + "; convert from a wavelength "
                            + "axis (nm or µm) to obtain " + target.axisName());
        }
        return unit.get();
    }

    private static double resolveLaser(LumiSignal signal, ConversionOptions options) {
        double laser;
        if (options.laser() != null) {
            laser = options.laser();
        } else {
            String path = options.laserMetadataPath() != null
                    ? options.laserMetadataPath()
                    : LumiAxisDefaults.laserWavelengthPath();
            OptionalDouble fromMetadata = signal.metadata().getDouble(path);
            if (fromMetadata.isEmpty()) {
                throw new MissingLaserWavelengthException(path);
            }
            laser = fromMetadata.getAsDouble();
        }
        if (!(laser > 0.0) || Double.isInfinite(laser)) {
            throw new IllegalArgumentException("Laser wavelength must be positive and finite: " + laser);
        }
        return laser;
    }

    private static void resetNoiseModel(Metadata metadata) {
        String path = LumiAxisDefaults.noiseModelPath();
        if (!metadata.has(path)) return;
        metadata.set(path + ".gain_factor", 1.0);
        metadata.set(path + ".gain_offset", 0.0);
        metadata.set(path + ".correlation_factor", 1.0);
        log.warn("Following the Jacobian transformation, the parameters of the linear noise model "
                + "at '{}' were reset to gain_factor=1, gain_offset=0, correlation_factor=1", path);
    }

    private static void reverse(double[] v) {
        for (int i = 0, j = v.length - 1; i < j; i++, j--) {
            double t = v[i];
            v[i] = v[j];
            v[j] = t;
        }
    }
}

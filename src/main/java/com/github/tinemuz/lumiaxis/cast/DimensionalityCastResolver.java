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
package com.github.tinemuz.lumiaxis.cast;

import com.github.tinemuz.lumiaxis.exceptions.UnresolvedSignalTypeException;
import com.github.tinemuz.lumiaxis.signal.AxisUnit;
import com.github.tinemuz.lumiaxis.signal.DataAxis;
import com.github.tinemuz.lumiaxis.signal.LumiSignal;
import com.github.tinemuz.lumiaxis.signal.SignalType;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the type of a signal produced by dropping one axis of a signal
 * with two signal axes (wavelength × time).
 *
 * <p>Each call is judged on its own, from the axis that is left:</p>
 * <ul>
 *     <li>a time axis makes the result a {@link SignalType#TRANSIENT};</li>
 *     <li>a wavelength, energy or wavenumber axis makes it a
 *     {@link SignalType#LUMINESCENCE} spectrum;</li>
 *     <li>an axis without a recognised unit is an error, and the result keeps
 *     the type it had before the call.</li>
 * </ul>
 * <p>When the source had a single signal axis, or the result does not have
 * exactly one, the type is left alone.</p>
 */
public final class DimensionalityCastResolver {
    private static final Logger log = LoggerFactory.getLogger(DimensionalityCastResolver.class);

    private DimensionalityCastResolver() {}

    /**
     * Retag {@code reduced} according to its remaining signal axis.
     *
     * @param sourceType type of the signal before the reduction
     * @param reduced    result of the reduction, tagged {@link SignalType#BASE}
     *                   when its signal dimension changed
     * @return the type {@code reduced} carries after the call
     * @throws UnresolvedSignalTypeException if the remaining axis has no recognised unit
     */
    public static SignalType resolve(SignalType sourceType, LumiSignal reduced) {
        if (sourceType.signalDimension() != 2) return reduced.type();
        List<Integer> signalAxes = reduced.signalAxisIndices();
        if (signalAxes.size() != 1) return reduced.type();

        DataAxis remaining = reduced.axis(signalAxes.get(0));
        Optional<AxisUnit> unit = remaining.unit();
        if (unit.isEmpty()) {
            throw new UnresolvedSignalTypeException(
                    "Cannot tell whether axis '" + remaining.name() + "' with unit '"
                            + remaining.units() + "' is a time or a spectral axis");
        }
        SignalType resolved =
                unit.get().kind() == AxisUnit.Kind.TIME ? SignalType.TRANSIENT : SignalType.LUMINESCENCE;
        reduced.setType(resolved);
        log.debug("Reduced {} resolved to {} from axis '{}'", sourceType, resolved, remaining.name());
        return resolved;
    }
}

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

import com.github.tinemuz.lumiaxis.signal.AxisUnit;

/** Spectral representations a wavelength axis can be converted to. */
public enum ConversionTarget {
    ENERGY("Energy", AxisUnit.ELECTRONVOLT),
    WAVENUMBER("Wavenumber", AxisUnit.WAVENUMBER),
    RAMAN_SHIFT("Raman Shift", AxisUnit.WAVENUMBER);

    private final String axisName;
    private final AxisUnit unit;

    ConversionTarget(String axisName, AxisUnit unit) {
        this.axisName = axisName;
        this.unit = unit;
    }

    /** Name given to the converted axis. */
    public String axisName() {
        return axisName;
    }

    public AxisUnit unit() {
        return unit;
    }
}

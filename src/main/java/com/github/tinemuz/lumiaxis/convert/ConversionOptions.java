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

/**
 * Per-call settings of an axis conversion.
 */
public record ConversionOptions(
        boolean inplace,            // mutate the given signal instead of returning a copy
        boolean jacobian,           // rescale intensity and variance to keep the integral
        Double laser,               // laser wavelength in the axis length unit; null to look it up
        String laserMetadataPath    // where to look for the laser wavelength
) {
    /** Copy semantics, Jacobian on, laser read from the configured metadata path. */
    public static ConversionOptions defaults() {
        return new ConversionOptions(false, true, null, LumiAxisDefaults.laserWavelengthPath());
    }

    public ConversionOptions withInplace(boolean value) {
        return new ConversionOptions(value, jacobian, laser, laserMetadataPath);
    }

    public ConversionOptions withJacobian(boolean value) {
        return new ConversionOptions(inplace, value, laser, laserMetadataPath);
    }

    public ConversionOptions withLaser(double value) {
        return new ConversionOptions(inplace, jacobian, value, laserMetadataPath);
    }

    public ConversionOptions withLaserMetadataPath(String value) {
        return new ConversionOptions(inplace, jacobian, laser, value);
    }
}

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
 * Notice that some wavelengths passed to {@link AirRefractiveIndex} were
 * outside the valid range and were replaced by the nearest boundary.
 *
 * @param clampedCount number of clamped inputs
 * @param lowestNm     smallest wavelength requested (nm)
 * @param highestNm    largest wavelength requested (nm)
 */
public record ClampWarning(int clampedCount, double lowestNm, double highestNm) {

    public String message() {
        return String.format(
                "The wavelength range %.1f-%.1f nm exceeds the valid range of %.0f-%.0f nm of the "
                        + "refractive index of air; %d value(s) were clamped to the boundaries",
                lowestNm, highestNm,
                AirRefractiveIndex.MIN_WAVELENGTH_NM, AirRefractiveIndex.MAX_WAVELENGTH_NM,
                clampedCount);
    }
}

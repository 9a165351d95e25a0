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
package com.github.tinemuz.lumiaxis.join;

import com.github.tinemuz.lumiaxis.LumiAxisDefaults;

/**
 * Settings of {@link SpectrumJoiner#join}.
 *
 * @param window      half width, in samples, of the window around each seam
 *                    used to estimate the scale factor
 * @param scale       whether later spectra are scaled to match earlier ones
 * @param scaleFactor fixed factor applied to every later spectrum instead of
 *                    the estimate; null to estimate
 */
public record JoinOptions(int window, boolean scale, Double scaleFactor) {

    public JoinOptions {
        if (window < 0) throw new IllegalArgumentException("window must not be negative: " + window);
        if (scaleFactor != null && !(scaleFactor >= 0.0 && Double.isFinite(scaleFactor))) {
            throw new IllegalArgumentException("scaleFactor must be finite and non-negative: " + scaleFactor);
        }
    }

    public static JoinOptions defaults() {
        return new JoinOptions(LumiAxisDefaults.joinWindow(), true, null);
    }

    public JoinOptions withWindow(int value) {
        return new JoinOptions(value, scale, scaleFactor);
    }

    public JoinOptions withScale(boolean value) {
        return new JoinOptions(window, value, scaleFactor);
    }

    public JoinOptions withScaleFactor(double value) {
        return new JoinOptions(window, scale, value);
    }
}

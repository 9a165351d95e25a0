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
package com.github.tinemuz.lumiaxis.signal;

import java.util.Locale;
import java.util.Optional;

/**
 * Axis units recognised by the conversion and casting code.
 *
 * <p>Each unit belongs to a {@link Kind}. Symbols are matched exactly first,
 * then through a small alias table (e.g. {@code "um"} for micrometres or
 * {@code "cm$^{-1}$"} for wavenumbers). Anything else is unrecognised and is
 * reported as an empty {@link Optional} by {@link #fromSymbol(String)}.</p>
 */
public enum AxisUnit {
    NANOMETER("nm", Kind.LENGTH, 1.0),
    MICROMETER("µm", Kind.LENGTH, 1000.0),
    ELECTRONVOLT("eV", Kind.ENERGY, Double.NaN),
    WAVENUMBER("1/cm", Kind.WAVENUMBER, Double.NaN),
    FEMTOSECOND("fs", Kind.TIME, Double.NaN),
    PICOSECOND("ps", Kind.TIME, Double.NaN),
    NANOSECOND("ns", Kind.TIME, Double.NaN),
    MICROSECOND("µs", Kind.TIME, Double.NaN),
    MILLISECOND("ms", Kind.TIME, Double.NaN),
    SECOND("s", Kind.TIME, Double.NaN);

    /** Physical quantity an axis unit measures. */
    public enum Kind {
        LENGTH,
        ENERGY,
        WAVENUMBER,
        TIME
    }

    private final String symbol;
    private final Kind kind;
    private final double nanometers;

    AxisUnit(String symbol, Kind kind, double nanometers) {
        this.symbol = symbol;
        this.kind = kind;
        this.nanometers = nanometers;
    }

    public String symbol() {
        return symbol;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Length of one unit in nanometres. Only defined for {@link Kind#LENGTH}.
     *
     * @throws IllegalStateException for non-length units
     */
    public double nanometers() {
        if (kind != Kind.LENGTH) {
            throw new IllegalStateException(symbol + " is not a length unit");
        }
        return nanometers;
    }

    /**
     * Resolve a unit symbol as written on an axis.
     *
     * @param symbol axis unit string, may be null
     * @return the matching unit, or empty when missing or unrecognised
     */
    public static Optional<AxisUnit> fromSymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        String s = symbol.trim();
        if (s.isEmpty()) return Optional.empty();
        for (AxisUnit u : values()) {
            if (u.symbol.equals(s)) return Optional.of(u);
        }
        switch (s.toLowerCase(Locale.ROOT)) {
            case "um":
            case "μm": // greek mu
            case "micron":
                return Optional.of(MICROMETER);
            case "ev":
                return Optional.of(ELECTRONVOLT);
            case "cm-1":
            case "cm^-1":
            case "cm⁻¹":
            case "cm$^{-1}$":
            case "1/cm":
                return Optional.of(WAVENUMBER);
            case "us":
            case "μs":
                return Optional.of(MICROSECOND);
            case "sec":
                return Optional.of(SECOND);
            default:
                return Optional.empty();
        }
    }
}

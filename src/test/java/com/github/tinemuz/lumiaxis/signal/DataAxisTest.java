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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DataAxisTest {

    @Nested
    @DisplayName("Axis construction")
    class ConstructionTests {

        @Test
        @DisplayName("Uniform axis derives coordinates from offset and scale")
        void uniform() {
            DataAxis a = DataAxis.uniform("Wavelength", "nm", 5, 400.0, 2.5);
            assertTrue(a.isUniform());
            assertArrayEquals(new double[] {400, 402.5, 405, 407.5, 410}, a.values(), 1e-12);
            assertEquals(400.0, a.min(), 0.0);
            assertEquals(410.0, a.max(), 0.0);
            assertFalse(a.navigate());
        }

        @Test
        @DisplayName("Non-uniform axis keeps a private copy")
        void nonUniformCopy() {
            double[] v = {1.0, 1.5, 3.0};
            DataAxis a = DataAxis.nonUniform("Energy", "eV", v);
            v[0] = 99.0;
            assertEquals(1.0, a.valueAt(0), 0.0);
            a.values()[1] = 42.0;
            assertEquals(1.5, a.valueAt(1), 0.0);
        }

        @Test
        @DisplayName("Non-monotonic coordinates are rejected")
        void nonMonotonic() {
            assertThrows(IllegalArgumentException.class,
                    () -> DataAxis.nonUniform("x", "nm", new double[] {1, 3, 2}));
            assertThrows(IllegalArgumentException.class,
                    () -> DataAxis.nonUniform("x", "nm", new double[] {1, 1, 2}));
        }

        @Test
        @DisplayName("Degenerate uniform axes are rejected")
        void degenerate() {
            assertThrows(IllegalArgumentException.class, () -> DataAxis.uniform("x", "nm", 0, 0, 1));
            assertThrows(IllegalArgumentException.class, () -> DataAxis.uniform("x", "nm", 3, 0, 0));
        }

        @Test
        @DisplayName("Navigation axis is flagged and unit-less")
        void navigation() {
            DataAxis a = DataAxis.navigation("x", 4);
            assertTrue(a.navigate());
            assertNull(a.units());
            assertEquals(Optional.empty(), a.unit());
        }
    }

    @Nested
    @DisplayName("Lookup and slicing")
    class LookupTests {

        @ParameterizedTest
        @CsvSource({"400.0, 0", "401.2, 0", "401.3, 1", "1000.0, 4", "-5.0, 0"})
        @DisplayName("Uniform value-to-index is nearest and clamped")
        void uniformIndex(double value, int index) {
            DataAxis a = DataAxis.uniform("Wavelength", "nm", 5, 400.0, 2.5);
            assertEquals(index, a.valueToIndex(value));
        }

        @Test
        @DisplayName("Non-uniform value-to-index is nearest")
        void nonUniformIndex() {
            DataAxis a = DataAxis.nonUniform("Energy", "eV", new double[] {1.0, 1.1, 1.5, 2.5});
            assertEquals(1, a.valueToIndex(1.2));
            assertEquals(2, a.valueToIndex(1.4));
            assertEquals(3, a.valueToIndex(9.0));
        }

        @Test
        @DisplayName("Slicing keeps uniform axes uniform")
        void slice() {
            DataAxis a = DataAxis.uniform("Wavelength", "nm", 10, 0.0, 1.0).slice(2, 5);
            assertTrue(a.isUniform());
            assertArrayEquals(new double[] {2, 3, 4}, a.values(), 0.0);
            DataAxis b = DataAxis.nonUniform("E", "eV", new double[] {1, 2, 4, 8}).slice(1, 3);
            assertArrayEquals(new double[] {2, 4}, b.values(), 0.0);
            assertThrows(IndexOutOfBoundsException.class, () -> a.slice(2, 9));
        }

        @Test
        @DisplayName("Direction of coordinate vectors")
        void direction() {
            assertEquals(1, DataAxis.monotonicDirection(new double[] {1, 2, 3}));
            assertEquals(-1, DataAxis.monotonicDirection(new double[] {3, 2, 1}));
            assertEquals(0, DataAxis.monotonicDirection(new double[] {1, 3, 2}));
            assertEquals(1, DataAxis.monotonicDirection(new double[] {7}));
        }
    }
}

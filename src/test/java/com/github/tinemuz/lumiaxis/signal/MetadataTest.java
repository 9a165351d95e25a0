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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MetadataTest {

    @Test
    @DisplayName("Dotted paths create intermediate nodes")
    void setAndGet() {
        Metadata m = new Metadata().set("Acquisition_instrument.Laser.wavelength", 532.0);
        assertTrue(m.has("Acquisition_instrument.Laser"));
        assertTrue(m.has("Acquisition_instrument.Laser.wavelength"));
        assertEquals(532.0, m.getDouble("Acquisition_instrument.Laser.wavelength").getAsDouble(), 0.0);
        assertFalse(m.has("Acquisition_instrument.CL.exposure"));
    }

    @Test
    @DisplayName("Numbers and numeric strings read as doubles")
    void numericReads() {
        Metadata m = new Metadata().set("a.int", 2).set("a.str", " 0.5 ").set("a.word", "fast");
        assertEquals(2.0, m.getDouble("a.int").getAsDouble(), 0.0);
        assertEquals(0.5, m.getDouble("a.str").getAsDouble(), 0.0);
        assertTrue(m.getDouble("a.none").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> m.getDouble("a.word"));
    }

    @Test
    @DisplayName("Only Boolean.TRUE counts as true")
    void flags() {
        Metadata m = new Metadata().set("Signal.scaled", true).set("Signal.normalized", "true");
        assertTrue(m.isTrue("Signal.scaled"));
        assertFalse(m.isTrue("Signal.normalized"));
        assertFalse(m.isTrue("Signal.missing"));
    }

    @Test
    @DisplayName("Copies are deep")
    void deepCopy() {
        double[] background = {1, 2};
        Metadata m = new Metadata().set("Signal.quantity", "Intensity").set("Signal.background", background);
        Metadata c = m.copy();
        c.set("Signal.quantity", "Other");
        ((double[]) c.get("Signal.background").orElseThrow())[0] = 9;
        assertEquals("Intensity", m.getString("Signal.quantity").orElseThrow());
        assertEquals(1.0, background[0], 0.0);
    }

    @Test
    @DisplayName("Removing an entry leaves its siblings")
    void remove() {
        Metadata m = new Metadata().set("a.b", 1).set("a.c", 2);
        m.remove("a.b");
        m.remove("x.y");
        assertFalse(m.has("a.b"));
        assertTrue(m.has("a.c"));
    }

    @Test
    @DisplayName("Blank paths are rejected")
    void blankPath() {
        assertThrows(IllegalArgumentException.class, () -> new Metadata().get(" "));
    }
}

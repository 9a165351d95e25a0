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
package com.github.tinemuz.lumiaxis;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library-wide defaults read from the classpath resource
 * <code>lumiaxis.properties</code>.
 *
 * <p>The file names the metadata key paths the conversions and operations look
 * in (laser wavelength, exposure, linear noise model) and the default join
 * window. It is loaded on first use; call {@link #preload()} at startup to
 * surface a missing or broken file early.</p>
 */
public final class LumiAxisDefaults {
    private static final Logger log = LoggerFactory.getLogger(LumiAxisDefaults.class);
    private static final String RESOURCE = "lumiaxis.properties";

    private static volatile boolean loaded = false;
    private static String laserWavelengthPath;
    private static List<String> exposurePaths;
    private static String noiseModelPath;
    private static int joinWindow;

    private LumiAxisDefaults() {}

    /** Metadata key path of the excitation laser wavelength. */
    public static String laserWavelengthPath() {
        ensureLoaded();
        return laserWavelengthPath;
    }

    /** Metadata key paths searched, in order, for the acquisition time. */
    public static List<String> exposurePaths() {
        ensureLoaded();
        return exposurePaths;
    }

    /** Metadata node holding gain_factor, gain_offset and correlation_factor. */
    public static String noiseModelPath() {
        ensureLoaded();
        return noiseModelPath;
    }

    /** Default half width, in samples, of the window used to match joined spectra. */
    public static int joinWindow() {
        ensureLoaded();
        return joinWindow;
    }

    /**
     * Load the defaults now.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        loadFromResource();
        loaded = true;
    }

    private static void loadFromResource() {
        InputStream in = LumiAxisDefaults.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Defaults file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Defaults file '" + RESOURCE + "' not found on classpath");
        }
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.error("Failed to read defaults file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to read defaults file '" + RESOURCE + "'", e);
        }
        try {
            laserWavelengthPath = required(props, "laser.wavelength.path");
            noiseModelPath = required(props, "noise.model.path");
            List<String> paths = new ArrayList<>();
            for (String p : required(props, "exposure.paths").split(",")) {
                if (!p.isBlank()) paths.add(p.trim());
            }
            exposurePaths = Collections.unmodifiableList(paths);
            joinWindow = Integer.parseInt(required(props, "join.window"));
            if (joinWindow < 0) {
                throw new IllegalArgumentException("join.window must not be negative: " + joinWindow);
            }
        } catch (RuntimeException e) {
            log.error("Failed to parse defaults file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to parse defaults file '" + RESOURCE + "'", e);
        }
        log.debug("Loaded defaults: laser={}, exposure={}, noise={}, joinWindow={}",
                laserWavelengthPath, exposurePaths, noiseModelPath, joinWindow);
    }

    private static String required(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Missing property '" + key + "'");
        }
        return v.trim();
    }
}

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Hierarchical signal metadata addressed by dotted key paths such as
 * {@code Acquisition_instrument.Laser.wavelength}.
 *
 * <p>Intermediate nodes are created on write. Values are stored as given;
 * {@link #getDouble(String)} accepts any {@link Number} and numeric strings.</p>
 */
public final class Metadata {
    private final Map<String, Object> root;

    public Metadata() {
        this.root = new LinkedHashMap<>();
    }

    private Metadata(Map<String, Object> root) {
        this.root = root;
    }

    public boolean has(String path) {
        return get(path).isPresent();
    }

    public Optional<Object> get(String path) {
        String[] keys = split(path);
        Map<String, Object> node = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Object child = node.get(keys[i]);
            if (!(child instanceof Map)) return Optional.empty();
            node = asNode(child);
        }
        return Optional.ofNullable(node.get(keys[keys.length - 1]));
    }

    public OptionalDouble getDouble(String path) {
        Optional<Object> value = get(path);
        if (value.isEmpty()) return OptionalDouble.empty();
        Object v = value.get();
        if (v instanceof Number) return OptionalDouble.of(((Number) v).doubleValue());
        if (v instanceof String) {
            try {
                return OptionalDouble.of(Double.parseDouble(((String) v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Metadata '" + path + "' is not numeric: " + v, e);
            }
        }
        throw new IllegalArgumentException("Metadata '" + path + "' is not numeric: " + v);
    }

    public Optional<String> getString(String path) {
        return get(path).map(Object::toString);
    }

    /** True only when the entry exists and is {@link Boolean#TRUE}. */
    public boolean isTrue(String path) {
        return get(path).map(Boolean.TRUE::equals).orElse(false);
    }

    public Metadata set(String path, Object value) {
        String[] keys = split(path);
        Map<String, Object> node = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Object child = node.get(keys[i]);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                node.put(keys[i], child);
            }
            node = asNode(child);
        }
        node.put(keys[keys.length - 1], value);
        return this;
    }

    public void remove(String path) {
        String[] keys = split(path);
        Map<String, Object> node = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Object child = node.get(keys[i]);
            if (!(child instanceof Map)) return;
            node = asNode(child);
        }
        node.remove(keys[keys.length - 1]);
    }

    public Metadata copy() {
        return new Metadata(deepCopy(root));
    }

    @Override
    public String toString() {
        return root.toString();
    }

    private static String[] split(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Metadata path must not be blank");
        }
        return path.split("\\.");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asNode(Object o) {
        return (Map<String, Object>) o;
    }

    private static Map<String, Object> deepCopy(Map<String, Object> src) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : src.entrySet()) {
            Object v = e.getValue();
            if (v instanceof Map) v = deepCopy(asNode(v));
            else if (v instanceof double[]) v = ((double[]) v).clone();
            else if (v instanceof int[]) v = ((int[]) v).clone();
            out.put(e.getKey(), v);
        }
        return out;
    }
}

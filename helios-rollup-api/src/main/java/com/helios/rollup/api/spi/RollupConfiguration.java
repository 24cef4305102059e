/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.spi;

import java.util.List;

/**
 * Read-only view over a configuration tree.
 *
 * <p>Keys are dotted paths ({@code graphite_rollup.default.function}). Repeated
 * elements are addressed by index: the first occurrence is {@code pattern}, the following
 * ones {@code pattern[1]}, {@code pattern[2]}, and so on. {@link #keys(String)} lists
 * child keys in declaration order using the same convention.
 */
public interface RollupConfiguration {

    boolean has(String key);

    /**
     * Child keys of {@code key}, in declaration order. Empty for leaves and missing keys.
     */
    List<String> keys(String key);

    /**
     * @throws IllegalArgumentException if the key is missing or not a scalar
     */
    String getString(String key);

    default String getString(String key, String defaultValue) {
        return has(key) ? getString(key) : defaultValue;
    }

    /**
     * @throws IllegalArgumentException if the key is missing or not an unsigned 32-bit integer
     */
    long getUnsignedInt(String key);
}

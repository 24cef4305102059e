/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which metric paths a pattern applies to.
 */
public enum RuleType {
    /** Any path, plain or tagged. */
    ALL("all"),
    /** Plain paths only ({@code a.b.c}). */
    PLAIN("plain"),
    /**
     * Tagged paths, matched with a regular expression against the whole path.
     *
     * <p>A tag-spec such as {@code name; env=prod; dc=eu} is rewritten into a regex that
     * expects the tags in key order. Tagged paths are required to carry their tags sorted
     * lexicographically by key: {@code cpu?dc=eu&env=prod} matches the spec above,
     * {@code cpu?env=prod&dc=eu} does not.
     */
    TAGGED("tagged"),
    /** Tagged paths, matched term by term against the decomposed tags. */
    TAGGED_MAP("tagged_map");

    private final String configName;

    RuleType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<RuleType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.configName.equals(name))
                .findFirst();
    }
}

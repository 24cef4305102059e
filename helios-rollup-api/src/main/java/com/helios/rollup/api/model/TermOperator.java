/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators of a tagged_map term.
 */
public enum TermOperator {
    EQ("="),
    MATCH("=~"),
    NE("!="),
    NOT_MATCH("!=~");

    private final String symbol;

    TermOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean usesRegex() {
        return this == MATCH || this == NOT_MATCH;
    }

    public static Optional<TermOperator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }
}

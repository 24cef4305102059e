/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

import com.helios.rollup.api.spi.CompiledRegex;

import java.util.Objects;

/**
 * A single tag predicate of a tagged_map pattern.
 *
 * @param operator comparison operator
 * @param value    literal value, or the regex source for MATCH / NOT_MATCH
 * @param regex    compiled value, present only for MATCH / NOT_MATCH
 */
public record TaggedTerm(TermOperator operator, String value, CompiledRegex regex) {

    public TaggedTerm {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (operator.usesRegex() && regex == null) {
            throw new IllegalArgumentException("Operator " + operator.symbol() + " requires a compiled regex");
        }
        if (!operator.usesRegex() && regex != null) {
            throw new IllegalArgumentException("Operator " + operator.symbol() + " does not take a regex");
        }
    }

    public static TaggedTerm literal(TermOperator operator, String value) {
        return new TaggedTerm(operator, value, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaggedTerm other)) return false;
        return operator == other.operator && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, value);
    }

    @Override
    public String toString() {
        return operator.symbol() + value;
    }
}

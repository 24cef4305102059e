/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

/**
 * What a pattern contributes to a rollup rule, derived from which of
 * function and retentions it declares.
 */
public enum PatternKind {
    /** Retentions only, no function. */
    RETENTION,
    /** Function only, no retentions. */
    AGGREGATION,
    /** Both function and retentions. */
    BOTH;

    public static PatternKind of(boolean hasFunction, boolean hasRetentions) {
        if (hasFunction && hasRetentions) {
            return BOTH;
        }
        if (hasFunction) {
            return AGGREGATION;
        }
        if (hasRetentions) {
            return RETENTION;
        }
        throw new IllegalArgumentException("A pattern needs a function or retentions");
    }
}

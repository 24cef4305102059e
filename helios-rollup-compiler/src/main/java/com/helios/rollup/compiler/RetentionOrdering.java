/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler;

import com.helios.rollup.api.exceptions.CompilationException;
import com.helios.rollup.api.exceptions.CompilationException.ErrorCode;
import com.helios.rollup.api.model.Retention;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders retention steps by age descending and checks that precision grows with age.
 *
 * <p>Retentions are never reordered to make an inconsistent schedule valid: pairs such
 * as {@code 0:60} and {@code 100:30} are rejected.
 */
final class RetentionOrdering {

    private RetentionOrdering() {
    }

    static List<Retention> sortDescending(List<Retention> retentions, String element) {
        List<Retention> sorted = new ArrayList<>(retentions);
        sorted.sort(Comparator.comparingLong(Retention::age).reversed());
        for (int i = 1; i < sorted.size(); i++) {
            Retention older = sorted.get(i - 1);
            Retention younger = sorted.get(i);
            if (older.age() <= younger.age() || older.precision() <= younger.precision()) {
                throw new CompilationException(ErrorCode.INCONSISTENT_RETENTION_ORDERING,
                        "age and precision should only grow up: "
                                + older.age() + ":" + older.precision() + " vs "
                                + younger.age() + ":" + younger.precision() + " in " + element);
            }
        }
        return sorted;
    }
}

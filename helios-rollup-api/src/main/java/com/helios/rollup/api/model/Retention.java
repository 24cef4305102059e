/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

/**
 * One step of a retention schedule: once data is at least {@code age} seconds old,
 * its timestamps are rounded to {@code precision} seconds.
 *
 * <p>Both values are unsigned 32-bit quantities held in a {@code long}.
 */
public record Retention(long age, long precision) {

    public static final long MAX_SECONDS = 0xFFFF_FFFFL;

    public Retention {
        if (age < 0 || age > MAX_SECONDS) {
            throw new IllegalArgumentException("age out of range: " + age);
        }
        if (precision < 0 || precision > MAX_SECONDS) {
            throw new IllegalArgumentException("precision out of range: " + precision);
        }
    }

    @Override
    public String toString() {
        return "{ age = " + age + ", precision = " + precision + " }";
    }
}

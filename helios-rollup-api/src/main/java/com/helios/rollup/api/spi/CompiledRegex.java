/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.spi;

/**
 * A compiled regular expression. Implementations must be immutable and safe to use
 * from many threads.
 */
public interface CompiledRegex {

    /**
     * Returns true if the expression matches anywhere in {@code text}. Anchors
     * ({@code ^}, {@code $}) must be written into the expression.
     */
    boolean matches(CharSequence text);

    String source();
}

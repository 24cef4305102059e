/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.spi;

/**
 * Compiles regular expressions for path and tag matching.
 */
public interface RegexEngine {

    /**
     * @throws IllegalArgumentException if {@code pattern} is not a valid expression
     */
    CompiledRegex compile(String pattern);
}

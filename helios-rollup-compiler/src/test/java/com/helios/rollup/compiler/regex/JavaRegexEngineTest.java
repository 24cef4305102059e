/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.regex;

import com.helios.rollup.api.spi.CompiledRegex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaRegexEngineTest {

    private final JavaRegexEngine engine = new JavaRegexEngine();

    @Test
    @DisplayName("Should search anywhere in the input unless anchored")
    void shouldUseSearchSemantics() {
        CompiledRegex suffix = engine.compile("\\.sum$");
        assertThat(suffix.matches("test.sum")).isTrue();
        assertThat(suffix.matches("test.sum.rate")).isFalse();

        CompiledRegex unanchored = engine.compile("cpu");
        assertThat(unanchored.matches("servers.host1.cpu.user")).isTrue();
        assertThat(unanchored.source()).isEqualTo("cpu");
    }

    @Test
    @DisplayName("Should report syntax errors as IllegalArgumentException")
    void shouldRejectBadSyntax() {
        assertThatThrownBy(() -> engine.compile("(unclosed"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

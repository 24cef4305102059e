/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.functions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateFunctionSpecTest {

    @Test
    @DisplayName("Should parse plain names and parameter lists")
    void shouldParse() {
        assertThat(AggregateFunctionSpec.parse(" sum ")).isEqualTo(new AggregateFunctionSpec("sum", java.util.List.of()));
        assertThat(AggregateFunctionSpec.parse("avg()").parameters()).isEmpty();

        AggregateFunctionSpec topK = AggregateFunctionSpec.parse("topK( 10 , 'x')");
        assertThat(topK.name()).isEqualTo("topK");
        assertThat(topK.parameters()).containsExactly("10", "'x'");
        assertThat(topK).hasToString("topK(10, 'x')");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1sum", "sum(", "sum)", "sum(1))", "sum(1,)", "su m"})
    @DisplayName("Should reject malformed function expressions")
    void shouldRejectMalformed(String text) {
        assertThatThrownBy(() -> AggregateFunctionSpec.parse(text))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

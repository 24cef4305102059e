/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRollupConfigurationTest {

    private JsonRollupConfiguration config;

    @BeforeEach
    void setUp() throws Exception {
        config = JsonRollupConfiguration.parse("""
                {
                  "graphite_rollup": {
                    "path_column_name": "metric",
                    "pattern": [
                      { "regexp": "a", "retention": [ { "age": 0, "precision": 60 }, { "age": "3600", "precision": 300 } ] },
                      { "regexp": "b", "function": "sum" }
                    ],
                    "default": { "function": "avg", "retention": { "age": 4294967296, "precision": 1.5 } }
                  }
                }
                """, new ObjectMapper());
    }

    @Test
    @DisplayName("Should list children in order with repeated elements indexed")
    void shouldListKeys() {
        assertThat(config.keys("graphite_rollup"))
                .containsExactly("path_column_name", "pattern", "pattern[1]", "default");
        assertThat(config.keys("graphite_rollup.pattern")).containsExactly("regexp", "retention", "retention[1]");
        assertThat(config.keys("graphite_rollup.pattern[1]")).containsExactly("regexp", "function");
        assertThat(config.keys("graphite_rollup.path_column_name")).isEmpty();
        assertThat(config.keys("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should resolve dotted keys with indexes")
    void shouldResolveKeys() {
        assertThat(config.has("graphite_rollup.pattern[1].function")).isTrue();
        assertThat(config.has("graphite_rollup.pattern[2]")).isFalse();
        assertThat(config.has("graphite_rollup.default[1]")).isFalse();
        assertThat(config.getString("graphite_rollup.pattern[1].function")).isEqualTo("sum");
        assertThat(config.getString("graphite_rollup.default.function")).isEqualTo("avg");
        assertThat(config.getString("graphite_rollup.default.retention[0].precision", "none")).isEqualTo("1.5");
        assertThat(config.getString("graphite_rollup.value_column_name", "Value")).isEqualTo("Value");
    }

    @Test
    @DisplayName("Should read unsigned integers from numbers and numeric text")
    void shouldReadUnsignedInts() {
        assertThat(config.getUnsignedInt("graphite_rollup.pattern.retention.age")).isZero();
        assertThat(config.getUnsignedInt("graphite_rollup.pattern.retention[1].age")).isEqualTo(3600L);
    }

    @Test
    @DisplayName("Should reject values that are not unsigned 32-bit integers")
    void shouldRejectBadUnsignedInts() {
        assertThatThrownBy(() -> config.getUnsignedInt("graphite_rollup.default.retention.age"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of unsigned 32-bit range");
        assertThatThrownBy(() -> config.getUnsignedInt("graphite_rollup.default.retention.precision"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not an integer");
        assertThatThrownBy(() -> config.getUnsignedInt("graphite_rollup.pattern.regexp"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject reading a section as a string")
    void shouldRejectNonScalarString() {
        assertThatThrownBy(() -> config.getString("graphite_rollup.default"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a scalar value");
        assertThatThrownBy(() -> config.getString("graphite_rollup.nothing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing configuration key");
    }
}

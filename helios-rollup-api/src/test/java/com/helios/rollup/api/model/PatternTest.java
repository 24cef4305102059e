/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

import com.helios.rollup.api.spi.AggregateFunction;
import com.helios.rollup.api.spi.CompiledRegex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PatternTest {

    private static AggregateFunction function(String name) {
        AggregateFunction function = mock(AggregateFunction.class);
        when(function.name()).thenReturn(name);
        return function;
    }

    @Test
    @DisplayName("Should derive the kind from function and retentions")
    void shouldDeriveKind() {
        CompiledRegex regex = mock(CompiledRegex.class);

        Pattern aggregation = Pattern.builder().regexSource("x").regex(regex).function(function("sum")).build();
        Pattern retention = Pattern.builder().regexSource("x").regex(regex).retention(new Retention(0, 60)).build();
        Pattern both = Pattern.builder().function(function("avg")).retention(new Retention(0, 60)).build();

        assertThat(aggregation.kind()).isEqualTo(PatternKind.AGGREGATION);
        assertThat(aggregation.hasRetention()).isFalse();
        assertThat(retention.kind()).isEqualTo(PatternKind.RETENTION);
        assertThat(retention.hasAggregation()).isFalse();
        assertThat(retention.functionName()).isEmpty();
        assertThat(both.kind()).isEqualTo(PatternKind.BOTH);
        assertThat(both.isDefault()).isTrue();
        assertThat(both.ruleType()).isEqualTo(RuleType.ALL);
    }

    @Test
    @DisplayName("Should reject patterns without a body or matcher")
    void shouldRejectIncompletePatterns() {
        assertThatThrownBy(() -> Pattern.builder().regexSource("x").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Pattern.builder().regexSource("x").function(function("sum")).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("has no compiled regex");
        assertThatThrownBy(() -> Pattern.builder().ruleType(RuleType.TAGGED_MAP).regexSource("env=prod")
                .function(function("sum")).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("has no terms");
    }

    @Test
    @DisplayName("Should compare by rule type, source, function name and retentions")
    void shouldCompareByValue() {
        Pattern first = Pattern.builder().regexSource("x").regex(mock(CompiledRegex.class))
                .function(function("sum")).build();
        Pattern second = Pattern.builder().regexSource("x").regex(mock(CompiledRegex.class))
                .function(function("sum")).build();
        Pattern tagged = Pattern.builder().ruleType(RuleType.TAGGED).regexSource("x").regex(mock(CompiledRegex.class))
                .function(function("sum")).build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(tagged);
        assertThat(first).hasToString("{ rule_type = all, regexp = 'x', function = sum }");
    }

    @Test
    @DisplayName("Should build rollup rules only from matching slots")
    void shouldValidateRollupRules() {
        Pattern aggregation = Pattern.builder().regexSource("x").regex(mock(CompiledRegex.class))
                .function(function("sum")).build();
        Pattern retention = Pattern.builder().regexSource("y").regex(mock(CompiledRegex.class))
                .retention(new Retention(0, 60)).build();

        RollupRule rule = new RollupRule(retention, aggregation);
        assertThat(rule.isMatched()).isTrue();

        assertThatThrownBy(() -> new RollupRule(aggregation, retention))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollupRule(retention, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Both slots must be set or both empty");
        assertThatThrownBy(() -> RollupRule.of(aggregation))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep retention values within unsigned 32-bit range")
    void shouldValidateRetentions() {
        assertThat(new Retention(Retention.MAX_SECONDS, 1)).hasToString("{ age = 4294967295, precision = 1 }");
        assertThatThrownBy(() -> new Retention(-1, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Retention(0, Retention.MAX_SECONDS + 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should resolve rule types and term operators by their config names")
    void shouldResolveNames() {
        assertThat(RuleType.fromConfigName("tagged_map")).contains(RuleType.TAGGED_MAP);
        assertThat(RuleType.fromConfigName("TAGGED")).isEmpty();
        assertThat(TermOperator.fromSymbol("!=~")).contains(TermOperator.NOT_MATCH);
        assertThat(TermOperator.fromSymbol("=~").map(TermOperator::usesRegex)).contains(true);
        assertThat(TermOperator.fromSymbol("==")).isEmpty();
    }
}

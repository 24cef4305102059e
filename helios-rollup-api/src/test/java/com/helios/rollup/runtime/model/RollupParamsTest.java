/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.model;

import com.helios.rollup.api.model.Pattern;
import com.helios.rollup.api.model.Retention;
import com.helios.rollup.api.model.RuleType;
import com.helios.rollup.api.model.TaggedTerm;
import com.helios.rollup.api.model.TermOperator;
import com.helios.rollup.api.spi.AggregateFunction;
import com.helios.rollup.api.spi.CompiledRegex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RollupParamsTest {

    private final AggregateFunction sum = mock(AggregateFunction.class);

    {
        when(sum.name()).thenReturn("sum");
    }

    private Pattern pattern(RuleType type, String source) {
        Pattern.Builder builder = Pattern.builder().ruleType(type).regexSource(source).function(sum);
        if (type == RuleType.TAGGED_MAP) {
            builder.taggedTerm("env", TaggedTerm.literal(TermOperator.EQ, "prod"));
        } else {
            builder.regex(mock(CompiledRegex.class));
        }
        return builder.build();
    }

    private final Pattern fallback = Pattern.builder().function(sum).retention(new Retention(0, 60)).build();

    @Test
    @DisplayName("Should leave buckets empty for untyped configs")
    void shouldNotBucketUntypedConfig() {
        RollupParams params = RollupParams.builder("graphite_rollup")
                .addPattern(pattern(RuleType.ALL, "a"))
                .addPattern(fallback)
                .build();

        assertThat(params.isTyped()).isFalse();
        assertThat(params.patterns()).hasSize(2);
        assertThat(params.plainPatterns()).isEmpty();
        assertThat(params.taggedPatterns()).isEmpty();
    }

    @Test
    @DisplayName("Should put all-type patterns in both buckets of a typed config, in order")
    void shouldBucketTypedConfig() {
        Pattern all = pattern(RuleType.ALL, "all");
        Pattern plain = pattern(RuleType.PLAIN, "plain");
        Pattern tagged = pattern(RuleType.TAGGED, "tagged");
        Pattern taggedMap = pattern(RuleType.TAGGED_MAP, "env=prod");

        RollupParams params = RollupParams.builder("graphite_rollup")
                .addPattern(all)
                .addPattern(tagged)
                .addPattern(plain)
                .addPattern(taggedMap)
                .addPattern(fallback)
                .build();

        assertThat(params.isTyped()).isTrue();
        assertThat(params.hasTaggedMapPatterns()).isTrue();
        assertThat(params.plainPatterns()).containsExactly(all, plain, fallback);
        assertThat(params.taggedPatterns()).containsExactly(all, tagged, taggedMap, fallback);
        assertThat(params.pathColumnName()).isEqualTo(RollupParams.DEFAULT_PATH_COLUMN);
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.compiler.RollupCompiler;
import com.helios.rollup.compiler.config.JsonRollupConfiguration;
import com.helios.rollup.runtime.evaluation.RuleSelector;
import com.helios.rollup.runtime.model.RollupParams;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CachingRuleSelectorIntegrationTest {

    @Test
    @DisplayName("Should return the same rules as the uncached selector")
    void shouldAgreeWithUncachedSelector() throws Exception {
        RollupParams params = new RollupCompiler(OpenTelemetry.noop().getTracer("test")).compile(
                JsonRollupConfiguration.parse("""
                        {
                          "graphite_rollup": {
                            "pattern": [
                              { "rule_type": "plain", "regexp": "[.]sum$", "function": "sum" },
                              { "rule_type": "tagged", "regexp": "cpu;env=prod", "function": "max" }
                            ],
                            "default": { "function": "avg", "retention": [ { "age": 0, "precision": 60 } ] }
                          }
                        }
                        """, new ObjectMapper()),
                RollupCompiler.DEFAULT_CONFIG_ELEMENT);
        RuleSelector direct = new RuleSelector(params);
        CachingRuleSelector cached = CachingRuleSelector.builder(new RuleSelector(params))
                .maxSize(16)
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .build();

        for (String path : List.of("a.sum", "cpu?dc=east&env=prod", "cpu?env=dev", "a.max", "a.sum")) {
            RollupRule expected = direct.select(path);
            assertThat(cached.select(path)).as(path).isEqualTo(expected);
        }
        assertThat(cached.select("cpu?dc=east&env=prod").aggregation().functionName()).isEqualTo("max");
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.cache;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.rollup.api.IRuleSelector;
import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.runtime.model.RollupParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;


import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingRuleSelectorTest {

    @Mock
    private IRuleSelector delegate;

    private final RollupParams params = RollupParams.builder("graphite_rollup").build();

    @BeforeEach
    void setUp() {
        when(delegate.getParams()).thenReturn(params);
    }

    @Test
    @DisplayName("Should call the delegate once per distinct path")
    void shouldCacheSelections() {
        when(delegate.select("a.sum")).thenReturn(RollupRule.NONE);
        when(delegate.select("b.sum")).thenReturn(RollupRule.NONE);
        CachingRuleSelector selector = CachingRuleSelector.builder(delegate).recordStats(true).build();

        for (int i = 0; i < 5; i++) {
            assertThat(selector.select("a.sum")).isSameAs(RollupRule.NONE);
        }
        selector.select("b.sum");

        verify(delegate, times(1)).select("a.sum");
        verify(delegate, times(1)).select("b.sum");
        CacheStats stats = selector.stats();
        assertThat(stats.hitCount()).isEqualTo(4);
        assertThat(stats.missCount()).isEqualTo(2);
        assertThat(selector.estimatedSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should consult the delegate again after invalidation")
    void shouldReloadAfterInvalidation() {
        when(delegate.select("a.sum")).thenReturn(RollupRule.NONE);
        CachingRuleSelector selector = CachingRuleSelector.builder(delegate).build();

        selector.select("a.sum");
        selector.invalidateAll();
        selector.select("a.sum");

        verify(delegate, times(2)).select("a.sum");
        assertThat(selector.stats()).isEqualTo(CacheStats.empty());
        assertThat(selector.getParams()).isSameAs(params);
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.rollup.api.IRuleSelector;
import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.runtime.model.RollupParams;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Memoizes rule selection per path using Caffeine.
 *
 * <p>A merge pass asks for the rule of every distinct path, and the same paths come
 * back on every merge of the table. Results only depend on the bound params, so a
 * cache instance is tied to one params snapshot and must be replaced together with it.
 *
 * USAGE:
 * <pre>
 * IRuleSelector selector = CachingRuleSelector.builder(new RuleSelector(params))
 *         .maxSize(100_000)
 *         .recordStats(true)
 *         .build();
 * </pre>
 */
public final class CachingRuleSelector implements IRuleSelector {
    private static final Logger logger = Logger.getLogger(CachingRuleSelector.class.getName());

    private final IRuleSelector delegate;
    private final Cache<String, RollupRule> cache;
    private final boolean statsEnabled;

    private CachingRuleSelector(Builder builder) {
        this.delegate = builder.delegate;
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();

        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }

        if (builder.expireAfterAccessDuration > 0) {
            cacheBuilder.expireAfterAccess(builder.expireAfterAccessDuration, builder.expireAfterAccessUnit);
        }

        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }

        this.cache = cacheBuilder.build();

        logger.info(String.format(
                "CachingRuleSelector initialized for '%s': maxSize=%d, stats=%b",
                delegate.getParams().configName(), builder.maxSize, builder.recordStats
        ));
    }

    public static Builder builder(IRuleSelector delegate) {
        return new Builder(delegate);
    }

    @Override
    public RollupRule select(String path) {
        return cache.get(path, delegate::select);
    }

    @Override
    public RollupParams getParams() {
        return delegate.getParams();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return statsEnabled ? cache.stats() : CacheStats.empty();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public static final class Builder {
        private final IRuleSelector delegate;
        private long maxSize = 100_000;
        private long expireAfterAccessDuration = 0;
        private TimeUnit expireAfterAccessUnit = TimeUnit.MINUTES;
        private boolean recordStats = false;

        private Builder(IRuleSelector delegate) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder expireAfterAccess(long duration, TimeUnit unit) {
            this.expireAfterAccessDuration = duration;
            this.expireAfterAccessUnit = unit;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CachingRuleSelector build() {
            return new CachingRuleSelector(this);
        }
    }
}

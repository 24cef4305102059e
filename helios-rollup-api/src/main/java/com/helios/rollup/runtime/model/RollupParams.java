/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.model;

import com.helios.rollup.api.model.Pattern;
import com.helios.rollup.api.model.RuleType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compiled rollup configuration of one table.
 *
 * <p>Built once and never mutated afterwards, so any number of compaction threads may
 * select rules against the same instance without locking.
 *
 * <h2>Precedence</h2>
 * <p>{@link #patterns()} keeps configuration order, which is the precedence order used
 * by rule selection. The default pattern, if declared, is always last.
 *
 * <h2>Buckets</h2>
 * <p>When any pattern has a rule type other than {@link RuleType#ALL} the params are
 * <i>typed</i>: plain paths are matched against {@link #plainPatterns()} and tagged paths
 * against {@link #taggedPatterns()}. ALL patterns appear in both buckets at their
 * configuration position. The buckets hold the same {@link Pattern} instances as
 * {@link #patterns()}.
 */
public final class RollupParams {

    public static final String DEFAULT_PATH_COLUMN = "Path";
    public static final String DEFAULT_TIME_COLUMN = "Time";
    public static final String DEFAULT_VALUE_COLUMN = "Value";
    public static final String DEFAULT_VERSION_COLUMN = "Timestamp";

    private final String configName;
    private final String pathColumnName;
    private final String timeColumnName;
    private final String valueColumnName;
    private final String versionColumnName;

    private final List<Pattern> patterns;
    private final List<Pattern> plainPatterns;
    private final List<Pattern> taggedPatterns;
    private final boolean typed;
    private final boolean hasTaggedMapPatterns;

    private RollupParams(Builder builder) {
        this.configName = builder.configName;
        this.pathColumnName = builder.pathColumnName;
        this.timeColumnName = builder.timeColumnName;
        this.valueColumnName = builder.valueColumnName;
        this.versionColumnName = builder.versionColumnName;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(builder.patterns));
        this.typed = patterns.stream().anyMatch(p -> p.ruleType() != RuleType.ALL);
        this.hasTaggedMapPatterns = patterns.stream().anyMatch(p -> p.ruleType() == RuleType.TAGGED_MAP);

        List<Pattern> plain = new ArrayList<>();
        List<Pattern> tagged = new ArrayList<>();
        for (Pattern pattern : patterns) {
            switch (pattern.ruleType()) {
                case ALL -> {
                    if (typed) {
                        plain.add(pattern);
                        tagged.add(pattern);
                    }
                }
                case PLAIN -> plain.add(pattern);
                case TAGGED, TAGGED_MAP -> tagged.add(pattern);
            }
        }
        this.plainPatterns = Collections.unmodifiableList(plain);
        this.taggedPatterns = Collections.unmodifiableList(tagged);
    }

    public static Builder builder(String configName) {
        return new Builder(configName);
    }

    public String configName() {
        return configName;
    }

    public String pathColumnName() {
        return pathColumnName;
    }

    public String timeColumnName() {
        return timeColumnName;
    }

    public String valueColumnName() {
        return valueColumnName;
    }

    public String versionColumnName() {
        return versionColumnName;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    public List<Pattern> plainPatterns() {
        return plainPatterns;
    }

    public List<Pattern> taggedPatterns() {
        return taggedPatterns;
    }

    public boolean isTyped() {
        return typed;
    }

    public boolean hasTaggedMapPatterns() {
        return hasTaggedMapPatterns;
    }

    @Override
    public String toString() {
        return "RollupParams{config=" + configName
                + ", patterns=" + patterns.size()
                + ", typed=" + typed
                + ", taggedMap=" + hasTaggedMapPatterns + "}";
    }

    public static final class Builder {
        private final String configName;
        private String pathColumnName = DEFAULT_PATH_COLUMN;
        private String timeColumnName = DEFAULT_TIME_COLUMN;
        private String valueColumnName = DEFAULT_VALUE_COLUMN;
        private String versionColumnName = DEFAULT_VERSION_COLUMN;
        private final List<Pattern> patterns = new ArrayList<>();

        private Builder(String configName) {
            this.configName = Objects.requireNonNull(configName, "configName");
        }

        public Builder pathColumnName(String name) {
            this.pathColumnName = Objects.requireNonNull(name);
            return this;
        }

        public Builder timeColumnName(String name) {
            this.timeColumnName = Objects.requireNonNull(name);
            return this;
        }

        public Builder valueColumnName(String name) {
            this.valueColumnName = Objects.requireNonNull(name);
            return this;
        }

        public Builder versionColumnName(String name) {
            this.versionColumnName = Objects.requireNonNull(name);
            return this;
        }

        public Builder addPattern(Pattern pattern) {
            this.patterns.add(Objects.requireNonNull(pattern));
            return this;
        }

        public int patternCount() {
            return patterns.size();
        }

        public RollupParams build() {
            return new RollupParams(this);
        }
    }
}

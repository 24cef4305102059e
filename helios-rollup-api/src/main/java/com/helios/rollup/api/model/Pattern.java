/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

import com.helios.rollup.api.spi.AggregateFunction;
import com.helios.rollup.api.spi.CompiledRegex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled rollup pattern: a path matcher plus the function and/or retention
 * schedule it assigns.
 *
 * <p>A pattern with an empty regexp source is a default (catch-all) pattern and matches
 * every path of the candidate list it sits in. Instances are immutable and owned by
 * the {@link com.helios.rollup.runtime.model.RollupParams} they were compiled into.
 *
 * <p>{@link #equals(Object)} compares configuration values (kind, rule type, regexp
 * source, function name, retentions), not identity. Rollup rules always reference the
 * params-owned instances, so identity comparison is available where needed.
 */
public final class Pattern {

    private final RuleType ruleType;
    private final String regexSource;
    private final CompiledRegex regex;
    private final Map<String, TaggedTerm> taggedMap;
    private final AggregateFunction function;
    private final List<Retention> retentions;
    private final PatternKind kind;

    private Pattern(Builder builder) {
        this.ruleType = builder.ruleType;
        this.regexSource = builder.regexSource;
        this.regex = builder.regex;
        this.taggedMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.taggedMap));
        this.function = builder.function;
        this.retentions = List.copyOf(builder.retentions);
        this.kind = PatternKind.of(function != null, !retentions.isEmpty());

        if (!isDefault()) {
            if (ruleType == RuleType.TAGGED_MAP && taggedMap.isEmpty()) {
                throw new IllegalStateException("tagged_map pattern '" + regexSource + "' has no terms");
            }
            if (ruleType != RuleType.TAGGED_MAP && regex == null) {
                throw new IllegalStateException("pattern '" + regexSource + "' has no compiled regex");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public RuleType ruleType() {
        return ruleType;
    }

    /**
     * Effective regexp source. For tag-spec {@link RuleType#TAGGED} patterns this is the
     * rewritten regex; for {@link RuleType#TAGGED_MAP} the whitespace-stripped term list.
     */
    public String regexSource() {
        return regexSource;
    }

    public CompiledRegex regex() {
        return regex;
    }

    public Map<String, TaggedTerm> taggedMap() {
        return taggedMap;
    }

    public AggregateFunction function() {
        return function;
    }

    /** Retention steps, ordered by age descending. */
    public List<Retention> retentions() {
        return retentions;
    }

    public PatternKind kind() {
        return kind;
    }

    public boolean isDefault() {
        return regexSource.isEmpty();
    }

    public boolean hasRetention() {
        return kind != PatternKind.AGGREGATION;
    }

    public boolean hasAggregation() {
        return kind != PatternKind.RETENTION;
    }

    public String functionName() {
        return function == null ? "" : function.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern other)) return false;
        return kind == other.kind
                && ruleType == other.ruleType
                && regexSource.equals(other.regexSource)
                && functionName().equals(other.functionName())
                && retentions.equals(other.retentions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ruleType, regexSource, functionName(), retentions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ rule_type = ").append(ruleType.configName());
        if (!regexSource.isEmpty()) {
            sb.append(", regexp = '").append(regexSource).append('\'');
        }
        if (function != null) {
            sb.append(", function = ").append(function.name());
        }
        if (!retentions.isEmpty()) {
            sb.append(", retentions = ").append(retentions);
        }
        return sb.append(" }").toString();
    }

    public static final class Builder {
        private RuleType ruleType = RuleType.ALL;
        private String regexSource = "";
        private CompiledRegex regex;
        private final Map<String, TaggedTerm> taggedMap = new LinkedHashMap<>();
        private AggregateFunction function;
        private final List<Retention> retentions = new ArrayList<>();

        private Builder() {
        }

        public Builder ruleType(RuleType ruleType) {
            this.ruleType = Objects.requireNonNull(ruleType, "ruleType");
            return this;
        }

        public Builder regexSource(String regexSource) {
            this.regexSource = regexSource == null ? "" : regexSource;
            return this;
        }

        public Builder regex(CompiledRegex regex) {
            this.regex = regex;
            return this;
        }

        public Builder taggedTerm(String key, TaggedTerm term) {
            this.taggedMap.put(key, term);
            return this;
        }

        public Builder function(AggregateFunction function) {
            this.function = function;
            return this;
        }

        public Builder retention(Retention retention) {
            this.retentions.add(retention);
            return this;
        }

        public Builder retentions(List<Retention> retentions) {
            this.retentions.clear();
            this.retentions.addAll(retentions);
            return this;
        }

        public Pattern build() {
            return new Pattern(this);
        }
    }
}

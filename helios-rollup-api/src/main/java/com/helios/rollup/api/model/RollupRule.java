/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.model;

/**
 * The outcome of rule selection for one metric path: the pattern whose retentions
 * apply and the pattern whose aggregate function applies. Both may be the same
 * pattern.
 *
 * <p>{@link #NONE} means no rule applies; with a trailing default pattern in the
 * configuration it is never returned.
 *
 * @param retention   pattern providing the retention schedule, or null
 * @param aggregation pattern providing the aggregate function, or null
 */
public record RollupRule(Pattern retention, Pattern aggregation) {

    public static final RollupRule NONE = new RollupRule(null, null);

    public RollupRule {
        if ((retention == null) != (aggregation == null)) {
            throw new IllegalArgumentException("Both slots must be set or both empty");
        }
        if (retention != null && !retention.hasRetention()) {
            throw new IllegalArgumentException("Pattern without retentions in retention slot: " + retention);
        }
        if (aggregation != null && !aggregation.hasAggregation()) {
            throw new IllegalArgumentException("Pattern without function in aggregation slot: " + aggregation);
        }
    }

    public static RollupRule of(Pattern pattern) {
        return new RollupRule(pattern, pattern);
    }

    public boolean isMatched() {
        return retention != null;
    }
}

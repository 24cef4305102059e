/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.evaluation;

import com.helios.rollup.api.IRuleSelector;
import com.helios.rollup.api.model.Pattern;
import com.helios.rollup.api.model.PatternKind;
import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.runtime.context.ClassifiedPath;
import com.helios.rollup.runtime.context.PathClassifier;
import com.helios.rollup.runtime.model.RollupParams;
import com.helios.rollup.runtime.operators.TaggedTermEvaluator;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Selects the rollup rule of a metric path.
 *
 * <p>The candidate list depends on the params: untyped params scan every pattern;
 * typed params scan the plain list for plain paths and the tagged list for tagged
 * paths. Tagged paths are decomposed into tags only when the params contain
 * tagged_map patterns; every other pattern matches its regex against the raw path.
 *
 * <p>The scan keeps at most one partial match (retention-only or aggregation-only):
 * <ul>
 *   <li>a matching pattern with both function and retentions is returned for both
 *       slots at once;</li>
 *   <li>the first partial match is held, and the first later match of the other kind
 *       completes the rule;</li>
 *   <li>a default pattern completes a held partial match of the other kind, or, with
 *       nothing held, is returned for both slots if it declares both.</li>
 * </ul>
 *
 * <p>Stateless apart from the bound params; safe for concurrent use.
 */
public final class RuleSelector implements IRuleSelector {
    private static final Logger logger = Logger.getLogger(RuleSelector.class.getName());

    private final RollupParams params;

    public RuleSelector(RollupParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    @Override
    public RollupParams getParams() {
        return params;
    }

    @Override
    public RollupRule select(String path) {
        return select(params, path);
    }

    public static RollupRule select(RollupParams params, String path) {
        List<Pattern> candidates = params.patterns();
        ClassifiedPath classified = null;
        if (params.isTyped()) {
            if (!PathClassifier.isTagged(path)) {
                candidates = params.plainPatterns();
            } else {
                candidates = params.taggedPatterns();
                if (params.hasTaggedMapPatterns()) {
                    classified = PathClassifier.classify(path);
                }
            }
        }

        Pattern held = null;
        for (Pattern pattern : candidates) {
            if (pattern.isDefault()) {
                if (held == null) {
                    if (pattern.kind() == PatternKind.BOTH) {
                        return RollupRule.of(pattern);
                    }
                } else if (pattern.kind() != held.kind()) {
                    return combine(held, pattern);
                }
                continue;
            }

            if (!matches(pattern, path, classified)) {
                continue;
            }
            if (pattern.kind() == PatternKind.BOTH) {
                return RollupRule.of(pattern);
            }
            if (held == null) {
                held = pattern;
            } else if (pattern.kind() != held.kind()) {
                return combine(held, pattern);
            }
        }

        logger.fine(() -> "No rollup rule for path '" + path + "' in " + params.configName());
        return RollupRule.NONE;
    }

    private static boolean matches(Pattern pattern, String path, ClassifiedPath classified) {
        return switch (pattern.ruleType()) {
            case TAGGED_MAP -> classified != null
                    && TaggedTermEvaluator.matchTagMap(classified.matchableTags(), pattern.taggedMap());
            case ALL, PLAIN, TAGGED -> pattern.regex().matches(path);
        };
    }

    /**
     * Completes a held partial match with a pattern of another kind. The held pattern
     * keeps its slot; the other pattern fills the remaining one.
     */
    private static RollupRule combine(Pattern held, Pattern other) {
        return switch (held.kind()) {
            case RETENTION -> new RollupRule(held, other);
            case AGGREGATION -> new RollupRule(other, held);
            case BOTH -> throw new IllegalStateException("Complete pattern held as partial match: " + held);
        };
    }
}

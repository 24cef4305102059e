/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.analysis;

import com.helios.rollup.api.model.Pattern;
import com.helios.rollup.api.model.PatternKind;
import com.helios.rollup.runtime.model.RollupParams;

import java.util.ArrayList;
import java.util.List;

/**
 * Analyzes compiled params for precedence mistakes.
 *
 * <p>Rule selection is order-sensitive and silently ignores patterns that can never
 * win. This analyzer walks each candidate list the selector uses and reports:
 * <ul>
 *   <li>{@code UNREACHABLE} - the pattern sits after a catch-all pattern that declares
 *       both function and retentions, so the scan never gets to it</li>
 *   <li>{@code SHADOWED} - an earlier pattern with the same rule type and regexp
 *       always wins over it</li>
 *   <li>{@code NO_DEFAULT} - the list has no catch-all pattern, paths matching nothing
 *       get no rollup rule</li>
 *   <li>{@code DEFAULT_INCOMPLETE} - the catch-all only declares a function or only
 *       retentions, so paths matching nothing still get no rollup rule</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * RollupParams params = compiler.compile(configPath);
 * OrderingReport report = new PatternOrderAnalyzer().analyze(params);
 * report.findings().forEach(f -> System.out.println(f.message()));
 * </pre>
 */
public class PatternOrderAnalyzer {

    /**
     * Analyzes every candidate list of the params.
     *
     * @param params compiled params
     * @return report, empty when the order is sound
     */
    public OrderingReport analyze(RollupParams params) {
        List<Finding> findings = new ArrayList<>();
        if (params.isTyped()) {
            analyzeList("plain", params.plainPatterns(), findings);
            analyzeList("tagged", params.taggedPatterns(), findings);
        } else {
            analyzeList("all", params.patterns(), findings);
        }
        return new OrderingReport(findings);
    }

    private void analyzeList(String listName, List<Pattern> patterns, List<Finding> findings) {
        Pattern catchAll = null;
        boolean hasDefault = false;
        boolean defaultCoversRetention = false;
        boolean defaultCoversAggregation = false;

        for (int i = 0; i < patterns.size(); i++) {
            Pattern pattern = patterns.get(i);

            if (catchAll != null) {
                findings.add(new Finding(FindingType.UNREACHABLE, listName, i, pattern,
                        "Pattern " + pattern + " in " + listName + " patterns is unreachable after catch-all " + catchAll));
                continue;
            }

            if (pattern.isDefault()) {
                hasDefault = true;
                defaultCoversRetention |= pattern.hasRetention();
                defaultCoversAggregation |= pattern.hasAggregation();
                if (pattern.kind() == PatternKind.BOTH) {
                    catchAll = pattern;
                }
                continue;
            }

            Pattern shadowing = findShadowing(patterns, i);
            if (shadowing != null) {
                findings.add(new Finding(FindingType.SHADOWED, listName, i, pattern,
                        "Pattern " + pattern + " in " + listName + " patterns is shadowed by earlier " + shadowing));
            }
        }

        if (!hasDefault) {
            findings.add(new Finding(FindingType.NO_DEFAULT, listName, -1, null,
                    "No default pattern in " + listName + " patterns: paths matching no pattern get no rollup rule"));
        } else if (!(defaultCoversRetention && defaultCoversAggregation)) {
            findings.add(new Finding(FindingType.DEFAULT_INCOMPLETE, listName, -1, null,
                    "Default pattern in " + listName + " patterns declares only "
                            + (defaultCoversRetention ? "retentions" : "a function")
                            + ": paths matching no pattern get no rollup rule"));
        }
    }

    private static Pattern findShadowing(List<Pattern> patterns, int index) {
        Pattern pattern = patterns.get(index);
        for (int j = 0; j < index; j++) {
            Pattern earlier = patterns.get(j);
            if (earlier.ruleType() == pattern.ruleType()
                    && earlier.regexSource().equals(pattern.regexSource())
                    && (earlier.kind() == PatternKind.BOTH || earlier.kind() == pattern.kind())) {
                return earlier;
            }
        }
        return null;
    }

    public enum FindingType {
        UNREACHABLE,
        SHADOWED,
        NO_DEFAULT,
        DEFAULT_INCOMPLETE
    }

    /**
     * A single precedence finding.
     *
     * @param type     finding type
     * @param listName candidate list the finding applies to ("all", "plain" or "tagged")
     * @param index    position in that list, -1 for list-level findings
     * @param pattern  offending pattern, null for list-level findings
     * @param message  human-readable description
     */
    public record Finding(FindingType type, String listName, int index, Pattern pattern, String message) {
    }

    /**
     * Analysis result.
     *
     * @param findings findings in list order
     */
    public record OrderingReport(List<Finding> findings) {

        public OrderingReport {
            findings = List.copyOf(findings);
        }

        public boolean isClean() {
            return findings.isEmpty();
        }

        public List<Finding> findingsOfType(FindingType type) {
            return findings.stream().filter(f -> f.type() == type).toList();
        }
    }
}

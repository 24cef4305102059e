/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.functions;

import com.helios.rollup.api.spi.AggregateFunction;
import com.helios.rollup.api.spi.AggregateFunctionResolver;

import java.util.List;
import java.util.Map;

/**
 * Catalogue of the aggregate functions commonly used in Graphite rollup configurations.
 *
 * <p>Functions with fixed-size state (sum, avg, min, max, any, ...) are usable in rollup
 * patterns. Functions that keep a growing state in an arena (groupArray, quantile,
 * uniqExact, ...) are listed so that they resolve, and are then rejected by the compiler
 * with a precise error instead of "unknown function".
 */
public final class BuiltinAggregateFunctions implements AggregateFunctionResolver {

    private record Definition(boolean arena, int minParameters, int maxParameters) {
    }

    private static final Map<String, Definition> DEFINITIONS = Map.ofEntries(
            Map.entry("any", new Definition(false, 0, 0)),
            Map.entry("anyLast", new Definition(false, 0, 0)),
            Map.entry("anyHeavy", new Definition(false, 0, 0)),
            Map.entry("min", new Definition(false, 0, 0)),
            Map.entry("max", new Definition(false, 0, 0)),
            Map.entry("sum", new Definition(false, 0, 0)),
            Map.entry("sumWithOverflow", new Definition(false, 0, 0)),
            Map.entry("avg", new Definition(false, 0, 0)),
            Map.entry("count", new Definition(false, 0, 0)),
            Map.entry("median", new Definition(true, 0, 0)),
            Map.entry("quantile", new Definition(true, 0, 1)),
            Map.entry("groupArray", new Definition(true, 0, 1)),
            Map.entry("groupUniqArray", new Definition(true, 0, 1)),
            Map.entry("uniqExact", new Definition(true, 0, 0)),
            Map.entry("topK", new Definition(true, 0, 1))
    );

    /**
     * A resolved function handle.
     */
    public record BuiltinFunction(String name, List<String> parameters, boolean allocatesMemoryInArena)
            implements AggregateFunction {

        public BuiltinFunction {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String toString() {
            return parameters.isEmpty() ? name : name + "(" + String.join(", ", parameters) + ")";
        }
    }

    @Override
    public AggregateFunction resolve(String name, List<String> parameters) {
        Definition definition = DEFINITIONS.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown aggregate function " + name);
        }
        int count = parameters.size();
        if (count < definition.minParameters() || count > definition.maxParameters()) {
            throw new IllegalArgumentException("Aggregate function " + name + " takes "
                    + definition.minParameters() + ".." + definition.maxParameters()
                    + " parameters, got " + count);
        }
        if (name.equals("quantile") && count == 1) {
            checkLevel(name, parameters.get(0));
        }
        return new BuiltinFunction(name, parameters, definition.arena());
    }

    public boolean isKnown(String name) {
        return DEFINITIONS.containsKey(name);
    }

    private static void checkLevel(String name, String parameter) {
        double level;
        try {
            level = Double.parseDouble(parameter);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Aggregate function " + name + " expects a numeric level, got " + parameter, e);
        }
        if (level < 0.0 || level > 1.0) {
            throw new IllegalArgumentException("Aggregate function " + name + " level must be in [0, 1], got " + parameter);
        }
    }
}

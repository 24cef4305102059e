/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A function reference as written in the configuration: {@code sum} or
 * {@code quantile(0.99)}.
 *
 * @param name       function name
 * @param parameters literal parameters, trimmed, possibly empty
 */
public record AggregateFunctionSpec(String name, List<String> parameters) {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public AggregateFunctionSpec {
        parameters = List.copyOf(parameters);
    }

    /**
     * @throws IllegalArgumentException if the text is not {@code name} or {@code name(p1, ...)}
     */
    public static AggregateFunctionSpec parse(String text) {
        String trimmed = text.trim();
        int open = trimmed.indexOf('(');
        if (open < 0) {
            return new AggregateFunctionSpec(checkName(trimmed, text), List.of());
        }
        if (!trimmed.endsWith(")") || trimmed.indexOf(')') != trimmed.length() - 1) {
            throw new IllegalArgumentException("Unbalanced parameters in function '" + text + "'");
        }
        String name = checkName(trimmed.substring(0, open).trim(), text);
        String inner = trimmed.substring(open + 1, trimmed.length() - 1).trim();
        List<String> parameters = new ArrayList<>();
        if (!inner.isEmpty()) {
            for (String parameter : inner.split(",", -1)) {
                String p = parameter.trim();
                if (p.isEmpty()) {
                    throw new IllegalArgumentException("Empty parameter in function '" + text + "'");
                }
                parameters.add(p);
            }
        }
        return new AggregateFunctionSpec(name, parameters);
    }

    private static String checkName(String name, String text) {
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid function name in '" + text + "'");
        }
        return name;
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? name : name + "(" + String.join(", ", parameters) + ")";
    }
}

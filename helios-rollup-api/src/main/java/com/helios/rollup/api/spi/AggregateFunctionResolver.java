/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.spi;

import java.util.List;

/**
 * Looks up aggregate functions by name.
 */
public interface AggregateFunctionResolver {

    /**
     * Resolves a function.
     *
     * @param name       function name, e.g. {@code quantile}
     * @param parameters literal parameters as written in the configuration, e.g. {@code ["0.5"]}
     * @return the function handle
     * @throws IllegalArgumentException if the function is unknown or the parameters are invalid
     */
    AggregateFunction resolve(String name, List<String> parameters);
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.spi;

/**
 * Handle to an aggregate function of the host's function runtime. The rollup engine
 * only needs its name and whether it allocates per-row arena memory.
 */
public interface AggregateFunction {

    String name();

    /**
     * Functions whose state lives in an arena cannot be combined by the rollup merge
     * and are rejected at compile time.
     */
    boolean allocatesMemoryInArena();
}

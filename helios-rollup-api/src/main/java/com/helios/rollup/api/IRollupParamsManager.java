/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api;

import com.helios.rollup.runtime.model.RollupParams;

/**
 * Contract for managing the rollup params lifecycle (hot reload).
 */
public interface IRollupParamsManager {

    /**
     * Starts watching the configuration file for changes.
     */
    void start();

    /**
     * Stops watching and releases resources.
     */
    void shutdown();

    /**
     * Gets the currently active params.
     *
     * @return current params (thread-safe)
     */
    RollupParams getParams();

    /**
     * Gets a selector bound to the currently active params.
     *
     * @return current selector (thread-safe)
     */
    IRuleSelector getSelector();
}

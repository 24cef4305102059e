/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api;

import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.runtime.model.RollupParams;

/**
 * Contract for choosing the rollup rule of a metric path.
 *
 * <h2>Precedence</h2>
 * <p>Patterns are scanned in configuration order:
 * <ul>
 *   <li>The first matching pattern that declares both a function and retentions wins
 *       both slots outright.</li>
 *   <li>Otherwise the first matching retention-only pattern and the first matching
 *       aggregation-only pattern fill their slots; later partial patterns of an
 *       already filled kind are ignored.</li>
 *   <li>The default pattern fills whatever slot is still empty.</li>
 * </ul>
 * Users should therefore declare partial patterns first, complete patterns next and the
 * default last.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe; compaction threads share one instance.
 */
public interface IRuleSelector {

    /**
     * Selects the rule for a path.
     *
     * @param path plain ({@code a.b.c}) or tagged ({@code name?k1=v1&k2=v2}) metric path
     * @return the rule, or {@link RollupRule#NONE} when nothing applies
     */
    RollupRule select(String path);

    /**
     * The params this selector resolves against.
     */
    RollupParams getParams();
}

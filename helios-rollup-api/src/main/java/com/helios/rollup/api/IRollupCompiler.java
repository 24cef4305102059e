/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api;

import com.helios.rollup.api.exceptions.CompilationException;
import com.helios.rollup.api.spi.RollupConfiguration;
import com.helios.rollup.runtime.model.RollupParams;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling a rollup configuration into {@link RollupParams}.
 */
public interface IRollupCompiler {

    /**
     * Compiles the element {@code configElement} of a configuration tree.
     *
     * @throws CompilationException if the configuration is invalid; nothing is returned in that case
     */
    RollupParams compile(RollupConfiguration configuration, String configElement);

    /**
     * Compiles a JSON configuration file.
     *
     * @param configPath path to the JSON file
     * @return compiled params
     * @throws IOException          if the file cannot be read or parsed
     * @throws CompilationException if the configuration is invalid
     */
    RollupParams compile(Path configPath) throws IOException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}

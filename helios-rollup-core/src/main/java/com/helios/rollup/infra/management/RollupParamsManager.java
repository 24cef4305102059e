/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.infra.management;

import com.helios.rollup.api.IRollupCompiler;
import com.helios.rollup.api.IRollupParamsManager;
import com.helios.rollup.api.IRuleSelector;
import com.helios.rollup.api.exceptions.CompilationException;
import com.helios.rollup.cache.CachingRuleSelector;
import com.helios.rollup.runtime.evaluation.RuleSelector;
import com.helios.rollup.runtime.model.RollupParams;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the rollup params of a table for the lifetime of the process.
 *
 * <p>The configuration file is compiled once at construction; a failure there is fatal
 * and propagates to the caller. After {@link #start()} the file is polled for changes
 * and recompiled; a configuration that fails to compile is logged and the previous
 * params stay active, since a half-edited file must not stop compaction.
 */
public class RollupParamsManager implements IRollupParamsManager {
    private static final Logger logger = Logger.getLogger(RollupParamsManager.class.getName());

    public static final long DEFAULT_POLL_INTERVAL_SECONDS = 10;

    private record Snapshot(RollupParams params, IRuleSelector selector) {
    }

    private final Path configPath;
    private final IRollupCompiler compiler;
    private final Tracer tracer;
    private final Function<RollupParams, IRuleSelector> selectorFactory;
    private final long pollIntervalSeconds;

    /**
     * Holds the currently active params and the selector bound to them.
     * <p>
     * Both are swapped together in one atomic update, so a compaction thread never
     * pairs a selector with params of another generation.
     */
    private final AtomicReference<Snapshot> active = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    /**
     * Optional callback invoked with the new selector after each (re)load, typically to
     * pre-populate the selection cache with the table's known paths.
     */
    private Consumer<IRuleSelector> warmupCallback = null;

    public RollupParamsManager(Path configPath, Tracer tracer, IRollupCompiler compiler) throws IOException {
        this(configPath, tracer, compiler, RollupParamsManager::cachingSelector, DEFAULT_POLL_INTERVAL_SECONDS);
    }

    public RollupParamsManager(Path configPath, Tracer tracer, IRollupCompiler compiler,
                               Function<RollupParams, IRuleSelector> selectorFactory,
                               long pollIntervalSeconds) throws IOException {
        this.configPath = configPath;
        this.tracer = tracer;
        this.compiler = compiler;
        this.compiler.setTracer(tracer);
        this.selectorFactory = selectorFactory;
        this.pollIntervalSeconds = pollIntervalSeconds;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rollup-Config-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    private static IRuleSelector cachingSelector(RollupParams params) {
        return CachingRuleSelector.builder(new RuleSelector(params)).build();
    }

    @Override
    public RollupParams getParams() {
        return active.get().params();
    }

    @Override
    public IRuleSelector getSelector() {
        return active.get().selector();
    }

    public void setWarmupCallback(Consumer<IRuleSelector> callback) {
        this.warmupCallback = callback;
    }

    @Override
    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                pollIntervalSeconds, pollIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Recompiles the configuration now, regardless of its modification time.
     *
     * @throws CompilationException if the configuration is invalid; the previous params stay active
     * @throws IOException          if the file cannot be read
     */
    public void reload() throws IOException {
        reloadInternal();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rollup-config-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("configFile", configPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(configPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rollup config. Attempting to reload...");
                try {
                    reloadInternal();
                } catch (IOException | RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to compile new rollup config. Old params remain active.", e);
                }
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check rollup config for modifications.", e);
        } finally {
            span.end();
        }
    }

    private synchronized void reloadInternal() throws IOException {
        Span span = tracer.spanBuilder("load-rollup-params").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(configPath).toMillis();
            RollupParams params = compiler.compile(configPath);
            IRuleSelector selector = selectorFactory.apply(params);
            active.set(new Snapshot(params, selector));
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("patternCount", params.patterns().size());
            logger.info("Loaded rollup params " + params + " from " + configPath);

            if (warmupCallback != null) {
                warmUp(selector);
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void warmUp(IRuleSelector selector) {
        Span warmupSpan = tracer.spanBuilder("selector-warmup").startSpan();
        try (Scope warmupScope = warmupSpan.makeCurrent()) {
            long warmupStart = System.nanoTime();
            warmupCallback.accept(selector);
            long warmupDuration = System.nanoTime() - warmupStart;
            warmupSpan.setAttribute("warmupDurationMs", warmupDuration / 1_000_000.0);
            logger.info(String.format("Selector warmup completed in %.2f ms", warmupDuration / 1_000_000.0));
        } catch (RuntimeException e) {
            warmupSpan.recordException(e);
            logger.log(Level.WARNING, "Selector warmup failed, continuing with cold cache", e);
        } finally {
            warmupSpan.end();
        }
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.helios.rollup.api.IRuleSelector;
import com.helios.rollup.api.model.RollupRule;
import com.helios.rollup.cache.CachingRuleSelector;
import com.helios.rollup.compiler.RollupCompiler;
import com.helios.rollup.compiler.config.JsonRollupConfiguration;
import com.helios.rollup.runtime.evaluation.RuleSelector;
import com.helios.rollup.runtime.model.RollupParams;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Rule selection throughput over a synthetic Graphite config.
 * <p>
 * The config has {@code patternCount} plain suffix patterns, the same number of tagged
 * name patterns and a few tagged_map patterns, followed by a full default. The path pool
 * mixes plain and tagged paths, including paths that only the default matches.
 * <p>
 * USAGE:
 * mvn clean package -pl helios-rollup-benchmarks -am -DskipTests
 * java -jar helios-rollup-benchmarks/target/benchmarks.jar RuleSelectorBenchmark
 * <p>
 * -Dbench.quick : shorter warmup and measurement
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class RuleSelectorBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final int PATH_POOL_SIZE = 10_000;

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"10", "100"})
    private int patternCount;

    @Param({"0.5"})
    private double taggedShare;

    private RollupParams params;
    private IRuleSelector direct;
    private IRuleSelector cached;
    private String[] paths;
    private int cursor;

    @Setup(Level.Trial)
    public void setupTrial() throws Exception {
        java.util.logging.Logger.getLogger("com.helios.rollup")
                .setLevel(java.util.logging.Level.WARNING);

        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = mapper.createObjectNode();
        root.set(RollupCompiler.DEFAULT_CONFIG_ELEMENT, buildConfig(mapper, patternCount));

        params = new RollupCompiler(NOOP_TRACER).compile(JsonRollupConfiguration.of(root),
                RollupCompiler.DEFAULT_CONFIG_ELEMENT);
        direct = new RuleSelector(params);
        cached = CachingRuleSelector.builder(new RuleSelector(params)).maxSize(PATH_POOL_SIZE * 2L).build();
        paths = generatePaths(patternCount, taggedShare, PATH_POOL_SIZE);
    }

    @Setup(Level.Iteration)
    public void setupIteration() {
        cursor = 0;
    }

    @Benchmark
    public RollupRule selectDirect() {
        return direct.select(nextPath());
    }

    @Benchmark
    public RollupRule selectCached() {
        return cached.select(nextPath());
    }

    @Benchmark
    @OperationsPerInvocation(100)
    public void selectBatch100(Blackhole bh) {
        for (int i = 0; i < 100; i++) {
            bh.consume(RuleSelector.select(params, nextPath()));
        }
    }

    private String nextPath() {
        String path = paths[cursor];
        cursor = (cursor + 1) % paths.length;
        return path;
    }

    private static ObjectNode buildConfig(ObjectMapper mapper, int patternCount) {
        ObjectNode config = mapper.createObjectNode();
        ArrayNode patterns = config.putArray("pattern");
        for (int i = 0; i < patternCount; i++) {
            ObjectNode plain = patterns.addObject();
            plain.put("rule_type", "plain");
            plain.put("regexp", "\\.metric" + i + "\\.sum$");
            plain.put("function", "sum");

            ObjectNode tagged = patterns.addObject();
            tagged.put("rule_type", "tagged");
            tagged.put("regexp", "metric" + i + ";env=prod");
            tagged.put("function", "max");
            addRetention(tagged, 0, 10);
            addRetention(tagged, 86400, 600);
        }
        ObjectNode taggedMap = patterns.addObject();
        taggedMap.put("rule_type", "tagged_map");
        taggedMap.put("regexp", "env=~^stag;dc!=east");
        taggedMap.put("function", "min");

        ObjectNode fallback = config.putObject("default");
        fallback.put("function", "avg");
        addRetention(fallback, 0, 60);
        addRetention(fallback, 3600, 300);
        addRetention(fallback, 86400, 3600);
        return config;
    }

    private static void addRetention(ObjectNode pattern, long age, long precision) {
        ArrayNode retentions = pattern.has("retention")
                ? (ArrayNode) pattern.get("retention")
                : pattern.putArray("retention");
        ObjectNode retention = retentions.addObject();
        retention.put("age", age);
        retention.put("precision", precision);
    }

    private static String[] generatePaths(int patternCount, double taggedShare, int size) {
        Random random = new Random(42);
        String[] envs = {"prod", "staging", "test"};
        String[] dcs = {"east", "west"};
        List<String> pool = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            // Every tenth path addresses a metric no pattern names.
            int metric = random.nextInt(patternCount + patternCount / 10 + 1);
            if (random.nextDouble() < taggedShare) {
                pool.add("metric" + metric + "?dc=" + dcs[random.nextInt(dcs.length)]
                        + "&env=" + envs[random.nextInt(envs.length)]);
            } else {
                pool.add("servers.host" + random.nextInt(50) + ".metric" + metric + ".sum");
            }
        }
        return pool.toArray(new String[0]);
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(RuleSelectorBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 5 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}

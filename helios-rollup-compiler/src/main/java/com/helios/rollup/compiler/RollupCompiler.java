/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.rollup.api.CompilationListener;
import com.helios.rollup.api.IRollupCompiler;
import com.helios.rollup.api.exceptions.CompilationException;
import com.helios.rollup.api.exceptions.CompilationException.ErrorCode;
import com.helios.rollup.api.model.Pattern;
import com.helios.rollup.api.model.Retention;
import com.helios.rollup.api.model.RuleType;
import com.helios.rollup.api.spi.AggregateFunction;
import com.helios.rollup.api.spi.AggregateFunctionResolver;
import com.helios.rollup.api.spi.CompiledRegex;
import com.helios.rollup.api.spi.RegexEngine;
import com.helios.rollup.api.spi.RollupConfiguration;
import com.helios.rollup.compiler.analysis.PatternOrderAnalyzer;
import com.helios.rollup.compiler.analysis.PatternOrderAnalyzer.OrderingReport;
import com.helios.rollup.compiler.config.JsonRollupConfiguration;
import com.helios.rollup.compiler.functions.AggregateFunctionSpec;
import com.helios.rollup.compiler.functions.BuiltinAggregateFunctions;
import com.helios.rollup.compiler.regex.JavaRegexEngine;
import com.helios.rollup.runtime.model.RollupParams;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles a Graphite rollup configuration into {@link RollupParams}.
 *
 * <p>Configuration shape, under the root element (default {@code graphite_rollup}):
 * <pre>
 * path_column_name / time_column_name / value_column_name / version_column_name
 * pattern*
 *     rule_type     all | plain | tagged | tagged_map   (default all)
 *     regexp        path regex, tag-spec or tagged_map term list
 *     function      aggregate function, e.g. sum or quantile(0.99)
 *     retention*    age, precision (seconds)
 * default           same shape as pattern, rule_type must be all
 * </pre>
 * Each pattern needs a function, retentions, or both. Patterns keep their declaration
 * order, which is the precedence order; the default is appended last.
 *
 * <p>The compilation process involves several key steps:
 * 1. Reading the root element and column names, rejecting unknown elements.
 * 2. Compiling each pattern: function resolution, matcher construction, retention
 * ordering.
 * 3. Splitting the patterns into plain and tagged candidate lists.
 * 4. Analyzing the pattern order and logging precedence mistakes.
 *
 * <p>Any error aborts the whole compilation.
 */
public class RollupCompiler implements IRollupCompiler {
    private static final Logger logger = Logger.getLogger(RollupCompiler.class.getName());

    public static final String DEFAULT_CONFIG_ELEMENT = "graphite_rollup";

    private static final String DEFAULT_KEY = "default";
    private static final String PATTERN_KEY = "pattern";
    private static final String RETENTION_KEY = "retention";
    private static final Set<String> COLUMN_KEYS = Set.of(
            "path_column_name", "time_column_name", "value_column_name", "version_column_name");
    private static final int TOTAL_STAGES = 4;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AggregateFunctionResolver functionResolver;
    private final RegexEngine regexEngine;
    private final PatternOrderAnalyzer orderAnalyzer = new PatternOrderAnalyzer();
    private Tracer tracer;
    private CompilationListener compilationListener;

    public RollupCompiler() {
        this(OpenTelemetry.noop().getTracer(RollupCompiler.class.getName()));
    }

    public RollupCompiler(Tracer tracer) {
        this(tracer, new BuiltinAggregateFunctions(), new JavaRegexEngine());
    }

    public RollupCompiler(Tracer tracer, AggregateFunctionResolver functionResolver, RegexEngine regexEngine) {
        this.tracer = tracer;
        this.functionResolver = functionResolver;
        this.regexEngine = regexEngine;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.compilationListener = listener;
    }

    @Override
    public RollupParams compile(Path configPath) throws IOException {
        Span span = tracer.spanBuilder("load-rollup-config").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("configPath", configPath.toString());
            JsonRollupConfiguration configuration = JsonRollupConfiguration.load(configPath, objectMapper);
            return compile(configuration, DEFAULT_CONFIG_ELEMENT);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RollupParams compile(RollupConfiguration configuration, String configElement) {
        Span span = tracer.spanBuilder("compile-rollup").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("configElement", configElement);
            long startTime = System.nanoTime();

            RollupParams.Builder builder = runStage("PARSING", 1,
                    () -> readRoot(configuration, configElement),
                    b -> Map.of("configElement", configElement));

            runStage("PATTERNS", 2,
                    () -> appendPatterns(configuration, configElement, builder),
                    count -> Map.of("patternCount", count));

            RollupParams params = runStage("BUCKETING", 3, builder::build,
                    p -> Map.of(
                            "typed", p.isTyped(),
                            "taggedMap", p.hasTaggedMapPatterns(),
                            "plainPatterns", p.plainPatterns().size(),
                            "taggedPatterns", p.taggedPatterns().size()));

            OrderingReport report = runStage("ANALYSIS", 4,
                    () -> orderAnalyzer.analyze(params),
                    r -> Map.of("findings", r.findings().size()));
            report.findings().forEach(finding -> logger.warning(finding.message()));

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("patternCount", params.patterns().size());
            span.setAttribute("typed", params.isTyped());
            span.setAttribute("taggedMap", params.hasTaggedMapPatterns());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

            logger.info(String.format("Compiled rollup config '%s': %d patterns (typed=%b, taggedMap=%b) in %.2f ms",
                    configElement, params.patterns().size(), params.isTyped(), params.hasTaggedMapPatterns(),
                    compilationTime / 1_000_000.0));
            return params;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        CompilationListener listener = this.compilationListener;
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = stage.get();
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        }
    }

    private RollupParams.Builder readRoot(RollupConfiguration config, String element) {
        if (!config.has(element)) {
            throw new CompilationException(ErrorCode.MISSING_CONFIG_SECTION,
                    "No '" + element + "' element in configuration file");
        }

        for (String key : config.keys(element)) {
            if (!key.startsWith(PATTERN_KEY) && !key.equals(DEFAULT_KEY) && !COLUMN_KEYS.contains(key)) {
                throw new CompilationException(ErrorCode.UNKNOWN_CONFIG_KEY,
                        "Unknown element in config: " + element + "." + key);
            }
        }

        return RollupParams.builder(element)
                .pathColumnName(readString(config, element + ".path_column_name", RollupParams.DEFAULT_PATH_COLUMN))
                .timeColumnName(readString(config, element + ".time_column_name", RollupParams.DEFAULT_TIME_COLUMN))
                .valueColumnName(readString(config, element + ".value_column_name", RollupParams.DEFAULT_VALUE_COLUMN))
                .versionColumnName(readString(config, element + ".version_column_name", RollupParams.DEFAULT_VERSION_COLUMN));
    }

    private int appendPatterns(RollupConfiguration config, String element, RollupParams.Builder builder) {
        for (String key : config.keys(element)) {
            if (key.startsWith(PATTERN_KEY)) {
                builder.addPattern(compilePattern(config, element + "." + key, false));
            }
        }
        if (config.has(element + "." + DEFAULT_KEY)) {
            builder.addPattern(compilePattern(config, element + "." + DEFAULT_KEY, true));
        }
        return builder.patternCount();
    }

    private Pattern compilePattern(RollupConfiguration config, String element, boolean defaultRule) {
        String regexp = "";
        RuleType ruleType = RuleType.ALL;
        AggregateFunction function = null;
        List<Retention> retentions = new ArrayList<>();

        for (String key : config.keys(element)) {
            String path = element + "." + key;
            if (key.equals("regexp")) {
                regexp = readString(config, path);
            } else if (key.equals("function")) {
                function = resolveFunction(readString(config, path), path);
            } else if (key.equals("rule_type")) {
                String name = readString(config, path);
                ruleType = RuleType.fromConfigName(name)
                        .orElseThrow(() -> new CompilationException(ErrorCode.INVALID_RULE_TYPE,
                                "invalid rule type: " + name + " in " + path));
            } else if (key.startsWith(RETENTION_KEY)) {
                retentions.add(readRetention(config, path));
            } else {
                throw new CompilationException(ErrorCode.UNKNOWN_CONFIG_KEY, "Unknown element in config: " + path);
            }
        }

        if (function == null && retentions.isEmpty()) {
            throw new CompilationException(ErrorCode.MISSING_RULE_BODY,
                    "At least one of an aggregate function or retention rules is mandatory for rollup patterns: " + element);
        }

        if (defaultRule && ruleType != RuleType.ALL) {
            throw new CompilationException(ErrorCode.INVALID_DEFAULT_RULE_TYPE,
                    "Default must have rule_type all for rollup patterns, got " + ruleType.configName());
        }

        Pattern.Builder pattern = Pattern.builder()
                .ruleType(ruleType)
                .function(function)
                .retentions(RetentionOrdering.sortDescending(retentions, element));

        if (!regexp.isEmpty()) {
            switch (ruleType) {
                case TAGGED_MAP -> {
                    String terms = regexp.replaceAll("\\s+", "");
                    pattern.regexSource(terms);
                    TaggedMapParser.parse(terms, regexEngine, element).forEach(pattern::taggedTerm);
                }
                case TAGGED -> {
                    String source = buildTaggedRegex(regexp, element);
                    pattern.regexSource(source).regex(compileRegex(source, element));
                }
                case ALL, PLAIN -> pattern.regexSource(regexp).regex(compileRegex(regexp, element));
            }
        }

        Pattern compiled = pattern.build();
        logger.fine(() -> "Compiled pattern " + element + ": " + compiled);
        return compiled;
    }

    private AggregateFunction resolveFunction(String text, String path) {
        AggregateFunctionSpec spec;
        try {
            spec = AggregateFunctionSpec.parse(text);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE, e.getMessage() + " in " + path, e);
        }

        AggregateFunction function;
        try {
            function = functionResolver.resolve(spec.name(), spec.parameters());
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.UNKNOWN_AGGREGATE_FUNCTION, e.getMessage() + " in " + path, e);
        }

        if (function.allocatesMemoryInArena()) {
            throw new CompilationException(ErrorCode.UNSUPPORTED_FUNCTION,
                    "Aggregate function " + function.name() + " isn't supported in rollup patterns: " + path);
        }
        return function;
    }

    private Retention readRetention(RollupConfiguration config, String path) {
        Map<String, Long> values = new LinkedHashMap<>();
        for (String key : config.keys(path)) {
            if (!key.equals("age") && !key.equals("precision")) {
                throw new CompilationException(ErrorCode.UNKNOWN_CONFIG_KEY, "Unknown element in config: " + path + "." + key);
            }
            values.put(key, readUnsignedInt(config, path + "." + key));
        }
        if (!values.containsKey("age") || !values.containsKey("precision")) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE,
                    "Retention " + path + " requires both age and precision");
        }
        return new Retention(values.get("age"), values.get("precision"));
    }

    private String buildTaggedRegex(String regexp, String element) {
        try {
            return TaggedRegexBuilder.build(regexp);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE, e.getMessage() + " in " + element, e);
        }
    }

    private CompiledRegex compileRegex(String source, String element) {
        try {
            return regexEngine.compile(source);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.INVALID_REGEX,
                    "Invalid regexp in " + element + ": " + e.getMessage(), e);
        }
    }

    private static String readString(RollupConfiguration config, String path) {
        try {
            return config.getString(path);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE, e.getMessage(), e);
        }
    }

    private static String readString(RollupConfiguration config, String path, String defaultValue) {
        return config.has(path) ? readString(config, path) : defaultValue;
    }

    private static long readUnsignedInt(RollupConfiguration config, String path) {
        try {
            return config.getUnsignedInt(path);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE, e.getMessage(), e);
        }
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler;

import com.helios.rollup.api.exceptions.CompilationException;
import com.helios.rollup.api.exceptions.CompilationException.ErrorCode;
import com.helios.rollup.api.model.TaggedTerm;
import com.helios.rollup.api.model.TermOperator;
import com.helios.rollup.api.spi.RegexEngine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the term list of a {@code tagged_map} pattern.
 *
 * <p>Terms are separated by {@code ;} and written {@code key<op>value} with op one of
 * {@code =}, {@code =~}, {@code !=}, {@code !=~}. A term without an operator is a name
 * equality ({@code cpu} is {@code name=cpu}); {@code __name__} is an alias of
 * {@code name}. A repeated key keeps its last term.
 */
final class TaggedMapParser {

    static final String NAME_KEY = "name";
    static final String NAME_ALIAS = "__name__";

    private static final String OPERATOR_CHARS = "!=~";
    private static final int MAX_OPERATOR_LENGTH = 3;

    private TaggedMapParser() {
    }

    /**
     * @param source  whitespace-free term list
     * @param element configuration element, for error messages
     */
    static Map<String, TaggedTerm> parse(String source, RegexEngine regexEngine, String element) {
        Map<String, TaggedTerm> terms = new LinkedHashMap<>();
        for (String segment : source.split(";")) {
            if (segment.isEmpty()) {
                continue;
            }
            int pos = indexOfOperator(segment);
            if (pos < 0) {
                terms.put(NAME_KEY, TaggedTerm.literal(TermOperator.EQ, segment));
                continue;
            }

            String key = segment.substring(0, pos);
            if (key.isEmpty()) {
                throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE,
                        "Tagged map term '" + segment + "' has no key in " + element);
            }
            if (key.equals(NAME_ALIAS)) {
                key = NAME_KEY;
            }

            int end = pos;
            while (end < segment.length() && end - pos < MAX_OPERATOR_LENGTH
                    && OPERATOR_CHARS.indexOf(segment.charAt(end)) >= 0) {
                end++;
            }
            String symbol = segment.substring(pos, end);
            TermOperator operator = TermOperator.fromSymbol(symbol)
                    .orElseThrow(() -> new CompilationException(ErrorCode.UNKNOWN_TERM_OPERATOR,
                            "Unknown comparator in tagged map: " + symbol + " in " + element));

            String value = segment.substring(end);
            if (operator.usesRegex()) {
                try {
                    terms.put(key, new TaggedTerm(operator, value, regexEngine.compile(value)));
                } catch (IllegalArgumentException e) {
                    throw new CompilationException(ErrorCode.INVALID_REGEX,
                            "Invalid regex in tagged map term '" + segment + "' in " + element + ": " + e.getMessage(), e);
                }
            } else {
                terms.put(key, TaggedTerm.literal(operator, value));
            }
        }
        if (terms.isEmpty()) {
            throw new CompilationException(ErrorCode.INVALID_CONFIG_VALUE,
                    "Tagged map '" + source + "' has no terms in " + element);
        }
        return terms;
    }

    private static int indexOfOperator(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (OPERATOR_CHARS.indexOf(segment.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.regex;

import com.helios.rollup.api.spi.CompiledRegex;
import com.helios.rollup.api.spi.RegexEngine;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link RegexEngine} backed by {@code java.util.regex}. Matching uses
 * {@link java.util.regex.Matcher#find()}, so an expression matches anywhere in the text
 * unless it is anchored.
 */
public final class JavaRegexEngine implements RegexEngine {

    @Override
    public CompiledRegex compile(String pattern) {
        try {
            return new JavaCompiledRegex(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex '" + pattern + "': " + e.getDescription(), e);
        }
    }

    private record JavaCompiledRegex(Pattern pattern) implements CompiledRegex {

        @Override
        public boolean matches(CharSequence text) {
            return pattern.matcher(text).find();
        }

        @Override
        public String source() {
            return pattern.pattern();
        }

        @Override
        public String toString() {
            return pattern.pattern();
        }
    }
}

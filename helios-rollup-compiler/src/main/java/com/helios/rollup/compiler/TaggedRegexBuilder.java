/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites a human-authored tag-spec of a {@code tagged} pattern into a path regex.
 *
 * <p>Accepted forms (spaces are ignored):
 * <pre>
 * tag1=value1; tag2=VALUE2_REGEX; tag3=value3
 * name; tag1=value1; tag2=VALUE2_REGEX
 * tag1=value1;                                 (single tag, trailing ';')
 * name;                                        (name only)
 * </pre>
 * The key=value segments are sorted and joined so that unlisted tags may sit between
 * them. The result only matches paths whose tags are sorted by key.
 *
 * <p>Sources without {@code ;} are plain regexes and are returned with spaces removed.
 */
final class TaggedRegexBuilder {

    static final String TAG_SEPARATOR = "&(.*&)?";
    static final String TAIL = "(&.*)?$";

    private TaggedRegexBuilder() {
    }

    /**
     * @throws IllegalArgumentException if the spec has no segments at all
     */
    static String build(String source) {
        String spec = source.replace(" ", "");
        if (spec.indexOf(';') < 0) {
            return spec;
        }

        List<String> tags = new ArrayList<>(Arrays.asList(spec.split(";", -1)));
        tags.removeIf(String::isEmpty);
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("Tag spec '" + source + "' has no tags");
        }

        StringBuilder regex = new StringBuilder();
        String first = tags.get(0);
        if (first.indexOf('=') < 0) {
            if (tags.size() == 1) {
                return first + "\\?";
            }
            regex.append(first).append("\\?(.*&)?");
            tags.remove(0);
        } else {
            regex.append("[\\?&]");
        }

        Collections.sort(tags);
        regex.append(String.join(TAG_SEPARATOR, tags));
        regex.append(TAIL);
        return regex.toString();
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.operators;

import com.helios.rollup.api.model.TaggedTerm;
import com.helios.rollup.runtime.context.ClassifiedPath.Tag;

import java.util.List;
import java.util.Map;

/**
 * Evaluates tagged_map terms against the tags of a path.
 */
public final class TaggedTermEvaluator {

    private TaggedTermEvaluator() {
    }

    public static boolean evaluate(TaggedTerm term, String value) {
        return switch (term.operator()) {
            case EQ -> value.equals(term.value());
            case NE -> !value.equals(term.value());
            case MATCH -> term.regex().matches(value);
            case NOT_MATCH -> !term.regex().matches(value);
        };
    }

    /**
     * Returns true if every term of {@code terms} is satisfied by the tag of the same key.
     *
     * <p>Tags without a term are ignored. A tag whose term fails rejects the path at once,
     * and a term without a tag leaves the count short, which also rejects it. A key that
     * appears more than once in the path is checked once per occurrence.
     */
    public static boolean matchTagMap(List<Tag> tags, Map<String, TaggedTerm> terms) {
        if (tags.size() < terms.size()) {
            return false;
        }
        int remaining = terms.size();
        for (Tag tag : tags) {
            TaggedTerm term = terms.get(tag.key());
            if (term == null) {
                continue;
            }
            if (!evaluate(term, tag.value())) {
                return false;
            }
            remaining--;
        }
        return remaining == 0;
    }
}

/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A metric path split into its name and tags.
 *
 * <p>For a plain path the name is the whole path and there are no tags. A tagged path
 * whose tag list could not be decomposed is {@linkplain #isMalformed() malformed}: it
 * keeps its name but exposes no tags at all, so no tag term can match it.
 */
public final class ClassifiedPath {

    public static final String NAME_TAG = "name";

    /**
     * One {@code key=value} pair of a tagged path.
     */
    public record Tag(String key, String value) {
    }

    private final String path;
    private final boolean tagged;
    private final boolean malformed;
    private final String name;
    private final List<Tag> tags;
    private final List<Tag> matchableTags;

    private ClassifiedPath(String path, boolean tagged, boolean malformed, String name, List<Tag> tags) {
        this.path = path;
        this.tagged = tagged;
        this.malformed = malformed;
        this.name = name;
        this.tags = Collections.unmodifiableList(tags);
        if (tagged && !malformed) {
            List<Tag> all = new ArrayList<>(tags.size() + 1);
            all.add(new Tag(NAME_TAG, name));
            all.addAll(tags);
            this.matchableTags = Collections.unmodifiableList(all);
        } else {
            this.matchableTags = List.of();
        }
    }

    static ClassifiedPath plain(String path) {
        return new ClassifiedPath(path, false, false, path, List.of());
    }

    static ClassifiedPath tagged(String path, String name, List<Tag> tags) {
        return new ClassifiedPath(path, true, false, name, tags);
    }

    static ClassifiedPath malformed(String path, String name) {
        return new ClassifiedPath(path, true, true, name, List.of());
    }

    public String path() {
        return path;
    }

    public boolean isTagged() {
        return tagged;
    }

    public boolean isMalformed() {
        return malformed;
    }

    public String name() {
        return name;
    }

    /** Tags in path order, without the name. */
    public List<Tag> tags() {
        return tags;
    }

    /**
     * Tags as seen by tagged_map terms: the {@code name} pseudo-tag followed by
     * {@link #tags()}. Empty for plain and malformed paths.
     */
    public List<Tag> matchableTags() {
        return matchableTags;
    }

    @Override
    public String toString() {
        if (!tagged) {
            return "plain(" + path + ")";
        }
        return (malformed ? "malformed(" : "tagged(") + name + ", " + tags + ")";
    }
}

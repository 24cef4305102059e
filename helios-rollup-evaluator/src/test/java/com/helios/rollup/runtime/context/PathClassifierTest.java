/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.context;

import com.helios.rollup.runtime.context.ClassifiedPath.Tag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PathClassifierTest {

    @Test
    @DisplayName("Should classify paths without a query as plain")
    void shouldClassifyPlainPath() {
        ClassifiedPath classified = PathClassifier.classify("servers.host1.cpu.user");

        assertThat(PathClassifier.isTagged("servers.host1.cpu.user")).isFalse();
        assertThat(classified.isTagged()).isFalse();
        assertThat(classified.isMalformed()).isFalse();
        assertThat(classified.name()).isEqualTo("servers.host1.cpu.user");
        assertThat(classified.tags()).isEmpty();
        assertThat(classified.matchableTags()).isEmpty();
    }

    @Test
    @DisplayName("Should split a tagged path into name and tags in path order")
    void shouldClassifyTaggedPath() {
        ClassifiedPath classified = PathClassifier.classify("cpu.load?env=prod&dc=east");

        assertThat(classified.isTagged()).isTrue();
        assertThat(classified.isMalformed()).isFalse();
        assertThat(classified.name()).isEqualTo("cpu.load");
        assertThat(classified.tags()).containsExactly(new Tag("env", "prod"), new Tag("dc", "east"));
        assertThat(classified.matchableTags()).containsExactly(
                new Tag("name", "cpu.load"), new Tag("env", "prod"), new Tag("dc", "east"));
    }

    @Test
    @DisplayName("Should split each tag at its first equals sign")
    void shouldSplitAtFirstEquals() {
        ClassifiedPath classified = PathClassifier.classify("__name__=sum?expr=a=b&empty=");

        assertThat(classified.name()).isEqualTo("__name__=sum");
        assertThat(classified.tags()).containsExactly(new Tag("expr", "a=b"), new Tag("empty", ""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cpu?env=prod", "cpu?a=1&b=2&c=3", "a.b.c?x=&y=z=w"})
    @DisplayName("Should rebuild the original path from name and tags")
    void shouldRoundTrip(String path) {
        ClassifiedPath classified = PathClassifier.classify(path);

        String rebuilt = classified.name() + "?" + classified.tags().stream()
                .map(t -> t.key() + "=" + t.value())
                .collect(Collectors.joining("&"));
        assertThat(rebuilt).isEqualTo(path);
    }

    @ParameterizedTest
    @ValueSource(strings = {"cpu?env", "cpu?", "cpu?a=1&&b=2", "cpu?a=1&b"})
    @DisplayName("Should mark paths with a tag lacking '=' as malformed")
    void shouldMarkMalformed(String path) {
        ClassifiedPath classified = PathClassifier.classify(path);

        assertThat(PathClassifier.isTagged(path)).isTrue();
        assertThat(classified.isTagged()).isTrue();
        assertThat(classified.isMalformed()).isTrue();
        assertThat(classified.name()).isEqualTo("cpu");
        assertThat(classified.tags()).isEmpty();
        assertThat(classified.matchableTags()).isEmpty();
    }
}

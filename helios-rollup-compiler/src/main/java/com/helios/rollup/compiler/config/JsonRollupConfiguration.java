/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.compiler.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.rollup.api.model.Retention;
import com.helios.rollup.api.spi.RollupConfiguration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RollupConfiguration} over a Jackson JSON tree.
 *
 * <p>Repeated elements are JSON arrays. A configuration such as
 * <pre>{@code
 * {
 *   "graphite_rollup": {
 *     "pattern": [
 *       { "regexp": "\\.sum$", "function": "sum" },
 *       { "regexp": "^retention\\.", "retention": [ { "age": 0, "precision": 60 } ] }
 *     ],
 *     "default": { "function": "avg", "retention": { "age": 0, "precision": 60 } }
 *   }
 * }
 * }</pre>
 * exposes the keys {@code pattern}, {@code pattern[1]} and {@code default} under
 * {@code graphite_rollup}. A single object and a one-element array are equivalent.
 */
public final class JsonRollupConfiguration implements RollupConfiguration {

    private final JsonNode root;

    private JsonRollupConfiguration(JsonNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static JsonRollupConfiguration of(JsonNode root) {
        return new JsonRollupConfiguration(root);
    }

    public static JsonRollupConfiguration load(Path path, ObjectMapper objectMapper) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Rollup configuration not found: " + path);
        }
        return new JsonRollupConfiguration(objectMapper.readTree(path.toFile()));
    }

    public static JsonRollupConfiguration parse(String json, ObjectMapper objectMapper) throws IOException {
        return new JsonRollupConfiguration(objectMapper.readTree(json));
    }

    @Override
    public boolean has(String key) {
        return resolve(key) != null;
    }

    @Override
    public List<String> keys(String key) {
        JsonNode node = resolve(key);
        if (node == null || !node.isObject()) {
            return List.of();
        }
        List<String> keys = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                for (int i = 0; i < field.getValue().size(); i++) {
                    keys.add(i == 0 ? field.getKey() : field.getKey() + "[" + i + "]");
                }
            } else {
                keys.add(field.getKey());
            }
        }
        return keys;
    }

    @Override
    public String getString(String key) {
        JsonNode node = resolve(key);
        if (node == null) {
            throw new IllegalArgumentException("Missing configuration key: " + key);
        }
        if (!node.isValueNode() || node.isNull()) {
            throw new IllegalArgumentException("Configuration key " + key + " is not a scalar value");
        }
        return node.asText();
    }

    @Override
    public long getUnsignedInt(String key) {
        JsonNode node = resolve(key);
        if (node == null) {
            throw new IllegalArgumentException("Missing configuration key: " + key);
        }
        long value;
        if (node.isIntegralNumber()) {
            value = node.asLong();
        } else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Configuration key " + key + " is not an integer: " + node.asText(), e);
            }
        } else {
            throw new IllegalArgumentException("Configuration key " + key + " is not an integer: " + node);
        }
        if (value < 0 || value > Retention.MAX_SECONDS) {
            throw new IllegalArgumentException("Configuration key " + key + " is out of unsigned 32-bit range: " + value);
        }
        return value;
    }

    private JsonNode resolve(String key) {
        JsonNode node = root;
        if (key == null || key.isEmpty()) {
            return node;
        }
        for (String segment : key.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            String name = segment;
            int index = 0;
            int bracket = segment.indexOf('[');
            if (bracket > 0 && segment.endsWith("]")) {
                name = segment.substring(0, bracket);
                try {
                    index = Integer.parseInt(segment.substring(bracket + 1, segment.length() - 1));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            if (!node.isObject()) {
                return null;
            }
            node = node.get(name);
            if (node == null) {
                return null;
            }
            if (node.isArray()) {
                node = node.get(index);
            } else if (index != 0) {
                return null;
            }
            if (node == null) {
                return null;
            }
        }
        return node;
    }
}

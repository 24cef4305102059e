/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.runtime.context;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Classifies metric paths as plain or tagged and decomposes tagged ones.
 *
 * <p>A path is tagged iff it contains {@code ?}. For {@code name?k1=v1&k2=v2} the name
 * is {@code name} and the tags are {@code (k1, v1), (k2, v2)} in path order; each
 * segment is split at its first {@code =}. A segment without {@code =} makes the whole
 * tag list unusable and the path is returned as malformed.
 */
public final class PathClassifier {
    private static final Logger logger = Logger.getLogger(PathClassifier.class.getName());

    public static final char QUERY_DELIMITER = '?';
    public static final char TAG_DELIMITER = '&';
    public static final char VALUE_DELIMITER = '=';

    private PathClassifier() {
    }

    public static boolean isTagged(String path) {
        return path.indexOf(QUERY_DELIMITER) >= 0;
    }

    public static ClassifiedPath classify(String path) {
        int queryPos = path.indexOf(QUERY_DELIMITER);
        if (queryPos < 0) {
            return ClassifiedPath.plain(path);
        }

        String name = path.substring(0, queryPos);
        List<ClassifiedPath.Tag> tags = new ArrayList<>();
        int last = queryPos + 1;
        while (true) {
            int end = path.indexOf(TAG_DELIMITER, last);
            if (end < 0) {
                end = path.length();
            }
            int valuePos = path.indexOf(VALUE_DELIMITER, last);
            if (valuePos < 0 || valuePos >= end) {
                logger.fine(() -> "Malformed tag segment in path '" + path + "', ignoring its tags");
                return ClassifiedPath.malformed(path, name);
            }
            tags.add(new ClassifiedPath.Tag(path.substring(last, valuePos), path.substring(valuePos + 1, end)));
            if (end == path.length()) {
                break;
            }
            last = end + 1;
        }
        return ClassifiedPath.tagged(path, name, tags);
    }
}

/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import io.etl.annotation.Immutable;

/**
 * {@link Configuration} over a private sorted copy of its settings.
 */
@Immutable
final class MapConfiguration implements Configuration {

    private final Map<String, String> values;

    MapConfiguration(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    @Override
    public Set<String> keys() {
        return values.keySet();
    }

    @Override
    public String getString(String key) {
        return values.get(key);
    }

    @Override
    public String toString() {
        return withMaskedPasswords().asProperties().toString();
    }
}

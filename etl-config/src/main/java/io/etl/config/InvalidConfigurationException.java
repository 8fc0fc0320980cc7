/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigValue;

/**
 * Pipeline settings that are missing or do not parse as their {@link Field} requires.
 *
 * @see Configuration#validateAndThrow(Field.Set)
 */
public class InvalidConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Map<String, ConfigValue> invalidConfigValues;

    /**
     * @param results the validation results; those without error messages are dropped
     */
    public InvalidConfigurationException(Collection<ConfigValue> results) {
        this(invalidOnly(results));
    }

    private InvalidConfigurationException(Map<String, ConfigValue> invalid) {
        super("Invalid pipeline configuration: " + invalid.values().stream()
                .flatMap(value -> value.errorMessages().stream())
                .collect(Collectors.joining("; ")));
        this.invalidConfigValues = Collections.unmodifiableMap(invalid);
    }

    private static Map<String, ConfigValue> invalidOnly(Collection<ConfigValue> results) {
        Map<String, ConfigValue> invalid = new LinkedHashMap<>();
        for (ConfigValue result : results) {
            if (!result.errorMessages().isEmpty()) {
                invalid.put(result.name(), result);
            }
        }
        return invalid;
    }

    /**
     * @return the invalid values keyed by property name, in field order; never null
     */
    public Map<String, ConfigValue> invalidConfigValues() {
        return invalidConfigValues;
    }
}

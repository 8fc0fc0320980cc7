/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.kafka.common.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etl.annotation.Immutable;

/**
 * Raw pipeline settings as text, keyed by property name. Typed access goes through a {@link Field}, which supplies the
 * default for an absent key and the checks run by {@link #validate(Field.Set)}.
 */
@Immutable
public interface Configuration {

    Logger CONFIGURATION_LOGGER = LoggerFactory.getLogger(Configuration.class);

    /**
     * Keys whose values are never printed.
     */
    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    String MASKED_VALUE = "********";

    Set<String> keys();

    /**
     * @return the value of {@code key}, or {@code null} if there is none
     */
    String getString(String key);

    /**
     * Collects settings for a new {@link Configuration}.
     */
    final class Builder {

        private final Map<String, String> values = new HashMap<>();

        private Builder() {
        }

        /**
         * Set a value, or remove it if {@code value} is null.
         */
        public Builder with(String key, Object value) {
            if (value == null) {
                values.remove(key);
            }
            else {
                values.put(key, value.toString());
            }
            return this;
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        public Builder without(Field field) {
            values.remove(field.name());
            return this;
        }

        public Configuration build() {
            return new MapConfiguration(values);
        }
    }

    static Builder create() {
        return new Builder();
    }

    /**
     * @param properties the properties to copy; may be null
     * @return a configuration that later changes to {@code properties} do not affect; never null
     */
    static Configuration from(Properties properties) {
        Builder builder = create();
        if (properties != null) {
            properties.stringPropertyNames().forEach(key -> builder.with(key, properties.getProperty(key)));
        }
        return builder.build();
    }

    /**
     * Read settings in {@link Properties} format. The stream is closed afterwards.
     */
    static Configuration load(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            Properties properties = new Properties();
            properties.load(in);
            return from(properties);
        }
    }

    /**
     * Read settings in {@link Properties} format from the classpath.
     *
     * @param resource the resource path; may not be null
     * @param classLoader the loader to search; null means the loader of this interface
     * @return the settings, or an empty configuration if there is no such resource; never null
     */
    static Configuration load(String resource, ClassLoader classLoader) throws IOException {
        ClassLoader loader = classLoader != null ? classLoader : Configuration.class.getClassLoader();
        InputStream stream = loader.getResourceAsStream(resource);
        if (stream == null) {
            CONFIGURATION_LOGGER.debug("No configuration resource '{}' on the classpath", resource);
            return from(null);
        }
        return load(stream);
    }

    /**
     * @return the value of the field, or its default if the key is absent
     */
    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    default int getInteger(Field field) {
        return Integer.parseInt(getString(field).trim());
    }

    default long getLong(Field field) {
        return Long.parseLong(getString(field).trim());
    }

    /**
     * @return the bits of an unsigned 64-bit value
     */
    default long getUnsignedLong(Field field) {
        return Long.parseUnsignedLong(getString(field).trim());
    }

    default boolean getBoolean(Field field) {
        String value = getString(field);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * @return a copy whose password values read as {@link #MASKED_VALUE}
     */
    default Configuration withMaskedPasswords() {
        Builder masked = create();
        for (String key : keys()) {
            masked.with(key, PASSWORD_PATTERN.matcher(key).matches() ? MASKED_VALUE : getString(key));
        }
        return masked.build();
    }

    default Properties asProperties() {
        Properties properties = new Properties();
        for (String key : keys()) {
            String value = getString(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return properties;
    }

    /**
     * Check each field and report the outcome in Kafka's {@link ConfigValue} form. Passwords are masked in the reported
     * values.
     *
     * @return one value per field, in the order of {@code fields}; never null
     */
    default Map<String, ConfigValue> validate(Field.Set fields) {
        Map<String, ConfigValue> results = new LinkedHashMap<>();
        for (Field field : fields) {
            String value = getString(field.name());
            ConfigValue result = new ConfigValue(field.name());
            result.value(value != null && PASSWORD_PATTERN.matcher(field.name()).matches() ? MASKED_VALUE : value);
            field.validate(this).forEach(problem -> result.addErrorMessage(field.describe(value, problem)));
            results.put(field.name(), result);
        }
        return results;
    }

    /**
     * @throws InvalidConfigurationException listing every invalid field, if there is one
     */
    default void validateAndThrow(Field.Set fields) {
        Collection<ConfigValue> results = validate(fields).values();
        if (results.stream().anyMatch(result -> !result.errorMessages().isEmpty())) {
            throw new InvalidConfigurationException(results);
        }
    }
}

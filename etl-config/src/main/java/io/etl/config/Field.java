/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.etl.annotation.Immutable;
import io.etl.util.Strings;

/**
 * A named pipeline setting: its type, default, documentation and the checks its raw text value must pass. Fields are
 * values; the {@code with...} methods return modified copies.
 */
@Immutable
public final class Field {

    /**
     * Checks the text of a present, non-blank value that already has the field's {@link #type() type}.
     */
    @FunctionalInterface
    public interface Validator {
        /**
         * @param value the trimmed value; never null
         * @return a description of what is wrong, or {@code null} if the value is acceptable
         */
        String problemWith(String value);
    }

    // for INT and LONG fields, whose type check has already passed
    public static final Validator NON_NEGATIVE = value -> Long.parseLong(value) < 0 ? "A non-negative number is expected" : null;
    public static final Validator UNSIGNED_SHORT = unsigned(UnsignedRange.U16);
    public static final Validator UNSIGNED_INT = unsigned(UnsignedRange.U32);
    public static final Validator UNSIGNED_LONG = unsigned(UnsignedRange.U64);

    private static Validator unsigned(UnsignedRange range) {
        return value -> range.containsText(value) ? null : range.expectation();
    }

    /**
     * An ordered group of fields, such as all the settings of a pipeline.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {

        private final List<Field> fields;

        private Set(List<Field> fields) {
            this.fields = Collections.unmodifiableList(fields);
        }

        /**
         * @return the field called {@code name}, or {@code null} if there is none
         */
        public Field fieldWithName(String name) {
            for (Field field : fields) {
                if (field.name().equals(name)) {
                    return field;
                }
            }
            return null;
        }

        public List<String> names() {
            return fields.stream().map(Field::name).collect(Collectors.toList());
        }

        @Override
        public Iterator<Field> iterator() {
            return fields.iterator();
        }
    }

    public static Set setOf(Field... fields) {
        return new Set(new ArrayList<>(Arrays.asList(fields)));
    }

    public static Field create(String name) {
        return new Field(name, name, "", Type.STRING, Width.NONE, Importance.MEDIUM, null, null, false);
    }

    /**
     * Define the fields in {@code configDef}, numbered in the order given.
     *
     * @return {@code configDef}
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        int order = 0;
        for (Field field : fields) {
            order++;
            configDef.define(field.name, field.type, field.defaultValue, null, field.importance, field.description,
                    groupName, order, field.width, field.displayName, Collections.emptyList(), null);
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Width width;
    private final Importance importance;
    private final Object defaultValue;
    private final Validator validator;
    private final boolean required;

    private Field(String name, String displayName, String description, Type type, Width width, Importance importance,
                  Object defaultValue, Validator validator, boolean required) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayName = displayName;
        this.description = description;
        this.type = type;
        this.width = width;
        this.importance = importance;
        this.defaultValue = defaultValue;
        this.validator = validator;
        this.required = required;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Type type() {
        return type;
    }

    public Width width() {
        return width;
    }

    public Importance importance() {
        return importance;
    }

    /**
     * @return the default value, or {@code null} if the field has none
     */
    public Object defaultValue() {
        return defaultValue;
    }

    public String defaultValueAsString() {
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public boolean isRequired() {
        return required;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withDefault(Object defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field withValidation(Validator validator) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, required);
    }

    public Field required() {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator, true);
    }

    /**
     * Check this field's value in {@code config}. An absent optional value is valid. A present value must first parse as
     * the field's type; only then is the field's validator applied.
     *
     * @param config the configuration; may not be null
     * @return the problems found, empty if the value is valid; never null
     */
    public List<String> validate(Configuration config) {
        String value = config.getString(this);
        if (required && Strings.isNullOrBlank(value)) {
            return Collections.singletonList("A value is required");
        }
        if (value == null) {
            return Collections.emptyList();
        }
        String problem = typeProblem(value.trim());
        if (problem == null && validator != null) {
            problem = validator.problemWith(value.trim());
        }
        return problem != null ? Collections.singletonList(problem) : Collections.emptyList();
    }

    private String typeProblem(String value) {
        try {
            switch (type) {
                case BOOLEAN:
                    return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false") ? null : "Either 'true' or 'false' is expected";
                case INT:
                    Integer.parseInt(value);
                    return null;
                case LONG:
                    Long.parseLong(value);
                    return null;
                default:
                    return null;
            }
        }
        catch (NumberFormatException e) {
            return type == Type.INT ? "An integer is expected" : "A long value is expected";
        }
    }

    /**
     * Render a problem with this field's value for users. Password values are never shown.
     */
    String describe(String value, String problem) {
        if (value == null) {
            return "The '" + name + "' value is invalid: " + problem;
        }
        String shown = type == Type.PASSWORD || Configuration.PASSWORD_PATTERN.matcher(name).matches()
                ? Configuration.MASKED_VALUE
                : "'" + value + "'";
        return "The '" + name + "' value " + shown + " is invalid: " + problem;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Field && ((Field) obj).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}

/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Objects;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.etl.annotation.Immutable;

/**
 * How many changes a batch may hold and how long it may stay open before it is flushed.
 */
@Immutable
public final class BatchConfig {

    public static final int DEFAULT_MAX_SIZE = 100_000;
    public static final long DEFAULT_MAX_FILL_MS = 10_000L;

    public static final Field MAX_SIZE = Field.create("batch.max.size")
            .withDisplayName("Maximum batch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_MAX_SIZE)
            .withValidation(Field.NON_NEGATIVE)
            .withDescription("Maximum number of changes in a single batch");

    public static final Field MAX_FILL_MS = Field.create("batch.max.fill.ms")
            .withDisplayName("Maximum batch fill time (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_MAX_FILL_MS)
            .withValidation(Field.NON_NEGATIVE)
            .withDescription("Maximum time in milliseconds a batch is filled before it is flushed");

    @JsonProperty("max_size")
    private final int maxSize;

    @JsonProperty("max_fill_ms")
    private final long maxFillMs;

    @JsonCreator
    public BatchConfig(@JsonProperty("max_size") int maxSize, @JsonProperty("max_fill_ms") long maxFillMs) {
        this.maxSize = (int) UnsignedRange.U64.require("max_size", maxSize);
        this.maxFillMs = UnsignedRange.U64.require("max_fill_ms", maxFillMs);
    }

    public static BatchConfig from(Configuration config) {
        return new BatchConfig(config.getInteger(MAX_SIZE), config.getLong(MAX_FILL_MS));
    }

    public int maxSize() {
        return maxSize;
    }

    public long maxFillMs() {
        return maxFillMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BatchConfig that = (BatchConfig) o;
        return maxSize == that.maxSize && maxFillMs == that.maxFillMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxSize, maxFillMs);
    }

    @Override
    public String toString() {
        return "BatchConfig{maxSize=" + maxSize + ", maxFillMs=" + maxFillMs + "}";
    }
}

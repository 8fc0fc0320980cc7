/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.etl.annotation.Immutable;

/**
 * {@link PipelineConfig} without the database password. This is the only pipeline configuration type with a JSON form.
 * The pipeline id is written as an unsigned JSON number, and a document without {@code slot_prefix} reads back with
 * {@link PipelineConfig#DEFAULT_SLOT_PREFIX}.
 */
@Immutable
public final class PipelineConfigWithoutSecrets {

    private final long id;

    @JsonProperty("publication_name")
    private final String publicationName;

    @JsonProperty("pg_connection")
    private final PgConnectionConfigWithoutSecrets pgConnection;

    @JsonProperty("batch")
    private final BatchConfig batch;

    @JsonProperty("table_error_retry_delay_ms")
    private final long tableErrorRetryDelayMs;

    @JsonProperty("table_error_retry_max_attempts")
    private final long tableErrorRetryMaxAttempts;

    @JsonProperty("max_table_sync_workers")
    private final int maxTableSyncWorkers;

    @JsonProperty("slot_prefix")
    private final String slotPrefix;

    public PipelineConfigWithoutSecrets(long id, String publicationName, PgConnectionConfigWithoutSecrets pgConnection,
                                        BatchConfig batch, long tableErrorRetryDelayMs, long tableErrorRetryMaxAttempts,
                                        int maxTableSyncWorkers, String slotPrefix) {
        this.id = id;
        this.publicationName = publicationName;
        this.pgConnection = pgConnection;
        this.batch = batch;
        this.tableErrorRetryDelayMs = tableErrorRetryDelayMs;
        this.tableErrorRetryMaxAttempts = tableErrorRetryMaxAttempts;
        this.maxTableSyncWorkers = maxTableSyncWorkers;
        this.slotPrefix = slotPrefix != null ? slotPrefix : PipelineConfig.DEFAULT_SLOT_PREFIX;
    }

    /**
     * Read the JSON form. Numbers must fit the unsigned types of the properties: 64 bits for {@code id}, 32 bits for
     * {@code table_error_retry_max_attempts} and 16 bits for {@code max_table_sync_workers}. The retry delay must be
     * non-negative.
     *
     * @throws IllegalArgumentException if a number is out of range
     */
    @JsonCreator
    public static PipelineConfigWithoutSecrets fromJson(@JsonProperty("id") BigInteger id,
                                                        @JsonProperty("publication_name") String publicationName,
                                                        @JsonProperty("pg_connection") PgConnectionConfigWithoutSecrets pgConnection,
                                                        @JsonProperty("batch") BatchConfig batch,
                                                        @JsonProperty("table_error_retry_delay_ms") long tableErrorRetryDelayMs,
                                                        @JsonProperty("table_error_retry_max_attempts") long tableErrorRetryMaxAttempts,
                                                        @JsonProperty("max_table_sync_workers") long maxTableSyncWorkers,
                                                        @JsonProperty("slot_prefix") String slotPrefix) {
        return new PipelineConfigWithoutSecrets(
                UnsignedRange.U64.require("id", id).longValue(),
                publicationName,
                pgConnection,
                batch,
                UnsignedRange.U64.require("table_error_retry_delay_ms", tableErrorRetryDelayMs),
                UnsignedRange.U32.require("table_error_retry_max_attempts", tableErrorRetryMaxAttempts),
                (int) UnsignedRange.U16.require("max_table_sync_workers", maxTableSyncWorkers),
                slotPrefix);
    }

    public static PipelineConfigWithoutSecrets from(PipelineConfig config) {
        return new PipelineConfigWithoutSecrets(
                config.id(),
                config.publicationName(),
                config.pgConnection().withoutSecrets(),
                config.batch(),
                config.tableErrorRetryDelayMs(),
                config.tableErrorRetryMaxAttempts(),
                config.maxTableSyncWorkers(),
                config.slotPrefix());
    }

    public long id() {
        return id;
    }

    @JsonProperty("id")
    BigInteger jsonId() {
        return new BigInteger(Long.toUnsignedString(id));
    }

    public String publicationName() {
        return publicationName;
    }

    public PgConnectionConfigWithoutSecrets pgConnection() {
        return pgConnection;
    }

    public BatchConfig batch() {
        return batch;
    }

    public long tableErrorRetryDelayMs() {
        return tableErrorRetryDelayMs;
    }

    public long tableErrorRetryMaxAttempts() {
        return tableErrorRetryMaxAttempts;
    }

    public int maxTableSyncWorkers() {
        return maxTableSyncWorkers;
    }

    public String slotPrefix() {
        return slotPrefix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PipelineConfigWithoutSecrets that = (PipelineConfigWithoutSecrets) o;
        return id == that.id
                && tableErrorRetryDelayMs == that.tableErrorRetryDelayMs
                && tableErrorRetryMaxAttempts == that.tableErrorRetryMaxAttempts
                && maxTableSyncWorkers == that.maxTableSyncWorkers
                && Objects.equals(publicationName, that.publicationName)
                && Objects.equals(pgConnection, that.pgConnection)
                && Objects.equals(batch, that.batch)
                && Objects.equals(slotPrefix, that.slotPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, publicationName, pgConnection, batch, slotPrefix);
    }

    @Override
    public String toString() {
        return "PipelineConfigWithoutSecrets{id=" + Long.toUnsignedString(id) + ", publicationName=" + publicationName
                + ", pgConnection=" + pgConnection + ", batch=" + batch + ", slotPrefix=" + slotPrefix + "}";
    }
}

/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Objects;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etl.annotation.Immutable;
import io.etl.util.Strings;

/**
 * The configuration of a single replication pipeline: its identity, source connection, batching, retry policy, worker
 * limits and replication slot prefix.
 * <p>
 * Instances are usually obtained with {@link #from(Configuration)}, which type-checks the raw properties, followed by
 * {@link #validate()}, which checks the values against each other and against the slot naming scheme. This class holds
 * the database password and has no serialized form; see {@link PipelineConfigWithoutSecrets}.
 */
@Immutable
public final class PipelineConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

    /**
     * Prefix used for replication slot names when none is configured.
     */
    public static final String DEFAULT_SLOT_PREFIX = "supabase_etl";

    /**
     * Maximum length of a slot prefix in bytes. Postgres limits slot names to 63 bytes and the longest suffix,
     * {@code _table_sync_<max u64>_<max u32>}, takes 40 of them.
     */
    public static final int MAX_SLOT_PREFIX_LENGTH = 20;

    public static final long DEFAULT_TABLE_ERROR_RETRY_DELAY_MS = 10_000L;
    public static final long DEFAULT_TABLE_ERROR_RETRY_MAX_ATTEMPTS = 5L;
    public static final int DEFAULT_MAX_TABLE_SYNC_WORKERS = 4;

    private static final String APPLY_DELIMITER = "_apply_";
    private static final String TABLE_SYNC_DELIMITER = "_table_sync_";

    public static final Field ID = Field.create("pipeline.id")
            .withDisplayName("Pipeline id")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .required()
            .withValidation(Field.UNSIGNED_LONG)
            .withDescription("Unsigned 64-bit identifier of the pipeline. Isolates the replication slots of one pipeline "
                    + "from those of every other pipeline.");

    public static final Field PUBLICATION_NAME = Field.create("publication.name")
            .withDisplayName("Publication")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("Name of the Postgres publication used for logical replication.");

    public static final Field TABLE_ERROR_RETRY_DELAY_MS = Field.create("table.error.retry.delay.ms")
            .withDisplayName("Table error retry delay (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_TABLE_ERROR_RETRY_DELAY_MS)
            .withValidation(Field.NON_NEGATIVE)
            .withDescription("Number of milliseconds between one retry and the next when a table error occurs.");

    public static final Field TABLE_ERROR_RETRY_MAX_ATTEMPTS = Field.create("table.error.retry.max.attempts")
            .withDisplayName("Table error retry attempts")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_TABLE_ERROR_RETRY_MAX_ATTEMPTS)
            .withValidation(Field.UNSIGNED_INT)
            .withDescription("Maximum number of automatic retries of a failed table before manual intervention is required.");

    public static final Field MAX_TABLE_SYNC_WORKERS = Field.create("max.table.sync.workers")
            .withDisplayName("Maximum table sync workers")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_MAX_TABLE_SYNC_WORKERS)
            .withValidation(Field.UNSIGNED_SHORT)
            .withDescription("Maximum number of table sync workers that may run at the same time.");

    public static final Field SLOT_PREFIX = Field.create("slot.prefix")
            .withDisplayName("Replication slot prefix")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_SLOT_PREFIX)
            .withDescription("Prefix of every replication slot created by the pipeline. Apply slots are named "
                    + "'<prefix>_apply_<pipeline id>' and table sync slots '<prefix>_table_sync_<pipeline id>_<table id>'.");

    public static final Field.Set ALL_FIELDS = Field.setOf(
            ID,
            PUBLICATION_NAME,
            PgConnectionConfig.HOST,
            PgConnectionConfig.PORT,
            PgConnectionConfig.NAME,
            PgConnectionConfig.USERNAME,
            PgConnectionConfig.PASSWORD,
            TlsConfig.ENABLED,
            TlsConfig.TRUSTED_ROOT_CERTS,
            BatchConfig.MAX_SIZE,
            BatchConfig.MAX_FILL_MS,
            TABLE_ERROR_RETRY_DELAY_MS,
            TABLE_ERROR_RETRY_MAX_ATTEMPTS,
            MAX_TABLE_SYNC_WORKERS,
            SLOT_PREFIX);

    private final long id;
    private final String publicationName;
    private final PgConnectionConfig pgConnection;
    private final BatchConfig batch;
    private final long tableErrorRetryDelayMs;
    private final long tableErrorRetryMaxAttempts;
    private final int maxTableSyncWorkers;
    private final String slotPrefix;

    /**
     * @param id the pipeline id, read as an unsigned 64-bit value
     * @param slotPrefix the slot prefix; {@code null} selects {@link #DEFAULT_SLOT_PREFIX}
     */
    public PipelineConfig(long id, String publicationName, PgConnectionConfig pgConnection, BatchConfig batch,
                          long tableErrorRetryDelayMs, long tableErrorRetryMaxAttempts, int maxTableSyncWorkers,
                          String slotPrefix) {
        this.id = id;
        this.publicationName = Objects.requireNonNull(publicationName, "publicationName");
        this.pgConnection = Objects.requireNonNull(pgConnection, "pgConnection");
        this.batch = Objects.requireNonNull(batch, "batch");
        this.tableErrorRetryDelayMs = tableErrorRetryDelayMs;
        this.tableErrorRetryMaxAttempts = tableErrorRetryMaxAttempts;
        this.maxTableSyncWorkers = maxTableSyncWorkers;
        this.slotPrefix = slotPrefix != null ? slotPrefix : DEFAULT_SLOT_PREFIX;
    }

    /**
     * Read a pipeline configuration from raw properties. Every field in {@link #ALL_FIELDS} is type-checked first; the
     * semantic checks of {@link #validate()} are not run.
     *
     * @param config the configuration; may not be null
     * @return the pipeline configuration; never null
     * @throws InvalidConfigurationException if any required value is missing or any value has the wrong type or range
     */
    public static PipelineConfig from(Configuration config) {
        config.validateAndThrow(ALL_FIELDS);
        PipelineConfig pipelineConfig = new PipelineConfig(
                config.getUnsignedLong(ID),
                config.getString(PUBLICATION_NAME),
                PgConnectionConfig.from(config),
                BatchConfig.from(config),
                config.getLong(TABLE_ERROR_RETRY_DELAY_MS),
                config.getLong(TABLE_ERROR_RETRY_MAX_ATTEMPTS),
                config.getInteger(MAX_TABLE_SYNC_WORKERS),
                config.getString(SLOT_PREFIX));
        LOGGER.debug("Loaded pipeline configuration {}", pipelineConfig);
        return pipelineConfig;
    }

    /**
     * Describe all pipeline configuration properties as a Kafka {@link ConfigDef}.
     *
     * @return a new definition; never null
     */
    public static ConfigDef configDef() {
        ConfigDef config = new ConfigDef();
        Field.group(config, "Pipeline", ID, PUBLICATION_NAME, SLOT_PREFIX);
        Field.group(config, "Connection", PgConnectionConfig.HOST, PgConnectionConfig.PORT, PgConnectionConfig.NAME,
                PgConnectionConfig.USERNAME, PgConnectionConfig.PASSWORD, TlsConfig.ENABLED, TlsConfig.TRUSTED_ROOT_CERTS);
        Field.group(config, "Workers", BatchConfig.MAX_SIZE, BatchConfig.MAX_FILL_MS, TABLE_ERROR_RETRY_DELAY_MS,
                TABLE_ERROR_RETRY_MAX_ATTEMPTS, MAX_TABLE_SYNC_WORKERS);
        return config;
    }

    /**
     * Check the configuration, stopping at the first problem. The checks run in a fixed order: TLS settings, table sync
     * worker limit, retry attempt limit, then the slot prefix (non-empty, at most {@link #MAX_SLOT_PREFIX_LENGTH} bytes,
     * and free of the slot name delimiters so that slot names parse back unambiguously).
     *
     * @throws ValidationException describing the first failed check
     * @throws SlotPrefixTooLongException if the slot prefix is longer than {@link #MAX_SLOT_PREFIX_LENGTH} bytes
     */
    public void validate() {
        pgConnection.tls().validate();

        if (maxTableSyncWorkers == 0) {
            throw new ValidationException(ValidationError.MAX_TABLE_SYNC_WORKERS_ZERO);
        }

        if (tableErrorRetryMaxAttempts == 0) {
            throw new ValidationException(ValidationError.TABLE_ERROR_RETRY_MAX_ATTEMPTS_ZERO);
        }

        if (slotPrefix.isEmpty()) {
            throw new ValidationException(ValidationError.SLOT_PREFIX_EMPTY);
        }

        int prefixLength = Strings.utf8Length(slotPrefix);
        if (prefixLength > MAX_SLOT_PREFIX_LENGTH) {
            throw new SlotPrefixTooLongException(MAX_SLOT_PREFIX_LENGTH, prefixLength);
        }

        String terminated = slotPrefix + "_";
        if (terminated.contains(APPLY_DELIMITER) || terminated.contains(TABLE_SYNC_DELIMITER)) {
            throw new ValidationException(ValidationError.SLOT_PREFIX_CONTAINS_DELIMITER);
        }
    }

    /**
     * @return the pipeline id; an unsigned 64-bit value
     */
    public long id() {
        return id;
    }

    public String publicationName() {
        return publicationName;
    }

    public PgConnectionConfig pgConnection() {
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

    public PipelineConfigWithoutSecrets withoutSecrets() {
        return PipelineConfigWithoutSecrets.from(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PipelineConfig that = (PipelineConfig) o;
        return id == that.id
                && tableErrorRetryDelayMs == that.tableErrorRetryDelayMs
                && tableErrorRetryMaxAttempts == that.tableErrorRetryMaxAttempts
                && maxTableSyncWorkers == that.maxTableSyncWorkers
                && publicationName.equals(that.publicationName)
                && pgConnection.equals(that.pgConnection)
                && batch.equals(that.batch)
                && slotPrefix.equals(that.slotPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, publicationName, pgConnection, batch, slotPrefix);
    }

    @Override
    public String toString() {
        return "PipelineConfig{id=" + Long.toUnsignedString(id)
                + ", publicationName=" + publicationName
                + ", pgConnection=" + pgConnection
                + ", batch=" + batch
                + ", tableErrorRetryDelayMs=" + tableErrorRetryDelayMs
                + ", tableErrorRetryMaxAttempts=" + tableErrorRetryMaxAttempts
                + ", maxTableSyncWorkers=" + maxTableSyncWorkers
                + ", slotPrefix=" + slotPrefix + "}";
    }
}

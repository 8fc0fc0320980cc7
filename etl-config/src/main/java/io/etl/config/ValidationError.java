/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

/**
 * The semantic checks a {@link PipelineConfig} can fail, in the order they are evaluated.
 */
public enum ValidationError {

    MISSING_TRUSTED_ROOT_CERTS("Trusted root certificates must be provided when TLS is enabled"),
    MAX_TABLE_SYNC_WORKERS_ZERO("The maximum number of table sync workers must be greater than zero"),
    TABLE_ERROR_RETRY_MAX_ATTEMPTS_ZERO("The maximum number of table error retry attempts must be greater than zero"),
    SLOT_PREFIX_EMPTY("The slot prefix must not be empty"),
    SLOT_PREFIX_TOO_LONG("The slot prefix is too long"),
    SLOT_PREFIX_CONTAINS_DELIMITER("The slot prefix must not contain '_apply' or '_table_sync' followed by an underscore");

    private final String description;

    ValidationError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}

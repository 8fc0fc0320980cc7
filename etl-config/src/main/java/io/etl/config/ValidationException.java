/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import io.etl.EtlException;

/**
 * Raised by {@link PipelineConfig#validate()} and {@link TlsConfig#validate()} for the first check that fails.
 */
public class ValidationException extends EtlException {

    private static final long serialVersionUID = 1L;

    private final ValidationError error;

    public ValidationException(ValidationError error) {
        this(error, error.description());
    }

    protected ValidationException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}

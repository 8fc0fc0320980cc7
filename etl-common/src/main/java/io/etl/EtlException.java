/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl;

/**
 * Base exception thrown by the replication slot and pipeline configuration API.
 *
 */
public class EtlException extends RuntimeException {

    private static final long serialVersionUID = 4218793421559023847L;

    public EtlException() {
    }

    public EtlException(String message) {
        super(message);
    }

    public EtlException(Throwable cause) {
        super(cause);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}

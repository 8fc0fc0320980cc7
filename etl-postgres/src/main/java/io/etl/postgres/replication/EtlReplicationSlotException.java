/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import io.etl.EtlException;

/**
 * Base class for failures to encode or decode a replication slot name.
 */
public abstract class EtlReplicationSlotException extends EtlException {

    private static final long serialVersionUID = 1L;

    private final String slotName;

    protected EtlReplicationSlotException(String message, String slotName) {
        super(message);
        this.slotName = slotName;
    }

    /**
     * @return the offending slot name or name prefix
     */
    public String slotName() {
        return slotName;
    }
}

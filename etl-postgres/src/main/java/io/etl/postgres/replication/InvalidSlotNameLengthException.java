/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

/**
 * A slot name, or slot name prefix, would exceed the length Postgres allows.
 */
public class InvalidSlotNameLengthException extends EtlReplicationSlotException {

    private static final long serialVersionUID = 1L;

    public InvalidSlotNameLengthException(String slotName) {
        super(String.format("Invalid slot name length: '%s' exceeds %d bytes", slotName, EtlReplicationSlot.MAX_SLOT_NAME_LENGTH),
                slotName);
    }
}

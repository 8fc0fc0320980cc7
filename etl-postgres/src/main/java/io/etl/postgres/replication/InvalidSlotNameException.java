/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

/**
 * A slot name does not follow the apply or table sync naming scheme.
 */
public class InvalidSlotNameException extends EtlReplicationSlotException {

    private static final long serialVersionUID = 1L;

    public InvalidSlotNameException(String slotName) {
        super(String.format("Invalid slot name: '%s'", slotName), slotName);
    }
}

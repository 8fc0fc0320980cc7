/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.types;

import io.etl.annotation.Immutable;

/**
 * Identifies a table by its Postgres relation OID, an unsigned 32-bit value.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    public static final long MAX_VALUE = 0xFFFFFFFFL;

    private final long value;

    private TableId(long value) {
        this.value = value;
    }

    /**
     * @param oid the relation OID
     * @return the table id; never null
     * @throws IllegalArgumentException if {@code oid} is outside {@code 0..4294967295}
     */
    public static TableId of(long oid) {
        if (oid < 0 || oid > MAX_VALUE) {
            throw new IllegalArgumentException("A table id must be an unsigned 32-bit value but was " + oid);
        }
        return new TableId(oid);
    }

    /**
     * Parse the decimal form of an OID.
     *
     * @param oid the text; may not be null
     * @return the table id; never null
     * @throws NumberFormatException if the text is not an unsigned 32-bit decimal number
     */
    public static TableId parse(String oid) {
        return new TableId(Integer.toUnsignedLong(Integer.parseUnsignedInt(oid)));
    }

    public long value() {
        return value;
    }

    @Override
    public int compareTo(TableId that) {
        return Long.compare(this.value, that.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof TableId) {
            return this.value == ((TableId) obj).value;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}

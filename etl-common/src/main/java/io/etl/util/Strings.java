/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.util;

import java.nio.charset.StandardCharsets;

import io.etl.annotation.ThreadSafe;

/**
 * String helpers shared by the configuration and replication code.
 */
@ThreadSafe
public final class Strings {

    private Strings() {
    }

    /**
     * @return {@code true} if the value is null or holds only whitespace
     */
    public static boolean isNullOrBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Postgres limits identifiers by their encoded size, not by their number of characters.
     *
     * @param value the string; may not be null
     * @return the number of bytes of the UTF-8 encoding of {@code value}
     */
    public static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}

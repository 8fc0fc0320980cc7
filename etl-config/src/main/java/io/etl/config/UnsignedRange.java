/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.math.BigInteger;

/**
 * Ranges of the unsigned integer types used by pipeline settings. Values are carried in signed Java types wide enough
 * to hold them, except for 64-bit values, which keep their bits in a {@code long}.
 */
enum UnsignedRange {

    U16(16),
    U32(32),
    U64(64);

    private final int bits;
    private final BigInteger max;

    UnsignedRange(int bits) {
        this.bits = bits;
        this.max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    boolean contains(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(max) <= 0;
    }

    /**
     * Check a configuration text value.
     *
     * @return {@code true} if the trimmed text is a decimal integer in this range
     */
    boolean containsText(String text) {
        try {
            return contains(new BigInteger(text.trim()));
        }
        catch (NumberFormatException e) {
            return false;
        }
    }

    String expectation() {
        return "An unsigned " + bits + "-bit integer is expected";
    }

    /**
     * @throws IllegalArgumentException naming the property if {@code value} is null or out of range
     */
    BigInteger require(String property, BigInteger value) {
        if (value == null || !contains(value)) {
            throw new IllegalArgumentException("'" + property + "' must be an unsigned " + bits + "-bit integer but was " + value);
        }
        return value;
    }

    long require(String property, long value) {
        return require(property, BigInteger.valueOf(value)).longValue();
    }
}

/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

/**
 * The configured slot prefix exceeds {@link PipelineConfig#MAX_SLOT_PREFIX_LENGTH} bytes.
 */
public class SlotPrefixTooLongException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final int maxLength;
    private final int actualLength;

    public SlotPrefixTooLongException(int maxLength, int actualLength) {
        super(ValidationError.SLOT_PREFIX_TOO_LONG,
                String.format("The slot prefix is too long: %d bytes, the maximum is %d", actualLength, maxLength));
        this.maxLength = maxLength;
        this.actualLength = actualLength;
    }

    public int maxLength() {
        return maxLength;
    }

    public int actualLength() {
        return actualLength;
    }
}

package com.questrail.lockcodec.observability;

import java.time.Instant;

/**
 * Record describing one completed codec operation.
 *
 * <p>{@code characterCount} is the number of plain-text characters involved and
 * {@code codeCount} the number of code groups. Both are {@code -1} when the
 * operation failed before they were known.</p>
 */
public record CodecOperationEvent(
    Instant timestamp,
    CodecOperation operation,
    boolean success,
    int characterCount,
    int codeCount
) {
}

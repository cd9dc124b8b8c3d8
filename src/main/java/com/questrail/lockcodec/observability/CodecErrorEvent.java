package com.questrail.lockcodec.observability;

import java.time.Instant;

/**
 * Record representing a failed codec operation.
 */
public record CodecErrorEvent(
    Instant timestamp,
    CodecOperation operation,
    String message,
    Throwable cause
) {
}

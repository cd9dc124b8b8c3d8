package com.questrail.lockcodec.codec;

import com.questrail.lockcodec.error.LockCodecException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one element in a lenient batch: exactly one of {@code value} and
 * {@code error} is non-null.
 */
public record BatchEntry(
    int index,
    String value,
    LockCodecException error
) {
    public BatchEntry {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static BatchEntry success(int index, String value) {
        return new BatchEntry(index, Objects.requireNonNull(value, "value"), null);
    }

    public static BatchEntry failure(int index, LockCodecException error) {
        return new BatchEntry(index, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> valueIfPresent() {
        return Optional.ofNullable(value);
    }

    public Optional<LockCodecException> errorIfPresent() {
        return Optional.ofNullable(error);
    }
}

package com.questrail.lockcodec.error;

import java.util.Objects;

/**
 * LockCodecException
 * -----------------------------------------------------------------------------
 * Root of every failure raised by the lock codec.
 *
 * <p>Each failure carries a {@link Category} so callers can tell a broken
 * charset configuration apart from malformed input and from API misuse without
 * matching on concrete exception types.</p>
 *
 * <p>None of these failures are transient. They propagate immediately, carry no
 * partial output, and are never retried.</p>
 */
public abstract class LockCodecException extends RuntimeException
{
    /**
     * Broad classification of a codec failure.
     */
    public enum Category
    {
        /** The charset table is missing, invalid, or does not cover the input. */
        CONFIGURATION,

        /** The encoded input is structurally wrong or does not fit the code width. */
        INPUT_FORMAT,

        /** The caller invoked an operation with arguments it can never accept. */
        USAGE
    }

    private final Category category;

    protected LockCodecException(Category category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    protected LockCodecException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public Category category() {
        return category;
    }
}

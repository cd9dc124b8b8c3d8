package com.questrail.lockcodec.config;

/**
 * How the codec treats {@code code + lock} values that do not fit in the
 * table's code width.
 */
public enum OverflowPolicy
{
    /**
     * Reject the character with a {@code LockOverflowException}. A locked value
     * must lie in {@code [0, 10^codeWidth)}.
     */
    STRICT,

    /**
     * Reduce the locked value modulo {@code 10^codeWidth}, always yielding a
     * non-negative value. Decoding subtracts the lock modulo the same base, so
     * every lock round-trips.
     */
    WRAP
}

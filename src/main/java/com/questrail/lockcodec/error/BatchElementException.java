package com.questrail.lockcodec.error;

import java.util.Objects;

/**
 * Raised by a fail-fast batch operation when one element fails.
 *
 * <p>The element's own failure is the {@link #getCause() cause}; the category
 * is inherited from it.</p>
 */
public final class BatchElementException extends LockCodecException
{
    private final int index;

    public BatchElementException(int index, LockCodecException cause) {
        super(Objects.requireNonNull(cause, "cause").category(),
                "Batch element " + index + " failed: " + cause.getMessage(), cause);
        this.index = index;
    }

    /**
     * @return 0-based index of the failing element
     */
    public int index() {
        return index;
    }

    @Override
    public synchronized LockCodecException getCause() {
        return (LockCodecException) super.getCause();
    }
}

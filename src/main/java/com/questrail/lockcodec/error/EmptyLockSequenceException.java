package com.questrail.lockcodec.error;

/**
 * Raised when a multi-lock operation is given no locks.
 */
public final class EmptyLockSequenceException extends LockCodecException
{
    public EmptyLockSequenceException() {
        super(Category.USAGE, "Lock sequence must contain at least one lock");
    }
}

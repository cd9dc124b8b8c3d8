package com.questrail.lockcodec.error;

/**
 * Raised when a default-lock overload is called on a codec configured
 * without a default lock.
 */
public final class MissingDefaultLockException extends LockCodecException
{
    public MissingDefaultLockException() {
        super(Category.USAGE, "No default lock configured; pass a lock explicitly");
    }
}

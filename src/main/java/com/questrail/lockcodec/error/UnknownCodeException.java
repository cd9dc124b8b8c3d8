package com.questrail.lockcodec.error;

/**
 * Raised when a decoded code (after removing the lock) maps to no character.
 *
 * <p>Usually means the wrong lock was supplied or the text was produced with a
 * different charset.</p>
 */
public final class UnknownCodeException extends LockCodecException
{
    private final long code;
    private final int groupIndex;

    public UnknownCodeException(long code, int groupIndex) {
        super(Category.CONFIGURATION, groupIndex < 0
                ? "Code " + code + " is not in the charset"
                : "Code " + code + " at group " + groupIndex + " is not in the charset");
        this.code = code;
        this.groupIndex = groupIndex;
    }

    public long code() {
        return code;
    }

    public int groupIndex() {
        return groupIndex;
    }
}

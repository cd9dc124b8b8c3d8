package com.questrail.lockcodec.error;

/**
 * Raised under the strict overflow policy when {@code code + lock} does not fit
 * in {@code codeWidth} decimal digits (or is negative).
 */
public final class LockOverflowException extends LockCodecException
{
    private final int code;
    private final int lock;
    private final int codeWidth;

    public LockOverflowException(int code, int lock, int codeWidth) {
        super(Category.INPUT_FORMAT,
                "Code " + code + " with lock " + lock + " does not fit in " + codeWidth + " digits");
        this.code = code;
        this.lock = lock;
        this.codeWidth = codeWidth;
    }

    public int code() {
        return code;
    }

    public int lock() {
        return lock;
    }

    public int codeWidth() {
        return codeWidth;
    }
}

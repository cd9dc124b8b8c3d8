package com.questrail.lockcodec.error;

/**
 * Raised when a charset table or charset file violates the table invariants:
 * empty mapping, duplicate or negative codes, codes wider than the code width,
 * or an unreadable charset document.
 */
public final class InvalidCharsetException extends LockCodecException
{
    public InvalidCharsetException(String message) {
        super(Category.CONFIGURATION, message);
    }

    public InvalidCharsetException(String message, Throwable cause) {
        super(Category.CONFIGURATION, message, cause);
    }
}

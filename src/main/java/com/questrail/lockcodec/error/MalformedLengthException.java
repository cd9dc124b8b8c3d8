package com.questrail.lockcodec.error;

/**
 * Raised when encoded text cannot be split into whole code groups.
 */
public final class MalformedLengthException extends LockCodecException
{
    private final int length;
    private final int codeWidth;

    public MalformedLengthException(int length, int codeWidth) {
        super(Category.INPUT_FORMAT,
                "Encoded length " + length + " is not a multiple of code width " + codeWidth);
        this.length = length;
        this.codeWidth = codeWidth;
    }

    public int length() {
        return length;
    }

    public int codeWidth() {
        return codeWidth;
    }
}

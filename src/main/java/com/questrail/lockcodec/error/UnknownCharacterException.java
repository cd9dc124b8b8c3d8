package com.questrail.lockcodec.error;

/**
 * Raised when a character has no code in the charset table.
 */
public final class UnknownCharacterException extends LockCodecException
{
    private final int codePoint;
    private final int position;

    /**
     * @param codePoint the unmapped character
     * @param position  0-based character position in the input, or {@code -1}
     *                  when the lookup was not tied to an input position
     */
    public UnknownCharacterException(int codePoint, int position) {
        super(Category.CONFIGURATION, describe(codePoint, position));
        this.codePoint = codePoint;
        this.position = position;
    }

    public int codePoint() {
        return codePoint;
    }

    public String character() {
        return new String(Character.toChars(codePoint));
    }

    public int position() {
        return position;
    }

    private static String describe(int codePoint, int position) {
        String text = "Character '" + new String(Character.toChars(codePoint)) + "' (U+"
                + String.format("%04X", codePoint) + ") is not in the charset";
        return position < 0 ? text : text + " (position " + position + ")";
    }
}

package com.questrail.lockcodec.codec;

/**
 * SingleLockCodec
 * -----------------------------------------------------------------------------
 * Encodes one string under one lock, and back.
 *
 * <p>Each character is replaced by {@code code(char) + lock}, written as a
 * zero-padded decimal group of exactly {@code codeWidth} digits. Groups are
 * concatenated in input order, so for every successfully encoded input:</p>
 * <pre>
 *   length(encoded) == length(text) * codeWidth
 * </pre>
 *
 * <p>Both directions are all-or-nothing: any failure raises a
 * {@link com.questrail.lockcodec.error.LockCodecException} and no partial output
 * is produced. Empty input yields empty output.</p>
 */
public interface SingleLockCodec
{
    /**
     * Encode {@code text} under {@code lock}.
     *
     * @throws com.questrail.lockcodec.error.UnknownCharacterException if a character is not in the charset
     * @throws com.questrail.lockcodec.error.LockOverflowException if a locked code does not fit the code width
     *         under the strict overflow policy
     */
    String encodeData(String text, int lock);

    /**
     * Decode {@code encoded} under {@code lock}.
     *
     * @throws com.questrail.lockcodec.error.MalformedLengthException if the length is not a multiple of the code width
     * @throws com.questrail.lockcodec.error.MalformedDigitsException if a group is not all decimal digits
     * @throws com.questrail.lockcodec.error.UnknownCodeException if an unlocked code maps to no character
     */
    String decodeData(String encoded, int lock);

    /**
     * Re-encodes text produced under {@code fromLock} so that it decodes under
     * {@code toLock}. Equivalent to {@code encodeData(decodeData(encoded, fromLock), toLock)}.
     */
    String relock(String encoded, int fromLock, int toLock);
}

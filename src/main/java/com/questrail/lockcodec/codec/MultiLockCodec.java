package com.questrail.lockcodec.codec;

import java.util.List;

/**
 * MultiLockCodec
 * -----------------------------------------------------------------------------
 * Layers the single-lock transform once per lock.
 *
 * <pre>
 *   encode:  text -> encode(locks[0]) -> encode(locks[1]) -> ... -> encoded
 *   decode:  encoded -> decode(locks[n-1]) -> ... -> decode(locks[0]) -> text
 * </pre>
 *
 * <h2>Digit domain</h2>
 * Every layer after the first encodes the digit string produced by the layer
 * before it, so the charset must map {@code 0-9}. When more than one lock is
 * given, the charset is checked for all ten digits before any work is done and
 * a missing digit raises {@link com.questrail.lockcodec.error.UnknownCharacterException}.
 * A single-lock sequence behaves exactly like the single codec.
 *
 * <p>Each layer multiplies the length by the code width.</p>
 */
public interface MultiLockCodec
{
    /**
     * @throws com.questrail.lockcodec.error.EmptyLockSequenceException if {@code locks} is empty
     */
    String mEncode(List<Integer> locks, String text);

    /**
     * @throws com.questrail.lockcodec.error.EmptyLockSequenceException if {@code locks} is empty
     */
    String mDecode(List<Integer> locks, String encoded);
}

package com.questrail.lockcodec.codec;

import java.util.List;

/**
 * BatchLockCodec
 * -----------------------------------------------------------------------------
 * Applies the single-lock transform element-wise over an ordered list.
 *
 * <p>Two failure modes are offered:</p>
 * <ul>
 *   <li><b>fail-fast</b> ({@link #encodeBatch}, {@link #decodeBatch}): the first
 *       failing element aborts the whole batch with a
 *       {@link com.questrail.lockcodec.error.BatchElementException} carrying its
 *       index. No partial list is returned.</li>
 *   <li><b>lenient</b> ({@link #encodeEach}, {@link #decodeEach}): every element
 *       is attempted and reported as a {@link BatchEntry}.</li>
 * </ul>
 *
 * <p>All elements of one call are processed against the same charset table.</p>
 */
public interface BatchLockCodec
{
    List<String> encodeBatch(List<String> texts, int lock);

    List<String> decodeBatch(List<String> encoded, int lock);

    List<BatchEntry> encodeEach(List<String> texts, int lock);

    List<BatchEntry> decodeEach(List<String> encoded, int lock);
}

package com.questrail.lockcodec;

import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.BatchEntry;
import com.questrail.lockcodec.codec.BatchLockCodec;
import com.questrail.lockcodec.codec.MultiLockCodec;
import com.questrail.lockcodec.codec.SingleLockCodec;
import com.questrail.lockcodec.codec.impl.DefaultBatchLockCodec;
import com.questrail.lockcodec.codec.impl.DefaultMultiLockCodec;
import com.questrail.lockcodec.codec.impl.DefaultSingleLockCodec;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.error.MissingDefaultLockException;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * LockCodec
 * =============================================================================
 * Library entry point: one object exposing single, batch, multi-lock and
 * re-lock operations over a shared charset table.
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   LockCodec
 *     ├─ SingleLockCodec  ─┐
 *     ├─ BatchLockCodec   ─┼─ lock arithmetic ─ CharsetTable (via CharsetTableHolder)
 *     └─ MultiLockCodec   ─┘
 * </pre>
 *
 * <p>The charset table is never loaded here. Callers build one (typically with
 * {@link com.questrail.lockcodec.charset.CharsetLoader}) and hand it over, either
 * directly or through a {@link CharsetTableHolder} they may later update.</p>
 *
 * <h2>Default lock</h2>
 * Operations that take no lock argument use {@link LockCodecConfig#defaultLock()};
 * without one they raise {@link MissingDefaultLockException}.
 *
 * <p>This is a reversible encoding, not encryption.</p>
 */
public final class LockCodec implements SingleLockCodec, BatchLockCodec, MultiLockCodec
{
    private final CharsetTableHolder tables;
    private final LockCodecConfig config;
    private final SingleLockCodec single;
    private final BatchLockCodec batch;
    private final MultiLockCodec multi;

    public LockCodec(CharsetTableHolder tables, LockCodecConfig config)
    {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.config = Objects.requireNonNull(config, "config");
        this.single = new DefaultSingleLockCodec(tables, config);
        this.batch = new DefaultBatchLockCodec(tables, config);
        this.multi = new DefaultMultiLockCodec(tables, config);
    }

    public LockCodec(CharsetTable table, LockCodecConfig config)
    {
        this(CharsetTableHolder.of(table), config);
    }

    public LockCodec(CharsetTable table)
    {
        this(table, LockCodecConfig.defaults());
    }

    public CharsetTableHolder tables() {
        return tables;
    }

    public LockCodecConfig config() {
        return config;
    }

    public OptionalInt defaultLock() {
        return config.defaultLockIfPresent();
    }

    // ---------------------------------------------------------------------
    // Single
    // ---------------------------------------------------------------------

    @Override
    public String encodeData(String text, int lock) {
        return single.encodeData(text, lock);
    }

    public String encodeData(String text) {
        return single.encodeData(text, requireDefaultLock());
    }

    @Override
    public String decodeData(String encoded, int lock) {
        return single.decodeData(encoded, lock);
    }

    public String decodeData(String encoded) {
        return single.decodeData(encoded, requireDefaultLock());
    }

    @Override
    public String relock(String encoded, int fromLock, int toLock) {
        return single.relock(encoded, fromLock, toLock);
    }

    /**
     * Converts text encoded under the default lock to {@code toLock}.
     */
    public String relock(String encoded, int toLock) {
        return single.relock(encoded, requireDefaultLock(), toLock);
    }

    // ---------------------------------------------------------------------
    // Batch
    // ---------------------------------------------------------------------

    @Override
    public List<String> encodeBatch(List<String> texts, int lock) {
        return batch.encodeBatch(texts, lock);
    }

    public List<String> encodeBatch(List<String> texts) {
        return batch.encodeBatch(texts, requireDefaultLock());
    }

    @Override
    public List<String> decodeBatch(List<String> encoded, int lock) {
        return batch.decodeBatch(encoded, lock);
    }

    public List<String> decodeBatch(List<String> encoded) {
        return batch.decodeBatch(encoded, requireDefaultLock());
    }

    @Override
    public List<BatchEntry> encodeEach(List<String> texts, int lock) {
        return batch.encodeEach(texts, lock);
    }

    public List<BatchEntry> encodeEach(List<String> texts) {
        return batch.encodeEach(texts, requireDefaultLock());
    }

    @Override
    public List<BatchEntry> decodeEach(List<String> encoded, int lock) {
        return batch.decodeEach(encoded, lock);
    }

    public List<BatchEntry> decodeEach(List<String> encoded) {
        return batch.decodeEach(encoded, requireDefaultLock());
    }

    // ---------------------------------------------------------------------
    // Multi-lock
    // ---------------------------------------------------------------------

    @Override
    public String mEncode(List<Integer> locks, String text) {
        return multi.mEncode(locks, text);
    }

    @Override
    public String mDecode(List<Integer> locks, String encoded) {
        return multi.mDecode(locks, encoded);
    }

    private int requireDefaultLock() {
        return config.defaultLockIfPresent().orElseThrow(MissingDefaultLockException::new);
    }
}

package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.SingleLockCodec;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.config.OverflowPolicy;
import com.questrail.lockcodec.observability.CodecOperation;

import java.util.Objects;

/**
 * DefaultSingleLockCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SingleLockCodec}.
 *
 * <p>Each call performs the following steps, in order:</p>
 * <ol>
 *   <li>Snapshot the charset table (fails if none is installed)</li>
 *   <li>Apply the lock arithmetic under the configured overflow policy</li>
 *   <li>Report the outcome to the observability sink</li>
 * </ol>
 */
public final class DefaultSingleLockCodec implements SingleLockCodec
{
    private final CharsetTableHolder tables;
    private final OverflowPolicy overflowPolicy;
    private final OperationReporter reporter;

    public DefaultSingleLockCodec(CharsetTableHolder tables, LockCodecConfig config)
    {
        this.tables = Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(config, "config");
        this.overflowPolicy = config.overflowPolicy();
        this.reporter = new OperationReporter(config);
    }

    @Override
    public String encodeData(String text, int lock)
    {
        Objects.requireNonNull(text, "text");
        final String encoded;
        try {
            encoded = LockTransform.encode(tables.snapshot(), text, lock, overflowPolicy);
        }
        catch (RuntimeException e) {
            reporter.failed(CodecOperation.ENCODE, e);
            throw e;
        }
        final int characters = LockTransform.characterCount(text);
        reporter.succeeded(CodecOperation.ENCODE, characters, characters);
        return encoded;
    }

    @Override
    public String decodeData(String encoded, int lock)
    {
        Objects.requireNonNull(encoded, "encoded");
        final CharsetTable table;
        final String text;
        try {
            table = tables.snapshot();
            text = LockTransform.decode(table, encoded, lock, overflowPolicy);
        }
        catch (RuntimeException e) {
            reporter.failed(CodecOperation.DECODE, e);
            throw e;
        }
        reporter.succeeded(CodecOperation.DECODE, LockTransform.characterCount(text),
                encoded.length() / table.codeWidth());
        return text;
    }

    @Override
    public String relock(String encoded, int fromLock, int toLock)
    {
        Objects.requireNonNull(encoded, "encoded");
        final String text;
        final String relocked;
        try {
            // One snapshot for both halves so the conversion never straddles a table swap.
            final CharsetTable table = tables.snapshot();
            text = LockTransform.decode(table, encoded, fromLock, overflowPolicy);
            relocked = LockTransform.encode(table, text, toLock, overflowPolicy);
        }
        catch (RuntimeException e) {
            reporter.failed(CodecOperation.RELOCK, e);
            throw e;
        }
        final int characters = LockTransform.characterCount(text);
        reporter.succeeded(CodecOperation.RELOCK, characters, characters);
        return relocked;
    }
}

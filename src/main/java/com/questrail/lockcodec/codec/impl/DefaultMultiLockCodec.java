package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.MultiLockCodec;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.config.OverflowPolicy;
import com.questrail.lockcodec.error.EmptyLockSequenceException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import com.questrail.lockcodec.observability.CodecOperation;

import java.util.List;
import java.util.Objects;

/**
 * DefaultMultiLockCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MultiLockCodec}.
 *
 * <p>All layers of one call use the same charset table snapshot. Intermediate
 * layers are not reported; one event covers the whole call.</p>
 */
public final class DefaultMultiLockCodec implements MultiLockCodec
{
    private final CharsetTableHolder tables;
    private final OverflowPolicy overflowPolicy;
    private final OperationReporter reporter;

    public DefaultMultiLockCodec(CharsetTableHolder tables, LockCodecConfig config)
    {
        this.tables = Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(config, "config");
        this.overflowPolicy = config.overflowPolicy();
        this.reporter = new OperationReporter(config);
    }

    @Override
    public String mEncode(List<Integer> locks, String text)
    {
        Objects.requireNonNull(text, "text");
        final CharsetTable table;
        String result = text;
        try {
            table = prepare(locks);
            for (int i = 0; i < locks.size(); i++) {
                result = LockTransform.encode(table, result, locks.get(i), overflowPolicy);
            }
        }
        catch (RuntimeException e) {
            reporter.failed(CodecOperation.MULTI_ENCODE, e);
            throw e;
        }

        reporter.succeeded(CodecOperation.MULTI_ENCODE, LockTransform.characterCount(text),
                result.length() / table.codeWidth());
        return result;
    }

    @Override
    public String mDecode(List<Integer> locks, String encoded)
    {
        Objects.requireNonNull(encoded, "encoded");
        final CharsetTable table;
        String result = encoded;
        try {
            table = prepare(locks);
            for (int i = locks.size() - 1; i >= 0; i--) {
                result = LockTransform.decode(table, result, locks.get(i), overflowPolicy);
            }
        }
        catch (RuntimeException e) {
            reporter.failed(CodecOperation.MULTI_DECODE, e);
            throw e;
        }

        reporter.succeeded(CodecOperation.MULTI_DECODE, LockTransform.characterCount(result),
                encoded.length() / table.codeWidth());
        return result;
    }

    private CharsetTable prepare(List<Integer> locks)
    {
        Objects.requireNonNull(locks, "locks");
        if (locks.isEmpty()) {
            throw new EmptyLockSequenceException();
        }
        for (int i = 0; i < locks.size(); i++) {
            Objects.requireNonNull(locks.get(i), "lock at index " + i);
        }

        final CharsetTable table = tables.snapshot();

        // Layers after the first re-encode digit strings.
        if (locks.size() > 1) {
            for (int digit = '0'; digit <= '9'; digit++) {
                if (!table.contains(digit)) {
                    throw new UnknownCharacterException(digit, -1);
                }
            }
        }
        return table;
    }
}

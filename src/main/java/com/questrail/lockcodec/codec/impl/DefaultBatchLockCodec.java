package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.BatchEntry;
import com.questrail.lockcodec.codec.BatchLockCodec;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.config.OverflowPolicy;
import com.questrail.lockcodec.error.BatchElementException;
import com.questrail.lockcodec.error.LockCodecException;
import com.questrail.lockcodec.observability.CodecOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DefaultBatchLockCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BatchLockCodec}.
 *
 * <p>Every element goes through exactly the same arithmetic as
 * {@link DefaultSingleLockCodec}, so {@code encodeBatch(xs, k)} equals the
 * element-wise {@code encodeData(x, k)}. One operation event is reported per
 * batch, not per element. A lenient batch with failed elements reports that
 * event as unsuccessful, with counts covering the elements that succeeded, and
 * one error event per failed element.</p>
 */
public final class DefaultBatchLockCodec implements BatchLockCodec
{
    @FunctionalInterface
    private interface ElementTransform {
        String apply(CharsetTable table, String element, int lock, OverflowPolicy policy);
    }

    private final CharsetTableHolder tables;
    private final OverflowPolicy overflowPolicy;
    private final OperationReporter reporter;

    public DefaultBatchLockCodec(CharsetTableHolder tables, LockCodecConfig config)
    {
        this.tables = Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(config, "config");
        this.overflowPolicy = config.overflowPolicy();
        this.reporter = new OperationReporter(config);
    }

    @Override
    public List<String> encodeBatch(List<String> texts, int lock)
    {
        return failFast(CodecOperation.ENCODE_BATCH, texts, lock, LockTransform::encode, true);
    }

    @Override
    public List<String> decodeBatch(List<String> encoded, int lock)
    {
        return failFast(CodecOperation.DECODE_BATCH, encoded, lock, LockTransform::decode, false);
    }

    @Override
    public List<BatchEntry> encodeEach(List<String> texts, int lock)
    {
        return lenient(CodecOperation.ENCODE_BATCH, texts, lock, LockTransform::encode, true);
    }

    @Override
    public List<BatchEntry> decodeEach(List<String> encoded, int lock)
    {
        return lenient(CodecOperation.DECODE_BATCH, encoded, lock, LockTransform::decode, false);
    }

    private List<String> failFast(CodecOperation operation, List<String> elements, int lock,
                                  ElementTransform transform, boolean encoding)
    {
        Objects.requireNonNull(elements, "elements");
        final List<String> results = new ArrayList<>(elements.size());
        int characters = 0;
        try {
            final CharsetTable table = tables.snapshot();
            for (int i = 0; i < elements.size(); i++) {
                final String element = Objects.requireNonNull(elements.get(i), "element at index " + i);
                final String result;
                try {
                    result = transform.apply(table, element, lock, overflowPolicy);
                }
                catch (LockCodecException e) {
                    throw new BatchElementException(i, e);
                }
                results.add(result);
                characters += LockTransform.characterCount(encoding ? element : result);
            }
        }
        catch (RuntimeException e) {
            reporter.failed(operation, e);
            throw e;
        }

        reporter.completed(operation, true, characters, characters);
        return Collections.unmodifiableList(results);
    }

    private List<BatchEntry> lenient(CodecOperation operation, List<String> elements, int lock,
                                     ElementTransform transform, boolean encoding)
    {
        Objects.requireNonNull(elements, "elements");
        final CharsetTable table;
        try {
            table = tables.snapshot();
        }
        catch (RuntimeException e) {
            reporter.failed(operation, e);
            throw e;
        }

        final List<BatchEntry> entries = new ArrayList<>(elements.size());
        int characters = 0;
        boolean allSucceeded = true;

        for (int i = 0; i < elements.size(); i++) {
            final String element = Objects.requireNonNull(elements.get(i), "element at index " + i);
            try {
                final String result = transform.apply(table, element, lock, overflowPolicy);
                entries.add(BatchEntry.success(i, result));
                characters += LockTransform.characterCount(encoding ? element : result);
            }
            catch (LockCodecException e) {
                entries.add(BatchEntry.failure(i, e));
                reporter.elementFailed(operation, i, e);
                allSucceeded = false;
            }
        }

        reporter.completed(operation, allSucceeded, characters, characters);
        return Collections.unmodifiableList(entries);
    }
}

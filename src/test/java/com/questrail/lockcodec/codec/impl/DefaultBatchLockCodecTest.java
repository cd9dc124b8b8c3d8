package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.TestCharsets;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.BatchEntry;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.error.BatchElementException;
import com.questrail.lockcodec.error.LockCodecException;
import com.questrail.lockcodec.error.MalformedLengthException;
import com.questrail.lockcodec.error.TableNotInitializedException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import com.questrail.lockcodec.error.UnknownCodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultBatchLockCodecTest
{
    private final CharsetTableHolder tables = CharsetTableHolder.of(TestCharsets.lettersAndDigits());
    private final DefaultBatchLockCodec batch = new DefaultBatchLockCodec(tables, LockCodecConfig.defaults());
    private final DefaultSingleLockCodec single = new DefaultSingleLockCodec(tables, LockCodecConfig.defaults());

    // ---------------------------------------------------------------------
    // Fail-fast
    // ---------------------------------------------------------------------

    @Test
    void encodeBatchPreservesOrderAndCount() {
        assertEquals(List.of("101102103", "104105106", "107108109"),
                batch.encodeBatch(List.of("abc", "def", "ghi"), 1));
    }

    @Test
    void encodeBatchMatchesElementWiseEncode() {
        List<String> texts = List.of("alpha", "", "b2", "zz9");

        List<String> encoded = batch.encodeBatch(texts, 17);

        assertEquals(texts.size(), encoded.size());
        for (int i = 0; i < texts.size(); i++) {
            assertEquals(single.encodeData(texts.get(i), 17), encoded.get(i));
        }
    }

    @Test
    void decodeBatchReversesEncodeBatch() {
        assertEquals(List.of("abc", "def", "ghi"),
                batch.decodeBatch(List.of("101102103", "104105106", "107108109"), 1));
    }

    @Test
    void emptyBatchIsEmpty() {
        assertTrue(batch.encodeBatch(List.of(), 1).isEmpty());
        assertTrue(batch.decodeBatch(List.of(), 1).isEmpty());
    }

    /**
     * Verifies fail-fast: the first bad element aborts the batch and its index
     * is reported, with the element's own failure as the cause.
     */
    @Test
    void encodeBatchFailsFastWithIndex() {
        BatchElementException e = assertThrows(BatchElementException.class,
                () -> batch.encodeBatch(List.of("abc", "d!f", "g?i"), 1));

        assertEquals(1, e.index());
        UnknownCharacterException cause = assertInstanceOf(UnknownCharacterException.class, e.getCause());
        assertEquals('!', cause.codePoint());
        assertEquals(LockCodecException.Category.CONFIGURATION, e.category());
    }

    @Test
    void decodeBatchFailsFastWithIndex() {
        BatchElementException e = assertThrows(BatchElementException.class,
                () -> batch.decodeBatch(List.of("101102103", "104105106", "1071081"), 1));

        assertEquals(2, e.index());
        assertInstanceOf(MalformedLengthException.class, e.getCause());
        assertEquals(LockCodecException.Category.INPUT_FORMAT, e.category());
    }

    @Test
    void missingTableIsNotWrappedAsElementFailure() {
        DefaultBatchLockCodec uninitialized =
                new DefaultBatchLockCodec(CharsetTableHolder.empty(), LockCodecConfig.defaults());

        assertThrows(TableNotInitializedException.class, () -> uninitialized.encodeBatch(List.of("a"), 1));
        assertThrows(TableNotInitializedException.class, () -> uninitialized.encodeEach(List.of("a"), 1));
    }

    @Test
    void resultListIsUnmodifiable() {
        List<String> encoded = batch.encodeBatch(List.of("a"), 0);
        assertThrows(UnsupportedOperationException.class, () -> encoded.add("b"));
    }

    // ---------------------------------------------------------------------
    // Lenient
    // ---------------------------------------------------------------------

    @Test
    void encodeEachReportsEveryElement() {
        List<BatchEntry> entries = batch.encodeEach(List.of("abc", "def", "g!i"), 1);

        assertEquals(3, entries.size());
        assertEquals("101102103", entries.get(0).valueIfPresent().orElseThrow());
        assertEquals("104105106", entries.get(1).value());
        assertFalse(entries.get(2).isSuccess());
        assertEquals(2, entries.get(2).index());
        assertInstanceOf(UnknownCharacterException.class, entries.get(2).errorIfPresent().orElseThrow());
    }

    @Test
    void decodeEachContinuesPastFailures() {
        List<BatchEntry> entries = batch.decodeEach(List.of("101102103", "999", "107108109"), 1);

        assertTrue(entries.get(0).isSuccess());
        assertInstanceOf(UnknownCodeException.class, entries.get(1).error());
        assertEquals("ghi", entries.get(2).value());
    }

    @Test
    void batchEntryRequiresExactlyOneOutcome() {
        assertThrows(IllegalArgumentException.class, () -> new BatchEntry(0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new BatchEntry(0, "x", new UnknownCodeException(1, 0)));
    }
}

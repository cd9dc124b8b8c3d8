package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.TestCharsets;
import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.config.OverflowPolicy;
import com.questrail.lockcodec.error.LockCodecException;
import com.questrail.lockcodec.error.LockOverflowException;
import com.questrail.lockcodec.error.MalformedDigitsException;
import com.questrail.lockcodec.error.MalformedLengthException;
import com.questrail.lockcodec.error.TableNotInitializedException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import com.questrail.lockcodec.error.UnknownCodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultSingleLockCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultSingleLockCodec}.
 *
 * <p>Uses a table where {@code a-z} map to {@code 100..125} and {@code 0-9}
 * to {@code 126..135}, code width 3.</p>
 */
final class DefaultSingleLockCodecTest
{
    private final CharsetTableHolder tables = CharsetTableHolder.of(TestCharsets.lettersAndDigits());
    private final DefaultSingleLockCodec codec = new DefaultSingleLockCodec(tables, LockCodecConfig.defaults());

    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    @Test
    void encodeAddsLockToEachCode() {
        assertEquals("101102103", codec.encodeData("abc", 1));
        assertEquals("100101102", codec.encodeData("abc", 0));
    }

    @Test
    void encodeEmptyIsEmpty() {
        assertEquals("", codec.encodeData("", 1));
        assertEquals("", codec.encodeData("", -7));
    }

    @Test
    void encodedLengthIsCharacterCountTimesWidth() {
        for (String text : new String[] { "a", "hello", "z9z9", "thequickbrownfox0123456789" }) {
            assertEquals(text.length() * 3, codec.encodeData(text, 5).length());
        }
    }

    @Test
    void encodedLengthCountsSupplementaryCharactersOnce() {
        CharsetTable table = CharsetTable.builder().put("😀", 100).put("a", 101).build();
        DefaultSingleLockCodec emoji = new DefaultSingleLockCodec(CharsetTableHolder.of(table), LockCodecConfig.defaults());

        String encoded = emoji.encodeData("😀a😀", 2);

        assertEquals("102103102", encoded);
        assertEquals("😀a😀", emoji.decodeData(encoded, 2));
    }

    /**
     * Verifies that an unknown character anywhere in the input (here the third
     * one) fails the whole call and identifies the character and its position.
     */
    @Test
    void encodeUnknownCharacterFailsWholeInput() {
        UnknownCharacterException e = assertThrows(UnknownCharacterException.class,
                () -> codec.encodeData("ab!c", 1));

        assertEquals('!', e.codePoint());
        assertEquals(2, e.position());
        assertEquals(LockCodecException.Category.CONFIGURATION, e.category());
    }

    @Test
    void encodeOverflowIsRejectedUnderStrictPolicy() {
        assertThrows(LockOverflowException.class, () -> codec.encodeData("a", 900));
    }

    // ---------------------------------------------------------------------
    // Decode
    // ---------------------------------------------------------------------

    @Test
    void decodeSubtractsLock() {
        assertEquals("abc", codec.decodeData("101102103", 1));
    }

    @Test
    void decodeEmptyIsEmpty() {
        assertEquals("", codec.decodeData("", 1));
    }

    @Test
    void decodeRejectsLengthNotMultipleOfWidth() {
        MalformedLengthException e = assertThrows(MalformedLengthException.class,
                () -> codec.decodeData("1011021", 1));

        assertEquals(7, e.length());
        assertEquals(3, e.codeWidth());
        assertEquals(LockCodecException.Category.INPUT_FORMAT, e.category());
    }

    @Test
    void decodeRejectsNonDigitGroups() {
        MalformedDigitsException e = assertThrows(MalformedDigitsException.class,
                () -> codec.decodeData("10110a103", 1));
        assertEquals("10a", e.group());
        assertEquals(1, e.groupIndex());

        assertThrows(MalformedDigitsException.class, () -> codec.decodeData("+01", 0));
        assertThrows(MalformedDigitsException.class, () -> codec.decodeData("-01", 0));
        assertThrows(MalformedDigitsException.class, () -> codec.decodeData("١٠١", 0));
    }

    @Test
    void decodeWithWrongLockReportsUnknownCode() {
        UnknownCodeException e = assertThrows(UnknownCodeException.class,
                () -> codec.decodeData("101102103", 50));

        assertEquals(51, e.code());
        assertEquals(0, e.groupIndex());
    }

    @Test
    void decodeCodeBelowZeroIsUnknown() {
        assertThrows(UnknownCodeException.class, () -> codec.decodeData("005", 10));
    }

    // ---------------------------------------------------------------------
    // Round trip and re-lock
    // ---------------------------------------------------------------------

    @Test
    void roundTripsAcrossLocks() {
        String text = "roundtrip0123456789";
        for (int lock = -100; lock <= 864; lock += 41) {
            assertEquals(text, codec.decodeData(codec.encodeData(text, lock), lock));
        }
    }

    @Test
    void relockConvertsBetweenLocks() {
        String relocked = codec.relock("101102103", 1, 2);

        assertEquals("102103104", relocked);
        assertEquals(codec.encodeData("abc", 2), relocked);
    }

    @Test
    void wrapPolicyRoundTripsLocksThatWouldOverflow() {
        DefaultSingleLockCodec wrapping = new DefaultSingleLockCodec(tables,
                LockCodecConfig.builder().withOverflowPolicy(OverflowPolicy.WRAP).build());

        String encoded = wrapping.encodeData("az", 900);

        assertEquals("000025", encoded);
        assertEquals("az", wrapping.decodeData(encoded, 900));
    }

    // ---------------------------------------------------------------------
    // Table lifecycle
    // ---------------------------------------------------------------------

    @Test
    void failsWhenNoTableInstalled() {
        DefaultSingleLockCodec uninitialized =
                new DefaultSingleLockCodec(CharsetTableHolder.empty(), LockCodecConfig.defaults());

        assertThrows(TableNotInitializedException.class, () -> uninitialized.encodeData("abc", 1));
        assertThrows(TableNotInitializedException.class, () -> uninitialized.decodeData("101", 1));
    }

    @Test
    void nextCallUsesReplacedTable() {
        CharsetTableHolder holder = CharsetTableHolder.of(TestCharsets.lettersOnly());
        DefaultSingleLockCodec reloading = new DefaultSingleLockCodec(holder, LockCodecConfig.defaults());
        assertEquals("100", reloading.encodeData("a", 0));

        holder.install(CharsetTable.builder().put("a", 200).build());

        assertEquals("200", reloading.encodeData("a", 0));
    }
}

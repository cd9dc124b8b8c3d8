package com.questrail.lockcodec;

import com.questrail.lockcodec.charset.CharsetLoader;
import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.charset.CharsetTableHolder;
import com.questrail.lockcodec.codec.BatchEntry;
import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.error.LockCodecException;
import com.questrail.lockcodec.error.MissingDefaultLockException;
import com.questrail.lockcodec.error.TableNotInitializedException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LockCodecTest
 * -----------------------------------------------------------------------------
 * End-to-end scenarios against the bundled charset.
 */
final class LockCodecTest
{
    private static final CharsetTable DEFAULT_CHARSET = new CharsetLoader().loadDefault();

    private final LockCodec codec = new LockCodec(DEFAULT_CHARSET,
            LockCodecConfig.builder().withDefaultLock(1).build());

    // ---------------------------------------------------------------------
    // Documented scenarios
    // ---------------------------------------------------------------------

    @Test
    void encodesAndDecodesAbc() {
        assertEquals("101102103", codec.encodeData("abc", 1));
        assertEquals("abc", codec.decodeData("101102103", 1));
    }

    @Test
    void encodesBatchOfThree() {
        assertEquals(List.of("101102103", "104105106", "107108109"),
                codec.encodeBatch(List.of("abc", "def", "ghi"), 1));
    }

    @Test
    void multiLockRoundTripsHi() {
        String encoded = codec.mEncode(List.of(1, 2, 3), "hi");
        assertEquals("hi", codec.mDecode(List.of(1, 2, 3), encoded));
    }

    @Test
    void roundTripsMixedText() {
        String text = "Hello, World! 42 (v0.1.3) \"quoted\" path/to\\file\n";
        for (int lock : new int[] { -100, 0, 1, 37, 803 }) {
            assertEquals(text, codec.decodeData(codec.encodeData(text, lock), lock));
        }
        assertEquals(text, codec.mDecode(List.of(5, 0, 9), codec.mEncode(List.of(5, 0, 9), text)));
    }

    // ---------------------------------------------------------------------
    // Default lock
    // ---------------------------------------------------------------------

    @Test
    void defaultLockOverloadsUseConfiguredLock() {
        assertEquals("101102103", codec.encodeData("abc"));
        assertEquals("abc", codec.decodeData("101102103"));
        assertEquals(List.of("101", "102"), codec.encodeBatch(List.of("a", "b")));
        assertEquals(List.of("a", "b"), codec.decodeBatch(List.of("101", "102")));
        assertEquals("102103104", codec.relock("101102103", 2));
        assertTrue(codec.encodeEach(List.of("a")).get(0).isSuccess());
        assertEquals("a", codec.decodeEach(List.of("101")).get(0).value());
        assertEquals(1, codec.defaultLock().orElseThrow());
    }

    @Test
    void defaultLockOverloadsFailWithoutDefault() {
        LockCodec explicitOnly = new LockCodec(DEFAULT_CHARSET);

        MissingDefaultLockException e = assertThrows(MissingDefaultLockException.class,
                () -> explicitOnly.encodeData("abc"));
        assertEquals(LockCodecException.Category.USAGE, e.category());
        assertEquals("101102103", explicitOnly.encodeData("abc", 1));
    }

    // ---------------------------------------------------------------------
    // Failure behaviour
    // ---------------------------------------------------------------------

    @Test
    void unmappedCharacterFailsWithoutOutput() {
        UnknownCharacterException e = assertThrows(UnknownCharacterException.class,
                () -> codec.encodeData("abc€", 1));
        assertEquals("€", e.character());
        assertEquals(3, e.position());
    }

    @Test
    void lenientBatchMirrorsPerElementOutcome() {
        List<BatchEntry> entries = codec.encodeEach(List.of("abc", "def", "€"), 1);

        assertEquals("101102103", entries.get(0).value());
        assertEquals("104105106", entries.get(1).value());
        assertFalse(entries.get(2).isSuccess());
    }

    @Test
    void uninstalledTableFailsUntilLoaded() {
        CharsetTableHolder holder = CharsetTableHolder.empty();
        LockCodec lateBound = new LockCodec(holder, LockCodecConfig.defaults());

        assertThrows(TableNotInitializedException.class, () -> lateBound.encodeData("abc", 1));
        assertThrows(TableNotInitializedException.class, () -> lateBound.mEncode(List.of(1), "abc"));

        holder.install(DEFAULT_CHARSET);

        assertEquals("101102103", lateBound.encodeData("abc", 1));
        assertSame(holder, lateBound.tables());
    }
}

package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.charset.CharsetTable;
import com.questrail.lockcodec.config.OverflowPolicy;
import com.questrail.lockcodec.error.LockOverflowException;
import com.questrail.lockcodec.error.MalformedDigitsException;
import com.questrail.lockcodec.error.MalformedLengthException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import com.questrail.lockcodec.error.UnknownCodeException;

/**
 * LockTransform
 * -----------------------------------------------------------------------------
 * The single-lock arithmetic shared by every codec.
 *
 * <p>Purely mechanical: takes an already-resolved table snapshot, reports
 * nothing, and either returns the complete result or throws.</p>
 */
final class LockTransform
{
    private LockTransform() {}

    static String encode(CharsetTable table, String text, int lock, OverflowPolicy policy)
    {
        final int width = table.codeWidth();
        final StringBuilder out = new StringBuilder(text.length() * width);

        int position = 0;
        for (int i = 0; i < text.length(); ) {
            final int codePoint = text.codePointAt(i);
            if (!table.contains(codePoint)) {
                throw new UnknownCharacterException(codePoint, position);
            }

            final int locked = applyLock(table, table.codeOf(codePoint), lock, policy);
            appendPadded(out, locked, width);

            i += Character.charCount(codePoint);
            position++;
        }

        return out.toString();
    }

    static String decode(CharsetTable table, String encoded, int lock, OverflowPolicy policy)
    {
        final int width = table.codeWidth();
        if (encoded.length() % width != 0) {
            throw new MalformedLengthException(encoded.length(), width);
        }

        final int groups = encoded.length() / width;
        final StringBuilder out = new StringBuilder(groups);

        for (int g = 0; g < groups; g++) {
            final int start = g * width;
            final int value = parseGroup(encoded, start, width, g);

            final long code = removeLock(table, value, lock, policy);
            if (code < 0 || code > Integer.MAX_VALUE || !table.containsCode((int) code)) {
                throw new UnknownCodeException(code, g);
            }
            out.appendCodePoint(table.codePointOf((int) code));
        }

        return out.toString();
    }

    static int applyLock(CharsetTable table, int code, int lock, OverflowPolicy policy)
    {
        final long locked = (long) code + lock;
        if (policy == OverflowPolicy.WRAP) {
            return (int) Math.floorMod(locked, (long) table.modulus());
        }
        if (locked < 0 || locked >= table.modulus()) {
            throw new LockOverflowException(code, lock, table.codeWidth());
        }
        return (int) locked;
    }

    static long removeLock(CharsetTable table, int value, int lock, OverflowPolicy policy)
    {
        final long code = (long) value - lock;
        if (policy == OverflowPolicy.WRAP) {
            return Math.floorMod(code, (long) table.modulus());
        }
        return code;
    }

    private static int parseGroup(String encoded, int start, int width, int groupIndex)
    {
        // Only ASCII digits; Integer.parseInt would also accept signs and non-ASCII digits.
        int value = 0;
        for (int i = start; i < start + width; i++) {
            final char c = encoded.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedDigitsException(encoded.substring(start, start + width), groupIndex);
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private static void appendPadded(StringBuilder out, int value, int width)
    {
        final String digits = Integer.toString(value);
        for (int pad = width - digits.length(); pad > 0; pad--) {
            out.append('0');
        }
        out.append(digits);
    }

    static int characterCount(String text)
    {
        return text.codePointCount(0, text.length());
    }
}

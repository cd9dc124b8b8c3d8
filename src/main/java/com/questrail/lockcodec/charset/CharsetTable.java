package com.questrail.lockcodec.charset;

import com.questrail.lockcodec.error.InvalidCharsetException;
import com.questrail.lockcodec.error.UnknownCharacterException;
import com.questrail.lockcodec.error.UnknownCodeException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CharsetTable
 * -----------------------------------------------------------------------------
 * Immutable bidirectional mapping between characters and fixed-width decimal
 * codes.
 *
 * <p>Characters are Unicode code points, so supplementary characters count as
 * one character. The table is backed by:</p>
 * <ul>
 *   <li>a map for code point -> code</li>
 *   <li>a map for code -> code point</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * Checked once by {@link Builder#build()}:
 * <ul>
 *   <li>at least one entry</li>
 *   <li>every code is non-negative and fits in {@link #codeWidth()} digits</li>
 *   <li>no two characters share a code</li>
 * </ul>
 *
 * A table never changes after construction and may be shared freely between
 * threads. Use {@link CharsetTableHolder} to swap tables at runtime.
 */
public final class CharsetTable
{
    /** Largest supported code width; 10^9 still fits in an {@code int}. */
    public static final int MAX_CODE_WIDTH = 9;

    private final Map<Integer, Integer> codeByCodePoint;
    private final Map<Integer, Integer> codePointByCode;
    private final int codeWidth;
    private final int modulus;

    private CharsetTable(Map<Integer, Integer> codeByCodePoint, Map<Integer, Integer> codePointByCode, int codeWidth) {
        this.codeByCodePoint = codeByCodePoint;
        this.codePointByCode = codePointByCode;
        this.codeWidth = codeWidth;
        this.modulus = pow10(codeWidth);
    }

    /**
     * Returns the code for the given character.
     *
     * @throws UnknownCharacterException if the character is not mapped
     */
    public int codeOf(int codePoint) {
        Integer code = codeByCodePoint.get(codePoint);
        if (code == null) {
            throw new UnknownCharacterException(codePoint, -1);
        }
        return code;
    }

    /**
     * Reverse lookup: returns the character for the given code.
     *
     * @throws UnknownCodeException if no character has this code
     */
    public int codePointOf(int code) {
        Integer codePoint = codePointByCode.get(code);
        if (codePoint == null) {
            throw new UnknownCodeException(code, -1);
        }
        return codePoint;
    }

    public boolean contains(int codePoint) {
        return codeByCodePoint.containsKey(codePoint);
    }

    public boolean containsCode(int code) {
        return codePointByCode.containsKey(code);
    }

    /**
     * @return {@code true} if every decimal digit {@code 0-9} has a code
     */
    public boolean coversDecimalDigits() {
        for (int digit = '0'; digit <= '9'; digit++) {
            if (!codeByCodePoint.containsKey(digit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return number of decimal digits every code occupies in encoded text
     */
    public int codeWidth() {
        return codeWidth;
    }

    /**
     * @return {@code 10^codeWidth}, one past the largest representable code
     */
    public int modulus() {
        return modulus;
    }

    public int size() {
        return codeByCodePoint.size();
    }

    /**
     * @return read-only view of code point -> code, in insertion order
     */
    public Map<Integer, Integer> asMap() {
        return codeByCodePoint;
    }

    /**
     * Returns a builder pre-populated with this table's entries and code width.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.entries.putAll(codeByCodePoint);
        builder.codeWidth = codeWidth;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CharsetTable other)) {
            return false;
        }
        return codeWidth == other.codeWidth && codeByCodePoint.equals(other.codeByCodePoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(codeByCodePoint, codeWidth);
    }

    @Override
    public String toString() {
        return "CharsetTable{size=" + size() + ", codeWidth=" + codeWidth + "}";
    }

    static int pow10(int exponent) {
        int value = 1;
        for (int i = 0; i < exponent; i++) {
            value *= 10;
        }
        return value;
    }

    static int digitCount(int value) {
        return Integer.toString(value).length();
    }

    /**
     * Mutable staging area for a {@link CharsetTable}.
     *
     * <p>Nothing is validated until {@link #build()}, so entries may be added,
     * replaced and removed in any order.</p>
     */
    public static final class Builder
    {
        private final Map<Integer, Integer> entries = new LinkedHashMap<>();
        private Integer codeWidth;

        private Builder() {}

        /**
         * Maps a single character to a code, replacing any previous code.
         */
        public Builder put(int codePoint, int code) {
            entries.put(codePoint, code);
            return this;
        }

        /**
         * Maps a one-character string to a code.
         *
         * @throws InvalidCharsetException if {@code character} is not exactly one character
         */
        public Builder put(String character, int code) {
            return put(singleCodePoint(character), code);
        }

        /**
         * Maps a character to one more than the largest code present, or to 0
         * when the builder is empty. Does nothing if the character is already mapped.
         */
        public Builder append(int codePoint) {
            if (!entries.containsKey(codePoint)) {
                int next = entries.values().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
                entries.put(codePoint, next);
            }
            return this;
        }

        public Builder append(String character) {
            return append(singleCodePoint(character));
        }

        public Builder remove(int codePoint) {
            entries.remove(codePoint);
            return this;
        }

        public Builder remove(String character) {
            return remove(singleCodePoint(character));
        }

        /**
         * Merges another table: characters already present keep their code.
         */
        public Builder putAllAbsent(CharsetTable other) {
            Objects.requireNonNull(other, "other");
            other.codeByCodePoint.forEach(entries::putIfAbsent);
            return this;
        }

        /**
         * Fixes the code width. When unset, the width is the digit count of the
         * largest code.
         */
        public Builder codeWidth(int codeWidth) {
            if (codeWidth < 1 || codeWidth > MAX_CODE_WIDTH) {
                throw new InvalidCharsetException("Code width must be 1-" + MAX_CODE_WIDTH + ": " + codeWidth);
            }
            this.codeWidth = codeWidth;
            return this;
        }

        public CharsetTable build() {
            if (entries.isEmpty()) {
                throw new InvalidCharsetException("Charset must map at least one character");
            }

            int maxCode = 0;
            for (Map.Entry<Integer, Integer> e : entries.entrySet()) {
                int code = e.getValue();
                if (code < 0) {
                    throw new InvalidCharsetException("Negative code " + code + " for '"
                            + new String(Character.toChars(e.getKey())) + "'");
                }
                maxCode = Math.max(maxCode, code);
            }

            final int width = codeWidth != null ? codeWidth : digitCount(maxCode);
            if (width > MAX_CODE_WIDTH || digitCount(maxCode) > width) {
                throw new InvalidCharsetException("Code " + maxCode + " does not fit in " + width + " digits");
            }

            Map<Integer, Integer> inverse = new HashMap<>(entries.size() * 2);
            for (Map.Entry<Integer, Integer> e : entries.entrySet()) {
                Integer prev = inverse.put(e.getValue(), e.getKey());
                if (prev != null) {
                    throw new InvalidCharsetException("Code " + e.getValue() + " is shared by '"
                            + new String(Character.toChars(prev)) + "' and '"
                            + new String(Character.toChars(e.getKey())) + "'");
                }
            }

            return new CharsetTable(
                    Collections.unmodifiableMap(new LinkedHashMap<>(entries)),
                    Collections.unmodifiableMap(inverse),
                    width);
        }

        private static int singleCodePoint(String character) {
            Objects.requireNonNull(character, "character");
            if (character.isEmpty() || character.codePointCount(0, character.length()) != 1) {
                throw new InvalidCharsetException("Charset keys must be a single character: '" + character + "'");
            }
            return character.codePointAt(0);
        }
    }
}

package io.atprose.types.encoding;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Unpadded base32 codec over a configurable 32-character alphabet.
 *
 * <p>
 * Two alphabets are used by the protocol: RFC 4648 lowercase (multibase
 * prefix {@code b}, {@code did:plc} identifiers) and the sortable alphabet
 * used by timestamp identifiers, whose character order matches numeric order.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class Base32 {

    /** RFC 4648 alphabet, lowercase. */
    public static final Base32 RFC4648_LOWER = new Base32("abcdefghijklmnopqrstuvwxyz234567");

    /** Sortable alphabet used by timestamp identifiers. */
    public static final Base32 SORTABLE = new Base32("234567abcdefghijklmnopqrstuvwxyz");

    private final char[] alphabet;
    private final int[] lookup = new int[128];

    private Base32(String alphabet) {
        this.alphabet = alphabet.toCharArray();
        Arrays.fill(lookup, -1);
        for (int i = 0; i < this.alphabet.length; i++) {
            lookup[this.alphabet[i]] = i;
        }
    }

    /** Returns the 5-bit value of {@code c}, or -1 if it is not in this alphabet. */
    public int valueOf(char c) {
        return c < 128 ? lookup[c] : -1;
    }

    /** Returns the alphabet character for a 5-bit value. */
    public char charAt(int value) {
        return alphabet[value];
    }

    /** Encodes bytes without padding. */
    public String encode(byte[] data) {
        StringBuilder out = new StringBuilder((data.length * 8 + 4) / 5);
        int buffer = 0;
        int bits = 0;
        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                out.append(alphabet[(buffer >>> (bits - 5)) & 0x1F]);
                bits -= 5;
            }
        }
        if (bits > 0) {
            out.append(alphabet[(buffer << (5 - bits)) & 0x1F]);
        }
        return out.toString();
    }

    /**
     * Decodes an unpadded string.
     *
     * @throws IllegalArgumentException if a character is outside the alphabet or trailing bits are
     *     non-zero
     */
    public byte[] decode(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() * 5 / 8);
        int buffer = 0;
        int bits = 0;
        for (int i = 0; i < text.length(); i++) {
            int value = valueOf(text.charAt(i));
            if (value < 0) {
                throw new IllegalArgumentException("invalid base32 character at index " + i);
            }
            buffer = (buffer << 5) | value;
            bits += 5;
            if (bits >= 8) {
                out.write((buffer >>> (bits - 8)) & 0xFF);
                bits -= 8;
            }
        }
        if (bits >= 5 || (buffer & ((1 << bits) - 1)) != 0) {
            throw new IllegalArgumentException("invalid base32 length or trailing bits");
        }
        return out.toByteArray();
    }

    /** Encodes a 64-bit value as exactly 13 characters, most significant first. */
    public String encodeLong(long value) {
        char[] out = new char[13];
        long remaining = value;
        for (int i = 12; i >= 0; i--) {
            out[i] = alphabet[(int) (remaining & 0x1F)];
            remaining >>>= 5;
        }
        return new String(out);
    }

    /**
     * Decodes exactly 13 characters into a 64-bit value. The caller must have checked the length
     * and that the first character carries at most four significant bits.
     */
    public long decodeLong(String text) {
        long value = 0;
        for (int i = 0; i < text.length(); i++) {
            int digit = valueOf(text.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("invalid base32 character at index " + i);
            }
            value = (value << 5) | digit;
        }
        return value;
    }
}

package io.atprose.types;

import io.atprose.types.encoding.Base32;
import java.time.Instant;

/**
 * A timestamp identifier: a 64-bit value (high bit zero, 53 bits of microseconds since the Unix
 * epoch, 10 bits of clock id) written as 13 characters of sortable base32. String order equals
 * numeric order.
 */
public final class Tid implements Comparable<Tid> {

    static final int LENGTH = 13;

    private static final long TIMESTAMP_MASK = 0x1F_FFFF_FFFF_FFFFL;
    private static final int CLOCK_ID_MASK = 0x3FF;

    private final long value;

    private Tid(long value) {
        this.value = value;
    }

    /**
     * Builds a TID from its parts. Bits beyond the field widths are dropped.
     *
     * @param timestampMicros microseconds since the Unix epoch
     * @param clockId         clock identifier, 0 to 1023
     */
    public static Tid of(long timestampMicros, int clockId) {
        return new Tid(((timestampMicros & TIMESTAMP_MASK) << 10) | (clockId & CLOCK_ID_MASK));
    }

    /**
     * Parses the 13-character string form.
     *
     * @throws InvalidFormatException if the TID is invalid
     */
    public static Tid parse(String raw) {
        if (raw == null || raw.length() != LENGTH) {
            throw new InvalidFormatException(FormatError.TID_BAD_LENGTH, raw);
        }
        for (int i = 0; i < raw.length(); i++) {
            if (Base32.SORTABLE.valueOf(raw.charAt(i)) < 0) {
                throw new InvalidFormatException(FormatError.TID_INVALID_CHARACTER, raw);
            }
        }
        // 13 x 5 bits is 65, so the first character holds the top four bits and
        // the high bit must stay clear: 0..7 -> '2'..'7', 'a', 'b'
        if (Base32.SORTABLE.valueOf(raw.charAt(0)) > 0x7) {
            throw new InvalidFormatException(FormatError.TID_HIGH_BIT_SET, raw);
        }
        return new Tid(Base32.SORTABLE.decodeLong(raw));
    }

    /** Returns {@code true} if {@code raw} parses. */
    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    /** Microseconds since the Unix epoch. */
    public long timestampMicros() {
        return (value >>> 10) & TIMESTAMP_MASK;
    }

    /** The clock id, 0 to 1023. */
    public int clockId() {
        return (int) (value & CLOCK_ID_MASK);
    }

    /** The timestamp as an {@link Instant}. */
    public Instant instant() {
        long micros = timestampMicros();
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }

    /** The raw 64-bit value. */
    public long longValue() {
        return value;
    }

    @Override
    public int compareTo(Tid other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Tid other && value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Base32.SORTABLE.encodeLong(value);
    }
}

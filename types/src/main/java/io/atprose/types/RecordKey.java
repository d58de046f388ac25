package io.atprose.types;

import java.nio.charset.StandardCharsets;

/**
 * The key of a record within its repository collection.
 *
 * <p>
 * A record key is 1 to 512 bytes of UTF-8, must not be {@code .} or
 * {@code ..}, and must not contain {@code /}, whitespace or control
 * characters. A key that happens to be a valid {@link Tid} is reported as
 * such by {@link #isTid()}.
 */
public final class RecordKey {

    static final int MAX_BYTES = 512;

    private final String value;

    private RecordKey(String value) {
        this.value = value;
    }

    /**
     * Parses a record key.
     *
     * @throws InvalidFormatException if the key is invalid
     */
    public static RecordKey parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.RKEY_EMPTY, raw);
        }
        if (raw.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            throw new InvalidFormatException(FormatError.RKEY_TOO_LONG, raw);
        }
        if (raw.equals(".") || raw.equals("..")) {
            throw new InvalidFormatException(FormatError.RKEY_RESERVED, raw);
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '/' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidFormatException(FormatError.RKEY_INVALID_CHARACTER, raw);
            }
        }
        return new RecordKey(raw);
    }

    /** Wraps a TID as a record key. */
    public static RecordKey of(Tid tid) {
        return new RecordKey(tid.toString());
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

    /** Returns {@code true} if this key is also a well-formed TID. */
    public boolean isTid() {
        return Tid.isValid(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordKey other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

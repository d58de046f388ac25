package io.atprose.types;

import java.util.Locale;
import java.util.Set;

/**
 * A protocol handle: a DNS hostname such as {@code alice.example.com}.
 *
 * <p>
 * Handles compare case-insensitively; the canonical form returned by
 * {@link #toString()} is lowercase.
 *
 * <p>
 * In strict mode a handle must contain at least two labels, its top-level
 * label must start with a letter, and it must not end in a reserved
 * top-level domain. Lenient mode only enforces hostname syntax.
 */
public final class Handle {

    static final int MAX_LENGTH = 253;
    static final int MAX_LABEL_LENGTH = 63;

    private static final Set<String> RESERVED_TLDS =
            Set.of("alt", "arpa", "example", "internal", "invalid", "local", "localhost", "onion");

    private final String value;

    private Handle(String value) {
        this.value = value;
    }

    /** Parses a handle in strict mode. */
    public static Handle parse(String raw) {
        return parse(raw, true);
    }

    /**
     * Parses and canonicalizes a handle.
     *
     * @param raw    the handle text
     * @param strict whether to apply the strict-mode rules
     * @throws InvalidFormatException if the handle is invalid
     */
    public static Handle parse(String raw, boolean strict) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.HANDLE_EMPTY, raw);
        }
        if (raw.length() > MAX_LENGTH) {
            throw new InvalidFormatException(FormatError.HANDLE_TOO_LONG, raw);
        }
        String[] labels = raw.split("\\.", -1);
        for (String label : labels) {
            checkLabel(label, raw);
        }
        String canonical = raw.toLowerCase(Locale.ROOT);
        if (strict) {
            if (labels.length < 2) {
                throw new InvalidFormatException(FormatError.HANDLE_SINGLE_LABEL, raw);
            }
            String tld = labels[labels.length - 1].toLowerCase(Locale.ROOT);
            if (!Character.isLetter(tld.charAt(0))) {
                throw new InvalidFormatException(FormatError.HANDLE_NUMERIC_TLD, raw);
            }
            if (RESERVED_TLDS.contains(tld)) {
                throw new InvalidFormatException(FormatError.HANDLE_RESERVED_TLD, raw);
            }
        }
        return new Handle(canonical);
    }

    /** Returns {@code true} if {@code raw} parses in strict mode. */
    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    private static void checkLabel(String label, String raw) {
        if (label.isEmpty()) {
            throw new InvalidFormatException(FormatError.LABEL_EMPTY, raw);
        }
        if (label.length() > MAX_LABEL_LENGTH) {
            throw new InvalidFormatException(FormatError.LABEL_TOO_LONG, raw);
        }
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alnum && c != '-') {
                throw new InvalidFormatException(FormatError.LABEL_INVALID_CHARACTER, raw);
            }
        }
        if (label.charAt(0) == '-' || label.charAt(label.length() - 1) == '-') {
            throw new InvalidFormatException(FormatError.LABEL_HYPHEN_EDGE, raw);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Handle other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /** The canonical lowercase form. */
    @Override
    public String toString() {
        return value;
    }
}

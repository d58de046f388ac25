package io.atprose.types;

import java.util.Locale;

/**
 * A namespaced identifier such as {@code app.bsky.feed.post}: a reversed domain authority
 * ({@code app.bsky.feed}) followed by a name ({@code post}).
 *
 * <p>
 * Domain segments compare case-insensitively and are canonicalized to lowercase; the name is
 * case-sensitive and kept as written.
 */
public final class Nsid implements Comparable<Nsid> {

    static final int MAX_LENGTH = 317;
    static final int MAX_SEGMENT_LENGTH = 63;

    private final String authority;
    private final String name;

    private Nsid(String authority, String name) {
        this.authority = authority;
        this.name = name;
    }

    /**
     * Parses and canonicalizes an NSID.
     *
     * @throws InvalidFormatException if the NSID is invalid
     */
    public static Nsid parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.NSID_TOO_FEW_SEGMENTS, raw);
        }
        if (raw.length() > MAX_LENGTH) {
            throw new InvalidFormatException(FormatError.NSID_TOO_LONG, raw);
        }
        String[] segments = raw.split("\\.", -1);
        if (segments.length < 3) {
            throw new InvalidFormatException(FormatError.NSID_TOO_FEW_SEGMENTS, raw);
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new InvalidFormatException(FormatError.NSID_SEGMENT_EMPTY, raw);
            }
            if (segment.length() > MAX_SEGMENT_LENGTH) {
                throw new InvalidFormatException(FormatError.NSID_SEGMENT_TOO_LONG, raw);
            }
        }
        for (int i = 0; i < segments.length - 1; i++) {
            checkDomainSegment(segments[i], i == 0, raw);
        }
        String name = segments[segments.length - 1];
        checkName(name, raw);

        String authority = raw.substring(0, raw.length() - name.length() - 1).toLowerCase(Locale.ROOT);
        return new Nsid(authority, name);
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

    private static void checkDomainSegment(String segment, boolean first, String raw) {
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alnum && c != '-') {
                throw new InvalidFormatException(FormatError.NSID_INVALID_DOMAIN_LABEL, raw);
            }
        }
        if (segment.charAt(0) == '-' || segment.charAt(segment.length() - 1) == '-') {
            throw new InvalidFormatException(FormatError.NSID_INVALID_DOMAIN_LABEL, raw);
        }
        if (first && Character.isDigit(segment.charAt(0))) {
            throw new InvalidFormatException(FormatError.NSID_INVALID_DOMAIN_LABEL, raw);
        }
    }

    private static void checkName(String name, String raw) {
        char first = name.charAt(0);
        if (!((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z'))) {
            throw new InvalidFormatException(FormatError.NSID_INVALID_NAME, raw);
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
                throw new InvalidFormatException(FormatError.NSID_INVALID_NAME, raw);
            }
        }
    }

    /** The reversed-domain authority, e.g. {@code app.bsky.feed}. */
    public String authority() {
        return authority;
    }

    /** The final name segment, e.g. {@code post}. */
    public String name() {
        return name;
    }

    @Override
    public int compareTo(Nsid other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Nsid other && authority.equals(other.authority) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * authority.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return authority + "." + name;
    }
}

package io.atprose.types;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An RFC 3339 datetime with a mandatory timezone, e.g. {@code 2024-02-06T14:00:00.123Z} or
 * {@code 2024-02-06T16:00:00+02:00}.
 *
 * <p>
 * Seconds are mandatory and fractional seconds optional. The canonical form uppercases the
 * {@code T} separator and a {@code Z} offset and otherwise keeps the input, so precision and the
 * original offset are preserved. Equality is on the canonical string; use {@link #instant()} to
 * compare points in time.
 */
public final class Datetime {

    private static final Pattern RFC3339 = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2})[Tt](\\d{2}:\\d{2}:\\d{2})(\\.\\d{1,9})?([Zz]|[+-]\\d{2}:\\d{2})?$");

    private final String canonical;
    private final OffsetDateTime value;

    private Datetime(String canonical, OffsetDateTime value) {
        this.canonical = canonical;
        this.value = value;
    }

    /**
     * Parses and canonicalizes a datetime.
     *
     * @throws InvalidFormatException if the datetime is invalid or has no timezone
     */
    public static Datetime parse(String raw) {
        if (raw == null) {
            throw new InvalidFormatException(FormatError.DATETIME_MALFORMED, null);
        }
        Matcher m = RFC3339.matcher(raw);
        if (!m.matches()) {
            throw new InvalidFormatException(FormatError.DATETIME_MALFORMED, raw);
        }
        String offset = m.group(4);
        if (offset == null) {
            throw new InvalidFormatException(FormatError.MISSING_TIMEZONE, raw);
        }
        if (offset.equals("-00:00")) {
            throw new InvalidFormatException(FormatError.UNKNOWN_LOCAL_OFFSET, raw);
        }
        String fraction = m.group(3) == null ? "" : m.group(3);
        String canonical = m.group(1) + "T" + m.group(2) + fraction + (offset.equalsIgnoreCase("z") ? "Z" : offset);
        try {
            return new Datetime(canonical, OffsetDateTime.parse(canonical, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeException e) {
            throw new InvalidFormatException(FormatError.DATETIME_OUT_OF_RANGE, raw);
        }
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

    /** The parsed date, time and offset. */
    public OffsetDateTime offsetDateTime() {
        return value;
    }

    /** The point in time. */
    public Instant instant() {
        return value.toInstant();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Datetime other && canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}

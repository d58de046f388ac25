package io.atprose.lexicon.model;

import io.atprose.types.FormatError;
import java.util.List;
import java.util.Objects;

/**
 * What is wrong with an instance value. A closed set: validators and callers can switch over it
 * exhaustively.
 */
public sealed interface ViolationKind {

    /** A short human-readable description. */
    String describe();

    // ── Structure ──

    /** A required property is absent or null. */
    record MissingRequiredField() implements ViolationKind {
        @Override
        public String describe() {
            return "required field is missing";
        }
    }

    /** The value has the wrong JSON type, e.g. a string where an integer is declared. */
    record UnexpectedType(String expected, String actual) implements ViolationKind {
        @Override
        public String describe() {
            return "expected " + expected + " but found " + actual;
        }
    }

    /** A property that a closed object does not declare. */
    record UnexpectedField() implements ViolationKind {
        @Override
        public String describe() {
            return "field is not declared by a closed object";
        }
    }

    /** Instance nesting exceeded the configured ceiling. */
    record NestingTooDeep(int maxDepth) implements ViolationKind {
        @Override
        public String describe() {
            return "nesting deeper than " + maxDepth;
        }
    }

    // ── Strings ──

    /** UTF-8 byte length above {@code maxLength}. */
    record StringTooLong(int max, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "string is " + actual + " bytes, max " + max;
        }
    }

    /** UTF-8 byte length below {@code minLength}. */
    record StringTooShort(int min, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "string is " + actual + " bytes, min " + min;
        }
    }

    /** Grapheme count above {@code maxGraphemes}. */
    record StringTooManyGraphemes(int max, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "string has " + actual + " graphemes, max " + max;
        }
    }

    /** Grapheme count below {@code minGraphemes}. */
    record StringTooFewGraphemes(int min, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "string has " + actual + " graphemes, min " + min;
        }
    }

    /** The string does not satisfy its declared {@code format}. */
    record FormatMismatch(String format, FormatError error) implements ViolationKind {
        public FormatMismatch {
            Objects.requireNonNull(format, "format must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public String describe() {
            return "not a valid " + format + ": " + error.description();
        }
    }

    // ── Values ──

    /** The value is not one of the allowed literals ({@code enum}, {@code const} or a token). */
    record EnumMismatch(List<Object> allowed) implements ViolationKind {
        public EnumMismatch {
            allowed = List.copyOf(allowed);
        }

        @Override
        public String describe() {
            return "value must be one of " + allowed;
        }
    }

    /** An integer outside {@code minimum}..{@code maximum}; a null bound is open. */
    record OutOfRange(Long minimum, Long maximum, Number actual) implements ViolationKind {
        @Override
        public String describe() {
            return actual + " is outside [" + (minimum == null ? "" : minimum) + ", "
                    + (maximum == null ? "" : maximum) + "]";
        }
    }

    /** Array item count outside {@code minLength}..{@code maxLength}; a null bound is open. */
    record ArrayLengthOutOfBounds(Integer min, Integer max, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "array has " + actual + " items, allowed [" + (min == null ? 0 : min) + ", "
                    + (max == null ? "" : max) + "]";
        }
    }

    /** Decoded byte count outside {@code minLength}..{@code maxLength}; a null bound is open. */
    record BytesLengthOutOfBounds(Integer min, Integer max, int actual) implements ViolationKind {
        @Override
        public String describe() {
            return "bytes value has " + actual + " bytes, allowed [" + (min == null ? 0 : min) + ", "
                    + (max == null ? "" : max) + "]";
        }
    }

    // ── Unions and blobs ──

    /** A closed union has no member with the value's {@code $type}. */
    record UnknownUnionTag(String tag) implements ViolationKind {
        @Override
        public String describe() {
            return "unknown union member '" + tag + "'";
        }
    }

    /** The blob's MIME type matches none of the {@code accept} patterns. */
    record BlobRejected(String mimeType, List<String> accept) implements ViolationKind {
        public BlobRejected {
            accept = List.copyOf(accept);
        }

        @Override
        public String describe() {
            return "blob type " + mimeType + " is not in " + accept;
        }
    }

    /** The blob is larger than {@code maxSize}. */
    record BlobTooLarge(long maxSize, long actual) implements ViolationKind {
        @Override
        public String describe() {
            return "blob is " + actual + " bytes, max " + maxSize;
        }
    }

    // ── Record keys ──

    /** The record key does not satisfy the record type's key strategy. */
    record InvalidKey(String reason) implements ViolationKind {
        public InvalidKey {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public String describe() {
            return "invalid record key: " + reason;
        }
    }
}

package io.atprose.types;

import java.util.Objects;

/** Thrown when an identifier string fails validation. Carries the specific rule that failed. */
public class InvalidFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final FormatError error;
    private final String input;

    public InvalidFormatException(FormatError error, String input) {
        super(error.description() + ": '" + abbreviate(input) + "'");
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.input = input;
    }

    /** The rule that was violated. */
    public FormatError error() {
        return error;
    }

    /** The rejected input. */
    public String input() {
        return input;
    }

    private static String abbreviate(String input) {
        if (input == null) {
            return "null";
        }
        return input.length() <= 64 ? input : input.substring(0, 61) + "...";
    }
}

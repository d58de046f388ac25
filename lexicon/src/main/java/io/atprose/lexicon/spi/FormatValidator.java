package io.atprose.lexicon.spi;

import io.atprose.types.InvalidFormatException;

/**
 * Checks a string against one named {@code format} and returns its canonical form.
 *
 * <p>
 * Implementations must be pure and thread-safe: one validator instance is shared by every graph
 * built while it is registered.
 */
@FunctionalInterface
public interface FormatValidator {

    /**
     * @param raw the string value from the instance
     * @return the canonical form of {@code raw}
     * @throws InvalidFormatException if {@code raw} does not satisfy the format
     */
    String normalize(String raw);
}

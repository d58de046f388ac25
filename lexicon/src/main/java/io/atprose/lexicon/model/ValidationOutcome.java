package io.atprose.lexicon.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating one instance value. Either {@link Valid} with the normalized value, or
 * {@link Invalid} with every violation found, in document order.
 */
public sealed interface ValidationOutcome {

    boolean isValid();

    /** The violations, empty when valid. */
    List<Violation> violations();

    /** The value conforms. {@code value} is a fresh tree with canonical identifier forms. */
    record Valid(JsonNode value) implements ValidationOutcome {
        public Valid {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public List<Violation> violations() {
            return List.of();
        }
    }

    record Invalid(List<Violation> violations) implements ValidationOutcome {
        public Invalid {
            violations = List.copyOf(violations);
            if (violations.isEmpty()) {
                throw new IllegalArgumentException("an invalid outcome needs at least one violation");
            }
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}

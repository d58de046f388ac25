package io.atprose.lexicon.model;

import io.atprose.types.RecordKey;
import java.util.Objects;

/** Result of checking or deriving a record's repository key. */
public sealed interface KeyOutcome {

    boolean isAccepted();

    /**
     * The key to store the record under.
     *
     * @param key       the canonical key
     * @param generated {@code true} if the key was derived rather than supplied by the caller
     */
    record Accepted(RecordKey key, boolean generated) implements KeyOutcome {
        public Accepted {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    record Rejected(ViolationKind.InvalidKey reason) implements KeyOutcome {
        public Rejected {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}

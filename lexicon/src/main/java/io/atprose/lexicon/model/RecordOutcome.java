package io.atprose.lexicon.model;

import java.util.Objects;

/**
 * Result of validating a record for storage. Payload and key are judged independently so a
 * caller can retry key generation without revalidating the payload.
 */
public record RecordOutcome(ValidationOutcome payload, KeyOutcome key) {

    public RecordOutcome {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    /** {@code true} if both the payload and the key are acceptable. */
    public boolean isValid() {
        return payload.isValid() && key.isAccepted();
    }
}

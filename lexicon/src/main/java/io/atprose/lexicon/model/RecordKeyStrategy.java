package io.atprose.lexicon.model;

import java.util.Objects;

/**
 * How the repository key of a record type is chosen: {@code tid}, {@code literal:<value>},
 * {@code any} or {@code nsid}.
 */
public sealed interface RecordKeyStrategy {

    /**
     * Parses the {@code key} value of a record definition.
     *
     * @throws IllegalArgumentException if the value names no known strategy
     */
    static RecordKeyStrategy parse(String raw) {
        Objects.requireNonNull(raw, "key strategy must not be null");
        if (raw.startsWith("literal:")) {
            return new LiteralKey(raw.substring("literal:".length()));
        }
        return switch (raw) {
            case "tid" -> new TidKey();
            case "any" -> new AnyKey();
            case "nsid" -> new NsidKey();
            default -> throw new IllegalArgumentException("Unknown record key strategy: '" + raw + "'");
        };
    }

    // ── Implementations ──

    /** Keys are timestamp identifiers. */
    record TidKey() implements RecordKeyStrategy {
        @Override
        public String toString() {
            return "tid";
        }
    }

    /** Every record of the collection uses the same fixed key, e.g. {@code self}. */
    record LiteralKey(String value) implements RecordKeyStrategy {
        public LiteralKey {
            Objects.requireNonNull(value, "literal key must not be null");
            if (value.isEmpty()) {
                throw new IllegalArgumentException("literal key must not be empty");
            }
        }

        @Override
        public String toString() {
            return "literal:" + value;
        }
    }

    /** Any syntactically valid record key. */
    record AnyKey() implements RecordKeyStrategy {
        @Override
        public String toString() {
            return "any";
        }
    }

    /** The key must itself be a valid NSID. */
    record NsidKey() implements RecordKeyStrategy {
        @Override
        public String toString() {
            return "nsid";
        }
    }
}

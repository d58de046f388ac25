package io.atprose.lexicon.model;

import java.util.Objects;

/** One problem found in an instance value, and where. */
public record Violation(FieldPath path, ViolationKind kind) {

    public Violation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return path + ": " + kind.describe();
    }
}

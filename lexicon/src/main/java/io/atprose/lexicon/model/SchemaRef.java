package io.atprose.lexicon.model;

import io.atprose.types.TypeId;
import java.util.Objects;

/**
 * Where a {@code ref} or union member points: a node in the same graph, or a definition owned by
 * another graph and looked up through the graph's resolver on use.
 */
public sealed interface SchemaRef {

    /** The definition referred to. */
    TypeId target();

    record Local(TypeId target, int handle) implements SchemaRef {
        public Local {
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    record External(TypeId target) implements SchemaRef {
        public External {
            Objects.requireNonNull(target, "target must not be null");
        }
    }
}

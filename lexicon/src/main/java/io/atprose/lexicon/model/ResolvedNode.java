package io.atprose.lexicon.model;

import java.util.Objects;

/** A node handle together with the graph that owns it. */
public record ResolvedNode(SchemaGraph graph, int handle) {

    public ResolvedNode {
        Objects.requireNonNull(graph, "graph must not be null");
        if (handle < 0 || handle >= graph.size()) {
            throw new IllegalArgumentException("handle " + handle + " is outside the graph");
        }
    }

    public SchemaNode node() {
        return graph.node(handle);
    }

    public Kind kind() {
        return node().kind();
    }
}

package io.atprose.lexicon.model;

import io.atprose.lexicon.error.DefinitionNotFoundException;
import io.atprose.lexicon.spi.DefinitionResolver;
import io.atprose.types.Nsid;
import io.atprose.types.TypeId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The compiled form of a set of lexicon documents: a flat arena of {@link SchemaNode}s addressed
 * by integer handle, plus an index from definition id to handle.
 *
 * <p>
 * References into other graphs are followed through the {@link DefinitionResolver} the graph was
 * built with; the graph never owns those documents.
 *
 * <p>
 * Thread-safe and immutable. Instances are produced by the graph builder only.
 */
public final class SchemaGraph {

    private final List<SchemaNode> nodes;
    private final Map<TypeId, Integer> definitions;
    private final Set<Nsid> documentIds;
    private final DefinitionResolver resolver;

    public SchemaGraph(List<SchemaNode> nodes, Map<TypeId, Integer> definitions, DefinitionResolver resolver) {
        this.nodes = List.copyOf(nodes);
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        Set<Nsid> ids = new TreeSet<>();
        definitions.keySet().forEach(id -> ids.add(id.nsid()));
        this.documentIds = Collections.unmodifiableSet(ids);
    }

    /** Number of nodes, including inline (unnamed) ones. */
    public int size() {
        return nodes.size();
    }

    public SchemaNode node(int handle) {
        return nodes.get(handle);
    }

    /** Ids of the documents compiled into this graph, sorted. */
    public Set<Nsid> documentIds() {
        return documentIds;
    }

    /** Named definitions and their handles. */
    public Map<TypeId, Integer> definitions() {
        return definitions;
    }

    /** Looks up a named definition of this graph. */
    public Optional<ResolvedNode> find(TypeId id) {
        Integer handle = definitions.get(id);
        return handle == null ? Optional.empty() : Optional.of(new ResolvedNode(this, handle));
    }

    /**
     * Looks up a named definition of this graph, throwing if absent.
     *
     * @throws DefinitionNotFoundException if the graph has no such definition
     */
    public ResolvedNode require(TypeId id) {
        return find(id).orElseThrow(() -> new DefinitionNotFoundException(
                "No definition '" + id + "' in graph of " + documentIds, id.toString(), id.nsid().toString()));
    }

    /**
     * Follows a reference held by one of this graph's nodes.
     *
     * @throws DefinitionNotFoundException if an external target can no longer be resolved
     */
    public ResolvedNode follow(SchemaRef ref) {
        TypeId target = ref.target();
        return lookup(ref)
                .orElseThrow(() -> new DefinitionNotFoundException(
                        "Definition '" + target + "' is no longer resolvable", target.toString(), target.nsid().toString()));
    }

    /** Follows a reference held by one of this graph's nodes; empty if an external target is gone. */
    public Optional<ResolvedNode> lookup(SchemaRef ref) {
        if (ref instanceof SchemaRef.Local local) {
            return Optional.of(new ResolvedNode(this, local.handle()));
        }
        Optional<ResolvedNode> found = resolver.resolve(ref.target());
        return found == null ? Optional.empty() : found;
    }

    @Override
    public String toString() {
        return "SchemaGraph{documents=" + documentIds + ", definitions=" + definitions.size() + ", nodes=" + nodes.size()
                + "}";
    }
}

package io.atprose.lexicon.engine;

import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.spi.DefinitionResolver;
import io.atprose.types.Nsid;
import io.atprose.types.TypeId;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory registry of built graphs, keyed by document id. Serves as the
 * {@link DefinitionResolver} for graphs built later, so documents can be compiled one batch at a
 * time with references reaching back into earlier batches.
 *
 * <p>
 * Registering a graph that contains an already registered document replaces that entry
 * (last-write-wins). Graphs built against the old entry keep resolving through the catalog and so
 * see the new one. Thread-safe: registration and lookup can happen concurrently.
 */
public final class LexiconCatalog implements DefinitionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LexiconCatalog.class);

    private final Map<Nsid, SchemaGraph> graphs = new ConcurrentHashMap<>();

    /** Registers every document of {@code graph}. */
    public void register(SchemaGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        for (Nsid id : graph.documentIds()) {
            SchemaGraph previous = graphs.put(id, graph);
            LOG.info("Lexicon registered: id={}, replaced={}", id, previous != null && previous != graph);
        }
    }

    /** The graph containing the given document, if registered. */
    public Optional<SchemaGraph> find(Nsid id) {
        return Optional.ofNullable(graphs.get(id));
    }

    /** Registered document ids, sorted. */
    public Set<Nsid> documents() {
        return Collections.unmodifiableSet(new TreeSet<>(graphs.keySet()));
    }

    public int size() {
        return graphs.size();
    }

    @Override
    public Optional<ResolvedNode> resolve(TypeId id) {
        SchemaGraph graph = graphs.get(id.nsid());
        return graph == null ? Optional.empty() : graph.find(id);
    }
}

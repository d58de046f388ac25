package io.atprose.lexicon.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.atprose.lexicon.config.LexiconConfig;
import io.atprose.lexicon.error.DefinitionNotFoundException;
import io.atprose.lexicon.model.LexiconDocument;
import io.atprose.lexicon.model.RecordOutcome;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.ValidationOutcome;
import io.atprose.lexicon.spec.LexiconParser;
import io.atprose.lexicon.spi.DefinitionResolver;
import io.atprose.types.Nsid;
import io.atprose.types.TidGenerator;
import io.atprose.types.TypeId;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point wiring the parser, graph builder and validators together under one
 * {@link LexiconConfig}.
 *
 * <p>
 * Graphs built through {@link #load} are registered in the engine's {@link LexiconCatalog} and
 * become resolvable by later loads. {@link #buildGraph} builds without registering.
 *
 * <p>
 * Thread-safe: built graphs are immutable and every collaborator is thread-safe.
 */
public final class LexiconEngine {

    private final LexiconConfig config;
    private final FormatRegistry formats;
    private final LexiconParser parser;
    private final SchemaGraphBuilder builder;
    private final ValueValidator values;
    private final RecordValidator records;
    private final MethodValidator methods;
    private final LexiconCatalog catalog;

    /** Creates an engine with default configuration and the standard formats. */
    public LexiconEngine() {
        this(LexiconConfig.DEFAULTS);
    }

    public LexiconEngine(LexiconConfig config) {
        this(config, FormatRegistry.standard(config), new TidGenerator());
    }

    /**
     * Creates an engine with a custom format registry and TID source.
     *
     * @param config  validation settings
     * @param formats formats available to string definitions
     * @param tids    source of generated record keys
     */
    public LexiconEngine(LexiconConfig config, FormatRegistry formats, TidGenerator tids) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.formats = Objects.requireNonNull(formats, "formats must not be null");
        Objects.requireNonNull(tids, "tids must not be null");
        this.parser = new LexiconParser();
        this.builder = new SchemaGraphBuilder(config, formats);
        this.values = new ValueValidator(config);
        this.records = new RecordValidator(values, tids);
        this.methods = new MethodValidator(values);
        this.catalog = new LexiconCatalog();
    }

    // ── Documents and graphs ──

    /** Parses one lexicon file. */
    public LexiconDocument parse(Path path) {
        return parser.parse(path);
    }

    /** Parses one lexicon document from JSON text. */
    public LexiconDocument parse(String json, String source) {
        return parser.parse(json, source);
    }

    /** Builds a graph resolving external references through this engine's catalog. */
    public SchemaGraph buildGraph(Collection<LexiconDocument> documents) {
        return builder.build(documents, catalog);
    }

    /** Builds a graph resolving external references through {@code resolver}. */
    public SchemaGraph buildGraph(Collection<LexiconDocument> documents, DefinitionResolver resolver) {
        return builder.build(documents, resolver);
    }

    /**
     * Parses the given files, builds them into one graph and registers it in the catalog.
     *
     * @return the registered graph
     * @throws io.atprose.lexicon.error.LexiconBuildException if any file is invalid; nothing is
     *                                                        registered in that case
     */
    public SchemaGraph load(Collection<Path> paths) {
        List<LexiconDocument> documents = new ArrayList<>(paths.size());
        for (Path path : paths) {
            documents.add(parser.parse(path));
        }
        SchemaGraph graph = builder.build(documents, catalog);
        catalog.register(graph);
        return graph;
    }

    // ── Validation ──

    /** Validates a record payload against the collection's {@code main} record definition. */
    public ValidationOutcome validateRecord(SchemaGraph graph, Nsid collection, JsonNode instance) {
        return records.validateRecord(graph, collection, instance);
    }

    /** Validates a record payload and its repository key; a null key is derived where possible. */
    public RecordOutcome validateRecord(SchemaGraph graph, Nsid collection, JsonNode instance, String key) {
        return records.validateRecord(graph, collection, instance, key);
    }

    /** Validates a record against a collection registered in the catalog. */
    public RecordOutcome validateRecord(Nsid collection, JsonNode instance, String key) {
        SchemaGraph graph = catalog.find(collection)
                .orElseThrow(() -> new DefinitionNotFoundException(
                        "Collection '" + collection + "' is not loaded", collection.toString(), collection.toString()));
        return records.validateRecord(graph, collection, instance, key);
    }

    /** Validates a value against any named value definition of the graph. */
    public ValidationOutcome validate(SchemaGraph graph, TypeId definition, JsonNode value) {
        return values.validate(graph.require(definition), value);
    }

    // ── Accessors ──

    public LexiconConfig config() {
        return config;
    }

    public FormatRegistry formats() {
        return formats;
    }

    public LexiconCatalog catalog() {
        return catalog;
    }

    public MethodValidator methods() {
        return methods;
    }

    public RecordValidator records() {
        return records;
    }
}

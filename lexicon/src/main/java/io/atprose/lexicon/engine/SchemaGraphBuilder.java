package io.atprose.lexicon.engine;

import static java.util.Map.entry;

import com.fasterxml.jackson.databind.JsonNode;
import io.atprose.lexicon.config.LexiconConfig;
import io.atprose.lexicon.error.DocumentResolutionException;
import io.atprose.lexicon.error.DuplicateDefinitionException;
import io.atprose.lexicon.error.LexiconParseException;
import io.atprose.lexicon.error.UnknownFormatException;
import io.atprose.lexicon.error.UnresolvedReferenceException;
import io.atprose.lexicon.model.Kind;
import io.atprose.lexicon.model.LexiconDocument;
import io.atprose.lexicon.model.RecordKeyStrategy;
import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode;
import io.atprose.lexicon.model.SchemaNode.ArraySchema;
import io.atprose.lexicon.model.SchemaNode.BlobSchema;
import io.atprose.lexicon.model.SchemaNode.Body;
import io.atprose.lexicon.model.SchemaNode.BooleanSchema;
import io.atprose.lexicon.model.SchemaNode.BytesSchema;
import io.atprose.lexicon.model.SchemaNode.IntegerSchema;
import io.atprose.lexicon.model.SchemaNode.ObjectSchema;
import io.atprose.lexicon.model.SchemaNode.ProcedureSchema;
import io.atprose.lexicon.model.SchemaNode.QuerySchema;
import io.atprose.lexicon.model.SchemaNode.RecordSchema;
import io.atprose.lexicon.model.SchemaNode.StringSchema;
import io.atprose.lexicon.model.SchemaNode.UnionSchema;
import io.atprose.lexicon.model.SchemaRef;
import io.atprose.lexicon.spi.DefinitionResolver;
import io.atprose.lexicon.spi.FormatValidator;
import io.atprose.types.InvalidFormatException;
import io.atprose.types.Nsid;
import io.atprose.types.RecordKey;
import io.atprose.types.TypeId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles lexicon documents into a {@link SchemaGraph}.
 *
 * <p>
 * Building runs in two passes. The first allocates a handle for every named definition, in
 * document-id then definition-name order, so the handle layout does not depend on the order of
 * {@code defs} in the source files. The second builds each definition, appending inline child
 * definitions to the arena and resolving {@code ref}s and union members either to local handles or,
 * for documents outside the build set, through the supplied {@link DefinitionResolver}. The
 * finished arena is checked for reference cycles that admit no finite instance.
 *
 * <p>
 * Any problem aborts the build with a {@link io.atprose.lexicon.error.LexiconBuildException}; a
 * partially built graph is never returned.
 *
 * <p>
 * Thread-safe: all build state lives in a per-call session.
 */
public final class SchemaGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaGraphBuilder.class);

    // Keys each definition kind recognizes; "type" and "description" are accepted everywhere.
    // With strict keys enabled anything else is a build error, so a misspelled constraint
    // cannot silently disable itself.
    private static final Set<String> ALWAYS_ALLOWED = Set.of("type", "description");

    private static final Map<Kind, Set<String>> KNOWN_KEYS = Map.ofEntries(
            entry(Kind.RECORD, Set.of("key", "record")),
            entry(Kind.QUERY, Set.of("parameters", "output", "errors")),
            entry(Kind.PROCEDURE, Set.of("parameters", "input", "output", "errors")),
            entry(Kind.OBJECT, Set.of("properties", "required", "nullable", "closed")),
            entry(Kind.ARRAY, Set.of("items", "minLength", "maxLength")),
            entry(
                    Kind.STRING,
                    Set.of(
                            "format",
                            "minLength",
                            "maxLength",
                            "minGraphemes",
                            "maxGraphemes",
                            "enum",
                            "const",
                            "knownValues",
                            "default")),
            entry(Kind.INTEGER, Set.of("minimum", "maximum", "enum", "const", "default")),
            entry(Kind.BOOLEAN, Set.of("const", "default")),
            entry(Kind.BYTES, Set.of("minLength", "maxLength")),
            entry(Kind.BLOB, Set.of("accept", "maxSize")),
            entry(Kind.CID_LINK, Set.of()),
            entry(Kind.NULL, Set.of()),
            entry(Kind.UNKNOWN, Set.of()),
            entry(Kind.TOKEN, Set.of()),
            entry(Kind.REF, Set.of("ref")),
            entry(Kind.UNION, Set.of("refs", "closed")));

    private static final Set<String> KNOWN_PARAMS_KEYS = Set.of("properties", "required");
    private static final Set<String> KNOWN_BODY_KEYS = Set.of("encoding", "schema");
    private static final Set<String> KNOWN_ERROR_KEYS = Set.of("name");

    private static final Set<Kind> PARAMETER_KINDS = Set.of(Kind.BOOLEAN, Kind.INTEGER, Kind.STRING, Kind.UNKNOWN);
    private static final Set<Kind> BODY_KINDS = Set.of(Kind.REF, Kind.UNION, Kind.OBJECT);
    private static final Set<String> METHOD_TYPES = Set.of("query", "procedure");

    private final LexiconConfig config;
    private final FormatRegistry formats;

    public SchemaGraphBuilder(LexiconConfig config, FormatRegistry formats) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.formats = Objects.requireNonNull(formats, "formats must not be null");
    }

    /** Builds a graph whose documents reference only each other. */
    public SchemaGraph build(Collection<LexiconDocument> documents) {
        return build(documents, DefinitionResolver.NONE);
    }

    /**
     * Builds a graph from the given documents.
     *
     * @param documents the documents to compile together; ids must be distinct
     * @param resolver  looks up definitions of documents outside this set
     * @throws DuplicateDefinitionException  if two documents share an id
     * @throws LexiconParseException         if a definition is malformed
     * @throws UnknownFormatException        if a string names an unregistered format
     * @throws UnresolvedReferenceException  if a reference names no existing definition
     * @throws DocumentResolutionException   if the resolver fails
     * @throws io.atprose.lexicon.error.ReferenceCycleException if definitions form an unbounded cycle
     */
    public SchemaGraph build(Collection<LexiconDocument> documents, DefinitionResolver resolver) {
        Objects.requireNonNull(documents, "documents must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("at least one document is required");
        }

        Map<Nsid, LexiconDocument> byId = new TreeMap<>();
        for (LexiconDocument document : documents) {
            LexiconDocument previous = byId.put(document.id(), document);
            if (previous != null) {
                throw new DuplicateDefinitionException(
                        "Document '" + document.id() + "' supplied more than once (" + previous.source() + ", "
                                + document.source() + ")",
                        document.id().toString(),
                        null);
            }
        }

        Session session = new Session(byId, resolver);
        SchemaGraph graph = session.run();
        LOG.info(
                "Lexicon graph built: documents={}, definitions={}, nodes={}",
                graph.documentIds(),
                graph.definitions().size(),
                graph.size());
        return graph;
    }

    /** State of one build call. */
    private final class Session {

        private final Map<Nsid, LexiconDocument> documents;
        private final DefinitionResolver resolver;

        private final List<SchemaNode> nodes = new ArrayList<>();
        private final List<Integer> owners = new ArrayList<>();
        private final Map<TypeId, Integer> definitions = new LinkedHashMap<>();
        private final Map<Integer, TypeId> named = new HashMap<>();
        private final Map<TypeId, SchemaRef> externals = new HashMap<>();
        private final Map<TypeId, ResolvedNode> resolvedExternals = new HashMap<>();

        Session(Map<Nsid, LexiconDocument> documents, DefinitionResolver resolver) {
            this.documents = documents;
            this.resolver = resolver;
        }

        SchemaGraph run() {
            // --- Pass 1: reserve handles for named definitions ---
            for (LexiconDocument document : documents.values()) {
                for (String name : new TreeSet<>(document.defs().keySet())) {
                    TypeId id = new TypeId(document.id(), name);
                    int handle = reserve(-1);
                    owners.set(handle, handle);
                    definitions.put(id, handle);
                    named.put(handle, id);
                }
            }

            // --- Pass 2: build definitions ---
            for (Map.Entry<TypeId, Integer> definition : definitions.entrySet()) {
                TypeId id = definition.getKey();
                int handle = definition.getValue();
                JsonNode def = documents.get(id.nsid()).defs().get(id.name());
                nodes.set(handle, buildTopLevel(id, def, handle));
            }

            new CycleDetector(nodes, owners, named, definitions, resolvedExternals).check();
            return new SchemaGraph(nodes, definitions, resolver);
        }

        private int reserve(int owner) {
            nodes.add(null);
            owners.add(owner);
            return nodes.size() - 1;
        }

        private SchemaNode buildTopLevel(TypeId id, JsonNode def, int handle) {
            Site site = new Site(id.nsid(), id.nsid() + "#" + id.name(), handle);
            Kind kind = kindOf(def, site);
            if ((kind == Kind.RECORD || kind == Kind.QUERY || kind == Kind.PROCEDURE) && !id.isMain()) {
                throw site.error("Definition type '" + kind.typeName() + "' must be named 'main'");
            }
            if (kind == Kind.TOKEN) {
                rejectUnknownKeys(def, kind, site);
                return new SchemaNode.TokenSchema(id.toString());
            }
            return buildNode(def, kind, site);
        }

        /** Appends an inline definition to the arena and returns its handle. */
        private int child(JsonNode def, Site parent, String suffix) {
            Site site = parent.nested(suffix, reserve(parent.owner));
            Kind kind = kindOf(def, site);
            if (kind.topLevelOnly()) {
                throw site.error("Definition type '" + kind.typeName() + "' is only allowed at the top level");
            }
            nodes.set(site.handle, buildNode(def, kind, site));
            return site.handle;
        }

        private SchemaNode buildNode(JsonNode def, Kind kind, Site site) {
            rejectUnknownKeys(def, kind, site);
            return switch (kind) {
                case RECORD -> buildRecord(def, site);
                case QUERY -> new QuerySchema(
                        buildParameters(def, site), buildBody(def, "output", site), buildErrors(def, site));
                case PROCEDURE -> new ProcedureSchema(
                        buildParameters(def, site),
                        buildBody(def, "input", site),
                        buildBody(def, "output", site),
                        buildErrors(def, site));
                case OBJECT -> buildObject(def, site);
                case ARRAY -> buildArray(def, site);
                case STRING -> buildString(def, site);
                case INTEGER -> buildInteger(def, site);
                case BOOLEAN -> new BooleanSchema(
                        optionalBoolean(def, "const", site), optionalBoolean(def, "default", site));
                case BYTES -> {
                    Integer min = optionalLength(def, "minLength", site);
                    Integer max = optionalLength(def, "maxLength", site);
                    checkBounds(min, max, "minLength", "maxLength", site);
                    yield new BytesSchema(min, max);
                }
                case BLOB -> {
                    Long maxSize = optionalLong(def, "maxSize", site);
                    if (maxSize != null && maxSize < 0) {
                        throw site.error("'maxSize' must not be negative");
                    }
                    List<String> accept = optionalStringList(def, "accept", site);
                    yield new BlobSchema(accept == null ? List.of() : accept, maxSize);
                }
                case CID_LINK -> new SchemaNode.CidLinkSchema();
                case NULL -> new SchemaNode.NullSchema();
                case UNKNOWN -> new SchemaNode.UnknownSchema();
                case TOKEN -> throw site.error("Token definitions are only allowed at the top level");
                case REF -> new SchemaNode.RefSchema(resolveRef(requireString(def, "ref", site), site));
                case UNION -> buildUnion(def, site);
            };
        }

        // ── Containers ──

        private SchemaNode buildRecord(JsonNode def, Site site) {
            String rawKey = requireString(def, "key", site);
            RecordKeyStrategy key;
            try {
                key = RecordKeyStrategy.parse(rawKey);
            } catch (IllegalArgumentException e) {
                throw new LexiconParseException(e.getMessage(), e, site.documentId(), site.path);
            }
            if (key instanceof RecordKeyStrategy.LiteralKey literal && !RecordKey.isValid(literal.value())) {
                throw site.error("Literal key '" + literal.value() + "' is not a valid record key");
            }
            JsonNode payload = def.get("record");
            if (payload == null || !payload.isObject() || !"object".equals(payload.path("type").asText())) {
                throw site.error("'record' must be an object definition");
            }
            return new RecordSchema(key, child(payload, site, ".record"));
        }

        private SchemaNode buildObject(JsonNode def, Site site) {
            Map<String, Integer> properties = new LinkedHashMap<>();
            JsonNode props = def.get("properties");
            if (props != null) {
                if (!props.isObject()) {
                    throw site.error("'properties' must be an object");
                }
                props.fields().forEachRemaining(field -> properties.put(
                        field.getKey(), child(field.getValue(), site, ".properties." + field.getKey())));
            }
            List<String> required = optionalStringList(def, "required", site);
            List<String> nullable = optionalStringList(def, "nullable", site);
            Boolean closed = optionalBoolean(def, "closed", site);
            return new ObjectSchema(
                    properties,
                    required == null ? List.of() : required,
                    nullable == null ? Set.of() : new HashSet<>(nullable),
                    closed != null && closed);
        }

        private SchemaNode buildArray(JsonNode def, Site site) {
            JsonNode items = def.get("items");
            if (items == null) {
                throw site.error("Missing required field 'items'");
            }
            Integer min = optionalLength(def, "minLength", site);
            Integer max = optionalLength(def, "maxLength", site);
            checkBounds(min, max, "minLength", "maxLength", site);
            return new ArraySchema(child(items, site, ".items"), min, max);
        }

        private SchemaNode buildUnion(JsonNode def, Site site) {
            List<String> refs = optionalStringList(def, "refs", site);
            if (refs == null) {
                throw site.error("Missing required field 'refs'");
            }
            List<SchemaRef> members = new ArrayList<>(refs.size());
            for (String ref : refs) {
                members.add(resolveRef(ref, site));
            }
            Boolean closed = optionalBoolean(def, "closed", site);
            return new UnionSchema(members, closed != null ? closed : !config.unionOpenByDefault());
        }

        // ── Primitives ──

        private SchemaNode buildString(JsonNode def, Site site) {
            Integer minLength = optionalLength(def, "minLength", site);
            Integer maxLength = optionalLength(def, "maxLength", site);
            Integer minGraphemes = optionalLength(def, "minGraphemes", site);
            Integer maxGraphemes = optionalLength(def, "maxGraphemes", site);
            checkBounds(minLength, maxLength, "minLength", "maxLength", site);
            checkBounds(minGraphemes, maxGraphemes, "minGraphemes", "maxGraphemes", site);

            String format = optionalString(def, "format", site);
            FormatValidator validator = null;
            if (format != null) {
                validator = formats.find(format)
                        .orElseThrow(() -> new UnknownFormatException(format, site.documentId(), site.path));
            }
            return new StringSchema(
                    minLength,
                    maxLength,
                    minGraphemes,
                    maxGraphemes,
                    format,
                    validator,
                    optionalStringList(def, "enum", site),
                    optionalString(def, "const", site),
                    optionalStringList(def, "knownValues", site),
                    optionalString(def, "default", site));
        }

        private SchemaNode buildInteger(JsonNode def, Site site) {
            Long minimum = optionalLong(def, "minimum", site);
            Long maximum = optionalLong(def, "maximum", site);
            if (minimum != null && maximum != null && minimum > maximum) {
                throw site.error("'minimum' " + minimum + " exceeds 'maximum' " + maximum);
            }
            List<Long> enumValues = null;
            JsonNode enumNode = def.get("enum");
            if (enumNode != null) {
                if (!enumNode.isArray()) {
                    throw site.error("'enum' must be an array of integers");
                }
                enumValues = new ArrayList<>();
                for (JsonNode value : enumNode) {
                    if (!value.canConvertToExactIntegral() || !value.canConvertToLong()) {
                        throw site.error("'enum' must be an array of integers");
                    }
                    enumValues.add(value.longValue());
                }
            }
            return new IntegerSchema(
                    minimum,
                    maximum,
                    enumValues,
                    optionalLong(def, "const", site),
                    optionalLong(def, "default", site));
        }

        // ── Methods ──

        private Integer buildParameters(JsonNode def, Site site) {
            JsonNode params = def.get("parameters");
            if (params == null) {
                return null;
            }
            Site paramsSite = site.nested(".parameters", reserve(site.owner));
            if (!params.isObject() || !"params".equals(params.path("type").asText())) {
                throw paramsSite.error("'parameters' must be a definition of type 'params'");
            }
            rejectUnknownKeys(params, KNOWN_PARAMS_KEYS, "params", paramsSite);

            Map<String, Integer> properties = new LinkedHashMap<>();
            JsonNode props = params.get("properties");
            if (props != null) {
                if (!props.isObject()) {
                    throw paramsSite.error("'properties' must be an object");
                }
                for (var it = props.fields(); it.hasNext(); ) {
                    var field = it.next();
                    checkParameterKind(field.getValue(), paramsSite, field.getKey());
                    properties.put(
                            field.getKey(), child(field.getValue(), paramsSite, ".properties." + field.getKey()));
                }
            }
            List<String> required = optionalStringList(params, "required", paramsSite);
            nodes.set(
                    paramsSite.handle,
                    new ObjectSchema(properties, required == null ? List.of() : required, Set.of(), false));
            return paramsSite.handle;
        }

        private void checkParameterKind(JsonNode def, Site site, String name) {
            Kind kind = kindOf(def, site);
            if (kind == Kind.ARRAY) {
                kind = kindOf(def.path("items"), site);
            }
            if (!PARAMETER_KINDS.contains(kind)) {
                throw site.error("Parameter '" + name + "' must be a boolean, integer, string, unknown or an array"
                        + " of those, found '" + kind.typeName() + "'");
            }
        }

        private Body buildBody(JsonNode def, String field, Site site) {
            JsonNode body = def.get(field);
            if (body == null) {
                return null;
            }
            if (!body.isObject()) {
                throw site.error("'" + field + "' must be an object");
            }
            Site bodySite = site.nested("." + field, site.handle);
            rejectUnknownKeys(body, KNOWN_BODY_KEYS, field, bodySite);
            String encoding = requireString(body, "encoding", bodySite);
            JsonNode schema = body.get("schema");
            Integer handle = null;
            if (schema != null) {
                Kind kind = kindOf(schema, bodySite);
                if (!BODY_KINDS.contains(kind)) {
                    throw bodySite.error("Body schema must be a ref, union or object, found '" + kind.typeName() + "'");
                }
                handle = child(schema, bodySite, ".schema");
            }
            return new Body(encoding, handle);
        }

        private List<String> buildErrors(JsonNode def, Site site) {
            JsonNode errors = def.get("errors");
            if (errors == null) {
                return List.of();
            }
            if (!errors.isArray()) {
                throw site.error("'errors' must be an array");
            }
            List<String> names = new ArrayList<>();
            for (JsonNode error : errors) {
                if (!error.isObject()) {
                    throw site.error("'errors' entries must be objects");
                }
                rejectUnknownKeys(error, KNOWN_ERROR_KEYS, "errors", site);
                names.add(requireString(error, "name", site));
            }
            return names;
        }

        // ── References ──

        private SchemaRef resolveRef(String raw, Site site) {
            TypeId target;
            try {
                target = TypeId.resolve(raw, site.document);
            } catch (InvalidFormatException e) {
                throw new LexiconParseException(
                        "Malformed reference '" + raw + "': " + e.getMessage(), e, site.documentId(), site.path);
            }

            Integer local = definitions.get(target);
            if (local != null) {
                String targetType = documents.get(target.nsid()).defs().get(target.name()).path("type").asText();
                if (METHOD_TYPES.contains(targetType)) {
                    throw site.error("Reference '" + raw + "' targets a " + targetType + ", which is not a value type");
                }
                return new SchemaRef.Local(target, local);
            }
            if (documents.containsKey(target.nsid())) {
                throw new UnresolvedReferenceException(target.toString(), site.documentId(), site.path);
            }

            SchemaRef cached = externals.get(target);
            if (cached != null) {
                return cached;
            }
            LOG.debug("Resolving external reference: ref={}, from={}", target, site.path);
            Optional<ResolvedNode> resolved;
            try {
                resolved = resolver.resolve(target);
            } catch (RuntimeException e) {
                throw new DocumentResolutionException(target.toString(), e, site.documentId(), site.path);
            }
            if (resolved == null || resolved.isEmpty()) {
                throw new UnresolvedReferenceException(target.toString(), site.documentId(), site.path);
            }
            Kind kind = resolved.get().kind();
            if (kind == Kind.QUERY || kind == Kind.PROCEDURE) {
                throw site.error(
                        "Reference '" + raw + "' targets a " + kind.typeName() + ", which is not a value type");
            }
            SchemaRef ref = new SchemaRef.External(target);
            externals.put(target, ref);
            resolvedExternals.put(target, resolved.get());
            return ref;
        }

        // ── Field helpers ──

        private Kind kindOf(JsonNode def, Site site) {
            if (def == null || !def.isObject()) {
                throw site.error("Definition must be an object");
            }
            JsonNode type = def.get("type");
            if (type == null || !type.isTextual()) {
                throw site.error("Missing required field 'type'");
            }
            return Kind.fromTypeName(type.asText())
                    .orElseThrow(() -> site.error("Unknown definition type '" + type.asText() + "'"));
        }

        private void rejectUnknownKeys(JsonNode def, Kind kind, Site site) {
            rejectUnknownKeys(def, KNOWN_KEYS.get(kind), kind.typeName(), site);
        }

        private void rejectUnknownKeys(JsonNode def, Set<String> known, String blockName, Site site) {
            if (!config.strictKeys()) {
                return;
            }
            List<String> unknown = new ArrayList<>();
            def.fieldNames().forEachRemaining(key -> {
                if (!known.contains(key) && !ALWAYS_ALLOWED.contains(key)) {
                    unknown.add(key);
                }
            });
            if (!unknown.isEmpty()) {
                Set<String> recognized = new TreeSet<>(known);
                recognized.addAll(ALWAYS_ALLOWED);
                throw site.error("Unknown key(s) in '" + blockName + "': " + unknown + "; recognized keys are: "
                        + recognized);
            }
        }

        private String requireString(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null || !value.isTextual()) {
                throw site.error("Missing or non-string field '" + field + "'");
            }
            return value.asText();
        }

        private String optionalString(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null) {
                return null;
            }
            if (!value.isTextual()) {
                throw site.error("'" + field + "' must be a string");
            }
            return value.asText();
        }

        private Boolean optionalBoolean(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null) {
                return null;
            }
            if (!value.isBoolean()) {
                throw site.error("'" + field + "' must be a boolean");
            }
            return value.booleanValue();
        }

        private Long optionalLong(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null) {
                return null;
            }
            if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                throw site.error("'" + field + "' must be an integer");
            }
            return value.longValue();
        }

        private Integer optionalLength(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null) {
                return null;
            }
            if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
                throw site.error("'" + field + "' must be a non-negative integer");
            }
            return value.intValue();
        }

        private List<String> optionalStringList(JsonNode def, String field, Site site) {
            JsonNode value = def.get(field);
            if (value == null) {
                return null;
            }
            if (!value.isArray()) {
                throw site.error("'" + field + "' must be an array of strings");
            }
            List<String> out = new ArrayList<>(value.size());
            for (JsonNode item : value) {
                if (!item.isTextual()) {
                    throw site.error("'" + field + "' must be an array of strings");
                }
                out.add(item.asText());
            }
            return out;
        }

        private void checkBounds(Integer min, Integer max, String minField, String maxField, Site site) {
            if (min != null && max != null && min > max) {
                throw site.error("'" + minField + "' " + min + " exceeds '" + maxField + "' " + max);
            }
        }
    }

    /**
     * Where a definition sits: its document, a readable path such as
     * {@code dev.atprose.test.post#body.properties.text}, its own handle and the handle of the
     * named definition that contains it.
     */
    private record Site(Nsid document, String path, int handle, int owner) {

        Site(Nsid document, String path, int handle) {
            this(document, path, handle, handle);
        }

        Site nested(String suffix, int childHandle) {
            return new Site(document, path + suffix, childHandle, owner);
        }

        String documentId() {
            return document.toString();
        }

        LexiconParseException error(String message) {
            return new LexiconParseException(message + " at " + path, documentId(), path);
        }
    }
}

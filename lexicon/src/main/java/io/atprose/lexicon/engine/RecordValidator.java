package io.atprose.lexicon.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.atprose.lexicon.error.DefinitionNotFoundException;
import io.atprose.lexicon.model.FieldPath;
import io.atprose.lexicon.model.KeyOutcome;
import io.atprose.lexicon.model.Kind;
import io.atprose.lexicon.model.RecordKeyStrategy;
import io.atprose.lexicon.model.RecordOutcome;
import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode.RecordSchema;
import io.atprose.lexicon.model.ValidationOutcome;
import io.atprose.lexicon.model.Violation;
import io.atprose.lexicon.model.ViolationKind;
import io.atprose.types.InvalidFormatException;
import io.atprose.types.Nsid;
import io.atprose.types.RecordKey;
import io.atprose.types.Tid;
import io.atprose.types.TidGenerator;
import io.atprose.types.TypeId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates records against the {@code main} record definition of a collection.
 *
 * <p>
 * The payload is checked with a {@link ValueValidator}. A {@code $type} field, when present, must
 * name the collection. The repository key is judged separately, following the record type's key
 * strategy:
 * <ul>
 * <li>{@code tid}: the key must be a TID; without one, a fresh TID is generated.</li>
 * <li>{@code literal:<v>}: the key must be {@code <v>}; without one, {@code <v>} is used.</li>
 * <li>{@code any}: any valid record key, which the caller must supply.</li>
 * <li>{@code nsid}: a record key that is also an NSID, which the caller must supply.</li>
 * </ul>
 *
 * <p>
 * Thread-safe.
 */
public final class RecordValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RecordValidator.class);

    private static final String TYPE_FIELD = "$type";

    private final ValueValidator values;
    private final TidGenerator tids;

    public RecordValidator(ValueValidator values, TidGenerator tids) {
        this.values = Objects.requireNonNull(values, "values must not be null");
        this.tids = Objects.requireNonNull(tids, "tids must not be null");
    }

    /**
     * Validates a record payload.
     *
     * @throws DefinitionNotFoundException if the graph has no record definition for
     *                                     {@code collection}
     */
    public ValidationOutcome validateRecord(SchemaGraph graph, Nsid collection, JsonNode instance) {
        return validatePayload(requireRecord(graph, collection), collection, instance);
    }

    /**
     * Validates a record payload and its repository key.
     *
     * @param key the caller-supplied key, or {@code null} to derive one where the strategy allows
     * @throws DefinitionNotFoundException if the graph has no record definition for
     *                                     {@code collection}
     */
    public RecordOutcome validateRecord(SchemaGraph graph, Nsid collection, JsonNode instance, String key) {
        ResolvedNode record = requireRecord(graph, collection);
        ValidationOutcome payload = validatePayload(record, collection, instance);
        KeyOutcome keyOutcome = checkKey(((RecordSchema) record.node()).key(), key);
        if (!payload.isValid() || !keyOutcome.isAccepted()) {
            LOG.debug(
                    "Record rejected: collection={}, violations={}, key_accepted={}",
                    collection,
                    payload.violations().size(),
                    keyOutcome.isAccepted());
        }
        return new RecordOutcome(payload, keyOutcome);
    }

    /**
     * Checks or derives a repository key under the given strategy. Independent of the payload, so
     * a rejected key can be regenerated and rechecked alone.
     */
    public KeyOutcome checkKey(RecordKeyStrategy strategy, String key) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (strategy instanceof RecordKeyStrategy.TidKey) {
            if (key == null) {
                return new KeyOutcome.Accepted(RecordKey.of(tids.next()), true);
            }
            if (!Tid.isValid(key)) {
                return rejected("'" + key + "' is not a valid TID");
            }
            return new KeyOutcome.Accepted(RecordKey.parse(key), false);
        }
        if (strategy instanceof RecordKeyStrategy.LiteralKey literal) {
            if (key == null) {
                return new KeyOutcome.Accepted(RecordKey.parse(literal.value()), true);
            }
            if (!literal.value().equals(key)) {
                return rejected("expected '" + literal.value() + "', got '" + key + "'");
            }
            return new KeyOutcome.Accepted(RecordKey.parse(key), false);
        }
        if (key == null) {
            return rejected("strategy '" + strategy + "' requires a caller-supplied key");
        }
        RecordKey parsed;
        try {
            parsed = RecordKey.parse(key);
        } catch (InvalidFormatException e) {
            return rejected(e.error().description());
        }
        if (strategy instanceof RecordKeyStrategy.NsidKey && !Nsid.isValid(key)) {
            return rejected("'" + key + "' is not a valid NSID");
        }
        return new KeyOutcome.Accepted(parsed, false);
    }

    private ResolvedNode requireRecord(SchemaGraph graph, Nsid collection) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
        ResolvedNode node = graph.require(TypeId.main(collection));
        if (node.kind() != Kind.RECORD) {
            throw new DefinitionNotFoundException(
                    "Definition '" + collection + "' is a " + node.kind().typeName() + ", not a record",
                    collection.toString(),
                    collection.toString());
        }
        return node;
    }

    private ValidationOutcome validatePayload(ResolvedNode record, Nsid collection, JsonNode instance) {
        Violation typeViolation = checkTypeTag(collection, instance);
        ValidationOutcome payload = values.validate(record, instance);
        if (typeViolation == null) {
            return payload;
        }
        List<Violation> violations = new ArrayList<>();
        violations.add(typeViolation);
        violations.addAll(payload.violations());
        return new ValidationOutcome.Invalid(violations);
    }

    /** {@code nsid} and {@code nsid#main} both name the collection. */
    private static Violation checkTypeTag(Nsid collection, JsonNode instance) {
        if (instance == null || !instance.isObject() || !instance.has(TYPE_FIELD)) {
            return null;
        }
        FieldPath path = FieldPath.root().child(TYPE_FIELD);
        JsonNode tag = instance.get(TYPE_FIELD);
        if (!tag.isTextual()) {
            return new Violation(path, new ViolationKind.UnexpectedType("string", ValueValidator.describe(tag)));
        }
        TypeId expected = TypeId.main(collection);
        if (Nsid.isValid(stripMain(tag.textValue())) && TypeId.parse(tag.textValue()).equals(expected)) {
            return null;
        }
        return new Violation(path, new ViolationKind.UnexpectedType(expected.toString(), tag.textValue()));
    }

    private static String stripMain(String tag) {
        String suffix = "#" + TypeId.MAIN;
        return tag.endsWith(suffix) ? tag.substring(0, tag.length() - suffix.length()) : tag;
    }

    private static KeyOutcome rejected(String reason) {
        return new KeyOutcome.Rejected(new ViolationKind.InvalidKey(reason));
    }
}

package io.atprose.lexicon.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.atprose.lexicon.config.LexiconConfig;
import io.atprose.lexicon.model.FieldPath;
import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode;
import io.atprose.lexicon.model.SchemaNode.ArraySchema;
import io.atprose.lexicon.model.SchemaNode.BlobSchema;
import io.atprose.lexicon.model.SchemaNode.BooleanSchema;
import io.atprose.lexicon.model.SchemaNode.BytesSchema;
import io.atprose.lexicon.model.SchemaNode.IntegerSchema;
import io.atprose.lexicon.model.SchemaNode.ObjectSchema;
import io.atprose.lexicon.model.SchemaNode.RecordSchema;
import io.atprose.lexicon.model.SchemaNode.RefSchema;
import io.atprose.lexicon.model.SchemaNode.StringSchema;
import io.atprose.lexicon.model.SchemaNode.TokenSchema;
import io.atprose.lexicon.model.SchemaNode.UnionSchema;
import io.atprose.lexicon.model.SchemaRef;
import io.atprose.lexicon.model.ValidationOutcome;
import io.atprose.lexicon.model.Violation;
import io.atprose.lexicon.model.ViolationKind;
import io.atprose.types.Cid;
import io.atprose.types.InvalidFormatException;
import io.atprose.types.TypeId;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks instance values against nodes of a {@link SchemaGraph}.
 *
 * <p>
 * Each value is checked fail-fast: the first rule it breaks is reported and its children are not
 * visited. Siblings are all visited, so one call reports every independent problem. The input
 * tree is never modified; a valid value comes back as a fresh tree in which format-checked strings
 * carry their canonical form and whole-valued numbers are plain integers.
 *
 * <p>
 * Thread-safe and stateless apart from the nesting ceiling.
 */
public final class ValueValidator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    // Extended grapheme clusters.
    private static final Pattern GRAPHEME = Pattern.compile("\\X");

    private static final String TYPE_FIELD = "$type";
    private static final String BYTES_FIELD = "$bytes";
    private static final String LINK_FIELD = "$link";

    private final int maxDepth;

    public ValueValidator(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public ValueValidator(LexiconConfig config) {
        this(config.maxDepth());
    }

    /** Validates a value rooted at the empty path. */
    public ValidationOutcome validate(ResolvedNode node, JsonNode value) {
        return validate(node, value, FieldPath.root());
    }

    /**
     * Validates a value found at {@code path}.
     *
     * @throws IllegalArgumentException if {@code node} is a query or procedure
     */
    public ValidationOutcome validate(ResolvedNode node, JsonNode value, FieldPath path) {
        List<Violation> violations = new ArrayList<>();
        JsonNode input = value == null ? NullNode.getInstance() : value;
        JsonNode normalized = check(node.graph(), node.handle(), input, path, 0, violations);
        return violations.isEmpty()
                ? new ValidationOutcome.Valid(normalized)
                : new ValidationOutcome.Invalid(violations);
    }

    private JsonNode check(SchemaGraph graph, int handle, JsonNode value, FieldPath path, int depth, List<Violation> out) {
        if (depth > maxDepth) {
            out.add(new Violation(path, new ViolationKind.NestingTooDeep(maxDepth)));
            return value;
        }
        SchemaNode node = graph.node(handle);
        return switch (node.kind()) {
            case OBJECT -> checkObject(graph, (ObjectSchema) node, value, path, depth, out);
            case ARRAY -> checkArray(graph, (ArraySchema) node, value, path, depth, out);
            case STRING -> checkString((StringSchema) node, value, path, out);
            case INTEGER -> checkInteger((IntegerSchema) node, value, path, out);
            case BOOLEAN -> checkBoolean((BooleanSchema) node, value, path, out);
            case BYTES -> checkBytes((BytesSchema) node, value, path, out);
            case BLOB -> checkBlob((BlobSchema) node, value, path, out);
            case CID_LINK -> checkCidLink(value, path, out);
            case NULL -> {
                if (!value.isNull()) {
                    unexpectedType("null", value, path, out);
                }
                yield value;
            }
            case UNKNOWN -> value.deepCopy();
            case TOKEN -> checkToken((TokenSchema) node, value, path, out);
            case REF -> {
                ResolvedNode target = graph.follow(((RefSchema) node).target());
                yield check(target.graph(), target.handle(), value, path, depth + 1, out);
            }
            case UNION -> checkUnion(graph, (UnionSchema) node, value, path, depth, out);
            case RECORD -> check(graph, ((RecordSchema) node).payload(), value, path, depth, out);
            case QUERY, PROCEDURE -> throw new IllegalArgumentException(
                    "A " + node.kind().typeName() + " definition describes a method, not a value");
        };
    }

    // ── Containers ──

    private JsonNode checkObject(
            SchemaGraph graph, ObjectSchema schema, JsonNode value, FieldPath path, int depth, List<Violation> out) {
        if (!value.isObject()) {
            unexpectedType("object", value, path, out);
            return value;
        }

        Map<String, JsonNode> validated = new HashMap<>();
        for (Map.Entry<String, Integer> property : schema.properties().entrySet()) {
            String name = property.getKey();
            JsonNode field = value.get(name);
            boolean required = schema.required().contains(name);
            if (field == null) {
                if (required) {
                    out.add(new Violation(path.child(name), new ViolationKind.MissingRequiredField()));
                }
                continue;
            }
            if (field.isNull() && schema.nullable().contains(name)) {
                continue;
            }
            if (field.isNull() && required) {
                out.add(new Violation(path.child(name), new ViolationKind.MissingRequiredField()));
                continue;
            }
            validated.put(name, check(graph, property.getValue(), field, path.child(name), depth + 1, out));
        }

        // Required names without a declared schema still have to be present.
        for (String name : schema.required()) {
            if (schema.properties().containsKey(name)) {
                continue;
            }
            JsonNode field = value.get(name);
            if (field == null || (field.isNull() && !schema.nullable().contains(name))) {
                out.add(new Violation(path.child(name), new ViolationKind.MissingRequiredField()));
            }
        }

        if (schema.closed()) {
            for (Iterator<String> names = value.fieldNames(); names.hasNext(); ) {
                String name = names.next();
                if (!schema.properties().containsKey(name) && !TYPE_FIELD.equals(name)) {
                    out.add(new Violation(path.child(name), new ViolationKind.UnexpectedField()));
                }
            }
        }

        ObjectNode result = NODES.objectNode();
        value.fields().forEachRemaining(field -> {
            JsonNode checked = validated.get(field.getKey());
            result.set(field.getKey(), checked != null ? checked : field.getValue().deepCopy());
        });
        return result;
    }

    private JsonNode checkArray(
            SchemaGraph graph, ArraySchema schema, JsonNode value, FieldPath path, int depth, List<Violation> out) {
        if (!value.isArray()) {
            unexpectedType("array", value, path, out);
            return value;
        }
        int size = value.size();
        if ((schema.minLength() != null && size < schema.minLength())
                || (schema.maxLength() != null && size > schema.maxLength())) {
            out.add(new Violation(
                    path, new ViolationKind.ArrayLengthOutOfBounds(schema.minLength(), schema.maxLength(), size)));
            return value;
        }
        ArrayNode result = NODES.arrayNode(size);
        for (int i = 0; i < size; i++) {
            result.add(check(graph, schema.items(), value.get(i), path.index(i), depth + 1, out));
        }
        return result;
    }

    // ── Primitives ──

    private JsonNode checkString(StringSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isTextual()) {
            unexpectedType("string", value, path, out);
            return value;
        }
        String text = value.textValue();

        if (schema.constValue() != null && !schema.constValue().equals(text)) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.of(schema.constValue()))));
            return value;
        }
        if (schema.enumValues() != null && !schema.enumValues().contains(text)) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.copyOf(schema.enumValues()))));
            return value;
        }

        if (schema.minLength() != null || schema.maxLength() != null) {
            int bytes = text.getBytes(StandardCharsets.UTF_8).length;
            if (schema.maxLength() != null && bytes > schema.maxLength()) {
                out.add(new Violation(path, new ViolationKind.StringTooLong(schema.maxLength(), bytes)));
                return value;
            }
            if (schema.minLength() != null && bytes < schema.minLength()) {
                out.add(new Violation(path, new ViolationKind.StringTooShort(schema.minLength(), bytes)));
                return value;
            }
        }

        if (schema.minGraphemes() != null || schema.maxGraphemes() != null) {
            int graphemes = countGraphemes(text);
            if (schema.maxGraphemes() != null && graphemes > schema.maxGraphemes()) {
                out.add(new Violation(path, new ViolationKind.StringTooManyGraphemes(schema.maxGraphemes(), graphemes)));
                return value;
            }
            if (schema.minGraphemes() != null && graphemes < schema.minGraphemes()) {
                out.add(new Violation(path, new ViolationKind.StringTooFewGraphemes(schema.minGraphemes(), graphemes)));
                return value;
            }
        }

        if (schema.formatValidator() != null) {
            try {
                return TextNode.valueOf(schema.formatValidator().normalize(text));
            } catch (InvalidFormatException e) {
                out.add(new Violation(path, new ViolationKind.FormatMismatch(schema.format(), e.error())));
                return value;
            }
        }
        return TextNode.valueOf(text);
    }

    private JsonNode checkInteger(IntegerSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isNumber()) {
            unexpectedType("integer", value, path, out);
            return value;
        }
        long number;
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            number = value.longValue();
        } else if (value.isIntegralNumber()) {
            out.add(new Violation(
                    path, new ViolationKind.OutOfRange(schema.minimum(), schema.maximum(), value.numberValue())));
            return value;
        } else if ((value.isDouble() || value.isFloat()) && Double.isNaN(value.doubleValue())) {
            unexpectedType("integer", value, path, out);
            return value;
        } else if ((value.isDouble() || value.isFloat()) && Double.isInfinite(value.doubleValue())) {
            // 1e400 overflows a double.
            out.add(new Violation(
                    path, new ViolationKind.OutOfRange(schema.minimum(), schema.maximum(), value.numberValue())));
            return value;
        } else {
            // 3.0 is accepted as 3; 1.5 is not an integer.
            BigDecimal decimal = value.decimalValue().stripTrailingZeros();
            if (decimal.scale() > 0) {
                unexpectedType("integer", value, path, out);
                return value;
            }
            try {
                number = decimal.longValueExact();
            } catch (ArithmeticException e) {
                out.add(new Violation(
                        path, new ViolationKind.OutOfRange(schema.minimum(), schema.maximum(), value.numberValue())));
                return value;
            }
        }

        if (schema.constValue() != null && schema.constValue() != number) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.of(schema.constValue()))));
            return value;
        }
        if (schema.enumValues() != null && !schema.enumValues().contains(number)) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.copyOf(schema.enumValues()))));
            return value;
        }
        if ((schema.minimum() != null && number < schema.minimum())
                || (schema.maximum() != null && number > schema.maximum())) {
            out.add(new Violation(path, new ViolationKind.OutOfRange(schema.minimum(), schema.maximum(), number)));
            return value;
        }
        return LongNode.valueOf(number);
    }

    private JsonNode checkBoolean(BooleanSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isBoolean()) {
            unexpectedType("boolean", value, path, out);
            return value;
        }
        if (schema.constValue() != null && schema.constValue() != value.booleanValue()) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.of(schema.constValue()))));
        }
        return value;
    }

    /** Accepts a binary node or the JSON form {@code {"$bytes": "<base64>"}}. */
    private JsonNode checkBytes(BytesSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        byte[] data;
        if (value.isBinary()) {
            data = ((BinaryNode) value).binaryValue();
        } else if (value.isObject() && value.size() == 1 && value.has(BYTES_FIELD)) {
            JsonNode encoded = value.get(BYTES_FIELD);
            if (!encoded.isTextual()) {
                unexpectedType("string", encoded, path.child(BYTES_FIELD), out);
                return value;
            }
            try {
                data = Base64.getDecoder().decode(encoded.textValue());
            } catch (IllegalArgumentException e) {
                out.add(new Violation(path.child(BYTES_FIELD), new ViolationKind.UnexpectedType("base64", "string")));
                return value;
            }
        } else {
            unexpectedType("bytes", value, path, out);
            return value;
        }

        if ((schema.minLength() != null && data.length < schema.minLength())
                || (schema.maxLength() != null && data.length > schema.maxLength())) {
            out.add(new Violation(
                    path, new ViolationKind.BytesLengthOutOfBounds(schema.minLength(), schema.maxLength(), data.length)));
            return value;
        }
        if (value.isBinary()) {
            return BinaryNode.valueOf(data);
        }
        ObjectNode result = NODES.objectNode();
        result.put(BYTES_FIELD, Base64.getEncoder().withoutPadding().encodeToString(data));
        return result;
    }

    /** Accepts {@code {"$link": "<cid>"}} and returns it with the canonical CID string. */
    private JsonNode checkCidLink(JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isObject() || value.size() != 1 || !value.has(LINK_FIELD)) {
            unexpectedType("cid-link", value, path, out);
            return value;
        }
        JsonNode link = value.get(LINK_FIELD);
        if (!link.isTextual()) {
            unexpectedType("string", link, path.child(LINK_FIELD), out);
            return value;
        }
        try {
            Cid cid = Cid.parse(link.textValue());
            ObjectNode result = NODES.objectNode();
            result.put(LINK_FIELD, cid.toString());
            return result;
        } catch (InvalidFormatException e) {
            out.add(new Violation(path.child(LINK_FIELD), new ViolationKind.FormatMismatch("cid", e.error())));
            return value;
        }
    }

    /**
     * Accepts {@code {"$type": "blob", "ref": {"$link": <cid>}, "mimeType": <string>, "size": <int>}}
     * and enforces {@code accept} and {@code maxSize}.
     */
    private JsonNode checkBlob(BlobSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isObject()) {
            unexpectedType("blob", value, path, out);
            return value;
        }
        int before = out.size();

        JsonNode type = value.get(TYPE_FIELD);
        if (type == null) {
            out.add(new Violation(path.child(TYPE_FIELD), new ViolationKind.MissingRequiredField()));
        } else if (!"blob".equals(type.asText()) || !type.isTextual()) {
            out.add(new Violation(path.child(TYPE_FIELD), new ViolationKind.UnexpectedType("blob", describe(type))));
        }

        JsonNode ref = value.get("ref");
        JsonNode normalizedRef = null;
        if (ref == null) {
            out.add(new Violation(path.child("ref"), new ViolationKind.MissingRequiredField()));
        } else {
            normalizedRef = checkCidLink(ref, path.child("ref"), out);
        }

        JsonNode mimeType = value.get("mimeType");
        if (mimeType == null) {
            out.add(new Violation(path.child("mimeType"), new ViolationKind.MissingRequiredField()));
        } else if (!mimeType.isTextual()) {
            unexpectedType("string", mimeType, path.child("mimeType"), out);
        }

        JsonNode size = value.get("size");
        if (size == null) {
            out.add(new Violation(path.child("size"), new ViolationKind.MissingRequiredField()));
        } else if (!size.isIntegralNumber() || !size.canConvertToLong()) {
            unexpectedType("integer", size, path.child("size"), out);
        } else if (size.longValue() < 0) {
            out.add(new Violation(path.child("size"), new ViolationKind.OutOfRange(0L, null, size.longValue())));
        }

        if (out.size() > before) {
            return value;
        }

        String mime = mimeType.textValue();
        if (!schema.accept().isEmpty() && schema.accept().stream().noneMatch(pattern -> mimeMatches(pattern, mime))) {
            out.add(new Violation(path.child("mimeType"), new ViolationKind.BlobRejected(mime, schema.accept())));
            return value;
        }
        if (schema.maxSize() != null && size.longValue() > schema.maxSize()) {
            out.add(new Violation(path.child("size"), new ViolationKind.BlobTooLarge(schema.maxSize(), size.longValue())));
            return value;
        }

        ObjectNode result = value.deepCopy();
        result.set("ref", normalizedRef);
        return result;
    }

    private JsonNode checkToken(TokenSchema schema, JsonNode value, FieldPath path, List<Violation> out) {
        if (!value.isTextual()) {
            unexpectedType("string", value, path, out);
            return value;
        }
        if (!schema.value().equals(value.textValue())) {
            out.add(new Violation(path, new ViolationKind.EnumMismatch(List.of(schema.value()))));
        }
        return value;
    }

    // ── References ──

    /**
     * Selects the member named by the value's {@code $type}. {@code nsid} and {@code nsid#main}
     * name the same member. A tag matching no member is a violation for closed unions and passes
     * unchecked for open ones.
     */
    private JsonNode checkUnion(
            SchemaGraph graph, UnionSchema schema, JsonNode value, FieldPath path, int depth, List<Violation> out) {
        if (!value.isObject()) {
            unexpectedType("object", value, path, out);
            return value;
        }
        JsonNode tag = value.get(TYPE_FIELD);
        if (tag == null) {
            out.add(new Violation(path.child(TYPE_FIELD), new ViolationKind.MissingRequiredField()));
            return value;
        }
        if (!tag.isTextual()) {
            unexpectedType("string", tag, path.child(TYPE_FIELD), out);
            return value;
        }

        TypeId selected;
        try {
            selected = TypeId.parse(tag.textValue());
        } catch (InvalidFormatException e) {
            return unmatchedTag(schema, tag.textValue(), value, path, out);
        }
        for (SchemaRef member : schema.members()) {
            if (member.target().equals(selected)) {
                ResolvedNode target = graph.follow(member);
                return check(target.graph(), target.handle(), value, path, depth + 1, out);
            }
        }
        return unmatchedTag(schema, tag.textValue(), value, path, out);
    }

    private static JsonNode unmatchedTag(
            UnionSchema schema, String tag, JsonNode value, FieldPath path, List<Violation> out) {
        if (schema.closed()) {
            out.add(new Violation(path.child(TYPE_FIELD), new ViolationKind.UnknownUnionTag(tag)));
            return value;
        }
        return value.deepCopy();
    }

    // ── Helpers ──

    private static int countGraphemes(String text) {
        Matcher matcher = GRAPHEME.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /** Matches {@code type/subtype}, {@code type/*} and {@code *}{@code /*}, case-insensitively. */
    private static boolean mimeMatches(String pattern, String mimeType) {
        if ("*/*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith("/*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return mimeType.regionMatches(true, 0, prefix, 0, prefix.length());
        }
        return pattern.equalsIgnoreCase(mimeType);
    }

    private static void unexpectedType(String expected, JsonNode value, FieldPath path, List<Violation> out) {
        out.add(new Violation(path, new ViolationKind.UnexpectedType(expected, describe(value))));
    }

    /** The data-model type name of a JSON value. */
    static String describe(JsonNode value) {
        if (value.isObject()) {
            return "object";
        }
        if (value.isArray()) {
            return "array";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isIntegralNumber()) {
            return "integer";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        if (value.isNull()) {
            return "null";
        }
        if (value.isBinary()) {
            return "bytes";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}

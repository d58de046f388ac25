package io.atprose.lexicon.model;

import io.atprose.lexicon.spi.FormatValidator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One resolved definition in a {@link SchemaGraph}. Child definitions are integer handles into
 * the owning graph's node list; {@code ref} and union targets are {@link SchemaRef}s. Nodes are
 * immutable once the graph is built.
 *
 * <p>
 * Optional numeric constraints are {@code null} when the document leaves them out.
 */
public sealed interface SchemaNode {

    Kind kind();

    // ── Containers ──

    /**
     * @param properties property name to node handle, in declaration order
     * @param required   properties that must be present and, unless nullable, non-null
     * @param nullable   properties whose value may be JSON {@code null}
     * @param closed     whether undeclared properties (other than {@code $type}) are rejected
     */
    record ObjectSchema(Map<String, Integer> properties, List<String> required, Set<String> nullable, boolean closed)
            implements SchemaNode {
        public ObjectSchema {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
            required = List.copyOf(required);
            nullable = Set.copyOf(nullable);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    record ArraySchema(int items, Integer minLength, Integer maxLength) implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    // ── Primitives ──

    /**
     * Byte lengths are UTF-8; grapheme counts are extended grapheme clusters. {@code format} and
     * {@code formatValidator} are both set or both null.
     */
    record StringSchema(
            Integer minLength,
            Integer maxLength,
            Integer minGraphemes,
            Integer maxGraphemes,
            String format,
            FormatValidator formatValidator,
            List<String> enumValues,
            String constValue,
            List<String> knownValues,
            String defaultValue)
            implements SchemaNode {
        public StringSchema {
            if ((format == null) != (formatValidator == null)) {
                throw new IllegalArgumentException("format and formatValidator must be set together");
            }
            enumValues = enumValues == null ? null : List.copyOf(enumValues);
            knownValues = knownValues == null ? List.of() : List.copyOf(knownValues);
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record IntegerSchema(Long minimum, Long maximum, List<Long> enumValues, Long constValue, Long defaultValue)
            implements SchemaNode {
        public IntegerSchema {
            enumValues = enumValues == null ? null : List.copyOf(enumValues);
        }

        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }
    }

    record BooleanSchema(Boolean constValue, Boolean defaultValue) implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    /** Lengths count decoded bytes. */
    record BytesSchema(Integer minLength, Integer maxLength) implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.BYTES;
        }
    }

    /**
     * @param accept  MIME patterns such as {@code image/png} or {@code image/*}; empty accepts any
     * @param maxSize size ceiling in bytes, or {@code null}
     */
    record BlobSchema(List<String> accept, Long maxSize) implements SchemaNode {
        public BlobSchema {
            accept = List.copyOf(accept);
        }

        @Override
        public Kind kind() {
            return Kind.BLOB;
        }
    }

    record CidLinkSchema() implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.CID_LINK;
        }
    }

    record NullSchema() implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record UnknownSchema() implements SchemaNode {
        @Override
        public Kind kind() {
            return Kind.UNKNOWN;
        }
    }

    /** A named constant; instances must be the string {@code value}. */
    record TokenSchema(String value) implements SchemaNode {
        public TokenSchema {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TOKEN;
        }
    }

    // ── References ──

    record RefSchema(SchemaRef target) implements SchemaNode {
        public RefSchema {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.REF;
        }
    }

    /**
     * @param members candidate definitions, selected by the instance's {@code $type}
     * @param closed  whether a {@code $type} naming no member is a violation
     */
    record UnionSchema(List<SchemaRef> members, boolean closed) implements SchemaNode {
        public UnionSchema {
            members = List.copyOf(members);
        }

        @Override
        public Kind kind() {
            return Kind.UNION;
        }
    }

    // ── Top-level definitions ──

    /** A storable record type; {@code payload} is the handle of its object definition. */
    record RecordSchema(RecordKeyStrategy key, int payload) implements SchemaNode {
        public RecordSchema {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }
    }

    /**
     * Request or response body of an RPC method.
     *
     * @param encoding MIME type of the body
     * @param schema   handle of the body's ref, union or object definition, or {@code null}
     */
    record Body(String encoding, Integer schema) {
        public Body {
            Objects.requireNonNull(encoding, "encoding must not be null");
        }
    }

    /**
     * @param parameters handle of the object node describing query parameters, or {@code null}
     * @param output     response body, or {@code null}
     * @param errors     declared error names
     */
    record QuerySchema(Integer parameters, Body output, List<String> errors) implements SchemaNode {
        public QuerySchema {
            errors = List.copyOf(errors);
        }

        @Override
        public Kind kind() {
            return Kind.QUERY;
        }
    }

    record ProcedureSchema(Integer parameters, Body input, Body output, List<String> errors) implements SchemaNode {
        public ProcedureSchema {
            errors = List.copyOf(errors);
        }

        @Override
        public Kind kind() {
            return Kind.PROCEDURE;
        }
    }
}

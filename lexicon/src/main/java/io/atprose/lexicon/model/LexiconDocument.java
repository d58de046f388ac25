package io.atprose.lexicon.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.atprose.types.Nsid;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed lexicon file. Definitions are kept as raw JSON until a schema graph is built from them.
 *
 * @param version     the {@code lexicon} format version, always 1 once parsed
 * @param id          the document id
 * @param revision    the optional {@code revision} counter, or {@code null}
 * @param description the optional description, or {@code null}
 * @param defs        definitions by name, in document order
 * @param source      where the document was read from, for error messages
 */
public record LexiconDocument(
        int version, Nsid id, Integer revision, String description, Map<String, JsonNode> defs, String source) {

    public LexiconDocument {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(defs, "defs must not be null");
        defs = Collections.unmodifiableMap(new LinkedHashMap<>(defs));
    }
}

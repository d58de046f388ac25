package io.atprose.lexicon.model;

import java.util.Arrays;
import java.util.Optional;

/** The kinds of definition a lexicon document can declare, keyed by their {@code type} value. */
public enum Kind {
    RECORD("record"),
    QUERY("query"),
    PROCEDURE("procedure"),
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    BYTES("bytes"),
    BLOB("blob"),
    CID_LINK("cid-link"),
    NULL("null"),
    UNKNOWN("unknown"),
    TOKEN("token"),
    REF("ref"),
    UNION("union");

    private final String typeName;

    Kind(String typeName) {
        this.typeName = typeName;
    }

    /** The {@code type} value used in lexicon JSON. */
    public String typeName() {
        return typeName;
    }

    /** Whether this kind may only appear as a named definition directly under {@code defs}. */
    public boolean topLevelOnly() {
        return this == RECORD || this == QUERY || this == PROCEDURE || this == TOKEN;
    }

    /** Looks up a kind by its {@code type} value. */
    public static Optional<Kind> fromTypeName(String typeName) {
        return Arrays.stream(values()).filter(k -> k.typeName.equals(typeName)).findFirst();
    }
}

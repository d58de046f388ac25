package io.atprose.types;

import java.util.Objects;

/**
 * Identifies one definition inside a lexicon document: an {@link Nsid} plus a definition name.
 *
 * <p>
 * The name {@code main} is the document's primary definition; its canonical string form is the
 * bare NSID ({@code app.bsky.feed.post}), every other definition is written {@code nsid#name}.
 *
 * @param nsid the document id
 * @param name the definition name, never null ({@code main} for the primary definition)
 */
public record TypeId(Nsid nsid, String name) {

    public static final String MAIN = "main";

    public TypeId {
        Objects.requireNonNull(nsid, "nsid must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("definition name must not be empty");
        }
    }

    /** Identifies the {@code main} definition of a document. */
    public static TypeId main(Nsid nsid) {
        return new TypeId(nsid, MAIN);
    }

    /**
     * Parses an absolute reference: {@code nsid}, {@code nsid#main} or {@code nsid#name}.
     *
     * @throws InvalidFormatException if the reference is malformed
     */
    public static TypeId parse(String raw) {
        if (raw == null || raw.isEmpty() || raw.startsWith("#")) {
            throw new InvalidFormatException(FormatError.TYPE_ID_MALFORMED, raw);
        }
        return resolve(raw, null);
    }

    /**
     * Resolves a reference as written in a schema, where {@code #name} is relative to
     * {@code base}.
     *
     * @param raw  the reference text
     * @param base the document the reference appears in; may be null for absolute references
     * @throws InvalidFormatException if the reference is malformed
     */
    public static TypeId resolve(String raw, Nsid base) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.TYPE_ID_MALFORMED, raw);
        }
        int hash = raw.indexOf('#');
        if (hash < 0) {
            return main(Nsid.parse(raw));
        }
        if (raw.indexOf('#', hash + 1) >= 0) {
            throw new InvalidFormatException(FormatError.TYPE_ID_MALFORMED, raw);
        }
        String name = raw.substring(hash + 1);
        if (name.isEmpty()) {
            throw new InvalidFormatException(FormatError.TYPE_ID_MALFORMED, raw);
        }
        if (hash == 0) {
            if (base == null) {
                throw new InvalidFormatException(FormatError.TYPE_ID_MALFORMED, raw);
            }
            return new TypeId(base, name);
        }
        return new TypeId(Nsid.parse(raw.substring(0, hash)), name);
    }

    /** Returns {@code true} if this identifies a document's {@code main} definition. */
    public boolean isMain() {
        return MAIN.equals(name);
    }

    @Override
    public String toString() {
        return isMain() ? nsid.toString() : nsid + "#" + name;
    }
}

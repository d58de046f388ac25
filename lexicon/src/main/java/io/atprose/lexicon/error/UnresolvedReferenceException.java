package io.atprose.lexicon.error;

/**
 * Thrown when a {@code ref} target or {@code union} member names a definition that exists neither
 * in the documents being built nor through the cross-document resolver.
 */
public final class UnresolvedReferenceException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public UnresolvedReferenceException(String reference, String documentId, String definitionPath) {
        super("Unresolved reference '" + reference + "' at " + definitionPath, documentId, definitionPath);
        this.reference = reference;
    }

    /** The reference as resolved to an absolute definition id. */
    public String reference() {
        return reference;
    }
}

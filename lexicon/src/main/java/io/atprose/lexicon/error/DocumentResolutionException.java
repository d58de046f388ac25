package io.atprose.lexicon.error;

/**
 * Thrown when the cross-document resolver supplied to the graph builder fails. The resolver's
 * exception is kept as the cause.
 */
public final class DocumentResolutionException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public DocumentResolutionException(String reference, Throwable cause, String documentId, String definitionPath) {
        super("Failed to resolve '" + reference + "': " + cause.getMessage(), cause, documentId, definitionPath);
        this.reference = reference;
    }

    /** The reference being resolved when the resolver failed. */
    public String reference() {
        return reference;
    }
}

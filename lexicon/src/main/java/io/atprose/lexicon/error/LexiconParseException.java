package io.atprose.lexicon.error;

/**
 * Thrown when a lexicon document is not well-formed JSON, does not have the lexicon file shape,
 * or contains a definition with a missing, unknown or ill-typed field.
 */
public final class LexiconParseException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    public LexiconParseException(String message, String documentId, String definitionPath) {
        super(message, documentId, definitionPath);
    }

    public LexiconParseException(String message, Throwable cause, String documentId, String definitionPath) {
        super(message, cause, documentId, definitionPath);
    }
}

package io.atprose.lexicon.error;

/**
 * Thrown when a definition name appears twice in one document's {@code defs}, or when two
 * documents with the same id are built together.
 */
public final class DuplicateDefinitionException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    public DuplicateDefinitionException(String message, String documentId, String definitionPath) {
        super(message, documentId, definitionPath);
    }
}

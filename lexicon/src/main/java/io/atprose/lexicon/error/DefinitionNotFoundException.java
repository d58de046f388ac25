package io.atprose.lexicon.error;

/**
 * Thrown when a caller asks to validate against a definition the schema graph does not contain,
 * or against a definition of the wrong kind (e.g. a record entry point on an object definition).
 */
public final class DefinitionNotFoundException extends LexiconException {

    private static final long serialVersionUID = 1L;

    private final String definition;

    public DefinitionNotFoundException(String message, String definition, String documentId) {
        super(message, documentId, Phase.VALIDATION);
        this.definition = definition;
    }

    /** The requested definition. */
    public String definition() {
        return definition;
    }
}

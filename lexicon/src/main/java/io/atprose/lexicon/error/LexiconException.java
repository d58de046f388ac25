package io.atprose.lexicon.error;

/**
 * Abstract base for all lexicon exceptions. Never thrown directly; use the concrete subclasses
 * under {@link LexiconBuildException} or {@link DefinitionNotFoundException}.
 *
 * <p>
 * Problems with instance data are never thrown. They are returned as violations from the
 * validators.
 */
public abstract class LexiconException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        VALIDATION
    }

    private final String documentId;
    private final Phase phase;

    protected LexiconException(String message, String documentId, Phase phase) {
        super(message);
        this.documentId = documentId;
        this.phase = phase;
    }

    protected LexiconException(String message, Throwable cause, String documentId, Phase phase) {
        super(message, cause);
        this.documentId = documentId;
        this.phase = phase;
    }

    /** The lexicon document that triggered the error, or {@code null} if not yet identified. */
    public String documentId() {
        return documentId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

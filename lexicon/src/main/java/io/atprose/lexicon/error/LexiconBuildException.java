package io.atprose.lexicon.error;

/**
 * Abstract parent for schema-authoring mistakes found while parsing documents or building a
 * schema graph. A build that throws one of these produces no graph at all.
 *
 * <p>
 * Carries the path of the offending definition, e.g. {@code dev.atprose.test.post#body.text}.
 */
public abstract class LexiconBuildException extends LexiconException {

    private static final long serialVersionUID = 1L;

    private final String definitionPath;

    protected LexiconBuildException(String message, String documentId, String definitionPath) {
        super(message, documentId, Phase.LOAD);
        this.definitionPath = definitionPath;
    }

    protected LexiconBuildException(String message, Throwable cause, String documentId, String definitionPath) {
        super(message, cause, documentId, Phase.LOAD);
        this.definitionPath = definitionPath;
    }

    /** Path of the definition that caused the error, or {@code null} for document-level errors. */
    public String definitionPath() {
        return definitionPath;
    }
}

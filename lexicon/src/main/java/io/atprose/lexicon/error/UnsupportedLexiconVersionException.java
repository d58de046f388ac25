package io.atprose.lexicon.error;

/** Thrown when a document declares a {@code lexicon} version other than 1. */
public final class UnsupportedLexiconVersionException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    private final int version;

    public UnsupportedLexiconVersionException(int version, String documentId) {
        super("Unsupported lexicon version " + version + "; expected 1", documentId, null);
        this.version = version;
    }

    /** The version the document declared. */
    public int version() {
        return version;
    }
}

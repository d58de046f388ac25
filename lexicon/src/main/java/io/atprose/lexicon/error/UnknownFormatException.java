package io.atprose.lexicon.error;

/** Thrown when a string definition names a {@code format} the format registry does not know. */
public final class UnknownFormatException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    private final String format;

    public UnknownFormatException(String format, String documentId, String definitionPath) {
        super("Unknown string format '" + format + "' at " + definitionPath, documentId, definitionPath);
        this.format = format;
    }

    /** The unrecognized format name. */
    public String format() {
        return format;
    }
}

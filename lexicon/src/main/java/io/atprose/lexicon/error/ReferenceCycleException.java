package io.atprose.lexicon.error;

import java.util.List;

/**
 * Thrown when definitions reference each other in a loop that no finite instance can satisfy:
 * every edge of the loop is a required, non-nullable property, a non-empty array, a plain
 * {@code ref} or a closed union with no other way out.
 */
public final class ReferenceCycleException extends LexiconBuildException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public ReferenceCycleException(List<String> cycle, String documentId) {
        super("Reference cycle with no finite instance: " + String.join(" -> ", cycle), documentId, cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** The definitions on the cycle, first element repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}

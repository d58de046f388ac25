package io.atprose.lexicon.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Location of a value inside an instance: a sequence of object keys ({@link String}) and array
 * indices ({@link Integer}) from the root. Renders as {@code body.languages[0]}.
 */
public record FieldPath(List<Object> segments) {

    private static final FieldPath ROOT = new FieldPath(List.of());

    public FieldPath {
        segments = List.copyOf(segments);
    }

    /** The empty path. */
    public static FieldPath root() {
        return ROOT;
    }

    /** Path of a property of the object at this path. */
    public FieldPath child(String name) {
        return append(name);
    }

    /** Path of an element of the array at this path. */
    public FieldPath index(int index) {
        return append(index);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    private FieldPath append(Object segment) {
        List<Object> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new FieldPath(next);
    }

    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "$";
        }
        StringBuilder out = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer index) {
                out.append('[').append(index).append(']');
            } else {
                if (out.length() > 0) {
                    out.append('.');
                }
                out.append(segment);
            }
        }
        return out.toString();
    }
}

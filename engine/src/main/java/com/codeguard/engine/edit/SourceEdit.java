package com.codeguard.engine.edit;

/**
 * Replace {@code [start, end)} of the original text with {@code replacement}.
 * A zero-width span is an insertion.
 */
public record SourceEdit(int start, int end, String replacement) {

    public SourceEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
        if (replacement == null) {
            throw new IllegalArgumentException("replacement must not be null");
        }
    }

    public static SourceEdit insert(int offset, String text) {
        return new SourceEdit(offset, offset, text);
    }
}

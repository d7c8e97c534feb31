package org.livedoc.compiler.model;

/**
 * A character range in the source text of a file.
 *
 * @param fileId The file the offsets refer to.
 * @param start  Inclusive start offset.
 * @param end    Exclusive end offset.
 */
public record Span(FileId fileId, int start, int end) {

    public Span {
        if (end < start) {
            throw new IllegalArgumentException("Span end " + end + " before start " + start);
        }
    }

    public int length() {
        return end - start;
    }
}

package org.livedoc.compiler.document;

/**
 * Outcome of {@link LiveDocument#writeOrAddNode}.
 *
 * @param kind    What happened to the incoming node.
 * @param index   The index written to, or -1 when rejected.
 * @param message The rejection reason, or {@code null}.
 */
public record WriteResult(Kind kind, int index, String message) {

    public enum Kind {
        /** No entry with the same id existed; the node was appended. */
        APPENDED,
        /** An entry with the same id was replaced in place. */
        OVERWRITTEN,
        /** The node cannot be written at all. */
        REJECTED
    }

    public static WriteResult appended(int index) {
        return new WriteResult(Kind.APPENDED, index, null);
    }

    public static WriteResult overwritten(int index) {
        return new WriteResult(Kind.OVERWRITTEN, index, null);
    }

    public static WriteResult rejected(String message) {
        return new WriteResult(Kind.REJECTED, -1, message);
    }

    public boolean isAppended() {
        return kind == Kind.APPENDED;
    }
}

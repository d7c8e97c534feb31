package org.livedoc.compiler.diagnostics;

/**
 * Thrown by a parser when the source of a file cannot be turned into a document.
 */
public class LiveParseException extends Exception {

    private final transient LiveFileError error;

    public LiveParseException(LiveFileError error) {
        super(error.toString());
        this.error = error;
    }

    public LiveParseException(LiveFileError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }

    public LiveFileError getError() {
        return error;
    }
}

package org.livedoc.compiler.diagnostics;

import org.livedoc.compiler.model.Span;

/**
 * A problem recorded during registration or expansion. Rendering against the source text
 * is deferred to {@link #toLiveFileError}, so errors that are filtered out never pay for it.
 *
 * @param kind    The error category.
 * @param origin  The component that reported the error.
 * @param span    Where in the source the error points, or {@code null} when unknown.
 * @param message The human readable message.
 */
public record LiveError(LiveErrorKind kind, String origin, Span span, String message) {

    public static LiveError of(LiveErrorKind kind, Class<?> origin, Span span, String message) {
        return new LiveError(kind, origin.getSimpleName(), span, message);
    }

    public LiveFileError toLiveFileError(String file, String source) {
        return LiveFileError.of(file, source, span, message);
    }

    @Override
    public String toString() {
        return kind + " [" + origin + "] " + message;
    }
}

package org.livedoc.compiler.diagnostics;

import org.livedoc.compiler.model.Span;

/**
 * A diagnostic rendered against the source text of a file.
 *
 * @param file    The display name of the file.
 * @param span    The offending character range, or {@code null} when unknown.
 * @param line    1-based line of the span start (0 when unknown).
 * @param column  1-based column of the span start (0 when unknown).
 * @param snippet The source line containing the span start.
 * @param message The diagnostic message.
 */
public record LiveFileError(String file, Span span, int line, int column, String snippet, String message) {

    /**
     * Renders a span against the text it points into.
     */
    public static LiveFileError of(String file, String source, Span span, String message) {
        if (span == null || source == null) {
            return new LiveFileError(file, span, 0, 0, "", message);
        }
        int offset = Math.min(span.start(), source.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) lineEnd = source.length();
        return new LiveFileError(file, span, line, offset - lineStart + 1, source.substring(lineStart, lineEnd), message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(file).append(':').append(line).append(':').append(column).append(" - ").append(message);
        if (!snippet.isEmpty()) {
            sb.append('\n').append(snippet);
            if (column > 0) {
                sb.append('\n').append(" ".repeat(column - 1)).append('^');
            }
        }
        return sb.toString();
    }
}

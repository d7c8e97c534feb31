package org.livedoc.compiler.model;

/**
 * An entry of a document's token table.
 *
 * @param text The token text.
 * @param span Where the token was read from.
 */
public record TokenWithSpan(String text, Span span) {
}

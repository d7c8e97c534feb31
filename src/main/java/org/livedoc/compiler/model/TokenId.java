package org.livedoc.compiler.model;

/**
 * Reference to a token in the token table of a raw file.
 * Tokens keep the file they were lexed from, so a node copied into another document
 * still points at its original source text.
 *
 * @param fileId     The file whose raw document owns the token.
 * @param tokenIndex The index in that document's token table.
 */
public record TokenId(FileId fileId, int tokenIndex) {
}

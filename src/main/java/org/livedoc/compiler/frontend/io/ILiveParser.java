package org.livedoc.compiler.frontend.io;

import org.livedoc.compiler.diagnostics.LiveParseException;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.model.FileId;

/**
 * Turns the source text of one file into a raw document.
 */
@FunctionalInterface
public interface ILiveParser {
    /**
     * Parses a source file.
     * @param fileId The identity the file is registered under; token spans must carry it.
     * @param file The display name of the file, for diagnostics.
     * @param source The source text.
     * @return The raw document.
     * @throws LiveParseException if the source cannot be parsed.
     */
    LiveDocument parse(FileId fileId, String file, String source) throws LiveParseException;
}

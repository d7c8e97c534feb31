package org.livedoc.compiler.frontend.module;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.model.CrateModule;

/**
 * A registered source file with its raw document. Replaced wholesale on re-parse.
 *
 * @param crateModule The namespace key of the file's declarations.
 * @param file        The display name used in diagnostics.
 * @param source      The source text, kept for rendering diagnostics.
 * @param document    The raw document as produced by the parser.
 */
public record LiveFile(CrateModule crateModule, String file, String source, LiveDocument document) {
}

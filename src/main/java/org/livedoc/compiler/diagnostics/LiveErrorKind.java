package org.livedoc.compiler.diagnostics;

/**
 * Categories of problems found while registering or expanding documents.
 */
public enum LiveErrorKind {
    /** The source of a single file could not be parsed; that file is not registered. */
    PARSE,
    /** An identifier, path segment or import could not be found. */
    SCOPE_RESOLUTION,
    /** A declaration has an impossible shape, e.g. override fields on a non-class. */
    STRUCTURAL,
    /** A crate-module in the processing order has no registered file. */
    MISSING_DEPENDENCY
}

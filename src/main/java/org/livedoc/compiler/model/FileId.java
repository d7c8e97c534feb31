package org.livedoc.compiler.model;

/**
 * Index of a registered file. Indexes the registry's parallel tables of raw files
 * and expanded documents.
 *
 * @param index The zero-based registration index.
 */
public record FileId(int index) {

    public FileId {
        if (index < 0) {
            throw new IllegalArgumentException("File index must not be negative: " + index);
        }
    }

    @Override
    public String toString() {
        return "file#" + index;
    }
}

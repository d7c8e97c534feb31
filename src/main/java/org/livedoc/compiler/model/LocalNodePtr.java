package org.livedoc.compiler.model;

/**
 * Address of a node inside a single document.
 *
 * @param level The nesting level (0 = top-level declarations).
 * @param index The index within that level.
 */
public record LocalNodePtr(int level, int index) {

    @Override
    public String toString() {
        return level + ":" + index;
    }
}

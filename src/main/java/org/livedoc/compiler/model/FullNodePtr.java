package org.livedoc.compiler.model;

/**
 * Address of a node in any registered document. This is the only way to reference
 * nodes of another file; it is always dereferenced through the registry, never cached
 * as an object reference.
 *
 * @param fileId   The file holding the node.
 * @param localPtr The node address inside that file's expanded document.
 */
public record FullNodePtr(FileId fileId, LocalNodePtr localPtr) {

    public static FullNodePtr of(FileId fileId, int level, int index) {
        return new FullNodePtr(fileId, new LocalNodePtr(level, index));
    }

    @Override
    public String toString() {
        return fileId + "@" + localPtr;
    }
}

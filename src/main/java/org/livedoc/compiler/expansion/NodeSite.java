package org.livedoc.compiler.expansion;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;

/**
 * A raw node being expanded, with where it is read from and where it goes.
 *
 * @param node     The raw node.
 * @param inLevel  Its level in the raw document.
 * @param outLevel The level it is written at in the expanded document.
 * @param outStart Start of the output span the node belongs to. Write/merge searches this
 *                 span and {@code Self} paths are resolved against it.
 */
public record NodeSite(LiveNode node, int inLevel, int outLevel, int outStart) {

    public int inChildLevel() {
        return LiveDocument.childLevel(inLevel, node);
    }

    public int outChildLevel() {
        return LiveDocument.childLevel(outLevel, node);
    }
}

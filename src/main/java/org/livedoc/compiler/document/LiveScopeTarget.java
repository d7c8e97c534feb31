package org.livedoc.compiler.document;

import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.LocalNodePtr;

/**
 * What a scope binding points at: a node of the document being expanded, or a node
 * of another expanded document.
 */
public sealed interface LiveScopeTarget permits LiveScopeTarget.Local, LiveScopeTarget.Full {

    /**
     * Expresses this target as a full pointer, taking {@code ownFile} for local targets.
     */
    FullNodePtr toFull(FileId ownFile);

    record Local(LocalNodePtr ptr) implements LiveScopeTarget {
        @Override
        public FullNodePtr toFull(FileId ownFile) {
            return new FullNodePtr(ownFile, ptr);
        }
    }

    record Full(FullNodePtr ptr) implements LiveScopeTarget {
        @Override
        public FullNodePtr toFull(FileId ownFile) {
            return ptr;
        }
    }
}

package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.NodeSite;

/**
 * Expands the raw nodes of one value kind into the output document.
 * A handler that cannot produce a node reports why to the context and writes nothing.
 */
public interface IExpansionHandler {
    /**
     * Expands a single raw node, including its children.
     * @param site Where the node is read from and written to.
     * @param context The expansion in progress.
     */
    void expand(NodeSite site, ExpansionContext context);
}

package org.livedoc.compiler.expansion;

import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.expansion.handlers.ExpansionHandlerRegistry;
import org.livedoc.compiler.expansion.handlers.IExpansionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The recursive expansion pass. Top-level declarations are walked in order; every node is
 * dispatched to the handler registered for its value kind, and container handlers recurse
 * through {@link ExpansionContext#walk}.
 */
public final class ExpansionWalker {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionWalker.class);

    private final ExpansionHandlerRegistry registry;

    public ExpansionWalker(ExpansionHandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Expands every top-level declaration of the context's raw document into its output.
     * The output must already be reset to the raw document's tables.
     *
     * @param context The expansion of one document.
     */
    public void expandDocument(ExpansionContext context) {
        int count = context.raw().levelLength(0);
        for (int i = 0; i < count; i++) {
            walkNode(context, 0, i, 0, 0);
        }
        LOG.debug("Expanded {}: {} top-level declarations, {} levels", context.crateModule(), count,
                context.out().levelCount());
    }

    /**
     * Expands one raw node.
     *
     * @param context  The expansion in progress.
     * @param inLevel  Level of the node in the raw document.
     * @param inIndex  Index of the node in that level.
     * @param outLevel Level the node is written at.
     * @param outStart Start of the output span the node belongs to.
     */
    public void walkNode(ExpansionContext context, int inLevel, int inIndex, int outLevel, int outStart) {
        LiveNode node = context.raw().node(inLevel, inIndex);
        IExpansionHandler handler = registry.resolveHandler(node.value().getClass())
                .orElseThrow(() -> new IllegalStateException(
                        "No expansion handler for " + node.value().getClass().getSimpleName()));
        handler.expand(new NodeSite(node, inLevel, outLevel, outStart), context);
    }
}

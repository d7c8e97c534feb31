package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.NodeSite;

/**
 * Objects and arrays: the children are expanded into a fresh span first, then the node is
 * written pointing at that span.
 */
public class ContainerExpansionHandler implements IExpansionHandler {

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveValue.Container container = (LiveValue.Container) site.node().value();
        LiveDocument out = context.out();
        int childLevel = site.outChildLevel();
        int start = out.levelLength(childLevel);
        for (int i = 0; i < container.nodeCount(); i++) {
            context.walk(site.inChildLevel(), container.nodeStart() + i, childLevel, start);
        }
        LiveValue.Container expanded = container.withSpan(start, out.levelLength(childLevel) - start);
        context.writeOrAdd(site.outLevel(), site.outStart(), site.node().withValue(expanded));
    }
}

package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.NodeSite;

/**
 * Primitives, strings and resource references. Their spans address tables the output
 * inherits from the raw document, so they are written unchanged.
 */
public class ValueExpansionHandler implements IExpansionHandler {

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        context.writeOrAdd(site.outLevel(), site.outStart(), site.node());
    }
}

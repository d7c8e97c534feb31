package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveScopeItem;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.NodeSite;

import java.util.List;

/**
 * Function and variable bodies capture every binding visible at their declaration, so that
 * a later compilation of the body can resolve names without the scope stack.
 */
public class BodyExpansionHandler implements IExpansionHandler {

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveValue.Body body = (LiveValue.Body) site.node().value();
        LiveDocument out = context.out();
        List<LiveScopeItem> captured = context.scopes().flatten();
        int scopeStart = out.scopeCount();
        for (LiveScopeItem item : captured) {
            out.pushScope(item);
        }
        LiveValue.Body expanded = body.withSpans(body.tokenStart(), scopeStart, captured.size());
        context.writeOrAdd(site.outLevel(), site.outStart(), site.node().withValue(expanded));
    }
}

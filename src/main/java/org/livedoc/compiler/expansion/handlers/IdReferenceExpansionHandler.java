package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.ExpansionSettings;
import org.livedoc.compiler.expansion.IdResolver;
import org.livedoc.compiler.expansion.NodeSite;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;

import java.util.Optional;

/**
 * Identifier references are replaced by a pointer to the node they name. A reference that
 * cannot be resolved is reported and dropped.
 */
public class IdReferenceExpansionHandler implements IExpansionHandler {

    private final ExpansionSettings settings;
    private final IdResolver resolver;

    public IdReferenceExpansionHandler(ExpansionSettings settings, IdResolver resolver) {
        this.settings = settings;
        this.resolver = resolver;
    }

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveNode node = site.node();
        IdPack id = ((LiveValue.IdValue) node.value()).id();
        if (settings.isUnresolvable(id)) {
            context.writeOrAdd(site.outLevel(), site.outStart(), node);
            return;
        }
        Optional<FullNodePtr> target = resolver.resolve(context, id, node.tokenId(), site.outLevel(), site.outStart());
        if (target.isEmpty()) {
            return;
        }
        context.writeOrAdd(site.outLevel(), site.outStart(),
                node.withValue(new LiveValue.IdValue(IdPack.nodePtr(target.get()))));
    }
}

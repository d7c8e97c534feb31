package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.document.LiveDocument;
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
 * Calls resolve their target, which must name another call, and expand their arguments
 * like an object's members.
 */
public class CallExpansionHandler implements IExpansionHandler {

    private final ExpansionSettings settings;
    private final IdResolver resolver;

    public CallExpansionHandler(ExpansionSettings settings, IdResolver resolver) {
        this.settings = settings;
        this.resolver = resolver;
    }

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveNode node = site.node();
        LiveValue.CallValue call = (LiveValue.CallValue) node.value();
        IdPack target = call.target();

        if (!settings.isUnresolvable(target)) {
            Optional<FullNodePtr> resolved = resolver.resolve(context, target, node.tokenId(), site.outLevel(), site.outStart());
            if (resolved.isEmpty()) {
                return;
            }
            FullNodePtr ptr = resolved.get();
            LiveNode targetNode = context.documentFor(ptr.fileId()).node(ptr.localPtr());
            if (!(targetNode.value() instanceof LiveValue.CallValue)) {
                context.error(LiveErrorKind.STRUCTURAL, CallExpansionHandler.class, node.tokenId(),
                        "Target not a call " + context.format(target));
                return;
            }
            target = IdPack.nodePtr(ptr);
        }

        LiveDocument out = context.out();
        int childLevel = site.outChildLevel();
        int start = out.levelLength(childLevel);
        for (int i = 0; i < call.nodeCount(); i++) {
            context.walk(site.inChildLevel(), call.nodeStart() + i, childLevel, start);
        }
        LiveValue.CallValue expanded = new LiveValue.CallValue(target, start, out.levelLength(childLevel) - start);
        context.writeOrAdd(site.outLevel(), site.outStart(), node.withValue(expanded));
    }
}

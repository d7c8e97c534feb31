package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.ExpansionSettings;
import org.livedoc.compiler.expansion.IdResolver;
import org.livedoc.compiler.expansion.NodeSite;
import org.livedoc.compiler.expansion.ScopeStack;
import org.livedoc.compiler.expansion.StructuralCopier;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;

import java.util.Optional;

/**
 * Expands a class declaration.
 *
 * <ol>
 *   <li>The base is resolved. {@code Self} and the reserved roots need no copy.</li>
 *   <li>A class base has its fields copied into the declaration's field span; a non-class
 *       base without own fields turns the declaration into an alias of that value. A class
 *       deriving from {@code Self} copies nothing and counts as a non-class base, so such a
 *       declaration with fields is an error and without fields is dropped.</li>
 *   <li>The declaration's own fields are expanded on top in a new scope frame; a field with
 *       an inherited name overwrites the inherited entry in place.</li>
 * </ol>
 */
public class ClassExpansionHandler implements IExpansionHandler {

    private final ExpansionSettings settings;
    private final IdResolver resolver;
    private final StructuralCopier copier;

    public ClassExpansionHandler(ExpansionSettings settings, IdResolver resolver, StructuralCopier copier) {
        this.settings = settings;
        this.resolver = resolver;
        this.copier = copier;
    }

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveNode node = site.node();
        LiveValue.ClassValue cls = (LiveValue.ClassValue) node.value();
        LiveDocument out = context.out();
        IdPack base = cls.base();

        FullNodePtr basePtr = null;
        if (!settings.isUnresolvable(base)) {
            Optional<FullNodePtr> resolved = resolver.resolve(context, base, node.tokenId(), site.outLevel(), site.outStart());
            if (resolved.isEmpty()) {
                return;
            }
            basePtr = resolved.get();
            LiveNode root = context.documentFor(basePtr.fileId()).node(basePtr.localPtr());
            if (!(root.value() instanceof LiveValue.ClassValue rootClass) || settings.isSelf(rootClass.base())) {
                if (cls.nodeCount() > 0) {
                    context.error(LiveErrorKind.STRUCTURAL, ClassExpansionHandler.class, node.tokenId(),
                            "Cannot override items in non-class: " + context.format(base));
                    return;
                }
                LiveNode alias = copier.copyBase(context, basePtr, site.outLevel(), node).alias();
                if (alias != null) {
                    context.writeOrAdd(site.outLevel(), site.outStart(), alias);
                }
                return;
            }
        }

        int fieldLevel = site.outChildLevel();
        int fieldStart = out.levelLength(fieldLevel);
        ScopeStack scopes = context.scopes();
        scopes.pushFrame();

        if (settings.isSelf(base)) {
            copier.copySiblings(context, site.outLevel(), site.outStart(), fieldLevel);
        } else if (basePtr != null) {
            copier.copyBase(context, basePtr, site.outLevel(), node);
        }

        for (int i = 0; i < cls.nodeCount(); i++) {
            context.walk(site.inChildLevel(), cls.nodeStart() + i, fieldLevel, fieldStart);
        }
        scopes.popFrame();

        IdPack expandedBase = basePtr != null ? IdPack.nodePtr(basePtr) : base;
        LiveValue.ClassValue expanded = new LiveValue.ClassValue(expandedBase, fieldStart,
                out.levelLength(fieldLevel) - fieldStart);
        context.writeOrAdd(site.outLevel(), site.outStart(), node.withValue(expanded));
    }
}

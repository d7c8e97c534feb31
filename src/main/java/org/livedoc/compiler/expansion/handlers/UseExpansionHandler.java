package org.livedoc.compiler.expansion.handlers;

import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveScopeTarget;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.NodeSite;
import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.LocalNodePtr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Binds imported names in the innermost scope frame. Imports never reach the output.
 *
 * <p>The imported item is the node's id: the empty id imports every top-level declaration,
 * a single id one declaration, a path a nested declaration under its last segment, and a
 * path ending in the empty segment every field of the class it reaches.</p>
 */
public class UseExpansionHandler implements IExpansionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(UseExpansionHandler.class);

    @Override
    public void expand(NodeSite site, ExpansionContext context) {
        LiveNode node = site.node();
        LiveValue.UseValue use = (LiveValue.UseValue) node.value();
        IdPack item = node.idPack();

        if (item instanceof IdPack.NodePtr) {
            context.error(LiveErrorKind.STRUCTURAL, UseExpansionHandler.class, node.tokenId(), "Node type invalid");
            return;
        }
        CrateModule crateModule = use.crateModule(context.crateModule().crate());
        Optional<FileId> fileId = context.store().fileIdOf(crateModule);
        if (fileId.isEmpty()) {
            // reported once per pass as a missing dependency
            LOG.debug("Skipping import of unregistered module {}", crateModule);
            return;
        }
        LiveDocument doc = context.store().getExpandedDocument(fileId.get());

        if (item.isEmpty()) {
            bindAll(context, fileId.get(), doc, 0, 0, doc.levelLength(0));
            return;
        }
        if (item instanceof IdPack.Single single) {
            Optional<LocalNodePtr> found = doc.scanSpan(0, 0, doc.levelLength(0), List.of(single.id()));
            if (found.isEmpty()) {
                context.error(LiveErrorKind.SCOPE_RESOLUTION, UseExpansionHandler.class, node.tokenId(),
                        "Cannot find import " + single.id());
                return;
            }
            bind(context, single.id(), fileId.get(), found.get());
            return;
        }

        List<LiveId> path = context.raw().segments(item);
        LiveId last = path.get(path.size() - 1);
        if (last.isEmpty()) {
            Optional<LocalNodePtr> found = doc.scanForMulti(path.subList(0, path.size() - 1));
            if (found.isPresent() && doc.node(found.get()).value() instanceof LiveValue.ClassValue cls) {
                int fieldLevel = LiveDocument.childLevel(found.get().level(), doc.node(found.get()));
                bindAll(context, fileId.get(), doc, fieldLevel, cls.nodeStart(), cls.nodeCount());
                return;
            }
        } else {
            Optional<LocalNodePtr> found = doc.scanForMulti(path);
            if (found.isPresent()) {
                bind(context, last, fileId.get(), found.get());
                return;
            }
        }
        context.error(LiveErrorKind.SCOPE_RESOLUTION, UseExpansionHandler.class, node.tokenId(),
                "Use path not found " + context.format(item));
    }

    private void bindAll(ExpansionContext context, FileId fileId, LiveDocument doc, int level, int start, int count) {
        for (int i = start; i < start + count; i++) {
            if (doc.node(level, i).idPack() instanceof IdPack.Single single) {
                bind(context, single.id(), fileId, new LocalNodePtr(level, i));
            }
        }
    }

    private void bind(ExpansionContext context, LiveId id, FileId fileId, LocalNodePtr ptr) {
        context.scopes().bind(id, new LiveScopeTarget.Full(new FullNodePtr(fileId, ptr)));
    }
}

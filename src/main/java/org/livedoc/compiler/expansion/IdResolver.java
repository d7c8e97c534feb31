package org.livedoc.compiler.expansion;

import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveScopeTarget;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.LocalNodePtr;
import org.livedoc.compiler.model.TokenId;

import java.util.List;
import java.util.Optional;

/**
 * Binds identifiers of the raw document to concrete node locations.
 *
 * <ul>
 *   <li>A path headed by {@code Self} is looked up in the span currently being written,
 *       not on the scope stack.</li>
 *   <li>Reserved root kinds are never lookup targets.</li>
 *   <li>Anything else resolves its head on the scope stack; further path segments are
 *       looked up as fields inside the class the head points at.</li>
 * </ul>
 * Failures are reported to the context and yield an empty result.
 */
public final class IdResolver {

    private final ExpansionSettings settings;

    public IdResolver(ExpansionSettings settings) {
        this.settings = settings;
    }

    /**
     * Resolves an id of the raw document.
     *
     * @param context  The expansion in progress.
     * @param id       The id to resolve.
     * @param token    The token of the node carrying the id, for diagnostics.
     * @param outLevel The output level of that node.
     * @param outStart The start of the output span that node is written into.
     * @return The resolved node, or empty after an error was reported.
     */
    public Optional<FullNodePtr> resolve(ExpansionContext context, IdPack id, TokenId token, int outLevel, int outStart) {
        if (id instanceof IdPack.NodePtr ptr) {
            return Optional.of(ptr.ptr());
        }
        if (id instanceof IdPack.Multi) {
            return resolvePath(context, id, token, outLevel, outStart);
        }
        if (id instanceof IdPack.Single single && !settings.isBaseClass(single.id())) {
            Optional<LiveScopeTarget> target = context.scopes().find(single.id());
            if (target.isPresent()) {
                return Optional.of(target.get().toFull(context.fileId()));
            }
        }
        context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token,
                "Cannot find item on scope: " + context.format(id));
        return Optional.empty();
    }

    private Optional<FullNodePtr> resolvePath(ExpansionContext context, IdPack id, TokenId token, int outLevel, int outStart) {
        List<LiveId> segments = context.raw().segments(id);
        List<LiveId> rest = segments.subList(1, segments.size());
        LiveId head = segments.get(0);
        String path = context.format(id);

        if (head.equals(ExpansionSettings.SELF)) {
            LiveDocument out = context.out();
            Optional<LocalNodePtr> found = out.scanSpan(outLevel, outStart, out.levelLength(outLevel) - outStart, rest);
            if (found.isEmpty()) {
                context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token, "Unresolved path: " + path);
                return Optional.empty();
            }
            return Optional.of(new FullNodePtr(context.fileId(), found.get()));
        }
        if (settings.isBaseClass(head)) {
            context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token, "Cannot use baseclass " + head);
            return Optional.empty();
        }

        Optional<LiveScopeTarget> target = context.scopes().find(head);
        if (target.isEmpty()) {
            context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token,
                    "Cannot find item on scope: " + head + " of " + path);
            return Optional.empty();
        }
        FullNodePtr headPtr = target.get().toFull(context.fileId());
        LiveDocument doc = context.documentFor(headPtr.fileId());
        LiveNode headNode = doc.node(headPtr.localPtr());
        if (!(headNode.value() instanceof LiveValue.ClassValue cls)) {
            context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token,
                    "Property is not a class " + head + " of " + path);
            return Optional.empty();
        }
        int fieldLevel = LiveDocument.childLevel(headPtr.localPtr().level(), headNode);
        Optional<LocalNodePtr> found = doc.scanSpan(fieldLevel, cls.nodeStart(), cls.nodeCount(), rest);
        if (found.isEmpty()) {
            context.error(LiveErrorKind.SCOPE_RESOLUTION, IdResolver.class, token, "Unresolved path: " + path);
            return Optional.empty();
        }
        return Optional.of(new FullNodePtr(headPtr.fileId(), found.get()));
    }
}

package org.livedoc.compiler.expansion;

import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveScopeItem;
import org.livedoc.compiler.document.LiveScopeTarget;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.TokenWithSpan;

/**
 * Deep-copies subtrees into the document being expanded.
 *
 * <p>When the source is another document, everything a node addresses through that
 * document's interned tables is duplicated into the destination and the spans rewritten:
 * string characters, body tokens, captured scopes (local captures become full pointers into
 * the source file) and multi-segment ids. Resolved pointers are copied as they are and keep
 * pointing at their original target.</p>
 */
public final class StructuralCopier {

    private final ExpansionSettings settings;

    public StructuralCopier(ExpansionSettings settings) {
        this.settings = settings;
    }

    /**
     * Result of copying the root a declaration derives from.
     *
     * @param isClass Whether the root was a class other than one deriving from {@code Self};
     *                only then may the declaration add fields.
     * @param alias   For a non-class root, the relocated copy carrying the declaring id,
     *                or {@code null} if the root produces no output.
     */
    public record CopyOutcome(boolean isClass, LiveNode alias) {

        static CopyOutcome ofClass() {
            return new CopyOutcome(true, null);
        }

        static CopyOutcome none() {
            return new CopyOutcome(false, null);
        }

        static CopyOutcome ofAlias(LiveNode alias) {
            return new CopyOutcome(false, alias);
        }
    }

    private record CopySource(LiveDocument doc, FileId fileId, boolean crossDocument) {}

    /**
     * Copies the node a declaration derives from. For a class root its fields land in the
     * declaration's child level; any other root is returned as an alias under the declaring
     * id, with its own children already copied. A class deriving from {@code Self} yields
     * neither.
     *
     * @param context   The expansion in progress.
     * @param root      The resolved base.
     * @param outLevel  The output level of the declaring node.
     * @param declaring The declaring raw node.
     */
    public CopyOutcome copyBase(ExpansionContext context, FullNodePtr root, int outLevel, LiveNode declaring) {
        LiveDocument doc = context.documentFor(root.fileId());
        CopySource source = new CopySource(doc, root.fileId(), !root.fileId().equals(context.fileId()));
        int rootLevel = root.localPtr().level();
        LiveNode rootNode = doc.node(root.localPtr());

        if (rootNode.value() instanceof LiveValue.ClassValue cls) {
            if (settings.isSelf(cls.base())) {
                return CopyOutcome.none();
            }
            int inChild = LiveDocument.childLevel(rootLevel, rootNode);
            int outChild = LiveDocument.childLevel(outLevel, declaring);
            for (int i = 0; i < cls.nodeCount(); i++) {
                copyInto(context.out(), source, inChild, cls.nodeStart() + i, outChild);
            }
            return CopyOutcome.ofClass();
        }
        return CopyOutcome.ofAlias(relocate(context.out(), source, rootLevel, root.localPtr().index(), outLevel,
                declaring.idPack()));
    }

    /**
     * Copies the already written entries of a span, from {@code start} to the current end of
     * {@code level}, into {@code outLevel}. This is how a class deriving from {@code Self}
     * takes over its siblings.
     */
    public void copySiblings(ExpansionContext context, int level, int start, int outLevel) {
        LiveDocument out = context.out();
        CopySource source = new CopySource(out, context.fileId(), false);
        int end = out.levelLength(level);
        for (int i = start; i < end; i++) {
            copyInto(out, source, level, i, outLevel);
        }
    }

    private void copyInto(LiveDocument out, CopySource source, int inLevel, int inIndex, int outLevel) {
        LiveNode copy = relocate(out, source, inLevel, inIndex, outLevel, null);
        if (copy != null) {
            out.pushNode(outLevel, copy);
        }
    }

    /**
     * Copies the subtree of one node and returns the relocated node without appending it.
     * Imports and classes deriving from {@code Self} produce nothing.
     */
    private LiveNode relocate(LiveDocument out, CopySource source, int inLevel, int inIndex, int outLevel, IdPack idOverride) {
        LiveNode node = source.doc().node(inLevel, inIndex);
        IdPack id = idOverride != null ? idOverride : relocateId(out, source, node.idPack());
        LiveValue value = node.value();

        if (value instanceof LiveValue.UseValue) {
            return null;
        }
        if (value instanceof LiveValue.ClassValue cls && settings.isSelf(cls.base())) {
            return null;
        }
        if (value instanceof LiveValue.Container container) {
            int inChild = LiveDocument.childLevel(inLevel, node);
            int outChild = outLevel + id.segmentCount();
            int start = out.levelLength(outChild);
            for (int i = 0; i < container.nodeCount(); i++) {
                copyInto(out, source, inChild, container.nodeStart() + i, outChild);
            }
            LiveValue.Container moved = container.withSpan(start, out.levelLength(outChild) - start);
            if (moved instanceof LiveValue.ClassValue cls) {
                moved = cls.withBase(relocateId(out, source, cls.base()));
            } else if (moved instanceof LiveValue.CallValue call) {
                moved = call.withTarget(relocateId(out, source, call.target()));
            }
            return new LiveNode(node.tokenId(), id, moved);
        }
        if (!source.crossDocument()) {
            return new LiveNode(node.tokenId(), id, value);
        }
        return new LiveNode(node.tokenId(), id, relocateValue(out, source, value));
    }

    private LiveValue relocateValue(LiveDocument out, CopySource source, LiveValue value) {
        if (value instanceof LiveValue.StringValue string) {
            int start = out.appendString(source.doc().stringRange(string.stringStart(), string.stringCount()));
            return new LiveValue.StringValue(start, string.stringCount());
        }
        if (value instanceof LiveValue.Body body) {
            int tokenStart = out.tokenCount();
            for (TokenWithSpan token : source.doc().tokens(body.tokenStart(), body.tokenCount())) {
                out.pushToken(token);
            }
            int scopeStart = out.scopeCount();
            for (LiveScopeItem item : source.doc().scopes(body.scopeStart(), body.scopeCount())) {
                if (item.target() instanceof LiveScopeTarget.Local local) {
                    out.pushScope(new LiveScopeItem(item.id(),
                            new LiveScopeTarget.Full(new FullNodePtr(source.fileId(), local.ptr()))));
                } else {
                    out.pushScope(item);
                }
            }
            return body.withSpans(tokenStart, scopeStart, body.scopeCount());
        }
        if (value instanceof LiveValue.ResourceRefValue resource) {
            return new LiveValue.ResourceRefValue(relocateId(out, source, resource.target()));
        }
        if (value instanceof LiveValue.IdValue ref) {
            return new LiveValue.IdValue(relocateId(out, source, ref.id()));
        }
        return value;
    }

    private IdPack relocateId(LiveDocument out, CopySource source, IdPack id) {
        return source.crossDocument() ? out.cloneMultiId(id, source.doc().multiIds()) : id;
    }
}

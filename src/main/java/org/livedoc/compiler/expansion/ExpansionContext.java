package org.livedoc.compiler.expansion;

import org.livedoc.compiler.diagnostics.DiagnosticsEngine;
import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveScopeTarget;
import org.livedoc.compiler.document.WriteResult;
import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LocalNodePtr;
import org.livedoc.compiler.model.TokenId;

/**
 * Everything the expansion of one document threads through its recursive walk: the raw
 * input, the output document, the scope stack and the error sink.
 */
public final class ExpansionContext {

    private final IDocumentStore store;
    private final ExpansionSettings settings;
    private final ExpansionWalker walker;
    private final CrateModule crateModule;
    private final FileId fileId;
    private final LiveDocument raw;
    private final LiveDocument out;
    private final DiagnosticsEngine diagnostics;
    private final ScopeStack scopes = new ScopeStack();

    public ExpansionContext(IDocumentStore store, ExpansionSettings settings, ExpansionWalker walker,
                            CrateModule crateModule, FileId fileId, LiveDocument raw, LiveDocument out,
                            DiagnosticsEngine diagnostics) {
        this.store = store;
        this.settings = settings;
        this.walker = walker;
        this.crateModule = crateModule;
        this.fileId = fileId;
        this.raw = raw;
        this.out = out;
        this.diagnostics = diagnostics;
    }

    public IDocumentStore store() {
        return store;
    }

    public ExpansionSettings settings() {
        return settings;
    }

    public CrateModule crateModule() {
        return crateModule;
    }

    public FileId fileId() {
        return fileId;
    }

    public LiveDocument raw() {
        return raw;
    }

    public LiveDocument out() {
        return out;
    }

    public ScopeStack scopes() {
        return scopes;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * The document a pointer into {@code target} must be read from. For the file being
     * expanded that is the output under construction, not its stale previous expansion.
     */
    public LiveDocument documentFor(FileId target) {
        return target.equals(fileId) ? out : store.getExpandedDocument(target);
    }

    /**
     * Expands one raw node into the output.
     */
    public void walk(int inLevel, int inIndex, int outLevel, int outStart) {
        walker.walkNode(this, inLevel, inIndex, outLevel, outStart);
    }

    /**
     * Writes a node through the write/merge policy, searching the span written so far from
     * {@code searchStart}. A newly appended single id at the level of the innermost frame
     * becomes visible to later siblings.
     */
    public void writeOrAdd(int level, int searchStart, LiveNode node) {
        int searchCount = Math.max(0, out.levelLength(level) - searchStart);
        WriteResult result = out.writeOrAddNode(level, searchStart, searchCount, raw, node);
        if (result.kind() == WriteResult.Kind.REJECTED) {
            error(LiveErrorKind.STRUCTURAL, ExpansionContext.class, node.tokenId(), result.message());
            return;
        }
        if (result.isAppended() && scopes.depth() - 1 == level && node.idPack() instanceof IdPack.Single single) {
            scopes.bind(single.id(), new LiveScopeTarget.Local(new LocalNodePtr(level, result.index())));
        }
    }

    public void error(LiveErrorKind kind, Class<?> origin, TokenId token, String message) {
        diagnostics.report(kind, origin, token != null ? store.tokenIdToSpan(token) : null, message);
    }

    /**
     * Renders an id of the raw document for messages.
     */
    public String format(IdPack id) {
        return raw.format(id);
    }
}

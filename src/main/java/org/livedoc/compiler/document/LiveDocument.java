package org.livedoc.compiler.document;

import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.LocalNodePtr;
import org.livedoc.compiler.model.Span;
import org.livedoc.compiler.model.TokenId;
import org.livedoc.compiler.model.TokenWithSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The node tree of one file, in raw (as parsed) or expanded form.
 *
 * <p>Nodes are stored by level: level 0 holds the top-level declarations and the children
 * of a container node live in a contiguous run one child level below it. A node whose id
 * has {@code n} segments keeps its children {@code n} levels below itself, so a single
 * {@code a::b::c} declaration occupies the intermediate levels implicitly. Nodes are only
 * ever appended to a level, or replaced in place by the write/merge policy; indices never
 * shift.</p>
 *
 * <p>Besides nodes, a document owns four interned tables addressed by spans: string
 * characters, tokens, captured scope items and multi-segment ids.</p>
 */
public final class LiveDocument {

    private boolean recompile = true;
    private final List<List<LiveNode>> nodes = new ArrayList<>();
    private final StringBuilder strings = new StringBuilder();
    private final List<TokenWithSpan> tokens = new ArrayList<>();
    private final List<LiveScopeItem> scopes = new ArrayList<>();
    private final List<LiveId> multiIds = new ArrayList<>();

    // === Dirty flag ===

    /**
     * Whether the expanded form of this document is stale and must be rebuilt.
     */
    public boolean isRecompile() {
        return recompile;
    }

    public void setRecompile(boolean recompile) {
        this.recompile = recompile;
    }

    // === Nodes ===

    /**
     * The level holding the children of {@code node}, which itself sits at {@code level}.
     */
    public static int childLevel(int level, LiveNode node) {
        return level + node.idPack().segmentCount();
    }

    public int levelCount() {
        return nodes.size();
    }

    public int levelLength(int level) {
        return level < nodes.size() ? nodes.get(level).size() : 0;
    }

    public List<LiveNode> level(int level) {
        return level < nodes.size() ? Collections.unmodifiableList(nodes.get(level)) : List.of();
    }

    public LiveNode node(int level, int index) {
        if (level >= nodes.size() || index >= nodes.get(level).size()) {
            throw new IllegalArgumentException("No node at " + level + ":" + index);
        }
        return nodes.get(level).get(index);
    }

    public LiveNode node(LocalNodePtr ptr) {
        return node(ptr.level(), ptr.index());
    }

    /**
     * Appends a node to a level, creating intermediate levels as needed.
     *
     * @return The index of the new node.
     */
    public int pushNode(int level, LiveNode node) {
        while (nodes.size() <= level) {
            nodes.add(new ArrayList<>());
        }
        List<LiveNode> row = nodes.get(level);
        row.add(node);
        return row.size() - 1;
    }

    public void setNode(int level, int index, LiveNode node) {
        nodes.get(level).set(index, node);
    }

    /**
     * Overrides an entry of the given span if one carries the same id, otherwise appends.
     * Overwriting keeps the entry's position so that positional copies of this span taken
     * later still find it. Writing the same id twice is not an error: the last write wins.
     *
     * @param level       The level to write at.
     * @param searchStart First index of the span searched for an existing entry.
     * @param searchCount Length of that span.
     * @param inDoc       The document whose multi-id table the incoming id refers to.
     * @param node        The node to write.
     * @return Where the node went.
     */
    public WriteResult writeOrAddNode(int level, int searchStart, int searchCount, LiveDocument inDoc, LiveNode node) {
        IdPack id = node.idPack();
        if (id instanceof IdPack.NodePtr) {
            return WriteResult.rejected("A resolved pointer cannot be used as a declaration id: " + id);
        }
        if (!id.isEmpty()) {
            int end = Math.min(searchStart + searchCount, levelLength(level));
            for (int i = searchStart; i < end; i++) {
                LiveNode existing = nodes.get(level).get(i);
                if (idMatches(existing.idPack(), multiIds, id, inDoc.multiIds)) {
                    nodes.get(level).set(i, node);
                    return WriteResult.overwritten(i);
                }
            }
        }
        return WriteResult.appended(pushNode(level, node));
    }

    private static boolean idMatches(IdPack left, List<LiveId> leftTable, IdPack right, List<LiveId> rightTable) {
        if (left instanceof IdPack.Single l && right instanceof IdPack.Single r) {
            return l.id().equals(r.id());
        }
        if (left instanceof IdPack.Multi l && right instanceof IdPack.Multi r) {
            return l.segments(leftTable).equals(r.segments(rightTable));
        }
        return false;
    }

    // === Path scans ===

    /**
     * Looks up a path of ids starting at the top-level declarations.
     */
    public Optional<LocalNodePtr> scanForMulti(List<LiveId> path) {
        return scanSpan(0, 0, levelLength(0), path);
    }

    /**
     * Looks up a path of ids inside a span of one level. Every segment but the last must
     * land on a class or object whose children are searched for the remainder. A node whose
     * own id is a multi path matches the same number of path segments.
     *
     * @return The node the full path lands on.
     */
    public Optional<LocalNodePtr> scanSpan(int level, int start, int count, List<LiveId> path) {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        int end = Math.min(start + count, levelLength(level));
        for (int i = start; i < end; i++) {
            LiveNode node = nodes.get(level).get(i);
            int consumed = matchPrefix(node.idPack(), path);
            if (consumed == 0) {
                continue;
            }
            if (consumed == path.size()) {
                return Optional.of(new LocalNodePtr(level, i));
            }
            if (node.value() instanceof LiveValue.ClassValue || node.value() instanceof LiveValue.ObjectValue) {
                LiveValue.Container container = (LiveValue.Container) node.value();
                return scanSpan(childLevel(level, node), container.nodeStart(), container.nodeCount(),
                        path.subList(consumed, path.size()));
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    private int matchPrefix(IdPack id, List<LiveId> path) {
        if (id instanceof IdPack.Single single) {
            return single.id().equals(path.get(0)) ? 1 : 0;
        }
        if (id instanceof IdPack.Multi multi) {
            List<LiveId> segments = multi.segments(multiIds);
            if (segments.size() <= path.size() && path.subList(0, segments.size()).equals(segments)) {
                return segments.size();
            }
        }
        return 0;
    }

    // === Strings ===

    /**
     * Interns characters into the string table.
     *
     * @return The start offset of the appended run.
     */
    public int appendString(CharSequence chars) {
        int start = strings.length();
        strings.append(chars);
        return start;
    }

    public String string(LiveValue.StringValue value) {
        return strings.substring(value.stringStart(), value.stringStart() + value.stringCount());
    }

    public String stringRange(int start, int count) {
        return strings.substring(start, start + count);
    }

    public int stringsLength() {
        return strings.length();
    }

    // === Tokens ===

    public int pushToken(TokenWithSpan token) {
        tokens.add(token);
        return tokens.size() - 1;
    }

    public TokenWithSpan token(int index) {
        return tokens.get(index);
    }

    public int tokenCount() {
        return tokens.size();
    }

    public List<TokenWithSpan> tokens(int start, int count) {
        return Collections.unmodifiableList(tokens.subList(start, start + count));
    }

    /**
     * Span of a token owned by this (raw) document.
     */
    public Span tokenIdToSpan(TokenId tokenId) {
        return tokens.get(tokenId.tokenIndex()).span();
    }

    // === Captured scopes ===

    public void pushScope(LiveScopeItem item) {
        scopes.add(item);
    }

    public int scopeCount() {
        return scopes.size();
    }

    public List<LiveScopeItem> scopes(int start, int count) {
        return Collections.unmodifiableList(scopes.subList(start, start + count));
    }

    // === Multi ids ===

    /**
     * Interns a path. A single segment yields a {@link IdPack.Single}.
     */
    public IdPack pushMultiId(List<LiveId> segments) {
        if (segments.isEmpty()) {
            return IdPack.empty();
        }
        if (segments.size() == 1) {
            return IdPack.single(segments.get(0));
        }
        int start = multiIds.size();
        multiIds.addAll(segments);
        return IdPack.multi(start, segments.size());
    }

    /**
     * Re-interns a multi id that refers to another document's table. Other ids are
     * returned as they are.
     */
    public IdPack cloneMultiId(IdPack id, List<LiveId> sourceMultiIds) {
        if (id instanceof IdPack.Multi multi) {
            return pushMultiId(new ArrayList<>(multi.segments(sourceMultiIds)));
        }
        return id;
    }

    public List<LiveId> multiIds() {
        return Collections.unmodifiableList(multiIds);
    }

    /**
     * The path segments of an id: none for the empty id, one for a single id.
     */
    public List<LiveId> segments(IdPack id) {
        if (id instanceof IdPack.Single single) {
            return List.of(single.id());
        }
        if (id instanceof IdPack.Multi multi) {
            return multi.segments(multiIds);
        }
        return List.of();
    }

    public String format(IdPack id) {
        return id.format(multiIds);
    }

    // === Lifecycle ===

    /**
     * Drops all nodes and re-seeds the interned tables from a raw document, so the spans
     * of the raw nodes stay valid in this document.
     */
    public void restartFrom(LiveDocument raw) {
        nodes.clear();
        strings.setLength(0);
        strings.append(raw.strings);
        tokens.clear();
        tokens.addAll(raw.tokens);
        scopes.clear();
        scopes.addAll(raw.scopes);
        multiIds.clear();
        multiIds.addAll(raw.multiIds);
    }
}

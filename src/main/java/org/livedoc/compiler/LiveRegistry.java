package org.livedoc.compiler;

import org.livedoc.compiler.diagnostics.DiagnosticsEngine;
import org.livedoc.compiler.diagnostics.LiveError;
import org.livedoc.compiler.diagnostics.LiveErrorKind;
import org.livedoc.compiler.diagnostics.LiveFileError;
import org.livedoc.compiler.diagnostics.LiveParseException;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.expansion.ExpansionContext;
import org.livedoc.compiler.expansion.ExpansionSettings;
import org.livedoc.compiler.expansion.ExpansionWalker;
import org.livedoc.compiler.expansion.IDocumentStore;
import org.livedoc.compiler.expansion.handlers.ExpansionHandlerRegistry;
import org.livedoc.compiler.frontend.io.ILiveParser;
import org.livedoc.compiler.frontend.module.DependencyGraph;
import org.livedoc.compiler.frontend.module.LiveFile;
import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.FullNodePtr;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.LocalNodePtr;
import org.livedoc.compiler.model.Span;
import org.livedoc.compiler.model.TokenId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The owned store of all registered files: raw documents, their expanded forms, the
 * dependency graph and the processing order.
 *
 * <p>Usage is a cycle of {@link #parseLiveFile} for every new or changed file followed by
 * one {@link #expandAllDocuments} pass, which rebuilds exactly the documents that became
 * dirty. The registry is not thread-safe; parse and expansion calls must not overlap.</p>
 */
public class LiveRegistry implements IDocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(LiveRegistry.class);

    /**
     * A node dereferenced through the registry.
     *
     * @param document The expanded document holding the node.
     * @param node     The node.
     */
    public record ResolvedNode(LiveDocument document, LiveNode node) {}

    /**
     * The end of a class chain, as found by {@link #findComponentOrigin}.
     *
     * @param owner    The crate-module declaring the origin class.
     * @param originId The id the origin class is declared under.
     * @param ptr      The queried class node, whose overrides a factory lookup needs.
     */
    public record ComponentOrigin(CrateModule owner, LiveId originId, FullNodePtr ptr) {}

    private final ILiveParser parser;
    private final ExpansionSettings settings;
    private final ExpansionWalker walker;

    private final Map<CrateModule, FileId> crateModuleToFileId = new LinkedHashMap<>();
    private final List<LiveFile> liveFiles = new ArrayList<>();
    private final List<LiveDocument> expanded = new ArrayList<>();
    private final DependencyGraph graph = new DependencyGraph();

    public LiveRegistry(ILiveParser parser) {
        this(parser, ExpansionSettings.defaults());
    }

    public LiveRegistry(ILiveParser parser, ExpansionSettings settings) {
        this.parser = parser;
        this.settings = settings;
        this.walker = new ExpansionWalker(ExpansionHandlerRegistry.initializeWithDefaults(settings));
    }

    // === Registration ===

    /**
     * Registers or replaces the source of a crate-module.
     *
     * <p>On re-registration the module's expanded document and those of every module that
     * depends on it, directly or transitively, are marked dirty. The module's imports
     * become its new dependency set and the processing order is repaired so that each
     * import precedes the module. Imports of modules that are not registered are accepted
     * here and reported by the next expansion pass.</p>
     *
     * @param file   The display name of the file.
     * @param crate  The crate the file belongs to.
     * @param module The module name.
     * @param source The source text.
     * @return The identity of the file.
     * @throws LiveParseException if the source cannot be parsed; the registry is unchanged.
     */
    public FileId parseLiveFile(String file, LiveId crate, LiveId module, String source) throws LiveParseException {
        CrateModule crateModule = new CrateModule(crate, module);
        FileId existing = crateModuleToFileId.get(crateModule);
        FileId fileId = existing != null ? existing : new FileId(liveFiles.size());

        LiveDocument raw = parser.parse(fileId, file, source);

        if (!graph.appendIfAbsent(crateModule)) {
            markDirty(crateModule);
        }

        Set<CrateModule> imports = new LinkedHashSet<>();
        for (int level = 0; level < raw.levelCount(); level++) {
            for (LiveNode node : raw.level(level)) {
                if (node.value() instanceof LiveValue.UseValue use) {
                    CrateModule dependency = use.crateModule(crate);
                    if (!dependency.equals(crateModule)) {
                        graph.placeBefore(dependency, crateModule, node.tokenId());
                        imports.add(dependency);
                    }
                }
            }
        }
        graph.setDependencies(crateModule, imports);

        LiveFile liveFile = new LiveFile(crateModule, file, source, raw);
        if (existing == null) {
            crateModuleToFileId.put(crateModule, fileId);
            liveFiles.add(liveFile);
            expanded.add(new LiveDocument());
            LOG.debug("Registered {} as {} ({})", crateModule, fileId, file);
        } else {
            liveFiles.set(fileId.index(), liveFile);
            expanded.get(fileId.index()).setRecompile(true);
            LOG.debug("Replaced {} ({})", crateModule, file);
        }
        for (CrateModule stale : graph.pruneStale(crateModuleToFileId::containsKey)) {
            LOG.debug("Dropped {} from the processing order, no module imports it", stale);
        }
        return fileId;
    }

    public FileId parseLiveFile(String file, String crate, String module, String source) throws LiveParseException {
        return parseLiveFile(file, LiveId.of(crate), LiveId.of(module), source);
    }

    private void markDirty(CrateModule changed) {
        for (CrateModule crateModule : graph.dependentsClosure(changed)) {
            FileId fileId = crateModuleToFileId.get(crateModule);
            if (fileId != null) {
                expanded.get(fileId.index()).setRecompile(true);
                LOG.debug("Marked {} dirty after change of {}", crateModule, changed);
            }
        }
    }

    // === Expansion ===

    /**
     * Rebuilds every dirty expanded document in processing order. Problems are appended to
     * {@code diagnostics}; the pass always runs to the end.
     *
     * @param diagnostics The error sink.
     */
    public void expandAllDocuments(DiagnosticsEngine diagnostics) {
        int before = diagnostics.errorCount();
        int rebuilt = 0;
        for (DependencyGraph.OrderEntry entry : new ArrayList<>(graph.order())) {
            CrateModule crateModule = entry.crateModule();
            FileId fileId = crateModuleToFileId.get(crateModule);
            if (fileId == null) {
                diagnostics.report(LiveErrorKind.MISSING_DEPENDENCY, LiveRegistry.class,
                        tokenIdToSpan(entry.importToken()), "Cannot find dependency: " + crateModule);
                continue;
            }
            LiveDocument out = expanded.get(fileId.index());
            if (!out.isRecompile()) {
                continue;
            }
            LiveDocument raw = liveFiles.get(fileId.index()).document();
            out.restartFrom(raw);
            walker.expandDocument(new ExpansionContext(this, settings, walker, crateModule, fileId, raw, out, diagnostics));
            out.setRecompile(false);
            rebuilt++;
        }
        LOG.debug("Expansion pass rebuilt {} of {} documents, {} new errors", rebuilt, liveFiles.size(),
                diagnostics.errorCount() - before);
    }

    // === Lookups ===

    /**
     * Dereferences a pointer produced by expansion.
     *
     * @throws IllegalArgumentException if the pointer does not address a node.
     */
    public ResolvedNode resolvePtr(FullNodePtr ptr) {
        LiveDocument document = getExpandedDocument(ptr.fileId());
        return new ResolvedNode(document, document.node(ptr.localPtr()));
    }

    /**
     * Renders an error against the source text of the file its span points into.
     */
    public LiveFileError liveErrorToLiveFileError(LiveError error) {
        Span span = error.span();
        if (span == null || span.fileId().index() >= liveFiles.size()) {
            return LiveFileError.of("<unknown>", null, null, error.message());
        }
        LiveFile file = liveFiles.get(span.fileId().index());
        return error.toLiveFileError(file.file(), file.source());
    }

    @Override
    public Span tokenIdToSpan(TokenId tokenId) {
        if (tokenId == null || tokenId.fileId().index() >= liveFiles.size()) {
            return null;
        }
        LiveDocument raw = liveFiles.get(tokenId.fileId().index()).document();
        if (tokenId.tokenIndex() >= raw.tokenCount()) {
            return null;
        }
        return raw.tokenIdToSpan(tokenId);
    }

    public boolean isBaseClass(IdPack id) {
        return settings.isBaseClass(id);
    }

    /**
     * Follows resolved class bases to the first base that is not a pointer, typically a
     * reserved root kind.
     *
     * @return The unresolved base id, or empty if the chain leaves the classes or loops.
     */
    public Optional<IdPack> findBaseClassId(IdPack start) {
        IdPack id = start;
        Set<FullNodePtr> visited = new HashSet<>();
        while (id instanceof IdPack.NodePtr ptr) {
            if (!visited.add(ptr.ptr())) {
                return Optional.empty();
            }
            if (!(resolvePtr(ptr.ptr()).node().value() instanceof LiveValue.ClassValue cls)) {
                return Optional.empty();
            }
            id = cls.base();
        }
        return Optional.of(id);
    }

    /**
     * Follows references, class bases and call targets from {@code start} and returns the
     * declared id of the last node reached, or {@code lhs} if {@code start} is not a
     * pointer.
     */
    public IdPack findEnumOrigin(IdPack start, IdPack lhs) {
        IdPack current = start;
        IdPack origin = lhs;
        Set<FullNodePtr> visited = new HashSet<>();
        while (current instanceof IdPack.NodePtr ptr && visited.add(ptr.ptr())) {
            LiveNode node = resolvePtr(ptr.ptr()).node();
            IdPack next;
            if (node.value() instanceof LiveValue.IdValue ref) {
                next = ref.id();
            } else if (node.value() instanceof LiveValue.ClassValue cls) {
                next = cls.base();
            } else if (node.value() instanceof LiveValue.CallValue call) {
                next = call.target();
            } else {
                break;
            }
            origin = node.idPack();
            current = next;
        }
        return origin;
    }

    /**
     * Looks up a path of ids among the top-level declarations of an expanded module.
     *
     * @return The node, if the path exists and lands on a class.
     */
    public Optional<FullNodePtr> findFullNodePtrFromIds(LiveId crate, LiveId module, List<LiveId> ids) {
        Optional<FileId> fileId = fileIdOf(new CrateModule(crate, module));
        if (fileId.isEmpty()) {
            return Optional.empty();
        }
        LiveDocument document = getExpandedDocument(fileId.get());
        Optional<LocalNodePtr> found = document.scanForMulti(ids);
        if (found.isEmpty() || !document.node(found.get()).isClass()) {
            return Optional.empty();
        }
        return Optional.of(new FullNodePtr(fileId.get(), found.get()));
    }

    /**
     * Walks the base chain of a class to the class that derives from the component root.
     *
     * @param crate  The crate of the module declaring the start class.
     * @param module The module declaring the start class.
     * @param path   The path of the start class among the module's declarations.
     * @return The owner and id of the class deriving from the component root, with a pointer
     *         to the start class; empty if the path is not a class or the chain does not end
     *         at the component root.
     */
    public Optional<ComponentOrigin> findComponentOrigin(LiveId crate, LiveId module, List<LiveId> path) {
        Optional<FullNodePtr> start = findFullNodePtrFromIds(crate, module, path);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        FullNodePtr ptr = start.get();
        Set<FullNodePtr> visited = new HashSet<>();
        while (visited.add(ptr)) {
            ResolvedNode resolved = resolvePtr(ptr);
            if (!(resolved.node().value() instanceof LiveValue.ClassValue cls)) {
                return Optional.empty();
            }
            IdPack base = cls.base();
            if (base.isSingle(settings.componentClass())) {
                List<LiveId> segments = resolved.document().segments(resolved.node().idPack());
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                LiveId originId = segments.get(segments.size() - 1);
                FullNodePtr queried = start.get();
                return findCrateModuleByFileId(ptr.fileId()).map(owner -> new ComponentOrigin(owner, originId, queried));
            }
            if (!(base instanceof IdPack.NodePtr next)) {
                return Optional.empty();
            }
            ptr = next.ptr();
        }
        return Optional.empty();
    }

    public Optional<CrateModule> findCrateModuleByFileId(FileId fileId) {
        if (fileId.index() >= liveFiles.size()) {
            return Optional.empty();
        }
        return Optional.of(liveFiles.get(fileId.index()).crateModule());
    }

    // === Store ===

    @Override
    public LiveDocument getExpandedDocument(FileId fileId) {
        return expanded.get(fileId.index());
    }

    @Override
    public Optional<FileId> fileIdOf(CrateModule crateModule) {
        return Optional.ofNullable(crateModuleToFileId.get(crateModule));
    }

    public LiveFile getLiveFile(FileId fileId) {
        return liveFiles.get(fileId.index());
    }

    public int fileCount() {
        return liveFiles.size();
    }

    public List<CrateModule> processingOrder() {
        return graph.processingOrder();
    }

    public DependencyGraph dependencyGraph() {
        return graph;
    }

    public ExpansionSettings settings() {
        return settings;
    }

    public Map<CrateModule, FileId> registeredModules() {
        return Collections.unmodifiableMap(crateModuleToFileId);
    }
}

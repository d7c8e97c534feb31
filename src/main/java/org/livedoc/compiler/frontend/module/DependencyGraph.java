package org.livedoc.compiler.frontend.module;

import org.livedoc.compiler.model.CrateModule;
import org.livedoc.compiler.model.TokenId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The crate-module dependency sets plus the processing order used by expansion.
 *
 * <p>The order is repaired online as modules are (re)registered rather than sorted from
 * scratch: an import that is new to the order is inserted right before its importer, and an
 * import found after its importer is moved right before it. Every module therefore follows
 * the modules it is known to depend on, as far as the registrations seen so far tell.</p>
 */
public final class DependencyGraph {

    /**
     * One processing order entry.
     *
     * @param crateModule The module to expand.
     * @param importToken The {@code use} token that introduced the module, or {@code null}
     *                    for modules that were registered directly. Used to point
     *                    missing-dependency diagnostics at the importing source.
     */
    public record OrderEntry(CrateModule crateModule, TokenId importToken) {}

    private final List<OrderEntry> order = new ArrayList<>();
    private final Map<CrateModule, Set<CrateModule>> dependencies = new LinkedHashMap<>();

    public boolean contains(CrateModule crateModule) {
        return indexOf(crateModule) >= 0;
    }

    public int indexOf(CrateModule crateModule) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).crateModule().equals(crateModule)) return i;
        }
        return -1;
    }

    /**
     * Appends a module at the end of the order unless it is already present.
     *
     * @return true if the module was new to the order.
     */
    public boolean appendIfAbsent(CrateModule crateModule) {
        if (contains(crateModule)) return false;
        order.add(new OrderEntry(crateModule, null));
        return true;
    }

    /**
     * Ensures {@code dependency} is processed before {@code dependent}.
     *
     * @param dependency  The imported module.
     * @param dependent   The importing module, which must already be in the order.
     * @param importToken The token of the {@code use} declaration.
     */
    public void placeBefore(CrateModule dependency, CrateModule dependent, TokenId importToken) {
        int selfIndex = indexOf(dependent);
        if (selfIndex < 0) {
            throw new IllegalStateException("Module " + dependent + " is not in the processing order");
        }
        int otherIndex = indexOf(dependency);
        if (otherIndex < 0) {
            order.add(selfIndex, new OrderEntry(dependency, importToken));
        } else if (otherIndex > selfIndex) {
            order.remove(otherIndex);
            order.add(selfIndex, new OrderEntry(dependency, importToken));
        }
    }

    /**
     * Replaces the dependency set of a module.
     */
    public void setDependencies(CrateModule crateModule, Set<CrateModule> imports) {
        dependencies.put(crateModule, Collections.unmodifiableSet(new LinkedHashSet<>(imports)));
    }

    /**
     * Drops order entries for modules that are neither registered nor imported by any
     * module any more, such as the target of an import that was deleted from its file.
     *
     * @param registered Tells whether a module has a registered file.
     * @return The modules removed from the order.
     */
    public List<CrateModule> pruneStale(Predicate<CrateModule> registered) {
        List<CrateModule> removed = new ArrayList<>();
        order.removeIf(entry -> {
            CrateModule crateModule = entry.crateModule();
            if (registered.test(crateModule) || isImported(crateModule)) return false;
            removed.add(crateModule);
            return true;
        });
        return removed;
    }

    private boolean isImported(CrateModule crateModule) {
        for (Set<CrateModule> imports : dependencies.values()) {
            if (imports.contains(crateModule)) return true;
        }
        return false;
    }

    public Set<CrateModule> dependenciesOf(CrateModule crateModule) {
        return dependencies.getOrDefault(crateModule, Set.of());
    }

    /**
     * Collects {@code start} and every module that depends on it directly or transitively,
     * breadth first over the reverse dependency relation. Each module appears once, also
     * when the modules form a cycle.
     */
    public List<CrateModule> dependentsClosure(CrateModule start) {
        Set<CrateModule> visited = new LinkedHashSet<>();
        Queue<CrateModule> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            CrateModule current = queue.poll();
            for (Map.Entry<CrateModule, Set<CrateModule>> entry : dependencies.entrySet()) {
                if (entry.getValue().contains(current) && visited.add(entry.getKey())) {
                    queue.add(entry.getKey());
                }
            }
        }
        return new ArrayList<>(visited);
    }

    public List<OrderEntry> order() {
        return Collections.unmodifiableList(order);
    }

    public List<CrateModule> processingOrder() {
        List<CrateModule> modules = new ArrayList<>(order.size());
        for (OrderEntry entry : order) {
            modules.add(entry.crateModule());
        }
        return modules;
    }
}

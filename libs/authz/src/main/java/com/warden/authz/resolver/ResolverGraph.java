package com.warden.authz.resolver;

import com.warden.authz.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Execution plan for a set of resolvers: a topological order with priority tie-break, grouped
 * into dependency levels.
 * <p>
 * A resolver's level is 0 when it has no dependencies and otherwise one more than the highest
 * level among its dependencies. Within the order, among resolvers whose dependencies are all
 * placed, higher priority comes first and equal priorities keep registration order.
 */
final class ResolverGraph {

    private final List<ContextResolver> order;
    private final List<List<ContextResolver>> levels;

    private ResolverGraph(List<ContextResolver> order, List<List<ContextResolver>> levels) {
        this.order = order;
        this.levels = levels;
    }

    /**
     * Validates and plans the given resolvers.
     *
     * @param resolvers resolvers by name, in registration order
     * @throws SchemaException on an unknown dependency or a dependency cycle
     */
    static ResolverGraph plan(Map<String, ContextResolver> resolvers) {
        checkDependenciesExist(resolvers);
        checkAcyclic(resolvers);
        List<ContextResolver> order = topologicalOrder(resolvers);
        return new ResolverGraph(order, groupLevels(order));
    }

    /** All resolvers in execution order. */
    List<ContextResolver> order() {
        return order;
    }

    /** Resolvers grouped by level; each group keeps execution order. */
    List<List<ContextResolver>> levels() {
        return levels;
    }

    private static void checkDependenciesExist(Map<String, ContextResolver> resolvers) {
        for (ContextResolver resolver : resolvers.values()) {
            for (String dependency : resolver.dependsOn()) {
                if (!resolvers.containsKey(dependency)) {
                    throw new SchemaException(
                            "Resolver '" + resolver.name() + "' depends on unknown resolver '" + dependency + "'",
                            Map.of("resolver", resolver.name(), "dependency", dependency));
                }
            }
        }
    }

    private static void checkAcyclic(Map<String, ContextResolver> resolvers) {
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String name : resolvers.keySet()) {
            visit(name, resolvers, visited, visiting, new ArrayList<>());
        }
    }

    private static void visit(String name, Map<String, ContextResolver> resolvers,
                              Set<String> visited, Set<String> visiting, List<String> path) {
        if (visited.contains(name)) {
            return;
        }
        path.add(name);
        if (!visiting.add(name)) {
            throw new SchemaException(
                    "Circular dependency detected involving resolver '" + name + "': " + String.join(" -> ", path),
                    Map.of("resolver", name, "path", List.copyOf(path)));
        }
        for (String dependency : resolvers.get(name).dependsOn()) {
            visit(dependency, resolvers, visited, visiting, path);
        }
        visiting.remove(name);
        visited.add(name);
        path.remove(path.size() - 1);
    }

    // Kahn's algorithm; the ready list stays sorted so the head is always the next resolver.
    private static List<ContextResolver> topologicalOrder(Map<String, ContextResolver> resolvers) {
        Map<String, Integer> registrationIndex = new HashMap<>();
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        int index = 0;
        for (ContextResolver resolver : resolvers.values()) {
            registrationIndex.put(resolver.name(), index++);
            pending.put(resolver.name(), resolver.dependsOn().size());
            for (String dependency : resolver.dependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(resolver.name());
            }
        }

        Comparator<ContextResolver> readyOrder = Comparator
                .comparingInt(ContextResolver::priority).reversed()
                .thenComparing(r -> registrationIndex.get(r.name()));

        List<ContextResolver> ready = new ArrayList<>();
        for (ContextResolver resolver : resolvers.values()) {
            if (resolver.dependsOn().isEmpty()) {
                insertSorted(ready, resolver, readyOrder);
            }
        }

        List<ContextResolver> order = new ArrayList<>(resolvers.size());
        while (!ready.isEmpty()) {
            ContextResolver next = ready.remove(0);
            order.add(next);
            for (String dependent : dependents.getOrDefault(next.name(), List.of())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    insertSorted(ready, resolvers.get(dependent), readyOrder);
                }
            }
        }
        return Collections.unmodifiableList(order);
    }

    private static void insertSorted(List<ContextResolver> ready, ContextResolver resolver,
                                     Comparator<ContextResolver> readyOrder) {
        int position = Collections.binarySearch(ready, resolver, readyOrder);
        ready.add(position < 0 ? -(position + 1) : position, resolver);
    }

    private static List<List<ContextResolver>> groupLevels(List<ContextResolver> order) {
        Map<String, Integer> levelOf = new HashMap<>();
        Map<Integer, List<ContextResolver>> grouped = new LinkedHashMap<>();
        int maxLevel = -1;
        for (ContextResolver resolver : order) {
            int level = 0;
            for (String dependency : resolver.dependsOn()) {
                level = Math.max(level, levelOf.get(dependency) + 1);
            }
            levelOf.put(resolver.name(), level);
            grouped.computeIfAbsent(level, k -> new ArrayList<>()).add(resolver);
            maxLevel = Math.max(maxLevel, level);
        }
        List<List<ContextResolver>> levels = new ArrayList<>(maxLevel + 1);
        for (int level = 0; level <= maxLevel; level++) {
            levels.add(List.copyOf(grouped.get(level)));
        }
        return Collections.unmodifiableList(levels);
    }
}

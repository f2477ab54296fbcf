package com.warden.authz.rebac;

import com.warden.authz.SchemaException;
import com.warden.context.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles and stores relationship paths and row-level policies per table.
 * <p>
 * All validation happens at registration: every step names both tables, each step starts
 * where the previous one ended (its table or alias), and every policy's path resolves, first
 * among the table's own paths and then among global ones. Paths registered with a table are
 * also published globally so later tables can reuse them.
 * <p>
 * Compiled policies are kept sorted by descending priority; equal priorities keep declaration
 * order. Registration is thread-safe and replaces any previous configuration of the table.
 */
public final class RelationshipRegistry {

    private static final Logger log = LoggerFactory.getLogger(RelationshipRegistry.class);

    private final Map<String, CompiledTable> tables = new ConcurrentHashMap<>();
    private final Map<String, CompiledRelationshipPath> globalRelationships = new ConcurrentHashMap<>();

    /**
     * Compiles and registers the configuration of {@code table}.
     *
     * @throws SchemaException if a path or policy is invalid
     */
    public synchronized void registerTable(String table, TableReBAcConfig config) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }

        Map<String, CompiledRelationshipPath> relationships = new LinkedHashMap<>();
        for (RelationshipPath path : config.relationships()) {
            relationships.put(path.name(), compilePath(path, table));
        }

        List<CompiledPolicy> policies = new ArrayList<>(config.policies().size());
        for (int i = 0; i < config.policies().size(); i++) {
            ReBAcPolicyDefinition definition = config.policies().get(i);
            String name = definition.name() != null ? definition.name() : table + "_rebac_policy_" + i;
            policies.add(compilePolicy(definition, name, table, relationships));
        }
        policies.sort(Comparator.comparingInt(CompiledPolicy::priority).reversed());

        globalRelationships.putAll(relationships);
        tables.put(table, new CompiledTable(Map.copyOf(relationships), List.copyOf(policies)));
        log.info("Registered ReBAC table '{}': {} relationship(s), {} polic(ies)",
                table, relationships.size(), policies.size());
    }

    /**
     * Compiles and registers a path usable by any table.
     *
     * @throws SchemaException if the path is invalid
     */
    public synchronized void registerRelationship(RelationshipPath path) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (path.steps().isEmpty()) {
            throw new SchemaException("Relationship path '" + path.name() + "' has no steps",
                    Map.of("path", path.name()));
        }
        CompiledRelationshipPath compiled = compilePath(path, path.steps().get(0).from());
        globalRelationships.put(path.name(), compiled);
        log.debug("Registered global relationship '{}' ({} -> {})",
                path.name(), compiled.sourceTable(), compiled.targetTable());
    }

    /**
     * Policies of {@code table} covering {@code operation}, highest priority first. Empty when
     * the table is not configured.
     */
    public List<CompiledPolicy> getPolicies(String table, Operation operation) {
        CompiledTable compiled = tables.get(table);
        if (compiled == null) {
            return List.of();
        }
        Set<Operation> wanted = operation.expand();
        return compiled.policies().stream()
                .filter(policy -> wanted.stream().anyMatch(policy::appliesTo))
                .toList();
    }

    /** Looks up a path in {@code table}'s own paths first (when given), then globally. */
    public Optional<CompiledRelationshipPath> getRelationship(String name, String table) {
        if (table != null) {
            CompiledTable compiled = tables.get(table);
            if (compiled != null && compiled.relationships().containsKey(name)) {
                return Optional.of(compiled.relationships().get(name));
            }
        }
        return Optional.ofNullable(globalRelationships.get(name));
    }

    public Optional<CompiledRelationshipPath> getRelationship(String name) {
        return getRelationship(name, null);
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    public Set<String> tables() {
        return Set.copyOf(tables.keySet());
    }

    public synchronized void clear() {
        tables.clear();
        globalRelationships.clear();
    }

    private static CompiledRelationshipPath compilePath(RelationshipPath path, String sourceTable) {
        if (path.steps().isEmpty()) {
            throw new SchemaException("Relationship path '" + path.name() + "' must have at least one step",
                    Map.of("path", path.name()));
        }
        List<RelationshipStep> steps = path.steps();
        for (int i = 0; i < steps.size(); i++) {
            RelationshipStep step = steps.get(i);
            if (isBlank(step.from()) || isBlank(step.to())) {
                throw new SchemaException(
                        "Relationship step " + i + " in '" + path.name() + "' must have 'from' and 'to' tables",
                        Map.of("path", path.name(), "step", i));
            }
        }
        for (int i = 1; i < steps.size(); i++) {
            RelationshipStep previous = steps.get(i - 1);
            RelationshipStep current = steps.get(i);
            if (!current.from().equals(previous.to()) && !current.from().equals(previous.alias())) {
                throw new SchemaException(
                        "Relationship path '" + path.name() + "' has broken chain at step " + i
                                + ": expected '" + previous.to() + "' but got '" + current.from() + "'",
                        Map.of("path", path.name(), "step", i));
            }
        }
        return new CompiledRelationshipPath(path.name(), steps, sourceTable, steps.get(steps.size() - 1).to());
    }

    private CompiledPolicy compilePolicy(ReBAcPolicyDefinition definition, String name, String table,
                                         Map<String, CompiledRelationshipPath> tableRelationships) {
        CompiledRelationshipPath path = null;
        if (definition.relationshipPath() != null) {
            path = tableRelationships.get(definition.relationshipPath());
            if (path == null) {
                path = globalRelationships.get(definition.relationshipPath());
            }
            if (path == null) {
                throw new SchemaException(
                        "ReBAC policy '" + name + "' references unknown relationship path '"
                                + definition.relationshipPath() + "'",
                        Map.of("policy", name, "table", table, "relationshipPath", definition.relationshipPath()));
            }
        } else if (definition.type() == PolicyType.FILTER) {
            throw new SchemaException("Filter policy '" + name + "' on '" + table + "' needs a relationship path",
                    Map.of("policy", name, "table", table));
        }
        if (path != null && definition.endConditions() == null) {
            throw new SchemaException("ReBAC policy '" + name + "' has a relationship path but no end conditions",
                    Map.of("policy", name, "table", table));
        }

        Set<Operation> operations = EnumSet.noneOf(Operation.class);
        definition.operations().forEach(op -> operations.addAll(op.expand()));

        return new CompiledPolicy(name, definition.type(), Set.copyOf(operations), path,
                definition.endConditions(), definition.priority(), definition.negated(), definition.activeWhen());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record CompiledTable(Map<String, CompiledRelationshipPath> relationships, List<CompiledPolicy> policies) {
    }
}

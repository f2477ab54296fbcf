package com.warden.authz.field;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Field access configuration by table.
 * <p>
 * Condition failures are logged and treated as "no access".
 */
public final class FieldAccessRegistry {

    private static final Logger log = LoggerFactory.getLogger(FieldAccessRegistry.class);

    private final ConcurrentHashMap<String, TableFieldAccessConfig> tables = new ConcurrentHashMap<>();

    /** Registers (or replaces) the field rules of {@code table}. */
    public void registerTable(String table, TableFieldAccessConfig config) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        tables.put(table, config);
        log.debug("Registered field access rules for '{}' ({} fields, default {})",
                table, config.fields().size(), config.defaultAccess());
    }

    public Optional<TableFieldAccessConfig> getTableConfig(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    public Optional<FieldAccessRule> getFieldRule(String table, String field) {
        return getTableConfig(table).map(config -> config.fields().get(field));
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    public Set<String> tables() {
        return Set.copyOf(tables.keySet());
    }

    /** Fields with an explicit rule on {@code table}. */
    public Set<String> configuredFields(String table) {
        return getTableConfig(table).map(config -> config.fields().keySet()).orElse(Set.of());
    }

    public boolean canReadField(String table, String field, FieldEvaluationContext ctx) {
        TableFieldAccessConfig config = tables.get(table);
        if (config == null) {
            return true;
        }
        FieldAccessRule rule = config.fields().get(field);
        if (rule == null) {
            return config.defaultAccess() == DefaultAccess.ALLOW;
        }
        return check(rule.canRead(), table, field, "read", ctx);
    }

    public boolean canWriteField(String table, String field, FieldEvaluationContext ctx) {
        TableFieldAccessConfig config = tables.get(table);
        if (config == null) {
            return true;
        }
        FieldAccessRule rule = config.fields().get(field);
        if (rule == null) {
            return config.defaultAccess() == DefaultAccess.ALLOW;
        }
        return check(rule.canWrite(), table, field, "write", ctx);
    }

    public void clear() {
        tables.clear();
    }

    private static boolean check(FieldCondition condition, String table, String field, String access,
                                 FieldEvaluationContext ctx) {
        try {
            return condition.test(ctx);
        } catch (RuntimeException e) {
            log.warn("Field {} condition for {}.{} failed; denying", access, table, field, e);
            return false;
        }
    }
}

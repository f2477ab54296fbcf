package com.warden.authz.field;

import com.warden.authz.PolicyViolationException;
import com.warden.authz.metrics.AuthorizationMetrics;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies field rules to rows being read and payloads being written.
 * <p>
 * Rows of unconfigured tables, and all rows seen by system callers or by holders of a table's
 * skip roles, pass through unchanged. The caller comes from {@link AuthorizationScope}.
 */
public final class FieldAccessProcessor {

    private static final Logger log = LoggerFactory.getLogger(FieldAccessProcessor.class);

    private final FieldAccessRegistry registry;
    private final Object defaultMaskValue;
    private final AuthorizationMetrics metrics;

    public FieldAccessProcessor(FieldAccessRegistry registry) {
        this(registry, null, AuthorizationMetrics.noop());
    }

    /**
     * @param defaultMaskValue replacement for unreadable fields whose rule sets no masked value
     */
    public FieldAccessProcessor(FieldAccessRegistry registry, Object defaultMaskValue,
                                AuthorizationMetrics metrics) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.registry = registry;
        this.defaultMaskValue = defaultMaskValue;
        this.metrics = metrics;
    }

    public MaskedRow maskRow(String table, Map<String, Object> row) {
        return maskRow(table, row, MaskOptions.defaults());
    }

    /**
     * Masks one row.
     *
     * @throws PolicyViolationException if {@code options.throwOnDenied()} and a field is unreadable
     * @throws com.warden.context.ContextMissingException if no context is bound
     */
    public MaskedRow maskRow(String table, Map<String, Object> row, MaskOptions options) {
        AuthorizationContext auth = AuthorizationScope.require();
        TableFieldAccessConfig config = registry.getTableConfig(table).orElse(null);
        if (config == null || bypasses(auth, config)) {
            return MaskedRow.unchanged(project(row, options));
        }

        var ctx = new FieldEvaluationContext(auth, table, row, null);
        Map<String, Object> data = new LinkedHashMap<>();
        List<String> masked = new ArrayList<>();
        List<String> omitted = new ArrayList<>();

        for (Map.Entry<String, Object> entry : row.entrySet()) {
            String field = entry.getKey();
            if (!options.keeps(field)) {
                continue;
            }
            FieldAccessRule rule = config.fields().get(field);
            if (registry.canReadField(table, field, ctx)) {
                data.put(field, entry.getValue());
                continue;
            }
            if (options.throwOnDenied()) {
                throw new PolicyViolationException(Operation.READ, table,
                        "Cannot read field: " + field, null, List.of(field));
            }
            if (rule == null || rule.omitWhenHidden()) {
                omitted.add(field);
                continue;
            }
            try {
                data.put(field, rule.mask(entry.getValue(), defaultMaskValue));
                masked.add(field);
            } catch (RuntimeException e) {
                log.warn("Masking {}.{} failed; omitting the field", table, field, e);
                omitted.add(field);
            }
        }

        var result = new MaskedRow(data, masked, omitted);
        metrics.fieldsHidden(table, result.hiddenCount());
        return result;
    }

    public List<MaskedRow> maskRows(String table, List<Map<String, Object>> rows) {
        return maskRows(table, rows, MaskOptions.defaults());
    }

    public List<MaskedRow> maskRows(String table, List<Map<String, Object>> rows, MaskOptions options) {
        List<MaskedRow> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(maskRow(table, row, options));
        }
        return result;
    }

    /**
     * Checks that every field in {@code data} is writable.
     *
     * @param existingRow the stored row for updates, or null for creates
     * @throws PolicyViolationException naming every field that is not writable
     */
    public void validateWrite(String table, Map<String, Object> data, Map<String, Object> existingRow) {
        List<String> denied = deniedWrites(table, data, existingRow);
        if (!denied.isEmpty()) {
            Operation operation = existingRow == null ? Operation.CREATE : Operation.UPDATE;
            throw new PolicyViolationException(operation, table,
                    "Cannot write to protected fields: " + String.join(", ", denied), null, denied);
        }
    }

    /** Removes the fields of {@code data} the caller may not write. */
    public WriteFilterResult filterWritableFields(String table, Map<String, Object> data,
                                                  Map<String, Object> existingRow) {
        List<String> denied = deniedWrites(table, data, existingRow);
        Map<String, Object> allowed = new LinkedHashMap<>(data);
        denied.forEach(allowed::remove);
        if (!denied.isEmpty()) {
            log.debug("Dropped unwritable fields {} from write to '{}'", denied, table);
        }
        return new WriteFilterResult(allowed, denied);
    }

    /** Fields of {@code row} the caller may read. */
    public Set<String> getReadableFields(String table, Map<String, Object> row) {
        AuthorizationContext auth = AuthorizationScope.require();
        TableFieldAccessConfig config = registry.getTableConfig(table).orElse(null);
        if (config == null || bypasses(auth, config)) {
            return new LinkedHashSet<>(row.keySet());
        }
        var ctx = new FieldEvaluationContext(auth, table, row, null);
        Set<String> readable = new LinkedHashSet<>();
        for (String field : row.keySet()) {
            if (registry.canReadField(table, field, ctx)) {
                readable.add(field);
            }
        }
        return readable;
    }

    /**
     * Configured fields the caller may write, given the stored row (null for creates).
     * Unconfigured tables have no configured fields, so the result is empty for them.
     */
    public Set<String> getWritableFields(String table, Map<String, Object> existingRow) {
        AuthorizationContext auth = AuthorizationScope.require();
        TableFieldAccessConfig config = registry.getTableConfig(table).orElse(null);
        if (config == null) {
            return Set.of();
        }
        if (bypasses(auth, config)) {
            return new LinkedHashSet<>(config.fields().keySet());
        }
        var ctx = new FieldEvaluationContext(auth, table, existingRow, null);
        Set<String> writable = new LinkedHashSet<>();
        for (String field : config.fields().keySet()) {
            if (registry.canWriteField(table, field, ctx)) {
                writable.add(field);
            }
        }
        return writable;
    }

    private List<String> deniedWrites(String table, Map<String, Object> data, Map<String, Object> existingRow) {
        AuthorizationContext auth = AuthorizationScope.require();
        TableFieldAccessConfig config = registry.getTableConfig(table).orElse(null);
        if (config == null || bypasses(auth, config)) {
            return List.of();
        }
        var ctx = new FieldEvaluationContext(auth, table, existingRow, data);
        List<String> denied = new ArrayList<>();
        for (String field : data.keySet()) {
            if (!registry.canWriteField(table, field, ctx)) {
                denied.add(field);
            }
        }
        return denied;
    }

    private static boolean bypasses(AuthorizationContext auth, TableFieldAccessConfig config) {
        return auth.system() || auth.hasAnyRole(config.skipForRoles());
    }

    private static Map<String, Object> project(Map<String, Object> row, MaskOptions options) {
        Map<String, Object> projected = new LinkedHashMap<>();
        row.forEach((field, value) -> {
            if (options.keeps(field)) {
                projected.put(field, value);
            }
        });
        return projected;
    }
}

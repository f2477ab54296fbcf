package com.warden.authz;

import com.warden.audit.AuditDetails;
import com.warden.audit.AuditLogger;
import com.warden.authz.field.FieldAccessProcessor;
import com.warden.authz.field.FieldAccessRegistry;
import com.warden.authz.field.MaskOptions;
import com.warden.authz.field.MaskedRow;
import com.warden.authz.field.TableFieldAccessConfig;
import com.warden.authz.field.WriteFilterResult;
import com.warden.authz.metrics.AuthorizationMetrics;
import com.warden.authz.query.QueryLayer;
import com.warden.authz.query.ReBAcQueryTransformer;
import com.warden.authz.rebac.PolicyDecision;
import com.warden.authz.rebac.ReBAcEvaluator;
import com.warden.authz.rebac.RelationshipPath;
import com.warden.authz.rebac.RelationshipRegistry;
import com.warden.authz.rebac.RowFilter;
import com.warden.authz.rebac.TableReBAcConfig;
import com.warden.authz.resolver.ContextResolver;
import com.warden.authz.resolver.ResolverManager;
import com.warden.authz.resolver.ResolverManagerOptions;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationContextValidator;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Entry point combining context resolution, row-level policies, field access and auditing.
 * <p>
 * Typical request flow:
 * <pre>{@code
 * AuthorizationContext ctx = engine.resolveContext(AuthorizationContext.of("u1", "member"));
 * List<Map<String, Object>> rows = AuthorizationScope.call(ctx,
 *         () -> engine.secureRead("posts", query, queryLayer));
 * }</pre>
 * Every operation except registration and {@link #resolveContext} reads the caller from
 * {@link AuthorizationScope}.
 */
public final class AuthorizationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final ResolverManager resolverManager;
    private final RelationshipRegistry relationshipRegistry;
    private final ReBAcEvaluator evaluator;
    private final ReBAcQueryTransformer transformer;
    private final FieldAccessRegistry fieldAccessRegistry;
    private final FieldAccessProcessor fieldAccessProcessor;
    private final AuditLogger auditLogger;
    private final AuthorizationMetrics metrics;

    private AuthorizationEngine(Builder builder) {
        this.metrics = builder.resolverOptions.metrics();
        this.resolverManager = new ResolverManager(builder.resolverOptions);
        this.relationshipRegistry = new RelationshipRegistry();
        this.evaluator = new ReBAcEvaluator(relationshipRegistry, builder.clock);
        this.transformer = new ReBAcQueryTransformer(evaluator, builder.strategy, builder.mainTableAlias);
        this.fieldAccessRegistry = new FieldAccessRegistry();
        this.fieldAccessProcessor = new FieldAccessProcessor(fieldAccessRegistry, builder.defaultMaskValue, metrics);
        this.auditLogger = builder.auditLogger;
        if (auditLogger != null) {
            metrics.bindAudit(auditLogger);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // -- registration --

    public AuthorizationEngine registerResolver(ContextResolver resolver) {
        resolverManager.register(resolver);
        return this;
    }

    public AuthorizationEngine registerRelationship(RelationshipPath path) {
        relationshipRegistry.registerRelationship(path);
        return this;
    }

    /** Registers the row-level policies of {@code table}. */
    public AuthorizationEngine registerTable(String table, TableReBAcConfig config) {
        relationshipRegistry.registerTable(table, config);
        return this;
    }

    public AuthorizationEngine registerFieldAccess(String table, TableFieldAccessConfig config) {
        fieldAccessRegistry.registerTable(table, config);
        return this;
    }

    // -- context --

    /**
     * Validates {@code base} and runs every registered resolver.
     *
     * @throws com.warden.context.ContextValidationException if the base context is invalid
     * @throws ResolverException if a required resolver fails
     */
    public AuthorizationContext resolveContext(AuthorizationContext base) {
        AuthorizationContextValidator.validate(base).throwIfInvalid();
        return resolverManager.resolve(base);
    }

    public CompletableFuture<AuthorizationContext> resolveContextAsync(AuthorizationContext base) {
        AuthorizationContextValidator.validate(base).throwIfInvalid();
        return resolverManager.resolveAsync(base);
    }

    public void invalidateCache(String userId) {
        resolverManager.invalidateCache(userId);
    }

    public void clearCache() {
        resolverManager.clearCache();
    }

    // -- row level --

    /**
     * Evaluates the row-level policies of {@code table}, recording the decision in metrics and,
     * when configured, the audit log.
     */
    public PolicyDecision evaluate(String table, Operation operation) {
        long started = System.nanoTime();
        PolicyDecision decision = evaluator.evaluate(table, operation);
        metrics.policyDecision(table, operation, decision.label());
        audit(table, operation, decision, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return decision;
    }

    /** Restricts a query on {@code table} to the rows the caller may access for {@code operation}. */
    public <Q> Q restrict(Q handle, String table, Operation operation, QueryLayer<Q> layer) {
        return transformer.apply(handle, table, evaluate(table, operation), layer);
    }

    /**
     * Restricts and runs a read, then masks every returned row.
     *
     * @return the visible rows
     */
    public <Q> List<Map<String, Object>> secureRead(String table, Q handle, QueryLayer<Q> layer) {
        return secureRead(table, handle, layer, MaskOptions.defaults());
    }

    public <Q> List<Map<String, Object>> secureRead(String table, Q handle, QueryLayer<Q> layer,
                                                    MaskOptions options) {
        Q restricted = restrict(handle, table, Operation.READ, layer);
        List<Map<String, Object>> rows = layer.execute(restricted);
        List<Map<String, Object>> visible = new ArrayList<>(rows.size());
        for (MaskedRow row : fieldAccessProcessor.maskRows(table, rows, options)) {
            visible.add(row.data());
        }
        return visible;
    }

    /**
     * Checks a mutation before it runs.
     * <p>
     * A denial raises. Otherwise the payload (when given) is checked against the field rules and
     * the decision is returned so that a filtered update or delete can be restricted with
     * {@link #apply}.
     *
     * @param data        values being written (null for deletes)
     * @param existingRow the stored row for updates (null for creates)
     * @throws PolicyViolationException if the operation or a written field is not allowed
     */
    public PolicyDecision guardMutation(String table, Operation operation, Map<String, Object> data,
                                        Map<String, Object> existingRow) {
        if (operation == Operation.READ) {
            throw new IllegalArgumentException("operation must be a mutation");
        }
        PolicyDecision decision = evaluate(table, operation);
        if (decision instanceof PolicyDecision.Deny deny) {
            throw new PolicyViolationException(operation, table, deny.reason(), deny.policyName());
        }
        if (data != null && !data.isEmpty()) {
            fieldAccessProcessor.validateWrite(table, data,
                    operation == Operation.CREATE ? null : existingRow);
        }
        return decision;
    }

    /** Restricts a query according to a decision returned by {@link #guardMutation}. */
    public <Q> Q apply(Q handle, String table, PolicyDecision decision, QueryLayer<Q> layer) {
        return transformer.apply(handle, table, decision, layer);
    }

    // -- field level --

    public MaskedRow maskRow(String table, Map<String, Object> row) {
        return fieldAccessProcessor.maskRow(table, row);
    }

    public List<MaskedRow> maskRows(String table, List<Map<String, Object>> rows) {
        return fieldAccessProcessor.maskRows(table, rows);
    }

    public void validateWrite(String table, Map<String, Object> data, Map<String, Object> existingRow) {
        fieldAccessProcessor.validateWrite(table, data, existingRow);
    }

    public WriteFilterResult filterWritableFields(String table, Map<String, Object> data,
                                                  Map<String, Object> existingRow) {
        return fieldAccessProcessor.filterWritableFields(table, data, existingRow);
    }

    // -- components --

    public ResolverManager resolverManager() {
        return resolverManager;
    }

    public RelationshipRegistry relationshipRegistry() {
        return relationshipRegistry;
    }

    public FieldAccessRegistry fieldAccessRegistry() {
        return fieldAccessRegistry;
    }

    public FieldAccessProcessor fieldAccessProcessor() {
        return fieldAccessProcessor;
    }

    public Optional<AuditLogger> auditLogger() {
        return Optional.ofNullable(auditLogger);
    }

    public AuthorizationMetrics metrics() {
        return metrics;
    }

    public void flushAudit() {
        if (auditLogger != null) {
            auditLogger.flush();
        }
    }

    @Override
    public void close() {
        if (auditLogger != null) {
            auditLogger.close();
        }
        log.info("Authorization engine closed");
    }

    private void audit(String table, Operation operation, PolicyDecision decision, long durationMs) {
        if (auditLogger == null) {
            return;
        }
        AuditDetails details = AuditDetails.none().withDurationMs(durationMs);
        if (decision instanceof PolicyDecision.Allow allow) {
            auditLogger.logAllow(operation, table, allow.policyName(), details);
        } else if (decision instanceof PolicyDecision.Deny deny) {
            auditLogger.logDeny(operation, table, deny.policyName(), details.withReason(deny.reason()));
        } else if (decision instanceof PolicyDecision.Filter filter) {
            String policies = filter.filters().stream()
                    .map(RowFilter::policyName)
                    .collect(Collectors.joining(","));
            auditLogger.logFilter(operation, table, policies, details);
        }
    }

    /**
     * Builder for {@link AuthorizationEngine}.
     */
    public static final class Builder {

        private ResolverManagerOptions resolverOptions = ResolverManagerOptions.defaults();
        private ReBAcQueryTransformer.Strategy strategy = ReBAcQueryTransformer.Strategy.EXISTS;
        private String mainTableAlias;
        private Clock clock = Clock.systemUTC();
        private Object defaultMaskValue;
        private AuditLogger auditLogger;

        private Builder() {
        }

        /** Resolver options; their metrics are shared by the whole engine. */
        public Builder resolverOptions(ResolverManagerOptions resolverOptions) {
            this.resolverOptions = resolverOptions;
            return this;
        }

        public Builder strategy(ReBAcQueryTransformer.Strategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder mainTableAlias(String mainTableAlias) {
            this.mainTableAlias = mainTableAlias;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder defaultMaskValue(Object defaultMaskValue) {
            this.defaultMaskValue = defaultMaskValue;
            return this;
        }

        public Builder auditLogger(AuditLogger auditLogger) {
            this.auditLogger = auditLogger;
            return this;
        }

        public AuthorizationEngine build() {
            if (resolverOptions == null) {
                throw new IllegalArgumentException("resolverOptions must not be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            return new AuthorizationEngine(this);
        }
    }
}

package com.warden.authz.query;

import com.warden.authz.rebac.CompiledRelationshipPath;
import com.warden.authz.rebac.PolicyDecision;
import com.warden.authz.rebac.ReBAcEvaluator;
import com.warden.authz.rebac.RelationshipStep;
import com.warden.authz.rebac.RowFilter;
import com.warden.context.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a {@link PolicyDecision} into calls on a {@link QueryLayer}.
 * <p>
 * With the {@link Strategy#EXISTS} strategy each row filter becomes one correlated
 * {@code [NOT] EXISTS} predicate: the subquery starts at the first step's target table,
 * joins the remaining steps, is correlated with the outer row through the first step's
 * columns, and applies the end conditions at the last step. With {@link Strategy#JOIN} each
 * step is joined into the outer query and the end conditions are applied as a plain filter;
 * this can multiply rows when a relationship is one-to-many, and negated filters still use
 * EXISTS.
 * <p>
 * End condition values map to predicates as follows: null is IS NULL, a collection is IN (an
 * empty collection matches nothing), {@code Optional.empty()} is skipped and anything else is
 * equality.
 */
public final class ReBAcQueryTransformer {

    /** How relationship filters are expressed. */
    public enum Strategy {
        EXISTS,
        JOIN
    }

    private final ReBAcEvaluator evaluator;
    private final Strategy strategy;
    private final String mainTableAlias;

    public ReBAcQueryTransformer(ReBAcEvaluator evaluator) {
        this(evaluator, Strategy.EXISTS, null);
    }

    /**
     * @param mainTableAlias alias of the accessed table in the outer query (null to use the table name)
     */
    public ReBAcQueryTransformer(ReBAcEvaluator evaluator, Strategy strategy, String mainTableAlias) {
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator must not be null");
        }
        this.evaluator = evaluator;
        this.strategy = strategy == null ? Strategy.EXISTS : strategy;
        this.mainTableAlias = mainTableAlias;
    }

    /**
     * Evaluates the policies of {@code table} for the bound context and restricts the query.
     *
     * @throws com.warden.context.ContextMissingException if no context is bound
     */
    public <Q> Q transform(Q handle, String table, Operation operation, QueryLayer<Q> layer) {
        return apply(handle, table, evaluator.evaluate(table, operation), layer);
    }

    /** Restricts the query according to an already computed decision. */
    public <Q> Q apply(Q handle, String table, PolicyDecision decision, QueryLayer<Q> layer) {
        if (decision instanceof PolicyDecision.Deny) {
            return layer.applyFilter(handle, QueryPredicate.alwaysFalse());
        }
        if (!(decision instanceof PolicyDecision.Filter filter)) {
            return handle;
        }
        String alias = mainTableAlias != null ? mainTableAlias : table;
        Q result = handle;
        for (RowFilter rowFilter : filter.filters()) {
            if (strategy == Strategy.JOIN && !rowFilter.negated()) {
                result = applyAsJoins(result, rowFilter, alias, layer);
            } else {
                result = layer.applyFilter(result, toExists(rowFilter, alias));
            }
        }
        return result;
    }

    /** Builds the correlated EXISTS predicate for a row filter. */
    public QueryPredicate toExists(RowFilter rowFilter, String outerAlias) {
        CompiledRelationshipPath path = rowFilter.path();
        List<RelationshipStep> steps = path.steps();
        RelationshipStep first = steps.get(0);

        List<JoinClause> joins = new ArrayList<>();
        for (int i = 1; i < steps.size(); i++) {
            RelationshipStep previous = steps.get(i - 1);
            RelationshipStep step = steps.get(i);
            joins.add(joinFor(step, previous.alias()));
        }

        List<QueryPredicate> where = new ArrayList<>();
        where.add(new QueryPredicate.ColumnsEqual(
                ColumnRef.of(first.alias(), first.toColumn()),
                ColumnRef.of(outerAlias, first.fromColumn())));
        where.addAll(conditions(first.alias(), first.additionalConditions()));
        where.addAll(conditions(path.lastStep().alias(), rowFilter.endConditions()));

        return new QueryPredicate.Exists(first.to(), first.alias(), joins,
                QueryPredicate.and(where), rowFilter.negated());
    }

    private <Q> Q applyAsJoins(Q handle, RowFilter rowFilter, String outerAlias, QueryLayer<Q> layer) {
        Q result = handle;
        String previousAlias = outerAlias;
        for (RelationshipStep step : rowFilter.path().steps()) {
            result = layer.applyJoin(result, joinFor(step, previousAlias));
            previousAlias = step.alias();
        }
        List<QueryPredicate> end = conditions(rowFilter.path().lastStep().alias(), rowFilter.endConditions());
        return end.isEmpty() ? result : layer.applyFilter(result, QueryPredicate.and(end));
    }

    private static JoinClause joinFor(RelationshipStep step, String previousAlias) {
        List<QueryPredicate> on = new ArrayList<>();
        on.add(new QueryPredicate.ColumnsEqual(
                ColumnRef.of(previousAlias, step.fromColumn()),
                ColumnRef.of(step.alias(), step.toColumn())));
        on.addAll(conditions(step.alias(), step.additionalConditions()));
        return new JoinClause(step.joinType(), step.to(), step.alias(), QueryPredicate.and(on));
    }

    static List<QueryPredicate> conditions(String alias, Map<String, Object> values) {
        List<QueryPredicate> predicates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ColumnRef column = ColumnRef.of(alias, entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Optional<?> optional) {
                if (optional.isEmpty()) {
                    continue;
                }
                value = optional.get();
            }
            if (value == null) {
                predicates.add(new QueryPredicate.IsNull(column));
            } else if (value instanceof Collection<?> collection) {
                predicates.add(collection.isEmpty()
                        ? QueryPredicate.alwaysFalse()
                        : new QueryPredicate.In(column, new ArrayList<>(collection)));
            } else {
                predicates.add(new QueryPredicate.Eq(column, value));
            }
        }
        return predicates;
    }
}

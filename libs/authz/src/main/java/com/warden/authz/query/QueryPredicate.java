package com.warden.authz.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Storage-neutral row predicate handed to a {@link QueryLayer}.
 */
public sealed interface QueryPredicate
        permits QueryPredicate.Eq, QueryPredicate.In, QueryPredicate.IsNull, QueryPredicate.ColumnsEqual,
        QueryPredicate.Exists, QueryPredicate.And, QueryPredicate.Constant {

    /** {@code column = value}. */
    record Eq(ColumnRef column, Object value) implements QueryPredicate {
    }

    /** {@code column IN (values)}; never empty. */
    record In(ColumnRef column, List<Object> values) implements QueryPredicate {

        public In {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("values must not be null or empty");
            }
            values = List.copyOf(values);
        }
    }

    /** {@code column IS NULL}. */
    record IsNull(ColumnRef column) implements QueryPredicate {
    }

    /** {@code left = right}, comparing two columns. */
    record ColumnsEqual(ColumnRef left, ColumnRef right) implements QueryPredicate {
    }

    /**
     * {@code [NOT] EXISTS (SELECT 1 FROM table AS alias <joins> WHERE where)}, correlated with
     * the outer query through {@code where}.
     */
    record Exists(String table, String alias, List<JoinClause> joins, QueryPredicate where, boolean negated)
            implements QueryPredicate {

        public Exists {
            joins = List.copyOf(joins);
        }
    }

    /** Conjunction; an empty conjunction is true. */
    record And(List<QueryPredicate> operands) implements QueryPredicate {

        public And {
            operands = List.copyOf(operands);
        }
    }

    /** {@code TRUE} or {@code FALSE}. */
    record Constant(boolean value) implements QueryPredicate {
    }

    static QueryPredicate alwaysFalse() {
        return new Constant(false);
    }

    static QueryPredicate alwaysTrue() {
        return new Constant(true);
    }

    /** Combines predicates with AND, flattening nested conjunctions and dropping TRUE. */
    static QueryPredicate and(QueryPredicate... operands) {
        return and(Arrays.asList(operands));
    }

    static QueryPredicate and(List<QueryPredicate> operands) {
        List<QueryPredicate> flat = new ArrayList<>();
        for (QueryPredicate operand : operands) {
            if (operand instanceof And nested) {
                flat.addAll(nested.operands());
            } else if (!(operand instanceof Constant constant && constant.value())) {
                flat.add(operand);
            }
        }
        if (flat.isEmpty()) {
            return alwaysTrue();
        }
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }
}

package com.warden.authz.query;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders {@link QueryPredicate}s as parameterised SQL, for SQL-backed query layers and for
 * debugging.
 */
public final class PredicateFormatter {

    /** Identifier quoting and placeholder style. */
    public enum Dialect {
        POSTGRES,
        MYSQL,
        SQLITE
    }

    /**
     * SQL text and its positional parameters.
     */
    public record FormattedPredicate(String sql, List<Object> parameters) {

        public FormattedPredicate {
            parameters = List.copyOf(parameters);
        }
    }

    private final Dialect dialect;

    public PredicateFormatter() {
        this(Dialect.POSTGRES);
    }

    public PredicateFormatter(Dialect dialect) {
        this.dialect = dialect == null ? Dialect.POSTGRES : dialect;
    }

    public FormattedPredicate format(QueryPredicate predicate) {
        List<Object> parameters = new ArrayList<>();
        String sql = render(predicate, parameters);
        return new FormattedPredicate(sql, parameters);
    }

    /** Renders a join clause, e.g. {@code JOIN "employees" ON ...}. */
    public FormattedPredicate format(JoinClause join) {
        List<Object> parameters = new ArrayList<>();
        String sql = renderJoin(join, parameters);
        return new FormattedPredicate(sql, parameters);
    }

    private String render(QueryPredicate predicate, List<Object> parameters) {
        if (predicate instanceof QueryPredicate.Eq eq) {
            parameters.add(eq.value());
            return column(eq.column()) + " = " + placeholder(parameters.size());
        }
        if (predicate instanceof QueryPredicate.In in) {
            List<String> placeholders = new ArrayList<>();
            for (Object value : in.values()) {
                parameters.add(value);
                placeholders.add(placeholder(parameters.size()));
            }
            return column(in.column()) + " IN (" + String.join(", ", placeholders) + ")";
        }
        if (predicate instanceof QueryPredicate.IsNull isNull) {
            return column(isNull.column()) + " IS NULL";
        }
        if (predicate instanceof QueryPredicate.ColumnsEqual equal) {
            return column(equal.left()) + " = " + column(equal.right());
        }
        if (predicate instanceof QueryPredicate.Exists exists) {
            var sql = new StringBuilder("SELECT 1 FROM ").append(quote(exists.table()));
            if (!exists.alias().equals(exists.table())) {
                sql.append(" AS ").append(quote(exists.alias()));
            }
            for (JoinClause join : exists.joins()) {
                sql.append(' ').append(renderJoin(join, parameters));
            }
            sql.append(" WHERE ").append(render(exists.where(), parameters));
            return (exists.negated() ? "NOT EXISTS (" : "EXISTS (") + sql + ")";
        }
        if (predicate instanceof QueryPredicate.And and) {
            if (and.operands().isEmpty()) {
                return "TRUE";
            }
            return and.operands().stream()
                    .map(operand -> operand instanceof QueryPredicate.And
                            ? "(" + render(operand, parameters) + ")"
                            : render(operand, parameters))
                    .collect(Collectors.joining(" AND "));
        }
        if (predicate instanceof QueryPredicate.Constant constant) {
            return constant.value() ? "TRUE" : "FALSE";
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    private String renderJoin(JoinClause join, List<Object> parameters) {
        String keyword = switch (join.type()) {
            case INNER -> "JOIN";
            case LEFT -> "LEFT JOIN";
            case RIGHT -> "RIGHT JOIN";
        };
        var sql = new StringBuilder(keyword).append(' ').append(quote(join.table()));
        if (!join.alias().equals(join.table())) {
            sql.append(" AS ").append(quote(join.alias()));
        }
        return sql.append(" ON ").append(render(join.on(), parameters)).toString();
    }

    private String column(ColumnRef ref) {
        return quote(ref.alias()) + "." + quote(ref.column());
    }

    private String quote(String identifier) {
        return dialect == Dialect.MYSQL ? "`" + identifier + "`" : "\"" + identifier + "\"";
    }

    private String placeholder(int index) {
        return dialect == Dialect.POSTGRES ? "$" + index : "?";
    }
}

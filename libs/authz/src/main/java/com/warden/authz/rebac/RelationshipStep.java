package com.warden.authz.rebac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hop of a relationship path: rows of {@code from} linked to rows of {@code to} by
 * {@code from.fromColumn = to.toColumn}.
 * <p>
 * Unset columns default to {@code <to>_id} and {@code id}, the alias to the target table name,
 * and the join to {@link JoinType#INNER}. {@code additionalConditions} constrain the target
 * rows; a null value means IS NULL.
 *
 * @param from                 table the hop starts from (or the alias of the previous hop)
 * @param to                   table the hop arrives at
 * @param fromColumn           column on the {@code from} side
 * @param toColumn             column on the {@code to} side
 * @param alias                alias of the {@code to} table
 * @param joinType             join type
 * @param additionalConditions column/value constraints on the {@code to} rows
 */
public record RelationshipStep(
        String from,
        String to,
        String fromColumn,
        String toColumn,
        String alias,
        JoinType joinType,
        Map<String, Object> additionalConditions
) {

    public RelationshipStep {
        if (to != null) {
            if (fromColumn == null) {
                fromColumn = to + "_id";
            }
            if (alias == null) {
                alias = to;
            }
        }
        if (toColumn == null) {
            toColumn = "id";
        }
        if (joinType == null) {
            joinType = JoinType.INNER;
        }
        additionalConditions = additionalConditions == null || additionalConditions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalConditions));
    }

    /** A hop with every optional attribute defaulted. */
    public static RelationshipStep of(String from, String to) {
        return new RelationshipStep(from, to, null, null, null, null, null);
    }

    /** A hop joined on the given columns. */
    public static RelationshipStep of(String from, String to, String fromColumn, String toColumn) {
        return new RelationshipStep(from, to, fromColumn, toColumn, null, null, null);
    }

    public RelationshipStep withAlias(String alias) {
        return new RelationshipStep(from, to, fromColumn, toColumn, alias, joinType, additionalConditions);
    }

    public RelationshipStep withJoinType(JoinType joinType) {
        return new RelationshipStep(from, to, fromColumn, toColumn, alias, joinType, additionalConditions);
    }

    public RelationshipStep withConditions(Map<String, Object> additionalConditions) {
        return new RelationshipStep(from, to, fromColumn, toColumn, alias, joinType, additionalConditions);
    }
}

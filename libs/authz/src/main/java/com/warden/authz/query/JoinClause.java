package com.warden.authz.query;

import com.warden.authz.rebac.JoinType;

/**
 * {@code <type> JOIN table AS alias ON on}.
 */
public record JoinClause(JoinType type, String table, String alias, QueryPredicate on) {
}

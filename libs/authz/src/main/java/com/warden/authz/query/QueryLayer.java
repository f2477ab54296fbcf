package com.warden.authz.query;

import java.util.List;
import java.util.Map;

/**
 * Adapter to the query builder or data access layer that executes reads.
 * <p>
 * {@code Q} is the layer's own query handle (a builder, a criteria object, ...). Handles may
 * be mutable or immutable; callers always continue with the returned handle.
 *
 * @param <Q> the query handle type
 */
public interface QueryLayer<Q> {

    /** Adds a WHERE restriction. */
    Q applyFilter(Q handle, QueryPredicate predicate);

    /** Adds a join. */
    Q applyJoin(Q handle, JoinClause join);

    /** Runs the query and returns its rows as column/value maps. */
    List<Map<String, Object>> execute(Q handle);
}

package com.warden.authz.rebac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row restriction produced by a filter policy: rows of the accessed table qualify when the
 * relationship path reaches target rows matching {@code endConditions} (or, when negated,
 * when it reaches none).
 *
 * @param policyName    the filter policy
 * @param path          the relationship path to follow
 * @param endConditions evaluated constraints at the end of the path
 * @param negated       whether the relationship must be absent
 */
public record RowFilter(
        String policyName,
        CompiledRelationshipPath path,
        Map<String, Object> endConditions,
        boolean negated
) {

    public RowFilter {
        endConditions = endConditions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(endConditions));
    }
}

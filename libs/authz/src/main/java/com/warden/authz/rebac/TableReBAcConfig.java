package com.warden.authz.rebac;

import java.util.List;

/**
 * Relationship paths and policies for one table.
 *
 * @param relationships paths local to the table (also published globally)
 * @param policies      policies in declaration order
 */
public record TableReBAcConfig(List<RelationshipPath> relationships, List<ReBAcPolicyDefinition> policies) {

    public TableReBAcConfig {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static TableReBAcConfig of(List<RelationshipPath> relationships, ReBAcPolicyDefinition... policies) {
        return new TableReBAcConfig(relationships, List.of(policies));
    }
}

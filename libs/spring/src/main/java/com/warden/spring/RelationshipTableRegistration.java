package com.warden.spring;

import com.warden.authz.rebac.TableReBAcConfig;

/**
 * Row-level policies for one table, picked up from the application context.
 *
 * <pre>{@code
 * @Bean
 * RelationshipTableRegistration productPolicies() {
 *     return RelationshipTableRegistration.of("products", TableReBAcConfig.of(
 *             List.of(RelationshipPaths.shopOrgMembership("products")),
 *             ReBAcPolicies.allowRelation("products_shop_org_membership",
 *                     ctx -> Map.of("user_id", ctx.userId()), Operation.ALL).build()));
 * }
 * }</pre>
 */
public interface RelationshipTableRegistration {

    String table();

    TableReBAcConfig config();

    static RelationshipTableRegistration of(String table, TableReBAcConfig config) {
        return new RelationshipTableRegistration() {
            @Override
            public String table() {
                return table;
            }

            @Override
            public TableReBAcConfig config() {
                return config;
            }
        };
    }
}

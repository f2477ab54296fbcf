package com.warden.authz.rebac;

/**
 * Relationship paths for common membership models.
 */
public final class RelationshipPaths {

    private RelationshipPaths() {
        // utility class
    }

    /**
     * {@code <resource> -> organizations -> employees}, named {@code <resource>_org_membership}.
     * End conditions typically constrain {@code employees.user_id}.
     */
    public static RelationshipPath orgMembership(String resourceTable) {
        return orgMembership(resourceTable, "organization_id");
    }

    public static RelationshipPath orgMembership(String resourceTable, String organizationColumn) {
        return RelationshipPath.of(resourceTable + "_org_membership",
                        RelationshipStep.of(resourceTable, "organizations", organizationColumn, "id"),
                        RelationshipStep.of("organizations", "employees", "id", "organization_id"))
                .withDescription("Access " + resourceTable + " through organization membership");
    }

    /**
     * {@code <resource> -> shops -> organizations -> employees}, named
     * {@code <resource>_shop_org_membership}.
     */
    public static RelationshipPath shopOrgMembership(String resourceTable) {
        return shopOrgMembership(resourceTable, "shop_id");
    }

    public static RelationshipPath shopOrgMembership(String resourceTable, String shopColumn) {
        return RelationshipPath.of(resourceTable + "_shop_org_membership",
                        RelationshipStep.of(resourceTable, "shops", shopColumn, "id"),
                        RelationshipStep.of("shops", "organizations", "organization_id", "id"),
                        RelationshipStep.of("organizations", "employees", "id", "organization_id"))
                .withDescription("Access " + resourceTable + " through shop's organization membership");
    }

    /**
     * {@code <resource> -> teams -> team_members}, named {@code <resource>_team_access}.
     */
    public static RelationshipPath teamHierarchy(String resourceTable) {
        return teamHierarchy(resourceTable, "team_id");
    }

    public static RelationshipPath teamHierarchy(String resourceTable, String teamColumn) {
        return RelationshipPath.of(resourceTable + "_team_access",
                        RelationshipStep.of(resourceTable, "teams", teamColumn, "id"),
                        RelationshipStep.of("teams", "team_members", "id", "team_id"))
                .withDescription("Access " + resourceTable + " through team membership");
    }
}

package com.warden.authz.rebac;

import java.util.Arrays;
import java.util.List;

/**
 * A named chain of {@link RelationshipStep}s from a resource table to the table whose rows
 * decide access (memberships, team rosters, ...).
 *
 * @param name        unique name policies refer to
 * @param steps       the hops, in order
 * @param description optional human-readable description
 */
public record RelationshipPath(String name, List<RelationshipStep> steps, String description) {

    public RelationshipPath {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static RelationshipPath of(String name, RelationshipStep... steps) {
        return new RelationshipPath(name, Arrays.asList(steps), null);
    }

    public RelationshipPath withDescription(String description) {
        return new RelationshipPath(name, steps, description);
    }
}

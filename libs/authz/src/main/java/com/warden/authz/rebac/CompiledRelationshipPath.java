package com.warden.authz.rebac;

import java.util.List;

/**
 * A validated relationship path with all step defaults applied.
 *
 * @param name        path name
 * @param steps       validated steps (never empty)
 * @param sourceTable table the path starts from
 * @param targetTable table the path ends at, where end conditions apply
 */
public record CompiledRelationshipPath(
        String name,
        List<RelationshipStep> steps,
        String sourceTable,
        String targetTable
) {

    public CompiledRelationshipPath {
        steps = List.copyOf(steps);
    }

    public RelationshipStep firstStep() {
        return steps.get(0);
    }

    public RelationshipStep lastStep() {
        return steps.get(steps.size() - 1);
    }
}

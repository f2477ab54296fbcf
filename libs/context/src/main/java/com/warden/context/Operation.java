package com.warden.context;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Data operations a policy can guard.
 * <p>
 * {@link #ALL} is a wildcard used in policy definitions; it is expanded into the four
 * concrete operations when a policy is compiled and never reaches an evaluator.
 */
public enum Operation {

    READ("read"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    ALL("all");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    /** The lower-case name used in logs and audit events (e.g., "read"). */
    public String value() {
        return value;
    }

    /**
     * Returns the concrete operations this operation stands for.
     * {@code ALL} expands to read, create, update and delete; every other
     * operation stands for itself.
     */
    public Set<Operation> expand() {
        return this == ALL
                ? EnumSet.of(READ, CREATE, UPDATE, DELETE)
                : EnumSet.of(this);
    }

    /** Whether this operation writes data. */
    public boolean isMutation() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    /**
     * Looks up an operation by its lower-case value (case-insensitive).
     *
     * @param value the string to match
     * @return the matching operation, or empty if not found
     */
    public static Optional<Operation> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.value.equals(normalized)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}

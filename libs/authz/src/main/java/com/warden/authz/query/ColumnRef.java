package com.warden.authz.query;

/**
 * A column qualified by a table alias.
 */
public record ColumnRef(String alias, String column) {

    public ColumnRef {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("alias must not be null or blank");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
    }

    public static ColumnRef of(String alias, String column) {
        return new ColumnRef(alias, column);
    }
}

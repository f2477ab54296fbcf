package com.warden.authz.field;

import java.util.Set;

/**
 * Options for {@link FieldAccessProcessor#maskRow}.
 *
 * @param includeFields  when non-null, only these fields are kept
 * @param excludeFields  fields always dropped
 * @param throwOnDenied  whether an unreadable field raises instead of being hidden
 */
public record MaskOptions(Set<String> includeFields, Set<String> excludeFields, boolean throwOnDenied) {

    public MaskOptions {
        includeFields = includeFields == null ? null : Set.copyOf(includeFields);
        excludeFields = excludeFields == null ? Set.of() : Set.copyOf(excludeFields);
    }

    public static MaskOptions defaults() {
        return new MaskOptions(null, Set.of(), false);
    }

    public static MaskOptions strict() {
        return new MaskOptions(null, Set.of(), true);
    }

    public MaskOptions including(String... fields) {
        return new MaskOptions(Set.of(fields), excludeFields, throwOnDenied);
    }

    public MaskOptions excluding(String... fields) {
        return new MaskOptions(includeFields, Set.of(fields), throwOnDenied);
    }

    boolean keeps(String field) {
        return !excludeFields.contains(field) && (includeFields == null || includeFields.contains(field));
    }
}

package com.warden.authz.field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Field rules of one table.
 *
 * @param defaultAccess access for fields without a rule
 * @param fields        rules by field name
 * @param skipForRoles  roles that bypass every field rule of the table
 */
public record TableFieldAccessConfig(
        DefaultAccess defaultAccess,
        Map<String, FieldAccessRule> fields,
        Set<String> skipForRoles
) {

    public TableFieldAccessConfig {
        if (defaultAccess == null) {
            defaultAccess = DefaultAccess.ALLOW;
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        skipForRoles = skipForRoles == null ? Set.of() : Set.copyOf(skipForRoles);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link TableFieldAccessConfig}.
     */
    public static final class Builder {

        private DefaultAccess defaultAccess = DefaultAccess.ALLOW;
        private final Map<String, FieldAccessRule> fields = new LinkedHashMap<>();
        private Set<String> skipForRoles = Set.of();

        private Builder() {
        }

        public Builder defaultAccess(DefaultAccess defaultAccess) {
            this.defaultAccess = defaultAccess;
            return this;
        }

        public Builder field(String name, FieldAccessRule rule) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name must not be null or blank");
            }
            if (rule == null) {
                throw new IllegalArgumentException("rule must not be null");
            }
            fields.put(name, rule);
            return this;
        }

        public Builder skipFor(String... roles) {
            this.skipForRoles = Set.of(roles);
            return this;
        }

        public TableFieldAccessConfig build() {
            return new TableFieldAccessConfig(defaultAccess, fields, skipForRoles);
        }
    }
}

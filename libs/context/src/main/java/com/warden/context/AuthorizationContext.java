package com.warden.context;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization identity and contextual data for one logical operation.
 * <p>
 * Created once per operation, enriched once by the resolver manager, then bound to the
 * ambient {@link AuthorizationScope} for the rest of the operation. Enrichment never mutates
 * an instance; the {@code with*} methods return copies.
 *
 * @param userId          authenticated user performing the operation
 * @param tenantId        tenant of the user (nullable for single-tenant deployments)
 * @param roles           role names held by the user
 * @param system          whether this is a trusted system identity that bypasses policies
 * @param organizationIds organizations the user belongs to, when known up front
 * @param attributes      ABAC attributes of the subject (department, clearance, ...)
 * @param resolved        data produced by context resolvers
 * @param requestMeta     request metadata (nullable)
 * @param meta            free-form metadata forwarded to audit events
 */
public record AuthorizationContext(
        String userId,
        String tenantId,
        Set<String> roles,
        boolean system,
        List<String> organizationIds,
        Map<String, Object> attributes,
        ResolvedContext resolved,
        RequestMeta requestMeta,
        Map<String, Object> meta
) {

    /** User ID reported for system identities. */
    public static final String SYSTEM_USER_ID = "system";

    public AuthorizationContext {
        roles = roles == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        organizationIds = organizationIds == null ? List.of() : List.copyOf(organizationIds);
        attributes = copyOf(attributes);
        meta = copyOf(meta);
        if (resolved == null) {
            resolved = ResolvedContext.empty();
        }
    }

    /** Creates a context for a user with the given roles. */
    public static AuthorizationContext of(String userId, String... roles) {
        return builder(userId).roles(roles).build();
    }

    /** Creates a context for a tenant-scoped user with the given roles. */
    public static AuthorizationContext of(String userId, String tenantId, Collection<String> roles) {
        return builder(userId).tenantId(tenantId).roles(roles).build();
    }

    /** Creates a trusted system context that bypasses row and field policies. */
    public static AuthorizationContext systemContext() {
        return builder(SYSTEM_USER_ID).system(true).build();
    }

    public static Builder builder(String userId) {
        return new Builder(userId);
    }

    /** Returns a builder pre-populated with this context's values. */
    public Builder toBuilder() {
        return new Builder(userId)
                .tenantId(tenantId)
                .roles(roles)
                .system(system)
                .organizationIds(organizationIds)
                .attributes(attributes)
                .resolved(resolved)
                .requestMeta(requestMeta)
                .meta(meta);
    }

    /** Returns a copy carrying the given resolved data. */
    public AuthorizationContext withResolved(ResolvedContext resolved) {
        return toBuilder().resolved(resolved).build();
    }

    /** Returns a copy carrying the given request metadata. */
    public AuthorizationContext withRequestMeta(RequestMeta requestMeta) {
        return toBuilder().requestMeta(requestMeta).build();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(Collection<String> candidates) {
        for (String candidate : candidates) {
            if (roles.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /** Returns a subject attribute, if present. */
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /** Request ID from the request metadata, or null. */
    public String requestId() {
        return requestMeta == null ? null : requestMeta.requestId();
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Builder for {@link AuthorizationContext}.
     */
    public static final class Builder {

        private final String userId;
        private String tenantId;
        private Set<String> roles = new LinkedHashSet<>();
        private boolean system;
        private List<String> organizationIds = List.of();
        private Map<String, Object> attributes = new LinkedHashMap<>();
        private ResolvedContext resolved = ResolvedContext.empty();
        private RequestMeta requestMeta;
        private Map<String, Object> meta = new LinkedHashMap<>();

        private Builder(String userId) {
            this.userId = userId;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder roles(String... roles) {
            return roles(Arrays.asList(roles));
        }

        public Builder roles(Collection<String> roles) {
            this.roles = roles == null ? new LinkedHashSet<>() : new LinkedHashSet<>(roles);
            return this;
        }

        public Builder system(boolean system) {
            this.system = system;
            return this;
        }

        public Builder organizationIds(List<String> organizationIds) {
            this.organizationIds = organizationIds;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder resolved(ResolvedContext resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder requestMeta(RequestMeta requestMeta) {
            this.requestMeta = requestMeta;
            return this;
        }

        public Builder meta(Map<String, Object> meta) {
            this.meta = meta == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
            return this;
        }

        public AuthorizationContext build() {
            return new AuthorizationContext(
                    userId, tenantId, roles, system, organizationIds,
                    attributes, resolved, requestMeta, meta);
        }
    }
}

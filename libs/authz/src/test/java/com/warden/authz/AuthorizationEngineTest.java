package com.warden.authz;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.warden.audit.AuditConfig;
import com.warden.audit.AuditDecision;
import com.warden.audit.AuditEvent;
import com.warden.audit.AuditLogger;
import com.warden.audit.TableAuditConfig;
import com.warden.audit.testing.InMemoryAuditAdapter;
import com.warden.authz.field.FieldRules;
import com.warden.authz.field.TableFieldAccessConfig;
import com.warden.authz.query.QueryLayer;
import com.warden.authz.query.QueryPredicate;
import com.warden.authz.rebac.PolicyDecision;
import com.warden.authz.rebac.ReBAcPolicies;
import com.warden.authz.rebac.RelationshipPaths;
import com.warden.authz.rebac.TableReBAcConfig;
import com.warden.authz.resolver.ContextResolvers;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.ContextValidationException;
import com.warden.context.Operation;
import com.warden.context.ResolvedData;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuthorizationEngine")
class AuthorizationEngineTest {

    private final InMemoryAuditAdapter auditAdapter = new InMemoryAuditAdapter();
    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        AuditLogger auditLogger = new AuditLogger(AuditConfig.builder(auditAdapter)
                .async(false)
                .defaults(TableAuditConfig.builder().logAllowed(true).logFilters(true).build())
                .build());
        engine = AuthorizationEngine.builder().auditLogger(auditLogger).build();

        engine.registerResolver(ContextResolvers.builder("org")
                .resolveWith(ctx -> ResolvedData.of("organizationIds", List.of("o1"))));
        engine.registerTable("posts", TableReBAcConfig.of(
                List.of(RelationshipPaths.orgMembership("posts")),
                ReBAcPolicies.allowRelation("posts_org_membership",
                                ctx -> Map.of("user_id", ctx.userId()), Operation.READ, Operation.UPDATE)
                        .name("org-members").build(),
                ReBAcPolicies.allow(Operation.CREATE).name("anyone-creates").build()));
        engine.registerFieldAccess("posts", TableFieldAccessConfig.builder()
                .field("author_email", FieldRules.ownerOnly("author_id").withMaskedValue("hidden"))
                .field("author_id", FieldRules.readOnly())
                .build());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @SuppressWarnings("unchecked")
    private static QueryLayer<Object> queryLayer() {
        return mock(QueryLayer.class);
    }

    @Nested
    @DisplayName("resolveContext")
    class ResolveContext {

        @Test
        @DisplayName("should enrich a valid context with resolver output")
        void shouldResolve() {
            AuthorizationContext resolved = engine.resolveContext(AuthorizationContext.of("u1", "member"));

            assertThat(resolved.resolved().getList("organizationIds")).containsExactly("o1");
        }

        @Test
        @DisplayName("should reject a context without a user")
        void shouldValidate() {
            assertThatThrownBy(() -> engine.resolveContext(AuthorizationContext.builder("").build()))
                    .isInstanceOf(ContextValidationException.class);
        }
    }

    @Nested
    @DisplayName("secureRead")
    class SecureRead {

        @Test
        @DisplayName("should restrict the query, mask the rows and audit the filter")
        void shouldRestrictAndMask() {
            QueryLayer<Object> layer = queryLayer();
            Object query = new Object();
            Object restricted = new Object();
            when(layer.applyFilter(eq(query), any(QueryPredicate.Exists.class))).thenReturn(restricted);
            when(layer.execute(restricted)).thenReturn(List.of(
                    Map.of("id", 1, "author_id", "u1", "author_email", "u1@example.com"),
                    Map.of("id", 2, "author_id", "u2", "author_email", "u2@example.com")));

            List<Map<String, Object>> rows = AuthorizationScope.call(AuthorizationContext.of("u1"),
                    () -> engine.secureRead("posts", query, layer));

            assertThat(rows).extracting(row -> row.get("author_email"))
                    .containsExactly("u1@example.com", "hidden");
            assertThat(auditAdapter.events()).singleElement().satisfies(event -> {
                assertThat(event.decision()).isEqualTo(AuditDecision.FILTER);
                assertThat(event.policyName()).isEqualTo("org-members");
                assertThat(event.userId()).isEqualTo("u1");
            });
        }

        @Test
        @DisplayName("should run tables without policies unrestricted")
        void shouldPassUnconfiguredTables() {
            QueryLayer<Object> layer = queryLayer();
            Object query = new Object();
            when(layer.execute(query)).thenReturn(List.of(Map.of("id", 1)));

            List<Map<String, Object>> rows = AuthorizationScope.call(AuthorizationContext.of("u1"),
                    () -> engine.secureRead("tags", query, layer));

            assertThat(rows).hasSize(1);
            verify(layer, never()).applyFilter(any(), any());
            assertThat(auditAdapter.size()).isZero();
        }
    }

    @Nested
    @DisplayName("guardMutation")
    class GuardMutation {

        @Test
        @DisplayName("should raise and audit when no policy allows the operation")
        void shouldRejectDeniedOperation() {
            assertThatThrownBy(() -> AuthorizationScope.run(AuthorizationContext.of("u1"),
                    () -> engine.guardMutation("posts", Operation.DELETE, null, Map.of("id", 1))))
                    .isInstanceOf(PolicyViolationException.class)
                    .hasMessageContaining("Authorization denied: delete on posts");

            assertThat(auditAdapter.events()).extracting(AuditEvent::decision).containsExactly(AuditDecision.DENY);
        }

        @Test
        @DisplayName("should reject writes to protected fields")
        void shouldValidateFields() {
            assertThatThrownBy(() -> AuthorizationScope.run(AuthorizationContext.of("u1"),
                    () -> engine.guardMutation("posts", Operation.CREATE, Map.of("title", "t", "author_id", "u1"), null)))
                    .isInstanceOf(PolicyViolationException.class)
                    .hasMessageContaining("author_id");
        }

        @Test
        @DisplayName("should return the filter for a permitted update")
        void shouldReturnFilter() {
            PolicyDecision decision = AuthorizationScope.call(AuthorizationContext.of("u1"),
                    () -> engine.guardMutation("posts", Operation.UPDATE, Map.of("title", "new"),
                            Map.of("id", 1, "author_id", "u1")));

            assertThat(decision).isInstanceOf(PolicyDecision.Filter.class);

            QueryLayer<Object> layer = queryLayer();
            Object update = new Object();
            engine.apply(update, "posts", decision, layer);
            verify(layer).applyFilter(eq(update), any(QueryPredicate.Exists.class));
        }

        @Test
        @DisplayName("should refuse reads")
        void shouldRefuseRead() {
            assertThatThrownBy(() -> engine.guardMutation("posts", Operation.READ, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should count decisions in the shared metrics")
    void shouldRecordDecisionMetrics() {
        AuthorizationScope.run(AuthorizationContext.of("u1"), () -> engine.evaluate("posts", Operation.CREATE));

        assertThat(engine.metrics().registry().get("warden.policy.decisions")
                .tag("decision", "allow").counter().count()).isEqualTo(1.0);
        assertThat(auditAdapter.events()).extracting(AuditEvent::policyName).containsExactly("anyone-creates");
    }
}

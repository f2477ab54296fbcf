package com.warden.authz.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.authz.rebac.EndConditions;
import com.warden.authz.rebac.PolicyDecision;
import com.warden.authz.rebac.ReBAcEvaluator;
import com.warden.authz.rebac.ReBAcPolicies;
import com.warden.authz.rebac.RelationshipPath;
import com.warden.authz.rebac.RelationshipPaths;
import com.warden.authz.rebac.RelationshipRegistry;
import com.warden.authz.rebac.RelationshipStep;
import com.warden.authz.rebac.TableReBAcConfig;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReBAcQueryTransformer")
class ReBAcQueryTransformerTest {

    private static final EndConditions CALLER = ctx -> Map.of("user_id", ctx.userId());

    private final RelationshipRegistry registry = new RelationshipRegistry();
    private final ReBAcEvaluator evaluator = new ReBAcEvaluator(registry);
    private final PredicateFormatter formatter = new PredicateFormatter();
    private final RecordingQueryLayer layer = new RecordingQueryLayer();

    @BeforeEach
    void registerProducts() {
        registry.registerTable("products", TableReBAcConfig.of(
                List.of(RelationshipPaths.shopOrgMembership("products")),
                ReBAcPolicies.allowRelation("products_shop_org_membership", CALLER, Operation.READ)
                        .name("org-members").build()));
    }

    private List<String> transformAs(String userId, ReBAcQueryTransformer transformer) {
        AuthorizationContext ctx = AuthorizationContext.of(userId);
        return AuthorizationScope.call(ctx, () ->
                transformer.transform(new ArrayList<>(), "products", Operation.READ, layer));
    }

    @Nested
    @DisplayName("EXISTS strategy")
    class ExistsStrategy {

        @Test
        @DisplayName("should add one correlated EXISTS walking the whole path")
        void shouldBuildCorrelatedExists() {
            List<String> calls = transformAs("u1", new ReBAcQueryTransformer(evaluator));

            assertThat(calls).containsExactly("WHERE EXISTS (SELECT 1 FROM \"shops\""
                    + " JOIN \"organizations\" ON \"shops\".\"organization_id\" = \"organizations\".\"id\""
                    + " JOIN \"employees\" ON \"organizations\".\"id\" = \"employees\".\"organization_id\""
                    + " WHERE \"shops\".\"id\" = \"products\".\"shop_id\""
                    + " AND \"employees\".\"user_id\" = $1) [u1]");
        }

        @Test
        @DisplayName("should correlate with the configured outer alias")
        void shouldUseMainTableAlias() {
            var transformer = new ReBAcQueryTransformer(evaluator, ReBAcQueryTransformer.Strategy.EXISTS, "p");

            List<String> calls = transformAs("u1", transformer);

            assertThat(calls).singleElement().asString().contains("\"shops\".\"id\" = \"p\".\"shop_id\"");
        }

        @Test
        @DisplayName("should negate the subquery for an exclusion policy")
        void shouldNegateExclusion() {
            registry.registerTable("docs", TableReBAcConfig.of(
                    List.of(RelationshipPath.of("docs_blocklist",
                            RelationshipStep.of("docs", "blocked_users", "id", "doc_id"))),
                    ReBAcPolicies.denyRelation("docs_blocklist", CALLER, Operation.READ).name("blocked").build(),
                    ReBAcPolicies.allow(Operation.READ).name("everyone").build()));

            List<String> calls = AuthorizationScope.call(AuthorizationContext.of("u7"), () ->
                    new ReBAcQueryTransformer(evaluator).transform(new ArrayList<>(), "docs", Operation.READ, layer));

            assertThat(calls).containsExactly("WHERE NOT EXISTS (SELECT 1 FROM \"blocked_users\""
                    + " WHERE \"blocked_users\".\"doc_id\" = \"docs\".\"id\""
                    + " AND \"blocked_users\".\"user_id\" = $1) [u7]");
        }
    }

    @Nested
    @DisplayName("JOIN strategy")
    class JoinStrategy {

        @Test
        @DisplayName("should join every step and filter on the last one")
        void shouldJoinEachStep() {
            var transformer = new ReBAcQueryTransformer(evaluator, ReBAcQueryTransformer.Strategy.JOIN, null);

            List<String> calls = transformAs("u1", transformer);

            assertThat(calls).containsExactly(
                    "JOIN \"shops\" ON \"products\".\"shop_id\" = \"shops\".\"id\" []",
                    "JOIN \"organizations\" ON \"shops\".\"organization_id\" = \"organizations\".\"id\" []",
                    "JOIN \"employees\" ON \"organizations\".\"id\" = \"employees\".\"organization_id\" []",
                    "WHERE \"employees\".\"user_id\" = $1 [u1]");
        }
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("should make a denied read return nothing")
        void shouldApplyFalseOnDeny() {
            var transformer = new ReBAcQueryTransformer(evaluator);

            List<String> calls = transformer.apply(new ArrayList<>(), "products",
                    new PolicyDecision.Deny(null, "nope"), layer);

            assertThat(calls).containsExactly("WHERE FALSE []");
        }

        @Test
        @DisplayName("should leave the query alone on allow and untouched")
        void shouldNotTouchOnAllow() {
            var transformer = new ReBAcQueryTransformer(evaluator);

            assertThat(transformer.apply(new ArrayList<>(), "products", new PolicyDecision.Allow("p"), layer)).isEmpty();
            assertThat(transformer.apply(new ArrayList<>(), "products", PolicyDecision.untouched(), layer)).isEmpty();
        }
    }

    @Nested
    @DisplayName("end condition values")
    class EndConditionValues {

        @Test
        @DisplayName("should map null, collections and empty optionals")
        void shouldMapValues() {
            Map<String, Object> values = new HashMap<>();
            values.put("deleted_at", null);
            values.put("org_id", List.of("o1", "o2"));
            values.put("region", Optional.empty());
            values.put("status", "active");

            List<QueryPredicate> predicates = ReBAcQueryTransformer.conditions("e", new TreeMap<>(values));

            assertThat(predicates).containsExactly(
                    new QueryPredicate.IsNull(ColumnRef.of("e", "deleted_at")),
                    new QueryPredicate.In(ColumnRef.of("e", "org_id"), List.<Object>of("o1", "o2")),
                    new QueryPredicate.Eq(ColumnRef.of("e", "status"), "active"));
        }

        @Test
        @DisplayName("should match nothing for an empty collection")
        void shouldTreatEmptyCollectionAsFalse() {
            List<QueryPredicate> predicates = ReBAcQueryTransformer.conditions("e", Map.of("org_id", List.of()));

            assertThat(predicates).containsExactly(QueryPredicate.alwaysFalse());
        }
    }

    /** Records each call as formatted SQL on a list handle. */
    private final class RecordingQueryLayer implements QueryLayer<List<String>> {

        @Override
        public List<String> applyFilter(List<String> handle, QueryPredicate predicate) {
            PredicateFormatter.FormattedPredicate formatted = formatter.format(predicate);
            handle.add("WHERE " + formatted.sql() + " " + formatted.parameters());
            return handle;
        }

        @Override
        public List<String> applyJoin(List<String> handle, JoinClause join) {
            PredicateFormatter.FormattedPredicate formatted = formatter.format(join);
            handle.add(formatted.sql() + " " + formatted.parameters());
            return handle;
        }

        @Override
        public List<Map<String, Object>> execute(List<String> handle) {
            return List.of();
        }
    }
}

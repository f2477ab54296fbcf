package com.warden.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.audit.AuditAdapter;
import com.warden.audit.AuditLogger;
import com.warden.audit.testing.InMemoryAuditAdapter;
import com.warden.authz.AuthorizationEngine;
import com.warden.authz.cache.CacheProvider;
import com.warden.authz.cache.InMemoryCacheProvider;
import com.warden.authz.field.FieldRules;
import com.warden.authz.field.MaskedRow;
import com.warden.authz.field.TableFieldAccessConfig;
import com.warden.authz.metrics.AuthorizationMetrics;
import com.warden.authz.rebac.PolicyDecision;
import com.warden.authz.rebac.ReBAcPolicies;
import com.warden.authz.rebac.RelationshipPaths;
import com.warden.authz.rebac.TableReBAcConfig;
import com.warden.authz.resolver.ContextResolver;
import com.warden.authz.resolver.ContextResolvers;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import com.warden.context.ResolvedData;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@DisplayName("WardenAutoConfiguration")
class WardenAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WardenAutoConfiguration.class));

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        @DisplayName("should create the engine and its collaborators")
        void shouldCreateEngine() {
            runner.run(context -> {
                assertThat(context).hasSingleBean(AuthorizationEngine.class);
                assertThat(context).hasSingleBean(CacheProvider.class);
                assertThat(context).hasSingleBean(AuthorizationMetrics.class);
                assertThat(context).doesNotHaveBean(AuditLogger.class);
                assertThat(context.getBean(CacheProvider.class)).isInstanceOf(InMemoryCacheProvider.class);
            });
        }

        @Test
        @DisplayName("should back off entirely when disabled")
        void shouldBackOffWhenDisabled() {
            runner.withPropertyValues("warden.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean(AuthorizationEngine.class));
        }

        @Test
        @DisplayName("should bind resolver settings")
        void shouldBindResolverSettings() {
            runner.withPropertyValues(
                            "warden.resolver.default-cache-ttl=1m",
                            "warden.resolver.timeout=250ms",
                            "warden.resolver.strict-merge=true",
                            "warden.query.strategy=join")
                    .run(context -> {
                        WardenProperties props = context.getBean(WardenProperties.class);
                        assertThat(props.query().strategy().name()).isEqualTo("JOIN");

                        var options = context.getBean(AuthorizationEngine.class).resolverManager().options();
                        assertThat(options.defaultCacheTtl()).isEqualTo(Duration.ofMinutes(1));
                        assertThat(options.resolverTimeout()).isEqualTo(Duration.ofMillis(250));
                        assertThat(options.strictMerge()).isTrue();
                    });
        }

        @Test
        @DisplayName("should fail startup on an out-of-range sample rate")
        void shouldValidateProperties() {
            runner.withPropertyValues("warden.audit.sample-rate=1.5")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should use an application meter registry")
        void shouldUseMeterRegistry() {
            runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                    .run(context -> assertThat(context.getBean(AuthorizationMetrics.class).registry())
                            .isSameAs(context.getBean(MeterRegistry.class)));
        }
    }

    @Nested
    @DisplayName("registrations")
    class Registrations {

        @Test
        @DisplayName("should register resolvers, tables and field rules from beans")
        void shouldRegisterBeans() {
            runner.withUserConfiguration(PolicyConfiguration.class).run(context -> {
                AuthorizationEngine engine = context.getBean(AuthorizationEngine.class);

                assertThat(engine.resolverManager().resolverNames()).containsExactly("org");
                assertThat(engine.relationshipRegistry().hasTable("products")).isTrue();

                AuthorizationContext ctx = engine.resolveContext(AuthorizationContext.of("u1"));
                PolicyDecision decision = AuthorizationScope.call(ctx, () -> engine.evaluate("products", Operation.READ));
                MaskedRow row = AuthorizationScope.call(ctx, () -> engine.maskRow("customers",
                        Map.of("id", "u2", "email", "c@example.com")));

                assertThat(ctx.resolved().get("orgId")).contains("o1");
                assertThat(decision).isInstanceOf(PolicyDecision.Filter.class);
                assertThat(row.data()).doesNotContainKey("email");
            });
        }

        @Test
        @DisplayName("should keep an application cache provider")
        void shouldBackOffForCustomCache() {
            InMemoryCacheProvider custom = new InMemoryCacheProvider();
            runner.withBean(CacheProvider.class, () -> custom)
                    .run(context -> assertThat(context.getBean(CacheProvider.class)).isSameAs(custom));
        }
    }

    @Nested
    @DisplayName("audit")
    class AuditWiring {

        @Test
        @DisplayName("should audit decisions to the adapter bean when enabled")
        void shouldAuditToAdapter() {
            InMemoryAuditAdapter adapter = new InMemoryAuditAdapter();
            runner.withUserConfiguration(PolicyConfiguration.class)
                    .withBean(AuditAdapter.class, () -> adapter)
                    .withPropertyValues("warden.audit.enabled=true", "warden.audit.async=false",
                            "warden.audit.log-filters=true")
                    .run(context -> {
                        AuthorizationEngine engine = context.getBean(AuthorizationEngine.class);
                        assertThat(engine.auditLogger()).containsSame(context.getBean(AuditLogger.class));

                        AuthorizationScope.run(AuthorizationContext.of("u1"),
                                () -> engine.evaluate("products", Operation.READ));

                        assertThat(adapter.events()).singleElement()
                                .satisfies(event -> assertThat(event.table()).isEqualTo("products"));
                    });
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class PolicyConfiguration {

        @Bean
        ContextResolver orgResolver() {
            return ContextResolvers.builder("org").resolveWith(ctx -> ResolvedData.of("orgId", "o1"));
        }

        @Bean
        RelationshipTableRegistration productPolicies() {
            return RelationshipTableRegistration.of("products", TableReBAcConfig.of(
                    List.of(RelationshipPaths.shopOrgMembership("products")),
                    ReBAcPolicies.allowRelation("products_shop_org_membership",
                            ctx -> Map.of("user_id", ctx.userId()), Operation.ALL).build()));
        }

        @Bean
        FieldAccessTableRegistration customerFields() {
            return FieldAccessTableRegistration.of("customers", TableFieldAccessConfig.builder()
                    .field("email", FieldRules.ownerOnly().omittedWhenHidden())
                    .build());
        }
    }
}

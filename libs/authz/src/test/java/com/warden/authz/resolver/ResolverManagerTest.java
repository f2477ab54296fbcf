package com.warden.authz.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.authz.ResolverException;
import com.warden.authz.SchemaException;
import com.warden.authz.cache.CacheKeys;
import com.warden.authz.cache.InMemoryCacheProvider;
import com.warden.authz.testing.MutableClock;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationErrorCode;
import com.warden.context.AuthorizationScope;
import com.warden.context.ContextValidationException;
import com.warden.context.ResolvedData;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ResolverManager")
class ResolverManagerTest {

    private final AuthorizationContext base = AuthorizationContext.of("u1", "member");

    private static ResolverManager sequential() {
        return new ResolverManager(ResolverManagerOptions.builder().parallel(false).build());
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("should reject a duplicate name")
        void shouldRejectDuplicate() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("org").resolveWith(ctx -> ResolvedData.empty()));

            assertThatThrownBy(() -> manager.register(
                    ContextResolvers.builder("org").resolveWith(ctx -> ResolvedData.empty())))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("already registered");
        }

        @Test
        @DisplayName("should reject a resolver depending on itself")
        void shouldRejectSelfDependency() {
            var manager = new ResolverManager();

            assertThatThrownBy(() -> manager.register(ContextResolvers.builder("org")
                    .dependsOn("org")
                    .resolveWith(ctx -> ResolvedData.empty())))
                    .isInstanceOf(SchemaException.class)
                    .satisfies(e -> assertThat(((SchemaException) e).code())
                            .isEqualTo(AuthorizationErrorCode.SCHEMA_INVALID));
        }

        @Test
        @DisplayName("should unregister by name")
        void shouldUnregister() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("org").resolveWith(ctx -> ResolvedData.empty()));

            assertThat(manager.unregister("org")).isTrue();
            assertThat(manager.hasResolver("org")).isFalse();
            assertThat(manager.resolverNames()).isEmpty();
        }
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        @DisplayName("should run dependencies first and expose their output to dependents")
        void shouldRunInDependencyOrder() {
            var manager = sequential();
            List<String> calls = new CopyOnWriteArrayList<>();
            manager.register(ContextResolvers.builder("b")
                    .dependsOn("a")
                    .resolveWith(ctx -> {
                        calls.add("b");
                        Object a = ctx.resolved().get("a").orElseThrow();
                        return ResolvedData.of("b", a + "+b");
                    }));
            manager.register(ContextResolvers.builder("a").resolveWith(ctx -> {
                calls.add("a");
                return ResolvedData.of("a", 1);
            }));

            AuthorizationContext resolved = manager.resolve(base);

            assertThat(calls).containsExactly("a", "b");
            assertThat(resolved.resolved().get("b")).contains("1+b");
            assertThat(resolved.resolved().of("a")).isPresent();
        }

        @Test
        @DisplayName("should run a level's resolvers concurrently")
        void shouldRunLevelInParallel() {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                var manager = new ResolverManager(ResolverManagerOptions.builder().executor(executor).build());
                var bothStarted = new CountDownLatch(2);
                for (String name : List.of("left", "right")) {
                    manager.register(ContextResolvers.builder(name).resolveWith(ctx -> {
                        bothStarted.countDown();
                        try {
                            if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                                throw new IllegalStateException("resolvers did not overlap");
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException(e);
                        }
                        return ResolvedData.of(name, true);
                    }));
                }

                AuthorizationContext resolved = manager.resolve(base);

                assertThat(resolved.resolved().asMap()).containsKeys("left", "right");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should bind the base context while a resolver runs")
        void shouldBindScope() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("who").resolveWith(ctx ->
                    ResolvedData.of("boundUser", AuthorizationScope.require().userId())));

            assertThat(manager.resolve(base).resolved().get("boundUser")).contains("u1");
        }

        @Test
        @DisplayName("concurrent resolutions for different users should never see each other's data")
        void shouldIsolateConcurrentResolutions() throws Exception {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("who").resolveWith(ctx ->
                    ResolvedData.of("me", ctx.userId())));
            manager.register(ContextResolvers.builder("echo")
                    .dependsOn("who")
                    .resolveWith(ctx -> ResolvedData.of(Map.of(
                            "echoed", ctx.resolved().get("me").orElseThrow(),
                            "bound", AuthorizationScope.require().userId()))));

            ExecutorService callers = Executors.newFixedThreadPool(8);
            try {
                List<CompletableFuture<AuthorizationContext>> results = new ArrayList<>();
                for (int i = 0; i < 400; i++) {
                    AuthorizationContext caller = AuthorizationContext.of("user-" + i, "member");
                    results.add(CompletableFuture.supplyAsync(() -> manager.resolve(caller), callers));
                }

                for (int i = 0; i < results.size(); i++) {
                    AuthorizationContext resolved = results.get(i).get(10, TimeUnit.SECONDS);
                    String expected = "user-" + i;
                    assertThat(resolved.userId()).isEqualTo(expected);
                    assertThat(resolved.resolved().get("me")).contains(expected);
                    assertThat(resolved.resolved().get("echoed")).contains(expected);
                    assertThat(resolved.resolved().get("bound")).contains(expected);
                }
            } finally {
                callers.shutdownNow();
            }
        }

        @Test
        @DisplayName("should keep the first value when two resolvers produce the same key")
        void shouldKeepFirstOnCollision() {
            var manager = sequential();
            manager.register(ContextResolvers.builder("first").priority(10)
                    .resolveWith(ctx -> ResolvedData.of("orgId", "o1")));
            manager.register(ContextResolvers.builder("second")
                    .resolveWith(ctx -> ResolvedData.of("orgId", "o2")));

            AuthorizationContext resolved = manager.resolve(base);

            assertThat(resolved.resolved().get("orgId")).contains("o1");
            assertThat(resolved.resolved().of("second").orElseThrow().get("orgId")).contains("o2");
        }

        @Test
        @DisplayName("should reject a collision under strict merge")
        void shouldRejectCollisionWhenStrict() {
            var manager = new ResolverManager(ResolverManagerOptions.builder().strictMerge(true).build());
            manager.register(ContextResolvers.builder("first").resolveWith(ctx -> ResolvedData.of("orgId", "o1")));
            manager.register(ContextResolvers.builder("second").resolveWith(ctx -> ResolvedData.of("orgId", "o2")));

            assertThatThrownBy(() -> manager.resolve(base))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("orgId");
        }

        @Test
        @DisplayName("should reject a dependency cycle at resolution time")
        void shouldRejectCycle() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("a").dependsOn("b").resolveWith(ctx -> ResolvedData.empty()));
            manager.register(ContextResolvers.builder("b").dependsOn("a").resolveWith(ctx -> ResolvedData.empty()));

            assertThatThrownBy(() -> manager.resolve(base))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("Circular dependency detected");
        }

        @Test
        @DisplayName("should reject an invalid base context")
        void shouldRejectInvalidBase() {
            var manager = new ResolverManager();
            AuthorizationContext invalid = AuthorizationContext.builder(" ").build();

            assertThatThrownBy(() -> manager.resolve(invalid)).isInstanceOf(ContextValidationException.class);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should fail resolution when a required resolver throws")
        void shouldFailOnRequired() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("org").resolveWith(ctx -> {
                throw new IllegalStateException("db down");
            }));

            assertThatThrownBy(() -> manager.resolve(base))
                    .isInstanceOf(ResolverException.class)
                    .hasMessageContaining("db down")
                    .satisfies(e -> assertThat(((ResolverException) e).resolverName()).isEqualTo("org"));
        }

        @Test
        @DisplayName("should continue without an optional resolver that throws")
        void shouldSkipOptional() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("flags").optional().resolveWith(ctx -> {
                throw new IllegalStateException("flags service down");
            }));
            manager.register(ContextResolvers.builder("org").resolveWith(ctx -> ResolvedData.of("orgId", "o1")));

            AuthorizationContext resolved = manager.resolve(base);

            assertThat(resolved.resolved().resolverNames()).containsExactly("org");
        }

        @Test
        @DisplayName("should time out a resolver that never completes")
        void shouldTimeOut() {
            var manager = new ResolverManager(ResolverManagerOptions.builder()
                    .resolverTimeout(Duration.ofMillis(100))
                    .build());
            manager.register(ContextResolvers.builder("slow").resolveAsync(ctx -> new CompletableFuture<>()));

            assertThatThrownBy(() -> manager.resolve(base))
                    .isInstanceOf(ResolverException.class)
                    .satisfies(e -> assertThat(((ResolverException) e).timedOut()).isTrue())
                    .hasMessageContaining("timed out");
        }

        @Test
        @DisplayName("should complete the async form exceptionally")
        void shouldFailAsync() {
            var manager = new ResolverManager();
            manager.register(ContextResolvers.builder("a").dependsOn("missing").resolveWith(ctx -> ResolvedData.empty()));

            assertThat(manager.resolveAsync(base)).isCompletedExceptionally();
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        private final InMemoryCacheProvider cache = new InMemoryCacheProvider(clock);
        private final AtomicInteger calls = new AtomicInteger();

        private ResolverManager managerWithCountingResolver() {
            var manager = new ResolverManager(ResolverManagerOptions.builder().cacheProvider(cache).build());
            manager.register(ContextResolvers.builder("org")
                    .cacheKey(ctx -> CacheKeys.of("org", ctx.userId()))
                    .cacheTtl(Duration.ofSeconds(60))
                    .resolveWith(ctx -> ResolvedData.of("orgId", "o" + calls.incrementAndGet())));
            return manager;
        }

        @Test
        @DisplayName("should reuse cached output until the ttl elapses")
        void shouldCacheWithinTtl() {
            var manager = managerWithCountingResolver();

            manager.resolve(base);
            clock.advance(Duration.ofSeconds(30));
            AuthorizationContext second = manager.resolve(base);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(second.resolved().get("orgId")).contains("o1");

            clock.advance(Duration.ofSeconds(31));
            AuthorizationContext third = manager.resolve(base);

            assertThat(calls.get()).isEqualTo(2);
            assertThat(third.resolved().get("orgId")).contains("o2");
        }

        @Test
        @DisplayName("should recompute after invalidating a user")
        void shouldInvalidateUser() {
            var manager = managerWithCountingResolver();
            manager.resolve(base);

            manager.invalidateCache("u1");
            manager.resolve(base);

            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should recompute after clearing the cache")
        void shouldClear() {
            var manager = managerWithCountingResolver();
            manager.resolve(base);

            manager.clearCache();

            assertThat(cache.size()).isZero();
            manager.resolve(base);
            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should resolve a single resolver through the cache")
        void shouldResolveOne() {
            var manager = managerWithCountingResolver();

            assertThat(manager.resolveOne("org", base)).hasValueSatisfying(
                    data -> assertThat(data.get("orgId")).contains("o1"));
            assertThat(manager.resolveOne("org", base)).isPresent();
            assertThat(manager.resolveOne("unknown", base)).isEmpty();
            assertThat(calls.get()).isEqualTo(1);
        }
    }
}

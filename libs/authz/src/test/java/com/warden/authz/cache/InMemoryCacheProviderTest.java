package com.warden.authz.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.authz.testing.MutableClock;
import com.warden.context.ResolvedData;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryCacheProvider")
class InMemoryCacheProviderTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryCacheProvider cache = new InMemoryCacheProvider(clock);

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("should return a value until its ttl elapses")
        void shouldExpireAfterTtl() {
            cache.set("authz:org:u1", ResolvedData.of("orgId", "o1"), Duration.ofSeconds(60));

            clock.advance(Duration.ofSeconds(59));
            assertThat(cache.get("authz:org:u1")).isPresent();

            clock.advance(Duration.ofSeconds(1));
            assertThat(cache.get("authz:org:u1")).isEmpty();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("should reject a non-positive ttl")
        void shouldRejectZeroTtl() {
            assertThatThrownBy(() -> cache.set("k", ResolvedData.empty(), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ttl");
        }

        @Test
        @DisplayName("sweep should drop expired entries that are never read again")
        void shouldSweepUnreadExpiredEntries() {
            cache.set("authz:org:u1", ResolvedData.empty(), Duration.ofSeconds(10));
            cache.set("authz:org:u2", ResolvedData.empty(), Duration.ofMinutes(10));
            clock.advance(Duration.ofSeconds(10));

            assertThat(cache.sweep()).isEqualTo(1);
            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.get("authz:org:u2")).isPresent();
        }

        @Test
        @DisplayName("should sweep expired entries as writes accumulate")
        void shouldSweepOnWrites() {
            for (int i = 0; i < InMemoryCacheProvider.SWEEP_INTERVAL - 1; i++) {
                cache.set("authz:org:u" + i, ResolvedData.empty(), Duration.ofSeconds(1));
            }
            clock.advance(Duration.ofSeconds(2));

            cache.set("authz:org:fresh", ResolvedData.empty(), Duration.ofMinutes(1));

            assertThat(cache.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("deletion")
    class Deletion {

        @Test
        @DisplayName("should delete keys matching a glob and keep the rest")
        void shouldDeleteByPattern() {
            Duration ttl = Duration.ofMinutes(5);
            cache.set(CacheKeys.of("org", "u1"), ResolvedData.empty(), ttl);
            cache.set(CacheKeys.of("team", "u1", "t9"), ResolvedData.empty(), ttl);
            cache.set(CacheKeys.of("org", "u2"), ResolvedData.empty(), ttl);

            cache.deletePattern(CacheKeys.of("*", "u1"));
            cache.deletePattern(CacheKeys.of("*", "u1", "*"));

            assertThat(cache.get("authz:org:u1")).isEmpty();
            assertThat(cache.get("authz:team:u1:t9")).isEmpty();
            assertThat(cache.get("authz:org:u2")).isPresent();
        }

        @Test
        @DisplayName("should treat regex metacharacters in a glob literally")
        void shouldQuoteLiterals() {
            assertThat(InMemoryCacheProvider.toRegex("authz:a.b:*").matcher("authz:a.b:x").matches()).isTrue();
            assertThat(InMemoryCacheProvider.toRegex("authz:a.b:*").matcher("authz:aXb:x").matches()).isFalse();
        }

        @Test
        @DisplayName("should remove everything on clear")
        void shouldClear() {
            cache.set("a", ResolvedData.empty(), Duration.ofMinutes(1));
            cache.set("b", ResolvedData.empty(), Duration.ofMinutes(1));

            cache.clear();

            assertThat(cache.size()).isZero();
        }
    }

    @Test
    @DisplayName("should build keys under the authz prefix")
    void shouldBuildKeys() {
        assertThat(CacheKeys.of("org", "u1")).isEqualTo("authz:org:u1");
        assertThat(CacheKeys.of("team", null)).isEqualTo("authz:team:");
    }
}

package com.example.accessgate.cache;

import com.example.accessgate.config.properties.AccessGateProperties;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.observability.CacheMetricsService;
import com.example.accessgate.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("InMemoryDecisionCache")
class InMemoryDecisionCacheTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemoryDecisionCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        registry = new SimpleMeterRegistry();
        cache = new InMemoryDecisionCache(new AccessGateProperties(), new CacheMetricsService(registry), clock);
    }

    private static DecisionCacheKey key(String principal, String resourceId) {
        return new DecisionCacheKey("t1", principal, "doc", resourceId, "read");
    }

    private CachedDecision decision(boolean allowed) {
        return new CachedDecision(allowed, FieldPermissions.empty(), List.of(), List.of("p1"), clock.instant());
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("should serve an entry until its own TTL elapses")
        void shouldExpireAfterTtl() {
            cache.set(key("alice", "1"), decision(true), Duration.ofSeconds(300)).block();

            clock.advance(Duration.ofSeconds(299));
            StepVerifier.create(cache.get(key("alice", "1")))
                    .assertNext(hit -> assertThat(hit.allowed()).isTrue())
                    .verifyComplete();

            clock.advance(Duration.ofSeconds(2));
            StepVerifier.create(cache.get(key("alice", "1"))).verifyComplete();
        }

        @Test
        @DisplayName("should honor a shorter TTL for negative entries")
        void shouldExpireNegativeEntriesSooner() {
            cache.set(key("alice", "1"), decision(true), Duration.ofSeconds(300)).block();
            cache.set(key("alice", "2"), decision(false), Duration.ofSeconds(30)).block();

            clock.advance(Duration.ofSeconds(31));

            StepVerifier.create(cache.get(key("alice", "2"))).verifyComplete();
            StepVerifier.create(cache.get(key("alice", "1")))
                    .expectNextCount(1)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("clear")
    class Clear {

        @Test
        @DisplayName("should remove only the scoped principal's entries")
        void shouldClearOnePrincipal() {
            cache.set(key("alice", "1"), decision(true), Duration.ofMinutes(5)).block();
            cache.set(key("alice", "2"), decision(true), Duration.ofMinutes(5)).block();
            cache.set(key("bob", "1"), decision(true), Duration.ofMinutes(5)).block();

            StepVerifier.create(cache.clear(CacheScope.principal("alice")))
                    .expectNext(2L)
                    .verifyComplete();

            StepVerifier.create(cache.get(key("alice", "1"))).verifyComplete();
            StepVerifier.create(cache.get(key("bob", "1"))).expectNextCount(1).verifyComplete();
        }

        @Test
        @DisplayName("should not treat a principal id as a prefix of a longer one")
        void shouldNotMatchPrincipalPrefixes() {
            cache.set(key("al", "1"), decision(true), Duration.ofMinutes(5)).block();
            cache.set(key("alice", "1"), decision(true), Duration.ofMinutes(5)).block();

            cache.clear(CacheScope.principal("al")).block();

            StepVerifier.create(cache.get(key("alice", "1"))).expectNextCount(1).verifyComplete();
        }

        @Test
        @DisplayName("should bump the generation of the cleared principal and of everyone on a global clear")
        void shouldBumpGenerations() {
            long aliceBefore = cache.generation("alice").block();
            long bobBefore = cache.generation("bob").block();

            cache.clear(CacheScope.principal("alice")).block();

            assertThat(cache.generation("alice").block()).isGreaterThan(aliceBefore);
            assertThat(cache.generation("bob").block()).isEqualTo(bobBefore);

            cache.clear(CacheScope.all()).block();

            assertThat(cache.generation("bob").block()).isGreaterThan(bobBefore);
        }

        @Test
        @DisplayName("should keep principals apart whose ids differ only in reserved characters")
        void shouldNotMergeLookalikePrincipals() {
            cache.set(key("svc:a", "1"), decision(true), Duration.ofMinutes(5)).block();

            StepVerifier.create(cache.get(key("svc_a", "1"))).verifyComplete();
            StepVerifier.create(cache.get(key("svc a", "1"))).verifyComplete();

            cache.set(key("svc_a", "1"), decision(false), Duration.ofMinutes(5)).block();
            StepVerifier.create(cache.clear(CacheScope.principal("svc_a")))
                    .expectNext(1L)
                    .verifyComplete();
            StepVerifier.create(cache.get(key("svc:a", "1")))
                    .assertNext(hit -> assertThat(hit.allowed()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep resources apart whose ids differ only in reserved characters")
        void shouldNotMergeLookalikeResources() {
            cache.set(key("alice", "a:b"), decision(true), Duration.ofMinutes(5)).block();

            StepVerifier.create(cache.get(key("alice", "a_b"))).verifyComplete();
            StepVerifier.create(cache.get(key("alice", "a*b"))).verifyComplete();
        }

        @Test
        @DisplayName("should reject role scopes, which are expanded by the invalidator")
        void shouldRejectRoleScope() {
            StepVerifier.create(cache.clear(CacheScope.role("admin")))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("should count hits and misses")
    void shouldReportStats() {
        cache.set(key("alice", "1"), decision(true), Duration.ofMinutes(5)).block();
        cache.get(key("alice", "1")).block();
        cache.get(key("alice", "1")).block();
        cache.get(key("alice", "missing")).block();

        StepVerifier.create(cache.stats())
                .assertNext(stats -> {
                    assertThat(stats.hits()).isEqualTo(2);
                    assertThat(stats.misses()).isEqualTo(1);
                    assertThat(stats.size()).isEqualTo(1);
                    assertThat(stats.hitRate()).isCloseTo(2.0 / 3.0, offset(0.001));
                })
                .verifyComplete();
    }
}

package com.example.accessgate.cache;

import com.example.accessgate.audit.AuditEvent;
import com.example.accessgate.util.AccessGateFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static com.example.accessgate.util.AccessModelTestBuilder.aGroup;
import static com.example.accessgate.util.AccessModelTestBuilder.aPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.aRole;
import static com.example.accessgate.util.AccessModelTestBuilder.assign;
import static com.example.accessgate.util.AccessModelTestBuilder.seedGroup;
import static com.example.accessgate.util.AccessModelTestBuilder.seedPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.seedRole;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DecisionCacheInvalidator")
class DecisionCacheInvalidatorTest {

    private AccessGateFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new AccessGateFixture();
        seedRole(fixture.directoryStore, aRole("viewer"));
        seedRole(fixture.directoryStore, aRole("editor", "viewer"));
        seedRole(fixture.directoryStore, aRole("unrelated"));
        seedGroup(fixture.directoryStore, aGroup("editors", "editor"));
        seedGroup(fixture.directoryStore, aGroup("sub-editors").toBuilder().parentId("editors").build());

        seedPrincipal(fixture.directoryStore, aPrincipal("direct"));
        assign(fixture.directoryStore, "direct", "viewer");
        seedPrincipal(fixture.directoryStore, aPrincipal("child-holder"));
        assign(fixture.directoryStore, "child-holder", "editor");
        seedPrincipal(fixture.directoryStore, aPrincipal("group-member").toBuilder().groupId("sub-editors").build());
        seedPrincipal(fixture.directoryStore, aPrincipal("bystander"));
        assign(fixture.directoryStore, "bystander", "unrelated");
    }

    private void cacheFor(String principalId) {
        fixture.decisionCache.set(new DecisionCacheKey("tenant-1", principalId, "doc", "1", "read"),
                new CachedDecision(true, null, null, null, Instant.EPOCH), Duration.ofMinutes(5)).block();
    }

    @Test
    @DisplayName("should find holders of the role, of descendant roles and members of granting groups")
    void shouldResolveAffectedPrincipals() {
        StepVerifier.create(fixture.cacheInvalidator.affectedPrincipals("viewer"))
                .assertNext(principals -> assertThat(principals)
                        .containsExactlyInAnyOrder("direct", "child-holder", "group-member"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should evict affected principals only and audit the invalidation")
    void shouldEvictRoleScope() {
        cacheFor("direct");
        cacheFor("group-member");
        cacheFor("bystander");

        StepVerifier.create(fixture.cacheInvalidator.invalidate(CacheScope.role("viewer"), "test"))
                .expectNext(2L)
                .verifyComplete();

        StepVerifier.create(fixture.decisionCache.get(
                        new DecisionCacheKey("tenant-1", "bystander", "doc", "1", "read")))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(fixture.auditSink.events(AuditEvent.EventType.CACHE_INVALIDATION))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.details()).containsEntry("scope", "role:viewer");
                    assertThat(event.details()).containsEntry("evicted", 2L);
                    assertThat(event.details()).containsEntry("cause", "test");
                });
    }

    @Test
    @DisplayName("should clear every entry on a global invalidation")
    void shouldEvictAll() {
        cacheFor("direct");
        cacheFor("bystander");

        StepVerifier.create(fixture.cacheInvalidator.invalidateAll("manual"))
                .expectNext(2L)
                .verifyComplete();

        StepVerifier.create(fixture.decisionCache.stats())
                .assertNext(stats -> assertThat(stats.size()).isZero())
                .verifyComplete();
    }
}

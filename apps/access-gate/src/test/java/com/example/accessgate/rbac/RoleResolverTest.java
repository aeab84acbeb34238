package com.example.accessgate.rbac;

import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.memory.InMemoryDirectoryStore;
import com.example.accessgate.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static com.example.accessgate.util.AccessModelTestBuilder.aGroup;
import static com.example.accessgate.util.AccessModelTestBuilder.aPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.aRole;
import static com.example.accessgate.util.AccessModelTestBuilder.assign;
import static com.example.accessgate.util.AccessModelTestBuilder.seedGroup;
import static com.example.accessgate.util.AccessModelTestBuilder.seedPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.seedRole;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleResolver")
class RoleResolverTest {

    private InMemoryDirectoryStore store;
    private MutableClock clock;
    private RoleResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryDirectoryStore();
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        resolver = new RoleResolver(store, clock);
    }

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("should include every ancestor of a directly assigned role")
        void shouldIncludeAncestors() {
            seedRole(store, aRole("viewer"));
            seedRole(store, aRole("editor", "viewer"));
            seedRole(store, aRole("admin", "editor"));
            seedPrincipal(store, aPrincipal("alice"));
            assign(store, "alice", "admin");

            StepVerifier.create(resolver.resolveDetailed("alice"))
                    .assertNext(roles -> {
                        assertThat(roles.direct()).containsExactly("admin");
                        assertThat(roles.inherited()).containsExactlyInAnyOrder("editor", "viewer");
                        assertThat(roles.all()).containsExactlyInAnyOrder("admin", "editor", "viewer");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should terminate on a cyclic hierarchy and return each role once")
        void shouldTerminateOnCycle() {
            seedRole(store, aRole("a", "b"));
            seedRole(store, aRole("b", "c"));
            seedRole(store, aRole("c", "a"));
            seedPrincipal(store, aPrincipal("bob"));
            assign(store, "bob", "a");

            StepVerifier.create(resolver.resolve("bob"))
                    .assertNext(roles -> assertThat(roles).containsExactlyInAnyOrder("a", "b", "c"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should stop at inactive roles")
        void shouldStopAtInactiveRoles() {
            seedRole(store, aRole("root"));
            seedRole(store, aRole("middle", "root").toBuilder().active(false).build());
            seedRole(store, aRole("leaf", "middle"));
            seedPrincipal(store, aPrincipal("carol"));
            assign(store, "carol", "leaf");

            StepVerifier.create(resolver.resolve("carol"))
                    .assertNext(roles -> assertThat(roles).containsExactly("leaf"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        @DisplayName("should collect roles of member groups and their ancestors")
        void shouldCollectGroupRoles() {
            seedRole(store, aRole("reader"));
            seedRole(store, aRole("auditor", "reader"));
            seedGroup(store, aGroup("org", "auditor"));
            seedGroup(store, aGroup("team", "reader").toBuilder().parentId("org").build());
            seedPrincipal(store, aPrincipal("dave").toBuilder().groupId("team").build());

            StepVerifier.create(resolver.resolveDetailed("dave"))
                    .assertNext(roles -> {
                        assertThat(roles.direct()).isEmpty();
                        assertThat(roles.viaGroups()).containsExactlyInAnyOrder("reader", "auditor");
                        assertThat(roles.all()).containsExactlyInAnyOrder("reader", "auditor");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should terminate on a cyclic group hierarchy")
        void shouldTerminateOnGroupCycle() {
            seedRole(store, aRole("r1"));
            seedRole(store, aRole("r2"));
            seedGroup(store, aGroup("g1", "r1").toBuilder().parentId("g2").build());
            seedGroup(store, aGroup("g2", "r2").toBuilder().parentId("g1").build());
            seedPrincipal(store, aPrincipal("erin").toBuilder().groupId("g1").build());

            StepVerifier.create(resolver.resolve("erin"))
                    .assertNext(roles -> assertThat(roles).containsExactlyInAnyOrder("r1", "r2"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("assignments")
    class Assignments {

        @Test
        @DisplayName("should ignore expired and deactivated assignments")
        void shouldIgnoreIneffectiveAssignments() {
            seedRole(store, aRole("temp"));
            seedRole(store, aRole("off"));
            seedRole(store, aRole("base"));
            seedPrincipal(store, aPrincipal("frank"));
            store.saveAssignment(RoleAssignment.builder().principalId("frank").roleId("temp")
                    .expiresAt(clock.instant().plus(Duration.ofHours(1))).active(true).build()).block();
            store.saveAssignment(RoleAssignment.builder().principalId("frank").roleId("off")
                    .active(false).build()).block();
            assign(store, "frank", "base");

            StepVerifier.create(resolver.resolve("frank"))
                    .assertNext(roles -> assertThat(roles).containsExactlyInAnyOrder("temp", "base"))
                    .verifyComplete();

            clock.advance(Duration.ofHours(2));

            StepVerifier.create(resolver.resolve("frank"))
                    .assertNext(roles -> assertThat(roles).containsExactly("base"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should resolve no roles for an inactive principal")
        void shouldResolveNothingForInactivePrincipal() {
            seedRole(store, aRole("base"));
            Principal inactive = aPrincipal("gina").toBuilder().active(false).build();
            seedPrincipal(store, inactive);
            assign(store, "gina", "base");

            StepVerifier.create(resolver.resolve("gina"))
                    .assertNext(roles -> assertThat(roles).isEqualTo(Set.of()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail with NotFoundException for an unknown principal")
        void shouldFailForUnknownPrincipal() {
            StepVerifier.create(resolver.resolve("nobody"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }
}

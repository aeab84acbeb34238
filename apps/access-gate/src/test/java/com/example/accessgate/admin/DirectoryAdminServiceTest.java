package com.example.accessgate.admin;

import com.example.accessgate.audit.AuditEvent;
import com.example.accessgate.cache.CachedDecision;
import com.example.accessgate.cache.DecisionCacheKey;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.exception.ValidationException;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldAction;
import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.FieldTier;
import com.example.accessgate.util.AccessGateFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static com.example.accessgate.util.AccessModelTestBuilder.aChain;
import static com.example.accessgate.util.AccessModelTestBuilder.aLevel;
import static com.example.accessgate.util.AccessModelTestBuilder.aPermission;
import static com.example.accessgate.util.AccessModelTestBuilder.aPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.aRole;
import static com.example.accessgate.util.AccessModelTestBuilder.assign;
import static com.example.accessgate.util.AccessModelTestBuilder.grant;
import static com.example.accessgate.util.AccessModelTestBuilder.seedPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.seedRole;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DirectoryAdminService")
class DirectoryAdminServiceTest {

    private static final DecisionCacheKey ALICE_KEY = new DecisionCacheKey("tenant-1", "alice", "doc", "1", "read");

    private AccessGateFixture fixture;
    private DirectoryAdminService admin;

    @BeforeEach
    void setUp() {
        fixture = new AccessGateFixture();
        admin = fixture.admin;
        seedRole(fixture.directoryStore, aRole("a"));
        seedRole(fixture.directoryStore, aRole("b", "a"));
        seedRole(fixture.directoryStore, aRole("c", "b"));
        seedPrincipal(fixture.directoryStore, aPrincipal("alice"));
        assign(fixture.directoryStore, "alice", "c");
    }

    private void cacheAlice() {
        fixture.decisionCache.set(ALICE_KEY, new CachedDecision(true, null, null, null, Instant.EPOCH),
                Duration.ofMinutes(5)).block();
    }

    private void assertAliceEvicted() {
        StepVerifier.create(fixture.decisionCache.get(ALICE_KEY)).verifyComplete();
    }

    @Nested
    @DisplayName("roles")
    class Roles {

        @Test
        @DisplayName("should reject a parent that makes the role its own ancestor")
        void shouldRejectCycle() {
            StepVerifier.create(admin.setRoleParent("a", "c"))
                    .expectError(ValidationException.class)
                    .verify();
            StepVerifier.create(admin.saveRole(aRole("a", "a")))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should evict principals holding a descendant of a changed role")
        void shouldInvalidateDescendantHolders() {
            cacheAlice();

            StepVerifier.create(admin.saveRole(aRole("a").toBuilder().priority(5).build()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertAliceEvicted();
        }

        @Test
        @DisplayName("should fail with NotFoundException when re-parenting a missing role")
        void shouldFailForMissingRole() {
            StepVerifier.create(admin.setRoleParent("missing", "a"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("assignments")
    class Assignments {

        @Test
        @DisplayName("should assign, evict and audit")
        void shouldAssignRole() {
            seedRole(fixture.directoryStore, aRole("extra"));
            cacheAlice();

            StepVerifier.create(admin.assignRole("alice", "extra", null))
                    .assertNext(assignment -> assertThat(assignment.active()).isTrue())
                    .verifyComplete();

            assertAliceEvicted();
            assertThat(fixture.auditSink.events(AuditEvent.EventType.MUTATION))
                    .singleElement()
                    .satisfies(event -> assertThat(event.details()).containsEntry("operation", "assignRole"));
        }

        @Test
        @DisplayName("should refuse non-assignable roles and unknown principals")
        void shouldValidateAssignment() {
            seedRole(fixture.directoryStore, aRole("system").toBuilder().assignable(false).build());

            StepVerifier.create(admin.assignRole("alice", "system", null))
                    .expectError(ValidationException.class)
                    .verify();
            StepVerifier.create(admin.assignRole("ghost", "a", null))
                    .expectError(NotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should evict the principal on revocation")
        void shouldRevokeRole() {
            cacheAlice();

            StepVerifier.create(admin.revokeRole("alice", "c"))
                    .expectNext(true)
                    .verifyComplete();

            assertAliceEvicted();
        }
    }

    @Nested
    @DisplayName("permissions")
    class Permissions {

        @Test
        @DisplayName("should reject a permission with both an id and a path locator")
        void shouldRejectAmbiguousLocator() {
            StepVerifier.create(admin.savePermission(aPermission("p", "doc", Action.READ)
                            .resourceId("1").resourcePath("/x/*").build()))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should normalize field permissions against field definitions on save")
        void shouldNormalizeOnSave() {
            fixture.directoryStore.saveFieldDefinition(new FieldDefinition("doc", "title", FieldTier.CORE)).block();

            StepVerifier.create(admin.savePermission(aPermission("p", "doc", Action.READ)
                            .fieldPermissions(FieldPermissions.builder()
                                    .grant(FieldTier.CORE, "title", FieldAction.READ)
                                    .grant(FieldTier.CORE, "bogus", FieldAction.WRITE)
                                    .build())
                            .build()))
                    .assertNext(saved -> {
                        assertThat(saved.fieldPermissions().actionsFor(FieldTier.CORE, "title")).isNotEmpty();
                        assertThat(saved.fieldPermissions().actionsFor(FieldTier.CORE, "bogus")).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should evict holders of linked roles when a permission changes")
        void shouldInvalidateLinkedRoles() {
            grant(fixture.directoryStore, "a", aPermission("p-read", "doc", Action.READ).build());
            cacheAlice();

            StepVerifier.create(admin.savePermission(aPermission("p-read", "doc", Action.READ, Action.UPDATE).build()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertAliceEvicted();
        }

        @Test
        @DisplayName("should require both ends of a link to exist")
        void shouldValidateLink() {
            StepVerifier.create(admin.linkPermission("a", "missing"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("should evict every decision when a chain is saved and reject invalid chains")
    void shouldSaveChain() {
        cacheAlice();

        StepVerifier.create(admin.saveChain(aChain("empty", "doc", "doc:*").build()))
                .expectError(ValidationException.class)
                .verify();

        StepVerifier.create(admin.saveChain(aChain("c1", "doc", "doc:*")
                        .level(aLevel(1, "a"))
                        .build()))
                .expectNextCount(1)
                .verifyComplete();

        assertAliceEvicted();
    }
}

package com.example.accessgate.approval;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.AccessRequestStatus;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalDecision;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.approval.model.RequestDetails;
import com.example.accessgate.audit.AuditEvent;
import com.example.accessgate.condition.Condition;
import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.exception.UnauthorizedApproverException;
import com.example.accessgate.exception.UnavailableException;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.ResourceTarget;
import com.example.accessgate.notification.NotificationTarget;
import com.example.accessgate.rbac.ResourceMatcher;
import com.example.accessgate.store.memory.InMemoryApprovalStore;
import com.example.accessgate.store.memory.InMemoryDirectoryStore;
import com.example.accessgate.util.AccessGateFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.example.accessgate.util.AccessModelTestBuilder.TENANT;
import static com.example.accessgate.util.AccessModelTestBuilder.aChain;
import static com.example.accessgate.util.AccessModelTestBuilder.aLevel;
import static com.example.accessgate.util.AccessModelTestBuilder.aPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.aRole;
import static com.example.accessgate.util.AccessModelTestBuilder.assign;
import static com.example.accessgate.util.AccessModelTestBuilder.seedChain;
import static com.example.accessgate.util.AccessModelTestBuilder.seedPrincipal;
import static com.example.accessgate.util.AccessModelTestBuilder.seedRole;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("ApprovalGate")
class ApprovalGateTest {

    private static final ResourceTarget FINANCE_REPORT = ResourceTarget.ofId("doc", "finance-q1");
    private static final RequestDetails DELETE_REPORT =
            new RequestDetails(FINANCE_REPORT, Action.DELETE, "quarter close", null);

    private AccessGateFixture fixture;
    private ApprovalGate gate;
    private ApprovalChain twoLevelChain;

    @BeforeEach
    void setUp() {
        init(new AccessGateFixture());
    }

    private void init(AccessGateFixture newFixture) {
        fixture = newFixture;
        gate = fixture.approvalGate;

        seedRole(fixture.directoryStore, aRole("manager"));
        seedRole(fixture.directoryStore, aRole("director"));
        seedPrincipal(fixture.directoryStore, aPrincipal("requester"));
        seedPrincipal(fixture.directoryStore, aPrincipal("mgr"));
        assign(fixture.directoryStore, "mgr", "manager");
        seedPrincipal(fixture.directoryStore, aPrincipal("dir"));
        assign(fixture.directoryStore, "dir", "director");

        twoLevelChain = aChain("chain-finance", "doc", "doc:finance-*")
                .action(Action.DELETE)
                .level(aLevel(1, "manager"))
                .level(aLevel(2, "director"))
                .build();
        seedChain(fixture.approvalStore, twoLevelChain);
    }

    private AccessRequest open() {
        AccessRequestResult result = gate.createAccessRequest(TENANT, "requester", twoLevelChain, DELETE_REPORT,
                Map.of()).block();
        assertThat(result).isNotNull();
        assertThat(result.autoApproved()).isFalse();
        return Objects.requireNonNull(result.request());
    }

    @Nested
    @DisplayName("requiresApproval")
    class RequiresApproval {

        @Test
        @DisplayName("should return the chain matching type, pattern and action")
        void shouldFindMatchingChain() {
            StepVerifier.create(gate.requiresApproval(
                            new ResourceMatcher.MatchTarget("doc", "finance-q1", null), Action.DELETE))
                    .assertNext(chain -> assertThat(chain.id()).isEqualTo("chain-finance"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not gate other actions or non-matching resources")
        void shouldIgnoreOtherActionsAndResources() {
            StepVerifier.create(gate.requiresApproval(
                    new ResourceMatcher.MatchTarget("doc", "finance-q1", null), Action.READ)).verifyComplete();
            StepVerifier.create(gate.requiresApproval(
                    new ResourceMatcher.MatchTarget("doc", "hr-1", null), Action.DELETE)).verifyComplete();
        }
    }

    @Nested
    @DisplayName("createAccessRequest")
    class CreateAccessRequest {

        @Test
        @DisplayName("should open a pending request at the first level and notify its approvers")
        void shouldOpenPendingRequest() {
            AccessRequest request = open();

            assertThat(request.status()).isEqualTo(AccessRequestStatus.PENDING);
            assertThat(request.currentLevel()).isEqualTo(1);
            assertThat(request.version()).isZero();
            verify(fixture.notificationService, timeout(1000))
                    .notify(eq(NotificationTarget.role("manager")), eq(request.id()), eq(1));
        }

        @Test
        @DisplayName("should reuse the requester's open request for the same resource and action")
        void shouldReuseOpenRequest() {
            AccessRequest first = open();
            AccessRequest second = open();

            assertThat(second.id()).isEqualTo(first.id());
        }

        @Test
        @DisplayName("should share one request between concurrent callers")
        void shouldOpenOneRequestUnderConcurrency() {
            List<String> ids = IntStream.range(0, 16)
                    .parallel()
                    .mapToObj(i -> open().id())
                    .toList();

            assertThat(ids).containsOnly(ids.get(0));
            assertThat(fixture.approvalStore.findOpenRequests().collectList().block()).hasSize(1);
        }

        @Test
        @DisplayName("should open a fresh request once the previous one is closed")
        void shouldOpenAgainAfterCancel() {
            AccessRequest first = open();
            gate.cancel(first.id(), "requester").block();

            AccessRequest second = open();

            assertThat(second.id()).isNotEqualTo(first.id());
            assertThat(second.status()).isEqualTo(AccessRequestStatus.PENDING);
        }

        @Test
        @DisplayName("should auto-approve when level conditions override chain defaults and hold")
        void shouldAutoApprove() {
            ApprovalChain chain = twoLevelChain.toBuilder()
                    .autoApproveCondition(new Condition.Equals("principal.clearance", "high"))
                    .clearLevels()
                    .level(aLevel(1, "manager").toBuilder()
                            .autoApproveCondition(new Condition.InSet("principal.clearance", List.of("high", "top")))
                            .build())
                    .build();

            StepVerifier.create(gate.createAccessRequest(TENANT, "requester", chain, DELETE_REPORT,
                            Map.of("principal", Map.of("clearance", "top"))))
                    .assertNext(result -> {
                        assertThat(result.autoApproved()).isTrue();
                        assertThat(result.request()).isNull();
                    })
                    .verifyComplete();

            assertThat(fixture.auditSink.events(AuditEvent.EventType.APPROVAL_TRANSITION))
                    .extracting(AuditEvent::reasonCode)
                    .containsExactly(ReasonCode.AUTO_APPROVED);
        }

        @Test
        @DisplayName("should never auto-approve a chain without conditions")
        void shouldNotAutoApproveWithoutConditions() {
            assertThat(open().status()).isEqualTo(AccessRequestStatus.PENDING);
        }
    }

    @Nested
    @DisplayName("recordDecision")
    class RecordDecision {

        @Test
        @DisplayName("should advance through every level and issue a grant on final approval")
        void shouldProgressToApproved() {
            AccessRequest request = open();

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, "ok"))
                    .assertNext(updated -> {
                        assertThat(updated.status()).isEqualTo(AccessRequestStatus.PENDING_NEXT_LEVEL);
                        assertThat(updated.currentLevel()).isEqualTo(2);
                        assertThat(updated.version()).isEqualTo(1);
                    })
                    .verifyComplete();

            verify(fixture.notificationService, timeout(1000))
                    .notify(eq(NotificationTarget.role("director")), eq(request.id()), eq(2));

            StepVerifier.create(gate.recordDecision(request.id(), "dir", 2, ApprovalDecision.APPROVED, null))
                    .assertNext(updated -> assertThat(updated.status()).isEqualTo(AccessRequestStatus.APPROVED))
                    .verifyComplete();

            StepVerifier.create(fixture.approvalStore.findActiveGrant("requester", FINANCE_REPORT.key(),
                            Action.DELETE, fixture.clock.instant()))
                    .assertNext(grant -> assertThat(grant.requestId()).isEqualTo(request.id()))
                    .verifyComplete();

            StepVerifier.create(fixture.approvalStore.findApprovals(request.id()).map(a -> a.approverId()))
                    .expectNext("mgr", "dir")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should end the request on denial and reject later decisions with a conflict")
        void shouldDenyThenConflict() {
            AccessRequest request = open();

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.DENIED, "no"))
                    .assertNext(updated -> assertThat(updated.status()).isEqualTo(AccessRequestStatus.DENIED))
                    .verifyComplete();

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .expectError(ConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an approver without the level's role and leave the request untouched")
        void shouldRejectUnauthorizedApprover() {
            AccessRequest request = open();

            StepVerifier.create(gate.recordDecision(request.id(), "dir", 1, ApprovalDecision.APPROVED, null))
                    .expectError(UnauthorizedApproverException.class)
                    .verify();

            StepVerifier.create(gate.findRequest(request.id()))
                    .assertNext(current -> assertThat(current.version()).isZero())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a decision for a level other than the current one")
        void shouldRejectWrongLevel() {
            AccessRequest request = open();

            StepVerifier.create(gate.recordDecision(request.id(), "dir", 2, ApprovalDecision.APPROVED, null))
                    .expectError(ConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should let exactly one of two concurrent decisions on the same level win")
        void shouldSerializeConcurrentDecisions() {
            seedPrincipal(fixture.directoryStore, aPrincipal("mgr2"));
            assign(fixture.directoryStore, "mgr2", "manager");
            AccessRequest request = open();

            List<Object> outcomes = Stream.of("mgr", "mgr2")
                    .parallel()
                    .map(approver -> gate.recordDecision(request.id(), approver, 1, ApprovalDecision.APPROVED, null)
                            .<Object>map(r -> r)
                            .onErrorResume(ConflictException.class, Mono::just)
                            .block())
                    .toList();

            assertThat(outcomes).filteredOn(AccessRequest.class::isInstance).hasSize(1);
            assertThat(outcomes).filteredOn(ConflictException.class::isInstance).hasSize(1);
            assertThat(fixture.approvalStore.findApprovals(request.id()).collectList().block()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailures {

        private FlakyApprovalStore store;

        @BeforeEach
        void useFlakyStore() {
            store = new FlakyApprovalStore();
            init(new AccessGateFixture(new InMemoryDirectoryStore(), store));
        }

        @Test
        @DisplayName("should leave the request open when the approval cannot be recorded")
        void shouldNotMoveRequestWhenApprovalInsertFails() {
            twoLevelChain = aChain("chain-single", "doc", "doc:finance-*")
                    .action(Action.DELETE)
                    .level(aLevel(1, "manager"))
                    .build();
            seedChain(store, twoLevelChain);
            AccessRequest request = open();
            store.failApprovalInsert = true;

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .expectError(UnavailableException.class)
                    .verify();

            StepVerifier.create(gate.findRequest(request.id()))
                    .assertNext(current -> {
                        assertThat(current.status()).isEqualTo(AccessRequestStatus.PENDING);
                        assertThat(current.version()).isZero();
                    })
                    .verifyComplete();
            StepVerifier.create(store.findActiveGrant("requester", FINANCE_REPORT.key(), Action.DELETE,
                    fixture.clock.instant())).verifyComplete();

            store.failApprovalInsert = false;
            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .assertNext(updated -> assertThat(updated.status()).isEqualTo(AccessRequestStatus.APPROVED))
                    .verifyComplete();
            StepVerifier.create(store.findActiveGrant("requester", FINANCE_REPORT.key(), Action.DELETE,
                            fixture.clock.instant()))
                    .assertNext(grant -> assertThat(grant.requestId()).isEqualTo(request.id()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should remove the approval again when the request transition fails")
        void shouldRollBackApprovalWhenTransitionFails() {
            AccessRequest request = open();
            store.failCompareAndSet = true;

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .expectError(UnavailableException.class)
                    .verify();

            assertThat(store.findApprovals(request.id()).collectList().block()).isEmpty();
            assertThat(fixture.auditSink.events(AuditEvent.EventType.APPROVAL_TRANSITION))
                    .noneMatch(event -> event.details().containsKey("decision"));

            store.failCompareAndSet = false;
            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .assertNext(updated -> assertThat(updated.currentLevel()).isEqualTo(2))
                    .verifyComplete();
            assertThat(store.findApprovals(request.id()).collectList().block()).hasSize(1);
        }

        @Test
        @DisplayName("should keep a committed approval when only the grant write keeps failing")
        void shouldReportCommittedApprovalDespiteGrantFailure() {
            twoLevelChain = aChain("chain-single", "doc", "doc:finance-*")
                    .action(Action.DELETE)
                    .level(aLevel(1, "manager"))
                    .build();
            seedChain(store, twoLevelChain);
            AccessRequest request = open();
            store.failGrant = true;

            StepVerifier.create(gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null))
                    .assertNext(updated -> assertThat(updated.status()).isEqualTo(AccessRequestStatus.APPROVED))
                    .verifyComplete();

            assertThat(store.grantAttempts.get()).isEqualTo(4);
            assertThat(fixture.auditSink.events(AuditEvent.EventType.APPROVAL_TRANSITION))
                    .anyMatch(event -> event.reasonCode() == ReasonCode.GRANTED);
        }
    }

    static class FlakyApprovalStore extends InMemoryApprovalStore {

        volatile boolean failApprovalInsert;
        volatile boolean failCompareAndSet;
        volatile boolean failGrant;
        final AtomicInteger grantAttempts = new AtomicInteger();

        @Override
        public Mono<Approval> insertApproval(Approval approval) {
            return failApprovalInsert ? Mono.error(down()) : super.insertApproval(approval);
        }

        @Override
        public Mono<AccessRequest> compareAndSet(AccessRequest expected, AccessRequest updated) {
            return failCompareAndSet ? Mono.error(down()) : super.compareAndSet(expected, updated);
        }

        @Override
        public Mono<GrantedAccess> saveGrant(GrantedAccess grant) {
            return Mono.defer(() -> {
                grantAttempts.incrementAndGet();
                return failGrant ? Mono.error(down()) : super.saveGrant(grant);
            });
        }

        private static UnavailableException down() {
            return new UnavailableException("mongo", "down", null);
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("should let the requester cancel an open request once")
        void shouldCancel() {
            AccessRequest request = open();

            StepVerifier.create(gate.cancel(request.id(), "requester"))
                    .assertNext(cancelled -> assertThat(cancelled.status()).isEqualTo(AccessRequestStatus.CANCELLED))
                    .verifyComplete();

            StepVerifier.create(gate.cancel(request.id(), "requester"))
                    .expectError(ConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse cancellation by anyone but the requester")
        void shouldRefuseForeignCancel() {
            AccessRequest request = open();

            StepVerifier.create(gate.cancel(request.id(), "mgr"))
                    .expectError(UnauthorizedApproverException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("should not issue a grant that outlives the requested expiry")
    void shouldBoundGrantByAccessExpiry() {
        Instant expiry = fixture.clock.instant().plusSeconds(3600);
        RequestDetails bounded = new RequestDetails(FINANCE_REPORT, Action.DELETE, "temp", expiry);
        ApprovalChain single = aChain("chain-single", "doc", "doc:*")
                .action(Action.DELETE)
                .level(aLevel(1, "manager"))
                .build();
        seedChain(fixture.approvalStore, single);
        AccessRequest request = gate.createAccessRequest(TENANT, "requester", single, bounded, Map.of())
                .map(AccessRequestResult::request)
                .block();

        gate.recordDecision(request.id(), "mgr", 1, ApprovalDecision.APPROVED, null).block();

        StepVerifier.create(fixture.approvalStore.findActiveGrant("requester", FINANCE_REPORT.key(), Action.DELETE,
                        expiry.plusSeconds(1)))
                .verifyComplete();
    }
}

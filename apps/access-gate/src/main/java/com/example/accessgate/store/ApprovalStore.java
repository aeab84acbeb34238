package com.example.accessgate.store;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.model.Action;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence port for approval chains, access requests, approvals and resulting grants.
 */
public interface ApprovalStore {

    Mono<ApprovalChain> findChain(String chainId);

    Flux<ApprovalChain> findActiveChains(String resourceType);

    Mono<ApprovalChain> saveChain(ApprovalChain chain);

    /**
     * Inserts {@code request} unless an open request with the same {@link AccessRequest#openKey()}
     * exists, atomically. Emits whichever request is open afterwards: the new one, or the
     * existing one untouched.
     */
    Mono<AccessRequest> insertIfNoneOpen(AccessRequest request);

    Mono<AccessRequest> findRequest(String requestId);

    Flux<AccessRequest> findOpenRequests();

    /**
     * Replaces {@code expected} with {@code updated} only if the stored request still has the
     * expected status, current level and version. Completes empty when the condition fails.
     */
    Mono<AccessRequest> compareAndSet(AccessRequest expected, AccessRequest updated);

    /**
     * Inserts the approval, failing with {@link com.example.accessgate.exception.ConflictException}
     * when one already exists for the same request and level.
     */
    Mono<Approval> insertApproval(Approval approval);

    /**
     * Removes the approval for {@code (requestId, level)}, if any. Used to roll back an approval
     * whose request transition did not commit.
     */
    Mono<Void> deleteApproval(String requestId, int level);

    Flux<Approval> findApprovals(String requestId);

    Mono<GrantedAccess> saveGrant(GrantedAccess grant);

    Mono<GrantedAccess> findActiveGrant(String principalId, String resourceKey, Action action, Instant now);
}

package com.example.accessgate.store.memory;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.model.Action;
import com.example.accessgate.store.ApprovalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Map-backed approval store. Conditional updates rely on the per-key atomicity of
 * {@link ConcurrentHashMap#compute}; approval uniqueness on {@code putIfAbsent}. Open requests
 * are indexed by {@link AccessRequest#openKey()} so that lookup-or-insert is one {@code compute}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "access-gate.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryApprovalStore implements ApprovalStore {

    private final Map<String, ApprovalChain> chains = new ConcurrentHashMap<>();
    private final Map<String, AccessRequest> requests = new ConcurrentHashMap<>();
    private final Map<String, String> openRequestIds = new ConcurrentHashMap<>();
    private final Map<String, Approval> approvals = new ConcurrentHashMap<>();
    private final Map<String, GrantedAccess> grants = new ConcurrentHashMap<>();

    public InMemoryApprovalStore() {
        log.info("Initialized in-memory approval store");
    }

    @Override
    public Mono<ApprovalChain> findChain(String chainId) {
        return Mono.justOrEmpty(chains.get(chainId));
    }

    @Override
    public Flux<ApprovalChain> findActiveChains(String resourceType) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(chains.values())))
                .filter(ApprovalChain::active)
                .filter(chain -> resourceType.equals(chain.resourceType()))
                .sort(Comparator.comparing(ApprovalChain::id));
    }

    @Override
    public Mono<ApprovalChain> saveChain(ApprovalChain chain) {
        return Mono.fromSupplier(() -> {
            chains.put(chain.id(), chain);
            return chain;
        });
    }

    @Override
    public Mono<AccessRequest> insertIfNoneOpen(AccessRequest request) {
        return Mono.fromSupplier(() -> {
            String requestId = openRequestIds.compute(request.openKey(), (key, currentId) -> {
                AccessRequest current = currentId == null ? null : requests.get(currentId);
                if (current != null && current.status().isOpen()) {
                    return currentId;
                }
                if (requests.putIfAbsent(request.id(), request) != null) {
                    throw new ConflictException("Access request already exists: " + request.id());
                }
                return request.id();
            });
            return requests.get(requestId);
        });
    }

    @Override
    public Mono<AccessRequest> findRequest(String requestId) {
        return Mono.justOrEmpty(requests.get(requestId));
    }

    @Override
    public Flux<AccessRequest> findOpenRequests() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(requests.values())))
                .filter(r -> r.status().isOpen());
    }

    @Override
    public Mono<AccessRequest> compareAndSet(AccessRequest expected, AccessRequest updated) {
        return Mono.defer(() -> {
            AtomicBoolean swapped = new AtomicBoolean(false);
            requests.computeIfPresent(expected.id(), (id, current) -> {
                if (current.status() == expected.status()
                        && current.currentLevel() == expected.currentLevel()
                        && current.version() == expected.version()) {
                    swapped.set(true);
                    return updated;
                }
                return current;
            });
            if (!swapped.get()) {
                return Mono.empty();
            }
            if (!updated.status().isOpen()) {
                openRequestIds.remove(updated.openKey(), updated.id());
            }
            return Mono.just(updated);
        });
    }

    @Override
    public Mono<Approval> insertApproval(Approval approval) {
        return Mono.defer(() -> {
            Approval existing = approvals.putIfAbsent(approval.requestId() + "#" + approval.level(), approval);
            if (existing != null) {
                return Mono.error(new ConflictException("Level " + approval.level() + " of request "
                        + approval.requestId() + " already decided"));
            }
            return Mono.just(approval);
        });
    }

    @Override
    public Mono<Void> deleteApproval(String requestId, int level) {
        return Mono.fromRunnable(() -> approvals.remove(requestId + "#" + level));
    }

    @Override
    public Flux<Approval> findApprovals(String requestId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(approvals.values())))
                .filter(a -> requestId.equals(a.requestId()))
                .sort(Comparator.comparingInt(Approval::level));
    }

    @Override
    public Mono<GrantedAccess> saveGrant(GrantedAccess grant) {
        return Mono.fromSupplier(() -> {
            grants.put(grant.id(), grant);
            return grant;
        });
    }

    @Override
    public Mono<GrantedAccess> findActiveGrant(String principalId, String resourceKey, Action action, Instant now) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(grants.values())))
                .filter(g -> principalId.equals(g.principalId()) && resourceKey.equals(g.resourceKey()))
                .filter(g -> action == g.action() && g.isActive(now))
                .next();
    }
}

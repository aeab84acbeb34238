package com.example.accessgate.cache;

import com.example.accessgate.audit.AuditService;
import com.example.accessgate.cache.pubsub.InvalidationEventPublisher;
import com.example.accessgate.common.util.StringSanitizer;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.DirectoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Coarse invalidation of cached decisions after mutations.
 *
 * <p>A role mutation evicts every principal that can reach the role: direct holders of the
 * role or of any descendant role, and members of any group (or descendant group) granting
 * one of those roles. Each eviction is audited and, when broadcasting is enabled, published
 * to other instances.
 */
@Slf4j
@Service
public class DecisionCacheInvalidator {

    private final DecisionCache decisionCache;
    private final DirectoryStore directoryStore;
    private final AuditService auditService;
    @Nullable
    private final InvalidationEventPublisher eventPublisher;

    public DecisionCacheInvalidator(
            DecisionCache decisionCache,
            DirectoryStore directoryStore,
            AuditService auditService,
            @Nullable InvalidationEventPublisher eventPublisher) {
        this.decisionCache = decisionCache;
        this.directoryStore = directoryStore;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * @return number of evicted entries
     */
    @NonNull
    public Mono<Long> invalidate(@NonNull CacheScope scope, @NonNull String cause) {
        return switch (scope.kind()) {
            case ALL -> invalidateAll(cause);
            case PRINCIPAL -> invalidatePrincipal(scope.id(), cause);
            case ROLE -> invalidateRole(scope.id(), cause);
        };
    }

    @NonNull
    public Mono<Long> invalidateAll(@NonNull String cause) {
        return decisionCache.clear(CacheScope.all())
                .flatMap(removed -> broadcastAll().thenReturn(removed))
                .flatMap(removed -> auditService.invalidation("all", removed, cause).thenReturn(removed));
    }

    @NonNull
    public Mono<Long> invalidatePrincipal(@NonNull String principalId, @NonNull String cause) {
        return evictPrincipal(principalId)
                .flatMap(removed -> auditService.invalidation("principal:" + principalId, removed, cause)
                        .thenReturn(removed));
    }

    @NonNull
    public Mono<Long> invalidateRole(@NonNull String roleId, @NonNull String cause) {
        return affectedPrincipals(roleId)
                .flatMap(principals -> {
                    log.debug("Invalidating decisions of {} principal(s) reaching role {}",
                            principals.size(), StringSanitizer.forLog(roleId));
                    return Flux.fromIterable(principals)
                            .concatMap(this::evictPrincipal)
                            .reduce(0L, Long::sum);
                })
                .flatMap(removed -> auditService.invalidation("role:" + roleId, removed, cause).thenReturn(removed));
    }

    /**
     * Principals whose role closure can contain {@code roleId}.
     */
    @NonNull
    public Mono<Set<String>> affectedPrincipals(@NonNull String roleId) {
        return descendantRoles(roleId).flatMap(roles -> {
            Flux<String> direct = Flux.fromIterable(roles)
                    .flatMap(directoryStore::findAssignmentsForRole)
                    .map(RoleAssignment::principalId);
            Flux<String> viaGroups = groupsGranting(roles)
                    .flatMap(directoryStore::findGroupMembers)
                    .map(Principal::id);
            return Flux.merge(direct, viaGroups).collect(Collectors.toSet());
        });
    }

    private Mono<Long> evictPrincipal(String principalId) {
        return decisionCache.clear(CacheScope.principal(principalId))
                .flatMap(removed -> broadcastPrincipal(principalId).thenReturn(removed));
    }

    private Mono<Set<String>> descendantRoles(String roleId) {
        Set<String> visited = ConcurrentHashMap.newKeySet();
        visited.add(roleId);
        return Flux.just(roleId)
                .expand(id -> directoryStore.findChildRoles(id)
                        .map(Role::id)
                        .filter(visited::add))
                .collect(Collectors.toSet());
    }

    private Flux<String> groupsGranting(Set<String> roleIds) {
        Set<String> visited = ConcurrentHashMap.newKeySet();
        return Flux.fromIterable(roleIds)
                .flatMap(directoryStore::findGroupsGrantingRole)
                .map(Group::id)
                .filter(visited::add)
                .expand(groupId -> directoryStore.findChildGroups(groupId)
                        .map(Group::id)
                        .filter(visited::add));
    }

    private Mono<Void> broadcastPrincipal(String principalId) {
        return eventPublisher == null ? Mono.empty() : eventPublisher.publishPrincipal(principalId);
    }

    private Mono<Void> broadcastAll() {
        return eventPublisher == null ? Mono.empty() : eventPublisher.publishAll();
    }
}

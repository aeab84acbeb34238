package com.example.accessgate.rbac;

import com.example.accessgate.common.util.StringSanitizer;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Computes the transitive role closure of a principal from persisted state.
 *
 * <p>Seeds are the principal's effective direct assignments plus the roles of its groups and
 * every ancestor group. Each seed is followed up its parent chain. Role and group traversals
 * both carry a visited set: reaching an id twice stops that branch with a warning, so
 * misconfigured cycles terminate after visiting each distinct id once.
 *
 * <p>Inactive roles and groups, and expired or inactive assignments, contribute nothing.
 * An inactive principal resolves to no roles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleResolver {

    private final DirectoryStore directoryStore;
    private final Clock clock;

    /**
     * @return ids of every role the principal holds; fails with {@link NotFoundException}
     *         when the principal does not exist
     */
    @NonNull
    public Mono<Set<String>> resolve(@NonNull String principalId) {
        return resolveDetailed(principalId).map(ResolvedRoles::all);
    }

    @NonNull
    public Mono<ResolvedRoles> resolveDetailed(@NonNull String principalId) {
        return directoryStore.findPrincipal(principalId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Principal", principalId)))
                .flatMap(this::resolveFor);
    }

    @NonNull
    public Mono<ResolvedRoles> resolveFor(@NonNull Principal principal) {
        if (!principal.active()) {
            log.debug("Principal {} is inactive, resolving no roles", StringSanitizer.forLog(principal.id()));
            return Mono.just(ResolvedRoles.none());
        }
        Instant now = clock.instant();
        Mono<Set<String>> direct = directoryStore.findAssignments(principal.id())
                .filter(assignment -> assignment.isEffective(now))
                .map(RoleAssignment::roleId)
                .collect(Collectors.toSet());
        Mono<Set<String>> viaGroups = groupRoles(principal.groupIds());

        return Mono.zip(direct, viaGroups)
                .flatMap(seeds -> {
                    Set<String> seedIds = new HashSet<>(seeds.getT1());
                    seedIds.addAll(seeds.getT2());
                    return closure(seedIds).map(all -> {
                        Set<String> activeDirect = new HashSet<>(seeds.getT1());
                        activeDirect.retainAll(all);
                        Set<String> activeGroup = new HashSet<>(seeds.getT2());
                        activeGroup.retainAll(all);
                        Set<String> inherited = new HashSet<>(all);
                        inherited.removeAll(seedIds);
                        return new ResolvedRoles(activeDirect, activeGroup, inherited);
                    });
                });
    }

    /**
     * Follows parent pointers from the seed roles. Missing or inactive roles end their branch.
     */
    @NonNull
    public Mono<Set<String>> closure(@NonNull Set<String> seedRoleIds) {
        Set<String> visited = ConcurrentHashMap.newKeySet();
        return Flux.fromIterable(seedRoleIds)
                .concatMap(directoryStore::findRole)
                .filter(Role::active)
                .filter(role -> visited.add(role.id()))
                .expand(role -> parentOf(role, visited))
                .map(Role::id)
                .collect(Collectors.toSet());
    }

    private Mono<Role> parentOf(Role role, Set<String> visited) {
        String parentId = role.parentId();
        if (parentId == null) {
            return Mono.empty();
        }
        return directoryStore.findRole(parentId)
                .filter(Role::active)
                .filter(parent -> {
                    if (!visited.add(parent.id())) {
                        log.warn("Role hierarchy revisits {} from {}; cycle or shared ancestor, branch stopped",
                                StringSanitizer.forLog(parent.id()), StringSanitizer.forLog(role.id()));
                        return false;
                    }
                    return true;
                });
    }

    private Mono<Set<String>> groupRoles(Set<String> groupIds) {
        if (groupIds.isEmpty()) {
            return Mono.just(Set.of());
        }
        Set<String> visited = ConcurrentHashMap.newKeySet();
        return Flux.fromIterable(groupIds)
                .concatMap(directoryStore::findGroup)
                .filter(Group::active)
                .filter(group -> visited.add(group.id()))
                .expand(group -> parentGroupOf(group, visited))
                .flatMapIterable(Group::roleIds)
                .collect(Collectors.toSet());
    }

    private Mono<Group> parentGroupOf(Group group, Set<String> visited) {
        String parentId = group.parentId();
        if (parentId == null) {
            return Mono.empty();
        }
        return directoryStore.findGroup(parentId)
                .filter(Group::active)
                .filter(parent -> {
                    if (!visited.add(parent.id())) {
                        log.warn("Group hierarchy revisits {} from {}; cycle or shared ancestor, branch stopped",
                                StringSanitizer.forLog(parent.id()), StringSanitizer.forLog(group.id()));
                        return false;
                    }
                    return true;
                });
    }
}

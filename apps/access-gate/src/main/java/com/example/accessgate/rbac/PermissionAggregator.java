package com.example.accessgate.rbac;

import com.example.accessgate.condition.Condition;
import com.example.accessgate.condition.ConditionEvaluator;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.Permission;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Matches the permissions of resolved roles against a resource and action.
 *
 * <p>Implicit deny: access is allowed iff at least one permission matches the resource,
 * grants the action and has all its conditions satisfied. Field permissions of every such
 * permission are unioned. Role priority plays no part.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionAggregator {

    private final DirectoryStore directoryStore;
    private final ResourceMatcher resourceMatcher;
    private final ConditionEvaluator conditionEvaluator;

    @NonNull
    public Mono<AggregationResult> aggregate(@NonNull Set<String> roleIds,
                                             @NonNull ResourceMatcher.MatchTarget target,
                                             @NonNull Action action,
                                             @NonNull Map<String, ?> context) {
        if (roleIds.isEmpty()) {
            return Mono.just(AggregationResult.denied());
        }
        return Flux.fromIterable(roleIds)
                .flatMap(directoryStore::findPermissionsByRole)
                .distinct(Permission::id)
                .filter(permission -> applies(permission, target, action, context))
                .sort(Comparator.comparing(Permission::id))
                .collectList()
                .map(this::merge)
                .doOnNext(result -> log.debug("Aggregated {} matching permission(s) for {} on {}:{}",
                        result.matchedPermissions().size(), action.value(), target.type(), target.id()));
    }

    private boolean applies(Permission permission, ResourceMatcher.MatchTarget target, Action action,
                            Map<String, ?> context) {
        return permission.active()
                && resourceMatcher.matches(permission, target)
                && permission.actions().contains(action)
                && conditionEvaluator.evaluate(permission.conditions(), context);
    }

    private AggregationResult merge(List<Permission> matched) {
        if (matched.isEmpty()) {
            return AggregationResult.denied();
        }
        FieldPermissions fields = FieldPermissions.empty();
        Set<String> conditionPaths = new TreeSet<>();
        for (Permission permission : matched) {
            fields = fields.union(permission.fieldPermissions());
            permission.conditions().stream().map(Condition::path).forEach(conditionPaths::add);
        }
        return new AggregationResult(true, matched, fields, List.copyOf(conditionPaths));
    }
}

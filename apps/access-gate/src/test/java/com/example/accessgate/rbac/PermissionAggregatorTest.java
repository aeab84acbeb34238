package com.example.accessgate.rbac;

import com.example.accessgate.condition.Condition;
import com.example.accessgate.condition.ConditionEvaluator;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldAction;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.FieldTier;
import com.example.accessgate.store.memory.InMemoryDirectoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.Set;

import static com.example.accessgate.util.AccessModelTestBuilder.aPermission;
import static com.example.accessgate.util.AccessModelTestBuilder.grant;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionAggregator")
class PermissionAggregatorTest {

    private static final ResourceMatcher.MatchTarget DOC = new ResourceMatcher.MatchTarget("doc", "123", null);

    private InMemoryDirectoryStore store;
    private PermissionAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new InMemoryDirectoryStore();
        aggregator = new PermissionAggregator(store, new ResourceMatcher(), new ConditionEvaluator());
    }

    @Test
    @DisplayName("should deny when no role holds a matching permission")
    void shouldDenyWithoutMatch() {
        grant(store, "viewer", aPermission("p-read", "doc", Action.READ).build());

        StepVerifier.create(aggregator.aggregate(Set.of("viewer"), DOC, Action.DELETE, Map.of()))
                .assertNext(result -> {
                    assertThat(result.allowed()).isFalse();
                    assertThat(result.fieldPermissions().isEmpty()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should deny for an empty role set")
    void shouldDenyForNoRoles() {
        StepVerifier.create(aggregator.aggregate(Set.of(), DOC, Action.READ, Map.of()))
                .assertNext(result -> assertThat(result.allowed()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("should union field permissions of every matching permission")
    void shouldUnionFieldPermissions() {
        grant(store, "r1", aPermission("p1", "doc", Action.READ)
                .fieldPermissions(FieldPermissions.builder()
                        .grant(FieldTier.CORE, "name", FieldAction.READ)
                        .build())
                .build());
        grant(store, "r2", aPermission("p2", "doc", Action.READ)
                .fieldPermissions(FieldPermissions.builder()
                        .grant(FieldTier.CORE, "name", FieldAction.WRITE)
                        .grant(FieldTier.TENANT, "notes", FieldAction.READ)
                        .build())
                .build());

        StepVerifier.create(aggregator.aggregate(Set.of("r1", "r2"), DOC, Action.READ, Map.of()))
                .assertNext(result -> {
                    assertThat(result.allowed()).isTrue();
                    assertThat(result.matchedPermissionIds()).containsExactly("p1", "p2");
                    assertThat(result.fieldPermissions().actionsFor(FieldTier.CORE, "name"))
                            .containsExactlyInAnyOrder(FieldAction.READ, FieldAction.WRITE);
                    assertThat(result.fieldPermissions().actionsFor(FieldTier.TENANT, "notes"))
                            .containsExactly(FieldAction.READ);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should count a permission shared by two roles once")
    void shouldDeduplicateSharedPermissions() {
        var shared = aPermission("shared", "doc", Action.READ).build();
        grant(store, "r1", shared);
        store.link("r2", "shared").block();

        StepVerifier.create(aggregator.aggregate(Set.of("r1", "r2"), DOC, Action.READ, Map.of()))
                .assertNext(result -> assertThat(result.matchedPermissionIds()).containsExactly("shared"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should skip permissions whose conditions fail and report the satisfied ones")
    void shouldApplyConditions() {
        grant(store, "r1", aPermission("p-finance", "doc", Action.READ)
                .condition(new Condition.Equals("principal.department", "finance"))
                .build());
        grant(store, "r1", aPermission("p-hr", "doc", Action.READ)
                .condition(new Condition.Equals("principal.department", "hr"))
                .build());

        Map<String, Object> context = Map.of("principal", Map.of("department", "finance"));

        StepVerifier.create(aggregator.aggregate(Set.of("r1"), DOC, Action.READ, context))
                .assertNext(result -> {
                    assertThat(result.matchedPermissionIds()).containsExactly("p-finance");
                    assertThat(result.matchedConditions()).containsExactly("principal.department");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should ignore inactive permissions")
    void shouldIgnoreInactivePermissions() {
        grant(store, "r1", aPermission("p1", "doc", Action.READ).active(false).build());

        StepVerifier.create(aggregator.aggregate(Set.of("r1"), DOC, Action.READ, Map.of()))
                .assertNext(result -> assertThat(result.allowed()).isFalse())
                .verifyComplete();
    }
}

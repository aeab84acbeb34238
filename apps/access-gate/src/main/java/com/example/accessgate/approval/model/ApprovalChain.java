package com.example.accessgate.approval.model;

import com.example.accessgate.condition.Condition;
import com.example.accessgate.exception.ValidationException;
import com.example.accessgate.model.Action;
import lombok.Builder;
import lombok.Singular;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered approval levels gating actions on resources of {@code resourceType} whose
 * reference matches {@code resourcePattern}. An empty {@code actions} set gates every action.
 */
@Builder(toBuilder = true)
public record ApprovalChain(
        String id,
        String tenantId,
        String resourceType,
        String resourcePattern,
        @Singular Set<Action> actions,
        @Singular List<ApprovalLevel> levels,
        @Singular List<Condition> autoApproveConditions,
        boolean active
) {
    public ApprovalChain {
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        levels = levels == null ? List.of() : levels.stream()
                .sorted(Comparator.comparingInt(ApprovalLevel::level))
                .toList();
        autoApproveConditions = autoApproveConditions == null ? List.of() : List.copyOf(autoApproveConditions);
    }

    public boolean gates(Action action) {
        return actions.isEmpty() || actions.contains(action);
    }

    public Optional<ApprovalLevel> level(int level) {
        return levels.stream().filter(l -> l.level() == level).findFirst();
    }

    public ApprovalLevel firstLevel() {
        return levels.get(0);
    }

    public Optional<ApprovalLevel> nextLevel(int level) {
        return levels.stream().filter(l -> l.level() > level).findFirst();
    }

    public boolean isFinal(int level) {
        return nextLevel(level).isEmpty();
    }

    /**
     * Levels only move forward, so each (request, level) pair is decided at most once.
     *
     * @throws ValidationException when levels are missing or duplicated, or escalate backwards or to an unknown level
     */
    public ApprovalChain validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Approval chain id must not be blank");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new ValidationException("Approval chain " + id + " has no resource type");
        }
        if (levels.isEmpty()) {
            throw new ValidationException("Approval chain " + id + " has no levels");
        }
        Set<Integer> seen = new HashSet<>();
        for (ApprovalLevel level : levels) {
            if (!seen.add(level.level())) {
                throw new ValidationException("Approval chain " + id + " repeats level " + level.level());
            }
            if (level.approverRole() == null || level.approverRole().isBlank()) {
                throw new ValidationException("Level " + level.level() + " of chain " + id + " has no approver role");
            }
        }
        for (ApprovalLevel level : levels) {
            if (level.escalateToLevel() != null && !seen.contains(level.escalateToLevel())) {
                throw new ValidationException("Level " + level.level() + " of chain " + id
                        + " escalates to unknown level " + level.escalateToLevel());
            }
            if (level.escalateToLevel() != null && level.escalateToLevel() <= level.level()) {
                throw new ValidationException("Level " + level.level() + " of chain " + id
                        + " must escalate to a later level");
            }
        }
        return this;
    }
}

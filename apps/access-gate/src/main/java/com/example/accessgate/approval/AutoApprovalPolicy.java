package com.example.accessgate.approval;

import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalLevel;
import com.example.accessgate.condition.Condition;
import com.example.accessgate.condition.ConditionEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auto-approval check for the first level of a chain. Chain conditions apply as defaults;
 * a first-level condition on the same path replaces the chain's. With no condition at all
 * nothing is auto-approved.
 */
@Component
@RequiredArgsConstructor
public class AutoApprovalPolicy {

    private final ConditionEvaluator conditionEvaluator;

    public boolean isAutoApproved(@NonNull ApprovalChain chain, @NonNull Map<String, ?> context) {
        Collection<Condition> effective = effectiveConditions(chain, chain.firstLevel());
        return !effective.isEmpty() && conditionEvaluator.evaluate(effective, context);
    }

    @NonNull
    public Collection<Condition> effectiveConditions(@NonNull ApprovalChain chain, @NonNull ApprovalLevel level) {
        Map<String, Condition> byPath = new LinkedHashMap<>();
        chain.autoApproveConditions().forEach(c -> byPath.put(c.path(), c));
        level.autoApproveConditions().forEach(c -> byPath.put(c.path(), c));
        return byPath.values();
    }
}

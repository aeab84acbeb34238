package com.example.accessgate.engine;

import com.example.accessgate.cache.CachedDecision;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.rbac.AggregationResult;
import org.springframework.lang.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of one evaluation. {@code error} is set only for failed evaluations, which are
 * always denials.
 */
public record Decision(
        boolean allowed,
        boolean requiresApproval,
        @Nullable String accessRequestId,
        FieldPermissions fieldPermissions,
        List<String> matchedConditions,
        ReasonCode reason,
        @Nullable String error
) {
    private static final Set<ReasonCode> ERRORS = EnumSet.of(ReasonCode.NOT_FOUND, ReasonCode.VALIDATION,
            ReasonCode.UNAVAILABLE, ReasonCode.INTERNAL_ERROR, ReasonCode.CONFLICT, ReasonCode.UNAUTHORIZED);

    public Decision {
        fieldPermissions = fieldPermissions == null ? FieldPermissions.empty() : fieldPermissions;
        matchedConditions = matchedConditions == null ? List.of() : List.copyOf(matchedConditions);
    }

    public static Decision of(AggregationResult result) {
        return result.allowed()
                ? new Decision(true, false, null, result.fieldPermissions(), result.matchedConditions(),
                        ReasonCode.GRANTED, null)
                : denied();
    }

    /**
     * Allowed through an approved access request, whatever the role grants say.
     */
    public static Decision approvedAccess(AggregationResult result) {
        return new Decision(true, false, null, result.fieldPermissions(), result.matchedConditions(),
                ReasonCode.GRANTED, null);
    }

    public static Decision denied() {
        return new Decision(false, false, null, FieldPermissions.empty(), List.of(),
                ReasonCode.NO_MATCHING_PERMISSION, null);
    }

    public static Decision approvalRequired(String accessRequestId) {
        return new Decision(false, true, accessRequestId, FieldPermissions.empty(), List.of(),
                ReasonCode.APPROVAL_REQUIRED, null);
    }

    public static Decision failure(ReasonCode reason, String message) {
        return new Decision(false, false, null, FieldPermissions.empty(), List.of(), reason, message);
    }

    public static Decision fromCache(CachedDecision cached) {
        return cached.allowed()
                ? new Decision(true, false, null, cached.fieldPermissions(), cached.matchedConditions(),
                        ReasonCode.GRANTED, null)
                : denied();
    }

    public boolean hasError() {
        return ERRORS.contains(reason);
    }
}

package com.example.accessgate.approval;

import com.example.accessgate.approval.model.AccessRequest;
import org.springframework.lang.Nullable;

/**
 * Result of asking for access through a chain: either auto-approved (nothing persisted) or
 * a pending request awaiting sign-off.
 */
public record AccessRequestResult(String chainId, boolean autoApproved, @Nullable AccessRequest request) {

    public static AccessRequestResult autoApproved(String chainId) {
        return new AccessRequestResult(chainId, true, null);
    }

    public static AccessRequestResult pending(AccessRequest request) {
        return new AccessRequestResult(request.chainId(), false, request);
    }
}

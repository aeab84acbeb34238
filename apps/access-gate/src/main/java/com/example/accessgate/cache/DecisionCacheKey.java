package com.example.accessgate.cache;

import com.example.accessgate.common.util.CacheKeyUtils;

/**
 * Identity of a cached decision. The serialized form leads with the principal so that every
 * entry of one principal shares a prefix.
 */
public record DecisionCacheKey(
        String tenantId,
        String principalId,
        String resourceType,
        String resourceId,
        String action
) {
    public String asString() {
        return principalPrefix(principalId)
                + CacheKeyUtils.encodeOptional(tenantId) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(resourceType) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(resourceId) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(action);
    }

    public static String principalPrefix(String principalId) {
        return CacheKeyUtils.encode(principalId) + CacheKeyUtils.SEPARATOR;
    }
}

package com.example.accessgate.model;

import lombok.Builder;
import lombok.Singular;

import java.util.HashMap;
import java.util.Map;

/**
 * Stored resource. {@code path} is the materialized ancestry, e.g. {@code /root-id/child-id/}.
 */
@Builder(toBuilder = true)
public record Resource(
        String id,
        String tenantId,
        String type,
        String parentId,
        String path,
        @Singular Map<String, Object> attributes
) {
    public Resource {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Map<String, Object> asContext() {
        Map<String, Object> ctx = new HashMap<>(attributes);
        ctx.put("id", id);
        ctx.put("type", type);
        if (path != null) {
            ctx.put("path", path);
        }
        return ctx;
    }
}

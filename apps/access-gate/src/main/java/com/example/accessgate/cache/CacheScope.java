package com.example.accessgate.cache;

import com.example.accessgate.exception.ValidationException;

/**
 * What to evict: everything, one principal's entries, or the entries of every principal
 * holding a role.
 */
public record CacheScope(Kind kind, String id) {

    public enum Kind { ALL, PRINCIPAL, ROLE }

    public CacheScope {
        if (kind == null) {
            throw new ValidationException("Cache scope kind must not be null");
        }
        if (kind != Kind.ALL && (id == null || id.isBlank())) {
            throw new ValidationException("Cache scope " + kind + " needs an id");
        }
    }

    public static CacheScope all() {
        return new CacheScope(Kind.ALL, null);
    }

    public static CacheScope principal(String principalId) {
        return new CacheScope(Kind.PRINCIPAL, principalId);
    }

    public static CacheScope role(String roleId) {
        return new CacheScope(Kind.ROLE, roleId);
    }

    public String describe() {
        return kind == Kind.ALL ? "all" : kind.name().toLowerCase() + ":" + id;
    }
}

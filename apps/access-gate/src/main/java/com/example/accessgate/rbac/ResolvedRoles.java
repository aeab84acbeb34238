package com.example.accessgate.rbac;

import java.util.HashSet;
import java.util.Set;

/**
 * Role closure of a principal, split by how each role was obtained.
 *
 * @param direct    roles from effective direct assignments
 * @param viaGroups roles granted by the principal's groups and their ancestors
 * @param inherited parent roles reached from the two sets above and not already in them
 */
public record ResolvedRoles(Set<String> direct, Set<String> viaGroups, Set<String> inherited) {

    private static final ResolvedRoles NONE = new ResolvedRoles(Set.of(), Set.of(), Set.of());

    public ResolvedRoles {
        direct = Set.copyOf(direct);
        viaGroups = Set.copyOf(viaGroups);
        inherited = Set.copyOf(inherited);
    }

    public static ResolvedRoles none() {
        return NONE;
    }

    public Set<String> all() {
        Set<String> all = new HashSet<>(direct);
        all.addAll(viaGroups);
        all.addAll(inherited);
        return Set.copyOf(all);
    }
}

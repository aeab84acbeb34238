package com.example.accessgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiPredicate;

/**
 * Field-level grants keyed by tier, then field name. Immutable; {@link #union} merges two
 * grant maps additively.
 */
public record FieldPermissions(Map<FieldTier, Map<String, Set<FieldAction>>> tiers) {

    private static final FieldPermissions EMPTY = new FieldPermissions(Map.of());

    public FieldPermissions {
        tiers = freeze(tiers);
    }

    public static FieldPermissions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @NonNull
    public Set<FieldAction> actionsFor(FieldTier tier, String field) {
        return tiers.getOrDefault(tier, Map.of()).getOrDefault(field, Set.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tiers.isEmpty();
    }

    @NonNull
    public FieldPermissions union(@NonNull FieldPermissions other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Builder builder = builder().merge(this);
        return builder.merge(other).build();
    }

    /**
     * Keeps only the fields accepted by {@code keep}.
     */
    @NonNull
    public FieldPermissions retain(@NonNull BiPredicate<FieldTier, String> keep) {
        Builder builder = builder();
        tiers.forEach((tier, fields) -> fields.forEach((field, actions) -> {
            if (keep.test(tier, field)) {
                builder.grant(tier, field, actions);
            }
        }));
        return builder.build();
    }

    private static Map<FieldTier, Map<String, Set<FieldAction>>> freeze(Map<FieldTier, Map<String, Set<FieldAction>>> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<FieldTier, Map<String, Set<FieldAction>>> copy = new EnumMap<>(FieldTier.class);
        raw.forEach((tier, fields) -> {
            if (fields == null || fields.isEmpty()) {
                return;
            }
            Map<String, Set<FieldAction>> fieldCopy = new TreeMap<>();
            fields.forEach((field, actions) -> {
                if (actions != null && !actions.isEmpty()) {
                    fieldCopy.put(field, Collections.unmodifiableSet(EnumSet.copyOf(actions)));
                }
            });
            if (!fieldCopy.isEmpty()) {
                copy.put(tier, Collections.unmodifiableMap(fieldCopy));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {

        private final Map<FieldTier, Map<String, Set<FieldAction>>> tiers = new EnumMap<>(FieldTier.class);

        private Builder() {}

        public Builder grant(FieldTier tier, String field, FieldAction... actions) {
            return grant(tier, field, Arrays.asList(actions));
        }

        public Builder grant(FieldTier tier, String field, java.util.Collection<FieldAction> actions) {
            if (actions.isEmpty()) {
                return this;
            }
            tiers.computeIfAbsent(tier, t -> new TreeMap<>())
                    .computeIfAbsent(field, f -> EnumSet.noneOf(FieldAction.class))
                    .addAll(actions);
            return this;
        }

        public Builder merge(FieldPermissions other) {
            other.tiers().forEach((tier, fields) -> fields.forEach((field, actions) -> grant(tier, field, actions)));
            return this;
        }

        public FieldPermissions build() {
            return tiers.isEmpty() ? EMPTY : new FieldPermissions(tiers);
        }
    }
}

package com.example.accessgate.rbac;

import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.FieldTier;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalizes field-permission keys against the {@link FieldDefinition}s of an entity type.
 * Entity types without any definition are passed through unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldPermissionService {

    private final DirectoryStore directoryStore;

    @NonNull
    public Mono<FieldPermissions> normalize(@NonNull String entityType, @NonNull FieldPermissions permissions) {
        if (permissions.isEmpty()) {
            return Mono.just(permissions);
        }
        return directoryStore.findFieldDefinitions(entityType)
                .collectList()
                .map(definitions -> retainDefined(entityType, permissions, definitions));
    }

    private FieldPermissions retainDefined(String entityType, FieldPermissions permissions,
                                           List<FieldDefinition> definitions) {
        if (definitions.isEmpty()) {
            return permissions;
        }
        Set<String> known = definitions.stream()
                .map(d -> key(d.tier(), d.fieldName()))
                .collect(Collectors.toSet());
        return permissions.retain((tier, field) -> {
            boolean defined = known.contains(key(tier, field));
            if (!defined) {
                log.debug("Dropping undefined field {}.{} for entity type {}", tier, field, entityType);
            }
            return defined;
        });
    }

    private static String key(FieldTier tier, String field) {
        return tier.name() + "/" + field;
    }
}

package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.RolePermissionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

// ID format: "{roleId}#{permissionId}"
@Repository
public interface RolePermissionRepository extends ReactiveMongoRepository<RolePermissionDoc, String> {

    Flux<RolePermissionDoc> findByRoleId(String roleId);

    Flux<RolePermissionDoc> findByPermissionId(String permissionId);
}

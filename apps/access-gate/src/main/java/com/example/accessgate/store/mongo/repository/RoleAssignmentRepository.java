package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.RoleAssignmentDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

// ID format: "{principalId}#{roleId}"
@Repository
public interface RoleAssignmentRepository extends ReactiveMongoRepository<RoleAssignmentDoc, String> {

    Flux<RoleAssignmentDoc> findByPrincipalId(String principalId);

    Flux<RoleAssignmentDoc> findByRoleId(String roleId);
}

package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.GroupDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface GroupRepository extends ReactiveMongoRepository<GroupDoc, String> {

    Flux<GroupDoc> findByParentId(String parentId);

    /**
     * Groups whose {@code roleIds} array contains the role.
     */
    Flux<GroupDoc> findByRoleIds(String roleId);
}

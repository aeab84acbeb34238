package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.RoleDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface RoleRepository extends ReactiveMongoRepository<RoleDoc, String> {

    Flux<RoleDoc> findByParentId(String parentId);
}

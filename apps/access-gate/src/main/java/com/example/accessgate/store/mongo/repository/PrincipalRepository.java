package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.PrincipalDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface PrincipalRepository extends ReactiveMongoRepository<PrincipalDoc, String> {

    Flux<PrincipalDoc> findByGroupIds(String groupId);
}

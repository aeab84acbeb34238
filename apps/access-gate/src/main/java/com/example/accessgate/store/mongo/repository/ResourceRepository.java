package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.ResourceDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ResourceRepository extends ReactiveMongoRepository<ResourceDoc, String> {

    Flux<ResourceDoc> findByPathStartingWith(String pathPrefix);
}

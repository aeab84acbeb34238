package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.FieldDefinitionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface FieldDefinitionRepository extends ReactiveMongoRepository<FieldDefinitionDoc, String> {

    Flux<FieldDefinitionDoc> findByEntityType(String entityType);
}

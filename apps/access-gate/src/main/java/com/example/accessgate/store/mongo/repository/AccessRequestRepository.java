package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.AccessRequestDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface AccessRequestRepository extends ReactiveMongoRepository<AccessRequestDoc, String> {

    Mono<AccessRequestDoc> findByOpenKey(String openKey);

    Flux<AccessRequestDoc> findByStatusIn(Collection<String> statuses);
}

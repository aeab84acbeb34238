package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.ApprovalDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

// ID format: "{requestId}#{level}"
@Repository
public interface ApprovalRepository extends ReactiveMongoRepository<ApprovalDoc, String> {

    Flux<ApprovalDoc> findByRequestIdOrderByLevelAsc(String requestId);
}

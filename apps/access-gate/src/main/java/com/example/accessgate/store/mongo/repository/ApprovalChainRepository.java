package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.ApprovalChainDoc;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ApprovalChainRepository extends ReactiveMongoRepository<ApprovalChainDoc, String> {

    Flux<ApprovalChainDoc> findByResourceTypeAndActiveTrue(String resourceType, Sort sort);
}

package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.GrantedAccessDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface GrantedAccessRepository extends ReactiveMongoRepository<GrantedAccessDoc, String> {

    Flux<GrantedAccessDoc> findByPrincipalIdAndResourceKeyAndAction(String principalId, String resourceKey,
                                                                    String action);
}

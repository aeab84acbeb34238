package com.example.accessgate.store.mongo.repository;

import com.example.accessgate.store.mongo.document.PermissionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PermissionRepository extends ReactiveMongoRepository<PermissionDoc, String> {
}

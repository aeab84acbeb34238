package com.example.accessgate.config;

import com.example.accessgate.config.properties.AccessGateProperties;
import com.example.accessgate.store.mongo.document.AccessRequestDoc;
import com.example.accessgate.store.mongo.document.ApprovalChainDoc;
import com.example.accessgate.store.mongo.document.ApprovalDoc;
import com.example.accessgate.store.mongo.document.FieldDefinitionDoc;
import com.example.accessgate.store.mongo.document.GrantedAccessDoc;
import com.example.accessgate.store.mongo.document.GroupDoc;
import com.example.accessgate.store.mongo.document.PrincipalDoc;
import com.example.accessgate.store.mongo.document.ResourceDoc;
import com.example.accessgate.store.mongo.document.RoleAssignmentDoc;
import com.example.accessgate.store.mongo.document.RoleDoc;
import com.example.accessgate.store.mongo.document.RolePermissionDoc;
import com.example.accessgate.store.mongo.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * MongoDB-backed stores. Repository scanning is off by default and enabled here only when
 * {@code access-gate.store.type=mongo}; indexes declared on the documents are created on
 * startup, including the unique {@code (requestId, level)} index on approvals.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access-gate.store.type", havingValue = "mongo")
@EnableReactiveMongoRepositories(basePackageClasses = PrincipalRepository.class)
public class MongoStoreConfig {

    private static final List<Class<?>> INDEXED_DOCUMENTS = List.of(
            PrincipalDoc.class,
            RoleDoc.class,
            GroupDoc.class,
            RoleAssignmentDoc.class,
            RolePermissionDoc.class,
            ResourceDoc.class,
            FieldDefinitionDoc.class,
            ApprovalChainDoc.class,
            AccessRequestDoc.class,
            ApprovalDoc.class,
            GrantedAccessDoc.class);

    private final ReactiveMongoTemplate mongoTemplate;
    private final AccessGateProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        IndexResolver resolver = new MongoPersistentEntityIndexResolver(
                mongoTemplate.getConverter().getMappingContext());
        Long created = Flux.fromIterable(INDEXED_DOCUMENTS)
                .concatMap(type -> Flux.fromIterable(resolver.resolveIndexFor(type))
                        .concatMap(index -> mongoTemplate.indexOps(type).ensureIndex(index)))
                .count()
                .block(properties.getStore().getIndexInitTimeout());
        log.info("Ensured {} MongoDB indexes across {} collections", created, INDEXED_DOCUMENTS.size());
    }
}

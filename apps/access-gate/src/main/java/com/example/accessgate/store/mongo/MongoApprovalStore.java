package com.example.accessgate.store.mongo;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.AccessRequestStatus;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.model.Action;
import com.example.accessgate.store.ApprovalStore;
import com.example.accessgate.store.mongo.document.AccessRequestDoc;
import com.example.accessgate.store.mongo.document.ApprovalDoc;
import com.example.accessgate.store.mongo.repository.AccessRequestRepository;
import com.example.accessgate.store.mongo.repository.ApprovalChainRepository;
import com.example.accessgate.store.mongo.repository.ApprovalRepository;
import com.example.accessgate.store.mongo.repository.GrantedAccessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * MongoDB approval store. Request transitions are a single {@code findAndReplace} filtered on
 * the expected status, level and version; approval uniqueness comes from the
 * {@code (requestId, level)} key and open-request uniqueness from the unique {@code openKey}
 * index, a duplicate insert resolving to the request that won.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access-gate.store.type", havingValue = "mongo")
public class MongoApprovalStore implements ApprovalStore {

    private static final List<String> OPEN_STATUSES = Arrays.stream(AccessRequestStatus.values())
            .filter(AccessRequestStatus::isOpen)
            .map(Enum::name)
            .toList();

    private final ApprovalChainRepository chainRepository;
    private final AccessRequestRepository requestRepository;
    private final ApprovalRepository approvalRepository;
    private final GrantedAccessRepository grantRepository;
    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Mono<ApprovalChain> findChain(String chainId) {
        return chainRepository.findById(chainId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findChain", e));
    }

    @Override
    public Flux<ApprovalChain> findActiveChains(String resourceType) {
        return chainRepository.findByResourceTypeAndActiveTrue(resourceType, Sort.by("id"))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findActiveChains", e));
    }

    @Override
    public Mono<ApprovalChain> saveChain(ApprovalChain chain) {
        return chainRepository.save(MongoDocumentMapper.toDoc(chain))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveChain", e));
    }

    @Override
    public Mono<AccessRequest> insertIfNoneOpen(AccessRequest request) {
        String openKey = request.openKey();
        return requestRepository.insert(MongoDocumentMapper.toDoc(request))
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Open access request already exists for key {}, re-reading", openKey);
                    return requestRepository.findByOpenKey(openKey)
                            .switchIfEmpty(Mono.error(() -> new ConflictException(
                                    "Access request already exists: " + request.id(), e)));
                })
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("insertIfNoneOpen", e));
    }

    @Override
    public Mono<AccessRequest> findRequest(String requestId) {
        return requestRepository.findById(requestId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findRequest", e));
    }

    @Override
    public Flux<AccessRequest> findOpenRequests() {
        return requestRepository.findByStatusIn(OPEN_STATUSES)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findOpenRequests", e));
    }

    @Override
    public Mono<AccessRequest> compareAndSet(AccessRequest expected, AccessRequest updated) {
        Query query = Query.query(Criteria.where(AccessRequestDoc.ID).is(expected.id())
                .and(AccessRequestDoc.STATUS).is(expected.status().name())
                .and(AccessRequestDoc.CURRENT_LEVEL).is(expected.currentLevel())
                .and(AccessRequestDoc.VERSION).is(expected.version()));
        return mongoTemplate.findAndReplace(query, MongoDocumentMapper.toDoc(updated),
                        FindAndReplaceOptions.options().returnNew())
                .map(MongoDocumentMapper::fromDoc)
                .doOnSuccess(saved -> {
                    if (saved == null) {
                        log.debug("Conditional update of access request {} matched nothing", expected.id());
                    }
                })
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("compareAndSet", e));
    }

    @Override
    public Mono<Approval> insertApproval(Approval approval) {
        return approvalRepository.insert(MongoDocumentMapper.toDoc(approval))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DuplicateKeyException.class, e -> new ConflictException("Level " + approval.level()
                        + " of request " + approval.requestId() + " already decided", e))
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("insertApproval", e));
    }

    @Override
    public Mono<Void> deleteApproval(String requestId, int level) {
        return approvalRepository.deleteById(ApprovalDoc.idFor(requestId, level))
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("deleteApproval", e));
    }

    @Override
    public Flux<Approval> findApprovals(String requestId) {
        return approvalRepository.findByRequestIdOrderByLevelAsc(requestId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findApprovals", e));
    }

    @Override
    public Mono<GrantedAccess> saveGrant(GrantedAccess grant) {
        return grantRepository.save(MongoDocumentMapper.toDoc(grant))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveGrant", e));
    }

    @Override
    public Mono<GrantedAccess> findActiveGrant(String principalId, String resourceKey, Action action, Instant now) {
        return grantRepository.findByPrincipalIdAndResourceKeyAndAction(principalId, resourceKey, action.value())
                .map(MongoDocumentMapper::fromDoc)
                .filter(grant -> grant.isActive(now))
                .next()
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findActiveGrant", e));
    }
}

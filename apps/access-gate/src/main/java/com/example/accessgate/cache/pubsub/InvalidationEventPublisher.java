package com.example.accessgate.cache.pubsub;

import com.example.accessgate.config.properties.AccessGateProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Publishes decision cache invalidations so that other instances evict their local entries.
 * Publishing is best effort: a failure is logged and does not fail the invalidation.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "access-gate.cache.broadcast", havingValue = "true")
public class InvalidationEventPublisher {

    public static final String INVALIDATION_CHANNEL = "access-gate:decision:events";

    private final ReactiveRedisOperations<String, String> redisOps;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String instanceId;

    public InvalidationEventPublisher(
            ReactiveRedisOperations<String, String> redisOps,
            ObjectMapper objectMapper,
            Clock clock,
            AccessGateProperties properties) {
        this.redisOps = redisOps;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.instanceId = properties.getInstanceId();
        log.info("Decision cache invalidation publisher initialized (instance={})", instanceId);
    }

    @NonNull
    public Mono<Void> publishPrincipal(@NonNull String principalId) {
        return publish(InvalidationEventMessage.evictPrincipal(principalId, instanceId, clock.instant()));
    }

    @NonNull
    public Mono<Void> publishAll() {
        return publish(InvalidationEventMessage.evictAll(instanceId, clock.instant()));
    }

    private Mono<Void> publish(InvalidationEventMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            return redisOps.convertAndSend(INVALIDATION_CHANNEL, json)
                    .doOnSuccess(count -> log.debug("Published {} to {} subscriber(s)", message.eventType(), count))
                    .doOnError(e -> log.warn("Failed to publish invalidation event: {}", e.getMessage()))
                    .onErrorResume(e -> Mono.empty())
                    .then();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize invalidation event: {}", e.getMessage());
            return Mono.empty();
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}

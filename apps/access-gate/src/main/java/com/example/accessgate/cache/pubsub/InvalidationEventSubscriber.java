package com.example.accessgate.cache.pubsub;

import com.example.accessgate.cache.CacheScope;
import com.example.accessgate.cache.DecisionCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import static com.example.accessgate.cache.pubsub.InvalidationEventPublisher.INVALIDATION_CHANNEL;

/**
 * Applies invalidations published by other instances to the local decision cache.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "access-gate.cache.broadcast", havingValue = "true")
public class InvalidationEventSubscriber {

    private final ReactiveRedisOperations<String, String> redisOps;
    private final ObjectMapper objectMapper;
    private final DecisionCache decisionCache;
    private final InvalidationEventPublisher publisher;

    private Disposable subscription;

    public InvalidationEventSubscriber(
            ReactiveRedisOperations<String, String> redisOps,
            ObjectMapper objectMapper,
            DecisionCache decisionCache,
            InvalidationEventPublisher publisher) {
        this.redisOps = redisOps;
        this.objectMapper = objectMapper;
        this.decisionCache = decisionCache;
        this.publisher = publisher;
    }

    @PostConstruct
    public void subscribe() {
        subscription = redisOps.listenTo(ChannelTopic.of(INVALIDATION_CHANNEL))
                .map(ReactiveSubscription.Message::getMessage)
                .flatMap(this::handleMessage)
                .subscribe(
                        v -> {},
                        e -> log.error("Error in invalidation subscription: {}", e.getMessage())
                );
        log.info("Subscribed to decision cache invalidations on channel: {}", INVALIDATION_CHANNEL);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Unsubscribed from decision cache invalidations");
        }
    }

    @NonNull
    Mono<Long> handleMessage(@NonNull String json) {
        try {
            InvalidationEventMessage message = objectMapper.readValue(json, InvalidationEventMessage.class);

            if (publisher.getInstanceId().equals(message.sourceInstanceId())) {
                log.trace("Ignoring self-published invalidation: {}", message.eventType());
                return Mono.empty();
            }

            log.debug("Received invalidation from {}: {} {}",
                    message.sourceInstanceId(), message.eventType(), message.principalId());

            CacheScope scope = switch (message.eventType()) {
                case EVICT_PRINCIPAL -> CacheScope.principal(message.principalId());
                case EVICT_ALL -> CacheScope.all();
            };
            return decisionCache.clear(scope)
                    .onErrorResume(e -> {
                        log.warn("Failed to apply remote invalidation {}: {}", scope.describe(), e.getMessage());
                        return Mono.empty();
                    });
        } catch (Exception e) {
            log.warn("Failed to parse invalidation message: {}", e.getMessage());
            return Mono.empty();
        }
    }
}

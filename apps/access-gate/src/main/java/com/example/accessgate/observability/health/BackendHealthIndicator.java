package com.example.accessgate.observability.health;

import com.example.accessgate.config.properties.AccessGateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports connectivity of the configured decision cache and store backends via
 * /actuator/health/accessGateBackends. In-memory backends are always up.
 */
@Slf4j
@Component("accessGateBackendsHealthIndicator")
public class BackendHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    @Nullable
    private final ReactiveStringRedisTemplate redisTemplate;
    @Nullable
    private final ReactiveMongoTemplate mongoTemplate;
    private final AccessGateProperties properties;

    public BackendHealthIndicator(
            @Nullable ReactiveStringRedisTemplate redisTemplate,
            @Nullable ReactiveMongoTemplate mongoTemplate,
            AccessGateProperties properties) {
        this.redisTemplate = redisTemplate;
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        Health.Builder builder = Health.up();
        String cacheStore = properties.getCache().getStore();
        String storeType = properties.getStore().getType();
        builder.withDetail("cacheStore", cacheStore);
        builder.withDetail("storeType", storeType);

        Mono<Void> redisCheck = Mono.empty();
        if (("redis".equals(cacheStore) || properties.getCache().isBroadcast()) && redisTemplate != null) {
            redisCheck = checkRedis(builder);
        } else {
            builder.withDetail("redis", "not used");
        }

        Mono<Void> mongoCheck = Mono.empty();
        if ("mongo".equals(storeType) && mongoTemplate != null) {
            mongoCheck = checkMongo(builder);
        } else {
            builder.withDetail("mongodb", "not used");
        }

        return redisCheck
                .then(mongoCheck)
                .then(Mono.fromSupplier(builder::build))
                .timeout(HEALTH_CHECK_TIMEOUT)
                .onErrorResume(e -> {
                    log.warn("Backend health check failed: {}", e.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .withDetail("cacheStore", cacheStore)
                            .withDetail("storeType", storeType)
                            .build());
                });
    }

    private Mono<Void> checkRedis(Health.Builder builder) {
        return redisTemplate.getConnectionFactory()
                .getReactiveConnection()
                .ping()
                .doOnSuccess(pong -> builder.withDetail("redis", "connected"))
                .doOnError(e -> {
                    builder.down();
                    builder.withDetail("redis", "disconnected");
                    builder.withDetail("redisError", String.valueOf(e.getMessage()));
                })
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    private Mono<Void> checkMongo(Health.Builder builder) {
        return mongoTemplate.executeCommand("{ping: 1}")
                .doOnSuccess(result -> builder.withDetail("mongodb", "connected"))
                .doOnError(e -> {
                    builder.down();
                    builder.withDetail("mongodb", "disconnected");
                    builder.withDetail("mongoError", String.valueOf(e.getMessage()));
                })
                .onErrorResume(e -> Mono.empty())
                .then();
    }
}

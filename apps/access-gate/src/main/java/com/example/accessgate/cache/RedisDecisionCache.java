package com.example.accessgate.cache;

import com.example.accessgate.config.properties.AccessGateProperties;
import com.example.accessgate.exception.AccessGateException;
import com.example.accessgate.exception.UnavailableException;
import com.example.accessgate.observability.CacheMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

import static com.example.accessgate.config.DecisionCacheConfig.DECISION_CACHE_TEMPLATE;

/**
 * Decision cache shared by all instances through Redis. Entries live under
 * {@code <prefix>d:<principal>:...}; generation counters under {@code <prefix>g:<principal>}.
 * Unlike a read-through cache, a Redis failure is not bypassed: it surfaces as
 * {@link UnavailableException} so that evaluation fails closed.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "access-gate.cache.store", havingValue = "redis")
public class RedisDecisionCache implements DecisionCache {

    private static final String CACHE_TYPE = "redis";
    private static final String BACKEND = "redis";
    private static final String GLOBAL_GENERATION = "*global*";
    private static final int DELETE_BATCH = 500;

    private final ReactiveRedisTemplate<String, Object> redisTemplate;
    private final ReactiveStringRedisTemplate counterTemplate;
    private final ObjectMapper objectMapper;
    private final CacheMetricsService metricsService;
    private final String entryPrefix;
    private final String generationPrefix;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public RedisDecisionCache(
            @Qualifier(DECISION_CACHE_TEMPLATE) ReactiveRedisTemplate<String, Object> redisTemplate,
            ReactiveStringRedisTemplate counterTemplate,
            ObjectMapper objectMapper,
            CacheMetricsService metricsService,
            AccessGateProperties properties) {
        this.redisTemplate = redisTemplate;
        this.counterTemplate = counterTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.entryPrefix = properties.getCache().getKeyPrefix() + "d:";
        this.generationPrefix = properties.getCache().getKeyPrefix() + "g:";
        log.info("Redis decision cache initialized (prefix={})", properties.getCache().getKeyPrefix());
    }

    @Override
    @NonNull
    public Mono<CachedDecision> get(@NonNull DecisionCacheKey key) {
        String fullKey = entryPrefix + key.asString();
        return redisTemplate.opsForValue().get(fullKey)
                .flatMap(cached -> {
                    try {
                        CachedDecision value = objectMapper.convertValue(cached, CachedDecision.class);
                        hits.increment();
                        metricsService.recordHit(CACHE_TYPE);
                        log.debug("Decision cache hit: {}", fullKey);
                        return Mono.just(value);
                    } catch (IllegalArgumentException e) {
                        log.warn("Failed to deserialize cached decision {}, evicting corrupted entry", fullKey);
                        metricsService.recordEviction(CACHE_TYPE, 1);
                        return redisTemplate.delete(fullKey).then(Mono.<CachedDecision>empty());
                    }
                })
                .switchIfEmpty(Mono.defer(() -> {
                    misses.increment();
                    metricsService.recordMiss(CACHE_TYPE);
                    log.debug("Decision cache miss: {}", fullKey);
                    return Mono.empty();
                }))
                .onErrorMap(this::isBackendFailure, this::unavailable);
    }

    @Override
    @NonNull
    public Mono<Void> set(@NonNull DecisionCacheKey key, @NonNull CachedDecision value, @NonNull Duration ttl) {
        String fullKey = entryPrefix + key.asString();
        return redisTemplate.opsForValue().set(fullKey, value, ttl)
                .doOnNext(ok -> log.debug("Cached decision {} with TTL {}", fullKey, ttl))
                .onErrorMap(this::isBackendFailure, this::unavailable)
                .then();
    }

    @Override
    @NonNull
    public Mono<Void> delete(@NonNull DecisionCacheKey key) {
        return redisTemplate.delete(entryPrefix + key.asString())
                .onErrorMap(this::isBackendFailure, this::unavailable)
                .then();
    }

    @Override
    @NonNull
    public Mono<Long> clear(@NonNull CacheScope scope) {
        String pattern;
        String generationKey;
        switch (scope.kind()) {
            case ALL -> {
                pattern = entryPrefix + "*";
                generationKey = generationPrefix + GLOBAL_GENERATION;
            }
            case PRINCIPAL -> {
                pattern = entryPrefix + DecisionCacheKey.principalPrefix(scope.id()) + "*";
                generationKey = generationPrefix + DecisionCacheKey.principalPrefix(scope.id());
            }
            default -> {
                return Mono.error(new IllegalArgumentException("Unsupported cache scope: " + scope.kind()));
            }
        }
        return counterTemplate.opsForValue().increment(generationKey)
                .thenMany(scan(pattern))
                .buffer(DELETE_BATCH)
                .concatMap(this::deleteAll)
                .reduce(0L, Long::sum)
                .doOnNext(removed -> {
                    metricsService.recordEviction(CACHE_TYPE, removed);
                    log.debug("Cleared {} decision(s) for scope {}", removed, scope.describe());
                })
                .onErrorMap(this::isBackendFailure, this::unavailable);
    }

    @Override
    @NonNull
    public Mono<Long> generation(@NonNull String principalId) {
        return counterTemplate.opsForValue()
                .multiGet(List.of(generationPrefix + GLOBAL_GENERATION,
                        generationPrefix + DecisionCacheKey.principalPrefix(principalId)))
                .map(values -> values.stream()
                        .mapToLong(v -> v == null ? 0L : Long.parseLong(v))
                        .sum())
                .defaultIfEmpty(0L)
                .onErrorMap(this::isBackendFailure, this::unavailable);
    }

    @Override
    @NonNull
    public Mono<CacheStats> stats() {
        return scan(entryPrefix + "*")
                .count()
                .map(size -> CacheStats.of(hits.sum(), misses.sum(), size))
                .onErrorMap(this::isBackendFailure, this::unavailable);
    }

    private Flux<String> scan(String pattern) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(DELETE_BATCH).build());
    }

    private Mono<Long> deleteAll(List<String> keys) {
        return redisTemplate.delete(keys.toArray(new String[0]));
    }

    private boolean isBackendFailure(Throwable error) {
        return !(error instanceof AccessGateException) && !(error instanceof IllegalArgumentException);
    }

    private Throwable unavailable(Throwable error) {
        log.warn("Redis decision cache unavailable: {}", error.getMessage());
        return new UnavailableException(BACKEND, String.valueOf(error.getMessage()), error);
    }
}

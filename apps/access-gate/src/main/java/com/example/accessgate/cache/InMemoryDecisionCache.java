package com.example.accessgate.cache;

import com.example.accessgate.config.properties.AccessGateProperties;
import com.example.accessgate.observability.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed decision cache for single-instance deployments, or for several instances
 * kept consistent through invalidation broadcasts.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "access-gate.cache.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryDecisionCache implements DecisionCache {

    private static final String CACHE_TYPE = "memory";

    private final Cache<String, Entry> cache;
    private final CacheMetricsService metricsService;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final AtomicLong globalGeneration = new AtomicLong();
    private final Map<String, AtomicLong> principalGenerations = new ConcurrentHashMap<>();

    public InMemoryDecisionCache(AccessGateProperties properties, CacheMetricsService metricsService, Clock clock) {
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaxEntries())
                .expireAfter(new EntryExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        metricsService.registerSizeGauge(CACHE_TYPE, cache::estimatedSize);
        log.info("In-memory decision cache initialized (max-entries={}, ttl={})",
                properties.getCache().getMaxEntries(), properties.getCache().getTtl());
    }

    @Override
    @NonNull
    public Mono<CachedDecision> get(@NonNull DecisionCacheKey key) {
        return Mono.fromCallable(() -> {
            String cacheKey = key.asString();
            Entry entry = cache.getIfPresent(cacheKey);
            if (entry == null) {
                misses.increment();
                metricsService.recordMiss(CACHE_TYPE);
                log.debug("Decision cache miss: {}", cacheKey);
                return null;
            }
            hits.increment();
            metricsService.recordHit(CACHE_TYPE);
            log.debug("Decision cache hit: {}", cacheKey);
            return entry.value();
        });
    }

    @Override
    @NonNull
    public Mono<Void> set(@NonNull DecisionCacheKey key, @NonNull CachedDecision value, @NonNull Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(key.asString(), new Entry(value, ttl.toNanos())));
    }

    @Override
    @NonNull
    public Mono<Void> delete(@NonNull DecisionCacheKey key) {
        return Mono.fromRunnable(() -> cache.invalidate(key.asString()));
    }

    @Override
    @NonNull
    public Mono<Long> clear(@NonNull CacheScope scope) {
        return Mono.fromCallable(() -> {
            long removed;
            switch (scope.kind()) {
                case ALL -> {
                    globalGeneration.incrementAndGet();
                    removed = cache.estimatedSize();
                    cache.invalidateAll();
                }
                case PRINCIPAL -> {
                    principalGenerations.computeIfAbsent(scope.id(), id -> new AtomicLong()).incrementAndGet();
                    String prefix = DecisionCacheKey.principalPrefix(scope.id());
                    long before = cache.estimatedSize();
                    cache.asMap().keySet().removeIf(k -> k.startsWith(prefix));
                    removed = Math.max(0, before - cache.estimatedSize());
                }
                default -> throw new IllegalArgumentException("Unsupported cache scope: " + scope.kind());
            }
            metricsService.recordEviction(CACHE_TYPE, removed);
            log.debug("Cleared {} decision(s) for scope {}", removed, scope.describe());
            return removed;
        });
    }

    @Override
    @NonNull
    public Mono<Long> generation(@NonNull String principalId) {
        return Mono.fromSupplier(() -> {
            AtomicLong principal = principalGenerations.get(principalId);
            return globalGeneration.get() + (principal == null ? 0 : principal.get());
        });
    }

    @Override
    @NonNull
    public Mono<CacheStats> stats() {
        return Mono.fromSupplier(() -> {
            cache.cleanUp();
            return CacheStats.of(hits.sum(), misses.sum(), cache.estimatedSize());
        });
    }

    private record Entry(CachedDecision value, long ttlNanos) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

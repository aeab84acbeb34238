package com.example.accessgate.cache;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Store of prior decisions with per-entry TTL. Implementations are interchangeable: callers
 * observe the same behavior from the in-process and the distributed variant.
 *
 * <p>Every clear bumps a generation counter before deleting. A writer that reads the
 * generation before computing a decision and again after storing it can detect an
 * invalidation that raced with its computation and delete its own entry.
 * Backend failures surface as {@link com.example.accessgate.exception.UnavailableException}.
 */
public interface DecisionCache {

    /**
     * @return the live entry, or empty when absent or expired
     */
    @NonNull
    Mono<CachedDecision> get(@NonNull DecisionCacheKey key);

    @NonNull
    Mono<Void> set(@NonNull DecisionCacheKey key, @NonNull CachedDecision value, @NonNull Duration ttl);

    @NonNull
    Mono<Void> delete(@NonNull DecisionCacheKey key);

    /**
     * Clears {@link CacheScope.Kind#ALL} or {@link CacheScope.Kind#PRINCIPAL} scopes.
     *
     * @return number of entries removed
     */
    @NonNull
    Mono<Long> clear(@NonNull CacheScope scope);

    /**
     * Monotonic counter covering clears of the principal's entries, including global clears.
     */
    @NonNull
    Mono<Long> generation(@NonNull String principalId);

    @NonNull
    Mono<CacheStats> stats();
}

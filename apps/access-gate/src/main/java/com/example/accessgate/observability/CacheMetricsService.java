package com.example.accessgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer counters for decision cache operations, tagged by cache backend.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "access_gate.cache";
    private static final String TAG_CACHE_TYPE = "type";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> gauges = new ConcurrentHashMap<>();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordHit(String cacheType) {
        counter("hits", cacheType).increment();
    }

    public void recordMiss(String cacheType) {
        counter("misses", cacheType).increment();
    }

    public void recordEviction(String cacheType, long count) {
        if (count > 0) {
            counter("evictions", cacheType).increment(count);
        }
    }

    public void registerSizeGauge(String cacheType, Supplier<Number> sizeSupplier) {
        if (gauges.putIfAbsent(cacheType, Boolean.TRUE) == null) {
            meterRegistry.gauge(METRIC_PREFIX + ".size", Tags.of(TAG_CACHE_TYPE, cacheType),
                    sizeSupplier, s -> s.get().doubleValue());
            log.debug("Registered size gauge for decision cache: {}", cacheType);
        }
    }

    private Counter counter(String name, String cacheType) {
        return counters.computeIfAbsent(name + ":" + cacheType, k ->
                Counter.builder(METRIC_PREFIX + "." + name)
                        .tags(TAG_CACHE_TYPE, cacheType)
                        .register(meterRegistry));
    }
}

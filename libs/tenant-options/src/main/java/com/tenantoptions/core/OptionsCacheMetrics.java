package com.tenantoptions.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;

/**
 * Micrometer counters for {@link MultiTenantOptionsCache}. Every meter carries a {@value #TAG_CACHE}
 * tag naming the cache, so several caches can share one registry; counters also carry an
 * {@value #TAG_OPTIONS_TYPE} tag with the simple name of the options type.
 *
 * <p>Tenant ids are deliberately not used as tags: tenant counts are unbounded.
 */
public final class OptionsCacheMetrics {

    public static final String HITS = "tenant.options.cache.hits";
    public static final String MISSES = "tenant.options.cache.misses";
    public static final String EVICTIONS = "tenant.options.cache.evictions";
    public static final String SIZE = "tenant.options.cache.size";

    /** Tag key for the options type. */
    public static final String TAG_OPTIONS_TYPE = "options_type";

    /** Tag key for the cache name. */
    public static final String TAG_CACHE = "cache";

    private static final OptionsCacheMetrics NOOP = new OptionsCacheMetrics(null, null);

    private final MeterRegistry registry;
    private final String cacheName;

    private OptionsCacheMetrics(MeterRegistry registry, String cacheName) {
        this.registry = registry;
        this.cacheName = cacheName;
    }

    /**
     * Creates metrics bound to {@code registry} and tagged with {@code cacheName}, or a no-op
     * instance when the registry is null.
     */
    public static OptionsCacheMetrics of(MeterRegistry registry, String cacheName) {
        if (registry == null) {
            return NOOP;
        }
        if (cacheName == null || cacheName.isBlank()) {
            throw new IllegalArgumentException("cacheName must not be blank");
        }
        return new OptionsCacheMetrics(registry, cacheName);
    }

    void bindSize(Supplier<Number> size) {
        if (registry != null) {
            Gauge.builder(SIZE, size)
                    .description("Number of cached tenant options instances")
                    .tag(TAG_CACHE, cacheName)
                    .register(registry);
        }
    }

    void hit(Class<?> optionsType) {
        increment(HITS, "Tenant options resolved from cache", optionsType, 1);
    }

    void miss(Class<?> optionsType) {
        increment(MISSES, "Tenant options built by the pipeline", optionsType, 1);
    }

    void evicted(Class<?> optionsType, int count) {
        increment(EVICTIONS, "Tenant options removed by invalidation", optionsType, count);
    }

    public boolean isEnabled() {
        return registry != null;
    }

    private void increment(String name, String description, Class<?> optionsType, int amount) {
        if (registry == null || amount <= 0) {
            return;
        }
        Counter.builder(name)
                .description(description)
                .tag(TAG_CACHE, cacheName)
                .tag(TAG_OPTIONS_TYPE, optionsType.getSimpleName())
                .register(registry)
                .increment(amount);
    }
}

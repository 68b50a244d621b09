package com.tenantoptions.core;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of resolved options instances, keyed by (type, name, tenant).
 *
 * <p>Instances are built outside any lock. When two callers race on the same key both may build an
 * instance, but only the first one published is stored and every racing caller receives that
 * stored instance. A factory that throws stores nothing, so the next caller simply retries.
 *
 * <p>Each invalidation takes a new generation from a counter and records it against what it
 * targets: the key, the tenant, the options type, or the whole cache. A build that started before
 * an invalidation covering its own key still returns its instance to its own caller but does not
 * store it; an invalidation is never undone by a build that was already in flight. Builds of keys
 * the invalidation does not cover are stored as usual.
 *
 * <p>Entries are only removed through explicit invalidation. There is no expiry.
 */
public final class MultiTenantOptionsCache {

    private static final Logger log = LoggerFactory.getLogger(MultiTenantOptionsCache.class);
    private static final String DEFAULT_NAME_PREFIX = "tenant-options-";
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final String name;

    private final ConcurrentMap<OptionsCacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final ConcurrentMap<OptionsCacheKey, Long> keyInvalidations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> tenantInvalidations = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, Long> typeInvalidations = new ConcurrentHashMap<>();
    private final AtomicLong lastInvalidateAll = new AtomicLong();
    private final OptionsCacheMetrics metrics;

    /**
     * Creates a cache without metrics.
     */
    public MultiTenantOptionsCache() {
        this(null);
    }

    /**
     * Creates a cache that publishes its meters to {@code meterRegistry} under a generated cache
     * name.
     *
     * @param meterRegistry the registry, or null to disable metrics
     */
    public MultiTenantOptionsCache(MeterRegistry meterRegistry) {
        this(meterRegistry, DEFAULT_NAME_PREFIX + INSTANCES.incrementAndGet());
    }

    /**
     * Creates a cache that publishes hit/miss/eviction counters and its size to {@code
     * meterRegistry}, tagged with {@code name}.
     *
     * @param meterRegistry the registry, or null to disable metrics
     * @param name          the cache name used as the {@value OptionsCacheMetrics#TAG_CACHE} tag
     */
    public MultiTenantOptionsCache(MeterRegistry meterRegistry, String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.metrics = OptionsCacheMetrics.of(meterRegistry, name);
        this.metrics.bindSize(entries::size);
    }

    /**
     * Returns the instance cached for {@code key}, building and storing it on a miss.
     *
     * @param key     the cache key
     * @param factory builds the instance; must not return null
     * @return the stored instance, or the caller's own instance if an invalidation happened while
     *     it was being built
     * @throws IllegalStateException if the factory returns null
     */
    public <O> O getOrCreate(OptionsCacheKey key, Supplier<? extends O> factory) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");

        CacheEntry existing = entries.get(key);
        if (existing != null) {
            metrics.hit(key.optionsType());
            return cast(existing);
        }
        metrics.miss(key.optionsType());

        long startGeneration = generation.get();
        O created = factory.get();
        if (created == null) {
            throw new IllegalStateException("Options factory returned null for " + key);
        }

        CacheEntry candidate = new CacheEntry(created, startGeneration);
        CacheEntry stored =
                entries.compute(
                        key,
                        (k, current) -> {
                            if (current != null) {
                                return current;
                            }
                            return invalidatedSince(k, startGeneration) ? null : candidate;
                        });

        if (stored == null) {
            log.warn(
                    "Discarding options built for {} because its key was invalidated meanwhile",
                    key);
            return created;
        }
        if (stored == candidate) {
            log.debug("Cached options for {} at generation {}", key, startGeneration);
        }
        return cast(stored);
    }

    /**
     * Stores {@code options} under {@code key} unless an instance is already cached.
     *
     * @return true if the instance was stored
     */
    public boolean tryAdd(OptionsCacheKey key, Object options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(options, "options");
        return entries.putIfAbsent(key, new CacheEntry(options, generation.get())) == null;
    }

    /** Returns true if an instance is cached under {@code key}. */
    public boolean contains(OptionsCacheKey key) {
        return entries.containsKey(key);
    }

    /**
     * Removes one entry.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(OptionsCacheKey key) {
        Objects.requireNonNull(key, "key");
        mark(keyInvalidations, key);
        boolean removed = entries.remove(key) != null;
        if (removed) {
            metrics.evicted(key.optionsType(), 1);
            log.debug("Invalidated options for {}", key);
        }
        return removed;
    }

    /** Same as {@link #invalidate(OptionsCacheKey)}. */
    public boolean tryRemove(OptionsCacheKey key) {
        return invalidate(key);
    }

    /**
     * Removes every entry of one tenant, across all types and names.
     *
     * @return the number of entries removed
     */
    public int invalidateTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        mark(tenantInvalidations, tenantId);
        int removed = invalidateMatching(key -> tenantId.equals(key.tenantId()));
        log.debug("Invalidated {} options entries of tenant '{}'", removed, tenantId);
        return removed;
    }

    /**
     * Removes every entry of one options type, across all tenants and names.
     *
     * @return the number of entries removed
     */
    public int invalidateType(Class<?> optionsType) {
        Objects.requireNonNull(optionsType, "optionsType");
        mark(typeInvalidations, optionsType);
        int removed = invalidateMatching(key -> optionsType.equals(key.optionsType()));
        log.debug("Invalidated {} options entries of type {}", removed, optionsType.getName());
        return removed;
    }

    /**
     * Removes every entry.
     *
     * @return the number of entries removed
     */
    public int invalidateAll() {
        long stamp = generation.incrementAndGet();
        lastInvalidateAll.accumulateAndGet(stamp, Math::max);
        int removed = invalidateMatching(key -> true);
        log.debug("Invalidated all {} options entries", removed);
        return removed;
    }

    /** Returns the name the cache's meters are tagged with. */
    public String name() {
        return name;
    }

    /** Returns the number of cached instances. */
    public int size() {
        return entries.size();
    }

    /** Returns the generation of the latest invalidation, whatever it targeted. */
    public long generation() {
        return generation.get();
    }

    // Marks are recorded before the matching entries are removed, so a build publishing after the
    // mark is rejected and one publishing before it is swept.
    private <K> void mark(ConcurrentMap<K, Long> invalidations, K target) {
        long stamp = generation.incrementAndGet();
        invalidations.merge(target, stamp, Math::max);
    }

    private boolean invalidatedSince(OptionsCacheKey key, long startGeneration) {
        if (lastInvalidateAll.get() > startGeneration
                || keyInvalidations.getOrDefault(key, 0L) > startGeneration
                || typeInvalidations.getOrDefault(key.optionsType(), 0L) > startGeneration) {
            return true;
        }
        return !key.isHost() && tenantInvalidations.getOrDefault(key.tenantId(), 0L) > startGeneration;
    }

    private int invalidateMatching(Predicate<OptionsCacheKey> predicate) {
        int removed = 0;
        for (OptionsCacheKey key : entries.keySet()) {
            if (predicate.test(key) && entries.remove(key) != null) {
                metrics.evicted(key.optionsType(), 1);
                removed++;
            }
        }
        return removed;
    }

    @SuppressWarnings("unchecked")
    private static <O> O cast(CacheEntry entry) {
        return (O) entry.value();
    }

    private record CacheEntry(Object value, long generation) {}
}

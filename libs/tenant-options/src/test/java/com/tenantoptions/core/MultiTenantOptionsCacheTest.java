package com.tenantoptions.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MultiTenantOptionsCache}: get-or-create, invalidation scopes, failure handling,
 * stale builds and metrics.
 */
@DisplayName("MultiTenantOptionsCache")
class MultiTenantOptionsCacheTest {

    private static final OptionsCacheKey BILLING_A = OptionsCacheKey.forTenant(BillingOptions.class, "", "a");
    private static final OptionsCacheKey BILLING_B = OptionsCacheKey.forTenant(BillingOptions.class, "", "b");
    private static final OptionsCacheKey LOGGING_A = OptionsCacheKey.forTenant(LoggingOptions.class, "", "a");

    private MultiTenantOptionsCache cache;

    @BeforeEach
    void setUp() {
        cache = new MultiTenantOptionsCache();
    }

    @Nested
    @DisplayName("getOrCreate")
    class GetOrCreate {

        @Test
        @DisplayName("builds once and then serves the cached instance")
        void buildsOnce() {
            AtomicInteger builds = new AtomicInteger();

            BillingOptions first = cache.getOrCreate(BILLING_A, () -> {
                builds.incrementAndGet();
                return new BillingOptions();
            });
            BillingOptions second = cache.getOrCreate(BILLING_A, () -> {
                builds.incrementAndGet();
                return new BillingOptions();
            });

            assertThat(second).isSameAs(first);
            assertThat(builds.get()).isEqualTo(1);
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("keys differing only by tenant hold separate instances")
        void separateTenants() {
            BillingOptions a = cache.getOrCreate(BILLING_A, BillingOptions::new);
            BillingOptions b = cache.getOrCreate(BILLING_B, BillingOptions::new);

            assertThat(a).isNotSameAs(b);
        }

        @Test
        @DisplayName("a failing factory stores nothing and the next call retries")
        void failingFactory() {
            assertThatThrownBy(() -> cache.getOrCreate(BILLING_A, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

            assertThat(cache.contains(BILLING_A)).isFalse();
            assertThat(cache.<BillingOptions>getOrCreate(BILLING_A, BillingOptions::new)).isNotNull();
            assertThat(cache.contains(BILLING_A)).isTrue();
        }

        @Test
        @DisplayName("a factory returning null is rejected")
        void nullFromFactory() {
            assertThatThrownBy(() -> cache.getOrCreate(BILLING_A, () -> null))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("racing builds converge on the first published instance")
        void racingBuilds() throws Exception {
            int callers = 12;
            CountDownLatch allBuilding = new CountDownLatch(callers);
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            try {
                List<Future<BillingOptions>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> cache.<BillingOptions>getOrCreate(BILLING_A, () -> {
                        allBuilding.countDown();
                        awaitQuietly(allBuilding);
                        return new BillingOptions();
                    })));
                }

                BillingOptions first = futures.get(0).get(10, TimeUnit.SECONDS);
                for (Future<BillingOptions> future : futures) {
                    assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(first);
                }
                assertThat(cache.<BillingOptions>getOrCreate(BILLING_A, BillingOptions::new)).isSameAs(first);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @BeforeEach
        void fill() {
            cache.getOrCreate(BILLING_A, BillingOptions::new);
            cache.getOrCreate(BILLING_B, BillingOptions::new);
            cache.getOrCreate(LOGGING_A, LoggingOptions::new);
        }

        @Test
        @DisplayName("invalidate removes exactly one entry")
        void single() {
            assertThat(cache.invalidate(BILLING_A)).isTrue();
            assertThat(cache.invalidate(BILLING_A)).isFalse();
            assertThat(cache.contains(BILLING_B)).isTrue();
            assertThat(cache.contains(LOGGING_A)).isTrue();
        }

        @Test
        @DisplayName("invalidateTenant removes every entry of that tenant only")
        void tenant() {
            BillingOptions bBefore = cache.getOrCreate(BILLING_B, BillingOptions::new);

            assertThat(cache.invalidateTenant("a")).isEqualTo(2);

            assertThat(cache.contains(BILLING_A)).isFalse();
            assertThat(cache.contains(LOGGING_A)).isFalse();
            assertThat(cache.<BillingOptions>getOrCreate(BILLING_B, BillingOptions::new)).isSameAs(bBefore);
        }

        @Test
        @DisplayName("invalidateType removes the type across tenants")
        void type() {
            assertThat(cache.invalidateType(BillingOptions.class)).isEqualTo(2);
            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.contains(LOGGING_A)).isTrue();
        }

        @Test
        @DisplayName("invalidateAll empties the cache and advances the generation")
        void all() {
            long before = cache.generation();

            assertThat(cache.invalidateAll()).isEqualTo(3);

            assertThat(cache.size()).isZero();
            assertThat(cache.generation()).isGreaterThan(before);
        }

        @Test
        @DisplayName("tryAdd never overwrites and tryRemove removes")
        void tryAddAndRemove() {
            assertThat(cache.tryAdd(BILLING_A, new BillingOptions())).isFalse();
            assertThat(cache.tryRemove(BILLING_A)).isTrue();
            assertThat(cache.tryAdd(BILLING_A, new BillingOptions())).isTrue();
        }
    }

    @Nested
    @DisplayName("Stale builds")
    class StaleBuilds {

        @Test
        @DisplayName("a build overtaken by an invalidation is returned but not stored")
        void overtakenByInvalidation() {
            BillingOptions built = cache.getOrCreate(BILLING_A, () -> {
                cache.invalidateTenant("a");
                return new BillingOptions();
            });

            assertThat(built).isNotNull();
            assertThat(cache.contains(BILLING_A)).isFalse();

            BillingOptions next = cache.getOrCreate(BILLING_A, BillingOptions::new);
            assertThat(next).isNotSameAs(built);
            assertThat(cache.contains(BILLING_A)).isTrue();
        }

        @Test
        @DisplayName("invalidating one tenant does not discard another tenant's build")
        void otherTenantInvalidated() {
            BillingOptions built = cache.getOrCreate(BILLING_B, () -> {
                cache.invalidateTenant("a");
                return new BillingOptions();
            });

            assertThat(cache.contains(BILLING_B)).isTrue();
            assertThat(cache.<BillingOptions>getOrCreate(BILLING_B, BillingOptions::new)).isSameAs(built);
        }

        @Test
        @DisplayName("invalidating another type or key does not discard the build")
        void otherTypeOrKeyInvalidated() {
            BillingOptions built = cache.getOrCreate(BILLING_A, () -> {
                cache.invalidateType(LoggingOptions.class);
                cache.invalidate(BILLING_B);
                return new BillingOptions();
            });

            assertThat(cache.<BillingOptions>getOrCreate(BILLING_A, BillingOptions::new)).isSameAs(built);
        }

        @Test
        @DisplayName("type, key and full invalidations discard builds they cover")
        void coveringInvalidations() {
            cache.getOrCreate(BILLING_A, () -> {
                cache.invalidateType(BillingOptions.class);
                return new BillingOptions();
            });
            cache.getOrCreate(BILLING_B, () -> {
                cache.invalidate(BILLING_B);
                return new BillingOptions();
            });
            cache.getOrCreate(LOGGING_A, () -> {
                cache.invalidateAll();
                return new LoggingOptions();
            });

            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("a build started after an invalidation is stored")
        void startedAfterInvalidation() {
            cache.invalidateTenant("a");

            BillingOptions built = cache.getOrCreate(BILLING_A, BillingOptions::new);

            assertThat(cache.<BillingOptions>getOrCreate(BILLING_A, BillingOptions::new)).isSameAs(built);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("counts hits, misses and evictions per options type")
        void counters() {
            var registry = new SimpleMeterRegistry();
            var metered = new MultiTenantOptionsCache(registry);

            metered.getOrCreate(BILLING_A, BillingOptions::new);
            metered.getOrCreate(BILLING_A, BillingOptions::new);
            metered.getOrCreate(BILLING_B, BillingOptions::new);
            metered.invalidateType(BillingOptions.class);

            assertThat(registry.get(OptionsCacheMetrics.MISSES)
                    .tag(OptionsCacheMetrics.TAG_OPTIONS_TYPE, "BillingOptions").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get(OptionsCacheMetrics.HITS).counter().count()).isEqualTo(1.0);
            assertThat(registry.get(OptionsCacheMetrics.EVICTIONS).counter().count()).isEqualTo(2.0);
            assertThat(registry.get(OptionsCacheMetrics.SIZE).gauge().value()).isZero();
        }

        @Test
        @DisplayName("caches sharing a registry report their own size")
        void sharedRegistry() {
            var registry = new SimpleMeterRegistry();
            var first = new MultiTenantOptionsCache(registry, "first");
            var second = new MultiTenantOptionsCache(registry, "second");

            first.getOrCreate(BILLING_A, BillingOptions::new);
            second.getOrCreate(BILLING_A, BillingOptions::new);
            second.getOrCreate(BILLING_B, BillingOptions::new);

            assertThat(registry.get(OptionsCacheMetrics.SIZE).tag(OptionsCacheMetrics.TAG_CACHE, "first")
                    .gauge().value()).isEqualTo(1.0);
            assertThat(registry.get(OptionsCacheMetrics.SIZE).tag(OptionsCacheMetrics.TAG_CACHE, "second")
                    .gauge().value()).isEqualTo(2.0);
            assertThat(new MultiTenantOptionsCache(registry).name())
                    .isNotEqualTo(new MultiTenantOptionsCache(registry).name());
        }

        @Test
        @DisplayName("works without a meter registry")
        void withoutRegistry() {
            assertThat(OptionsCacheMetrics.of(null, null).isEnabled()).isFalse();
            assertThat(cache.<LoggingOptions>getOrCreate(LOGGING_A, LoggingOptions::new)).isNotNull();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package com.tenantoptions.core;

import static com.tenantoptions.core.InvalidRegistrationException.requireArgument;

import com.tenantoptions.core.registration.ServiceFactory;
import com.tenantoptions.core.registration.ServiceLifetime;
import com.tenantoptions.core.registration.ServiceRegistration;
import com.tenantoptions.core.registration.TenantResolutionStrategy;
import com.tenantoptions.core.registration.TenantStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup-time configuration of per-tenant options.
 *
 * <pre>{@code
 * TenantContextHolder<ShopTenant> tenants = new TenantContextHolder<>();
 * MultiTenantOptions<ShopTenant> options = MultiTenantOptionsBuilder.forTenantContext(tenants)
 *         .withPerTenantOptions(BillingOptions.class, (o, t) -> o.setPlanName(t.plan()))
 *         .withPerTenantNamedOptions(MailOptions.class, "alerts", (o, t) -> o.setFrom(t.alertSender()))
 *         .withStore(ServiceLifetime.SINGLETON, ctx -> new JdbcTenantStore(ctx.requireAttribute("dataSource", DataSource.class)))
 *         .build();
 * }</pre>
 *
 * <p>Every method returns this builder. After {@link #build()} the builder rejects further calls,
 * which makes "register during startup, read-only afterwards" explicit.
 *
 * @param <T> the tenant type
 */
public final class MultiTenantOptionsBuilder<T extends TenantInfo> {

    private static final Logger log = LoggerFactory.getLogger(MultiTenantOptionsBuilder.class);

    private final TenantContextAccessor<T> tenantContext;
    private final TenantMutatorRegistry.Builder<T> mutators = TenantMutatorRegistry.builder();
    private final Map<Class<?>, OptionsPipeline<?>> pipelines = new LinkedHashMap<>();
    private final List<ServiceRegistration<TenantStore<T>>> stores = new ArrayList<>();
    private final List<ServiceRegistration<TenantResolutionStrategy>> strategies = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private MissingTenantPolicy missingTenantPolicy = MissingTenantPolicy.FAIL;
    private MeterRegistry meterRegistry;
    private String cacheName;
    private boolean built;

    private MultiTenantOptionsBuilder(TenantContextAccessor<T> tenantContext) {
        this.tenantContext = requireArgument(tenantContext, "tenantContext");
    }

    /**
     * Starts a builder that reads the current tenant from {@code tenantContext}.
     */
    public static <T extends TenantInfo> MultiTenantOptionsBuilder<T> forTenantContext(
            TenantContextAccessor<T> tenantContext) {
        return new MultiTenantOptionsBuilder<>(tenantContext);
    }

    /**
     * Adds a tenant mutator for every named and unnamed instance of {@code optionsType}.
     */
    public <O> MultiTenantOptionsBuilder<T> withPerTenantOptions(
            Class<O> optionsType, BiConsumer<? super O, ? super T> action) {
        return withPerTenantOptions(optionsType, NameFilter.all(), action);
    }

    /**
     * Adds a tenant mutator for the instance of {@code optionsType} named {@code name}. Use
     * {@link Options#DEFAULT_NAME} for the unnamed instance.
     *
     * @throws InvalidRegistrationException if name or action is null
     */
    public <O> MultiTenantOptionsBuilder<T> withPerTenantNamedOptions(
            Class<O> optionsType, String name, BiConsumer<? super O, ? super T> action) {
        return withPerTenantOptions(optionsType, NameFilter.named(name), action);
    }

    public <O> MultiTenantOptionsBuilder<T> withPerTenantOptions(
            Class<O> optionsType, NameFilter nameFilter, BiConsumer<? super O, ? super T> action) {
        ensureNotBuilt();
        mutators.register(optionsType, nameFilter, action);
        return this;
    }

    /**
     * Sets the base pipeline of {@code optionsType}, replacing an earlier one. Types without a
     * pipeline are built through their no-arg constructor.
     */
    public <O> MultiTenantOptionsBuilder<T> withOptionsPipeline(
            Class<O> optionsType, OptionsPipeline<O> pipeline) {
        ensureNotBuilt();
        pipelines.put(requireArgument(optionsType, "optionsType"), requireArgument(pipeline, "pipeline"));
        return this;
    }

    /**
     * Registers a tenant store factory. Several stores may be registered.
     */
    @SuppressWarnings("unchecked")
    public MultiTenantOptionsBuilder<T> withStore(
            ServiceLifetime lifetime, ServiceFactory<? extends TenantStore<T>> factory) {
        ensureNotBuilt();
        Class<TenantStore<T>> storeType = (Class<TenantStore<T>>) (Class<?>) TenantStore.class;
        stores.add(new ServiceRegistration<>(storeType, lifetime, factory));
        return this;
    }

    /**
     * Registers a tenant resolution strategy factory. Several strategies may be registered; they
     * are handed out in registration order.
     */
    public MultiTenantOptionsBuilder<T> withStrategy(
            ServiceLifetime lifetime, ServiceFactory<? extends TenantResolutionStrategy> factory) {
        ensureNotBuilt();
        strategies.add(new ServiceRegistration<>(TenantResolutionStrategy.class, lifetime, factory));
        return this;
    }

    /**
     * Adds a startup attribute visible to store and strategy factories through
     * {@link com.tenantoptions.core.registration.ServiceContext}.
     */
    public MultiTenantOptionsBuilder<T> withAttribute(String key, Object value) {
        ensureNotBuilt();
        attributes.put(requireArgument(key, "key"), requireArgument(value, "value"));
        return this;
    }

    public MultiTenantOptionsBuilder<T> withMissingTenantPolicy(MissingTenantPolicy policy) {
        ensureNotBuilt();
        this.missingTenantPolicy = requireArgument(policy, "missingTenantPolicy");
        return this;
    }

    /**
     * Publishes cache metrics to {@code registry}. Null disables metrics.
     */
    public MultiTenantOptionsBuilder<T> withMeterRegistry(MeterRegistry registry) {
        ensureNotBuilt();
        this.meterRegistry = registry;
        return this;
    }

    /**
     * Names the cache in its meter tags. Without a name, each build gets a generated one, so that
     * caches sharing a registry never hide each other's meters.
     */
    public MultiTenantOptionsBuilder<T> withCacheName(String name) {
        ensureNotBuilt();
        requireArgument(name, "cacheName");
        if (name.isBlank()) {
            throw new InvalidRegistrationException("cacheName", "must not be blank");
        }
        this.cacheName = name;
        return this;
    }

    /**
     * Freezes the configuration and wires the cache and the manager.
     *
     * @throws IllegalStateException if called twice
     */
    public MultiTenantOptions<T> build() {
        ensureNotBuilt();
        built = true;

        TenantMutatorRegistry<T> mutatorRegistry = mutators.build();
        OptionsPipelineRegistry pipelineRegistry = new OptionsPipelineRegistry(pipelines);
        MultiTenantOptionsCache cache =
                cacheName == null
                        ? new MultiTenantOptionsCache(meterRegistry)
                        : new MultiTenantOptionsCache(meterRegistry, cacheName);
        MultiTenantOptionsManager<T> manager =
                new MultiTenantOptionsManager<>(
                        tenantContext, pipelineRegistry, mutatorRegistry, cache, missingTenantPolicy);

        log.info(
                "Tenant options built: {} mutator(s) over {} type(s), {} pipeline(s), {} store(s), {} strategy(ies), missing tenant policy {}",
                mutatorRegistry.size(),
                mutatorRegistry.optionsTypes().size(),
                pipelines.size(),
                stores.size(),
                strategies.size(),
                missingTenantPolicy);

        return new MultiTenantOptions<>(
                tenantContext,
                manager,
                cache,
                mutatorRegistry,
                pipelineRegistry,
                stores,
                strategies,
                attributes);
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("Tenant options were already built");
        }
    }
}

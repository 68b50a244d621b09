package com.tenantoptions.core;

import com.tenantoptions.core.registration.ServiceContext;
import com.tenantoptions.core.registration.ServiceRegistration;
import com.tenantoptions.core.registration.ServiceScope;
import com.tenantoptions.core.registration.TenantResolutionStrategy;
import com.tenantoptions.core.registration.TenantStore;
import java.util.List;
import java.util.Map;

/**
 * The frozen result of {@link MultiTenantOptionsBuilder#build()}: the wired manager and cache plus
 * the pass-through store and strategy registrations.
 *
 * <p>Share one instance across the process; every consumer must see the same cache.
 *
 * @param <T> the tenant type
 */
public final class MultiTenantOptions<T extends TenantInfo> {

    private final TenantContextAccessor<T> tenantContext;
    private final MultiTenantOptionsManager<T> manager;
    private final MultiTenantOptionsCache cache;
    private final TenantMutatorRegistry<T> mutators;
    private final OptionsPipelineRegistry pipelines;
    private final List<ServiceRegistration<TenantStore<T>>> stores;
    private final List<ServiceRegistration<TenantResolutionStrategy>> strategies;
    private final Map<String, Object> attributes;

    MultiTenantOptions(
            TenantContextAccessor<T> tenantContext,
            MultiTenantOptionsManager<T> manager,
            MultiTenantOptionsCache cache,
            TenantMutatorRegistry<T> mutators,
            OptionsPipelineRegistry pipelines,
            List<ServiceRegistration<TenantStore<T>>> stores,
            List<ServiceRegistration<TenantResolutionStrategy>> strategies,
            Map<String, Object> attributes) {
        this.tenantContext = tenantContext;
        this.manager = manager;
        this.cache = cache;
        this.mutators = mutators;
        this.pipelines = pipelines;
        this.stores = List.copyOf(stores);
        this.strategies = List.copyOf(strategies);
        this.attributes = Map.copyOf(attributes);
    }

    public MultiTenantOptionsManager<T> manager() {
        return manager;
    }

    public MultiTenantOptionsCache cache() {
        return cache;
    }

    public TenantMutatorRegistry<T> mutators() {
        return mutators;
    }

    public OptionsPipelineRegistry pipelines() {
        return pipelines;
    }

    public TenantContextAccessor<T> tenantContext() {
        return tenantContext;
    }

    /** Opens a scope for {@code SCOPED} stores and strategies. */
    public ServiceScope newScope() {
        return new ServiceScope();
    }

    /**
     * Returns the registered tenant stores, in registration order, resolved within {@code scope}.
     */
    public List<TenantStore<T>> stores(ServiceScope scope) {
        ServiceContext context = new ServiceContext(scope, attributes);
        return stores.stream().map(registration -> registration.resolve(context)).toList();
    }

    /**
     * Returns the registered resolution strategies, in registration order, resolved within
     * {@code scope}.
     */
    public List<TenantResolutionStrategy> strategies(ServiceScope scope) {
        ServiceContext context = new ServiceContext(scope, attributes);
        return strategies.stream().map(registration -> registration.resolve(context)).toList();
    }
}

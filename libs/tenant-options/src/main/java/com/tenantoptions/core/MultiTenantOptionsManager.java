package com.tenantoptions.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for consumers that need an options instance.
 *
 * <p>Resolution reads the current tenant, then asks the {@link MultiTenantOptionsCache} for the
 * (type, name, tenant) entry. On a miss the instance is built by running, in order:
 *
 * <ol>
 *   <li>the base pipeline's {@link OptionsPipeline#configure configure} phase,
 *   <li>every matching tenant mutator, in registration order,
 *   <li>the base pipeline's {@link OptionsPipeline#postConfigure postConfigure} phase.
 * </ol>
 *
 * <p>Any failure aborts the build, nothing is cached, and the failure reaches the caller.
 *
 * @param <T> the tenant type
 */
public final class MultiTenantOptionsManager<T extends TenantInfo> {

    private static final Logger log = LoggerFactory.getLogger(MultiTenantOptionsManager.class);

    private final TenantContextAccessor<T> tenantContext;
    private final OptionsPipelineRegistry pipelines;
    private final TenantMutatorRegistry<T> mutators;
    private final MultiTenantOptionsCache cache;
    private final MissingTenantPolicy missingTenantPolicy;

    public MultiTenantOptionsManager(
            TenantContextAccessor<T> tenantContext,
            OptionsPipelineRegistry pipelines,
            TenantMutatorRegistry<T> mutators,
            MultiTenantOptionsCache cache,
            MissingTenantPolicy missingTenantPolicy) {
        this.tenantContext = Objects.requireNonNull(tenantContext, "tenantContext");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
        this.mutators = Objects.requireNonNull(mutators, "mutators");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.missingTenantPolicy = Objects.requireNonNull(missingTenantPolicy, "missingTenantPolicy");
    }

    /**
     * Resolves the unnamed instance of {@code optionsType} for the current tenant.
     */
    public <O> O get(Class<O> optionsType) {
        return get(optionsType, Options.DEFAULT_NAME);
    }

    /**
     * Resolves the instance of {@code optionsType} named {@code name} for the current tenant.
     *
     * @param optionsType the options type
     * @param name        the options name, null for the unnamed instance
     * @throws NoTenantContextException      if no tenant is active and the policy is {@code FAIL}
     * @throws OptionsConfigurationException if the base pipeline fails
     * @throws TenantMutationException       if a tenant mutator fails
     */
    public <O> O get(Class<O> optionsType, String name) {
        if (optionsType == null) {
            throw new IllegalArgumentException("optionsType must not be null");
        }
        String optionsName = Options.nameOrDefault(name);

        Optional<T> tenant = tenantContext.currentTenant();
        if (tenant.isEmpty()) {
            if (missingTenantPolicy == MissingTenantPolicy.SHARED) {
                return cache.getOrCreate(
                        OptionsCacheKey.host(optionsType, optionsName),
                        () -> buildShared(optionsType, optionsName));
            }
            throw new NoTenantContextException(optionsType, optionsName);
        }

        T current = tenant.get();
        return cache.getOrCreate(
                OptionsCacheKey.forTenant(optionsType, optionsName, current.id()),
                () -> build(optionsType, optionsName, current));
    }

    /**
     * Returns a typed handle bound to {@code optionsType}.
     */
    public <O> TenantOptions<O> forType(Class<O> optionsType) {
        if (optionsType == null) {
            throw new IllegalArgumentException("optionsType must not be null");
        }
        return new TenantOptions<>(this, optionsType);
    }

    /**
     * Stores a ready-made instance for the current tenant unless one is already cached.
     *
     * @return true if stored
     * @throws NoTenantContextException if no tenant is active
     */
    public <O> boolean tryAdd(Class<O> optionsType, String name, O options) {
        return cache.tryAdd(currentKey(optionsType, name), options);
    }

    /**
     * Drops the current tenant's cached instance of {@code optionsType} named {@code name}.
     *
     * @throws NoTenantContextException if no tenant is active
     */
    public boolean tryRemove(Class<?> optionsType, String name) {
        return cache.tryRemove(currentKey(optionsType, name));
    }

    /**
     * Drops every cached instance of the current tenant.
     *
     * @throws NoTenantContextException if no tenant is active
     */
    public int clearCurrentTenant() {
        T tenant =
                tenantContext
                        .currentTenant()
                        .orElseThrow(
                                () ->
                                        new NoTenantContextException(
                                                "clearing the current tenant's options"));
        return cache.invalidateTenant(tenant.id());
    }

    /** Drops every cached instance of {@code tenantId}. */
    public int clearTenant(String tenantId) {
        return cache.invalidateTenant(tenantId);
    }

    /** Drops every cached instance of {@code optionsType}, for all tenants. */
    public int clearType(Class<?> optionsType) {
        return cache.invalidateType(optionsType);
    }

    /** Drops every cached instance. */
    public int clearAll() {
        return cache.invalidateAll();
    }

    public MissingTenantPolicy missingTenantPolicy() {
        return missingTenantPolicy;
    }

    private OptionsCacheKey currentKey(Class<?> optionsType, String name) {
        String optionsName = Options.nameOrDefault(name);
        T tenant =
                tenantContext
                        .currentTenant()
                        .orElseThrow(() -> new NoTenantContextException(optionsType, optionsName));
        return OptionsCacheKey.forTenant(optionsType, optionsName, tenant.id());
    }

    private <O> O build(Class<O> optionsType, String name, T tenant) {
        OptionsPipeline<O> pipeline = pipelines.pipelineFor(optionsType);
        O options = configure(pipeline, optionsType, name);

        List<MutatorEntry<O, T>> chain = mutators.resolveMutators(optionsType, name);
        for (int i = 0; i < chain.size(); i++) {
            try {
                chain.get(i).apply(options, tenant);
            } catch (RuntimeException e) {
                log.debug(
                        "Tenant mutator #{} failed for {} '{}' and tenant '{}'",
                        i,
                        optionsType.getName(),
                        name,
                        tenant.id(),
                        e);
                throw new TenantMutationException(optionsType, name, tenant.id(), i, e);
            }
        }

        postConfigure(pipeline, optionsType, name, options);
        log.debug(
                "Built options {} '{}' for tenant '{}' with {} mutator(s)",
                optionsType.getName(),
                name,
                tenant.id(),
                chain.size());
        return options;
    }

    private <O> O buildShared(Class<O> optionsType, String name) {
        OptionsPipeline<O> pipeline = pipelines.pipelineFor(optionsType);
        O options = configure(pipeline, optionsType, name);
        postConfigure(pipeline, optionsType, name, options);
        return options;
    }

    private static <O> O configure(OptionsPipeline<O> pipeline, Class<O> optionsType, String name) {
        O options;
        try {
            options = pipeline.configure(name);
        } catch (OptionsConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OptionsConfigurationException(optionsType, name, e);
        }
        if (options == null) {
            throw new OptionsConfigurationException(optionsType, name, "pipeline returned null");
        }
        return options;
    }

    private static <O> void postConfigure(
            OptionsPipeline<O> pipeline, Class<O> optionsType, String name, O options) {
        try {
            pipeline.postConfigure(name, options);
        } catch (OptionsConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OptionsConfigurationException(optionsType, name, e);
        }
    }
}

package com.tenantoptions.core;

/**
 * Typed view of {@link MultiTenantOptionsManager} for a single options type, for consumers that
 * only ever need one type.
 *
 * @param <O> the options type
 */
public final class TenantOptions<O> {

    private final MultiTenantOptionsManager<?> manager;
    private final Class<O> optionsType;

    TenantOptions(MultiTenantOptionsManager<?> manager, Class<O> optionsType) {
        this.manager = manager;
        this.optionsType = optionsType;
    }

    /** Returns the current tenant's unnamed instance. */
    public O get() {
        return manager.get(optionsType);
    }

    /** Returns the current tenant's instance named {@code name}. */
    public O get(String name) {
        return manager.get(optionsType, name);
    }

    /** Drops the current tenant's cached instance named {@code name}. */
    public boolean invalidate(String name) {
        return manager.tryRemove(optionsType, name);
    }

    public Class<O> optionsType() {
        return optionsType;
    }
}

package com.tenantoptions.core;

/**
 * Cache key of one resolved options instance: (options type, options name, tenant id).
 *
 * <p>A null {@code tenantId} marks the host key used by {@link MissingTenantPolicy#SHARED}; tenant
 * keys always carry a non-blank id, so the two can never collide.
 *
 * @param optionsType the options type
 * @param name        the options name, {@link Options#DEFAULT_NAME} for the unnamed instance
 * @param tenantId    the tenant id, or null for the host key
 */
public record OptionsCacheKey(Class<?> optionsType, String name, String tenantId) {

    public OptionsCacheKey {
        if (optionsType == null) {
            throw new IllegalArgumentException("optionsType must not be null");
        }
        name = Options.nameOrDefault(name);
        if (tenantId != null && tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    /**
     * Key of the instance resolved for one tenant.
     *
     * @throws IllegalArgumentException if tenantId is null or blank
     */
    public static OptionsCacheKey forTenant(Class<?> optionsType, String name, String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId must not be null");
        }
        return new OptionsCacheKey(optionsType, name, tenantId);
    }

    /** Key of the shared instance resolved outside any tenant. */
    public static OptionsCacheKey host(Class<?> optionsType, String name) {
        return new OptionsCacheKey(optionsType, name, null);
    }

    public boolean isHost() {
        return tenantId == null;
    }
}

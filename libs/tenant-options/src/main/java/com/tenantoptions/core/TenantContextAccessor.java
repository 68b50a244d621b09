package com.tenantoptions.core;

import java.util.Optional;

/**
 * Supplies the tenant active for the current logical operation (usually one request).
 *
 * @param <T> the application's tenant type
 */
@FunctionalInterface
public interface TenantContextAccessor<T extends TenantInfo> {

    /**
     * Returns the active tenant, or empty when the calling code runs outside any tenant.
     */
    Optional<T> currentTenant();
}

package com.tenantoptions.core;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local {@link TenantContextAccessor} with an SLF4J MDC bridge.
 *
 * <p>While a tenant is set, the {@value #MDC_TENANT_ID} MDC key holds its id so that every log line
 * on this thread carries it. Unlike a static holder, each instance owns its own thread-local slot;
 * the application wires one instance into the options manager and into whatever sets the tenant
 * per request.
 *
 * <p>Work handed to another thread does not inherit the tenant. Use {@link #runWithTenant} or
 * {@link #callWithTenant} on the worker thread.
 *
 * @param <T> the application's tenant type
 */
public final class TenantContextHolder<T extends TenantInfo> implements TenantContextAccessor<T> {

    /** MDC key for the active tenant id. */
    public static final String MDC_TENANT_ID = "tenantId";

    private final ThreadLocal<T> current = new ThreadLocal<>();

    /**
     * Sets the tenant for the current thread and populates the MDC.
     *
     * @param tenant the tenant to activate (must not be null)
     * @throws IllegalArgumentException if tenant is null
     */
    public void set(T tenant) {
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
        current.set(tenant);
        MDC.put(MDC_TENANT_ID, tenant.id());
    }

    @Override
    public Optional<T> currentTenant() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Clears the tenant and its MDC key for the current thread.
     */
    public void clear() {
        current.remove();
        MDC.remove(MDC_TENANT_ID);
    }

    /**
     * Runs {@code work} with {@code tenant} active, then restores the previous tenant (or clears
     * the slot if there was none), also when {@code work} throws.
     */
    public void runWithTenant(T tenant, Runnable work) {
        callWithTenant(
                tenant,
                () -> {
                    work.run();
                    return null;
                });
    }

    /**
     * Same as {@link #runWithTenant} for work that returns a value.
     */
    public <V> V callWithTenant(T tenant, Supplier<V> work) {
        T previous = current.get();
        try {
            set(tenant);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }
}

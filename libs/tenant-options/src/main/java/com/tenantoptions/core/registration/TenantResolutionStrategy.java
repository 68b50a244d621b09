package com.tenantoptions.core.registration;

import java.util.Optional;

/**
 * Derives a tenant identifier from an inbound request or message. Implementations are supplied by
 * the application; several strategies may be registered and are handed out in registration order.
 */
@FunctionalInterface
public interface TenantResolutionStrategy {

    /**
     * Returns the tenant identifier found in {@code context}, or empty if this strategy does not
     * recognize it.
     *
     * @param context the transport-specific request object
     */
    Optional<String> identify(Object context);
}

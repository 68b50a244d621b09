package com.tenantoptions.core;

/**
 * Thrown when options are resolved with tenant isolation required but no tenant is active on the
 * calling thread.
 *
 * <p>The shared (non-multiplexed) instance is never handed out in place of a tenant instance unless
 * {@link MissingTenantPolicy#SHARED} was chosen explicitly.
 */
public class NoTenantContextException extends TenantOptionsException {

    public NoTenantContextException(Class<?> optionsType, String optionsName) {
        super(
                optionsType,
                optionsName,
                "No tenant context is active while resolving options %s"
                        .formatted(describe(optionsType, optionsName)));
    }

    /**
     * For operations that are not a resolution of one options type.
     *
     * @param operation what was attempted, e.g. "clearing the current tenant's options"
     */
    public NoTenantContextException(String operation) {
        super(null, null, "No tenant context is active while " + operation);
    }
}

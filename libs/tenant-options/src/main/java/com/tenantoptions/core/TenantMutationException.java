package com.tenantoptions.core;

/**
 * Thrown when a tenant mutator fails. The remaining mutators of the chain are skipped and the
 * instance is discarded, so the next resolution for the same tenant starts over.
 */
public class TenantMutationException extends TenantOptionsException {

    private final String tenantId;
    private final int mutatorIndex;

    public TenantMutationException(
            Class<?> optionsType,
            String optionsName,
            String tenantId,
            int mutatorIndex,
            Throwable cause) {
        super(
                optionsType,
                optionsName,
                "Tenant mutator #%d failed for options %s and tenant '%s': %s"
                        .formatted(
                                mutatorIndex,
                                describe(optionsType, optionsName),
                                tenantId,
                                cause.getMessage()),
                cause);
        this.tenantId = tenantId;
        this.mutatorIndex = mutatorIndex;
    }

    public String tenantId() {
        return tenantId;
    }

    /** Zero-based position of the failing mutator among those matching the options type and name. */
    public int mutatorIndex() {
        return mutatorIndex;
    }
}

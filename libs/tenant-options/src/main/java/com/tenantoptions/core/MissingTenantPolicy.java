package com.tenantoptions.core;

/**
 * What {@link MultiTenantOptionsManager} does when options are resolved outside any tenant.
 */
public enum MissingTenantPolicy {

    /** Fail with {@link NoTenantContextException}. */
    FAIL,

    /**
     * Resolve the shared base instance (no tenant mutators), cached under a host key separate from
     * every tenant's entries.
     */
    SHARED
}

package com.tenantoptions.core.registration;

/**
 * How long an instance produced by a {@link ServiceFactory} is reused.
 */
public enum ServiceLifetime {

    /** One instance for the lifetime of the built tenant options. */
    SINGLETON,

    /** One instance per {@link ServiceScope}, typically one request. */
    SCOPED,

    /** A new instance on every lookup. */
    TRANSIENT
}

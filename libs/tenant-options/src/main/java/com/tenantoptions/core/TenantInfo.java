package com.tenantoptions.core;

/**
 * Minimal view of a tenant record as seen by the options subsystem.
 *
 * <p>Applications usually implement this with a record that also carries the tenant-specific data
 * their mutators read (plan, region, feature flags).
 */
public interface TenantInfo {

    /** Unique, stable tenant id. Used as the tenant component of every cache key. */
    String id();

    /** The identifier a resolution strategy matches on (host name, path segment, header value). */
    String identifier();

    /** Optional human-readable name. */
    String name();
}

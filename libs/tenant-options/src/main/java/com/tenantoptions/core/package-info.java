/**
 * Per-tenant options resolution and caching.
 *
 * <p>An options type is an ordinary mutable class. Resolving it for the current tenant runs the
 * type's base {@link com.tenantoptions.core.OptionsPipeline}, applies the tenant mutators
 * registered for the type and name, runs post-configuration and validation, and caches the result
 * under {@code (type, name, tenant)}:
 *
 * <ul>
 *   <li>{@link com.tenantoptions.core.MultiTenantOptionsBuilder} collects registrations at startup
 *   <li>{@link com.tenantoptions.core.TenantMutatorRegistry} answers which mutators apply
 *   <li>{@link com.tenantoptions.core.MultiTenantOptionsCache} holds one instance per key
 *   <li>{@link com.tenantoptions.core.MultiTenantOptionsManager} resolves and invalidates
 * </ul>
 *
 * <p>The current tenant comes from a {@link com.tenantoptions.core.TenantContextAccessor}; {@link
 * com.tenantoptions.core.TenantContextHolder} is the thread-bound default.
 *
 * @see com.tenantoptions.core.registration
 */
package com.tenantoptions.core;

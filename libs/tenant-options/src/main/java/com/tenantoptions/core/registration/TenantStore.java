package com.tenantoptions.core.registration;

import com.tenantoptions.core.TenantInfo;
import java.util.Optional;

/**
 * Where tenant records live. Implementations are supplied by the application; the options core only
 * registers them and hands them out.
 *
 * @param <T> the tenant type
 */
public interface TenantStore<T extends TenantInfo> {

    /** Looks up a tenant by the identifier a resolution strategy produced. */
    Optional<T> findByIdentifier(String identifier);

    /** Looks up a tenant by id. */
    Optional<T> findById(String id);
}

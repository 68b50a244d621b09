package com.tenantoptions.core.registration;

/**
 * Creates a registered component (tenant store, resolution strategy) from an explicit context
 * instead of reflective constructor injection.
 *
 * @param <S> the component type
 */
@FunctionalInterface
public interface ServiceFactory<S> {

    /**
     * Creates the component. Must not return null.
     */
    S create(ServiceContext context);
}

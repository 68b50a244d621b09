package com.tenantoptions.core;

/**
 * The base (tenant-unaware) configuration pipeline of one options type.
 *
 * <p>Resolution runs {@link #configure} to obtain a fresh configured instance, applies the tenant
 * mutators, and then hands the same instance to {@link #postConfigure}. Tenant overrides therefore
 * land after generic configuration and before post-configuration and validation.
 *
 * @param <O> the options type
 */
@FunctionalInterface
public interface OptionsPipeline<O> {

    /**
     * Creates and configures a new instance for {@code name}. Must never return a shared instance.
     *
     * @param name the options name, {@link Options#DEFAULT_NAME} for the unnamed instance
     */
    O configure(String name);

    /**
     * Finishes an instance after tenant mutation. The default does nothing.
     */
    default void postConfigure(String name, O options) {}
}

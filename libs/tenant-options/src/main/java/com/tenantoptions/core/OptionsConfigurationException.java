package com.tenantoptions.core;

/**
 * Thrown when the base options pipeline fails to produce an instance. Carries the options type and
 * name that were being resolved; the pipeline's own failure is kept as the cause.
 */
public class OptionsConfigurationException extends TenantOptionsException {

    public OptionsConfigurationException(Class<?> optionsType, String optionsName, String reason) {
        super(
                optionsType,
                optionsName,
                "Failed to configure options %s: %s"
                        .formatted(describe(optionsType, optionsName), reason));
    }

    public OptionsConfigurationException(
            Class<?> optionsType, String optionsName, String reason, Throwable cause) {
        super(
                optionsType,
                optionsName,
                "Failed to configure options %s: %s"
                        .formatted(describe(optionsType, optionsName), reason),
                cause);
    }

    public OptionsConfigurationException(
            Class<?> optionsType, String optionsName, Throwable cause) {
        super(
                optionsType,
                optionsName,
                "Failed to configure options %s: %s"
                        .formatted(describe(optionsType, optionsName), cause.getMessage()),
                cause);
    }
}

package com.tenantoptions.core;

import java.util.List;

/**
 * Thrown when a configured options instance fails one or more validators. All failure messages are
 * collected, not just the first.
 */
public class OptionsValidationException extends OptionsConfigurationException {

    private final List<String> failures;

    public OptionsValidationException(
            Class<?> optionsType, String optionsName, List<String> failures) {
        super(optionsType, optionsName, "validation failed: " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> failures() {
        return failures;
    }
}

package com.tenantoptions.core;

/**
 * Thrown at registration time when a mutator, pipeline, store or strategy registration is missing a
 * required argument. Never deferred to resolution time.
 */
public class InvalidRegistrationException extends IllegalArgumentException {

    private final String parameter;

    public InvalidRegistrationException(String parameter) {
        this(parameter, "must not be null");
    }

    public InvalidRegistrationException(String parameter, String reason) {
        super("Invalid registration: '%s' %s".formatted(parameter, reason));
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /** Returns {@code value}, or throws when it is null. */
    public static <V> V requireArgument(V value, String parameter) {
        if (value == null) {
            throw new InvalidRegistrationException(parameter);
        }
        return value;
    }
}

package com.tenantoptions.core;

/**
 * Base type for failures raised while resolving tenant options.
 *
 * <p>Unchecked: every failure reaches the immediate caller of {@link MultiTenantOptionsManager#get}
 * and the caller decides whether to retry. A failed resolution never leaves a cache entry behind.
 */
public class TenantOptionsException extends RuntimeException {

    private final Class<?> optionsType;
    private final String optionsName;

    public TenantOptionsException(Class<?> optionsType, String optionsName, String message) {
        super(message);
        this.optionsType = optionsType;
        this.optionsName = optionsName;
    }

    public TenantOptionsException(
            Class<?> optionsType, String optionsName, String message, Throwable cause) {
        super(message, cause);
        this.optionsType = optionsType;
        this.optionsName = optionsName;
    }

    public Class<?> optionsType() {
        return optionsType;
    }

    public String optionsName() {
        return optionsName;
    }

    static String describe(Class<?> optionsType, String optionsName) {
        String typeName = optionsType == null ? "<unknown>" : optionsType.getName();
        return optionsName == null || optionsName.isEmpty()
                ? typeName
                : "%s['%s']".formatted(typeName, optionsName);
    }
}

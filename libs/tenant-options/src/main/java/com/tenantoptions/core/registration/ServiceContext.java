package com.tenantoptions.core.registration;

import java.util.Map;
import java.util.Optional;

/**
 * Everything a {@link ServiceFactory} may use to build its component: the active scope and the
 * startup attributes registered with {@code MultiTenantOptionsBuilder#withAttribute}.
 *
 * @param scope      the scope the lookup runs in
 * @param attributes startup attributes (connection strings, file paths, static tenant lists)
 */
public record ServiceContext(ServiceScope scope, Map<String, Object> attributes) {

    public ServiceContext {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Returns the attribute {@code key} if present and of type {@code type}.
     *
     * @throws IllegalStateException if the attribute exists with another type
     */
    public <V> Optional<V> attribute(String key, Class<V> type) {
        Object value = attributes.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                    "Attribute '%s' is a %s, not a %s"
                            .formatted(key, value.getClass().getName(), type.getName()));
        }
        return Optional.of(type.cast(value));
    }

    /**
     * Returns the attribute {@code key}, failing if it is missing.
     */
    public <V> V requireAttribute(String key, Class<V> type) {
        return attribute(key, type)
                .orElseThrow(() -> new IllegalStateException("Missing attribute '" + key + "'"));
    }
}

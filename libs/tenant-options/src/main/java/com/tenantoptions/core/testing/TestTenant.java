package com.tenantoptions.core.testing;

import com.tenantoptions.core.TenantInfo;
import java.util.Map;

/**
 * Simple {@link TenantInfo} for tests, carrying free-form string attributes for mutators to read.
 *
 * <p>Placed in {@code src/main/java} so that modules depending on this one can use it in their
 * tests without a test-jar.
 *
 * @param id         tenant id
 * @param identifier tenant identifier
 * @param name       display name
 * @param attributes tenant-specific settings
 */
public record TestTenant(String id, String identifier, String name, Map<String, String> attributes)
        implements TenantInfo {

    public TestTenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Creates a tenant whose identifier and name are derived from {@code id}. */
    public static TestTenant of(String id) {
        return of(id, Map.of());
    }

    public static TestTenant of(String id, Map<String, String> attributes) {
        return new TestTenant(id, id, "Test Tenant " + id, attributes);
    }

    /** Returns the attribute {@code key}, or null. */
    public String attribute(String key) {
        return attributes.get(key);
    }
}

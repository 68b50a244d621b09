package com.tenantoptions.spring;

import com.tenantoptions.core.MissingTenantPolicy;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized settings for per-tenant options, bound from the {@code tenant-options.*} prefix:
 *
 * <pre>
 * tenant-options:
 *   enabled: true
 *   missing-tenant-policy: FAIL
 *   metrics-enabled: true
 *   cache-name: billing-options
 * </pre>
 *
 * @param enabled             whether the auto-configuration applies (default true)
 * @param missingTenantPolicy what resolution does outside a tenant context (default FAIL)
 * @param metricsEnabled      publish cache meters when a MeterRegistry bean exists (default true)
 * @param cacheName           value of the cache's {@code cache} meter tag; generated when unset
 */
@ConfigurationProperties(prefix = "tenant-options")
@Validated
public record TenantOptionsProperties(
        @NotNull Boolean enabled,
        @NotNull MissingTenantPolicy missingTenantPolicy,
        @NotNull Boolean metricsEnabled,
        @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9._-]*") String cacheName) {

    public TenantOptionsProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (missingTenantPolicy == null) {
            missingTenantPolicy = MissingTenantPolicy.FAIL;
        }
        if (metricsEnabled == null) {
            metricsEnabled = Boolean.TRUE;
        }
    }
}

package com.tenantoptions.spring;

import com.tenantoptions.core.MultiTenantOptions;
import com.tenantoptions.core.MultiTenantOptionsBuilder;
import com.tenantoptions.core.MultiTenantOptionsCache;
import com.tenantoptions.core.MultiTenantOptionsManager;
import com.tenantoptions.core.TenantContextAccessor;
import com.tenantoptions.core.TenantContextHolder;
import com.tenantoptions.core.TenantInfo;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for per-tenant options.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link TenantContextHolder}, unless the application defines its own {@link
 *       TenantContextAccessor}
 *   <li>{@link MultiTenantOptions}, built from every {@link TenantOptionsConfigurer} bean
 *   <li>{@link MultiTenantOptionsManager} and {@link MultiTenantOptionsCache} taken from it
 * </ul>
 *
 * <p>Cache meters go to the {@link MeterRegistry} bean when one exists and {@code
 * tenant-options.metrics-enabled} is not false. Set {@code tenant-options.enabled=false} to turn the
 * whole configuration off.
 *
 * @see TenantOptionsProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(TenantOptionsProperties.class)
@ConditionalOnProperty(prefix = "tenant-options", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TenantOptionsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TenantOptionsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(TenantContextAccessor.class)
    public TenantContextHolder<TenantInfo> tenantContextHolder() {
        return new TenantContextHolder<>();
    }

    @Bean
    @ConditionalOnMissingBean
    public MultiTenantOptions<?> multiTenantOptions(
            TenantContextAccessor<?> tenantContext,
            ObjectProvider<TenantOptionsConfigurer<?>> configurers,
            ObjectProvider<MeterRegistry> meterRegistry,
            TenantOptionsProperties properties) {
        MeterRegistry registry = properties.metricsEnabled() ? meterRegistry.getIfAvailable() : null;
        List<TenantOptionsConfigurer<?>> ordered = configurers.orderedStream().toList();
        log.debug(
                "Building tenant options from {} configurer(s), metrics {}",
                ordered.size(),
                registry != null ? "enabled" : "disabled");
        return build(tenantContext, ordered, registry, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public MultiTenantOptionsManager<?> multiTenantOptionsManager(MultiTenantOptions<?> options) {
        return options.manager();
    }

    @Bean
    @ConditionalOnMissingBean
    public MultiTenantOptionsCache multiTenantOptionsCache(MultiTenantOptions<?> options) {
        return options.cache();
    }

    @SuppressWarnings("unchecked")
    private static <T extends TenantInfo> MultiTenantOptions<T> build(
            TenantContextAccessor<T> tenantContext,
            List<TenantOptionsConfigurer<?>> configurers,
            MeterRegistry registry,
            TenantOptionsProperties properties) {
        MultiTenantOptionsBuilder<T> builder =
                MultiTenantOptionsBuilder.forTenantContext(tenantContext)
                        .withMissingTenantPolicy(properties.missingTenantPolicy())
                        .withMeterRegistry(registry);
        if (properties.cacheName() != null) {
            builder.withCacheName(properties.cacheName());
        }
        for (TenantOptionsConfigurer<?> configurer : configurers) {
            // Configurers are declared against the application's single tenant type.
            ((TenantOptionsConfigurer<T>) configurer).configure(builder);
        }
        return builder.build();
    }
}

package com.tenantoptions.spring;

import com.tenantoptions.core.MultiTenantOptionsBuilder;
import com.tenantoptions.core.TenantInfo;

/**
 * Application callback that adds mutators, pipelines, stores and strategies before the tenant
 * options are built. Declare implementations as beans; they run in {@link
 * org.springframework.core.annotation.Order} order.
 *
 * <pre>{@code
 * @Bean
 * TenantOptionsConfigurer<ShopTenant> billingOptions() {
 *     return builder -> builder.withPerTenantOptions(BillingOptions.class, (o, t) -> o.setPlanName(t.plan()));
 * }
 * }</pre>
 *
 * <p>The tenant type must match the one supplied by the {@code TenantContextAccessor} bean.
 *
 * @param <T> the tenant type
 */
@FunctionalInterface
public interface TenantOptionsConfigurer<T extends TenantInfo> {

    void configure(MultiTenantOptionsBuilder<T> builder);
}

package com.tenantoptions.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantMutatorRegistry")
class TenantMutatorRegistryTest {

    private static final BiConsumer<BillingOptions, BillingTenant> NOOP = (o, t) -> {};

    @Nested
    @DisplayName("resolveMutators")
    class ResolveMutators {

        @Test
        @DisplayName("returns exact-name and all-name entries in registration order")
        void matchingInOrder() {
            List<String> applied = new ArrayList<>();
            TenantMutatorRegistry<BillingTenant> registry =
                    TenantMutatorRegistry.<BillingTenant>builder()
                            .register(BillingOptions.class, NameFilter.all(), (o, t) -> applied.add("all-1"))
                            .register(BillingOptions.class, NameFilter.named("eu"), (o, t) -> applied.add("eu"))
                            .register(BillingOptions.class, NameFilter.named("us"), (o, t) -> applied.add("us"))
                            .register(BillingOptions.class, NameFilter.all(), (o, t) -> applied.add("all-2"))
                            .build();

            List<MutatorEntry<BillingOptions, BillingTenant>> eu =
                    registry.resolveMutators(BillingOptions.class, "eu");
            eu.forEach(entry -> entry.apply(new BillingOptions(), BillingTenant.of("a", "Gold")));

            assertThat(eu).hasSize(3);
            assertThat(applied).containsExactly("all-1", "eu", "all-2");
        }

        @Test
        @DisplayName("the default-name filter matches a null name")
        void defaultName() {
            TenantMutatorRegistry<BillingTenant> registry =
                    TenantMutatorRegistry.<BillingTenant>builder()
                            .register(BillingOptions.class, NameFilter.defaultName(), NOOP)
                            .build();

            assertThat(registry.resolveMutators(BillingOptions.class, null)).hasSize(1);
            assertThat(registry.resolveMutators(BillingOptions.class, Options.DEFAULT_NAME)).hasSize(1);
            assertThat(registry.resolveMutators(BillingOptions.class, "eu")).isEmpty();
        }

        @Test
        @DisplayName("no match is an empty list, not an error")
        void noMatch() {
            TenantMutatorRegistry<BillingTenant> registry = TenantMutatorRegistry.empty();

            assertThat(registry.resolveMutators(LoggingOptions.class, "any")).isEmpty();
            assertThat(registry.hasMutators(LoggingOptions.class)).isFalse();
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("keeps repeated registrations of the same action")
        void duplicatesKept() {
            TenantMutatorRegistry<BillingTenant> registry =
                    TenantMutatorRegistry.<BillingTenant>builder()
                            .register(BillingOptions.class, NameFilter.all(), NOOP)
                            .register(BillingOptions.class, NameFilter.all(), NOOP)
                            .build();

            assertThat(registry.resolveMutators(BillingOptions.class, null)).hasSize(2);
            assertThat(registry.size()).isEqualTo(2);
            assertThat(registry.optionsTypes()).containsExactly(BillingOptions.class);
        }

        @Test
        @DisplayName("returned lists are read-only")
        void readOnly() {
            TenantMutatorRegistry<BillingTenant> registry =
                    TenantMutatorRegistry.<BillingTenant>builder()
                            .register(BillingOptions.class, NameFilter.all(), NOOP)
                            .build();

            assertThatThrownBy(() -> registry.resolveMutators(BillingOptions.class, null).clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("rejects null arguments immediately")
        void rejectsNulls() {
            TenantMutatorRegistry.Builder<BillingTenant> builder = TenantMutatorRegistry.builder();

            assertThatThrownBy(() -> builder.register(null, NameFilter.all(), NOOP))
                    .isInstanceOf(InvalidRegistrationException.class)
                    .hasMessageContaining("optionsType");
            assertThatThrownBy(() -> builder.register(BillingOptions.class, null, NOOP))
                    .isInstanceOf(InvalidRegistrationException.class)
                    .hasMessageContaining("nameFilter");
            assertThatThrownBy(() -> builder.register(BillingOptions.class, NameFilter.all(), null))
                    .isInstanceOf(InvalidRegistrationException.class)
                    .satisfies(e -> assertThat(((InvalidRegistrationException) e).parameter()).isEqualTo("action"));
        }

        @Test
        @DisplayName("is frozen after build")
        void frozenAfterBuild() {
            TenantMutatorRegistry.Builder<BillingTenant> builder = TenantMutatorRegistry.builder();
            builder.build();

            assertThatThrownBy(() -> builder.register(BillingOptions.class, NameFilter.all(), NOOP))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        }
    }
}

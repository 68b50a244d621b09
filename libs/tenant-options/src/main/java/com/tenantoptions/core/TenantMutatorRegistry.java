package com.tenantoptions.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Ordered, per-options-type list of tenant mutators.
 *
 * <p>Filled through a {@link Builder} during startup and immutable afterwards, so lookups need no
 * locking. Registrations are cumulative: registering two mutators for the same type and name keeps
 * both, and registering the same action twice applies it twice.
 *
 * @param <T> the tenant type
 */
public final class TenantMutatorRegistry<T extends TenantInfo> {

    private final Map<Class<?>, List<MutatorEntry<?, T>>> entriesByType;
    private final int size;

    private TenantMutatorRegistry(Map<Class<?>, List<MutatorEntry<?, T>>> entriesByType) {
        Map<Class<?>, List<MutatorEntry<?, T>>> copy = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<Class<?>, List<MutatorEntry<?, T>>> entry : entriesByType.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            count += entry.getValue().size();
        }
        this.entriesByType = Collections.unmodifiableMap(copy);
        this.size = count;
    }

    public static <T extends TenantInfo> Builder<T> builder() {
        return new Builder<>();
    }

    /** Returns a registry without any mutators. */
    public static <T extends TenantInfo> TenantMutatorRegistry<T> empty() {
        return new TenantMutatorRegistry<>(Map.of());
    }

    /**
     * Returns, in registration order, every mutator for {@code optionsType} whose filter matches
     * {@code name} exactly or matches all names. An empty list means no tenant customization.
     *
     * @param optionsType the options type
     * @param name        the options name (null means the default name)
     */
    public <O> List<MutatorEntry<O, T>> resolveMutators(Class<O> optionsType, String name) {
        List<MutatorEntry<?, T>> entries = entriesByType.getOrDefault(optionsType, List.of());
        if (entries.isEmpty()) {
            return List.of();
        }
        List<MutatorEntry<O, T>> matches = new ArrayList<>(entries.size());
        for (MutatorEntry<?, T> entry : entries) {
            if (entry.nameFilter().matches(name)) {
                matches.add(cast(entry));
            }
        }
        return Collections.unmodifiableList(matches);
    }

    /** Returns true if at least one mutator targets {@code optionsType}, for any name. */
    public boolean hasMutators(Class<?> optionsType) {
        return entriesByType.containsKey(optionsType);
    }

    /** Options types with at least one mutator, in first-registration order. */
    public Set<Class<?>> optionsTypes() {
        return entriesByType.keySet();
    }

    /** Total number of registered mutators. */
    public int size() {
        return size;
    }

    // Entries are grouped by their own optionsType, so the element type is O for this list.
    @SuppressWarnings("unchecked")
    private static <O, T extends TenantInfo> MutatorEntry<O, T> cast(MutatorEntry<?, T> entry) {
        return (MutatorEntry<O, T>) entry;
    }

    /**
     * Collects mutators during startup. Not thread-safe; {@link #build()} may be called once.
     *
     * @param <T> the tenant type
     */
    public static final class Builder<T extends TenantInfo> {

        private final Map<Class<?>, List<MutatorEntry<?, T>>> entries = new LinkedHashMap<>();
        private boolean built;

        private Builder() {}

        /**
         * Appends a mutator. Never replaces an earlier registration.
         *
         * @throws InvalidRegistrationException if any argument is null
         * @throws IllegalStateException        if the registry was already built
         */
        public <O> Builder<T> register(
                Class<O> optionsType, NameFilter nameFilter, BiConsumer<? super O, ? super T> action) {
            return add(new MutatorEntry<>(optionsType, nameFilter, action));
        }

        /** Appends a pre-built entry. */
        public Builder<T> add(MutatorEntry<?, T> entry) {
            InvalidRegistrationException.requireArgument(entry, "entry");
            if (built) {
                throw new IllegalStateException(
                        "Tenant mutators cannot be registered after the registry was built");
            }
            entries.computeIfAbsent(entry.optionsType(), type -> new ArrayList<>()).add(entry);
            return this;
        }

        /** Freezes the collected mutators. */
        public TenantMutatorRegistry<T> build() {
            if (built) {
                throw new IllegalStateException("Tenant mutator registry was already built");
            }
            built = true;
            return new TenantMutatorRegistry<>(entries);
        }
    }
}

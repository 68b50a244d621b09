package com.tenantoptions.core;

import java.util.function.BiConsumer;

/**
 * One tenant mutator: the options type it targets, the names it applies to, and the action that
 * customizes a configured instance with the current tenant's data.
 *
 * @param optionsType the options type
 * @param nameFilter  which named instances the action applies to
 * @param action      mutates the instance in place
 * @param <O>         the options type
 * @param <T>         the tenant type
 */
public record MutatorEntry<O, T extends TenantInfo>(
        Class<O> optionsType, NameFilter nameFilter, BiConsumer<? super O, ? super T> action) {

    public MutatorEntry {
        InvalidRegistrationException.requireArgument(optionsType, "optionsType");
        InvalidRegistrationException.requireArgument(nameFilter, "nameFilter");
        InvalidRegistrationException.requireArgument(action, "action");
    }

    /** Applies the action to {@code options} for {@code tenant}. */
    public void apply(O options, T tenant) {
        action.accept(options, tenant);
    }
}

package com.tenantoptions.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * {@link OptionsPipeline} assembled from ordered steps: an instance factory, configure steps,
 * post-configure steps and validators.
 *
 * <pre>{@code
 * OptionsPipeline<SmtpOptions> pipeline = ConfiguredOptionsPipeline.builder(SmtpOptions.class, SmtpOptions::new)
 *         .configure(o -> o.setPort(25))
 *         .configure("bulk", o -> o.setPort(2525))
 *         .postConfigure(o -> o.setHost(o.getHost().toLowerCase()))
 *         .validate(o -> o.getHost() != null, "host is required")
 *         .build();
 * }</pre>
 *
 * <p>Validators run after every post-configure step, so they see tenant-mutated values.
 *
 * @param <O> the options type
 */
public final class ConfiguredOptionsPipeline<O> implements OptionsPipeline<O> {

    private final Class<O> optionsType;
    private final Supplier<? extends O> instanceFactory;
    private final List<Step<O>> configureSteps;
    private final List<Step<O>> postConfigureSteps;
    private final List<Validator<O>> validators;

    private ConfiguredOptionsPipeline(Builder<O> builder) {
        this.optionsType = builder.optionsType;
        this.instanceFactory = builder.instanceFactory;
        this.configureSteps = List.copyOf(builder.configureSteps);
        this.postConfigureSteps = List.copyOf(builder.postConfigureSteps);
        this.validators = List.copyOf(builder.validators);
    }

    public static <O> Builder<O> builder(Class<O> optionsType, Supplier<? extends O> instanceFactory) {
        return new Builder<>(optionsType, instanceFactory);
    }

    @Override
    public O configure(String name) {
        O options = instanceFactory.get();
        if (options == null) {
            throw new IllegalStateException(
                    "Instance factory for %s returned null".formatted(optionsType.getName()));
        }
        apply(configureSteps, name, options);
        return options;
    }

    @Override
    public void postConfigure(String name, O options) {
        apply(postConfigureSteps, name, options);

        List<String> failures = new ArrayList<>();
        for (Validator<O> validator : validators) {
            if (!validator.rule().test(options)) {
                failures.add(validator.failureMessage());
            }
        }
        if (!failures.isEmpty()) {
            throw new OptionsValidationException(optionsType, name, failures);
        }
    }

    public Class<O> optionsType() {
        return optionsType;
    }

    private static <O> void apply(List<Step<O>> steps, String name, O options) {
        for (Step<O> step : steps) {
            if (step.filter().matches(name)) {
                step.action().accept(options);
            }
        }
    }

    private record Step<O>(NameFilter filter, Consumer<? super O> action) {}

    private record Validator<O>(Predicate<? super O> rule, String failureMessage) {}

    /**
     * Collects the steps of a pipeline in the order they should run.
     *
     * @param <O> the options type
     */
    public static final class Builder<O> {

        private final Class<O> optionsType;
        private final Supplier<? extends O> instanceFactory;
        private final List<Step<O>> configureSteps = new ArrayList<>();
        private final List<Step<O>> postConfigureSteps = new ArrayList<>();
        private final List<Validator<O>> validators = new ArrayList<>();

        private Builder(Class<O> optionsType, Supplier<? extends O> instanceFactory) {
            this.optionsType = InvalidRegistrationException.requireArgument(optionsType, "optionsType");
            this.instanceFactory =
                    InvalidRegistrationException.requireArgument(instanceFactory, "instanceFactory");
        }

        /** Adds a configure step for every name. */
        public Builder<O> configure(Consumer<? super O> action) {
            return configure(NameFilter.all(), action);
        }

        /** Adds a configure step for one name. */
        public Builder<O> configure(String name, Consumer<? super O> action) {
            return configure(NameFilter.named(name), action);
        }

        public Builder<O> configure(NameFilter filter, Consumer<? super O> action) {
            configureSteps.add(step(filter, action));
            return this;
        }

        /** Adds a post-configure step for every name. */
        public Builder<O> postConfigure(Consumer<? super O> action) {
            return postConfigure(NameFilter.all(), action);
        }

        public Builder<O> postConfigure(NameFilter filter, Consumer<? super O> action) {
            postConfigureSteps.add(step(filter, action));
            return this;
        }

        /**
         * Adds a validator; {@code failureMessage} is reported when {@code rule} returns false.
         */
        public Builder<O> validate(Predicate<? super O> rule, String failureMessage) {
            InvalidRegistrationException.requireArgument(rule, "rule");
            InvalidRegistrationException.requireArgument(failureMessage, "failureMessage");
            validators.add(new Validator<>(rule, failureMessage));
            return this;
        }

        public ConfiguredOptionsPipeline<O> build() {
            return new ConfiguredOptionsPipeline<>(this);
        }

        private Step<O> step(NameFilter filter, Consumer<? super O> action) {
            InvalidRegistrationException.requireArgument(filter, "nameFilter");
            InvalidRegistrationException.requireArgument(action, "action");
            return new Step<>(filter, action);
        }
    }
}

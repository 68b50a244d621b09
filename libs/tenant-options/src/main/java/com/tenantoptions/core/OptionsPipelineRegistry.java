package com.tenantoptions.core;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps options types to their base {@link OptionsPipeline}.
 *
 * <p>Types without a registered pipeline get a default one that instantiates the type through its
 * no-arg constructor and applies nothing else.
 */
public final class OptionsPipelineRegistry {

    private final Map<Class<?>, OptionsPipeline<?>> registered;
    private final ConcurrentMap<Class<?>, OptionsPipeline<?>> defaults = new ConcurrentHashMap<>();

    public OptionsPipelineRegistry(Map<Class<?>, OptionsPipeline<?>> pipelines) {
        this.registered = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
    }

    /** Returns a registry where every type uses its default pipeline. */
    public static OptionsPipelineRegistry empty() {
        return new OptionsPipelineRegistry(Map.of());
    }

    /**
     * Returns the pipeline for {@code optionsType}, falling back to the no-arg constructor pipeline.
     */
    @SuppressWarnings("unchecked")
    public <O> OptionsPipeline<O> pipelineFor(Class<O> optionsType) {
        OptionsPipeline<?> pipeline = registered.get(optionsType);
        if (pipeline == null) {
            pipeline = defaults.computeIfAbsent(optionsType, type -> new DefaultConstructorPipeline<>(type));
        }
        // Pipelines are registered keyed by the type they produce.
        return (OptionsPipeline<O>) pipeline;
    }

    public boolean isRegistered(Class<?> optionsType) {
        return registered.containsKey(optionsType);
    }

    private static final class DefaultConstructorPipeline<O> implements OptionsPipeline<O> {

        private final Class<O> optionsType;

        DefaultConstructorPipeline(Class<O> optionsType) {
            this.optionsType = optionsType;
        }

        @Override
        public O configure(String name) {
            try {
                Constructor<O> constructor = optionsType.getDeclaredConstructor();
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                throw new OptionsConfigurationException(
                        optionsType, name, "no-arg constructor failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new OptionsConfigurationException(
                        optionsType, name, "type has no accessible no-arg constructor", e);
            }
        }
    }
}

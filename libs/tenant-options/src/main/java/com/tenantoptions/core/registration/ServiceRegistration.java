package com.tenantoptions.core.registration;

import com.tenantoptions.core.InvalidRegistrationException;

/**
 * A component registered with a lifetime and a factory. The options core does not interpret what
 * the component does; it only hands out instances honoring the lifetime.
 *
 * @param <S> the component type
 */
public final class ServiceRegistration<S> {

    private final Class<S> serviceType;
    private final ServiceLifetime lifetime;
    private final ServiceFactory<? extends S> factory;
    private volatile S singleton;

    public ServiceRegistration(
            Class<S> serviceType, ServiceLifetime lifetime, ServiceFactory<? extends S> factory) {
        this.serviceType = InvalidRegistrationException.requireArgument(serviceType, "serviceType");
        this.lifetime = InvalidRegistrationException.requireArgument(lifetime, "lifetime");
        this.factory = InvalidRegistrationException.requireArgument(factory, "factory");
    }

    /**
     * Returns the instance for {@code context}, creating it if the lifetime requires.
     *
     * @throws IllegalStateException if the factory returns null
     */
    public S resolve(ServiceContext context) {
        return switch (lifetime) {
            case SINGLETON -> singleton(context);
            case SCOPED -> context.scope().getOrCreate(this, () -> create(context));
            case TRANSIENT -> create(context);
        };
    }

    public Class<S> serviceType() {
        return serviceType;
    }

    public ServiceLifetime lifetime() {
        return lifetime;
    }

    private S singleton(ServiceContext context) {
        S instance = singleton;
        if (instance == null) {
            synchronized (this) {
                instance = singleton;
                if (instance == null) {
                    instance = create(context);
                    singleton = instance;
                }
            }
        }
        return instance;
    }

    private S create(ServiceContext context) {
        S instance = factory.create(context);
        if (instance == null) {
            throw new IllegalStateException(
                    "Factory for %s returned null".formatted(serviceType.getName()));
        }
        return instance;
    }
}

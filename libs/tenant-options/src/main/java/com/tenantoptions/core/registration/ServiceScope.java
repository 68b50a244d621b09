package com.tenantoptions.core.registration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Holds the {@link ServiceLifetime#SCOPED} instances of one unit of work. Closing the scope drops
 * them; components that implement {@link AutoCloseable} are closed.
 */
public final class ServiceScope implements AutoCloseable {

    private final ConcurrentMap<ServiceRegistration<?>, Object> instances = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @SuppressWarnings("unchecked")
    <S> S getOrCreate(ServiceRegistration<S> registration, Supplier<S> factory) {
        if (closed) {
            throw new IllegalStateException("Service scope is closed");
        }
        // Registrations are keyed by identity and always produce their own service type.
        S instance = (S) instances.computeIfAbsent(registration, r -> factory.get());
        if (closed) {
            // close() ran while the instance was being created and may have missed it.
            IllegalStateException closedFailure = new IllegalStateException("Service scope is closed");
            if (instances.remove(registration, instance) && instance instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    closedFailure.addSuppressed(e);
                }
            }
            throw closedFailure;
        }
        return instance;
    }

    /** Number of scoped instances created so far. */
    public int size() {
        return instances.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the scope and every {@link AutoCloseable} instance it holds. Each instance is closed
     * exactly once, also when a lookup races with this call.
     *
     * @throws Exception the first close failure, with later ones suppressed
     */
    @Override
    public void close() throws Exception {
        closed = true;
        Exception failure = null;
        for (Map.Entry<ServiceRegistration<?>, Object> entry : instances.entrySet()) {
            // Whoever removes the entry closes the instance.
            if (instances.remove(entry.getKey(), entry.getValue())
                    && entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

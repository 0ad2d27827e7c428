package org.seisview.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed registry of shared services handed to HTTP controllers.
 * <p>
 * Services are registered once during startup and looked up by controllers in their
 * constructors. Thread-safe.
 */
public class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service under its type.
     *
     * @param type    lookup key
     * @param service the instance
     * @param <T>     service type
     * @throws IllegalStateException if a service of that type is already registered
     */
    public <T> void register(Class<T> type, T service) {
        if (services.putIfAbsent(type, type.cast(service)) != null) {
            throw new IllegalStateException("Service already registered: " + type.getName());
        }
    }

    /**
     * Looks up a required service.
     *
     * @param type lookup key
     * @param <T>  service type
     * @return the service
     * @throws IllegalStateException if no service of that type is registered
     */
    public <T> T get(Class<T> type) {
        Object service = services.get(type);
        if (service == null) {
            throw new IllegalStateException("Required service not registered: " + type.getName());
        }
        return type.cast(service);
    }

    public boolean contains(Class<?> type) {
        return services.containsKey(type);
    }
}

package io.lion.registry;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe, in-memory mapper registry.
 *
 * <p>Mappers are registered by class and instantiated through their no-arg constructor on
 * every resolution. One implementation is kept per {@link MapperKey}; registering the same
 * key again replaces the previous implementation (last write wins).
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MapperRegistry registry = new DefaultMapperRegistry()
 *     // Scan candidates for EventMapper<N> and FlexibleEventMapper<N>
 *     .addEventMappers(UserCreatedEventMapper.class, UserCreatedFlexibleEventMapper.class)
 *     // Or register a single pair explicitly
 *     .register(new MapperRegistration(MapperKey.typed(OrderPlacedNotification.class),
 *         OrderPlacedEventMapper.class));
 *
 * registry.eventMapperFor(UserCreatedNotification.class)
 *     .ifPresent(mapper -> mapper.createEvents(notification));
 * }</pre>
 *
 * <p>Registration is meant to happen once at startup; reads are safe from any thread.
 *
 * @see MapperTypeScanner
 */
public final class DefaultMapperRegistry implements MapperRegistry {

    private static final Logger logger = Logger.getLogger(DefaultMapperRegistry.class.getName());

    private final Map<MapperKey, MapperRegistration> registrations = new ConcurrentHashMap<>();

    /**
     * Scans candidate classes and registers every mapper capability they implement.
     *
     * @param candidateTypes the classes to scan
     * @return this registry for chaining
     * @throws MapperConfigurationException if no candidate is given
     */
    public DefaultMapperRegistry addEventMappers(Class<?>... candidateTypes) {
        if (candidateTypes == null) {
            throw new MapperConfigurationException("At least one candidate type must be provided");
        }
        return addEventMappers(Arrays.asList(candidateTypes));
    }

    /**
     * Scans candidate classes and registers every mapper capability they implement.
     *
     * @param candidateTypes the classes to scan
     * @return this registry for chaining
     * @throws MapperConfigurationException if the collection is null or empty
     */
    public DefaultMapperRegistry addEventMappers(Collection<? extends Class<?>> candidateTypes) {
        if (candidateTypes == null || candidateTypes.isEmpty()) {
            throw new MapperConfigurationException("At least one candidate type must be provided");
        }
        List<MapperRegistration> found = MapperTypeScanner.scan(candidateTypes);
        for (MapperRegistration registration : found) {
            register(registration);
        }
        logger.info("Registered " + found.size() + " event mapper(s) from "
                + candidateTypes.size() + " candidate type(s)");
        return this;
    }

    /**
     * Registers a single mapper, replacing any implementation already registered for its key.
     *
     * @param registration the capability and implementing class
     * @return this registry for chaining
     */
    public DefaultMapperRegistry register(MapperRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        MapperRegistration previous = registrations.put(registration.key(), registration);
        if (previous != null && !previous.equals(registration)) {
            logger.fine("Replaced " + previous + " with " + registration.implementation().getName());
        } else {
            logger.fine("Registered " + registration);
        }
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <N> Optional<EventMapper<N>> eventMapperFor(Class<N> notificationType) {
        return resolve(MapperKey.typed(notificationType)).map(mapper -> (EventMapper<N>) mapper);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <N> Optional<FlexibleEventMapper<N>> flexibleEventMapperFor(Class<N> notificationType) {
        return resolve(MapperKey.flexible(notificationType)).map(mapper -> (FlexibleEventMapper<N>) mapper);
    }

    @Override
    public List<MapperRegistration> registrations() {
        return List.copyOf(registrations.values());
    }

    private Optional<Object> resolve(MapperKey key) {
        MapperRegistration registration = registrations.get(key);
        if (registration == null) {
            return Optional.empty();
        }
        return Optional.of(instantiate(registration));
    }

    private static Object instantiate(MapperRegistration registration) {
        Class<?> type = registration.implementation();
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new MapperConfigurationException(
                    "Mapper " + type.getName() + " registered for " + registration.key()
                            + " has no no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new MapperConfigurationException(
                    "Constructor of mapper " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new MapperConfigurationException("Failed to instantiate mapper " + type.getName(), e);
        }
    }
}

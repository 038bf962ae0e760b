package io.lion.registry;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;

import java.util.List;
import java.util.Optional;

/**
 * Resolves mappers by notification type.
 *
 * <p>Each resolution returns a new mapper instance; instances are never shared
 * between callers.
 *
 * @see DefaultMapperRegistry
 */
public interface MapperRegistry {

    /**
     * Resolves the typed mapper registered for a notification type.
     *
     * @param notificationType the notification class
     * @return a new mapper instance, or empty if none is registered
     * @throws MapperConfigurationException if the registered class cannot be instantiated
     */
    <N> Optional<EventMapper<N>> eventMapperFor(Class<N> notificationType);

    /**
     * Resolves the flexible mapper registered for a notification type.
     *
     * @param notificationType the notification class
     * @return a new mapper instance, or empty if none is registered
     * @throws MapperConfigurationException if the registered class cannot be instantiated
     */
    <N> Optional<FlexibleEventMapper<N>> flexibleEventMapperFor(Class<N> notificationType);

    /**
     * Returns a snapshot of all registrations.
     *
     * @return immutable list of registrations, may be empty
     */
    List<MapperRegistration> registrations();
}

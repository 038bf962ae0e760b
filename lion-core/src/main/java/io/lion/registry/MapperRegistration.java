package io.lion.registry;

import java.util.Objects;

/**
 * A discovered pair of capability instantiation and implementing class.
 *
 * @param key the capability instantiation, e.g. {@code EventMapper<UserCreatedNotification>}
 * @param implementation the concrete class that implements it
 */
public record MapperRegistration(MapperKey key, Class<?> implementation) {

    public MapperRegistration {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(implementation, "implementation");
        if (!key.kind().capability().isAssignableFrom(implementation)) {
            throw new IllegalArgumentException(
                    implementation.getName() + " does not implement " + key.kind().capability().getName());
        }
        if (!MapperTypeScanner.isInstantiable(implementation)) {
            throw new IllegalArgumentException(implementation.getName() + " is not a concrete class");
        }
    }

    @Override
    public String toString() {
        return key + " -> " + implementation.getName();
    }
}

package io.lion.registry;

import java.util.Objects;

/**
 * A capability instantiation such as {@code EventMapper<UserCreatedNotification>}.
 *
 * <p>The registry holds at most one implementation per key.
 *
 * @param kind which mapper capability
 * @param notificationType the concrete notification class bound to the capability's type parameter
 */
public record MapperKey(MapperKind kind, Class<?> notificationType) {

    public MapperKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(notificationType, "notificationType");
    }

    public static MapperKey typed(Class<?> notificationType) {
        return new MapperKey(MapperKind.TYPED, notificationType);
    }

    public static MapperKey flexible(Class<?> notificationType) {
        return new MapperKey(MapperKind.FLEXIBLE, notificationType);
    }

    @Override
    public String toString() {
        return kind.capability().getSimpleName() + "<" + notificationType.getName() + ">";
    }
}

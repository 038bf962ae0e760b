package io.lion.domain;

import java.util.Objects;

/**
 * Identity-based equality for {@link Entity} implementations.
 *
 * <p>Two entities are equal when they have the same runtime class and equal identifiers.
 * No other field takes part in the comparison. Both methods are pure and thread-safe.
 */
public final class Entities {

    private Entities() {
    }

    /**
     * Compares an entity with another object by runtime class and identifier.
     *
     * @param self the receiver, usually {@code this}
     * @param other the object to compare with, may be null
     * @return {@code true} if {@code other} is the same instance, or has the same runtime
     *         class and an equal identifier
     * @throws NullPointerException if {@code self} is null
     */
    public static boolean entityEquals(Entity<?> self, Object other) {
        Objects.requireNonNull(self, "self");
        if (other == null) return false;
        if (self == other) return true;
        if (self.getClass() != other.getClass()) return false;
        Entity<?> that = (Entity<?>) other;
        return self.id().equals(that.id());
    }

    /**
     * Returns the hash code of the entity's identifier.
     *
     * @param self the receiver, usually {@code this}
     * @return the identifier's hash code
     * @throws NullPointerException if {@code self} is null
     */
    public static int entityHashCode(Entity<?> self) {
        Objects.requireNonNull(self, "self");
        return self.id().hashCode();
    }
}

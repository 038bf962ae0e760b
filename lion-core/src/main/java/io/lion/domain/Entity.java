package io.lion.domain;

/**
 * A domain object distinguished by its identity rather than its attribute values.
 *
 * <p>Implementations can be mutable classes or records. To get identity equality,
 * delegate to {@link Entities}:
 * <pre>{@code
 * public final class User implements Entity<String> {
 *   private final String id;
 *   private String name;
 *
 *   @Override public String id() { return id; }
 *
 *   @Override public boolean equals(Object o) { return Entities.entityEquals(this, o); }
 *   @Override public int hashCode() { return Entities.entityHashCode(this); }
 * }
 * }</pre>
 *
 * <p>The identity must not change after construction. This is a convention; nothing here
 * enforces it.
 *
 * @param <ID> the identifier type; must implement {@code equals} and {@code hashCode}
 * @see AggregateRoot
 * @see Entities
 */
public interface Entity<ID> {

    /**
     * Returns the unique identifier of this entity.
     *
     * @return the identifier, never null
     */
    ID id();
}

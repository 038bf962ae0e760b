package io.lion.domain;

/**
 * An entity that is the single access point to a cluster of related objects and
 * the boundary inside which their invariants hold.
 *
 * <p>Marker interface: it adds no data and no equality rule on top of {@link Entity}.
 *
 * @param <ID> the identifier type
 */
public interface AggregateRoot<ID> extends Entity<ID> {
}

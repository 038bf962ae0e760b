package io.lion.domain;

import java.util.List;

/**
 * Capability of a value object to expose the components that define its equality.
 *
 * <p>Bridges different implementations of the same logical value: a class and a record
 * holding the same fields compare through their component lists.
 */
public interface ValueObjectWithComponents {

    /**
     * Returns the components that determine equality, in a fixed order.
     *
     * <p>The list must be produced deterministically: the same instance returns the
     * same elements in the same order on every call. Elements may be {@code null}.
     *
     * @return the ordered equality components
     */
    List<Object> equalityComponents();
}

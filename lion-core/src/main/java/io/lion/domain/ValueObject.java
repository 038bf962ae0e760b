package io.lion.domain;

/**
 * An immutable object with no conceptual identity, compared by its attribute values.
 *
 * <p>Typical examples are quantities, dates, money or addresses. Implementations that also
 * implement {@link ValueObjectWithComponents} can delegate {@code equals}/{@code hashCode}
 * to {@link ValueObjects}.
 *
 * @see ValueObjectWithComponents
 * @see ValueObjects
 */
public interface ValueObject {

    /**
     * Checks the invariants of this value object.
     *
     * <p>Nothing in this library calls this method; constructors and factories of the
     * implementing type decide when to invoke it.
     *
     * @throws DomainValidationException if the state is invalid
     */
    void validate();
}

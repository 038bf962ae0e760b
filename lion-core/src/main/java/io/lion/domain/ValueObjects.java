package io.lion.domain;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Component-based equality for {@link ValueObject} implementations.
 *
 * <p>Equality is decided by an ordered list of components: two value objects of the same
 * runtime class are equal when their lists have the same length and every pair of elements
 * is equal ({@code null} only equals {@code null}).
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * public final class Address implements ValueObject, ValueObjectWithComponents {
 *   ...
 *   @Override public List<Object> equalityComponents() {
 *     return Arrays.asList(street, city);
 *   }
 *
 *   @Override public boolean equals(Object o) {
 *     return ValueObjects.valueObjectEquals(this, o, this::equalityComponents);
 *   }
 *
 *   @Override public int hashCode() {
 *     return ValueObjects.valueObjectHashCode(this, this::equalityComponents);
 *   }
 * }
 * }</pre>
 *
 * <h2>Fallback path</h2>
 * <p>When {@code other} does not implement {@link ValueObjectWithComponents}, its components
 * cannot be read, so the supplier bound to {@code self} is invoked a second time and the
 * result is compared with the first. That comparison only holds meaning when the runtime
 * class already guarantees structural equality by other means (e.g. a record relying on its
 * generated {@code equals}). Value objects that want a real comparison must implement
 * {@link ValueObjectWithComponents}.
 */
public final class ValueObjects {

    private ValueObjects() {
    }

    /**
     * Compares a value object with another object by equality components.
     *
     * @param self the receiver, usually {@code this}
     * @param other the object to compare with, may be null
     * @param equalityComponents supplies the ordered components of {@code self}
     * @return {@code true} if the objects are equal
     * @throws NullPointerException if {@code self} or {@code equalityComponents} is null
     */
    public static boolean valueObjectEquals(
            ValueObject self, Object other, Supplier<? extends List<?>> equalityComponents) {
        Objects.requireNonNull(self, "self");
        Objects.requireNonNull(equalityComponents, "equalityComponents");
        if (other == null) return false;
        if (self == other) return true;
        if (self.getClass() != other.getClass()) return false;

        List<?> selfComponents = equalityComponents.get();
        if (other instanceof ValueObjectWithComponents provider) {
            return sequenceEquals(selfComponents, provider.equalityComponents());
        }
        return sequenceEquals(selfComponents, equalityComponents.get());
    }

    /**
     * Compares a value object with another object using the receiver's own components.
     *
     * @param self the receiver, usually {@code this}
     * @param other the object to compare with, may be null
     * @return {@code true} if the objects are equal
     */
    public static <T extends ValueObject & ValueObjectWithComponents> boolean valueObjectEquals(
            T self, Object other) {
        Objects.requireNonNull(self, "self");
        return valueObjectEquals(self, other, self::equalityComponents);
    }

    /**
     * Combines the hash codes of the components with exclusive-or.
     *
     * <p>{@code null} components contribute {@code 0}; an empty component list hashes to {@code 0}.
     *
     * @param self the receiver, usually {@code this}
     * @param equalityComponents supplies the ordered components of {@code self}
     * @return the combined hash code
     */
    public static int valueObjectHashCode(ValueObject self, Supplier<? extends List<?>> equalityComponents) {
        Objects.requireNonNull(self, "self");
        Objects.requireNonNull(equalityComponents, "equalityComponents");
        int hash = 0;
        for (Object component : equalityComponents.get()) {
            hash ^= component == null ? 0 : component.hashCode();
        }
        return hash;
    }

    /**
     * Hashes a value object using the receiver's own components.
     *
     * @param self the receiver, usually {@code this}
     * @return the combined hash code
     */
    public static <T extends ValueObject & ValueObjectWithComponents> int valueObjectHashCode(T self) {
        Objects.requireNonNull(self, "self");
        return valueObjectHashCode(self, self::equalityComponents);
    }

    private static boolean sequenceEquals(List<?> left, List<?> right) {
        if (left.size() != right.size()) return false;
        for (int i = 0; i < left.size(); i++) {
            if (!Objects.equals(left.get(i), right.get(i))) return false;
        }
        return true;
    }
}

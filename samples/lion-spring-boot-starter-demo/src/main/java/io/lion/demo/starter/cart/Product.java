package io.lion.demo.starter.cart;

import io.lion.domain.DomainValidationException;
import io.lion.domain.ValueObject;
import io.lion.domain.ValueObjectWithComponents;
import io.lion.domain.ValueObjects;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

public final class Product implements ValueObject, ValueObjectWithComponents {

    private final String sku;
    private final String name;
    private final BigDecimal price;

    public Product(String sku, String name, BigDecimal price) {
        this.sku = sku;
        this.name = name;
        this.price = price;
        validate();
    }

    public String sku() {
        return sku;
    }

    public String name() {
        return name;
    }

    public BigDecimal price() {
        return price;
    }

    @Override
    public void validate() {
        if (sku == null || sku.isBlank()) {
            throw new DomainValidationException("sku cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new DomainValidationException("name cannot be blank");
        }
        if (price == null || price.signum() < 0) {
            throw new DomainValidationException("price must be zero or positive");
        }
    }

    // BigDecimal.equals is scale-sensitive; 9.90 and 9.9 are the same price.
    @Override
    public List<Object> equalityComponents() {
        return Arrays.asList(sku, name, price.stripTrailingZeros());
    }

    @Override
    public boolean equals(Object o) {
        return ValueObjects.valueObjectEquals(this, o);
    }

    @Override
    public int hashCode() {
        return ValueObjects.valueObjectHashCode(this);
    }

    @Override
    public String toString() {
        return "Product[sku=" + sku + ", name=" + name + ", price=" + price + "]";
    }
}

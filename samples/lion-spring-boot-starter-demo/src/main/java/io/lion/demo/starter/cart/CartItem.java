package io.lion.demo.starter.cart;

import io.lion.domain.DomainValidationException;
import io.lion.domain.ValueObject;
import io.lion.domain.ValueObjectWithComponents;
import io.lion.domain.ValueObjects;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

public record CartItem(Product product, int quantity) implements ValueObject, ValueObjectWithComponents {

    public CartItem {
        if (product == null) {
            throw new DomainValidationException("product is required");
        }
        if (quantity <= 0) {
            throw new DomainValidationException("quantity must be positive: " + quantity);
        }
    }

    public CartItem withQuantity(int newQuantity) {
        return new CartItem(product, newQuantity);
    }

    public BigDecimal subtotal() {
        return product.price().multiply(BigDecimal.valueOf(quantity));
    }

    @Override
    public void validate() {
        product.validate();
    }

    @Override
    public List<Object> equalityComponents() {
        return Arrays.asList(product, quantity);
    }

    @Override
    public boolean equals(Object o) {
        return ValueObjects.valueObjectEquals(this, o);
    }

    @Override
    public int hashCode() {
        return ValueObjects.valueObjectHashCode(this);
    }
}

package io.lion.demo.starter.cart;

import io.lion.domain.AggregateRoot;
import io.lion.domain.DomainValidationException;
import io.lion.domain.Entities;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Shopping cart aggregate. Items are keyed by product SKU; adding a product that is
 * already in the cart increases its quantity.
 */
public class ShoppingCart implements AggregateRoot<UUID> {

    private final UUID id;
    private final String customerId;
    private final List<CartItem> items = new ArrayList<>();

    public ShoppingCart(UUID id, String customerId) {
        this.id = Objects.requireNonNull(id, "id");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
    }

    @Override
    public UUID id() {
        return id;
    }

    public String customerId() {
        return customerId;
    }

    public List<CartItem> items() {
        return List.copyOf(items);
    }

    public void addItem(Product product, int quantity) {
        if (product == null) {
            throw new DomainValidationException("product is required");
        }
        if (quantity <= 0) {
            throw new DomainValidationException("quantity must be positive: " + quantity);
        }
        for (int i = 0; i < items.size(); i++) {
            CartItem item = items.get(i);
            if (item.product().sku().equals(product.sku())) {
                items.set(i, item.withQuantity(item.quantity() + quantity));
                return;
            }
        }
        items.add(new CartItem(product, quantity));
    }

    public void removeItem(String sku) {
        if (!items.removeIf(item -> item.product().sku().equals(sku))) {
            throw new DomainValidationException("no item with sku " + sku + " in cart " + id);
        }
    }

    public BigDecimal total() {
        return items.stream().map(CartItem::subtotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean equals(Object o) {
        return Entities.entityEquals(this, o);
    }

    @Override
    public int hashCode() {
        return Entities.entityHashCode(this);
    }

    @Override
    public String toString() {
        return "ShoppingCart[id=" + id + ", items=" + items.size() + "]";
    }
}

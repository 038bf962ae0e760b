package io.lion.demo.starter.cart;

import io.lion.domain.DomainValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ShoppingCartTest {

    private final Product book = new Product("BK-1", "Domain-Driven Design", new BigDecimal("49.90"));
    private final Product pen = new Product("PN-7", "Pen", new BigDecimal("1.50"));

    @Test
    void addingSameProductMergesQuantities() {
        ShoppingCart cart = new ShoppingCart(UUID.randomUUID(), "c-1");
        cart.addItem(book, 1);
        cart.addItem(pen, 2);
        cart.addItem(book, 2);

        assertEquals(List.of(new CartItem(book, 3), new CartItem(pen, 2)), cart.items());
        assertEquals(new BigDecimal("152.70"), cart.total());
    }

    @Test
    void nonPositiveQuantityIsRejectedForProductAlreadyInCart() {
        ShoppingCart cart = new ShoppingCart(UUID.randomUUID(), "c-1");
        cart.addItem(pen, 3);

        var ex = assertThrows(DomainValidationException.class, () -> cart.addItem(pen, -2));
        assertEquals("quantity must be positive: -2", ex.getMessage());
        assertThrows(DomainValidationException.class, () -> cart.addItem(pen, 0));
        assertEquals(List.of(new CartItem(pen, 3)), cart.items());
    }

    @Test
    void nullProductIsRejectedWhetherOrNotCartIsEmpty() {
        ShoppingCart cart = new ShoppingCart(UUID.randomUUID(), "c-1");
        assertThrows(DomainValidationException.class, () -> cart.addItem(null, 1));
        cart.addItem(pen, 1);
        assertThrows(DomainValidationException.class, () -> cart.addItem(null, 1));
    }

    @Test
    void removingUnknownSkuFails() {
        ShoppingCart cart = new ShoppingCart(UUID.randomUUID(), "c-1");
        cart.addItem(pen, 1);
        cart.removeItem("PN-7");
        assertTrue(cart.items().isEmpty());
        assertThrows(DomainValidationException.class, () -> cart.removeItem("PN-7"));
    }

    @Test
    void cartsAreEqualByIdOnly() {
        UUID id = UUID.randomUUID();
        ShoppingCart first = new ShoppingCart(id, "c-1");
        ShoppingCart second = new ShoppingCart(id, "c-2");
        second.addItem(book, 1);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new ShoppingCart(UUID.randomUUID(), "c-1"));
    }

    @Test
    void productsIgnorePriceScale() {
        Product a = new Product("PN-7", "Pen", new BigDecimal("1.50"));
        Product b = new Product("PN-7", "Pen", new BigDecimal("1.5"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Product("PN-7", "Pen", new BigDecimal("1.55")));
    }

    @Test
    void invalidValuesAreRejected() {
        var ex = assertThrows(DomainValidationException.class,
                () -> new Product("PN-7", "Pen", new BigDecimal("-1")));
        assertEquals("price must be zero or positive", ex.getMessage());
        assertThrows(DomainValidationException.class, () -> new CartItem(pen, 0));
    }
}

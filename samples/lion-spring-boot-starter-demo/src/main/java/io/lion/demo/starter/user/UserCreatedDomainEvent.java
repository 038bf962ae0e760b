package io.lion.demo.starter.user;

import io.lion.domain.event.DomainEvent;

import java.util.Objects;

public record UserCreatedDomainEvent(String userId, String email, String firstName, String lastName)
        implements DomainEvent {

    public UserCreatedDomainEvent {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(firstName, "firstName");
        Objects.requireNonNull(lastName, "lastName");
    }

    public String fullName() {
        return firstName + " " + lastName;
    }
}

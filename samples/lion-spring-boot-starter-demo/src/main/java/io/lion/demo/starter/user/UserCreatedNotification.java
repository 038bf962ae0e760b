package io.lion.demo.starter.user;

import io.lion.domain.event.AbstractDomainEventNotification;

import java.util.Objects;

/**
 * A user was created. Carries the credentials needed by downstream mappers that the
 * domain event itself must not hold.
 */
public class UserCreatedNotification extends AbstractDomainEventNotification<UserCreatedDomainEvent> {

    private final String plaintextPassword;
    private final String activationToken;

    public UserCreatedNotification(UserCreatedDomainEvent domainEvent, String plaintextPassword,
                                   String activationToken) {
        super(domainEvent);
        this.plaintextPassword = Objects.requireNonNull(plaintextPassword, "plaintextPassword");
        this.activationToken = Objects.requireNonNull(activationToken, "activationToken");
    }

    public String plaintextPassword() {
        return plaintextPassword;
    }

    public String activationToken() {
        return activationToken;
    }
}

package io.lion.domain.event;

import io.lion.Event;

import java.util.Objects;

/**
 * Base class for notifications. Subclasses add their context fields as final fields.
 *
 * <pre>{@code
 * public final class UserCreatedNotification
 *     extends AbstractDomainEventNotification<UserCreatedDomainEvent> {
 *   private final String activationToken;
 *
 *   public UserCreatedNotification(UserCreatedDomainEvent event, String activationToken) {
 *     super(event);
 *     this.activationToken = Objects.requireNonNull(activationToken, "activationToken");
 *   }
 * }
 * }</pre>
 *
 * @param <E> the type of the wrapped event
 */
public abstract class AbstractDomainEventNotification<E extends Event> implements DomainEventNotification<E> {

    private final E domainEvent;

    /**
     * @param domainEvent the event that triggered this notification
     * @throws NullPointerException if {@code domainEvent} is null
     */
    protected AbstractDomainEventNotification(E domainEvent) {
        this.domainEvent = Objects.requireNonNull(domainEvent, "domainEvent");
    }

    @Override
    public final E domainEvent() {
        return domainEvent;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[domainEvent=" + domainEvent + "]";
    }
}

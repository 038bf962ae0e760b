package io.lion.domain.event;

import io.lion.Event;

/**
 * Wraps a domain event together with context that is not part of the event itself.
 *
 * <p>Typical extra context is data produced during the operation that must not be stored
 * on the event, such as a one-time activation token. Mappers receive the notification and
 * can read both the event and the context.
 *
 * @param <E> the type of the wrapped event
 * @see AbstractDomainEventNotification
 * @see io.lion.integration.EventMapper
 */
public interface DomainEventNotification<E extends Event> {

    /**
     * Returns the event that triggered this notification.
     *
     * @return the wrapped event, never null
     */
    E domainEvent();
}

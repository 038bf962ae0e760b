package io.lion.domain.event;

import io.lion.Event;

/**
 * A business-significant state change inside one bounded context.
 *
 * <p>Domain events stay in-process. To publish something to other services, wrap the
 * domain event in a {@link DomainEventNotification} and map it to
 * {@linkplain io.lion.integration.IntegrationEvent integration events}.
 */
public interface DomainEvent extends Event {
}

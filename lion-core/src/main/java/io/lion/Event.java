package io.lion;

/**
 * Root type for every event that crosses a boundary, in-process or between services.
 *
 * <p>The interface declares no members. The two sub-types only differ in which channel
 * consumes them:
 * <ul>
 *   <li>{@link io.lion.domain.event.DomainEvent} for business facts inside one bounded context</li>
 *   <li>{@link io.lion.integration.IntegrationEvent} for contracts published to other services</li>
 * </ul>
 */
public interface Event {
}

package io.lion.integration;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Converts a domain notification into integration events.
 *
 * <p>One notification can produce any number of integration events, including none.
 * Implementations are discovered by {@link io.lion.registry.MapperTypeScanner} and must be
 * concrete classes with a no-arg constructor; a new instance is created for each resolution.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public class UserCreatedEventMapper implements EventMapper<UserCreatedNotification> {
 *   @Override
 *   public CompletableFuture<List<IntegrationEvent>> createEvents(UserCreatedNotification n) {
 *     var event = n.domainEvent();
 *     return CompletableFuture.completedFuture(List.of(
 *         new UserRegisteredIntegrationEvent(event.userId(), event.email()),
 *         new WelcomeEmailIntegrationEvent(event.email(), n.activationToken())));
 *   }
 * }
 * }</pre>
 *
 * <h2>Cancellation and Errors</h2>
 * <p>Callers cancel by cancelling the returned future. Failures either complete the
 * future exceptionally or are thrown directly; this layer defines no retry policy.
 *
 * @param <N> the notification type
 * @see FlexibleEventMapper
 */
public interface EventMapper<N> {

    /**
     * Creates the integration events for a notification.
     *
     * @param notification the notification with the domain event and its context
     * @return a future completing with the events to publish, never null
     */
    CompletableFuture<List<IntegrationEvent>> createEvents(N notification);
}

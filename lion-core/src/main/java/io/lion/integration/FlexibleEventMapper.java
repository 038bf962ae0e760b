package io.lion.integration;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Untyped variant of {@link EventMapper}.
 *
 * <p>Returns plain objects so that messaging frameworks with their own event types can be
 * fed directly. The results are usually {@link IntegrationEvent} instances, but any object
 * is allowed.
 *
 * <p>The method has its own name so that one class can implement both capabilities for the
 * same notification type.
 *
 * @param <N> the notification type
 */
public interface FlexibleEventMapper<N> {

    /**
     * Creates the outbound events for a notification.
     *
     * @param notification the notification with the domain event and its context
     * @return a future completing with the events to publish, never null
     */
    CompletableFuture<List<Object>> createPayloads(N notification);
}

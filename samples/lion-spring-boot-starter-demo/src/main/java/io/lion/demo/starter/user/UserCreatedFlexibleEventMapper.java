package io.lion.demo.starter.user;

import io.lion.integration.FlexibleEventMapper;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Produces a mix of integration events and plain payloads for consumers that do not
 * understand {@code IntegrationEvent}.
 */
public class UserCreatedFlexibleEventMapper implements FlexibleEventMapper<UserCreatedNotification> {

    @Override
    public CompletableFuture<List<Object>> createPayloads(UserCreatedNotification notification) {
        UserCreatedDomainEvent event = notification.domainEvent();
        return CompletableFuture.completedFuture(List.of(
                new UserRegisteredIntegrationEvent(event.userId(), event.email(), event.fullName()),
                Map.of("eventType", "UserCreated", "userId", event.userId())));
    }
}

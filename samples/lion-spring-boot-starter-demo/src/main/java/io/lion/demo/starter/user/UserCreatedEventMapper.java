package io.lion.demo.starter.user;

import io.lion.integration.EventMapper;
import io.lion.integration.IntegrationEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fans a created user out to registration, welcome-email and analytics events.
 */
public class UserCreatedEventMapper implements EventMapper<UserCreatedNotification> {

    @Override
    public CompletableFuture<List<IntegrationEvent>> createEvents(UserCreatedNotification notification) {
        UserCreatedDomainEvent event = notification.domainEvent();
        return CompletableFuture.completedFuture(List.of(
                new UserRegisteredIntegrationEvent(event.userId(), event.email(), event.fullName()),
                new WelcomeEmailIntegrationEvent(event.email(), event.firstName(), notification.activationToken()),
                new UserAnalyticsIntegrationEvent(event.userId(), event.email())));
    }
}

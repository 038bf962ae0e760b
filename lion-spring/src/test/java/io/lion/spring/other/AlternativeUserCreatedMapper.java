package io.lion.spring.other;

import io.lion.integration.EventMapper;
import io.lion.integration.IntegrationEvent;
import io.lion.spring.mappers.UserCreatedNotification;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public class AlternativeUserCreatedMapper implements EventMapper<UserCreatedNotification> {

    @Override
    public CompletableFuture<List<IntegrationEvent>> createEvents(UserCreatedNotification notification) {
        return CompletableFuture.completedFuture(List.of());
    }
}

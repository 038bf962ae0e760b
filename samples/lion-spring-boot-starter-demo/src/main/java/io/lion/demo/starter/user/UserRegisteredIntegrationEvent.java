package io.lion.demo.starter.user;

import io.lion.integration.IntegrationEvent;

public record UserRegisteredIntegrationEvent(String userId, String email, String fullName)
        implements IntegrationEvent {
}

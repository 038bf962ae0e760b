package io.lion.demo.starter.user;

import io.lion.integration.IntegrationEvent;

public record WelcomeEmailIntegrationEvent(String email, String firstName, String activationToken)
        implements IntegrationEvent {
}

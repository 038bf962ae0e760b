package io.lion.demo.starter.user;

import io.lion.integration.IntegrationEvent;

public record UserAnalyticsIntegrationEvent(String userId, String email) implements IntegrationEvent {
}

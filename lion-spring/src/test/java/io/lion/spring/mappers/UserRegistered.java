package io.lion.spring.mappers;

import io.lion.integration.IntegrationEvent;

public record UserRegistered(String userId) implements IntegrationEvent {
}

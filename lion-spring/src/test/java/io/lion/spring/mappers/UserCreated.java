package io.lion.spring.mappers;

import io.lion.domain.event.DomainEvent;

public record UserCreated(String userId, String email) implements DomainEvent {
}

package io.lion.demo.starter;

import io.lion.demo.starter.user.UserCreatedDomainEvent;
import io.lion.demo.starter.user.UserCreatedNotification;
import io.lion.integration.IntegrationEvent;
import io.lion.registry.MapperRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class UserRegistrationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(UserRegistrationRunner.class);

    private final MapperRegistry mappers;

    public UserRegistrationRunner(MapperRegistry mappers) {
        this.mappers = mappers;
    }

    @Override
    public void run(String... args) {
        mappers.registrations().forEach(r -> log.info("[Registry] {}", r));

        UserCreatedNotification notification = new UserCreatedNotification(
                new UserCreatedDomainEvent(UUID.randomUUID().toString(), "alice@example.com", "Alice", "Smith"),
                "s3cret",
                UUID.randomUUID().toString());

        mappers.eventMapperFor(UserCreatedNotification.class).ifPresent(mapper -> {
            List<IntegrationEvent> events = mapper.createEvents(notification).join();
            events.forEach(e -> log.info("[EventMapper] {}", e));
        });
        mappers.flexibleEventMapperFor(UserCreatedNotification.class).ifPresent(mapper -> {
            List<Object> payloads = mapper.createPayloads(notification).join();
            payloads.forEach(p -> log.info("[FlexibleEventMapper] {}", p));
        });
    }
}

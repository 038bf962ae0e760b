package io.lion.domain.event;

import org.junit.jupiter.api.Test;

import java.util.Objects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AbstractDomainEventNotificationTest {

    @Test
    void exposesWrappedEventAndContext() {
        UserCreated event = new UserCreated("u1", "alice@example.com");
        UserCreatedNotification notification = new UserCreatedNotification(event, "token-123");

        assertSame(event, notification.domainEvent());
        assertEquals("token-123", notification.activationToken());
    }

    @Test
    void rejectsNullEvent() {
        NullPointerException ex = assertThrows(NullPointerException.class,
                () -> new UserCreatedNotification(null, "token-123"));
        assertEquals("domainEvent", ex.getMessage());
    }

    @Test
    void toStringNamesNotificationAndEvent() {
        UserCreatedNotification notification =
                new UserCreatedNotification(new UserCreated("u1", "alice@example.com"), "t");

        assertTrue(notification.toString().startsWith("UserCreatedNotification[domainEvent=UserCreated["));
    }

    record UserCreated(String userId, String email) implements DomainEvent {
    }

    static final class UserCreatedNotification extends AbstractDomainEventNotification<UserCreated> {
        private final String activationToken;

        UserCreatedNotification(UserCreated event, String activationToken) {
            super(event);
            this.activationToken = Objects.requireNonNull(activationToken, "activationToken");
        }

        String activationToken() {
            return activationToken;
        }
    }
}

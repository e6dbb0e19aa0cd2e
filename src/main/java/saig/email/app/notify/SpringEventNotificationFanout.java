package saig.email.app.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands change events to Spring's event bus, where push transports subscribe.
 * A failing listener is logged and never fails the mutation that produced the event.
 */
@Slf4j
@Component
public class SpringEventNotificationFanout implements NotificationFanout {
    private final ApplicationEventPublisher eventPublisher;

    public SpringEventNotificationFanout(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void publish(String accountId, MailboxChangeEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for account {}: {}", event.getType(), accountId, e.getMessage(), e);
        }
    }
}

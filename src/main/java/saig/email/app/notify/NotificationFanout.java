package saig.email.app.notify;

import java.util.List;

/**
 * Delivers change events to connected clients. Callers publish only after the
 * owning transaction has committed.
 */
public interface NotificationFanout {
    void publish(String accountId, MailboxChangeEvent event);

    default void publishAll(List<MailboxChangeEvent> events) {
        for (MailboxChangeEvent event : events) {
            publish(event.getAccountId(), event);
        }
    }
}

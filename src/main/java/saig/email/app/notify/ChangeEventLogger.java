package saig.email.app.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ChangeEventLogger {

    @EventListener
    public void onChange(MailboxChangeEvent event) {
        log.debug("Mailbox change for account {}: {} {}", event.getAccountId(), event.getType(), event.getEntityId());
    }
}

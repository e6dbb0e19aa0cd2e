package saig.email.app.notify;

import lombok.Value;

/**
 * What changed, for connected clients. Carries ids only; clients re-read the entity.
 */
@Value
public class MailboxChangeEvent {
    String accountId;
    ChangeType type;
    String entityId;

    public static MailboxChangeEvent emailCreated(String accountId, String emailId) {
        return new MailboxChangeEvent(accountId, ChangeType.EMAIL_CREATED, emailId);
    }

    public static MailboxChangeEvent emailUpdated(String accountId, String emailId) {
        return new MailboxChangeEvent(accountId, ChangeType.EMAIL_UPDATED, emailId);
    }

    public static MailboxChangeEvent actionItemCreated(String accountId, String actionItemId) {
        return new MailboxChangeEvent(accountId, ChangeType.ACTION_ITEM_CREATED, actionItemId);
    }

    public static MailboxChangeEvent actionItemUpdated(String accountId, String actionItemId) {
        return new MailboxChangeEvent(accountId, ChangeType.ACTION_ITEM_UPDATED, actionItemId);
    }

    public static MailboxChangeEvent trashPurged(String accountId, String emailId) {
        return new MailboxChangeEvent(accountId, ChangeType.TRASH_PURGED, emailId);
    }

    public static MailboxChangeEvent huddleUpdated(String accountId, String huddleId) {
        return new MailboxChangeEvent(accountId, ChangeType.HUDDLE_UPDATED, huddleId);
    }
}

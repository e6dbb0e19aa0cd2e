package saig.email.app.notify;

public enum ChangeType {
    EMAIL_CREATED,
    EMAIL_UPDATED,
    ACTION_ITEM_CREATED,
    ACTION_ITEM_UPDATED,
    TRASH_PURGED,
    HUDDLE_UPDATED
}

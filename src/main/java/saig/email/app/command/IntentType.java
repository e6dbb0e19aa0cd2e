package saig.email.app.command;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of operations the interpreter executes.
 */
public enum IntentType {
    SEARCH,
    MARK_READ,
    MARK_UNREAD,
    STAR,
    UNSTAR,
    MOVE_TO_TRASH,
    RESTORE,
    COMPOSE,
    REPLY,
    CREATE_ACTION_ITEM,
    COMPLETE_ACTION_ITEM,
    DISMISS_ACTION_ITEM,
    LIST_ACTION_ITEMS,
    CREATE_HUDDLE,
    HELP;

    /**
     * Accepts "markRead", "mark_read", "MARK-READ" and similar spellings.
     */
    public static Optional<IntentType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.strip()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        for (IntentType type : values()) {
            if (type.name().equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

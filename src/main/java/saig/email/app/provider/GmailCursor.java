package saig.email.app.provider;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Parsed form of the opaque position string handed out by {@link GmailMailboxAdapter}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class GmailCursor {
    private static final String LIST = "list";
    private static final String HISTORY = "history";

    String mode;
    String historyId;
    String pageToken;

    static GmailCursor initial() {
        return new GmailCursor(LIST, null, null);
    }

    static GmailCursor listing(String historyId, String pageToken) {
        return new GmailCursor(LIST, historyId, pageToken);
    }

    static GmailCursor history(String historyId, String pageToken) {
        return new GmailCursor(HISTORY, historyId, pageToken);
    }

    /**
     * Unknown or malformed positions restart with a full listing.
     */
    static GmailCursor parse(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return initial();
        }
        String[] parts = cursor.split(":", 3);
        if (parts.length < 2 || !parts[1].matches("\\d+")) {
            return initial();
        }
        String token = parts.length == 3 && !parts[2].isEmpty() ? parts[2] : null;
        if (HISTORY.equals(parts[0])) {
            return history(parts[1], token);
        }
        if (LIST.equals(parts[0])) {
            return listing(parts[1], token);
        }
        return initial();
    }

    boolean isHistory() {
        return HISTORY.equals(mode);
    }

    String format() {
        StringBuilder sb = new StringBuilder(mode).append(':').append(historyId != null ? historyId : "0");
        if (pageToken != null) {
            sb.append(':').append(pageToken);
        }
        return sb.toString();
    }
}

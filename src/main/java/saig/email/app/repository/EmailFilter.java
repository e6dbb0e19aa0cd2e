package saig.email.app.repository;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Match criteria over local emails. Null fields do not constrain the match.
 */
@Value
@Builder(toBuilder = true)
public class EmailFilter {
    String query;
    String sender;
    String subjectContains;
    String label;
    Boolean unread;
    Boolean starred;
    Boolean urgent;
    Instant receivedAfter;
    Instant receivedBefore;
    boolean inTrash;

    /**
     * True when at least one criterion narrows the match set.
     */
    public boolean isConstrained() {
        return hasText(query) || hasText(sender) || hasText(subjectContains) || hasText(label)
                || unread != null || starred != null || urgent != null || receivedAfter != null || receivedBefore != null;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

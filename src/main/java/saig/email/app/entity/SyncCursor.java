package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Per-account provider position. Only the account's sync tick writes it.
 */
@Entity
@Table(name = "sync_cursors")
@Getter
@Setter
@ToString
public class SyncCursor {
    @Id
    @Column(name = "account_id")
    private String accountId;

    /** Opaque provider position; null before the first committed page. */
    @Column(name = "cursor_position", length = 2000)
    private String position;

    private Instant lastSuccessAt;

    private int consecutiveFailures;

    private Instant nextAttemptAt;

    @Column(length = 2000)
    private String lastError;

    private int lastIngestedCount;

    public static SyncCursor initial(String accountId) {
        SyncCursor cursor = new SyncCursor();
        cursor.setAccountId(accountId);
        return cursor;
    }

    public SyncCursor copy() {
        SyncCursor copy = new SyncCursor();
        copy.setAccountId(accountId);
        copy.setPosition(position);
        copy.setLastSuccessAt(lastSuccessAt);
        copy.setConsecutiveFailures(consecutiveFailures);
        copy.setNextAttemptAt(nextAttemptAt);
        copy.setLastError(lastError);
        copy.setLastIngestedCount(lastIngestedCount);
        return copy;
    }
}

package saig.email.app.service;

import saig.email.app.entity.SyncStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of an account's sync progress.
 */
@Value
@Builder
public class SyncState {
    String accountId;
    SyncStatus status;
    boolean inFlight;
    Instant lastSuccessAt;
    int consecutiveFailures;
    Instant nextAttemptAt;
    int lastIngestedCount;
    String lastError;
    String suspendedReason;
}

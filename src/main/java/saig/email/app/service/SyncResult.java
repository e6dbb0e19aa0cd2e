package saig.email.app.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncResult {
    String accountId;
    SyncOutcome outcome;
    int pages;
    int created;
    int updated;
    int extractionPasses;
    int actionItemsCreated;
    /** Cursor position after the last committed page. */
    String cursor;
    String error;

    public static SyncResult of(String accountId, SyncOutcome outcome) {
        return SyncResult.builder().accountId(accountId).outcome(outcome).build();
    }
}

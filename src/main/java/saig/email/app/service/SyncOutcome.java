package saig.email.app.service;

public enum SyncOutcome {
    COMPLETED,
    /** Another tick for the account holds the account lock. */
    SKIPPED_IN_FLIGHT,
    SKIPPED_DISABLED,
    SUSPENDED,
    CANCELLED,
    FAILED_TRANSIENT,
    FAILED
}

package saig.email.app.entity;

public enum SyncStatus {
    ACTIVE,
    /** Token expired or revoked; scheduling is suspended until a valid token is stored. */
    UNAUTHENTICATED,
    DISABLED
}

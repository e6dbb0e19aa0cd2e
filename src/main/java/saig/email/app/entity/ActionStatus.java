package saig.email.app.entity;

public enum ActionStatus {
    PENDING,
    COMPLETED,
    DISMISSED
}

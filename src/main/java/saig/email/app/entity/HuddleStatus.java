package saig.email.app.entity;

public enum HuddleStatus {
    ACTIVE,
    ARCHIVED
}

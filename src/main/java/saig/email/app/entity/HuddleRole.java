package saig.email.app.entity;

public enum HuddleRole {
    OWNER,
    MEMBER
}

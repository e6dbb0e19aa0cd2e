package saig.email.app.entity;

public enum ActionSource {
    EXTRACTED,
    USER,
    ASSISTANT
}

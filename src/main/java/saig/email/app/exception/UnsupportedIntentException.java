package saig.email.app.exception;

public class UnsupportedIntentException extends MailEngineException {
    private final String intentName;

    public UnsupportedIntentException(String intentName) {
        super("Unsupported intent: " + intentName);
        this.intentName = intentName;
    }

    public String getIntentName() {
        return intentName;
    }
}

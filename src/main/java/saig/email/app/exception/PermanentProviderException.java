package saig.email.app.exception;

public class PermanentProviderException extends MailEngineException {
    public PermanentProviderException(String message) {
        super(message);
    }

    public PermanentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

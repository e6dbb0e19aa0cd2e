package saig.email.app.exception;

/**
 * A row-level mutation lost a race with a concurrent writer.
 */
public class ConflictException extends MailEngineException {
    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package saig.email.app.exception;

/**
 * Base type for failures raised by the sync, trash and command components.
 */
public abstract class MailEngineException extends RuntimeException {
    protected MailEngineException(String message) {
        super(message);
    }

    protected MailEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same single operation later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}

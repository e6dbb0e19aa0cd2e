package saig.email.app.exception;

/**
 * Network failure or rate limit from the remote mailbox. Retried with backoff.
 */
public class TransientProviderException extends MailEngineException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

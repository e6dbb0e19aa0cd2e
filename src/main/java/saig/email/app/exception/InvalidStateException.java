package saig.email.app.exception;

/**
 * A trash lifecycle transition was requested from a state that does not allow it.
 */
public class InvalidStateException extends MailEngineException {
    public InvalidStateException(String message) {
        super(message);
    }
}

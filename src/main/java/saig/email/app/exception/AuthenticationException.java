package saig.email.app.exception;

/**
 * The account's token is expired or revoked and could not be refreshed.
 */
public class AuthenticationException extends MailEngineException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}

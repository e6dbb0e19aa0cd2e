package saig.email.app.exception;

public class PermissionDeniedException extends MailEngineException {
    public PermissionDeniedException(String message) {
        super(message);
    }
}

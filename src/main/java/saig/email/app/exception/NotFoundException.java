package saig.email.app.exception;

public class NotFoundException extends MailEngineException {
    public NotFoundException(String message) {
        super(message);
    }
}

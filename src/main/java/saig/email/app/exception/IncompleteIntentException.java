package saig.email.app.exception;

import java.util.List;

/**
 * Required parameters were missing; nothing was executed.
 */
public class IncompleteIntentException extends MailEngineException {
    private final String intentName;
    private final List<String> missingParameters;

    public IncompleteIntentException(String intentName, List<String> missingParameters) {
        super("Intent '" + intentName + "' is missing required parameters: " + String.join(", ", missingParameters));
        this.intentName = intentName;
        this.missingParameters = List.copyOf(missingParameters);
    }

    public String getIntentName() {
        return intentName;
    }

    public List<String> getMissingParameters() {
        return missingParameters;
    }
}

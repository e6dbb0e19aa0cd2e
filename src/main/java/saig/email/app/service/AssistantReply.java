package saig.email.app.service;

import saig.email.app.command.CommandResult;
import lombok.Value;

/**
 * What the assistant tells the user, plus the command result when a command ran.
 */
@Value
public class AssistantReply {
    String message;
    /** Null when nothing was executed. */
    CommandResult result;

    public boolean isExecuted() {
        return result != null;
    }
}

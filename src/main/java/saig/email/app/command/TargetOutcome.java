package saig.email.app.command;

import lombok.Value;

/**
 * Result of applying an intent to one target.
 */
@Value
public class TargetOutcome {
    String targetId;
    boolean success;
    String error;

    public static TargetOutcome ok(String targetId) {
        return new TargetOutcome(targetId, true, null);
    }

    public static TargetOutcome failed(String targetId, String error) {
        return new TargetOutcome(targetId, false, error);
    }
}

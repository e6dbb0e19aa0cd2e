package saig.email.app.command;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.Email;
import saig.email.app.entity.Huddle;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CommandResult {
    IntentType intent;
    /** True only when every target succeeded. */
    boolean success;
    String message;
    @Singular
    List<TargetOutcome> outcomes;
    @Singular
    List<Email> emails;
    @Singular
    List<ActionItem> actionItems;
    Huddle huddle;

    public long successCount() {
        return outcomes.stream().filter(TargetOutcome::isSuccess).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }
}

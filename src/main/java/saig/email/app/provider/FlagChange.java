package saig.email.app.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Flag edits to push to the remote mailbox. Null means unchanged.
 */
@Value
@Builder
public class FlagChange {
    Boolean read;
    Boolean starred;

    public static FlagChange read(boolean read) {
        return FlagChange.builder().read(read).build();
    }

    public static FlagChange starred(boolean starred) {
        return FlagChange.builder().starred(starred).build();
    }
}

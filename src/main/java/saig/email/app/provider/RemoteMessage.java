package saig.email.app.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * One message as reported by the remote mailbox.
 */
@Value
@Builder
public class RemoteMessage {
    String remoteId;
    String threadId;
    String messageIdHeader;
    String sender;
    String recipients;
    String subject;
    String body;
    Instant receivedAt;
    boolean read;
    boolean starred;
    boolean trashed;
    @Singular
    Set<String> labels;
    /** Provider revision of this record; 0 when unknown. */
    long syncVersion;
}

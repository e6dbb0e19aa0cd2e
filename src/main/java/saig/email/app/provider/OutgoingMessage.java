package saig.email.app.provider;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OutgoingMessage {
    String from;
    List<String> to;
    List<String> cc;
    String subject;
    String body;
    /** Set for replies. */
    String threadId;
    String inReplyTo;
}

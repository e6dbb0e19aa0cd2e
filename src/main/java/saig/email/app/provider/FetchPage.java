package saig.email.app.provider;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FetchPage {
    List<RemoteMessage> records;
    /** Position to resume from once this page is committed. */
    String nextCursor;
    boolean hasMore;
}

package saig.email.app.provider;

import saig.email.app.entity.MailAccount;

/**
 * Operations against the user's hosted mailbox.
 * Every method fails with {@link saig.email.app.exception.TransientProviderException},
 * {@link saig.email.app.exception.PermanentProviderException} or
 * {@link saig.email.app.exception.AuthenticationException}.
 */
public interface RemoteMailboxAdapter {
    /**
     * Fetch the next page of changes after the given position.
     * @param account Mailbox account
     * @param accessToken Valid OAuth access token
     * @param cursor Opaque position from a previous page, or null for a first sync
     * @param pageSize Maximum number of records in the page
     */
    FetchPage fetchSince(MailAccount account, String accessToken, String cursor, int pageSize);

    void applyFlags(MailAccount account, String accessToken, String remoteId, FlagChange flags);

    void trash(MailAccount account, String accessToken, String remoteId);

    void untrash(MailAccount account, String accessToken, String remoteId);

    /**
     * Send a message.
     * @return remote id of the sent copy
     */
    String send(MailAccount account, String accessToken, OutgoingMessage message);
}

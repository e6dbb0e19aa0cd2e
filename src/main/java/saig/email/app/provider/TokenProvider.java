package saig.email.app.provider;

import saig.email.app.entity.MailAccount;

public interface TokenProvider {
    /**
     * Return an access token usable right now, refreshing it if needed.
     * @throws saig.email.app.exception.AuthenticationException if the account must be re-authorized
     * @throws saig.email.app.exception.TransientProviderException if the token endpoint could not be reached
     */
    String getValidToken(MailAccount account);
}

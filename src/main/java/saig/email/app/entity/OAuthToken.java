package saig.email.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

@Embeddable
@Data
public class OAuthToken {
    @Column(name = "access_token", length = 4000)
    private String accessToken;

    @Column(name = "refresh_token", length = 4000)
    private String refreshToken;

    @Column(name = "token_expiry")
    private Instant expiry;

    private String scopes;

    /**
     * A missing expiry is treated as already expired.
     */
    public boolean expiresWithin(Duration window, Instant now) {
        return expiry == null || expiry.isBefore(now.plus(window));
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }
}

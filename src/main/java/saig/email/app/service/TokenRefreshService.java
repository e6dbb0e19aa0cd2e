package saig.email.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import saig.email.app.entity.MailAccount;
import saig.email.app.entity.OAuthToken;
import saig.email.app.entity.SyncStatus;
import saig.email.app.exception.AuthenticationException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.TransientProviderException;
import saig.email.app.provider.TokenProvider;
import saig.email.app.repository.MailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps Google access tokens fresh using the stored refresh token.
 * Never changes an account's sync status itself: the scheduler decides what an
 * {@link AuthenticationException} means for scheduling.
 */
@Slf4j
@Service
public class TokenRefreshService implements TokenProvider {
    private static final String TOKEN_URI = "https://oauth2.googleapis.com/token";
    private static final Duration REFRESH_WINDOW = Duration.ofMinutes(5);

    private final MailAccountRepository mailAccountRepository;
    private final Clock clock;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${spring.security.oauth2.client.registration.google.client-id:}")
    private String clientId;

    @Value("${spring.security.oauth2.client.registration.google.client-secret:}")
    private String clientSecret;

    public TokenRefreshService(MailAccountRepository mailAccountRepository, Clock clock) {
        this.mailAccountRepository = mailAccountRepository;
        this.clock = clock;
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    private void validateClientCredentials() {
        if (clientId == null || clientId.isEmpty() || clientId.startsWith("${")) {
            throw new IllegalStateException("Google OAuth client-id is not configured. Please set spring.security.oauth2.client.registration.google.client-id");
        }
        if (clientSecret == null || clientSecret.isEmpty() || clientSecret.startsWith("${")) {
            throw new IllegalStateException("Google OAuth client-secret is not configured. Please set spring.security.oauth2.client.registration.google.client-secret");
        }
    }

    /**
     * Returns the stored access token, refreshing it first when it expires within five minutes.
     */
    @Override
    @Transactional
    public String getValidToken(MailAccount account) {
        OAuthToken token = account.getToken();
        if (token == null || token.getAccessToken() == null) {
            throw new AuthenticationException("No access token available for account: " + account.getEmailAddress());
        }

        if (!token.expiresWithin(REFRESH_WINDOW, clock.instant())) {
            return token.getAccessToken();
        }

        if (!token.hasRefreshToken()) {
            throw new AuthenticationException("Access token expired and no refresh token available for account: "
                    + account.getEmailAddress() + ". Please re-authenticate.");
        }

        log.info("Refreshing access token for account: {}", account.getEmailAddress());
        refreshAccessToken(account);
        return account.getToken().getAccessToken();
    }

    /**
     * Exchanges the refresh token for a new access token and stores it on the account.
     */
    @Transactional
    public void refreshAccessToken(MailAccount account) {
        validateClientCredentials();
        OAuthToken token = account.getToken();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", token.getRefreshToken());
        body.add("grant_type", "refresh_token");

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(TOKEN_URI, new HttpEntity<>(body, headers), String.class);
        } catch (HttpClientErrorException e) {
            // 400 invalid_grant / 401: the refresh token was revoked or has expired.
            throw new AuthenticationException("Refresh token rejected for account " + account.getEmailAddress()
                    + ": " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new TransientProviderException("Token endpoint unavailable for account " + account.getEmailAddress()
                    + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new TransientProviderException("Failed to refresh token. Status: " + response.getStatusCode());
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new TransientProviderException("Unreadable token response: " + e.getMessage(), e);
        }
        if (!json.has("access_token")) {
            throw new AuthenticationException("Token refresh response missing access_token for account " + account.getEmailAddress());
        }

        long expiresInSeconds = json.has("expires_in") ? json.get("expires_in").asLong() : 3600;
        Instant expiry = clock.instant().plusSeconds(expiresInSeconds);

        token.setAccessToken(json.get("access_token").asText());
        token.setExpiry(expiry);
        if (json.has("refresh_token") && !json.get("refresh_token").isNull()) {
            token.setRefreshToken(json.get("refresh_token").asText());
        }
        account.setToken(token);
        mailAccountRepository.save(account);
        log.info("Token refreshed successfully for account: {}, expires at: {}", account.getEmailAddress(), expiry);
    }

    /**
     * Entry point for the OAuth flow once the user has re-authorized: stores the new token and
     * clears any suspension so the next scheduler pass picks the account up again.
     */
    @Transactional
    public MailAccount storeToken(String accountId, String accessToken, String refreshToken, Instant expiry, String scopes) {
        MailAccount account = mailAccountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));

        OAuthToken token = account.getToken() != null ? account.getToken() : new OAuthToken();
        token.setAccessToken(accessToken);
        if (refreshToken != null) {
            token.setRefreshToken(refreshToken);
        }
        token.setExpiry(expiry);
        token.setScopes(scopes);
        account.setToken(token);

        if (account.getSyncStatus() == SyncStatus.UNAUTHENTICATED) {
            account.setSyncStatus(SyncStatus.ACTIVE);
            account.setSuspendedAt(null);
            account.setSuspendedReason(null);
            log.info("Account {} re-authorized, sync resumes", account.getEmailAddress());
        }
        return mailAccountRepository.save(account);
    }
}

package email.agent.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.agent.app.entity.GmailAccount;
import email.agent.app.entity.OAuthToken;
import email.agent.app.entity.SyncStatus;
import email.agent.app.repository.GmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * Keeps the Gmail access token of a connected mailbox fresh and records when it can't be.
 */
@Slf4j
@Service
public class TokenRefreshService {
    static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    // Refresh this long before the recorded expiry
    private static final long EXPIRY_SKEW_SECONDS = 300;

    private final GmailAccountRepository gmailAccountRepository;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${google.oauth.client-id:}")
    private String clientId;

    @Value("${google.oauth.client-secret:}")
    private String clientSecret;

    public TokenRefreshService(GmailAccountRepository gmailAccountRepository, RestTemplate restTemplate) {
        this.gmailAccountRepository = gmailAccountRepository;
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Returns a usable access token, refreshing it first when it is expired or close to expiry.
     * Marks the account EXPIRED when there is no refresh token and ERROR when the refresh fails.
     */
    public String ensureValidAccessToken(GmailAccount account) {
        OAuthToken token = requireToken(account);
        boolean needsRefresh = token.getExpiry() == null
            || token.getExpiry().isBefore(Instant.now().plusSeconds(EXPIRY_SKEW_SECONDS));
        if (!needsRefresh) {
            return token.getAccessToken();
        }
        log.info("Access token for {} expires at {}, refreshing", account.getEmailAddress(), token.getExpiry());
        return refreshOrMarkFailed(account);
    }

    /**
     * Called after Gmail rejected the current token with 401.
     */
    public String refreshTokenOn401(GmailAccount account) {
        requireToken(account);
        log.info("Received 401, refreshing access token for account: {}", account.getEmailAddress());
        return refreshOrMarkFailed(account);
    }

    private OAuthToken requireToken(GmailAccount account) {
        if (account.getToken() == null || account.getToken().getAccessToken() == null) {
            throw new IllegalStateException("No access token available for account: " + account.getEmailAddress());
        }
        return account.getToken();
    }

    private String refreshOrMarkFailed(GmailAccount account) {
        String refreshToken = account.getToken().getRefreshToken();
        if (refreshToken == null || refreshToken.isEmpty()) {
            account.setSyncStatus(SyncStatus.EXPIRED);
            gmailAccountRepository.save(account);
            throw new IllegalStateException("Access token expired and no refresh token available for account: "
                + account.getEmailAddress() + ". Please reconnect the mailbox.");
        }

        try {
            refreshAccessToken(account);
            return account.getToken().getAccessToken();
        } catch (Exception e) {
            account.setSyncStatus(SyncStatus.ERROR);
            gmailAccountRepository.save(account);
            log.error("Failed to refresh access token for account {}: {}", account.getEmailAddress(), e.getMessage(), e);
            throw new IllegalStateException("Failed to refresh access token for account: " + account.getEmailAddress(), e);
        }
    }

    /**
     * Exchanges the refresh token at Google's token endpoint and stores the new access token on the account.
     */
    void refreshAccessToken(GmailAccount account) throws Exception {
        if (clientId == null || clientId.isEmpty() || clientSecret == null || clientSecret.isEmpty()) {
            throw new IllegalStateException("Google OAuth client is not configured. Please set google.oauth.client-id and google.oauth.client-secret");
        }

        OAuthToken token = account.getToken();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", token.getRefreshToken());
        body.add("grant_type", "refresh_token");

        ResponseEntity<String> response = restTemplate.postForEntity(TOKEN_ENDPOINT, new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException("Failed to refresh token. Status: " + response.getStatusCode() + ", Body: " + response.getBody());
        }

        JsonNode json = objectMapper.readTree(response.getBody());
        if (!json.hasNonNull("access_token")) {
            throw new IllegalStateException("Token refresh response missing access_token");
        }

        Instant expiresAt = Instant.now().plusSeconds(json.path("expires_in").asLong(3600));
        token.setAccessToken(json.get("access_token").asText());
        token.setExpiry(expiresAt);
        // Google rarely rotates the refresh token, keep the old one otherwise
        if (json.hasNonNull("refresh_token")) {
            token.setRefreshToken(json.get("refresh_token").asText());
        }
        account.setToken(token);
        account.setSyncStatus(SyncStatus.ACTIVE);
        gmailAccountRepository.save(account);
        log.info("Token refreshed for account: {}, expires at: {}", account.getEmailAddress(), expiresAt);
    }
}

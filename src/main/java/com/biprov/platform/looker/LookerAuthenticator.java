package com.biprov.platform.looker;

import com.biprov.platform.PlatformException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Obtains and caches the Looker API access token.
 *
 * Tokens come from {@code POST /login} with the API client credentials and are reused until
 * shortly before they expire. A 401 from any call invalidates the cached token; the failed
 * call itself is not repeated.
 */
public class LookerAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(LookerAuthenticator.class);

    /**
     * Tokens are refreshed this long before their advertised expiry.
     */
    private static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final String clientId;
    private final String clientSecret;
    private final Duration timeout;
    private final Clock clock;

    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public LookerAuthenticator(WebClient webClient, String clientId, String clientSecret, Duration timeout, Clock clock) {
        this.webClient = webClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.timeout = timeout;
        this.clock = clock;
    }

    public synchronized String token() {
        Instant now = clock.instant();
        if (accessToken != null && now.isBefore(expiresAt.minus(EXPIRY_SKEW))) {
            return accessToken;
        }
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new PlatformException("login", "Looker API credentials are not configured");
        }

        JsonNode response;
        try {
            response = webClient.post()
                .uri("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("client_id", clientId).with("client_secret", clientSecret))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);
        } catch (WebClientResponseException e) {
            throw new PlatformException("login", "Looker login rejected", e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new PlatformException("login", "Looker login failed: " + e.getMessage(), e);
        }

        if (response == null || !response.hasNonNull("access_token")) {
            throw new PlatformException("login", "Looker login returned no access token");
        }
        accessToken = response.get("access_token").asText();
        expiresAt = now.plusSeconds(response.path("expires_in").asLong(3600));
        log.debug("Obtained Looker API token valid until {}", expiresAt);
        return accessToken;
    }

    public synchronized void invalidate() {
        accessToken = null;
        expiresAt = Instant.EPOCH;
    }
}

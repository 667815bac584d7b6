package com.securityops.devicesync.client.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.exception.TokenAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * OAuth 2.0 client-credentials token source for one API audience.
 *
 * A token is reused until five minutes before it expires. The cache lives on this instance,
 * so every audience gets its own provider bean.
 */
@Slf4j
public class AccessTokenProvider {

    static final Duration EXPIRY_BUFFER = Duration.ofMinutes(5);

    private final String audienceName;
    private final SyncProperties.ApiSource source;
    private final RestTemplate tokenRestTemplate;
    private final Clock clock;

    private CachedToken cachedToken;

    public AccessTokenProvider(String audienceName, SyncProperties.ApiSource source,
                               RestTemplate tokenRestTemplate, Clock clock) {
        this.audienceName = audienceName;
        this.source = source;
        this.tokenRestTemplate = tokenRestTemplate;
        this.clock = clock;
    }

    public synchronized String getAccessToken() {
        if (cachedToken != null && isValid(cachedToken)) {
            log.debug("[{}] Using cached access token, expires at {}", audienceName, cachedToken.expiresAt());
            return cachedToken.accessToken();
        }

        log.info("[{}] Requesting new access token", audienceName);
        TokenResponse response = requestNewToken();
        Instant expiresAt = clock.instant()
                .plusSeconds(response.expiresIn())
                .minus(EXPIRY_BUFFER);
        cachedToken = new CachedToken(response.accessToken(), expiresAt);
        log.info("[{}] Access token acquired, valid for {} minutes", audienceName, response.expiresIn() / 60);
        return cachedToken.accessToken();
    }

    public synchronized void clearCache() {
        log.debug("[{}] Clearing token cache", audienceName);
        cachedToken = null;
    }

    public synchronized boolean hasCachedToken() {
        return cachedToken != null && isValid(cachedToken);
    }

    private boolean isValid(CachedToken token) {
        return clock.instant().isBefore(token.expiresAt());
    }

    private TokenResponse requestNewToken() {
        if (isBlank(source.getTenantId()) || isBlank(source.getClientId()) || isBlank(source.getClientSecret())) {
            log.error("[{}] Missing credentials: tenantId={}, clientId={}, clientSecret={}", audienceName,
                    !isBlank(source.getTenantId()), !isBlank(source.getClientId()), !isBlank(source.getClientSecret()));
            throw new TokenAcquisitionException(audienceName + " API configuration is incomplete");
        }

        String tokenUrl = source.getTokenUrl().replace("{tenant}", source.getTenantId());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", source.getClientId());
        form.add("client_secret", source.getClientSecret());
        form.add("scope", source.getScope());

        try {
            ResponseEntity<TokenResponse> response =
                    tokenRestTemplate.postForEntity(tokenUrl, new HttpEntity<>(form, headers), TokenResponse.class);
            TokenResponse body = response.getBody();
            if (body == null || body.accessToken() == null) {
                throw new TokenAcquisitionException("Token endpoint for " + audienceName + " returned no access token");
            }
            return body;
        } catch (HttpClientErrorException e) {
            log.error("[{}] Token request rejected with status {}", audienceName, e.getStatusCode());
            if (e.getStatusCode().value() == 401 || e.getStatusCode().value() == 403) {
                throw new TokenAcquisitionException("Invalid " + audienceName + " API credentials", e);
            }
            throw new TokenAcquisitionException("Token request for " + audienceName + " failed with status "
                    + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("[{}] Token request failed: {}", audienceName, e.getMessage());
            throw new TokenAcquisitionException("Failed to request access token for " + audienceName + ": "
                    + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
    ) {}

    private record CachedToken(String accessToken, Instant expiresAt) {}
}

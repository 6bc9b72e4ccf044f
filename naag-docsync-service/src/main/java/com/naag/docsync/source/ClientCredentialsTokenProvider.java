package com.naag.docsync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.http.Http;
import com.naag.docsync.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 client-credentials flow against Microsoft identity. The token is cached until
 * shortly before it expires.
 */
public final class ClientCredentialsTokenProvider implements AccessTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);

    static final String GRAPH_SCOPE = "https://graph.microsoft.com/.default";
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    private String cachedToken;
    private Instant expiresAt = Instant.EPOCH;

    public ClientCredentialsTokenProvider(String authorityUrl, String tenantId, String clientId, String clientSecret) {
        this(authorityUrl, tenantId, clientId, clientSecret, Clock.systemUTC());
    }

    ClientCredentialsTokenProvider(String authorityUrl, String tenantId, String clientId, String clientSecret, Clock clock) {
        this.tokenUrl = authorityUrl + "/" + tenantId + "/oauth2/v2.0/token";
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.clock = clock;
    }

    @Override
    public synchronized String getAccessToken() {
        if (cachedToken != null && clock.instant().isBefore(expiresAt.minus(EXPIRY_MARGIN))) {
            return cachedToken;
        }
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new RemoteSourceException("Graph client credentials are not configured", 401);
        }

        String form = "client_id=" + encode(clientId)
                + "&client_secret=" + encode(clientSecret)
                + "&scope=" + encode(GRAPH_SCOPE)
                + "&grant_type=client_credentials";

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        HttpResponse<String> resp;
        try {
            resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSourceException("Token request interrupted", e);
        } catch (Exception e) {
            throw new RemoteSourceException("Token request failed", e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new RemoteSourceException("Token endpoint HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }

        try {
            JsonNode root = Json.MAPPER.readTree(resp.body());
            String token = root.path("access_token").asText(null);
            if (token == null) {
                throw new RemoteSourceException("Token response missing access_token", resp.statusCode());
            }
            cachedToken = token;
            expiresAt = clock.instant().plusSeconds(root.path("expires_in").asLong(3600));
            log.debug("Acquired Graph access token, expires at {}", expiresAt);
            return token;
        } catch (RemoteSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new RemoteSourceException("Bad token response", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

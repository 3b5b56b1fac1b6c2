package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.ConnectionStatusTracker;
import com.bko.glucosesync.integrations.secrets.SecretStorePort;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.DexcomSettings;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.HttpCall;
import com.bko.glucosesync.shared.HttpResult;
import com.bko.glucosesync.shared.HttpTransport;
import com.bko.glucosesync.shared.SingleFlight;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OAuth authorization-code client for the official Dexcom API. Holds the token pair, persists it to the
 * {@link SecretStorePort} and refreshes it at most once at a time.
 */
@Component
public class DexcomOAuthAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(DexcomOAuthAuthenticator.class);
    static final String ACCESS_TOKEN_KEY = "dexcom.access_token";
    static final String REFRESH_TOKEN_KEY = "dexcom.refresh_token";
    static final String TOKEN_EXPIRY_KEY = "dexcom.token_expiry";
    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);
    private static final String SCOPE = "offline_access";
    private static final String LOGIN_PATH = "/v2/oauth2/login";
    private static final String TOKEN_PATH = "/v2/oauth2/token";

    private final DexcomSettings settings;
    private final SecretStorePort secretStore;
    private final HttpTransport transport;
    private final AuthorizationPresenter presenter;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SingleFlight<OAuthToken> refreshFlight = new SingleFlight<>("Dexcom token refresh");
    private final ConnectionStatusTracker connection = new ConnectionStatusTracker("Dexcom");
    private final Map<String, AuthorizationFlow> pendingFlows = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private OAuthToken token;
    private boolean loaded;

    public DexcomOAuthAuthenticator(AppSettings settings,
                                    SecretStorePort secretStore,
                                    HttpTransport transport,
                                    AuthorizationPresenter presenter,
                                    Clock clock) {
        this.settings = settings.dexcom();
        this.secretStore = secretStore;
        this.transport = transport;
        this.presenter = presenter;
        this.clock = clock;
    }

    public boolean isAuthenticated() {
        OAuthToken current;
        try {
            current = currentToken();
        } catch (IOException e) {
            logger.warn("Could not load Dexcom token: {}", e.getMessage());
            return false;
        }
        if (current == null) {
            return false;
        }
        if (!current.isExpired(clock.instant())) {
            return true;
        }
        try {
            getAccessToken();
            return true;
        } catch (IOException e) {
            logger.warn("Dexcom token refresh failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * True while a token pair is stored, even an expired one that can still be refreshed.
     */
    public boolean hasStoredToken() {
        try {
            return currentToken() != null;
        } catch (IOException e) {
            logger.warn("Could not load Dexcom token: {}", e.getMessage());
            return false;
        }
    }

    public String getAccessToken() throws IOException {
        OAuthToken current = currentToken();
        if (current == null) {
            throw new GlucoseApiException(ErrorKind.NOT_CONNECTED, "Dexcom is not connected");
        }
        if (!current.isExpired(clock.instant())) {
            return current.accessToken();
        }
        return refreshFlight.execute(this::refresh).accessToken();
    }

    public boolean needsRefreshSoon() {
        synchronized (lock) {
            return token != null && token.expiresWithin(REFRESH_MARGIN, clock.instant());
        }
    }

    /**
     * Marks the access token as expired so the next {@link #getAccessToken()} refreshes it. Ignored when the token
     * was already replaced.
     */
    public void invalidateAccessToken(String rejectedToken) {
        synchronized (lock) {
            if (token != null && token.accessToken().equals(rejectedToken)) {
                token = token.expired();
            }
        }
    }

    public ConnectionStatus connectionStatus() {
        return connection.current();
    }

    public AuthorizationFlow beginAuthorization() throws GlucoseApiException {
        if (!settings.isConfigured()) {
            throw new GlucoseApiException(ErrorKind.INVALID_CONFIGURATION,
                    "Missing DEXCOM_CLIENT_ID, DEXCOM_CLIENT_SECRET or DEXCOM_REDIRECT_URI");
        }
        String state = UUID.randomUUID().toString();
        URI uri;
        try {
            uri = new URIBuilder(settings.baseUrl() + LOGIN_PATH)
                    .addParameter("client_id", settings.clientId())
                    .addParameter("redirect_uri", settings.redirectUri())
                    .addParameter("response_type", "code")
                    .addParameter("scope", SCOPE)
                    .addParameter("state", state)
                    .build();
        } catch (URISyntaxException e) {
            throw new GlucoseApiException(ErrorKind.INVALID_CONFIGURATION, "Failed to build Dexcom login URI", e);
        }
        AuthorizationFlow flow = new AuthorizationFlow(state, uri, () -> pendingFlows.remove(state));
        pendingFlows.put(state, flow);
        connection.connecting();
        presenter.present(uri);
        return flow;
    }

    /**
     * Delivers the redirect parameters to the flow that issued {@code state}.
     *
     * @return false when no pending flow matches
     */
    public boolean completeAuthorization(String state, String code, String error) {
        AuthorizationFlow flow = state != null ? pendingFlows.get(state) : null;
        if (flow == null) {
            logger.warn("Ignoring Dexcom callback with unknown state.");
            return false;
        }
        if (error != null && !error.isBlank()) {
            ErrorKind kind = "access_denied".equals(error)
                    ? ErrorKind.AUTHORIZATION_CANCELLED
                    : ErrorKind.AUTHORIZATION_FAILED;
            return flow.fail(new GlucoseApiException(kind, "Dexcom authorization returned " + error));
        }
        if (code == null || code.isBlank()) {
            return flow.fail(new GlucoseApiException(ErrorKind.INVALID_AUTHORIZATION_CODE,
                    "Dexcom callback carried no authorization code"));
        }
        return flow.complete(code);
    }

    public String startAuthorization(Duration timeout) throws GlucoseApiException {
        AuthorizationFlow flow = beginAuthorization();
        try {
            return flow.awaitCode(timeout);
        } catch (GlucoseApiException e) {
            abandonAuthorization(e);
            throw e;
        }
    }

    public void authorize(Duration timeout) throws IOException {
        exchangeCodeForTokens(startAuthorization(timeout));
    }

    public void exchangeCodeForTokens(String code) throws IOException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", settings.clientId());
        form.put("client_secret", settings.clientSecret());
        form.put("code", code);
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", settings.redirectUri());

        logger.info("Exchanging Dexcom authorization code for tokens...");
        try {
            HttpResult result = transport.execute(HttpCall.postForm(tokenUri(), form));
            if (!result.isSuccess()) {
                if (result.statusCode() == 400) {
                    throw new GlucoseApiException(ErrorKind.INVALID_AUTHORIZATION_CODE,
                            "Dexcom rejected the authorization code", 400, null);
                }
                throw GlucoseApiException.fromHttpStatus("Dexcom", result.statusCode(), result.body());
            }
            OAuthToken issued = decodeToken(result.body(), null);
            storeToken(issued);
            connection.connected();
            logger.info("Dexcom connected, token valid until {}", issued.expiry());
        } catch (GlucoseApiException e) {
            connection.error(e.userMessage());
            throw e;
        }
    }

    public void disconnect() throws IOException {
        synchronized (lock) {
            token = null;
            loaded = true;
        }
        secretStore.delete(ACCESS_TOKEN_KEY);
        secretStore.delete(REFRESH_TOKEN_KEY);
        secretStore.delete(TOKEN_EXPIRY_KEY);
        connection.disconnected();
        logger.info("Dexcom disconnected, stored tokens removed.");
    }

    void markConnected() {
        connection.connected();
    }

    void markError(String reason) {
        connection.error(reason);
    }

    private OAuthToken refresh() throws IOException {
        OAuthToken current = currentToken();
        if (current == null) {
            throw new GlucoseApiException(ErrorKind.NOT_CONNECTED, "Dexcom is not connected");
        }
        if (!current.isExpired(clock.instant())) {
            return current;
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", settings.clientId());
        form.put("client_secret", settings.clientSecret());
        form.put("refresh_token", current.refreshToken());
        form.put("grant_type", "refresh_token");
        form.put("redirect_uri", settings.redirectUri());

        logger.info("Refreshing Dexcom access token...");
        HttpResult result;
        try {
            result = transport.execute(HttpCall.postForm(tokenUri(), form));
        } catch (IOException e) {
            connection.error("Token refresh failed: " + e.getMessage());
            throw e;
        }

        int status = result.statusCode();
        if (status == 401 || status == 403) {
            logger.warn("Dexcom rejected the refresh token (HTTP {}), disconnecting.", status);
            disconnect();
            connection.error(ErrorKind.TOKEN_REFRESH_FAILED.userMessage());
            throw new GlucoseApiException(ErrorKind.TOKEN_REFRESH_FAILED,
                    "Dexcom token refresh rejected: HTTP " + status, status, null);
        }
        if (!result.isSuccess()) {
            GlucoseApiException error = GlucoseApiException.fromHttpStatus("Dexcom", status, result.body());
            connection.error(error.userMessage());
            throw error;
        }

        OAuthToken refreshed = decodeToken(result.body(), current.refreshToken());
        storeToken(refreshed);
        connection.connected();
        logger.info("Dexcom access token refreshed, valid until {}", refreshed.expiry());
        return refreshed;
    }

    private OAuthToken decodeToken(String body, String previousRefreshToken) throws GlucoseApiException {
        DexcomTokenResponse response;
        try {
            response = objectMapper.readValue(body, DexcomTokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new GlucoseApiException(ErrorKind.DECODE_FAILURE, "Could not decode Dexcom token response", e);
        }
        if (response == null) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Dexcom token response is empty");
        }
        String refreshToken = response.getRefreshToken() != null ? response.getRefreshToken() : previousRefreshToken;
        if (response.getAccessToken() == null || refreshToken == null || response.getExpiresIn() == null) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Dexcom token response is incomplete");
        }
        Instant expiry = clock.instant().plusSeconds(response.getExpiresIn());
        return new OAuthToken(response.getAccessToken(), refreshToken, expiry);
    }

    private void storeToken(OAuthToken newToken) throws IOException {
        secretStore.write(ACCESS_TOKEN_KEY, newToken.accessToken());
        secretStore.write(REFRESH_TOKEN_KEY, newToken.refreshToken());
        secretStore.write(TOKEN_EXPIRY_KEY, String.valueOf(newToken.expiry().getEpochSecond()));
        synchronized (lock) {
            token = newToken;
            loaded = true;
        }
    }

    private OAuthToken currentToken() throws IOException {
        synchronized (lock) {
            if (loaded) {
                return token;
            }
        }
        OAuthToken stored = loadStoredToken();
        synchronized (lock) {
            if (!loaded) {
                token = stored;
                loaded = true;
                if (stored != null) {
                    connection.connected();
                }
            }
            return token;
        }
    }

    private OAuthToken loadStoredToken() throws IOException {
        Optional<String> access = secretStore.read(ACCESS_TOKEN_KEY);
        Optional<String> refresh = secretStore.read(REFRESH_TOKEN_KEY);
        Optional<String> expiry = secretStore.read(TOKEN_EXPIRY_KEY);
        if (access.isEmpty() || refresh.isEmpty()) {
            return null;
        }
        Instant expiresAt = Instant.EPOCH;
        if (expiry.isPresent()) {
            try {
                expiresAt = Instant.ofEpochSecond(Long.parseLong(expiry.get()));
            } catch (NumberFormatException e) {
                logger.warn("Stored Dexcom token expiry is not a number, treating token as expired.");
            }
        }
        return new OAuthToken(access.get(), refresh.get(), expiresAt);
    }

    /**
     * Leaves the CONNECTING state after an authorization attempt ended without tokens. A cancelled or timed out
     * attempt falls back to the stored token, anything else is reported as an error.
     */
    public void abandonAuthorization(IOException cause) {
        if (!(cause instanceof GlucoseApiException)) {
            connection.error(cause.getMessage());
            return;
        }
        GlucoseApiException apiError = (GlucoseApiException) cause;
        if (apiError.getKind() != ErrorKind.AUTHORIZATION_CANCELLED) {
            connection.error(apiError.userMessage());
        } else if (hasStoredToken()) {
            connection.connected();
        } else {
            connection.disconnected();
        }
    }

    private URI tokenUri() {
        return URI.create(settings.baseUrl() + TOKEN_PATH);
    }
}

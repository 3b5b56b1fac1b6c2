package com.bko.glucosesync.integrations.share;

import com.bko.glucosesync.glucose.ConnectionStatus;
import com.bko.glucosesync.glucose.ConnectionStatusTracker;
import com.bko.glucosesync.integrations.secrets.SecretStorePort;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.HttpCall;
import com.bko.glucosesync.shared.HttpResult;
import com.bko.glucosesync.shared.HttpTransport;
import com.bko.glucosesync.shared.ShareSettings;
import com.bko.glucosesync.shared.SingleFlight;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Two-step Share login: credentials resolve an account id, the account id resolves a session id. Sessions are not
 * refreshable; once expired the whole login runs again.
 */
@Component
public class ShareSessionAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(ShareSessionAuthenticator.class);
    static final String USERNAME_KEY = "share.username";
    static final String PASSWORD_KEY = "share.password";
    static final String SESSION_KEY = "share.session_id";
    static final String SESSION_EXPIRY_KEY = "share.session_expiry";
    static final String USER_AGENT = "Dexcom Share/3.0.2.11 CFNetwork/672.0.2 Darwin/14.0.0";
    private static final String AUTHENTICATE_PATH = "/ShareWebServices/Services/General/AuthenticatePublisherAccount";
    private static final String LOGIN_PATH = "/ShareWebServices/Services/General/LoginPublisherAccountById";
    private static final String NULL_ID = "00000000-0000-0000-0000-000000000000";

    private final ShareSettings settings;
    private final SecretStorePort secretStore;
    private final HttpTransport transport;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SingleFlight<ShareSession> loginFlight = new SingleFlight<>("Share login");
    private final ConnectionStatusTracker connection = new ConnectionStatusTracker("Dexcom Share");
    private final Object lock = new Object();
    private ShareSession session;
    private boolean sessionLoaded;

    public ShareSessionAuthenticator(AppSettings settings,
                                     SecretStorePort secretStore,
                                     HttpTransport transport,
                                     Clock clock) {
        this.settings = settings.share();
        this.secretStore = secretStore;
        this.transport = transport;
        this.clock = clock;
        seedConfiguredCredentials();
    }

    public boolean hasCredentials() {
        try {
            return loadCredentials().isPresent();
        } catch (IOException e) {
            logger.warn("Could not read Share credentials: {}", e.getMessage());
            return false;
        }
    }

    public boolean isAuthenticated() {
        try {
            ShareSession current = currentSession();
            return current != null && current.isValid(clock.instant());
        } catch (IOException e) {
            logger.warn("Could not read Share session: {}", e.getMessage());
            return false;
        }
    }

    public String getSessionId() throws IOException {
        ShareSession current = currentSession();
        if (current != null && current.isValid(clock.instant())) {
            return current.sessionId();
        }
        return loginFlight.execute(() -> login(true)).sessionId();
    }

    /**
     * Runs the full login even when a valid session is cached.
     */
    public String authenticate() throws IOException {
        return loginFlight.execute(() -> login(false)).sessionId();
    }

    public void saveCredentials(String username, String password) throws IOException {
        secretStore.write(USERNAME_KEY, username);
        secretStore.write(PASSWORD_KEY, password);
        clearSession();
        logger.info("Saved Share credentials for {}", username);
    }

    /**
     * Stores the credentials and logs in with them; they are removed again when the login fails.
     */
    public void testCredentials(String username, String password) throws IOException {
        saveCredentials(username, password);
        try {
            authenticate();
        } catch (IOException e) {
            deleteCredentials();
            connection.error(e instanceof GlucoseApiException
                    ? ((GlucoseApiException) e).userMessage()
                    : e.getMessage());
            throw e;
        }
    }

    public void clearSession() throws IOException {
        synchronized (lock) {
            session = null;
            sessionLoaded = true;
        }
        secretStore.delete(SESSION_KEY);
        secretStore.delete(SESSION_EXPIRY_KEY);
        logger.debug("Cleared Share session.");
    }

    public void deleteCredentials() throws IOException {
        secretStore.delete(USERNAME_KEY);
        secretStore.delete(PASSWORD_KEY);
        clearSession();
        connection.disconnected();
        logger.info("Deleted Share credentials.");
    }

    public ConnectionStatus connectionStatus() {
        return connection.current();
    }

    String baseUrl() {
        return settings.baseUrl();
    }

    void markConnected() {
        connection.connected();
    }

    void markError(String reason) {
        connection.error(reason);
    }

    private ShareSession login(boolean reuseValidSession) throws IOException {
        Instant now = clock.instant();
        if (reuseValidSession) {
            ShareSession current = currentSession();
            if (current != null && current.isValid(now)) {
                return current;
            }
        }
        ShareCredentials credentials = loadCredentials()
                .orElseThrow(() -> new GlucoseApiException(ErrorKind.INVALID_CREDENTIALS,
                        "No Share credentials stored"));

        connection.connecting();
        try {
            logger.info("Logging in to Dexcom Share as {}...", credentials.username());
            String accountId = resolveAccountId(credentials);
            String sessionId = resolveSessionId(accountId, credentials.password());
            ShareSession issued = new ShareSession(sessionId, clock.instant().plus(settings.sessionLifetime()));
            storeSession(issued);
            connection.connected();
            logger.info("Dexcom Share session {}... valid until {}", sessionId.substring(0, 8), issued.expiry());
            return issued;
        } catch (GlucoseApiException e) {
            connection.error(e.userMessage());
            throw e;
        }
    }

    private String resolveAccountId(ShareCredentials credentials) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("accountName", credentials.username());
        body.put("password", credentials.password());
        body.put("applicationId", settings.applicationId());

        HttpResult result = post(AUTHENTICATE_PATH, body);
        if (!result.isSuccess()) {
            throw loginFailure("account lookup", result, true);
        }
        String accountId = unquote(result.body());
        if (accountId.isEmpty() || NULL_ID.equals(accountId)) {
            throw new GlucoseApiException(ErrorKind.INVALID_CREDENTIALS, "Share returned no account id");
        }
        return accountId;
    }

    private String resolveSessionId(String accountId, String password) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("accountId", accountId);
        body.put("password", password);
        body.put("applicationId", settings.applicationId());

        HttpResult result = post(LOGIN_PATH, body);
        if (!result.isSuccess()) {
            throw loginFailure("session login", result, false);
        }
        String sessionId = unquote(result.body());
        try {
            UUID.fromString(sessionId);
        } catch (IllegalArgumentException e) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Share session id is not a UUID", e);
        }
        if (NULL_ID.equals(sessionId)) {
            throw new GlucoseApiException(ErrorKind.INVALID_CREDENTIALS, "Share returned an empty session");
        }
        return sessionId;
    }

    private GlucoseApiException loginFailure(String step, HttpResult result, boolean firstStep) {
        int status = result.statusCode();
        ShareErrorResponse error = readError(result.body());
        String detail = error != null && error.getCode() != null ? " (" + error.getCode() + ")" : "";
        String message = "Share " + step + " failed: HTTP " + status + detail;
        if (status == 401 || status == 403 || (error != null && error.isCredentialError())) {
            return new GlucoseApiException(ErrorKind.INVALID_CREDENTIALS, message, status, null);
        }
        if (status >= 500) {
            return new GlucoseApiException(ErrorKind.SERVER_ERROR, message, status, null);
        }
        if (firstStep) {
            return new GlucoseApiException(ErrorKind.INVALID_CREDENTIALS, message, status, null);
        }
        return new GlucoseApiException(ErrorKind.HTTP_ERROR, message, status, null);
    }

    private HttpResult post(String path, Map<String, String> body) throws IOException {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GlucoseApiException(ErrorKind.INVALID_RESPONSE, "Could not encode Share request", e);
        }
        HttpCall call = HttpCall.postJson(URI.create(settings.baseUrl() + path), json)
                .withHeader("Accept", "application/json")
                .withHeader("User-Agent", USER_AGENT);
        return transport.execute(call);
    }

    private ShareErrorResponse readError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ShareErrorResponse.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void storeSession(ShareSession issued) throws IOException {
        secretStore.write(SESSION_KEY, issued.sessionId());
        secretStore.write(SESSION_EXPIRY_KEY, String.valueOf(issued.expiry().getEpochSecond()));
        synchronized (lock) {
            session = issued;
            sessionLoaded = true;
        }
    }

    private ShareSession currentSession() throws IOException {
        synchronized (lock) {
            if (sessionLoaded) {
                return session;
            }
        }
        ShareSession stored = loadStoredSession();
        synchronized (lock) {
            if (!sessionLoaded) {
                session = stored;
                sessionLoaded = true;
            }
            return session;
        }
    }

    private ShareSession loadStoredSession() throws IOException {
        Optional<String> id = secretStore.read(SESSION_KEY);
        Optional<String> expiry = secretStore.read(SESSION_EXPIRY_KEY);
        if (id.isEmpty() || expiry.isEmpty()) {
            return null;
        }
        try {
            return new ShareSession(id.get(), Instant.ofEpochSecond(Long.parseLong(expiry.get())));
        } catch (NumberFormatException e) {
            logger.warn("Stored Share session expiry is not a number, ignoring session.");
            return null;
        }
    }

    private Optional<ShareCredentials> loadCredentials() throws IOException {
        Optional<String> username = secretStore.read(USERNAME_KEY);
        Optional<String> password = secretStore.read(PASSWORD_KEY);
        if (username.isEmpty() || password.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ShareCredentials(username.get(), password.get()));
    }

    private void seedConfiguredCredentials() {
        if (settings == null || !settings.hasCredentials()) {
            return;
        }
        try {
            if (loadCredentials().isEmpty()) {
                secretStore.write(USERNAME_KEY, settings.username());
                secretStore.write(PASSWORD_KEY, settings.password());
                logger.info("Seeded Share credentials from configuration.");
            }
        } catch (IOException e) {
            logger.warn("Could not store configured Share credentials: {}", e.getMessage());
        }
    }

    private static String unquote(String body) {
        if (body == null) {
            return "";
        }
        return body.trim().replace("\"", "");
    }
}

package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.glucose.ConnectionState;
import com.bko.glucosesync.integrations.secrets.InMemorySecretStore;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.DexcomSettings;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.GoogleSettings;
import com.bko.glucosesync.shared.HttpCall;
import com.bko.glucosesync.shared.HttpResult;
import com.bko.glucosesync.shared.HttpTransport;
import com.bko.glucosesync.shared.MutableClock;
import com.bko.glucosesync.shared.SecretSettings;
import com.bko.glucosesync.shared.ShareSettings;
import com.bko.glucosesync.shared.SyncSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DexcomOAuthAuthenticatorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String TOKEN_BODY =
            "{\"access_token\":\"new-access\",\"refresh_token\":\"new-refresh\",\"expires_in\":7200,\"token_type\":\"Bearer\"}";

    private InMemorySecretStore secretStore;
    private HttpTransport transport;
    private AuthorizationPresenter presenter;
    private MutableClock clock;
    private DexcomOAuthAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        secretStore = new InMemorySecretStore();
        transport = mock(HttpTransport.class);
        presenter = mock(AuthorizationPresenter.class);
        clock = new MutableClock(NOW);
        authenticator = new DexcomOAuthAuthenticator(settings(), secretStore, transport, presenter, clock);
    }

    @Test
    void validTokenIsReturnedWithoutRefresh() throws Exception {
        storeToken("access", "refresh", NOW.plusSeconds(3600));

        assertEquals("access", authenticator.getAccessToken());
        verify(transport, never()).execute(any());
    }

    @Test
    void missingTokenIsNotConnected() {
        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> authenticator.getAccessToken());
        assertEquals(ErrorKind.NOT_CONNECTED, e.getKind());
        assertFalse(authenticator.isAuthenticated());
    }

    @Test
    void concurrentCallersTriggerOneRefresh() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenAnswer(invocation -> {
            Thread.sleep(200);
            return new HttpResult(200, TOKEN_BODY);
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> callers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                callers.add(authenticator::getAccessToken);
            }
            for (Future<String> result : pool.invokeAll(callers, 5, TimeUnit.SECONDS)) {
                assertEquals("new-access", result.get());
            }
        } finally {
            pool.shutdownNow();
        }

        verify(transport, times(1)).execute(any());
        assertEquals(Optional.of("new-refresh"), secretStore.read(DexcomOAuthAuthenticator.REFRESH_TOKEN_KEY));
        assertEquals(Optional.of(String.valueOf(NOW.plusSeconds(7200).getEpochSecond())),
                secretStore.read(DexcomOAuthAuthenticator.TOKEN_EXPIRY_KEY));
    }

    @Test
    void refreshSendsRefreshGrant() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenReturn(new HttpResult(200, TOKEN_BODY));

        authenticator.getAccessToken();

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).execute(captor.capture());
        HttpCall call = captor.getValue();
        assertEquals("POST", call.method());
        assertEquals("https://sandbox-api.dexcom.com/v2/oauth2/token", call.uri().toString());
        assertTrue(call.body().contains("grant_type=refresh_token"));
        assertTrue(call.body().contains("refresh_token=old-refresh"));
    }

    @Test
    void refreshWithoutNewRefreshTokenKeepsPreviousOne() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenReturn(new HttpResult(200,
                "{\"access_token\":\"new-access\",\"expires_in\":7200}"));

        assertEquals("new-access", authenticator.getAccessToken());
        assertEquals(Optional.of("old-refresh"), secretStore.read(DexcomOAuthAuthenticator.REFRESH_TOKEN_KEY));
    }

    @Test
    void rejectedRefreshTokenWipesStoredTokens() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenReturn(new HttpResult(401, "{\"error\":\"invalid_grant\"}"));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> authenticator.getAccessToken());

        assertEquals(ErrorKind.TOKEN_REFRESH_FAILED, e.getKind());
        assertTrue(e.requiresReauthentication());
        assertFalse(authenticator.hasStoredToken());
        assertEquals(Optional.empty(), secretStore.read(DexcomOAuthAuthenticator.ACCESS_TOKEN_KEY));
        assertEquals(ConnectionState.ERROR, authenticator.connectionStatus().state());
    }

    @Test
    void serverErrorDuringRefreshKeepsTokens() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenReturn(new HttpResult(503, ""));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> authenticator.getAccessToken());

        assertEquals(ErrorKind.SERVER_ERROR, e.getKind());
        assertTrue(authenticator.hasStoredToken());
        assertEquals(Optional.of("old-refresh"), secretStore.read(DexcomOAuthAuthenticator.REFRESH_TOKEN_KEY));
    }

    @Test
    void transportFailureDuringRefreshKeepsTokens() throws Exception {
        storeToken("old-access", "old-refresh", NOW.minusSeconds(10));
        when(transport.execute(any())).thenThrow(new GlucoseApiException(ErrorKind.TRANSPORT_FAILURE, "offline"));

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> authenticator.getAccessToken());

        assertEquals(ErrorKind.TRANSPORT_FAILURE, e.getKind());
        assertTrue(authenticator.hasStoredToken());
    }

    @Test
    void invalidatedTokenIsRefreshedOnNextUse() throws Exception {
        storeToken("access", "refresh", NOW.plusSeconds(3600));
        when(transport.execute(any())).thenReturn(new HttpResult(200, TOKEN_BODY));

        authenticator.invalidateAccessToken("some-other-token");
        assertEquals("access", authenticator.getAccessToken());

        authenticator.invalidateAccessToken("access");
        assertEquals("new-access", authenticator.getAccessToken());
    }

    @Test
    void needsRefreshSoonWithinFiveMinutesOfExpiry() throws Exception {
        storeToken("access", "refresh", NOW.plusSeconds(600));
        authenticator.getAccessToken();
        assertFalse(authenticator.needsRefreshSoon());

        clock.advance(Duration.ofMinutes(6));
        assertTrue(authenticator.needsRefreshSoon());
    }

    @Test
    void authorizationFlowDeliversCodeAndStoresTokens() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(200, TOKEN_BODY));

        AuthorizationFlow flow = authenticator.beginAuthorization();
        String uri = flow.authorizationUri().toString();
        assertTrue(uri.startsWith("https://sandbox-api.dexcom.com/v2/oauth2/login?"));
        assertTrue(uri.contains("client_id=client"));
        assertTrue(uri.contains("scope=offline_access"));
        assertTrue(uri.contains("state=" + flow.state()));
        verify(presenter).present(flow.authorizationUri());

        assertTrue(authenticator.completeAuthorization(flow.state(), "auth-code", null));
        String code = flow.awaitCode(Duration.ofSeconds(1));
        authenticator.exchangeCodeForTokens(code);

        assertEquals("auth-code", code);
        assertTrue(authenticator.isAuthenticated());
        assertEquals(Optional.of("new-access"), secretStore.read(DexcomOAuthAuthenticator.ACCESS_TOKEN_KEY));
        assertFalse(authenticator.completeAuthorization(flow.state(), "again", null));
    }

    @Test
    void deniedAuthorizationIsCancelled() throws Exception {
        AuthorizationFlow flow = authenticator.beginAuthorization();
        authenticator.completeAuthorization(flow.state(), null, "access_denied");

        GlucoseApiException e = assertThrows(GlucoseApiException.class, () -> flow.awaitCode(Duration.ofSeconds(1)));
        assertEquals(ErrorKind.AUTHORIZATION_CANCELLED, e.getKind());
    }

    @Test
    void abandonedAuthorizationFallsBackToStoredToken() throws Exception {
        storeToken("access", "refresh", NOW.plusSeconds(3600));
        authenticator.beginAuthorization();
        assertEquals(ConnectionState.CONNECTING, authenticator.connectionStatus().state());

        authenticator.abandonAuthorization(new GlucoseApiException(ErrorKind.AUTHORIZATION_CANCELLED, "timed out"));

        assertEquals(ConnectionState.CONNECTED, authenticator.connectionStatus().state());
    }

    @Test
    void abandonedAuthorizationAfterTransportFailureIsAnError() throws Exception {
        authenticator.beginAuthorization();

        authenticator.abandonAuthorization(new IOException("connection reset"));

        assertEquals(ConnectionState.ERROR, authenticator.connectionStatus().state());
        assertEquals("connection reset", authenticator.connectionStatus().reason());
    }

    @Test
    void callbackWithUnknownStateIsIgnored() {
        assertFalse(authenticator.completeAuthorization("unknown", "code", null));
    }

    @Test
    void rejectedAuthorizationCodeIsReported() throws Exception {
        when(transport.execute(any())).thenReturn(new HttpResult(400, "{\"error\":\"invalid_grant\"}"));

        GlucoseApiException e = assertThrows(GlucoseApiException.class,
                () -> authenticator.exchangeCodeForTokens("bad-code"));
        assertEquals(ErrorKind.INVALID_AUTHORIZATION_CODE, e.getKind());
    }

    @Test
    void unconfiguredClientCannotAuthorize() {
        AppSettings empty = new AppSettings(
                new DexcomSettings(null, null, null, "sandbox"),
                new ShareSettings(null, null, null),
                SyncSettings.defaults(),
                new SecretSettings(null),
                new GoogleSettings(null, null));
        DexcomOAuthAuthenticator unconfigured =
                new DexcomOAuthAuthenticator(empty, secretStore, transport, presenter, clock);

        GlucoseApiException e = assertThrows(GlucoseApiException.class, unconfigured::beginAuthorization);
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
    }

    private void storeToken(String access, String refresh, Instant expiry) throws IOException {
        secretStore.write(DexcomOAuthAuthenticator.ACCESS_TOKEN_KEY, access);
        secretStore.write(DexcomOAuthAuthenticator.REFRESH_TOKEN_KEY, refresh);
        secretStore.write(DexcomOAuthAuthenticator.TOKEN_EXPIRY_KEY, String.valueOf(expiry.getEpochSecond()));
    }

    static AppSettings settings() {
        return new AppSettings(
                new DexcomSettings("client", "secret", "http://localhost:8080/oauth/dexcom/callback", "sandbox"),
                new ShareSettings(null, null, null),
                SyncSettings.defaults(),
                new SecretSettings(null),
                new GoogleSettings(null, null));
    }
}

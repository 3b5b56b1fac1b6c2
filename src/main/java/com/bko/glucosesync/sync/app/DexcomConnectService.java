package com.bko.glucosesync.sync.app;

import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.integrations.dexcom.AuthorizationFlow;
import com.bko.glucosesync.integrations.dexcom.DexcomOAuthAuthenticator;
import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives the browser based Dexcom login: hands out the login URI and exchanges the code once the redirect delivers
 * it. No thread is held while the user is logging in; only the exchange itself runs on the executor.
 */
@Service
public class DexcomConnectService {
    private static final Logger logger = LoggerFactory.getLogger(DexcomConnectService.class);
    static final Duration CALLBACK_TIMEOUT = Duration.ofMinutes(10);

    private final DexcomOAuthAuthenticator authenticator;
    private final Executor executor;
    private final SyncCoordinator coordinator;
    private final Duration callbackTimeout;

    @Autowired
    public DexcomConnectService(DexcomOAuthAuthenticator authenticator,
                                @Qualifier("glucoseFetchExecutor") Executor executor,
                                SyncCoordinator coordinator) {
        this(authenticator, executor, coordinator, CALLBACK_TIMEOUT);
    }

    DexcomConnectService(DexcomOAuthAuthenticator authenticator,
                         Executor executor,
                         SyncCoordinator coordinator,
                         Duration callbackTimeout) {
        this.authenticator = authenticator;
        this.executor = executor;
        this.coordinator = coordinator;
        this.callbackTimeout = callbackTimeout;
    }

    /**
     * @return the pending flow; its URI is where the user logs in
     */
    public AuthorizationFlow startConnect() throws GlucoseApiException {
        AuthorizationFlow flow = authenticator.beginAuthorization();
        flow.codeWithin(callbackTimeout).whenCompleteAsync(this::finishConnect, executor);
        return flow;
    }

    public boolean handleCallback(String state, String code, String error) {
        return authenticator.completeAuthorization(state, code, error);
    }

    public void disconnect() throws IOException {
        authenticator.disconnect();
    }

    private void finishConnect(String code, Throwable failure) {
        if (failure != null) {
            GlucoseApiException e = asApiException(failure);
            logger.warn("Dexcom authorization did not complete ({}): {}", e.getKind(), e.getMessage());
            authenticator.abandonAuthorization(e);
            return;
        }
        try {
            authenticator.exchangeCodeForTokens(code);
            coordinator.sourceReconnected(ReadingSource.OFFICIAL);
            coordinator.requestSync();
        } catch (GlucoseApiException e) {
            logger.warn("Dexcom token exchange failed ({}): {}", e.getKind(), e.getMessage());
        } catch (IOException e) {
            logger.error("Dexcom token exchange failed.", e);
            authenticator.abandonAuthorization(e);
        }
    }

    private static GlucoseApiException asApiException(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof GlucoseApiException) {
            return (GlucoseApiException) cause;
        }
        return new GlucoseApiException(ErrorKind.AUTHORIZATION_FAILED, "Authorization failed", cause);
    }
}

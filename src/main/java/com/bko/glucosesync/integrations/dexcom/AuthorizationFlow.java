package com.bko.glucosesync.integrations.dexcom;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One interactive authorization attempt. The caller holds this handle until the redirect delivers a code or the
 * attempt is cancelled.
 */
public final class AuthorizationFlow {
    private final String state;
    private final URI authorizationUri;
    private final Runnable onClose;
    private final CompletableFuture<String> code = new CompletableFuture<>();

    AuthorizationFlow(String state, URI authorizationUri, Runnable onClose) {
        this.state = state;
        this.authorizationUri = authorizationUri;
        this.onClose = onClose;
    }

    public String state() {
        return state;
    }

    public URI authorizationUri() {
        return authorizationUri;
    }

    public boolean isDone() {
        return code.isDone();
    }

    public String awaitCode(Duration timeout) throws GlucoseApiException {
        try {
            return code.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel();
            throw new GlucoseApiException(ErrorKind.AUTHORIZATION_CANCELLED,
                    "No authorization callback within " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new GlucoseApiException(ErrorKind.AUTHORIZATION_CANCELLED, "Authorization interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GlucoseApiException) {
                throw (GlucoseApiException) e.getCause();
            }
            throw new GlucoseApiException(ErrorKind.AUTHORIZATION_FAILED, "Authorization failed", e.getCause());
        } finally {
            onClose.run();
        }
    }

    /**
     * Non-blocking variant of {@link #awaitCode(Duration)}. The returned future fails with a
     * {@link GlucoseApiException}: AUTHORIZATION_CANCELLED when no callback arrives within {@code timeout}.
     */
    public CompletableFuture<String> codeWithin(Duration timeout) {
        CompletableFuture<String> result = new CompletableFuture<>();
        code.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            onClose.run();
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(asApiException(error, timeout));
            }
        });
        return result;
    }

    public void cancel() {
        fail(new GlucoseApiException(ErrorKind.AUTHORIZATION_CANCELLED, "Authorization cancelled"));
    }

    boolean complete(String authorizationCode) {
        boolean completed = code.complete(authorizationCode);
        onClose.run();
        return completed;
    }

    boolean fail(GlucoseApiException error) {
        boolean failed = code.completeExceptionally(error);
        onClose.run();
        return failed;
    }

    private static GlucoseApiException asApiException(Throwable error, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof GlucoseApiException) {
            return (GlucoseApiException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new GlucoseApiException(ErrorKind.AUTHORIZATION_CANCELLED,
                    "No authorization callback within " + timeout.toSeconds() + "s", cause);
        }
        return new GlucoseApiException(ErrorKind.AUTHORIZATION_FAILED, "Authorization failed", cause);
    }
}

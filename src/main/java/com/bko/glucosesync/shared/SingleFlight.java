package com.bko.glucosesync.shared;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Collapses concurrent executions of one operation. The first caller runs the work; callers arriving while it is
 * in flight wait for the same outcome, value or exception, instead of starting their own.
 */
public final class SingleFlight<T> {

    @FunctionalInterface
    public interface Work<T> {
        T run() throws IOException;
    }

    private final String name;
    private final Object lock = new Object();
    private CompletableFuture<T> inFlight;

    public SingleFlight(String name) {
        this.name = name;
    }

    public T execute(Work<T> work) throws IOException {
        CompletableFuture<T> flight;
        boolean owner = false;
        synchronized (lock) {
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            flight = inFlight;
        }
        if (!owner) {
            return await(flight);
        }

        T result;
        try {
            result = work.run();
        } catch (Throwable t) {
            release(flight);
            flight.completeExceptionally(t);
            throw t;
        }
        release(flight);
        flight.complete(result);
        return result;
    }

    public boolean isInFlight() {
        synchronized (lock) {
            return inFlight != null;
        }
    }

    private void release(CompletableFuture<T> flight) {
        synchronized (lock) {
            if (inFlight == flight) {
                inFlight = null;
            }
        }
    }

    private T await(CompletableFuture<T> flight) throws IOException {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GlucoseApiException(ErrorKind.CANCELLED, "Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException(name + " failed", cause);
        }
    }
}

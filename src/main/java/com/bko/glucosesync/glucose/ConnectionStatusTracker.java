package com.bko.glucosesync.glucose;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection state of one upstream. Only the authenticator and client of that upstream move it.
 */
public class ConnectionStatusTracker {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionStatusTracker.class);

    private final String api;
    private volatile ConnectionStatus status = ConnectionStatus.disconnected();

    public ConnectionStatusTracker(String api) {
        this.api = api;
    }

    public ConnectionStatus current() {
        return status;
    }

    public void connecting() {
        transition(ConnectionStatus.connecting());
    }

    public void connected() {
        transition(ConnectionStatus.connected());
    }

    public void disconnected() {
        transition(ConnectionStatus.disconnected());
    }

    public void error(String reason) {
        transition(ConnectionStatus.error(reason));
    }

    private void transition(ConnectionStatus next) {
        ConnectionStatus previous = status;
        status = next;
        if (previous.state() != next.state()) {
            logger.debug("{} connection {} -> {}", api, previous.state(), next.state());
        }
    }
}

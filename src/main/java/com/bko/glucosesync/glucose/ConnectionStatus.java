package com.bko.glucosesync.glucose;

public record ConnectionStatus(ConnectionState state, String reason) {
    public static ConnectionStatus disconnected() {
        return new ConnectionStatus(ConnectionState.DISCONNECTED, null);
    }

    public static ConnectionStatus connecting() {
        return new ConnectionStatus(ConnectionState.CONNECTING, null);
    }

    public static ConnectionStatus connected() {
        return new ConnectionStatus(ConnectionState.CONNECTED, null);
    }

    public static ConnectionStatus error(String reason) {
        return new ConnectionStatus(ConnectionState.ERROR, reason);
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}

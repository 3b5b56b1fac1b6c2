package com.bko.glucosesync.sync.app;

public interface HostConditionsPort {
    boolean isNetworkAvailable();

    /**
     * True when the host is too hot or too loaded for background work.
     */
    boolean isThermallyConstrained();
}

package com.bko.glucosesync.sync.app;

import com.bko.glucosesync.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Network check resolves the upstream host name; load above twice the processor count counts as constrained.
 */
@Component
public class DefaultHostConditions implements HostConditionsPort {
    private static final Logger logger = LoggerFactory.getLogger(DefaultHostConditions.class);

    private final String probeHost;
    private final OperatingSystemMXBean operatingSystem = ManagementFactory.getOperatingSystemMXBean();

    public DefaultHostConditions(AppSettings settings) {
        this.probeHost = settings.sync().connectivityProbeHost();
    }

    @Override
    public boolean isNetworkAvailable() {
        try {
            InetAddress.getByName(probeHost);
            return true;
        } catch (UnknownHostException e) {
            logger.debug("Could not resolve {}: {}", probeHost, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isThermallyConstrained() {
        double load = operatingSystem.getSystemLoadAverage();
        return load >= 0 && load > 2.0 * operatingSystem.getAvailableProcessors();
    }
}

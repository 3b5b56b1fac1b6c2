package com.bko.glucosesync.sync.app;

import com.bko.glucosesync.glucose.HybridGlucoseSource;
import com.bko.glucosesync.integrations.dexcom.DexcomClientPort;
import com.bko.glucosesync.integrations.share.ShareClientPort;
import com.bko.glucosesync.shared.AppSettings;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SyncConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService syncScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("glucose-sync"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService glucoseFetchExecutor() {
        return Executors.newFixedThreadPool(2, daemonThreads("glucose-fetch"));
    }

    @Bean
    public HybridGlucoseSource hybridGlucoseSource(DexcomClientPort dexcomClient,
                                                   ShareClientPort shareClient,
                                                   @Qualifier("glucoseFetchExecutor") ExecutorService executor,
                                                   AppSettings settings,
                                                   Clock clock) {
        return new HybridGlucoseSource(dexcomClient, shareClient, executor, clock,
                settings.dexcom().dataDelay(), settings.dexcom().safetyBuffer());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

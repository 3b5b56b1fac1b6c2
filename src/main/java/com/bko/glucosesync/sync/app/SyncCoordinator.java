package com.bko.glucosesync.sync.app;

import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.GlucoseReadingRepository;
import com.bko.glucosesync.glucose.ReadingSource;
import com.bko.glucosesync.integrations.dexcom.DexcomClientPort;
import com.bko.glucosesync.integrations.share.ShareClientPort;
import com.bko.glucosesync.shared.AppSettings;
import com.bko.glucosesync.shared.GlucoseApiException;
import com.bko.glucosesync.shared.SyncSettings;
import com.bko.glucosesync.sync.GlucoseDataUpdatedEvent;
import com.bko.glucosesync.sync.SyncControlUseCase;
import com.bko.glucosesync.sync.SyncState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic pull of new readings from both upstreams into the repository.
 * <p>
 * Cycles run on a single scheduler thread and never overlap: manual and debounced triggers go through the
 * same lock. The wait between cycles grows with consecutive failures and the loop stops itself after too many
 * failures, after running for too long, or when the host is constrained. Restarting needs {@link #activate()}.
 */
@Service
public class SyncCoordinator implements SyncControlUseCase {
    private static final Logger logger = LoggerFactory.getLogger(SyncCoordinator.class);

    private final DexcomClientPort dexcomClient;
    private final ShareClientPort shareClient;
    private final GlucoseReadingRepository repository;
    private final HostConditionsPort hostConditions;
    private final ApplicationEventPublisher eventPublisher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final SyncSettings syncSettings;
    private final Duration officialDelay;
    private final BackoffPolicy backoffPolicy;
    private final Debouncer debouncer;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Object stateLock = new Object();
    private final Set<ReadingSource> awaitingReauthentication = EnumSet.noneOf(ReadingSource.class);

    private boolean active;
    private Instant activatedAt;
    private Instant lastSuccessfulSync;
    private int consecutiveErrors;
    private long activation;
    private ScheduledFuture<?> nextCycle;

    public SyncCoordinator(DexcomClientPort dexcomClient,
                           ShareClientPort shareClient,
                           GlucoseReadingRepository repository,
                           HostConditionsPort hostConditions,
                           ApplicationEventPublisher eventPublisher,
                           @Qualifier("syncScheduler") ScheduledExecutorService syncScheduler,
                           AppSettings settings,
                           Clock clock) {
        this.dexcomClient = dexcomClient;
        this.shareClient = shareClient;
        this.repository = repository;
        this.hostConditions = hostConditions;
        this.eventPublisher = eventPublisher;
        this.scheduler = syncScheduler;
        this.clock = clock;
        this.syncSettings = settings.sync();
        this.officialDelay = settings.dexcom().dataDelay();
        this.backoffPolicy = new BackoffPolicy(syncSettings.baseInterval(), syncSettings.maxBackoffMultiplier());
        this.debouncer = new Debouncer(syncScheduler, syncSettings.debounceQuietPeriod());
    }

    @Override
    public void activate() {
        synchronized (stateLock) {
            if (active) {
                logger.debug("Sync loop already active.");
                return;
            }
            active = true;
            activation++;
            activatedAt = clock.instant();
            consecutiveErrors = 0;
            awaitingReauthentication.clear();
            logger.info("Sync loop activated.");
            scheduleNext(Duration.ZERO);
        }
    }

    @Override
    public void deactivate() {
        synchronized (stateLock) {
            stop("deactivated by caller");
        }
    }

    @Override
    public boolean isActive() {
        synchronized (stateLock) {
            return active;
        }
    }

    @Override
    public SyncState state() {
        synchronized (stateLock) {
            return new SyncState(lastSuccessfulSync, consecutiveErrors, active, activatedAt,
                    backoffPolicy.delayAfter(consecutiveErrors));
        }
    }

    public Duration nextSyncDelay() {
        synchronized (stateLock) {
            return backoffPolicy.delayAfter(consecutiveErrors);
        }
    }

    /**
     * Lets a source that failed with an authentication error take part in cycles again.
     */
    public void sourceReconnected(ReadingSource source) {
        synchronized (stateLock) {
            awaitingReauthentication.remove(source);
        }
    }

    public boolean isAwaitingReauthentication(ReadingSource source) {
        synchronized (stateLock) {
            return awaitingReauthentication.contains(source);
        }
    }

    @Override
    public void requestSync() {
        debouncer.submit(this::runSyncCycleSafely);
    }

    @Override
    public SyncReport runSyncCycle() {
        cycleLock.lock();
        try {
            return performCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs one cycle of the chain started by activation number {@code chain} and schedules its successor. A chain
     * whose activation has been superseded ends here.
     */
    void runScheduledCycle(long chain) {
        runSyncCycleSafely();
        synchronized (stateLock) {
            if (!active || chain != activation) {
                return;
            }
            Optional<String> cutoff = cutoffReason();
            if (cutoff.isPresent()) {
                stop(cutoff.get());
                return;
            }
            Duration delay = backoffPolicy.delayAfter(consecutiveErrors);
            logger.debug("Next sync in {}s.", delay.toSeconds());
            scheduleNext(delay);
        }
    }

    Optional<String> cutoffReason() {
        synchronized (stateLock) {
            if (consecutiveErrors >= syncSettings.maxConsecutiveErrors()) {
                return Optional.of(consecutiveErrors + " consecutive failed cycles");
            }
            if (activatedAt != null
                    && Duration.between(activatedAt, clock.instant()).compareTo(syncSettings.maxActiveDuration()) >= 0) {
                return Optional.of("maximum active duration reached");
            }
        }
        if (hostConditions.isThermallyConstrained()) {
            return Optional.of("host is constrained");
        }
        return Optional.empty();
    }

    private void runSyncCycleSafely() {
        try {
            runSyncCycle();
        } catch (RuntimeException e) {
            logger.error("Sync cycle failed unexpectedly.", e);
            synchronized (stateLock) {
                consecutiveErrors++;
            }
        }
    }

    private SyncReport performCycle() {
        SyncReport report = new SyncReport();
        Instant now = clock.instant();

        if (!hostConditions.isNetworkAvailable()) {
            report.skip("No network connectivity.");
            logger.info("Sync skipped: no network connectivity.");
            return report;
        }
        if (hostConditions.isThermallyConstrained()) {
            report.skip("Host is constrained.");
            logger.info("Sync skipped: host is constrained.");
            return report;
        }

        boolean officialReady;
        boolean shareReady;
        synchronized (stateLock) {
            if (lastSuccessfulSync != null
                    && Duration.between(lastSuccessfulSync, now).compareTo(syncSettings.baseInterval()) < 0) {
                report.skip("Last successful sync was " + Duration.between(lastSuccessfulSync, now).toSeconds()
                        + "s ago.");
                return report;
            }
            officialReady = !awaitingReauthentication.contains(ReadingSource.OFFICIAL);
            shareReady = !awaitingReauthentication.contains(ReadingSource.SHARE);
        }
        officialReady = officialReady && dexcomClient.isAvailable();
        shareReady = shareReady && shareClient.isAvailable();

        if (!officialReady && !shareReady) {
            report.skip("No glucose source connected.");
            logger.info("Sync skipped: no glucose source connected.");
            return report;
        }

        if (officialReady) {
            report.setOfficialAttempted(true);
            syncOfficial(now, report);
        }
        if (shareReady) {
            report.setShareAttempted(true);
            syncShare(now, report);
        }

        if (report.isAnySucceeded()) {
            synchronized (stateLock) {
                lastSuccessfulSync = now;
                consecutiveErrors = 0;
            }
            logger.info("Sync cycle saved {} official and {} share readings.",
                    report.getOfficialSaved(), report.getShareSaved());
            eventPublisher.publishEvent(new GlucoseDataUpdatedEvent(now, report.getOfficialSaved(), report.getShareSaved()));
        } else {
            int errors;
            synchronized (stateLock) {
                errors = ++consecutiveErrors;
            }
            logger.warn("Sync cycle failed ({} consecutive).", errors);
        }
        return report;
    }

    private void syncOfficial(Instant now, SyncReport report) {
        Instant end = now.minus(officialDelay);
        Instant start = end.minus(syncSettings.officialLookback());
        try {
            List<GlucoseReading> readings = dexcomClient.fetchReadings(start, end);
            int saved = repository.saveReadings(readings);
            report.addOfficialSaved(saved);
            report.setOfficialSucceeded(true);
            report.info("Dexcom API: fetched " + readings.size() + ", saved " + saved + ".");
        } catch (GlucoseApiException e) {
            handleFailure(ReadingSource.OFFICIAL, "Dexcom API", e, report);
        } catch (IOException e) {
            logger.warn("Dexcom API sync failed: {}", e.getMessage());
            report.error("Dexcom API: " + e.getMessage());
        }
    }

    private void syncShare(Instant now, SyncReport report) {
        Instant start = now.minus(syncSettings.shareLookback());
        try {
            List<GlucoseReading> readings = shareClient.fetchReadings(start, now);
            int saved = repository.saveReadings(readings);
            report.addShareSaved(saved);
            report.setShareSucceeded(true);
            report.info("Dexcom Share: fetched " + readings.size() + ", saved " + saved + ".");
        } catch (GlucoseApiException e) {
            handleFailure(ReadingSource.SHARE, "Dexcom Share", e, report);
        } catch (IOException e) {
            logger.warn("Dexcom Share sync failed: {}", e.getMessage());
            report.error("Dexcom Share: " + e.getMessage());
        }
    }

    private void handleFailure(ReadingSource source, String label, GlucoseApiException e, SyncReport report) {
        if (e.isNoData()) {
            report.info(label + ": no new data.");
            if (source == ReadingSource.OFFICIAL) {
                report.setOfficialSucceeded(true);
            } else {
                report.setShareSucceeded(true);
            }
            return;
        }
        if (e.requiresReauthentication()) {
            synchronized (stateLock) {
                awaitingReauthentication.add(source);
            }
            logger.warn("{} needs to be reconnected: {}", label, e.getMessage());
            report.error(label + ": " + e.userMessage());
            return;
        }
        logger.warn("{} sync failed ({}): {}", label, e.getKind(), e.getMessage());
        report.error(label + ": " + e.userMessage());
    }

    private void scheduleNext(Duration delay) {
        long chain = activation;
        nextCycle = scheduler.schedule(() -> runScheduledCycle(chain), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void stop(String reason) {
        if (!active) {
            return;
        }
        active = false;
        activatedAt = null;
        if (nextCycle != null) {
            nextCycle.cancel(false);
            nextCycle = null;
        }
        debouncer.cancel();
        logger.info("Sync loop stopped: {}.", reason);
    }
}

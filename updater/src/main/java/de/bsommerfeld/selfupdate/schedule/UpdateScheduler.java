package de.bsommerfeld.selfupdate.schedule;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.config.UpdaterConfig;
import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import de.bsommerfeld.selfupdate.event.UpdateEvents.UpdateAvailableEvent;
import de.bsommerfeld.selfupdate.manifest.ManifestFetcher;
import de.bsommerfeld.selfupdate.manifest.UpdateInfo;
import de.bsommerfeld.selfupdate.transfer.ScratchStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs update checks immediately and then on a fixed period.
 *
 * <p>
 * Fire-and-forget: {@link #scheduleChecks} returns at once and results
 * surface as {@link UpdateAvailableEvent}s on the event bus. All ticks run on
 * one daemon thread, so two scheduled checks never overlap; a tick that
 * overruns the period only delays the next one. A failing tick is logged
 * and leaves the schedule armed. A closed scheduler cannot be armed again.
 */
@Singleton
public class UpdateScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateScheduler.class);

    private final ManifestFetcher fetcher;
    private final ApplicationEventBus eventBus;
    private final ScratchStorage storage;
    private final Duration staleAfter;
    private final ScheduledExecutorService executor;
    private volatile boolean armed;
    private boolean closed;

    @Inject
    public UpdateScheduler(ManifestFetcher fetcher, ApplicationEventBus eventBus,
            ScratchStorage storage, UpdaterConfig config) {
        this(fetcher, eventBus, storage, config.getStorage().staleAfter(),
                Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("update-check-%d")
                        .setDaemon(true)
                        .build()));
    }

    UpdateScheduler(ManifestFetcher fetcher, ApplicationEventBus eventBus, ScratchStorage storage,
            Duration staleAfter, ScheduledExecutorService executor) {
        this.fetcher = fetcher;
        this.eventBus = eventBus;
        this.storage = storage;
        this.staleAfter = staleAfter;
        this.executor = executor;
    }

    /**
     * Arms the schedule: one check right away, then one every
     * {@code intervalMinutes}. Ignored if already armed.
     *
     * @throws IllegalArgumentException if the interval is not positive
     * @throws IllegalStateException if the scheduler has been closed
     */
    public void scheduleChecks(long intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got: " + intervalMinutes);
        }
        scheduleChecks(Duration.ofMinutes(intervalMinutes));
    }

    synchronized void scheduleChecks(Duration interval) {
        if (closed) {
            throw new IllegalStateException("Update scheduler is closed");
        }
        if (armed) {
            LOG.warn("Update checks already scheduled, ignoring new interval {}", interval);
            return;
        }
        armed = true;

        LOG.info("Scheduling update checks every {} minutes", interval.toMinutes());
        executor.execute(() -> storage.purgeStale(staleAfter));
        executor.scheduleAtFixedRate(this::runCheck, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isArmed() {
        return armed;
    }

    /**
     * One tick. Never throws: an escaping exception would silently cancel
     * all future executions of the periodic task.
     */
    void runCheck() {
        try {
            Optional<UpdateInfo> update = fetcher.checkForUpdates();
            update.ifPresent(info -> eventBus.post(new UpdateAvailableEvent(info)));
        } catch (RuntimeException e) {
            LOG.error("Scheduled update check failed", e);
        }
    }

    /** Disarms the schedule. Checks already running are not interrupted. */
    @Override
    public synchronized void close() {
        closed = true;
        armed = false;
        executor.shutdown();
    }
}

package de.bsommerfeld.selfupdate.api;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.config.ScheduleConfig;
import de.bsommerfeld.selfupdate.core.config.UpdaterConfig;
import de.bsommerfeld.selfupdate.install.InstallerException;
import de.bsommerfeld.selfupdate.install.InstallerInvoker;
import de.bsommerfeld.selfupdate.manifest.ManifestFetcher;
import de.bsommerfeld.selfupdate.manifest.UpdateInfo;
import de.bsommerfeld.selfupdate.schedule.UpdateScheduler;
import de.bsommerfeld.selfupdate.transfer.ArtifactTransferEngine;
import de.bsommerfeld.selfupdate.transfer.TransferException;
import de.bsommerfeld.selfupdate.transfer.TransferProgressCallback;
import de.bsommerfeld.selfupdate.version.VersionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;

/**
 * Entry point of the update pipeline for the rest of the application.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 * checkForUpdates()      → manifest fetch → version comparison
 * downloadAndInstall()   → platform gate → transfer into scratch storage → installer hand-off
 * scheduleUpdateChecks() → checkForUpdates() now and every interval, results on the event bus
 * </pre>
 *
 * <h3>Failure reporting</h3>
 * Checks never throw; a failed check looks like "no update". Downloads and
 * installs throw {@link TransferException} or {@link InstallerException}
 * with a message suitable for display. No failure leaves the pipeline
 * unusable for the next attempt.
 */
@Singleton
public class SelfUpdateService {

    private static final Logger LOG = LoggerFactory.getLogger(SelfUpdateService.class);

    private final ManifestFetcher fetcher;
    private final ArtifactTransferEngine transferEngine;
    private final InstallerInvoker installer;
    private final UpdateScheduler scheduler;
    private final VersionDescriptor currentVersion;
    private final ScheduleConfig scheduleConfig;

    @Inject
    public SelfUpdateService(ManifestFetcher fetcher, ArtifactTransferEngine transferEngine,
            InstallerInvoker installer, UpdateScheduler scheduler,
            VersionDescriptor currentVersion, UpdaterConfig config) {
        this.fetcher = fetcher;
        this.transferEngine = transferEngine;
        this.installer = installer;
        this.scheduler = scheduler;
        this.currentVersion = currentVersion;
        this.scheduleConfig = config.getSchedule();
    }

    /**
     * @return the newer release, or empty if there is none, the host cannot
     *         install updates, or the check failed
     */
    public Optional<UpdateInfo> checkForUpdates() {
        return fetcher.checkForUpdates();
    }

    /**
     * Downloads the artifact and starts the platform installer.
     *
     * @param onProgress receives percent progress, may be {@code null}
     */
    public void downloadAndInstall(String downloadUrl, TransferProgressCallback onProgress)
            throws TransferException, InstallerException {
        try {
            URI artifact = transferEngine.download(downloadUrl, onProgress);
            installer.install(artifact);
        } catch (TransferException | InstallerException e) {
            LOG.error("Error in downloadAndInstall for {}: {}", downloadUrl, e.getMessage());
            throw e;
        }
    }

    public void downloadAndInstall(String downloadUrl) throws TransferException, InstallerException {
        downloadAndInstall(downloadUrl, null);
    }

    public VersionDescriptor getCurrentVersion() {
        return currentVersion;
    }

    /**
     * Arms periodic checks. Found updates are published as
     * {@link de.bsommerfeld.selfupdate.event.UpdateEvents.UpdateAvailableEvent}.
     */
    public void scheduleUpdateChecks(long intervalMinutes) {
        scheduler.scheduleChecks(intervalMinutes);
    }

    /**
     * Arms periodic checks with the configured interval, unless scheduled
     * checks are disabled in the configuration.
     */
    public void scheduleUpdateChecks() {
        if (!scheduleConfig.isEnabled()) {
            LOG.info("Scheduled update checks disabled by configuration");
            return;
        }
        scheduleUpdateChecks(scheduleConfig.getIntervalMinutes());
    }
}

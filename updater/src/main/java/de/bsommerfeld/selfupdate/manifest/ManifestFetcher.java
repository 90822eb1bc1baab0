package de.bsommerfeld.selfupdate.manifest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.config.UpdaterConfig;
import de.bsommerfeld.selfupdate.http.Downloader;
import de.bsommerfeld.selfupdate.platform.HostPlatform;
import de.bsommerfeld.selfupdate.version.UpdateEvaluator;
import de.bsommerfeld.selfupdate.version.VersionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Retrieves the release manifest and decides whether it describes an update.
 *
 * <p>
 * Fails softly: a host without installer support, an unreachable endpoint,
 * a non-2xx answer or an unparsable body all end up as an empty result. The
 * cause is logged here and never thrown past this class, so a broken
 * manifest can't take down the screen that triggered the check.
 */
@Singleton
public class ManifestFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestFetcher.class);

    private final HostPlatform platform;
    private final Downloader downloader;
    private final VersionDescriptor currentVersion;
    private final URI manifestUrl;

    @Inject
    public ManifestFetcher(HostPlatform platform, Downloader downloader,
            VersionDescriptor currentVersion, UpdaterConfig config) {
        this(platform, downloader, currentVersion, URI.create(config.getManifest().getUrl()));
    }

    public ManifestFetcher(HostPlatform platform, Downloader downloader,
            VersionDescriptor currentVersion, URI manifestUrl) {
        this.platform = platform;
        this.downloader = downloader;
        this.currentVersion = currentVersion;
        this.manifestUrl = manifestUrl;
    }

    /**
     * @return the manifest if it announces a release newer than the running
     *         build, empty if there is none or the check failed
     */
    public Optional<UpdateInfo> checkForUpdates() {
        if (!platform.canInstallUpdates()) {
            LOG.info("Update check skipped: {} cannot install updates", platform.name());
            return Optional.empty();
        }

        UpdateInfo manifest;
        try {
            manifest = ManifestParser.parse(downloader.toString(manifestUrl));
        } catch (IOException | ManifestParseException e) {
            LOG.error("Error checking for updates at {}", manifestUrl, e);
            return Optional.empty();
        }

        Optional<UpdateInfo> update = UpdateEvaluator.evaluate(manifest, currentVersion);
        if (update.isPresent()) {
            LOG.info("Update available: {} (code {}) over {} (code {}){}",
                    manifest.version(), manifest.versionCode(),
                    currentVersion.name(), currentVersion.code(),
                    manifest.mandatory() ? " [mandatory]" : "");
        } else {
            LOG.debug("No update: manifest code {} vs. current {}", manifest.versionCode(), currentVersion.code());
        }
        return update;
    }

    public URI manifestUrl() {
        return manifestUrl;
    }
}

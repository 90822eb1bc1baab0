package de.bsommerfeld.selfupdate.inject;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.config.ConfigurationLoader;
import de.bsommerfeld.selfupdate.core.config.UpdaterConfig;
import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import de.bsommerfeld.selfupdate.core.util.StorageUtils;
import de.bsommerfeld.selfupdate.http.Downloader;
import de.bsommerfeld.selfupdate.install.InstallerBridges;
import de.bsommerfeld.selfupdate.install.InstallerInvoker;
import de.bsommerfeld.selfupdate.platform.HostPlatform;
import de.bsommerfeld.selfupdate.platform.OperatingSystem;
import de.bsommerfeld.selfupdate.platform.SystemHostPlatform;
import de.bsommerfeld.selfupdate.transfer.BufferedTransferStrategy;
import de.bsommerfeld.selfupdate.transfer.HttpStreamingTransport;
import de.bsommerfeld.selfupdate.transfer.ScratchStorage;
import de.bsommerfeld.selfupdate.transfer.StreamingTransferStrategy;
import de.bsommerfeld.selfupdate.transfer.StreamingTransport;
import de.bsommerfeld.selfupdate.transfer.TransferStrategy;
import de.bsommerfeld.selfupdate.version.VersionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Guice wiring for the update pipeline.
 *
 * <p>
 * Host capabilities are resolved once here: the transfer strategy and the
 * installer bridge are picked at injector creation and never re-checked
 * per call.
 */
public class UpdaterModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(UpdaterModule.class);

    private final Path configFile;
    private final Path cacheDir;

    public UpdaterModule(String appName) {
        this(StorageUtils.getAppDataDir(appName).resolve("updater.toml"),
                StorageUtils.getCacheDir(appName).resolve("updates"));
    }

    UpdaterModule(Path configFile, Path cacheDir) {
        this.configFile = configFile;
        this.cacheDir = cacheDir;
    }

    @Override
    protected void configure() {
        try {
            LOG.info("Loading updater configuration from: {}", configFile.toAbsolutePath());
            UpdaterConfig config = ConfigurationLoader.load(configFile);
            bind(UpdaterConfig.class).toInstance(config);

            VersionDescriptor current = VersionDescriptor.fromClasspath();
            LOG.info("Running build {} (code {})", current.name(), current.code());
            bind(VersionDescriptor.class).toInstance(current);

            bind(HostPlatform.class).toInstance(SystemHostPlatform.detect(config.getPlatform()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize updater", e);
        }

        bind(ScratchStorage.class).toInstance(new ScratchStorage(cacheDir));
        bind(StreamingTransport.class).to(HttpStreamingTransport.class);
    }

    @Provides
    @Singleton
    Downloader provideDownloader(UpdaterConfig config) {
        return new Downloader(config.getNetwork().connectTimeout(), config.getNetwork().requestTimeout());
    }

    @Provides
    @Singleton
    TransferStrategy provideTransferStrategy(HostPlatform platform, StreamingTransport transport,
            Downloader downloader, ScratchStorage storage, ApplicationEventBus eventBus) {
        if (platform.supportsStreamingDownload()) {
            LOG.info("Using streaming transfer on {}", platform.name());
            return new StreamingTransferStrategy(transport, storage, eventBus);
        }
        LOG.info("Using buffered transfer on {}", platform.name());
        return new BufferedTransferStrategy(downloader::toBytes, storage);
    }

    @Provides
    @Singleton
    InstallerInvoker provideInstallerInvoker(HostPlatform platform) {
        return new InstallerInvoker(InstallerBridges.forPlatform(platform, OperatingSystem.current()));
    }
}

package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the updater configuration, persisted as {@code updater.toml} in the
 * application data directory. Every section is initialized with defaults so a
 * missing or partial file still yields a usable configuration.
 *
 * @see ConfigurationLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdaterConfig {

    @JsonProperty("manifest")
    private ManifestConfig manifest = new ManifestConfig();

    @JsonProperty("network")
    private NetworkConfig network = new NetworkConfig();

    @JsonProperty("platform")
    private PlatformConfig platform = new PlatformConfig();

    @JsonProperty("schedule")
    private ScheduleConfig schedule = new ScheduleConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public ManifestConfig getManifest() {
        return manifest;
    }

    public NetworkConfig getNetwork() {
        return network;
    }

    public PlatformConfig getPlatform() {
        return platform;
    }

    public ScheduleConfig getSchedule() {
        return schedule;
    }

    public StorageConfig getStorage() {
        return storage;
    }
}

package de.bsommerfeld.selfupdate.platform;

import de.bsommerfeld.selfupdate.core.config.PlatformConfig;

import java.util.Locale;

/**
 * {@link HostPlatform} backed by OS detection plus the {@code [platform]}
 * configuration section, which may force installability on or off.
 */
public final class SystemHostPlatform implements HostPlatform {

    private final OperatingSystem os;
    private final boolean installable;
    private final boolean streaming;

    public SystemHostPlatform(OperatingSystem os, PlatformConfig config) {
        this.os = os;
        this.streaming = config.isStreamingDownload();
        this.installable = switch (config.getInstallable()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> os != OperatingSystem.OTHER;
        };
    }

    public static SystemHostPlatform detect(PlatformConfig config) {
        return new SystemHostPlatform(OperatingSystem.current(), config);
    }

    public OperatingSystem operatingSystem() {
        return os;
    }

    @Override
    public String name() {
        return os.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean canInstallUpdates() {
        return installable;
    }

    @Override
    public boolean supportsStreamingDownload() {
        return streaming;
    }

    @Override
    public String toString() {
        return "SystemHostPlatform[" + name() + ", installable=" + installable + ", streaming=" + streaming + "]";
    }
}

package de.bsommerfeld.selfupdate.install;

import de.bsommerfeld.selfupdate.platform.HostPlatform;
import de.bsommerfeld.selfupdate.platform.OperatingSystem;

import java.util.Optional;

/**
 * Resolves the installer bridge for the host once at startup.
 */
public final class InstallerBridges {

    private InstallerBridges() {
    }

    /**
     * @return the bridge for {@code os}, or empty if the host has no installer
     *         concept or cannot install updates
     */
    public static Optional<InstallerBridge> forPlatform(HostPlatform platform, OperatingSystem os) {
        if (!platform.canInstallUpdates() || os == OperatingSystem.OTHER) {
            return Optional.empty();
        }
        return Optional.of(new ProcessInstallerBridge(os));
    }
}

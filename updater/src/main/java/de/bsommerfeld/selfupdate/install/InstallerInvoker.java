package de.bsommerfeld.selfupdate.install;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;

/**
 * Passes a downloaded artifact to the installer bridge resolved at startup.
 *
 * <p>
 * Without a bridge the call is a successful no-op. Bridge failures are
 * logged and rethrown as the same instance; there is no automatic retry
 * because a half-started install must not be triggered twice.
 */
public class InstallerInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(InstallerInvoker.class);

    private final Optional<InstallerBridge> bridge;

    public InstallerInvoker(Optional<InstallerBridge> bridge) {
        this.bridge = bridge;
    }

    public void install(URI artifact) throws InstallerException {
        if (bridge.isEmpty()) {
            LOG.info("No installer available on this platform, leaving {} in place", artifact);
            return;
        }

        try {
            bridge.get().install(artifact);
        } catch (InstallerException e) {
            LOG.error("Failed to install {}", artifact, e);
            throw e;
        }
    }

    public boolean hasInstaller() {
        return bridge.isPresent();
    }
}

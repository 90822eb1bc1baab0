package de.bsommerfeld.selfupdate.install;

import java.net.URI;

/**
 * Hands a downloaded artifact to the platform's package installer.
 */
@FunctionalInterface
public interface InstallerBridge {

    /**
     * Starts the OS install flow for the artifact. Returns once the flow is
     * launched; the installation itself continues outside this process.
     *
     * @param artifact location of the downloaded artifact
     */
    void install(URI artifact) throws InstallerException;
}

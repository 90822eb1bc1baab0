package de.bsommerfeld.selfupdate.install;

import de.bsommerfeld.selfupdate.api.UpdateException;

/**
 * Thrown by an {@link InstallerBridge} when the OS install flow could not be
 * started. Propagated to the caller unchanged.
 */
public class InstallerException extends UpdateException {

    public InstallerException(String message) {
        super(message);
    }

    public InstallerException(String message, Throwable cause) {
        super(message, cause);
    }
}

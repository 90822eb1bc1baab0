package de.bsommerfeld.selfupdate.transfer;

import java.net.URI;

/**
 * One way of moving an artifact from a URL into {@link ScratchStorage}.
 * Exactly one implementation is active per process, chosen from the host's
 * capabilities at startup.
 */
public interface TransferStrategy {

    /**
     * @param url          absolute artifact URL
     * @param artifactName fresh scratch file name for this attempt
     * @param callback     receives percent progress, may be {@code null}
     * @return location of the written artifact
     * @throws TransferException on any terminal failure
     */
    URI transfer(URI url, String artifactName, TransferProgressCallback callback) throws TransferException;
}

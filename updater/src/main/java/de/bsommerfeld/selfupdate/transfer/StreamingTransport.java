package de.bsommerfeld.selfupdate.transfer;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Transport that writes a download straight to storage. Progress is not
 * returned to the caller but published as
 * {@link de.bsommerfeld.selfupdate.event.UpdateEvents.TransferProgressEvent}s,
 * keyed by the target's file name.
 */
public interface StreamingTransport {

    /**
     * Downloads {@code url} into {@code target}. Completion of this call says
     * nothing about where the artifact can be read from; resolve that through
     * {@link ScratchStorage#getUri(String)}.
     */
    void downloadFile(URI url, Path target) throws IOException;
}

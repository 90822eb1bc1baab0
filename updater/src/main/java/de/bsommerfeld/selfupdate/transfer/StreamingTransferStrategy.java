package de.bsommerfeld.selfupdate.transfer;

import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Primary strategy: the transport streams the artifact directly into
 * scratch storage while progress arrives through the event bus.
 *
 * <p>
 * The progress subscription is scoped to a single call. It is opened only
 * when a callback is supplied and released by try-with-resources on every
 * exit path, so repeated update checks never accumulate listeners.
 */
public class StreamingTransferStrategy implements TransferStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingTransferStrategy.class);

    private final StreamingTransport transport;
    private final ScratchStorage storage;
    private final ApplicationEventBus eventBus;

    public StreamingTransferStrategy(StreamingTransport transport, ScratchStorage storage,
            ApplicationEventBus eventBus) {
        this.transport = transport;
        this.storage = storage;
        this.eventBus = eventBus;
    }

    @Override
    public URI transfer(URI url, String artifactName, TransferProgressCallback callback) throws TransferException {
        try (ProgressSubscription ignored = callback != null
                ? ProgressSubscription.open(eventBus, artifactName, callback)
                : null) {
            transport.downloadFile(url, storage.pathOf(artifactName));
        } catch (IOException e) {
            throw TransferException.fromTransport(e);
        }

        try {
            URI location = storage.getUri(artifactName);
            LOG.debug("Streamed artifact to {}", location);
            return location;
        } catch (IOException e) {
            throw TransferException.storage(artifactName, e);
        }
    }
}

package de.bsommerfeld.selfupdate.transfer;

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Fallback strategy for hosts without streaming downloads.
 *
 * <p>
 * The artifact is fetched into memory, Base64-encoded and handed to
 * {@link ScratchStorage#writeEncoded}, the only write path that accepts a
 * complete payload. Raw {@code (loaded, total)} updates are translated into
 * the same percent contract the streaming strategy offers.
 *
 * <p>
 * The whole artifact lives in memory and encoding needs roughly 4/3 of the
 * payload size on top of that. Running out of memory while buffering or
 * encoding is reported as a conversion failure, not as a generic error.
 *
 * <p>
 * A callback that throws is logged and ignored; the transfer carries on.
 */
public class BufferedTransferStrategy implements TransferStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(BufferedTransferStrategy.class);

    /** Turns the raw payload into the text form accepted by scratch storage. */
    @FunctionalInterface
    interface PayloadEncoder {
        String encode(byte[] payload);
    }

    private final BufferedTransport transport;
    private final ScratchStorage storage;
    private final PayloadEncoder encoder;

    public BufferedTransferStrategy(BufferedTransport transport, ScratchStorage storage) {
        this(transport, storage, payload -> BaseEncoding.base64().encode(payload));
    }

    BufferedTransferStrategy(BufferedTransport transport, ScratchStorage storage, PayloadEncoder encoder) {
        this.transport = transport;
        this.storage = storage;
        this.encoder = encoder;
    }

    @Override
    public URI transfer(URI url, String artifactName, TransferProgressCallback callback) throws TransferException {
        byte[] payload;
        try {
            payload = transport.fetch(url, (loaded, total) -> {
                if (callback != null && total > 0) {
                    notifyProgress(callback, new TransferProgress(loaded, total), artifactName);
                }
            });
        } catch (IOException e) {
            throw TransferException.fromTransport(e);
        } catch (OutOfMemoryError e) {
            throw TransferException.conversion(e);
        }

        LOG.debug("Download finished ({} bytes), converting to Base64", payload.length);
        String encoded;
        try {
            encoded = encoder.encode(payload);
        } catch (OutOfMemoryError | IllegalArgumentException e) {
            throw TransferException.conversion(e);
        }

        LOG.debug("Writing {} to scratch storage", artifactName);
        try {
            return storage.writeEncoded(artifactName, encoded);
        } catch (IOException e) {
            throw TransferException.storage(artifactName, e);
        }
    }

    private static void notifyProgress(TransferProgressCallback callback, TransferProgress progress,
            String artifactName) {
        try {
            callback.onProgress(progress.percent());
        } catch (RuntimeException e) {
            LOG.warn("Progress callback for {} failed", artifactName, e);
        }
    }
}

package de.bsommerfeld.selfupdate.transfer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.platform.HostPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;

/**
 * Downloads release artifacts into scratch storage.
 *
 * <p>
 * The engine owns the parts every attempt shares, whatever the strategy:
 * the platform gate, URL validation and the per-attempt file name. The
 * transfer itself is delegated to the {@link TransferStrategy} selected at
 * startup.
 */
@Singleton
public class ArtifactTransferEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactTransferEngine.class);

    static final String DEFAULT_EXTENSION = ".bin";

    private final HostPlatform platform;
    private final TransferStrategy strategy;
    private final ScratchStorage storage;

    @Inject
    public ArtifactTransferEngine(HostPlatform platform, TransferStrategy strategy, ScratchStorage storage) {
        this.platform = platform;
        this.strategy = strategy;
        this.storage = storage;
    }

    /**
     * Downloads the artifact at {@code url}.
     *
     * @param onProgress receives percent progress, may be {@code null}
     * @return location of the downloaded artifact
     * @throws TransferException if the host cannot install updates, the URL is
     *                           invalid, or the transfer fails
     */
    public URI download(String url, TransferProgressCallback onProgress) throws TransferException {
        if (!platform.canInstallUpdates()) {
            throw TransferException.unsupportedPlatform(platform.name());
        }

        URI uri = parseUrl(url);
        String artifactName = storage.newArtifactName(extensionOf(uri));

        LOG.info("Starting download from {} into {}", uri, artifactName);
        URI location = strategy.transfer(uri, artifactName, onProgress);
        LOG.info("Download complete: {}", location);
        return location;
    }

    public TransferStrategy strategy() {
        return strategy;
    }

    private static URI parseUrl(String url) throws TransferException {
        if (url == null || url.isBlank()) {
            throw new TransferException(TransferException.Reason.INVALID_URL, "Missing download URL");
        }
        try {
            URI uri = URI.create(url);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new TransferException(TransferException.Reason.INVALID_URL,
                        "Invalid download URL: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new TransferException(TransferException.Reason.INVALID_URL, "Invalid download URL: " + url, e);
        }
    }

    /**
     * Keeps the artifact's extension so the OS installer recognises the file
     * type ({@code .msi}, {@code .pkg}, {@code .deb}, ...).
     */
    static String extensionOf(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return extension.matches("\\.[a-z0-9]{1,8}") ? extension : DEFAULT_EXTENSION;
    }
}

package de.bsommerfeld.selfupdate.transfer;

import de.bsommerfeld.selfupdate.api.UpdateException;
import de.bsommerfeld.selfupdate.http.HttpStatusException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Terminal failure of an artifact transfer. The message is meant to be shown
 * to the user as-is; {@link #reason()} lets callers branch without parsing it.
 */
public class TransferException extends UpdateException {

    public enum Reason {
        UNSUPPORTED_PLATFORM,
        INVALID_URL,
        HTTP_STATUS,
        NETWORK,
        TIMEOUT,
        CONVERSION,
        STORAGE
    }

    private final Reason reason;

    public TransferException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransferException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Classifies a transport failure by its exception type: non-2xx status,
     * timeout, or anything else on the network level.
     */
    static TransferException fromTransport(IOException e) {
        if (e instanceof HttpStatusException) {
            return httpStatus(((HttpStatusException) e).statusCode(), e);
        }
        if (e instanceof HttpTimeoutException) {
            return timeout(e);
        }
        return network(e);
    }

    static TransferException unsupportedPlatform(String platform) {
        return new TransferException(Reason.UNSUPPORTED_PLATFORM,
                "Updates are not available on this platform (" + platform + ").");
    }

    static TransferException httpStatus(int status, Throwable cause) {
        return new TransferException(Reason.HTTP_STATUS,
                "The download failed (status " + status + ").", cause);
    }

    static TransferException network(Throwable cause) {
        return new TransferException(Reason.NETWORK,
                "Network error during download. Check your connection.", cause);
    }

    static TransferException timeout(Throwable cause) {
        return new TransferException(Reason.TIMEOUT, "The download timed out.", cause);
    }

    static TransferException conversion(Throwable cause) {
        return new TransferException(Reason.CONVERSION,
                "Could not convert the downloaded file (insufficient memory?).", cause);
    }

    static TransferException storage(String artifactName, Throwable cause) {
        return new TransferException(Reason.STORAGE,
                "Could not write the update to local storage: " + artifactName, cause);
    }
}

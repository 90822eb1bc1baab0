package de.bsommerfeld.selfupdate.manifest;

/**
 * Thrown when a manifest body cannot be mapped onto {@link UpdateInfo}.
 */
public class ManifestParseException extends RuntimeException {

    public ManifestParseException(String message) {
        super(message);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
